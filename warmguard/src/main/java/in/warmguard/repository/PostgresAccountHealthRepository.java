package in.warmguard.repository;

import in.warmguard.application.port.output.AccountHealthRepository;
import in.warmguard.domain.health.AccountHealth;
import in.warmguard.domain.health.AccountPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static in.warmguard.repository.JdbcValues.instant;
import static in.warmguard.repository.JdbcValues.ts;

/**
 * PostgreSQL implementation of AccountHealthRepository.
 */
public class PostgresAccountHealthRepository implements AccountHealthRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresAccountHealthRepository.class);

    private static final String COLUMNS = """
        id, account_id, health_score, login_success_rate, post_success_rate,
        engagement_naturalness_score, freeze_risk_score, account_phase,
        warming_started_at, warming_completed_at, max_daily_posts, max_daily_actions,
        posts_today, actions_today, posts_this_hour, actions_this_hour, last_action_at, last_post_at,
        is_throttled, throttle_reason, throttle_until, is_suspended, suspended_reason,
        total_freeze_count, last_freeze_at, consecutive_successes, consecutive_failures,
        created_at, updated_at
        """;

    private final DataSource dataSource;

    public PostgresAccountHealthRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<AccountHealth> findByAccountId(long accountId) {
        String sql = "SELECT " + COLUMNS + " FROM account_health WHERE account_id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, accountId);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Error finding account_health for account_id={}: {}", accountId, e.getMessage());
        }

        return Optional.empty();
    }

    @Override
    public List<AccountHealth> findAllOrderByHealthScore() {
        String sql = "SELECT " + COLUMNS + " FROM account_health ORDER BY health_score ASC, account_id ASC";

        List<AccountHealth> records = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                records.add(mapResultSet(rs));
            }
        } catch (SQLException e) {
            log.error("Error listing account_health: {}", e.getMessage());
        }

        return records;
    }

    @Override
    public List<Long> findAllAccountIds() {
        String sql = "SELECT account_id FROM account_health ORDER BY account_id";

        List<Long> ids = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                ids.add(rs.getLong("account_id"));
            }
        } catch (SQLException e) {
            log.error("Error listing account ids: {}", e.getMessage());
        }

        return ids;
    }

    @Override
    public AccountHealth insert(AccountHealth h) {
        String sql = """
            INSERT INTO account_health (
                account_id, health_score, login_success_rate, post_success_rate,
                engagement_naturalness_score, freeze_risk_score, account_phase,
                warming_started_at, warming_completed_at, max_daily_posts, max_daily_actions,
                posts_today, actions_today, posts_this_hour, actions_this_hour, last_action_at, last_post_at,
                is_throttled, throttle_reason, throttle_until, is_suspended, suspended_reason,
                total_freeze_count, last_freeze_at, consecutive_successes, consecutive_failures,
                created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            RETURNING id
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            int i = bindRecord(stmt, h);
            stmt.setTimestamp(i++, ts(h.createdAt()));
            stmt.setTimestamp(i, ts(h.updatedAt()));

            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                long id = rs.getLong(1);
                log.info("Inserted account_health id={} for account_id={}", id, h.accountId());
                return h.withId(id);
            }
        } catch (SQLException e) {
            log.error("Error inserting account_health for account_id={}: {}", h.accountId(), e.getMessage());
            throw new RepositoryException("Failed to insert account_health", e);
        }
    }

    @Override
    public void update(AccountHealth h) {
        String sql = """
            UPDATE account_health SET
                account_id = ?, health_score = ?, login_success_rate = ?, post_success_rate = ?,
                engagement_naturalness_score = ?, freeze_risk_score = ?, account_phase = ?,
                warming_started_at = ?, warming_completed_at = ?, max_daily_posts = ?, max_daily_actions = ?,
                posts_today = ?, actions_today = ?, posts_this_hour = ?, actions_this_hour = ?,
                last_action_at = ?, last_post_at = ?,
                is_throttled = ?, throttle_reason = ?, throttle_until = ?, is_suspended = ?, suspended_reason = ?,
                total_freeze_count = ?, last_freeze_at = ?, consecutive_successes = ?, consecutive_failures = ?,
                updated_at = ?
            WHERE account_id = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            int i = bindRecord(stmt, h);
            stmt.setTimestamp(i++, ts(h.updatedAt()));
            stmt.setLong(i, h.accountId());

            int rows = stmt.executeUpdate();
            if (rows == 0) {
                log.warn("No account_health row updated for account_id={}", h.accountId());
            }
        } catch (SQLException e) {
            log.error("Error updating account_health for account_id={}: {}", h.accountId(), e.getMessage());
            throw new RepositoryException("Failed to update account_health", e);
        }
    }

    /**
     * Binds account_id through consecutive_failures; returns the next parameter index.
     */
    private int bindRecord(PreparedStatement stmt, AccountHealth h) throws SQLException {
        int i = 1;
        stmt.setLong(i++, h.accountId());
        stmt.setInt(i++, h.healthScore());
        stmt.setInt(i++, h.loginSuccessRate());
        stmt.setInt(i++, h.postSuccessRate());
        stmt.setInt(i++, h.engagementNaturalnessScore());
        stmt.setInt(i++, h.freezeRiskScore());
        stmt.setString(i++, h.accountPhase().dbValue());
        stmt.setTimestamp(i++, ts(h.warmingStartedAt()));
        stmt.setTimestamp(i++, ts(h.warmingCompletedAt()));
        stmt.setInt(i++, h.maxDailyPosts());
        stmt.setInt(i++, h.maxDailyActions());
        stmt.setInt(i++, h.postsToday());
        stmt.setInt(i++, h.actionsToday());
        stmt.setInt(i++, h.postsThisHour());
        stmt.setInt(i++, h.actionsThisHour());
        stmt.setTimestamp(i++, ts(h.lastActionAt()));
        stmt.setTimestamp(i++, ts(h.lastPostAt()));
        stmt.setBoolean(i++, h.isThrottled());
        stmt.setString(i++, h.throttleReason());
        stmt.setTimestamp(i++, ts(h.throttleUntil()));
        stmt.setBoolean(i++, h.isSuspended());
        stmt.setString(i++, h.suspendedReason());
        stmt.setInt(i++, h.totalFreezeCount());
        stmt.setTimestamp(i++, ts(h.lastFreezeAt()));
        stmt.setInt(i++, h.consecutiveSuccesses());
        stmt.setInt(i++, h.consecutiveFailures());
        return i;
    }

    private AccountHealth mapResultSet(ResultSet rs) throws SQLException {
        return AccountHealth.builder()
            .id(rs.getLong("id"))
            .accountId(rs.getLong("account_id"))
            .healthScore(rs.getInt("health_score"))
            .loginSuccessRate(rs.getInt("login_success_rate"))
            .postSuccessRate(rs.getInt("post_success_rate"))
            .engagementNaturalnessScore(rs.getInt("engagement_naturalness_score"))
            .freezeRiskScore(rs.getInt("freeze_risk_score"))
            .accountPhase(AccountPhase.fromDbValue(rs.getString("account_phase")))
            .warmingStartedAt(instant(rs, "warming_started_at"))
            .warmingCompletedAt(instant(rs, "warming_completed_at"))
            .maxDailyPosts(rs.getInt("max_daily_posts"))
            .maxDailyActions(rs.getInt("max_daily_actions"))
            .postsToday(rs.getInt("posts_today"))
            .actionsToday(rs.getInt("actions_today"))
            .postsThisHour(rs.getInt("posts_this_hour"))
            .actionsThisHour(rs.getInt("actions_this_hour"))
            .lastActionAt(instant(rs, "last_action_at"))
            .lastPostAt(instant(rs, "last_post_at"))
            .isThrottled(rs.getBoolean("is_throttled"))
            .throttleReason(rs.getString("throttle_reason"))
            .throttleUntil(instant(rs, "throttle_until"))
            .isSuspended(rs.getBoolean("is_suspended"))
            .suspendedReason(rs.getString("suspended_reason"))
            .totalFreezeCount(rs.getInt("total_freeze_count"))
            .lastFreezeAt(instant(rs, "last_freeze_at"))
            .consecutiveSuccesses(rs.getInt("consecutive_successes"))
            .consecutiveFailures(rs.getInt("consecutive_failures"))
            .createdAt(instant(rs, "created_at"))
            .updatedAt(instant(rs, "updated_at"))
            .build();
    }
}
