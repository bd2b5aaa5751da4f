package in.warmguard.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Safety schema migration - creates the safety core's tables on startup.
 *
 * Tables:
 * - account_health: per-account health ledger
 * - account_login_attempts, account_post_outcomes, account_interactions, freeze_detections: score signals
 * - health_escalations: accounts needing human review
 * - engagement_tasks, engagement_logs, interaction_settings: engagement queue
 *
 * Existing tables are left untouched.
 */
public final class SafetySchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SafetySchemaMigration.class);

    private final DataSource dataSource;

    public SafetySchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration - creates missing tables and their indexes.
     */
    public void migrate() {
        log.info("[SCHEMA MIGRATION] Starting safety schema migration");

        try (Connection conn = dataSource.getConnection()) {
            int created = 0;
            for (Map.Entry<String, String> table : tables().entrySet()) {
                if (tableExists(conn, table.getKey())) {
                    log.debug("[SCHEMA MIGRATION] {} already exists", table.getKey());
                    continue;
                }
                log.info("[SCHEMA MIGRATION] Creating {} table...", table.getKey());
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute(table.getValue());
                }
                created++;
            }
            createIndexes(conn);
            log.info("[SCHEMA MIGRATION] Migration completed ({} table(s) created)", created);

        } catch (SQLException e) {
            log.error("[SCHEMA MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Safety schema migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private static Map<String, String> tables() {
        Map<String, String> tables = new LinkedHashMap<>();

        tables.put("account_health", """
            CREATE TABLE account_health (
                id BIGSERIAL PRIMARY KEY,
                account_id BIGINT NOT NULL UNIQUE,

                -- Scores (0-100)
                health_score INT NOT NULL DEFAULT 100 CHECK (health_score BETWEEN 0 AND 100),
                login_success_rate INT NOT NULL DEFAULT 100,
                post_success_rate INT NOT NULL DEFAULT 100,
                engagement_naturalness_score INT NOT NULL DEFAULT 100,
                freeze_risk_score INT NOT NULL DEFAULT 0,

                -- Warming protocol
                account_phase VARCHAR(20) NOT NULL DEFAULT 'warming',
                warming_started_at TIMESTAMPTZ,
                warming_completed_at TIMESTAMPTZ,
                max_daily_posts INT NOT NULL DEFAULT 1,
                max_daily_actions INT NOT NULL DEFAULT 10,

                -- Rate tracking
                posts_today INT NOT NULL DEFAULT 0,
                actions_today INT NOT NULL DEFAULT 0,
                posts_this_hour INT NOT NULL DEFAULT 0,
                actions_this_hour INT NOT NULL DEFAULT 0,
                last_action_at TIMESTAMPTZ,
                last_post_at TIMESTAMPTZ,

                -- Throttling
                is_throttled BOOLEAN NOT NULL DEFAULT FALSE,
                throttle_reason TEXT,
                throttle_until TIMESTAMPTZ,
                is_suspended BOOLEAN NOT NULL DEFAULT FALSE,
                suspended_reason TEXT,

                -- History
                total_freeze_count INT NOT NULL DEFAULT 0,
                last_freeze_at TIMESTAMPTZ,
                consecutive_successes INT NOT NULL DEFAULT 0,
                consecutive_failures INT NOT NULL DEFAULT 0,

                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        tables.put("account_login_attempts", """
            CREATE TABLE account_login_attempts (
                id BIGSERIAL PRIMARY KEY,
                account_id BIGINT NOT NULL,
                status VARCHAR(20) NOT NULL,
                attempted_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        tables.put("account_post_outcomes", """
            CREATE TABLE account_post_outcomes (
                id BIGSERIAL PRIMARY KEY,
                account_id BIGINT NOT NULL,
                status VARCHAR(20) NOT NULL,
                recorded_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        tables.put("account_interactions", """
            CREATE TABLE account_interactions (
                id BIGSERIAL PRIMARY KEY,
                account_id BIGINT NOT NULL,
                action_type VARCHAR(20) NOT NULL,
                executed_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        tables.put("freeze_detections", """
            CREATE TABLE freeze_detections (
                id BIGSERIAL PRIMARY KEY,
                account_id BIGINT NOT NULL,
                freeze_type VARCHAR(20) NOT NULL DEFAULT 'unknown',
                confidence INT NOT NULL DEFAULT 0 CHECK (confidence BETWEEN 0 AND 100),
                detected_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        tables.put("health_escalations", """
            CREATE TABLE health_escalations (
                id BIGSERIAL PRIMARY KEY,
                account_id BIGINT NOT NULL,
                health_score INT NOT NULL,
                reason TEXT NOT NULL,
                breakdown JSONB NOT NULL,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        tables.put("engagement_tasks", """
            CREATE TABLE engagement_tasks (
                id BIGSERIAL PRIMARY KEY,
                project_id BIGINT NOT NULL,
                account_id BIGINT NOT NULL,
                task_type VARCHAR(20) NOT NULL,
                target_user VARCHAR(255),
                target_post VARCHAR(500),
                comment_text TEXT,
                last_executed_at TIMESTAMPTZ,
                status VARCHAR(20) NOT NULL DEFAULT 'pending',
                claimed_at TIMESTAMPTZ,
                expires_at TIMESTAMPTZ,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        tables.put("engagement_logs", """
            CREATE TABLE engagement_logs (
                id BIGSERIAL PRIMARY KEY,
                account_id BIGINT NOT NULL,
                task_id BIGINT,
                task_type VARCHAR(20) NOT NULL,
                status VARCHAR(20) NOT NULL,
                target_user VARCHAR(255),
                target_post VARCHAR(500),
                error_message TEXT,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        tables.put("interaction_settings", """
            CREATE TABLE interaction_settings (
                project_id BIGINT PRIMARY KEY,
                is_enabled BOOLEAN NOT NULL DEFAULT FALSE,
                like_enabled BOOLEAN NOT NULL DEFAULT TRUE,
                comment_enabled BOOLEAN NOT NULL DEFAULT FALSE,
                follow_enabled BOOLEAN NOT NULL DEFAULT TRUE,
                like_delay_min_minutes INT,
                comment_delay_min_minutes INT,
                follow_delay_min_minutes INT,
                unfollow_delay_min_minutes INT
            )
            """);

        return tables;
    }

    private void createIndexes(Connection conn) throws SQLException {
        String[] indexes = {
            "CREATE INDEX IF NOT EXISTS idx_login_attempts_account ON account_login_attempts (account_id, attempted_at)",
            "CREATE INDEX IF NOT EXISTS idx_post_outcomes_account ON account_post_outcomes (account_id, recorded_at)",
            "CREATE INDEX IF NOT EXISTS idx_interactions_account ON account_interactions (account_id, executed_at)",
            "CREATE INDEX IF NOT EXISTS idx_freeze_detections_account ON freeze_detections (account_id, detected_at)",
            "CREATE INDEX IF NOT EXISTS idx_escalations_account ON health_escalations (account_id, created_at)",
            "CREATE INDEX IF NOT EXISTS idx_engagement_tasks_queue ON engagement_tasks (project_id, account_id, status, created_at DESC)",
            "CREATE INDEX IF NOT EXISTS idx_engagement_tasks_claimed ON engagement_tasks (status, claimed_at)",
            "CREATE INDEX IF NOT EXISTS idx_engagement_logs_account ON engagement_logs (account_id, created_at)"
        };
        try (Statement stmt = conn.createStatement()) {
            for (String sql : indexes) {
                stmt.execute(sql);
            }
        }
    }
}
