package in.warmguard.repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * Null-safe conversions between JDBC column values and domain types.
 */
final class JdbcValues {

    static Timestamp ts(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private JdbcValues() {}
}
