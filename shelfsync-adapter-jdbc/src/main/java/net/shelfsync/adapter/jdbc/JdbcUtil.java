package net.shelfsync.adapter.jdbc;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;

public final class JdbcUtil {
    private JdbcUtil() {}

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    /**
     * NUMTODSINTERVAL(?, 'SECOND') 인자 바인딩. 밀리초 정밀도.
     * null이면 NULL 바인딩 → CURRENT_TIMESTAMP + NULL = NULL(만료 없음)
     */
    public static void setSeconds(PreparedStatement ps, int idx, Duration d) throws SQLException {
        if (d == null) ps.setNull(idx, Types.NUMERIC);
        else ps.setBigDecimal(idx, BigDecimal.valueOf(d.toMillis(), 3));
    }

    /** ORA-00001 (unique constraint) */
    public static boolean isUniqueViolation(SQLException e) {
        return e instanceof SQLIntegrityConstraintViolationException || e.getErrorCode() == 1;
    }
}
