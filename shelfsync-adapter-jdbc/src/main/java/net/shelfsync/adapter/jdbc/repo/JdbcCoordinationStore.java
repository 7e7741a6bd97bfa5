package net.shelfsync.adapter.jdbc.repo;

import net.shelfsync.adapter.jdbc.JdbcUtil;
import net.shelfsync.adapter.jdbc.TxContext;
import net.shelfsync.core.spi.CoordinationStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;

/**
 * TB_COORD_LOCK 기반 리스 락 저장소.
 * 만료 판정은 DB 시각(CURRENT_TIMESTAMP) 기준이라 인스턴스 간 시계 차이에 영향받지 않는다.
 */
public final class JdbcCoordinationStore implements CoordinationStore {
    private static final int MAX_INSERT_RACES = 3;

    private Connection mustConn() {
        Connection c = TxContext.get();
        if (c == null) throw new IllegalStateException("TxContext required (wrap with JdbcTxRunner)");
        return c;
    }

    @Override
    public Optional<String> setIfAbsent(String key, String value, Duration ttl) throws Exception {
        for (int i = 0; ; i++) {
            try {
                if (mergeIfAbsentOrExpired(key, value, ttl) > 0) return Optional.empty();
            } catch (SQLException e) {
                // 동시에 같은 키를 INSERT → 진 쪽은 ORA-00001, 승자를 다시 읽는다
                if (!JdbcUtil.isUniqueViolation(e) || i >= MAX_INSERT_RACES) throw e;
                continue;
            }
            Optional<String> owner = get(key);
            if (owner.isPresent()) return owner;
            // MERGE와 SELECT 사이에 만료/삭제됨 → 재시도
            if (i >= MAX_INSERT_RACES) {
                throw new IllegalStateException("Lock " + key + " kept changing while acquiring");
            }
        }
    }

    /** @return 1 = 새로 생성(또는 만료 레코드 대체), 0 = 살아있는 레코드 존재 */
    private int mergeIfAbsentOrExpired(String key, String value, Duration ttl) throws SQLException {
        try (var ps = mustConn().prepareStatement("""
            MERGE INTO TB_COORD_LOCK l
            USING (
                SELECT ? AS lock_key,
                       ? AS owner,
                       CURRENT_TIMESTAMP + NUMTODSINTERVAL(?, 'SECOND') AS expires_at
                FROM dual
            ) s
            ON (l.LOCK_KEY = s.lock_key)
            WHEN MATCHED THEN UPDATE SET
                l.OWNER      = s.owner,
                l.EXPIRES_AT = s.expires_at,
                l.CREATED_AT = CURRENT_TIMESTAMP,
                l.UPDATED_AT = CURRENT_TIMESTAMP
                WHERE l.EXPIRES_AT IS NOT NULL AND l.EXPIRES_AT <= CURRENT_TIMESTAMP
            WHEN NOT MATCHED THEN INSERT (LOCK_KEY, OWNER, EXPIRES_AT, CREATED_AT, UPDATED_AT)
                VALUES (s.lock_key, s.owner, s.expires_at, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
        """)) {
            ps.setString(1, key);
            ps.setString(2, value);
            JdbcUtil.setSeconds(ps, 3, ttl);
            return ps.executeUpdate();
        }
    }

    @Override
    public boolean compareAndDelete(String key, String expected) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            DELETE FROM TB_COORD_LOCK
             WHERE LOCK_KEY = ?
               AND OWNER = ?
               AND (EXPIRES_AT IS NULL OR EXPIRES_AT > CURRENT_TIMESTAMP)
        """)) {
            ps.setString(1, key);
            ps.setString(2, expected);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean compareAndExpire(String key, String expected, Duration ttl) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_COORD_LOCK
               SET EXPIRES_AT = CURRENT_TIMESTAMP + NUMTODSINTERVAL(?, 'SECOND'),
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE LOCK_KEY = ?
               AND OWNER = ?
               AND (EXPIRES_AT IS NULL OR EXPIRES_AT > CURRENT_TIMESTAMP)
        """)) {
            JdbcUtil.setSeconds(ps, 1, ttl);
            ps.setString(2, key);
            ps.setString(3, expected);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public Optional<String> get(String key) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT OWNER
              FROM TB_COORD_LOCK
             WHERE LOCK_KEY = ?
               AND (EXPIRES_AT IS NULL OR EXPIRES_AT > CURRENT_TIMESTAMP)
        """)) {
            ps.setString(1, key);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        }
    }

    @Override
    public int purgeExpired() throws Exception {
        try (var ps = mustConn().prepareStatement("""
            DELETE FROM TB_COORD_LOCK
             WHERE EXPIRES_AT IS NOT NULL
               AND EXPIRES_AT <= CURRENT_TIMESTAMP
        """)) {
            return ps.executeUpdate();
        }
    }
}
