package net.shelfsync.adapter.jdbc.repo;

import net.shelfsync.adapter.jdbc.JdbcUtil;
import net.shelfsync.adapter.jdbc.TxContext;
import net.shelfsync.adapter.jdbc.mapper.RowMappers;
import net.shelfsync.core.lock.LockResult;
import net.shelfsync.core.model.GuardStatus;
import net.shelfsync.core.model.Guarded;
import net.shelfsync.core.model.SessionGuard;
import net.shelfsync.core.model.UploadPart;
import net.shelfsync.core.model.UploadRecord;
import net.shelfsync.core.model.UploadState;
import net.shelfsync.core.spi.UploadSessionRepository;

import java.io.ByteArrayOutputStream;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * TB_UPLOAD_SESSION / TB_UPLOAD_BUFFER / TB_UPLOAD_PART.
 * 가드 UPDATE가 세션 로우를 잠그므로 같은 트랜잭션의 버퍼/파트 변경은 세션 단위로 직렬화된다.
 */
public final class JdbcUploadSessionRepository implements UploadSessionRepository {

    private Connection mustConn() {
        Connection c = TxContext.get();
        if (c == null) throw new IllegalStateException("TxContext required (wrap with JdbcTxRunner)");
        return c;
    }

    // === lock ===

    @Override
    public LockResult acquire(String sessionKey, String token, Duration lockTtl, Duration sessionTtl) throws Exception {
        Connection c = mustConn();
        for (int i = 0; i < 3; i++) {
            createIfAbsent(c, sessionKey, sessionTtl);

            // 1) 세션 로우 잠금 후 현재 소유자 확인
            String owner = null;
            boolean found = false;
            try (var ps = c.prepareStatement("""
                SELECT LOCK_TOKEN,
                       CASE WHEN LOCK_UNTIL > CURRENT_TIMESTAMP THEN 1 ELSE 0 END AS LIVE
                  FROM TB_UPLOAD_SESSION
                 WHERE SESSION_KEY = ?
                 FOR UPDATE
            """)) {
                ps.setString(1, sessionKey);
                try (var rs = ps.executeQuery()) {
                    if (rs.next()) {
                        found = true;
                        if (rs.getInt("LIVE") == 1) owner = rs.getString("LOCK_TOKEN");
                    }
                }
            }
            if (!found) continue; // 사이에 삭제됨
            if (owner != null && !owner.equals(token)) return LockResult.FAILED;

            // 2) 락 설정 + 세션 만료 갱신
            try (var up = c.prepareStatement("""
                UPDATE TB_UPLOAD_SESSION
                   SET LOCK_TOKEN = ?,
                       LOCK_UNTIL = CURRENT_TIMESTAMP + NUMTODSINTERVAL(?, 'SECOND'),
                       EXPIRES_AT = CURRENT_TIMESTAMP + NUMTODSINTERVAL(?, 'SECOND'),
                       UPDATED_AT = CURRENT_TIMESTAMP
                 WHERE SESSION_KEY = ?
            """)) {
                up.setString(1, token);
                JdbcUtil.setSeconds(up, 2, lockTtl);
                JdbcUtil.setSeconds(up, 3, sessionTtl);
                up.setString(4, sessionKey);
                up.executeUpdate();
            }
            return owner != null ? LockResult.EXTENDED : LockResult.ACQUIRED;
        }
        throw new IllegalStateException("Upload session " + sessionKey + " kept disappearing while acquiring");
    }

    private void createIfAbsent(Connection c, String sessionKey, Duration sessionTtl) throws SQLException {
        try (var ps = c.prepareStatement("""
            MERGE INTO TB_UPLOAD_SESSION t
            USING (SELECT ? AS session_key FROM dual) s
            ON (t.SESSION_KEY = s.session_key)
            WHEN NOT MATCHED THEN INSERT (
                SESSION_KEY, STATE, UPDATE_NUMBER, EXPIRES_AT, CREATED_AT, UPDATED_AT
            ) VALUES (
                s.session_key, 'INITIAL', 0,
                CURRENT_TIMESTAMP + NUMTODSINTERVAL(?, 'SECOND'),
                CURRENT_TIMESTAMP, CURRENT_TIMESTAMP
            )
        """)) {
            ps.setString(1, sessionKey);
            JdbcUtil.setSeconds(ps, 2, sessionTtl);
            ps.executeUpdate();
        } catch (SQLException e) {
            // 동시 생성: 다른 쪽이 만든 로우를 그대로 쓴다
            if (!JdbcUtil.isUniqueViolation(e)) throw e;
        }
    }

    @Override
    public boolean release(String sessionKey, String token) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_UPLOAD_SESSION
               SET LOCK_TOKEN = NULL,
                   LOCK_UNTIL = NULL,
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE SESSION_KEY = ?
               AND LOCK_TOKEN = ?
               AND LOCK_UNTIL > CURRENT_TIMESTAMP
        """)) {
            ps.setString(1, sessionKey);
            ps.setString(2, token);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean extend(String sessionKey, String token, Duration lockTtl) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_UPLOAD_SESSION
               SET LOCK_UNTIL = CURRENT_TIMESTAMP + NUMTODSINTERVAL(?, 'SECOND'),
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE SESSION_KEY = ?
               AND LOCK_TOKEN = ?
               AND LOCK_UNTIL > CURRENT_TIMESTAMP
        """)) {
            JdbcUtil.setSeconds(ps, 1, lockTtl);
            ps.setString(2, sessionKey);
            ps.setString(3, token);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public Optional<String> lockOwner(String sessionKey) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT LOCK_TOKEN
              FROM TB_UPLOAD_SESSION
             WHERE SESSION_KEY = ?
               AND LOCK_TOKEN IS NOT NULL
               AND LOCK_UNTIL > CURRENT_TIMESTAMP
        """)) {
            ps.setString(1, sessionKey);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        }
    }

    @Override
    public boolean delete(String sessionKey, String token) throws Exception {
        // 버퍼/파트는 ON DELETE CASCADE
        try (var ps = mustConn().prepareStatement("""
            DELETE FROM TB_UPLOAD_SESSION
             WHERE SESSION_KEY = ?
               AND LOCK_TOKEN = ?
               AND LOCK_UNTIL > CURRENT_TIMESTAMP
        """)) {
            ps.setString(1, sessionKey);
            ps.setString(2, token);
            return ps.executeUpdate() == 1;
        }
    }

    // === read ===

    @Override
    public OptionalLong updateNumber(String sessionKey) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT UPDATE_NUMBER FROM TB_UPLOAD_SESSION WHERE SESSION_KEY=?")) {
            ps.setString(1, sessionKey);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? OptionalLong.of(rs.getLong(1)) : OptionalLong.empty();
            }
        }
    }

    @Override
    public Optional<UploadState> state(String sessionKey) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT STATE FROM TB_UPLOAD_SESSION WHERE SESSION_KEY=?")) {
            ps.setString(1, sessionKey);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(UploadState.from(rs.getString(1))) : Optional.empty();
            }
        }
    }

    @Override
    public Map<String, UploadRecord> get(String sessionKey) throws Exception {
        Connection c = mustConn();
        Map<String, String> uploadIds = new LinkedHashMap<>();
        Map<String, byte[]> buffers = new LinkedHashMap<>();
        try (var ps = c.prepareStatement("""
            SELECT OUTPUT_KEY, UPLOAD_ID, BUFFER
              FROM TB_UPLOAD_BUFFER
             WHERE SESSION_KEY = ?
             ORDER BY SEQ
        """)) {
            ps.setString(1, sessionKey);
            try (var rs = ps.executeQuery()) {
                while (rs.next()) {
                    String key = rs.getString("OUTPUT_KEY");
                    uploadIds.put(key, rs.getString("UPLOAD_ID"));
                    buffers.put(key, rs.getBytes("BUFFER"));
                }
            }
        }
        if (uploadIds.isEmpty()) return Map.of();

        Map<String, List<UploadPart>> parts = new LinkedHashMap<>();
        try (var ps = c.prepareStatement("""
            SELECT OUTPUT_KEY, PART_NUMBER, ETAG
              FROM TB_UPLOAD_PART
             WHERE SESSION_KEY = ?
             ORDER BY OUTPUT_KEY, PART_NUMBER
        """)) {
            ps.setString(1, sessionKey);
            try (var rs = ps.executeQuery()) {
                while (rs.next()) {
                    parts.computeIfAbsent(rs.getString("OUTPUT_KEY"), k -> new ArrayList<>())
                            .add(RowMappers.toUploadPart(rs));
                }
            }
        }

        Map<String, UploadRecord> out = new LinkedHashMap<>();
        uploadIds.forEach((key, uploadId) ->
                out.put(key, new UploadRecord(uploadId, buffers.get(key), parts.get(key))));
        return out;
    }

    // === guarded mutations ===

    @Override
    public Guarded<Map<String, Integer>> appendBuffers(String sessionKey, SessionGuard guard,
                                                       Map<String, byte[]> data) throws Exception {
        Connection c = mustConn();
        GuardStatus st = guard(c, sessionKey, guard);
        if (st != GuardStatus.APPLIED) return Guarded.rejected(st);

        Map<String, Integer> sizes = new LinkedHashMap<>();
        for (var e : data.entrySet()) {
            sizes.put(e.getKey(), append(c, sessionKey, e.getKey(), e.getValue()));
        }
        return Guarded.applied(sizes);
    }

    /** 기존 BLOB 뒤에 이어붙여 다시 쓴다. @return 누적 크기 */
    private int append(Connection c, String sessionKey, String outputKey, byte[] bytes) throws SQLException {
        byte[] current = null;
        boolean exists = false;
        try (var ps = c.prepareStatement("""
            SELECT BUFFER FROM TB_UPLOAD_BUFFER WHERE SESSION_KEY = ? AND OUTPUT_KEY = ?
        """)) {
            ps.setString(1, sessionKey);
            ps.setString(2, outputKey);
            try (var rs = ps.executeQuery()) {
                if (rs.next()) {
                    exists = true;
                    current = rs.getBytes(1);
                }
            }
        }

        var merged = new ByteArrayOutputStream();
        if (current != null) merged.writeBytes(current);
        merged.writeBytes(bytes);
        byte[] next = merged.toByteArray();

        if (exists) {
            try (var up = c.prepareStatement("""
                UPDATE TB_UPLOAD_BUFFER
                   SET BUFFER = ?, BUFFER_SIZE = ?
                 WHERE SESSION_KEY = ? AND OUTPUT_KEY = ?
            """)) {
                up.setBytes(1, next);
                up.setInt(2, next.length);
                up.setString(3, sessionKey);
                up.setString(4, outputKey);
                up.executeUpdate();
            }
        } else {
            try (var ins = c.prepareStatement("""
                INSERT INTO TB_UPLOAD_BUFFER (SESSION_KEY, OUTPUT_KEY, BUFFER, BUFFER_SIZE)
                VALUES (?, ?, ?, ?)
            """)) {
                ins.setString(1, sessionKey);
                ins.setString(2, outputKey);
                ins.setBytes(3, next);
                ins.setInt(4, next.length);
                ins.executeUpdate();
            }
        }
        return next.length;
    }

    @Override
    public GuardStatus setUploadId(String sessionKey, SessionGuard guard, String outputKey, String uploadId) throws Exception {
        Connection c = mustConn();
        GuardStatus st = guard(c, sessionKey, guard);
        if (st != GuardStatus.APPLIED) return st;

        try (var ps = c.prepareStatement("""
            MERGE INTO TB_UPLOAD_BUFFER b
            USING (SELECT ? AS session_key, ? AS output_key, ? AS upload_id FROM dual) s
            ON (b.SESSION_KEY = s.session_key AND b.OUTPUT_KEY = s.output_key)
            WHEN MATCHED THEN UPDATE SET b.UPLOAD_ID = s.upload_id
            WHEN NOT MATCHED THEN INSERT (SESSION_KEY, OUTPUT_KEY, UPLOAD_ID, BUFFER_SIZE)
                VALUES (s.session_key, s.output_key, s.upload_id, 0)
        """)) {
            ps.setString(1, sessionKey);
            ps.setString(2, outputKey);
            ps.setString(3, uploadId);
            ps.executeUpdate();
        }
        return st;
    }

    @Override
    public GuardStatus addPartAndClearBuffer(String sessionKey, SessionGuard guard,
                                             String outputKey, UploadPart part) throws Exception {
        Connection c = mustConn();
        GuardStatus st = guard(c, sessionKey, guard);
        if (st != GuardStatus.APPLIED) return st;

        // 1) 버퍼 비우기 (없으면 빈 버퍼 생성: 파트 FK 대상)
        try (var ps = c.prepareStatement("""
            MERGE INTO TB_UPLOAD_BUFFER b
            USING (SELECT ? AS session_key, ? AS output_key FROM dual) s
            ON (b.SESSION_KEY = s.session_key AND b.OUTPUT_KEY = s.output_key)
            WHEN MATCHED THEN UPDATE SET b.BUFFER = NULL, b.BUFFER_SIZE = 0
            WHEN NOT MATCHED THEN INSERT (SESSION_KEY, OUTPUT_KEY, BUFFER_SIZE)
                VALUES (s.session_key, s.output_key, 0)
        """)) {
            ps.setString(1, sessionKey);
            ps.setString(2, outputKey);
            ps.executeUpdate();
        }

        // 2) 파트 기록
        try (var ps = c.prepareStatement("""
            INSERT INTO TB_UPLOAD_PART (SESSION_KEY, OUTPUT_KEY, PART_NUMBER, ETAG)
            VALUES (?, ?, ?, ?)
        """)) {
            ps.setString(1, sessionKey);
            ps.setString(2, outputKey);
            ps.setInt(3, part.partNumber());
            ps.setString(4, part.etag());
            ps.executeUpdate();
        }
        return st;
    }

    @Override
    public GuardStatus clearUploads(String sessionKey, SessionGuard guard) throws Exception {
        Connection c = mustConn();
        GuardStatus st = guard(c, sessionKey, guard);
        if (st != GuardStatus.APPLIED) return st;

        try (var ps = c.prepareStatement("DELETE FROM TB_UPLOAD_BUFFER WHERE SESSION_KEY=?")) {
            ps.setString(1, sessionKey);
            ps.executeUpdate();
        }
        return st;
    }

    @Override
    public GuardStatus setState(String sessionKey, SessionGuard guard, UploadState state) throws Exception {
        Connection c = mustConn();
        GuardStatus st = guard(c, sessionKey, guard);
        if (st != GuardStatus.APPLIED) return st;

        try (var ps = c.prepareStatement("UPDATE TB_UPLOAD_SESSION SET STATE=? WHERE SESSION_KEY=?")) {
            ps.setString(1, state.code());
            ps.setString(2, sessionKey);
            ps.executeUpdate();
        }
        return st;
    }

    /**
     * 소유 토큰 + update number를 한 문장으로 검사하고 통과하면 UPDATE_NUMBER+1, 세션 만료 갱신.
     * 실패 시 원인만 다시 읽어서 분류한다.
     */
    private GuardStatus guard(Connection c, String sessionKey, SessionGuard guard) throws SQLException {
        try (var ps = c.prepareStatement("""
            UPDATE TB_UPLOAD_SESSION
               SET UPDATE_NUMBER = UPDATE_NUMBER + 1,
                   EXPIRES_AT    = CURRENT_TIMESTAMP + NUMTODSINTERVAL(?, 'SECOND'),
                   UPDATED_AT    = CURRENT_TIMESTAMP
             WHERE SESSION_KEY   = ?
               AND LOCK_TOKEN    = ?
               AND LOCK_UNTIL    > CURRENT_TIMESTAMP
               AND UPDATE_NUMBER = ?
        """)) {
            JdbcUtil.setSeconds(ps, 1, guard.sessionTtl());
            ps.setString(2, sessionKey);
            ps.setString(3, guard.token());
            ps.setLong(4, guard.expectedUpdateNumber());
            if (ps.executeUpdate() == 1) return GuardStatus.APPLIED;
        }

        try (var ps = c.prepareStatement("""
            SELECT CASE WHEN LOCK_TOKEN = ? AND LOCK_UNTIL > CURRENT_TIMESTAMP THEN 1 ELSE 0 END AS OWNED
              FROM TB_UPLOAD_SESSION
             WHERE SESSION_KEY = ?
        """)) {
            ps.setString(1, guard.token());
            ps.setString(2, sessionKey);
            try (var rs = ps.executeQuery()) {
                if (!rs.next() || rs.getInt(1) == 0) return GuardStatus.NOT_OWNER;
                return GuardStatus.STALE;
            }
        }
    }

    // === maintenance ===

    @Override
    public List<String> findExpired(int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT SESSION_KEY
              FROM TB_UPLOAD_SESSION
             WHERE EXPIRES_AT <= CURRENT_TIMESTAMP
               AND (LOCK_UNTIL IS NULL OR LOCK_UNTIL <= CURRENT_TIMESTAMP)
             ORDER BY EXPIRES_AT ASC
             FETCH FIRST ? ROWS ONLY
        """)) {
            ps.setInt(1, limit);
            try (var rs = ps.executeQuery()) {
                var out = new ArrayList<String>();
                while (rs.next()) out.add(rs.getString(1));
                return out;
            }
        }
    }

    @Override
    public boolean forceDelete(String sessionKey) throws Exception {
        try (var ps = mustConn().prepareStatement("DELETE FROM TB_UPLOAD_SESSION WHERE SESSION_KEY=?")) {
            ps.setString(1, sessionKey);
            return ps.executeUpdate() == 1;
        }
    }
}
