package net.shelfsync.adapter.jdbc.repo;

import net.shelfsync.adapter.jdbc.JdbcUtil;
import net.shelfsync.adapter.jdbc.TxContext;
import net.shelfsync.adapter.jdbc.json.TaskArgsCodec;
import net.shelfsync.adapter.jdbc.mapper.RowMappers;
import net.shelfsync.core.model.CursorTaskArgs;
import net.shelfsync.core.model.TaskInvocation;
import net.shelfsync.core.spi.TaskQueueRepository;

import java.sql.Connection;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcTaskQueueRepository implements TaskQueueRepository {

    private Connection mustConn() {
        Connection c = TxContext.get();
        if (c == null) throw new IllegalStateException("TxContext required (wrap with JdbcTxRunner)");
        return c;
    }

    @Override
    public TaskInvocation enqueue(String taskName, String rootId, Long parentId,
                                  CursorTaskArgs args, Instant availableAt) throws Exception {
        Connection c = mustConn();
        long id;
        try (var ps = c.prepareStatement("""
            INSERT INTO TB_TASK_INVOCATION (
                -- ID 생략: IDENTITY가 자동 발번
                TASK_NAME, ROOT_ID, PARENT_ID, ARGS, STATUS, ATTEMPT, AVAILABLE_AT, CREATED_AT, UPDATED_AT
            ) VALUES (
                ?, ?, ?, ?, 'READY', 1, COALESCE(?, CURRENT_TIMESTAMP), CURRENT_TIMESTAMP, CURRENT_TIMESTAMP
            )
        """, new String[]{"ID"})) {
            ps.setString(1, taskName);
            ps.setString(2, rootId);
            if (parentId == null) ps.setNull(3, Types.NUMERIC); else ps.setLong(3, parentId);
            ps.setString(4, TaskArgsCodec.toJson(args));
            ps.setTimestamp(5, JdbcUtil.ts(availableAt));
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new IllegalStateException("No generated ID for task invocation " + taskName);
                id = keys.getLong(1);
            }
        }
        return findById(id).orElseThrow();
    }

    @Override
    public Optional<TaskInvocation> claimReady(Duration lease, String workerToken) throws Exception {
        Connection c = mustConn();

        // 1) 하나 픽업
        Long id = null;
        try (var ps = c.prepareStatement("""
            SELECT  ti.ID
            FROM    TB_TASK_INVOCATION ti
            WHERE   ti.ROWID IN (
                SELECT rid
                FROM (
                    SELECT  ti2.ROWID AS rid
                    FROM    TB_TASK_INVOCATION ti2
                    WHERE   ti2.STATUS = 'READY'
                      AND   ti2.AVAILABLE_AT <= CURRENT_TIMESTAMP
                    ORDER BY ti2.AVAILABLE_AT ASC, ti2.ID ASC
                    FETCH FIRST 1 ROWS ONLY
                )
            )
            FOR UPDATE OF ti.STATUS SKIP LOCKED
        """)) {
            try (var rs = ps.executeQuery()) {
                if (rs.next()) id = rs.getLong(1);
            }
        }
        if (id == null) return Optional.empty();

        // 2) RUNNING 전환
        try (var up = c.prepareStatement("""
            UPDATE TB_TASK_INVOCATION
               SET STATUS='RUNNING',
                   WORKER_TOKEN = ?,
                   LEASE_UNTIL = CURRENT_TIMESTAMP + NUMTODSINTERVAL(?, 'SECOND'),
                   STARTED_AT  = COALESCE(STARTED_AT, CURRENT_TIMESTAMP),
                   UPDATED_AT  = CURRENT_TIMESTAMP
             WHERE ID = ?
        """)) {
            up.setString(1, workerToken);
            JdbcUtil.setSeconds(up, 2, lease);
            up.setLong(3, id);
            up.executeUpdate();
        }

        // 3) 로우 반환
        return findById(id);
    }

    @Override
    public void heartbeat(long invocationId, Duration lease) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TASK_INVOCATION
               SET LEASE_UNTIL = CURRENT_TIMESTAMP + NUMTODSINTERVAL(?, 'SECOND'),
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE ID = ? AND STATUS='RUNNING'
        """)) {
            JdbcUtil.setSeconds(ps, 1, lease);
            ps.setLong(2, invocationId);
            ps.executeUpdate();
        }
    }

    @Override
    public void markDone(long invocationId) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TASK_INVOCATION
               SET STATUS='DONE',
                   FINISHED_AT = CURRENT_TIMESTAMP,
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE ID=?
        """)) {
            ps.setLong(1, invocationId);
            ps.executeUpdate();
        }
    }

    @Override
    public void markFailed(long invocationId, String lastError) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TASK_INVOCATION
               SET STATUS='FAILED',
                   FINISHED_AT = CURRENT_TIMESTAMP,
                   UPDATED_AT = CURRENT_TIMESTAMP,
                   LAST_ERROR = COALESCE(?, LAST_ERROR)
             WHERE ID=?
        """)) {
            ps.setString(1, lastError);
            ps.setLong(2, invocationId);
            ps.executeUpdate();
        }
    }

    @Override
    public void retryWithBackoff(long invocationId, Duration backoff, String lastError) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TASK_INVOCATION
               SET STATUS='READY',
                   AVAILABLE_AT = CURRENT_TIMESTAMP + NUMTODSINTERVAL(?, 'SECOND'),
                   ATTEMPT = ATTEMPT + 1,
                   WORKER_TOKEN = NULL,
                   LEASE_UNTIL = NULL,
                   UPDATED_AT = CURRENT_TIMESTAMP,
                   LAST_ERROR = ?
             WHERE ID=?
        """)) {
            JdbcUtil.setSeconds(ps, 1, backoff);
            ps.setString(2, lastError);
            ps.setLong(3, invocationId);
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<TaskInvocation> findById(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_TASK_INVOCATION WHERE ID=?")) {
            ps.setLong(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toTaskInvocation(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<TaskInvocation> findByRoot(String rootId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_TASK_INVOCATION WHERE ROOT_ID=? ORDER BY ID")) {
            ps.setString(1, rootId);
            try (var rs = ps.executeQuery()) {
                var out = new ArrayList<TaskInvocation>();
                while (rs.next()) out.add(RowMappers.toTaskInvocation(rs));
                return out;
            }
        }
    }

    // --- Maintenance 전용 메서드들 ---

    @Override
    public int recoverExpiredLeases(Duration backoff, String reason) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_TASK_INVOCATION
               SET STATUS='READY',
                   AVAILABLE_AT = CURRENT_TIMESTAMP + NUMTODSINTERVAL(?, 'SECOND'),
                   ATTEMPT = ATTEMPT + 1,
                   WORKER_TOKEN = NULL,
                   LEASE_UNTIL = NULL,
                   UPDATED_AT = CURRENT_TIMESTAMP,
                   LAST_ERROR = ?
             WHERE STATUS='RUNNING'
               AND LEASE_UNTIL IS NOT NULL
               AND LEASE_UNTIL <= CURRENT_TIMESTAMP
        """)) {
            JdbcUtil.setSeconds(ps, 1, backoff);
            ps.setString(2, reason);
            return ps.executeUpdate();
        }
    }

    @Override
    public int archiveFinishedOlderThan(Instant threshold) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            DELETE FROM TB_TASK_INVOCATION
             WHERE (STATUS='DONE' OR STATUS='FAILED')
               AND FINISHED_AT IS NOT NULL
               AND FINISHED_AT < ?
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(threshold));
            return ps.executeUpdate();
        }
    }
}
