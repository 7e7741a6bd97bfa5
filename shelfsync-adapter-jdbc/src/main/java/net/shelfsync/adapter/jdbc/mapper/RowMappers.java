package net.shelfsync.adapter.jdbc.mapper;

import net.shelfsync.adapter.jdbc.JdbcUtil;
import net.shelfsync.adapter.jdbc.json.TaskArgsCodec;
import net.shelfsync.core.model.TaskInvocation;
import net.shelfsync.core.model.UploadPart;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- TaskInvocation ---
    public static TaskInvocation toTaskInvocation(ResultSet rs) throws SQLException {
        long parent = rs.getLong("PARENT_ID");
        Long parentId = rs.wasNull() ? null : parent;
        return new TaskInvocation(
                rs.getLong("ID"),
                rs.getString("TASK_NAME"),
                rs.getString("ROOT_ID"),
                parentId,
                TaskArgsCodec.fromJson(rs.getString("ARGS")),
                TaskInvocation.Status.from(rs.getString("STATUS")),
                rs.getLong("ATTEMPT"),
                rs.getString("WORKER_TOKEN"),
                JdbcUtil.toInstant(rs.getTimestamp("AVAILABLE_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("LEASE_UNTIL")),
                JdbcUtil.toInstant(rs.getTimestamp("STARTED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("FINISHED_AT")),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant(),
                rs.getString("LAST_ERROR")
        );
    }

    // --- UploadPart
    public static UploadPart toUploadPart(ResultSet rs) throws SQLException {
        return new UploadPart(rs.getInt("PART_NUMBER"), rs.getString("ETAG"));
    }
}
