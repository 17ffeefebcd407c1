package net.syncron.adapter.jdbc.mapper;

import net.syncron.adapter.jdbc.JdbcUtil;
import net.syncron.core.model.RunRecord;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    public static final String RUN_COLUMNS =
            "ID, JOB_NAME, INTENDED_AT, STARTED_AT, FINISHED_AT, RESULT_VALUE, ERROR_DETAIL";

    // --- RunRecord ---
    public static RunRecord toRunRecord(ResultSet rs) throws SQLException {
        return new RunRecord(
                rs.getLong("ID"),
                rs.getString("JOB_NAME"),
                JdbcUtil.getInstant(rs, "INTENDED_AT"),
                JdbcUtil.getInstant(rs, "STARTED_AT"),
                JdbcUtil.getInstant(rs, "FINISHED_AT"),
                rs.getString("RESULT_VALUE"),
                rs.getString("ERROR_DETAIL")
        );
    }
}
