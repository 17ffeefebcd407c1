package net.syncron.adapter.jdbc.repo;

import net.syncron.adapter.jdbc.JdbcUtil;
import net.syncron.adapter.jdbc.TxContext;
import net.syncron.adapter.jdbc.UniqueViolations;
import net.syncron.adapter.jdbc.mapper.RowMappers;
import net.syncron.adapter.jdbc.schema.LedgerSchema;
import net.syncron.core.error.DuplicateOccurrenceException;
import net.syncron.core.model.RunRecord;
import net.syncron.core.spi.RunLedger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 관계형 DB 원장. 선점은 평범한 INSERT 이고, 유니크 인덱스 위반이 곧 "다른 프로세스가 가져갔다"는 뜻이다.
 * 모든 메서드는 TxRunner 가 열어준 커넥션({@link TxContext})만 쓴다. prepare() 만 예외.
 */
public final class JdbcRunLedger implements RunLedger {
    private final LedgerSchema schema;
    private final String table;

    public JdbcRunLedger(DataSource ds, String storeName) {
        this.schema = new LedgerSchema(ds, storeName);
        this.table = schema.table();
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    public String table() { return table; }

    @Override
    public void prepare() throws Exception {
        schema.migrate();
    }

    @Override
    public long claim(Instant intendedAt, String name, Instant startedAt) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "INSERT INTO " + table + " (JOB_NAME, INTENDED_AT, STARTED_AT) VALUES (?, ?, ?)",
                new String[]{"ID"}
        )) {
            ps.setString(1, name);
            JdbcUtil.setInstant(ps, 2, intendedAt);
            JdbcUtil.setInstant(ps, 3, startedAt);
            ps.executeUpdate();
            try (ResultSet k = ps.getGeneratedKeys()) {
                if (!k.next()) throw new SQLException("no generated key returned for " + table);
                return k.getLong(1);
            }
        } catch (SQLException e) {
            if (UniqueViolations.isUniqueViolation(e)) {
                throw new DuplicateOccurrenceException(name, intendedAt, e);
            }
            throw e;
        }
    }

    @Override
    public void complete(long recordId, Instant finishedAt, String result) throws Exception {
        finish(recordId, finishedAt, result, null);
    }

    @Override
    public void fail(long recordId, Instant finishedAt, String error) throws Exception {
        finish(recordId, finishedAt, null, error);
    }

    /** result 와 error 는 동시에 채워지지 않는다 */
    private void finish(long recordId, Instant finishedAt, String result, String error) throws SQLException {
        try (PreparedStatement ps = mustConn().prepareStatement(
                """
                UPDATE %s
                   SET FINISHED_AT  = ?,
                       RESULT_VALUE = ?,
                       ERROR_DETAIL = ?
                 WHERE ID = ?
                """.formatted(table)
        )) {
            JdbcUtil.setInstant(ps, 1, finishedAt);
            JdbcUtil.setText(ps, 2, result);
            JdbcUtil.setText(ps, 3, error);
            ps.setLong(4, recordId);
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<RunRecord> findById(long recordId) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "SELECT " + RowMappers.RUN_COLUMNS + " FROM " + table + " WHERE ID = ?"
        )) {
            ps.setLong(1, recordId);
            return single(ps);
        }
    }

    @Override
    public Optional<RunRecord> findByOccurrence(Instant intendedAt, String name) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "SELECT " + RowMappers.RUN_COLUMNS + " FROM " + table + " WHERE INTENDED_AT = ? AND JOB_NAME = ?"
        )) {
            JdbcUtil.setInstant(ps, 1, intendedAt);
            ps.setString(2, name);
            return single(ps);
        }
    }

    @Override
    public List<RunRecord> findByName(String name, int limit) throws Exception {
        if (limit <= 0) return List.of();
        try (PreparedStatement ps = mustConn().prepareStatement(
                """
                SELECT %s
                  FROM %s
                 WHERE JOB_NAME = ?
                 ORDER BY INTENDED_AT DESC
                """.formatted(RowMappers.RUN_COLUMNS, table)
        )) {
            ps.setString(1, name);
            ps.setMaxRows(limit);
            List<RunRecord> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toRunRecord(rs));
            }
            return out;
        }
    }

    @Override
    public int expireStartedBefore(Instant threshold) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "DELETE FROM " + table + " WHERE STARTED_AT < ?"
        )) {
            JdbcUtil.setInstant(ps, 1, threshold);
            return ps.executeUpdate();
        }
    }

    @Override
    public int deleteAll() throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("DELETE FROM " + table)) {
            return ps.executeUpdate();
        }
    }

    private static Optional<RunRecord> single(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            if (rs.next()) return Optional.of(RowMappers.toRunRecord(rs));
            return Optional.empty();
        }
    }
}
