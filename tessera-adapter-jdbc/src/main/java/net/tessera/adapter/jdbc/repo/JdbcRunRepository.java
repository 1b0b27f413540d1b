package net.tessera.adapter.jdbc.repo;

import net.tessera.adapter.jdbc.JdbcUtil;
import net.tessera.adapter.jdbc.TxContext;
import net.tessera.adapter.jdbc.mapper.RowMappers;
import net.tessera.core.model.Run;
import net.tessera.core.model.RunRecord;
import net.tessera.core.model.RunStatus;
import net.tessera.core.model.RunTags;
import net.tessera.core.model.RunsFilter;
import net.tessera.core.serdes.Serdes;
import net.tessera.core.spi.RunRepository;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class JdbcRunRepository implements RunRepository {
    private static final String BASE_COLUMNS =
            "r.id, r.run_id, r.run_body, r.create_timestamp, r.update_timestamp";
    private static final String TIME_COLUMNS = ", r.start_time, r.end_time";

    private final DataSource ds;
    private final Serdes serdes;

    public JdbcRunRepository(DataSource ds, Serdes serdes) {
        this.ds = ds;
        this.serdes = serdes;
    }

    private Connection mustConn() {
        return TxContext.require(ds);
    }

    @Override
    public boolean exists(String runId) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("SELECT 1 FROM runs WHERE run_id = ?")) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public long insert(Run run, Instant now) throws Exception {
        Connection c = mustConn();
        try (PreparedStatement ps = c.prepareStatement(
                """
                INSERT INTO runs (run_id, job_name, status, run_body, snapshot_id,
                                  partition_key, partition_set, create_timestamp, update_timestamp)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """
        )) {
            ps.setString(1, run.runId());
            ps.setString(2, run.jobName());
            ps.setString(3, run.status().code());
            ps.setString(4, serdes.serialize(run));
            ps.setString(5, run.jobSnapshotId());
            ps.setString(6, run.partition());
            ps.setString(7, run.partitionSet());
            ps.setLong(8, JdbcUtil.millis(now));
            ps.setLong(9, JdbcUtil.millis(now));
            ps.executeUpdate();
        }
        long id = JdbcUtil.lastInsertId(c);
        insertTags(c, run.runId(), run.tags());
        return id;
    }

    @Override
    public void update(Run run, Instant now) throws Exception {
        Connection c = mustConn();
        try (PreparedStatement ps = c.prepareStatement(
                """
                UPDATE runs
                   SET status = ?,
                       run_body = ?,
                       partition_key = ?,
                       partition_set = ?,
                       update_timestamp = ?
                 WHERE run_id = ?
                """
        )) {
            ps.setString(1, run.status().code());
            ps.setString(2, serdes.serialize(run));
            ps.setString(3, run.partition());
            ps.setString(4, run.partitionSet());
            ps.setLong(5, JdbcUtil.millis(now));
            ps.setString(6, run.runId());
            ps.executeUpdate();
        }
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM run_tags WHERE run_id = ?")) {
            ps.setString(1, run.runId());
            ps.executeUpdate();
        }
        insertTags(c, run.runId(), run.tags());
    }

    private static void insertTags(Connection c, String runId, Map<String, String> tags) throws SQLException {
        if (tags.isEmpty()) return;
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO run_tags (run_id, tag_key, tag_value) VALUES (?, ?, ?)")) {
            for (Map.Entry<String, String> t : tags.entrySet()) {
                ps.setString(1, runId);
                ps.setString(2, t.getKey());
                ps.setString(3, t.getValue());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    @Override
    public Optional<RunRecord> findRecord(String runId, boolean withRunTimes) throws Exception {
        String sql = "SELECT " + BASE_COLUMNS + (withRunTimes ? TIME_COLUMNS : "") + " FROM runs r WHERE r.run_id = ?";
        try (PreparedStatement ps = mustConn().prepareStatement(sql)) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(RowMappers.toRunRecord(rs, serdes, withRunTimes));
                return Optional.empty();
            }
        }
    }

    @Override
    public List<RunRecord> query(RunsFilter filter, String cursor, int limit,
                                 boolean indexedPartitions, boolean withRunTimes) throws Exception {
        StringBuilder sql = new StringBuilder("SELECT ")
                .append(BASE_COLUMNS).append(withRunTimes ? TIME_COLUMNS : "")
                .append(" FROM runs r WHERE 1 = 1");
        List<String> params = new ArrayList<>();

        if (!filter.runIds().isEmpty()) {
            sql.append(" AND r.run_id IN (").append(JdbcUtil.placeholders(filter.runIds().size())).append(')');
            params.addAll(filter.runIds());
        }
        if (filter.jobName() != null) {
            sql.append(" AND r.job_name = ?");
            params.add(filter.jobName());
        }
        if (!filter.statuses().isEmpty()) {
            sql.append(" AND r.status IN (").append(JdbcUtil.placeholders(filter.statuses().size())).append(')');
            for (RunStatus s : filter.statuses()) params.add(s.code());
        }
        if (filter.snapshotId() != null) {
            sql.append(" AND r.snapshot_id = ?");
            params.add(filter.snapshotId());
        }
        for (Map.Entry<String, String> t : filter.tags().entrySet()) {
            appendTagMatch(sql, params, t.getKey(), t.getValue());
        }
        if (filter.hasPartition()) {
            if (indexedPartitions) {
                sql.append(" AND r.partition_key = ?");
                params.add(filter.partition());
                if (filter.partitionSet() != null) {
                    sql.append(" AND r.partition_set = ?");
                    params.add(filter.partitionSet());
                }
            } else {
                appendTagMatch(sql, params, RunTags.PARTITION, filter.partition());
                if (filter.partitionSet() != null) {
                    appendTagMatch(sql, params, RunTags.PARTITION_SET, filter.partitionSet());
                }
            }
        }
        if (cursor != null) {
            sql.append(" AND r.id < (SELECT c.id FROM runs c WHERE c.run_id = ?)");
            params.add(cursor);
        }
        sql.append(" ORDER BY r.id DESC");
        if (limit > 0) sql.append(" LIMIT ").append(limit);

        try (PreparedStatement ps = mustConn().prepareStatement(sql.toString())) {
            JdbcUtil.bindStrings(ps, 1, params);
            try (ResultSet rs = ps.executeQuery()) {
                List<RunRecord> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toRunRecord(rs, serdes, withRunTimes));
                return out;
            }
        }
    }

    private static void appendTagMatch(StringBuilder sql, List<String> params, String key, String value) {
        sql.append(" AND EXISTS (SELECT 1 FROM run_tags t WHERE t.run_id = r.run_id AND t.tag_key = ? AND t.tag_value = ?)");
        params.add(key);
        params.add(value);
    }

    @Override
    public void setStartTime(String runId, double startTime) throws Exception {
        setTime("start_time", runId, startTime);
    }

    @Override
    public void setEndTime(String runId, double endTime) throws Exception {
        setTime("end_time", runId, endTime);
    }

    private void setTime(String column, String runId, double value) throws SQLException {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "UPDATE runs SET " + column + " = ? WHERE run_id = ?")) {
            ps.setDouble(1, value);
            ps.setString(2, runId);
            ps.executeUpdate();
        }
    }

    @Override
    public List<String> runIds() throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("SELECT run_id FROM runs ORDER BY id");
             ResultSet rs = ps.executeQuery()) {
            List<String> ids = new ArrayList<>();
            while (rs.next()) ids.add(rs.getString(1));
            return ids;
        }
    }

    @Override
    public boolean hasSnapshot(String snapshotId) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("SELECT 1 FROM snapshots WHERE snapshot_id = ?")) {
            ps.setString(1, snapshotId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public void insertSnapshot(String snapshotId, String kind, String body, Instant now) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                """
                INSERT INTO snapshots (snapshot_id, snapshot_kind, snapshot_body, create_timestamp)
                VALUES (?, ?, ?, ?)
                """
        )) {
            ps.setString(1, snapshotId);
            ps.setString(2, kind);
            ps.setString(3, body);
            ps.setLong(4, JdbcUtil.millis(now));
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<String> findSnapshotBody(String snapshotId) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "SELECT snapshot_body FROM snapshots WHERE snapshot_id = ?")) {
            ps.setString(1, snapshotId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(rs.getString(1));
                return Optional.empty();
            }
        }
    }
}
