package net.tessera.adapter.jdbc.repo;

import net.tessera.adapter.jdbc.JdbcUtil;
import net.tessera.adapter.jdbc.TxContext;
import net.tessera.adapter.jdbc.mapper.RowMappers;
import net.tessera.core.model.AssetKey;
import net.tessera.core.model.AssetKeyRecord;
import net.tessera.core.model.EventIndexColumns;
import net.tessera.core.model.EventLogEntry;
import net.tessera.core.model.EventLogRecord;
import net.tessera.core.model.EventLogRow;
import net.tessera.core.serdes.Serdes;
import net.tessera.core.spi.EventLogRepository;

import javax.sql.DataSource;
import java.sql.*;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class JdbcEventLogRepository implements EventLogRepository {
    private static final String ASSET_COLUMNS =
            "asset_key, last_materialization_timestamp, last_run_id, wipe_timestamp, tags";

    private final DataSource ds;
    private final Serdes serdes;

    public JdbcEventLogRepository(DataSource ds, Serdes serdes) {
        this.ds = ds;
        this.serdes = serdes;
    }

    private Connection mustConn() {
        return TxContext.require(ds);
    }

    @Override
    public long append(EventLogEntry entry) throws Exception {
        EventIndexColumns cols = EventIndexColumns.of(entry);
        Connection c = mustConn();
        try (PreparedStatement ps = c.prepareStatement(
                """
                INSERT INTO event_logs (run_id, event, event_type, timestamp, step_key, asset_key, partition_key)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """
        )) {
            ps.setString(1, entry.runId());
            ps.setString(2, serdes.serialize(entry));
            ps.setString(3, cols.eventType());
            ps.setDouble(4, entry.timestamp());
            ps.setString(5, cols.stepKey());
            ps.setString(6, cols.assetKey());
            ps.setString(7, cols.partition());
            ps.executeUpdate();
        }
        return JdbcUtil.lastInsertId(c);
    }

    @Override
    public List<EventLogRecord> findByRun(String runId, long afterLogId, int limit) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "SELECT id, event FROM event_logs WHERE run_id = ? AND id > ? ORDER BY id LIMIT ?")) {
            ps.setString(1, runId);
            ps.setLong(2, afterLogId);
            ps.setInt(3, limit);
            try (ResultSet rs = ps.executeQuery()) {
                List<EventLogRecord> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toEventLogRecord(rs, serdes));
                return out;
            }
        }
    }

    @Override
    public Optional<EventLogRow> findRow(long logId) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                """
                SELECT id, run_id, event_type, timestamp, step_key, asset_key, partition_key
                  FROM event_logs
                 WHERE id = ?
                """
        )) {
            ps.setLong(1, logId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(RowMappers.toEventLogRow(rs));
                return Optional.empty();
            }
        }
    }

    @Override
    public Map<String, Long> countByType(String runId) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                """
                SELECT event_type, COUNT(*)
                  FROM event_logs
                 WHERE run_id = ? AND event_type IS NOT NULL
                 GROUP BY event_type
                 ORDER BY event_type
                """
        )) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                Map<String, Long> counts = new LinkedHashMap<>();
                while (rs.next()) counts.put(rs.getString(1), rs.getLong(2));
                return counts;
            }
        }
    }

    @Override
    public List<String> runIds() throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "SELECT run_id FROM event_logs GROUP BY run_id ORDER BY MIN(id)");
             ResultSet rs = ps.executeQuery()) {
            List<String> ids = new ArrayList<>();
            while (rs.next()) ids.add(rs.getString(1));
            return ids;
        }
    }

    /**
     * With the index columns a materialization only moves the record forward: an older timestamp
     * never replaces a newer one.
     */
    @Override
    public void upsertMaterialization(AssetKey key, String runId, double timestamp, Map<String, String> tags,
                                      boolean indexColumns) throws Exception {
        long created = (long) (timestamp * 1000);
        if (!indexColumns) {
            try (PreparedStatement ps = mustConn().prepareStatement(
                    "INSERT OR IGNORE INTO asset_keys (asset_key, create_timestamp) VALUES (?, ?)")) {
                ps.setString(1, key.toDbString());
                ps.setLong(2, created);
                ps.executeUpdate();
            }
            return;
        }
        try (PreparedStatement ps = mustConn().prepareStatement(
                """
                INSERT INTO asset_keys (asset_key, create_timestamp, last_materialization_timestamp, last_run_id, tags)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT (asset_key) DO UPDATE
                   SET last_materialization_timestamp = excluded.last_materialization_timestamp,
                       last_run_id = excluded.last_run_id,
                       tags = excluded.tags
                 WHERE asset_keys.last_materialization_timestamp IS NULL
                    OR excluded.last_materialization_timestamp >= asset_keys.last_materialization_timestamp
                """
        )) {
            ps.setString(1, key.toDbString());
            ps.setLong(2, created);
            ps.setDouble(3, timestamp);
            ps.setString(4, runId);
            ps.setString(5, serdes.serialize(tags));
            ps.executeUpdate();
        }
    }

    /**
     * Without the index columns the row is deleted and the key cleared from its events; with them the
     * wipe is recorded as a tombstone timestamp, never earlier than the last materialization it hides.
     */
    @Override
    public boolean wipe(AssetKey key, double timestamp, boolean indexColumns) throws Exception {
        Connection c = mustConn();
        if (indexColumns) {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE asset_keys SET wipe_timestamp = MAX(?, COALESCE(last_materialization_timestamp, ?))"
                            + " WHERE asset_key = ?")) {
                ps.setDouble(1, timestamp);
                ps.setDouble(2, timestamp);
                ps.setString(3, key.toDbString());
                return ps.executeUpdate() > 0;
            }
        }
        int deleted;
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM asset_keys WHERE asset_key = ?")) {
            ps.setString(1, key.toDbString());
            deleted = ps.executeUpdate();
        }
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE event_logs SET asset_key = NULL WHERE asset_key = ?")) {
            ps.setString(1, key.toDbString());
            ps.executeUpdate();
        }
        return deleted > 0;
    }

    @Override
    public Optional<AssetKeyRecord> findAssetKey(AssetKey key, boolean indexColumns) throws Exception {
        String columns = indexColumns ? ASSET_COLUMNS : "asset_key";
        try (PreparedStatement ps = mustConn().prepareStatement(
                "SELECT " + columns + " FROM asset_keys WHERE asset_key = ?")) {
            ps.setString(1, key.toDbString());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(RowMappers.toAssetKeyRecord(rs, serdes, indexColumns));
                return Optional.empty();
            }
        }
    }

    @Override
    public List<AssetKeyRecord> allAssetKeys(boolean indexColumns) throws Exception {
        String columns = indexColumns ? ASSET_COLUMNS : "asset_key";
        try (PreparedStatement ps = mustConn().prepareStatement(
                "SELECT " + columns + " FROM asset_keys ORDER BY asset_key");
             ResultSet rs = ps.executeQuery()) {
            List<AssetKeyRecord> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toAssetKeyRecord(rs, serdes, indexColumns));
            return out;
        }
    }
}
