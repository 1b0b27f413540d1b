package net.tessera.adapter.jdbc.mapper;

import net.tessera.adapter.jdbc.JdbcUtil;
import net.tessera.core.backfill.SecondaryIndexState;
import net.tessera.core.model.*;
import net.tessera.core.serdes.Serdes;

import java.sql.*;
import java.util.Map;

public final class RowMappers {
    private RowMappers() {}

    // --- Run ---
    public static RunRecord toRunRecord(ResultSet rs, Serdes serdes, boolean withRunTimes) throws SQLException {
        Run run = serdes.deserialize(rs.getString("run_body"), Run.class);
        return new RunRecord(
                rs.getLong("id"),
                run,
                JdbcUtil.toInstant(rs.getLong("create_timestamp")),
                JdbcUtil.toInstant(rs.getLong("update_timestamp")),
                withRunTimes ? JdbcUtil.getDouble(rs, "start_time") : null,
                withRunTimes ? JdbcUtil.getDouble(rs, "end_time") : null
        );
    }

    // --- Event log ---
    public static EventLogRecord toEventLogRecord(ResultSet rs, Serdes serdes) throws SQLException {
        return new EventLogRecord(
                rs.getLong("id"),
                serdes.deserialize(rs.getString("event"), EventLogEntry.class)
        );
    }

    public static EventLogRow toEventLogRow(ResultSet rs) throws SQLException {
        return new EventLogRow(
                rs.getLong("id"),
                rs.getString("run_id"),
                rs.getString("event_type"),
                rs.getDouble("timestamp"),
                rs.getString("step_key"),
                rs.getString("asset_key"),
                rs.getString("partition_key")
        );
    }

    // --- Asset key ---
    @SuppressWarnings("unchecked")
    public static AssetKeyRecord toAssetKeyRecord(ResultSet rs, Serdes serdes, boolean indexColumns) throws SQLException {
        AssetKey key = AssetKey.fromDbString(rs.getString("asset_key"));
        if (!indexColumns) {
            return new AssetKeyRecord(key, null, null, null, Map.of());
        }
        String tags = rs.getString("tags");
        return new AssetKeyRecord(
                key,
                JdbcUtil.getDouble(rs, "last_materialization_timestamp"),
                rs.getString("last_run_id"),
                JdbcUtil.getDouble(rs, "wipe_timestamp"),
                tags == null ? Map.of() : (Map<String, String>) serdes.deserialize(tags, Map.class)
        );
    }

    // --- Instigator ---
    public static InstigatorState toInstigatorState(ResultSet rs, Serdes serdes) throws SQLException {
        InstigatorState state = serdes.deserialize(rs.getString("instigator_body"), InstigatorState.class);
        return state.withType(InstigatorType.from(rs.getString("instigator_type")));
    }

    public static InstigatorTick toInstigatorTick(ResultSet rs, Serdes serdes) throws SQLException {
        TickData data = serdes.deserialize(rs.getString("tick_body"), TickData.class);
        return new InstigatorTick(
                rs.getLong("id"),
                data.withInstigatorType(InstigatorType.from(rs.getString("instigator_type")))
        );
    }

    // --- Secondary index ---
    public static SecondaryIndexState toSecondaryIndexState(ResultSet rs) throws SQLException {
        return new SecondaryIndexState(
                rs.getString("name"),
                JdbcUtil.toInstant(rs.getLong("create_timestamp")),
                JdbcUtil.toInstantOrNull(rs, "migration_completed"),
                rs.getLong("last_row_id")
        );
    }
}
