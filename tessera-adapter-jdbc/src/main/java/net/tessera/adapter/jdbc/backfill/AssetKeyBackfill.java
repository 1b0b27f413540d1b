package net.tessera.adapter.jdbc.backfill;

import net.tessera.adapter.jdbc.JdbcSchema;
import net.tessera.adapter.jdbc.TxContext;
import net.tessera.core.backfill.BatchResult;
import net.tessera.core.backfill.IndexBackfill;
import net.tessera.core.backfill.SecondaryIndexes;
import net.tessera.core.error.SerializationException;
import net.tessera.core.model.AssetKey;
import net.tessera.core.model.AssetMaterialization;
import net.tessera.core.model.EventLogEntry;
import net.tessera.core.serdes.Serdes;
import net.tessera.core.spi.EventLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds {@code asset_keys} from events whose {@code asset_key} column is set. Keys cleared by a wipe
 * are not resurrected, and older materializations never overwrite newer ones.
 */
public final class AssetKeyBackfill implements IndexBackfill {
    private static final Logger log = LoggerFactory.getLogger(AssetKeyBackfill.class);

    private final DataSource ds;
    private final EventLogRepository events;
    private final Serdes serdes;

    public AssetKeyBackfill(DataSource ds, EventLogRepository events, Serdes serdes) {
        this.ds = ds;
        this.events = events;
        this.serdes = serdes;
    }

    @Override
    public String indexName() {
        return SecondaryIndexes.ASSET_KEY_TABLE;
    }

    private record Row(long id, String runId, String assetKey, double timestamp, String body) {}

    @Override
    public BatchResult processBatch(long afterRowId, int batchSize) throws Exception {
        Connection c = TxContext.require(ds);
        List<Row> rows = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                """
                SELECT id, run_id, asset_key, timestamp, event
                  FROM event_logs
                 WHERE id > ? AND asset_key IS NOT NULL
                 ORDER BY id
                 LIMIT ?
                """
        )) {
            ps.setLong(1, afterRowId);
            ps.setInt(2, batchSize);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(new Row(rs.getLong("id"), rs.getString("run_id"), rs.getString("asset_key"),
                            rs.getDouble("timestamp"), rs.getString("event")));
                }
            }
        }
        if (rows.isEmpty()) return BatchResult.empty(afterRowId);

        boolean indexColumns = JdbcSchema.hasColumn(c, "asset_keys", "wipe_timestamp");
        int updated = 0, skipped = 0;
        for (Row row : rows) {
            AssetKey key;
            Map<String, String> tags = Map.of();
            try {
                key = AssetKey.fromDbString(row.assetKey());
                EventLogEntry entry = serdes.deserialize(row.body(), EventLogEntry.class);
                tags = entry.assetMaterialization().map(AssetMaterialization::tags).orElse(Map.of());
            } catch (SerializationException | IllegalArgumentException e) {
                log.warn("Skipping event {}: {}", row.id(), e.getMessage());
                skipped++;
                continue;
            }
            events.upsertMaterialization(key, row.runId(), row.timestamp(), tags, indexColumns);
            updated++;
        }
        return new BatchResult(rows.get(rows.size() - 1).id(), rows.size(), updated, skipped);
    }
}
