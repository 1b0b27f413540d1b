package net.tessera.adapter.jdbc.backfill;

import net.tessera.adapter.jdbc.TxContext;
import net.tessera.core.backfill.BatchResult;
import net.tessera.core.backfill.IndexBackfill;
import net.tessera.core.backfill.SecondaryIndexes;
import net.tessera.core.error.MalformedRecordException;
import net.tessera.core.error.SerializationException;
import net.tessera.core.model.EventIndexColumns;
import net.tessera.core.model.EventLogEntry;
import net.tessera.core.serdes.Serdes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;

/**
 * Derives {@code step_key}, {@code asset_key} and {@code partition_key} for events stored before those
 * columns existed, and {@code event_type} where it is missing. Only rows with all three columns empty are
 * touched; unreadable payloads are skipped.
 */
public final class EventLogColumnsBackfill implements IndexBackfill {
    private static final Logger log = LoggerFactory.getLogger(EventLogColumnsBackfill.class);

    private final DataSource ds;
    private final Serdes serdes;

    public EventLogColumnsBackfill(DataSource ds, Serdes serdes) {
        this.ds = ds;
        this.serdes = serdes;
    }

    @Override
    public String indexName() {
        return SecondaryIndexes.EVENT_LOG_COLUMNS;
    }

    @Override
    public BatchResult processBatch(long afterRowId, int batchSize) throws Exception {
        Connection c = TxContext.require(ds);
        long last = afterRowId;
        int scanned = 0, updated = 0, skipped = 0;
        try (PreparedStatement read = c.prepareStatement(
                """
                SELECT id, event, event_type, step_key, asset_key, partition_key
                  FROM event_logs
                 WHERE id > ?
                 ORDER BY id
                 LIMIT ?
                """);
             PreparedStatement write = c.prepareStatement(
                     """
                     UPDATE event_logs
                        SET step_key = ?, asset_key = ?, partition_key = ?,
                            event_type = COALESCE(event_type, ?)
                      WHERE id = ?
                     """)) {
            read.setLong(1, afterRowId);
            read.setInt(2, batchSize);
            try (ResultSet rs = read.executeQuery()) {
                while (rs.next()) {
                    long id = rs.getLong("id");
                    last = id;
                    scanned++;
                    if (rs.getString("step_key") != null || rs.getString("asset_key") != null
                            || rs.getString("partition_key") != null) {
                        continue;
                    }
                    EventIndexColumns cols;
                    try {
                        cols = EventIndexColumns.of(decode(id, rs.getString("event")));
                    } catch (MalformedRecordException e) {
                        log.warn("Skipping event {}: {}", id, e.getMessage());
                        skipped++;
                        continue;
                    }
                    boolean typeMissing = rs.getString("event_type") == null && cols.eventType() != null;
                    if (cols.isEmpty() && !typeMissing) continue;
                    write.setString(1, cols.stepKey());
                    write.setString(2, cols.assetKey());
                    write.setString(3, cols.partition());
                    write.setString(4, cols.eventType());
                    write.setLong(5, id);
                    write.addBatch();
                    updated++;
                }
            }
            if (updated > 0) write.executeBatch();
        }
        return new BatchResult(last, scanned, updated, skipped);
    }

    private EventLogEntry decode(long id, String body) {
        try {
            return serdes.deserialize(body, EventLogEntry.class);
        } catch (SerializationException e) {
            throw new MalformedRecordException(id, e.getMessage(), e);
        }
    }
}
