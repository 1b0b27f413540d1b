package net.tessera.core.service;

import net.tessera.core.backfill.BackfillSummary;
import net.tessera.core.backfill.IndexBackfill;
import net.tessera.core.backfill.IndexBackfillService;
import net.tessera.core.migration.SchemaMigrator;
import net.tessera.core.migration.SchemaRevisions;
import net.tessera.core.model.AssetKey;
import net.tessera.core.model.AssetKeyRecord;
import net.tessera.core.model.AssetMaterialization;
import net.tessera.core.model.EventLogEntry;
import net.tessera.core.model.EventLogRow;
import net.tessera.core.spi.Clock;
import net.tessera.core.spi.EventLogRepository;
import net.tessera.core.spi.TxRunner;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only event log with asset-key tracking.
 *
 * <p>Until the optional asset-index-columns migration is applied, an asset row records existence only:
 * wiping deletes it and clears the key from its events. Afterwards wipes are tombstones and a key is
 * present again once it is materialized after the wipe.
 */
public final class EventLogStorage {

    private final EventLogRepository events;
    private final SchemaMigrator migrator;
    private final IndexBackfillService backfills;
    private final IndexBackfill columnsBackfill;
    private final IndexBackfill assetKeyBackfill;
    private final TxRunner tx;
    private final Clock clock;
    private final int pageSize;

    public EventLogStorage(EventLogRepository events,
                           SchemaMigrator migrator,
                           IndexBackfillService backfills,
                           IndexBackfill columnsBackfill,
                           IndexBackfill assetKeyBackfill,
                           TxRunner tx, Clock clock, int pageSize) {
        if (pageSize <= 0) throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        this.events = events;
        this.migrator = migrator;
        this.backfills = backfills;
        this.columnsBackfill = columnsBackfill;
        this.assetKeyBackfill = assetKeyBackfill;
        this.tx = tx;
        this.clock = clock;
        this.pageSize = pageSize;
    }

    public SchemaMigrator migrator() { return migrator; }

    /** Returns the new log id. A materialization also updates its asset-key record. */
    public long appendEvent(EventLogEntry entry) throws Exception {
        return tx.required(() -> {
            migrator.requireWritable();
            long logId = events.append(entry);
            Optional<AssetMaterialization> m = entry.assetMaterialization();
            if (m.isPresent()) {
                events.upsertMaterialization(m.get().assetKey(), entry.runId(), entry.timestamp(), m.get().tags(),
                        indexColumnsApplied());
            }
            return logId;
        });
    }

    public EventLogSequence getLogsForRun(String runId) {
        return getLogsForRun(runId, 0L);
    }

    /** Events with {@code log_id > cursor}; pass the last seen log id to tail a running log. */
    public EventLogSequence getLogsForRun(String runId, long cursor) {
        return new EventLogSequence(runId, cursor, pageSize,
                (after, limit) -> tx.required(() -> events.findByRun(runId, after, limit)));
    }

    public Optional<EventLogRow> getEventRow(long logId) throws Exception {
        return tx.required(() -> events.findRow(logId));
    }

    public List<String> getAllRunIds() throws Exception {
        return tx.required(events::runIds);
    }

    /** Event counts per event type; plain log messages are not counted. */
    public Map<String, Long> getStats(String runId) throws Exception {
        return tx.required(() -> events.countByType(runId));
    }

    public void recordMaterialization(AssetKey key, String runId, Map<String, String> tags, double timestamp)
            throws Exception {
        tx.required(() -> {
            migrator.requireWritable();
            events.upsertMaterialization(key, runId, timestamp, tags == null ? Map.of() : tags, indexColumnsApplied());
            return null;
        });
    }

    /** Returns false when the key was never recorded. */
    public boolean wipeAsset(AssetKey key) throws Exception {
        return tx.required(() -> {
            migrator.requireWritable();
            return events.wipe(key, clock.epochSeconds(), indexColumnsApplied());
        });
    }

    public boolean hasAssetKey(AssetKey key) throws Exception {
        return getAssetRecord(key).map(AssetKeyRecord::isPresent).orElse(false);
    }

    public Optional<AssetKeyRecord> getAssetRecord(AssetKey key) throws Exception {
        return tx.required(() -> events.findAssetKey(key, indexColumnsApplied()));
    }

    /** Keys currently present, wiped keys excluded. */
    public List<AssetKey> allAssetKeys() throws Exception {
        return tx.required(() -> events.allAssetKeys(indexColumnsApplied())).stream()
                .filter(AssetKeyRecord::isPresent)
                .map(AssetKeyRecord::assetKey)
                .toList();
    }

    public boolean hasBuiltIndex(String indexName) throws Exception {
        return backfills.hasBuiltIndex(indexName);
    }

    /** Fills the step key, asset key and partition columns of events written before they existed. */
    public BackfillSummary migrateEventLogData(boolean forceRebuildAll) throws Exception {
        requireWritable();
        return backfills.run(columnsBackfill, forceRebuildAll);
    }

    /** Rebuilds asset-key rows from historical materialization events. */
    public BackfillSummary migrateAssetKeyData(boolean forceRebuildAll) throws Exception {
        requireWritable();
        return backfills.run(assetKeyBackfill, forceRebuildAll);
    }

    private void requireWritable() throws Exception {
        tx.required(() -> {
            migrator.requireWritable();
            return null;
        });
    }

    private boolean indexColumnsApplied() throws Exception {
        return migrator.isApplied(SchemaRevisions.EVENTS_ASSET_INDEX_COLUMNS);
    }
}
