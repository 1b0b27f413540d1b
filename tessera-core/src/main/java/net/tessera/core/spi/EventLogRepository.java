package net.tessera.core.spi;

import net.tessera.core.model.AssetKey;
import net.tessera.core.model.AssetKeyRecord;
import net.tessera.core.model.EventLogEntry;
import net.tessera.core.model.EventLogRecord;
import net.tessera.core.model.EventLogRow;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Event rows and asset-key rows. {@code indexColumns} tells the asset methods whether the optional
 * asset-index-columns migration has been applied; without it an asset row only records existence.
 */
public interface EventLogRepository {
    /** Stores the payload and its derived columns; returns the new log id. */
    long append(EventLogEntry entry) throws Exception;

    /** Entries with {@code log_id > afterLogId}, ascending. */
    List<EventLogRecord> findByRun(String runId, long afterLogId, int limit) throws Exception;

    Optional<EventLogRow> findRow(long logId) throws Exception;

    Map<String, Long> countByType(String runId) throws Exception;

    List<String> runIds() throws Exception;

    void upsertMaterialization(AssetKey key, String runId, double timestamp, Map<String, String> tags,
                               boolean indexColumns) throws Exception;

    /** Returns false when the key was never recorded. */
    boolean wipe(AssetKey key, double timestamp, boolean indexColumns) throws Exception;

    Optional<AssetKeyRecord> findAssetKey(AssetKey key, boolean indexColumns) throws Exception;

    List<AssetKeyRecord> allAssetKeys(boolean indexColumns) throws Exception;
}
