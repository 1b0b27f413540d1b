package net.tessera.core.backfill;

/** A resumable recomputation of derived data over historical rows, scanned in row-id order. */
public interface IndexBackfill {
    String indexName();

    /**
     * Processes up to {@code batchSize} rows with id greater than {@code afterRowId}. Runs inside the
     * transaction that also records progress, so must be idempotent per row.
     */
    BatchResult processBatch(long afterRowId, int batchSize) throws Exception;
}
