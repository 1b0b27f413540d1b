package net.tessera.core.backfill;

/**
 * Outcome of one backfill batch. {@code lastRowId} is the highest row id scanned, the resume point
 * of the next batch.
 */
public record BatchResult(long lastRowId, int scanned, int updated, int skipped) {
    public static BatchResult empty(long afterRowId) {
        return new BatchResult(afterRowId, 0, 0, 0);
    }
}
