package net.tessera.core.backfill;

public record BackfillSummary(String indexName, int batches, long scanned, long updated, long skipped,
                              boolean alreadyBuilt) {
    public static BackfillSummary alreadyBuilt(String indexName) {
        return new BackfillSummary(indexName, 0, 0, 0, 0, true);
    }
}
