package net.tessera.core.backfill;

import net.tessera.core.spi.Clock;
import net.tessera.core.spi.SecondaryIndexRepository;
import net.tessera.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Drives {@link IndexBackfill}s batch by batch. Each batch commits together with its progress row, so an
 * interrupted run resumes after the last committed row. Concurrent runs of the same backfill are not
 * coordinated; they only repeat idempotent work.
 */
public final class IndexBackfillService {
    private static final Logger log = LoggerFactory.getLogger(IndexBackfillService.class);

    private final TxRunner tx;
    private final SecondaryIndexRepository indexes;
    private final Clock clock;
    private final int batchSize;

    public IndexBackfillService(TxRunner tx, SecondaryIndexRepository indexes, Clock clock, int batchSize) {
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        this.tx = tx;
        this.indexes = indexes;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    public boolean hasBuiltIndex(String name) throws Exception {
        return tx.required(() -> indexes.find(name).map(SecondaryIndexState::isBuilt).orElse(false));
    }

    public Optional<SecondaryIndexState> state(String name) throws Exception {
        return tx.required(() -> indexes.find(name));
    }

    public BackfillSummary run(IndexBackfill backfill, boolean forceRebuildAll) throws Exception {
        String name = backfill.indexName();
        Optional<SecondaryIndexState> existing = state(name);
        if (existing.map(SecondaryIndexState::isBuilt).orElse(false) && !forceRebuildAll) {
            log.debug("Index {} already built", name);
            return BackfillSummary.alreadyBuilt(name);
        }
        long after = 0L;
        if (forceRebuildAll) {
            tx.requiresNew(() -> {
                indexes.reset(name);
                return null;
            });
        } else if (existing.isPresent()) {
            after = existing.get().lastRowId();
            if (after > 0) log.info("Resuming backfill {} after row {}", name, after);
        }

        int batches = 0;
        long scanned = 0, updated = 0, skipped = 0;
        while (true) {
            final long from = after;
            BatchResult r = tx.requiresNew(() -> {
                BatchResult batch = backfill.processBatch(from, batchSize);
                if (batch.scanned() > 0) indexes.upsertProgress(name, batch.lastRowId(), clock.now());
                return batch;
            });
            if (r.scanned() == 0) break;
            batches++;
            scanned += r.scanned();
            updated += r.updated();
            skipped += r.skipped();
            after = r.lastRowId();
            log.debug("Backfill {} batch {}: scanned={} updated={} skipped={} lastRowId={}",
                    name, batches, r.scanned(), r.updated(), r.skipped(), after);
            if (r.scanned() < batchSize) break;
        }
        tx.requiresNew(() -> {
            indexes.markCompleted(name, clock.now());
            return null;
        });
        log.info("Backfill {} complete: batches={} scanned={} updated={} skipped={}",
                name, batches, scanned, updated, skipped);
        return new BackfillSummary(name, batches, scanned, updated, skipped, false);
    }
}
