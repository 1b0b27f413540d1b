package net.tessera.core.service;

import net.tessera.core.backfill.BackfillSummary;
import net.tessera.core.backfill.IndexBackfill;
import net.tessera.core.backfill.IndexBackfillService;
import net.tessera.core.backfill.SecondaryIndexes;
import net.tessera.core.error.RunAlreadyExistsException;
import net.tessera.core.error.RunNotFoundException;
import net.tessera.core.migration.SchemaMigrator;
import net.tessera.core.migration.SchemaRevisions;
import net.tessera.core.model.Run;
import net.tessera.core.model.RunGroup;
import net.tessera.core.model.RunRecord;
import net.tessera.core.model.RunStatus;
import net.tessera.core.model.RunTags;
import net.tessera.core.model.RunsFilter;
import net.tessera.core.serdes.Serdes;
import net.tessera.core.serdes.SnapshotIds;
import net.tessera.core.spi.Clock;
import net.tessera.core.spi.RunRepository;
import net.tessera.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Run metadata store. Writes check the run-storage revision first; start and end times are recorded only
 * once the optional run-times migration has been applied.
 */
public final class RunStorage {
    private static final Logger log = LoggerFactory.getLogger(RunStorage.class);

    private final RunRepository runs;
    private final SchemaMigrator migrator;
    private final IndexBackfillService backfills;
    private final IndexBackfill partitionBackfill;
    private final TxRunner tx;
    private final Clock clock;
    private final Serdes serdes;

    public RunStorage(RunRepository runs,
                      SchemaMigrator migrator,
                      IndexBackfillService backfills,
                      IndexBackfill partitionBackfill,
                      TxRunner tx, Clock clock, Serdes serdes) {
        this.runs = runs;
        this.migrator = migrator;
        this.backfills = backfills;
        this.partitionBackfill = partitionBackfill;
        this.tx = tx;
        this.clock = clock;
        this.serdes = serdes;
    }

    public SchemaMigrator migrator() { return migrator; }

    public Run createRun(Run run) throws Exception {
        return tx.required(() -> {
            migrator.requireWritable();
            if (runs.exists(run.runId())) throw new RunAlreadyExistsException(run.runId());
            Run stored = withLineageTags(run);
            runs.insert(stored, clock.now());
            return stored;
        });
    }

    public Optional<Run> getRun(String runId) throws Exception {
        return getRunRecord(runId).map(RunRecord::run);
    }

    public Optional<RunRecord> getRunRecord(String runId) throws Exception {
        return tx.required(() -> runs.findRecord(runId, runTimesApplied()));
    }

    public List<Run> queryRuns(RunsFilter filter, String cursor, int limit) throws Exception {
        return getRunRecords(filter, cursor, limit).stream().map(RunRecord::run).toList();
    }

    /** Newest first; {@code limit <= 0} returns every match after the cursor. */
    public List<RunRecord> getRunRecords(RunsFilter filter, String cursor, int limit) throws Exception {
        RunsFilter f = filter == null ? RunsFilter.all() : filter;
        return tx.required(() -> {
            boolean indexed = f.hasPartition() && backfills.hasBuiltIndex(SecondaryIndexes.RUN_PARTITIONS);
            return runs.query(f, cursor, limit, indexed, runTimesApplied());
        });
    }

    /**
     * Applies the new status. Transitions outside the engine's forward order are logged and still applied.
     *
     * @throws RunNotFoundException when no run has this id
     */
    public Run updateRunStatus(String runId, RunStatus status) throws Exception {
        return tx.required(() -> {
            migrator.requireWritable();
            boolean runTimes = runTimesApplied();
            RunRecord record = runs.findRecord(runId, runTimes).orElseThrow(() -> new RunNotFoundException(runId));
            RunStatus current = record.run().status();
            if (!current.canTransitionTo(status)) {
                log.warn("Run {} moved from {} to {} out of order", runId, current, status);
            }
            Run updated = record.run().withStatus(status);
            runs.update(updated, clock.now());
            if (runTimes) {
                if (status == RunStatus.STARTED && record.startTime() == null) {
                    runs.setStartTime(runId, clock.epochSeconds());
                }
                if (status.isTerminal() && record.endTime() == null) {
                    runs.setEndTime(runId, clock.epochSeconds());
                }
            }
            return updated;
        });
    }

    public Run addRunTags(String runId, Map<String, String> tags) throws Exception {
        return tx.required(() -> {
            migrator.requireWritable();
            Run run = runs.findRecord(runId, false).map(RunRecord::run)
                    .orElseThrow(() -> new RunNotFoundException(runId));
            Run updated = run.withTags(tags);
            runs.update(updated, clock.now());
            return updated;
        });
    }

    /** The root of the run's retry lineage followed by its descendants, newest first. */
    public Optional<RunGroup> getRunGroup(String runId) throws Exception {
        return tx.required(() -> {
            Optional<Run> run = runs.findRecord(runId, false).map(RunRecord::run);
            if (run.isEmpty()) return Optional.empty();
            String root = run.get().rootRunId() != null ? run.get().rootRunId() : runId;
            List<Run> members = new ArrayList<>();
            runs.findRecord(root, false).map(RunRecord::run).ifPresent(members::add);
            RunsFilter descendants = RunsFilter.builder().tag(RunTags.ROOT_RUN_ID, root).build();
            for (RunRecord r : runs.query(descendants, null, 0, false, false)) members.add(r.run());
            return Optional.of(new RunGroup(root, members));
        });
    }

    public List<String> getRunIds() throws Exception {
        return tx.required(runs::runIds);
    }

    /** Stores an immutable definition blob under its content id; storing it again is a no-op. */
    public String addSnapshot(Object snapshot) throws Exception {
        String id = SnapshotIds.create(serdes, snapshot);
        tx.required(() -> {
            migrator.requireWritable();
            if (!runs.hasSnapshot(id)) {
                runs.insertSnapshot(id, snapshot.getClass().getSimpleName(), serdes.serialize(snapshot), clock.now());
            }
            return null;
        });
        return id;
    }

    public boolean hasSnapshot(String snapshotId) throws Exception {
        return tx.required(() -> runs.hasSnapshot(snapshotId));
    }

    public Optional<Object> getSnapshot(String snapshotId) throws Exception {
        return tx.required(() -> runs.findSnapshotBody(snapshotId)).map(serdes::deserialize);
    }

    public boolean hasBuiltIndex(String indexName) throws Exception {
        return backfills.hasBuiltIndex(indexName);
    }

    /** Builds the partition columns from tags; {@code forceRebuildAll} recomputes every row. */
    public BackfillSummary migrate(boolean forceRebuildAll) throws Exception {
        tx.required(() -> {
            migrator.requireWritable();
            return null;
        });
        return backfills.run(partitionBackfill, forceRebuildAll);
    }

    private boolean runTimesApplied() throws Exception {
        return migrator.isApplied(SchemaRevisions.RUNS_START_END_TIMES);
    }

    private static Run withLineageTags(Run run) {
        if (run.rootRunId() == null && run.parentRunId() == null) return run;
        Map<String, String> lineage = new LinkedHashMap<>();
        if (run.rootRunId() != null) lineage.put(RunTags.ROOT_RUN_ID, run.rootRunId());
        if (run.parentRunId() != null) lineage.put(RunTags.PARENT_RUN_ID, run.parentRunId());
        return run.withTags(lineage);
    }
}
