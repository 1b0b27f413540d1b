package net.tessera.adapter.jdbc;

import net.tessera.core.error.RunAlreadyExistsException;
import net.tessera.core.error.RunNotFoundException;
import net.tessera.core.error.SchemaMismatchException;
import net.tessera.core.migration.SchemaRevisions;
import net.tessera.core.model.Run;
import net.tessera.core.model.RunGroup;
import net.tessera.core.model.RunRecord;
import net.tessera.core.model.RunStatus;
import net.tessera.core.model.RunTags;
import net.tessera.core.model.RunsFilter;
import net.tessera.core.service.RunStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunStorageTest extends TestSupport {

    RunStorage runs;

    @BeforeEach
    void init() {
        runs = storages.runStorage();
    }

    static List<String> ids(List<Run> runs) {
        return runs.stream().map(Run::runId).toList();
    }

    @Test
    void writes_requireAMigratedSchema() {
        SchemaMismatchException e = assertThrows(SchemaMismatchException.class,
                () -> runs.createRun(Run.builder("r1", "etl").build()));
        assertTrue(e.getMessage().contains("run storage"));
    }

    @Test
    void createRun_thenRead_andRejectDuplicates() throws Exception {
        storages.instanceMigrations().upgrade();
        Run run = Run.builder("r1", "etl").tag("team", "data").runConfig(Map.of("retries", 2)).build();

        runs.createRun(run);

        assertEquals(run, runs.getRun("r1").orElseThrow());
        RunRecord record = runs.getRunRecord("r1").orElseThrow();
        assertEquals(clock.now(), record.createTimestamp());
        assertTrue(runs.getRun("missing").isEmpty());
        assertThrows(RunAlreadyExistsException.class, () -> runs.createRun(run));
        assertEquals(List.of("r1"), runs.getRunIds());
    }

    @Test
    void queryRuns_filtersNewestFirst_withCursorAndLimit() throws Exception {
        storages.instanceMigrations().upgrade();
        runs.createRun(Run.builder("a", "etl").tag("env", "prod").build());
        runs.createRun(Run.builder("b", "report").build());
        runs.createRun(Run.builder("c", "etl").status(RunStatus.SUCCESS).tag("env", "dev").build());
        runs.createRun(Run.builder("d", "etl").tag("env", "prod").build());

        assertEquals(List.of("d", "c", "b", "a"), ids(runs.queryRuns(RunsFilter.all(), null, 0)));
        assertEquals(List.of("d", "c", "a"), ids(runs.queryRuns(RunsFilter.builder().jobName("etl").build(), null, 0)));
        assertEquals(List.of("d", "a"), ids(runs.queryRuns(RunsFilter.builder().tag("env", "prod").build(), null, 0)));
        assertEquals(List.of("c"), ids(runs.queryRuns(
                RunsFilter.builder().statuses(RunStatus.SUCCESS, RunStatus.FAILURE).build(), null, 0)));
        assertEquals(List.of("b", "a"), ids(runs.queryRuns(RunsFilter.all(), "c", 0)));
        assertEquals(List.of("d", "c"), ids(runs.queryRuns(RunsFilter.all(), null, 2)));
        assertEquals(List.of("a", "c"), ids(runs.queryRuns(RunsFilter.builder().runIds(List.of("a", "c")).build(), "d", 0))
                .stream().sorted().toList());
    }

    @Test
    void unknownCursor_yieldsEmptyPage() throws Exception {
        storages.instanceMigrations().upgrade();
        runs.createRun(Run.builder("a", "etl").build());
        assertEquals(List.of(), runs.queryRuns(RunsFilter.all(), "nope", 0));
    }

    @Test
    void updateRunStatus_recordsStartAndEndTimes_once() throws Exception {
        storages.instanceMigrations().upgrade();
        runs.createRun(Run.builder("r1", "etl").build());
        double started = clock.epochSeconds();

        runs.updateRunStatus("r1", RunStatus.STARTED);
        clock.advanceSeconds(30);
        runs.updateRunStatus("r1", RunStatus.STARTED);
        runs.updateRunStatus("r1", RunStatus.SUCCESS);
        clock.advanceSeconds(30);
        runs.updateRunStatus("r1", RunStatus.FAILURE);

        RunRecord record = runs.getRunRecord("r1").orElseThrow();
        assertEquals(RunStatus.FAILURE, record.run().status());
        assertEquals(started, record.startTime());
        assertEquals(started + 30, record.endTime());
        assertEquals(List.of("r1"), ids(runs.queryRuns(RunsFilter.builder().statuses(RunStatus.FAILURE).build(), null, 0)));
    }

    @Test
    void withoutOptionalRunTimesMigration_storageStaysWritable_andTimesAreNull() throws Exception {
        runs.migrator().upgrade(SchemaRevisions.RUNS_PARTITIONS);
        runs.createRun(Run.builder("r1", "etl").build());

        runs.updateRunStatus("r1", RunStatus.STARTED);

        RunRecord record = runs.getRunRecord("r1").orElseThrow();
        assertEquals(RunStatus.STARTED, record.run().status());
        assertNull(record.startTime());
        assertFalse(hasColumn("runs", "start_time"));
    }

    @Test
    void updateRunStatus_ofUnknownRun_fails() throws Exception {
        storages.instanceMigrations().upgrade();
        assertThrows(RunNotFoundException.class, () -> runs.updateRunStatus("nope", RunStatus.STARTED));
    }

    @Test
    void addRunTags_mergesAndIsQueryable() throws Exception {
        storages.instanceMigrations().upgrade();
        runs.createRun(Run.builder("r1", "etl").tag("a", "1").build());

        Run updated = runs.addRunTags("r1", Map.of("a", "2", "b", "3"));

        assertEquals(Map.of("a", "2", "b", "3"), updated.tags());
        assertEquals(List.of("r1"), ids(runs.queryRuns(RunsFilter.builder().tag("a", "2").build(), null, 0)));
        assertEquals(List.of(), runs.queryRuns(RunsFilter.builder().tag("a", "1").build(), null, 0));
    }

    @Test
    void runGroup_collectsRootAndRetries() throws Exception {
        storages.instanceMigrations().upgrade();
        runs.createRun(Run.builder("root", "etl").build());
        runs.createRun(Run.builder("retry1", "etl").parent("root", null).build());
        runs.createRun(Run.builder("retry2", "etl").parent("retry1", "root").build());
        runs.createRun(Run.builder("other", "etl").build());

        RunGroup group = runs.getRunGroup("retry2").orElseThrow();

        assertEquals("root", group.rootRunId());
        assertEquals(List.of("root", "retry2", "retry1"), ids(group.runs()));
        assertEquals("retry1", runs.getRun("retry2").orElseThrow().tags().get(RunTags.PARENT_RUN_ID));
        assertEquals(List.of("root", "retry2", "retry1"), ids(runs.getRunGroup("root").orElseThrow().runs()));
        assertTrue(runs.getRunGroup("missing").isEmpty());
    }

    @Test
    void snapshots_areContentAddressed_andStoredOnce() throws Exception {
        storages.instanceMigrations().upgrade();
        Map<String, Object> definition = Map.of("ops", List.of("extract", "load"));

        String id = runs.addSnapshot(definition);

        assertEquals(id, runs.addSnapshot(Map.of("ops", List.of("extract", "load"))));
        assertTrue(runs.hasSnapshot(id));
        assertEquals(definition, runs.getSnapshot(id).orElseThrow());
        assertEquals(List.of(1L), column("SELECT COUNT(*) FROM snapshots").stream().map(o -> ((Number) o).longValue()).toList());

        runs.createRun(Run.builder("r1", "etl").jobSnapshotId(id).build());
        assertEquals(List.of("r1"), ids(runs.queryRuns(RunsFilter.builder().snapshotId(id).build(), null, 0)));
    }

    @Test
    void partitionFilter_matchesTagsBeforeAndAfterIndexing() throws Exception {
        storages.instanceMigrations().upgrade();
        runs.createRun(Run.builder("p1", "etl").partition("daily", "2024-01-01").build());
        runs.createRun(Run.builder("p2", "etl").partition("daily", "2024-01-02").build());
        runs.createRun(Run.builder("p3", "etl").partition("hourly", "2024-01-01").build());
        RunsFilter filter = RunsFilter.builder().partition("daily", "2024-01-01").build();

        List<String> byTags = ids(runs.queryRuns(filter, null, 0));
        runs.migrate(false);
        List<String> byColumns = ids(runs.queryRuns(filter, null, 0));

        assertEquals(List.of("p1"), byTags);
        assertEquals(byTags, byColumns);
        assertEquals(List.of("p3", "p1"), ids(runs.queryRuns(RunsFilter.builder().partition(null, "2024-01-01").build(), null, 0)));
    }
}
