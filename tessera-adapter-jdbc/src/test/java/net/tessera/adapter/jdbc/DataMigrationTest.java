package net.tessera.adapter.jdbc;

import net.tessera.adapter.jdbc.migration.RunSchema;
import net.tessera.core.backfill.BackfillSummary;
import net.tessera.core.backfill.SecondaryIndexes;
import net.tessera.core.migration.SchemaRevisions;
import net.tessera.core.model.AssetKey;
import net.tessera.core.model.AssetMaterialization;
import net.tessera.core.model.EngineEvent;
import net.tessera.core.model.EventLogEntry;
import net.tessera.core.model.EventLogRow;
import net.tessera.core.model.Run;
import net.tessera.core.model.RunsFilter;
import net.tessera.core.serdes.CoreTypes;
import net.tessera.core.serdes.Serdes;
import net.tessera.core.service.EventLogStorage;
import net.tessera.core.service.RunStorage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DataMigrationTest extends TestSupport {

    final Serdes serdes = CoreTypes.serdes();

    void insertLegacyRun(Run run) throws Exception {
        update("INSERT INTO runs (run_id, job_name, status, run_body, create_timestamp, update_timestamp) "
                        + "VALUES (?, ?, ?, ?, 0, 0)",
                run.runId(), run.jobName(), run.status().code(), serdes.serialize(run));
        for (Map.Entry<String, String> t : run.tags().entrySet()) {
            update("INSERT INTO run_tags (run_id, tag_key, tag_value) VALUES (?, ?, ?)",
                    run.runId(), t.getKey(), t.getValue());
        }
    }

    long insertLegacyEvent(String runId, double ts, String json) throws Exception {
        update("INSERT INTO event_logs (run_id, event, timestamp) VALUES (?, ?, ?)", runId, json, ts);
        return ((Number) column("SELECT MAX(id) FROM event_logs").get(0)).longValue();
    }

    static List<String> ids(List<Run> runs) {
        return runs.stream().map(Run::runId).toList();
    }

    @Test
    void partitionBackfill_givesTheSameAnswersAsTagMatching() throws Exception {
        RunStorage runs = storages.runStorage();
        runs.migrator().upgrade(SchemaRevisions.RUNS_SNAPSHOTS);
        for (int i = 1; i <= 7; i++) {
            insertLegacyRun(Run.builder("r" + i, "etl").partition("daily", i % 2 == 0 ? "even" : "odd").build());
        }
        insertLegacyRun(Run.builder("plain", "etl").build());
        runs.migrator().upgrade();
        RunsFilter odd = RunsFilter.builder().partition("daily", "odd").build();

        List<String> byTags = ids(runs.queryRuns(odd, null, 0));
        assertFalse(runs.hasBuiltIndex(SecondaryIndexes.RUN_PARTITIONS));

        BackfillSummary summary = runs.migrate(false);

        assertEquals(8, summary.scanned());
        assertEquals(7, summary.updated());
        assertTrue(runs.hasBuiltIndex(SecondaryIndexes.RUN_PARTITIONS));
        assertEquals(List.of("r7", "r5", "r3", "r1"), byTags);
        assertEquals(byTags, ids(runs.queryRuns(odd, null, 0)));
        assertEquals(List.of("odd"), column("SELECT partition_key FROM runs WHERE run_id = 'r1'"));
        assertTrue(runs.migrate(false).alreadyBuilt());
    }

    @Test
    void partitionBackfill_resumesFromRecordedProgress() throws Exception {
        RunStorage runs = storages.runStorage();
        runs.migrator().upgrade(SchemaRevisions.RUNS_SNAPSHOTS);
        for (int i = 1; i <= 5; i++) insertLegacyRun(Run.builder("r" + i, "etl").partition(null, "p" + i).build());
        runs.migrator().upgrade();
        update("INSERT INTO " + RunSchema.SECONDARY_INDEX_TABLE
                + " (name, create_timestamp, migration_completed, last_row_id) VALUES (?, 0, NULL, 3)",
                SecondaryIndexes.RUN_PARTITIONS);

        BackfillSummary resumed = runs.migrate(false);

        assertEquals(2, resumed.scanned());
        assertNull(column("SELECT partition_key FROM runs WHERE run_id = 'r1'").get(0));
        assertEquals("p5", column("SELECT partition_key FROM runs WHERE run_id = 'r5'").get(0));

        BackfillSummary rebuilt = runs.migrate(true);
        assertEquals(5, rebuilt.scanned());
        assertEquals("p1", column("SELECT partition_key FROM runs WHERE run_id = 'r1'").get(0));
    }

    @Test
    void eventLogColumnsBackfill_derivesColumns_andSkipsUnreadableRows() throws Exception {
        EventLogStorage events = storages.eventLogStorage();
        events.migrator().upgrade(SchemaRevisions.EVENTS_CREATE);
        long step = insertLegacyEvent("r1", 1.0, """
                {"__class__": "EventRecord", "run_id": "r1", "timestamp": 1.0, "step_key": "extract",
                 "engine_event": {"__class__": "EngineEvent", "event_type_value": "STEP_START"}}
                """);
        long runStart = insertLegacyEvent("r1", 2.0, """
                {"__class__": "EventRecord", "run_id": "r1", "timestamp": 2.0,
                 "engine_event": {"__class__": "EngineEvent", "event_type_value": "PIPELINE_START"}}
                """);
        long broken = insertLegacyEvent("r1", 3.0, "{\"__class__\": \"NoSuchRecord\"}");
        long mat = insertLegacyEvent("r1", 4.0, """
                {"__class__": "EventRecord", "run_id": "r1", "timestamp": 4.0,
                 "engine_event": {"__class__": "EngineEvent", "event_type_value": "STEP_MATERIALIZATION",
                   "step_key": "load",
                   "event_specific_data": {"__class__": "AssetMaterialization",
                     "asset_key": {"__class__": "AssetKey", "path": ["db", "users"]}, "partition": "2024-01-01"}}}
                """);
        events.migrator().upgrade();

        BackfillSummary summary = events.migrateEventLogData(false);

        assertEquals(4, summary.scanned());
        assertEquals(1, summary.skipped());
        EventLogRow stepRow = events.getEventRow(step).orElseThrow();
        assertEquals("extract", stepRow.stepKey());
        assertEquals("STEP_START", stepRow.eventType());
        assertEquals("RUN_START", events.getEventRow(runStart).orElseThrow().eventType());
        assertNull(events.getEventRow(broken).orElseThrow().eventType());
        EventLogRow matRow = events.getEventRow(mat).orElseThrow();
        assertEquals(AssetKey.of("db", "users").toDbString(), matRow.assetKey());
        assertEquals("2024-01-01", matRow.partition());
        assertEquals("load", matRow.stepKey());
        assertTrue(events.hasBuiltIndex(SecondaryIndexes.EVENT_LOG_COLUMNS));

        assertFalse(events.hasAssetKey(AssetKey.of("db", "users")));
        events.migrateAssetKeyData(false);
        assertTrue(events.hasAssetKey(AssetKey.of("db", "users")));
        assertEquals(4.0, events.getAssetRecord(AssetKey.of("db", "users")).orElseThrow().lastMaterializationTimestamp());
    }

    @Test
    void assetKeyRebuild_doesNotResurrectWipedKeys() throws Exception {
        storages.instanceMigrations().upgrade();
        EventLogStorage events = storages.eventLogStorage();
        AssetKey users = AssetKey.of("db", "users");
        events.appendEvent(EventLogEntry.of("r1", 100.0,
                EngineEvent.materialization("etl", "load", AssetMaterialization.of(users))));
        events.wipeAsset(users);

        BackfillSummary rebuilt = events.migrateAssetKeyData(true);

        assertEquals(1, rebuilt.updated());
        assertFalse(events.hasAssetKey(users));
    }

    @Test
    void migrateData_runsEveryBackfill_onceEach() throws Exception {
        storages.instanceMigrations().upgrade();

        List<BackfillSummary> first = storages.instanceMigrations().migrateData(false);
        List<BackfillSummary> second = storages.instanceMigrations().migrateData(false);

        assertEquals(List.of(SecondaryIndexes.RUN_PARTITIONS, SecondaryIndexes.EVENT_LOG_COLUMNS,
                SecondaryIndexes.ASSET_KEY_TABLE), first.stream().map(BackfillSummary::indexName).toList());
        assertTrue(first.stream().noneMatch(BackfillSummary::alreadyBuilt));
        assertTrue(second.stream().allMatch(BackfillSummary::alreadyBuilt));
    }
}
