package net.tessera.core.serdes;

import net.tessera.core.error.SerializationException;
import net.tessera.core.model.AssetKey;
import net.tessera.core.model.AssetMaterialization;
import net.tessera.core.model.EngineEvent;
import net.tessera.core.model.EventLogEntry;
import net.tessera.core.model.EventType;
import net.tessera.core.model.InstigatorState;
import net.tessera.core.model.InstigatorStatus;
import net.tessera.core.model.InstigatorType;
import net.tessera.core.model.Run;
import net.tessera.core.model.RunBundle;
import net.tessera.core.model.RunStatus;
import net.tessera.core.model.ScheduleInstigatorData;
import net.tessera.core.model.SensorInstigatorData;
import net.tessera.core.model.SerializableErrorInfo;
import net.tessera.core.model.TickData;
import net.tessera.core.model.TickStatus;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SerdesTest {

    final Serdes serdes = CoreTypes.serdes();

    @Test
    void serialize_isCanonical_classTagFirst_thenSortedKeys() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("z", 1);
        config.put("a", "x");
        Run run = Run.builder("r1", "etl").runConfig(config).build();

        String json = serdes.serialize(run);

        assertTrue(json.startsWith("{\"__class__\":\"Run\""), json);
        assertTrue(json.indexOf("\"job_name\"") < json.indexOf("\"run_config\""));
        assertTrue(json.contains("\"run_config\":{\"a\":\"x\",\"z\":1}"), json);
        assertTrue(json.contains("\"status\":{\"__enum__\":\"RunStatus.NOT_STARTED\"}"), json);
        assertEquals(json, serdes.serialize(serdes.deserialize(json)));
    }

    @Test
    void setsAreEncodedInStableOrder() {
        Run a = Run.builder("r1", "etl").assetSelection(Set.of(AssetKey.of("b"), AssetKey.of("a"))).build();
        Run b = Run.builder("r1", "etl").assetSelection(Set.of(AssetKey.of("a"), AssetKey.of("b"))).build();

        assertEquals(serdes.serialize(a), serdes.serialize(b));
        assertEquals(a, serdes.deserialize(serdes.serialize(a), Run.class));
    }

    @Test
    void legacyRunPayload_decodesWithRenamedFields() {
        String legacy = """
                {"__class__": "PipelineRun", "run_id": "r9", "pipeline_name": "old_job",
                 "status": {"__enum__": "PipelineRunStatus.SUCCESS"}, "solid_selection": ["a", "b"],
                 "tags": {"k": "v"}}
                """;

        Run run = serdes.deserialize(legacy, Run.class);

        assertEquals("old_job", run.jobName());
        assertEquals(RunStatus.SUCCESS, run.status());
        assertEquals(List.of("a", "b"), run.opSelection());
        assertEquals(Map.of("k", "v"), run.tags());
        assertEquals(Map.of(), run.runConfig());
    }

    @Test
    void renamedField_currentNameWinsOverLegacyName() {
        String both = """
                {"__class__": "Run", "run_id": "r1", "pipeline_name": "old", "job_name": "new"}
                """;
        assertEquals("new", serdes.deserialize(both, Run.class).jobName());
    }

    @Test
    void missingRequiredField_isRejected() {
        SerializationException e = assertThrows(SerializationException.class,
                () -> serdes.deserialize("{\"__class__\": \"Run\", \"job_name\": \"etl\"}"));
        assertTrue(e.getMessage().contains("run_id"), e.getMessage());
    }

    @Test
    void unknownTag_failsByDefault_andFallsBackWhenEnabled() {
        String json = "{\"__class__\": \"FutureThing\", \"x\": 1}";
        assertThrows(SerializationException.class, () -> serdes.deserialize(json));

        Serdes lenient = new Serdes(CoreTypes.builder().fallbackToUnknown().build());
        Object value = lenient.deserialize(json);
        UnknownValue unknown = assertInstanceOf(UnknownValue.class, value);
        assertEquals("FutureThing", unknown.tag());
        assertEquals("{\"__class__\":\"FutureThing\",\"x\":1}", lenient.serialize(unknown));
    }

    @Test
    void unknownEnumValue_isRejected() {
        assertThrows(SerializationException.class,
                () -> serdes.deserialize("{\"__enum__\": \"RunStatus.EXPLODED\"}"));
    }

    @Test
    void reservedMapKeys_areRejectedOnWrite() {
        Run run = Run.builder("r1", "etl").runConfig(Map.of("__class__", "sneaky")).build();
        assertThrows(SerializationException.class, () -> serdes.serialize(run));
    }

    @Test
    void malformedJson_isSerializationException() {
        assertThrows(SerializationException.class, () -> serdes.deserialize("{not json"));
    }

    @Test
    void legacyEventRecord_mapsOldEventTypeNames() {
        String legacy = """
                {"__class__": "EventRecord", "run_id": "r1", "timestamp": 1700000000, "user_message": "hi",
                 "engine_event": {"__class__": "EngineEvent", "event_type_value": "PIPELINE_SUCCESS",
                                  "pipeline_name": "etl"}}
                """;

        EventLogEntry entry = serdes.deserialize(legacy, EventLogEntry.class);

        assertEquals(EventType.RUN_SUCCESS, entry.eventType());
        assertEquals("etl", entry.event().jobName());
        assertEquals("hi", entry.message());
        assertEquals(EventLogEntry.INFO, entry.level());
        assertEquals(1_700_000_000d, entry.timestamp());
    }

    @Test
    void materializationEvent_keepsTypedPayload() {
        AssetMaterialization m = new AssetMaterialization(AssetKey.of("db", "users"), "2024-01-01",
                Map.of("owner", "data"), null);
        EventLogEntry entry = EventLogEntry.of("r1", 12.5, EngineEvent.materialization("etl", "load", m));

        EventLogEntry decoded = serdes.deserialize(serdes.serialize(entry), EventLogEntry.class);

        assertEquals(m, decoded.assetMaterialization().orElseThrow());
        assertEquals("load", decoded.resolvedStepKey());
    }

    @Test
    void legacyJobState_decodesAsInstigatorState() {
        String legacy = """
                {"__class__": "JobState", "job_origin_id": "o1", "job_name": "sensor_a",
                 "job_type": {"__enum__": "JobType.SENSOR"}, "status": {"__enum__": "JobStatus.ENDED"},
                 "job_specific_data": {"__class__": "SensorJobData", "min_interval": 30}}
                """;

        InstigatorState state = serdes.deserialize(legacy, InstigatorState.class);

        assertEquals("o1", state.originId());
        assertEquals("sensor_a", state.instigatorName());
        assertEquals(InstigatorType.SENSOR, state.instigatorType());
        assertEquals(InstigatorStatus.STOPPED, state.status());
        assertEquals(new SensorInstigatorData(null, null, 30, null), state.instigatorData());
    }

    @Test
    void legacyTerminalTick_withoutEndTimestamp_endsWhenItStarted() {
        String legacy = """
                {"__class__": "JobTickData", "job_origin_id": "o1", "job_name": "s",
                 "job_type": {"__enum__": "JobType.SCHEDULE"}, "status": {"__enum__": "JobTickStatus.SUCCESS"},
                 "timestamp": 100.5, "run_ids": ["r1"]}
                """;

        TickData tick = serdes.deserialize(legacy, TickData.class);

        assertEquals(TickStatus.SUCCESS, tick.status());
        assertEquals(100.5, tick.endTimestamp());
        assertEquals(List.of("r1"), tick.runIds());
    }

    @Test
    void emptyTickRunLists_areOmitted() {
        TickData tick = TickData.started("o1", "s", InstigatorType.SENSOR, 1.0);
        String json = serdes.serialize(tick);

        assertFalse(json.contains("run_ids"), json);
        assertEquals(tick, serdes.deserialize(json, TickData.class));
    }

    @Test
    void numbers_decodeAsLongOrDouble() {
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) serdes.deserialize("{\"i\": 1, \"l\": 10000000000, \"d\": 1.5}");
        assertEquals(1L, map.get("i"));
        assertEquals(10_000_000_000L, map.get("l"));
        assertEquals(1.5, map.get("d"));
    }

    @Test
    void runConfigNumbers_roundTripWhateverTheirBoxedType() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("int", 3);
        config.put("long", 3L);
        config.put("float", 0.5f);
        config.put("nested", List.of(1, Map.of("depth", (short) 2)));
        Run run = Run.builder("r1", "etl").runConfig(config).build();

        Run decoded = serdes.deserialize(serdes.serialize(run), Run.class);

        assertEquals(run, decoded);
        assertEquals(3L, decoded.runConfig().get("int"));
        assertEquals(0.5, decoded.runConfig().get("float"));
        assertEquals(List.of(1L, Map.of("depth", 2L)), decoded.runConfig().get("nested"));
    }

    @Test
    void everyModelType_survivesEncodeThenDecode() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("retries", 3);
        config.put("max_rows", 10_000_000_000L);
        config.put("ratio", 0.25);
        config.put("ops", Map.of("load", Map.of("config", List.of("a", "b"))));
        config.put("labels", Set.of("x"));
        Run run = Run.builder("r2", "etl")
                .status(RunStatus.STARTED)
                .runConfig(config)
                .tag("owner", "data")
                .partition("daily", "2024-01-01")
                .parent("r1", null)
                .jobSnapshotId("job-snap")
                .executionPlanSnapshotId("plan-snap")
                .opSelection(List.of("extract", "load"))
                .stepKeysToExecute(List.of("load"))
                .assetSelection(Set.of(AssetKey.of("db", "users"), AssetKey.of("db", "orders")))
                .build();

        InstigatorState schedule = new InstigatorState("o1", "nightly", InstigatorType.SCHEDULE,
                InstigatorStatus.RUNNING, new ScheduleInstigatorData("0 2 * * *", 1_700_000_000.0, "UTC"));
        InstigatorState sensor = new InstigatorState("o2", "watcher", InstigatorType.SENSOR,
                InstigatorStatus.STOPPED, new SensorInstigatorData(12.5, "key-1", 30, "cursor-1"));

        SerializableErrorInfo error = new SerializableErrorInfo("load failed", "java.lang.IllegalStateException",
                List.of("at Load.run(Load.java:10)"),
                new SerializableErrorInfo("connection reset", "java.io.IOException", List.of(), null));
        TickData failed = TickData.started("o1", "nightly", InstigatorType.SCHEDULE, 100.0)
                .withRun("r2", "k2")
                .withCursor("c2")
                .fail(error, 101.5);
        TickData skipped = TickData.started("o2", "watcher", InstigatorType.SENSOR, 200.0).skip("no new files", 200.5);

        AssetMaterialization materialization = new AssetMaterialization(AssetKey.of("db", "users"), "2024-01-01",
                Map.of("rows", "10"), "daily load");
        RunBundle bundle = new RunBundle(run, List.of(
                EventLogEntry.of("r2", 10.0, EngineEvent.of(EventType.RUN_START, "etl")),
                EventLogEntry.of("r2", 11.0, EngineEvent.step(EventType.STEP_START, "etl", "load")),
                EventLogEntry.of("r2", 12.0, EngineEvent.materialization("etl", "load", materialization)),
                EventLogEntry.logMessage("r2", 13.0, EventLogEntry.INFO, "done")));

        assertEquals(run, serdes.deserialize(serdes.serialize(run), Run.class));
        assertEquals(schedule, serdes.deserialize(serdes.serialize(schedule), InstigatorState.class));
        assertEquals(sensor, serdes.deserialize(serdes.serialize(sensor), InstigatorState.class));
        assertEquals(error, serdes.deserialize(serdes.serialize(error), SerializableErrorInfo.class));
        assertEquals(failed, serdes.deserialize(serdes.serialize(failed), TickData.class));
        assertEquals(skipped, serdes.deserialize(serdes.serialize(skipped), TickData.class));
        assertEquals(bundle, serdes.deserialize(serdes.serialize(bundle), RunBundle.class));
        assertEquals(10_000_000_000L, run.runConfig().get("max_rows"));
        assertEquals(3L, run.runConfig().get("retries"));
    }

    @Test
    void snapshotId_dependsOnContentOnly() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("x", 1);
        a.put("y", 2);
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("y", 2);
        b.put("x", 1);

        assertEquals(SnapshotIds.create(serdes, a), SnapshotIds.create(serdes, b));
        assertNotEquals(SnapshotIds.create(serdes, a), SnapshotIds.create(serdes, Map.of("x", 1)));
        assertEquals(40, SnapshotIds.create(serdes, a).length());
    }
}
