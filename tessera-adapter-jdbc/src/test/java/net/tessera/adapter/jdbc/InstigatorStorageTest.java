package net.tessera.adapter.jdbc;

import net.tessera.core.error.InstigatorNotFoundException;
import net.tessera.core.error.InvariantViolationException;
import net.tessera.core.error.MalformedRecordException;
import net.tessera.core.error.TickNotFoundException;
import net.tessera.core.migration.SchemaRevisions;
import net.tessera.core.model.InstigatorState;
import net.tessera.core.model.InstigatorStatus;
import net.tessera.core.model.InstigatorTick;
import net.tessera.core.model.InstigatorType;
import net.tessera.core.model.ScheduleInstigatorData;
import net.tessera.core.model.SensorInstigatorData;
import net.tessera.core.model.TickData;
import net.tessera.core.model.TickStatus;
import net.tessera.core.service.InstigatorStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InstigatorStorageTest extends TestSupport {

    InstigatorStorage instigators;

    @BeforeEach
    void init() {
        instigators = storages.instigatorStorage();
    }

    static InstigatorState sensor(String originId) {
        return new InstigatorState(originId, "sensor_" + originId, InstigatorType.SENSOR, InstigatorStatus.RUNNING,
                new SensorInstigatorData(null, null, 30, null));
    }

    @Test
    void instigatorState_lifecycle() throws Exception {
        storages.instanceMigrations().upgrade();
        InstigatorState state = sensor("s1");

        instigators.addInstigatorState(state);
        assertThrows(InvariantViolationException.class, () -> instigators.addInstigatorState(state));

        InstigatorState moved = state.withData(((SensorInstigatorData) state.instigatorData()).withCursor("42"))
                .withStatus(InstigatorStatus.STOPPED);
        instigators.updateInstigatorState(moved);
        assertEquals(moved, instigators.getInstigatorState("s1").orElseThrow());
        assertEquals(List.of(moved), instigators.allInstigatorState());

        assertThrows(InstigatorNotFoundException.class, () -> instigators.updateInstigatorState(sensor("ghost")));
        assertTrue(instigators.deleteInstigatorState("s1"));
        assertFalse(instigators.deleteInstigatorState("s1"));
        assertTrue(instigators.getInstigatorState("s1").isEmpty());
    }

    @Test
    void ticks_moveFromStartedToATerminalStatus_once() throws Exception {
        storages.instanceMigrations().upgrade();
        InstigatorTick tick = instigators.createTick(TickData.started("s1", "sensor", InstigatorType.SENSOR, 10.0));

        InstigatorTick withRun = instigators.updateTick(tick.withData(tick.tickData().withRun("run-1", "key-1")));
        InstigatorTick done = instigators.updateTick(withRun.withData(withRun.tickData().succeed(12.0)));

        InstigatorTick stored = instigators.getTick(tick.tickId()).orElseThrow();
        assertEquals(TickStatus.SUCCESS, stored.status());
        assertEquals(12.0, stored.endTimestamp());
        assertEquals(List.of("run-1"), stored.tickData().runIds());
        assertEquals(done, stored);

        assertDoesNotThrow(() -> instigators.updateTick(stored));
        TickData rewritten = new TickData("s1", "sensor", InstigatorType.SENSOR, TickStatus.FAILURE, 10.0, 13.0,
                null, null, null, null, null);
        assertThrows(InvariantViolationException.class, () -> instigators.updateTick(stored.withData(rewritten)));
    }

    @Test
    void openTick_cannotChangeOriginOrStart() throws Exception {
        storages.instanceMigrations().upgrade();
        InstigatorTick tick = instigators.createTick(TickData.started("s1", "sensor", InstigatorType.SENSOR, 10.0));

        InstigatorTick moved = tick.withData(TickData.started("s1", "sensor", InstigatorType.SENSOR, 11.0));
        assertThrows(InvariantViolationException.class, () -> instigators.updateTick(moved));
        assertThrows(TickNotFoundException.class, () -> instigators.updateTick(new InstigatorTick(999, tick.tickData())));
    }

    @Test
    void getTicks_pagesNewestFirst() throws Exception {
        storages.instanceMigrations().upgrade();
        for (int i = 0; i < 5; i++) {
            instigators.createTick(TickData.started("s1", "sensor", InstigatorType.SENSOR, i));
        }
        instigators.createTick(TickData.started("s2", "other", InstigatorType.SENSOR, 100));

        List<InstigatorTick> newest = instigators.getTicks("s1", null, 2);
        assertEquals(List.of(4.0, 3.0), newest.stream().map(InstigatorTick::timestamp).toList());
        List<InstigatorTick> next = instigators.getTicks("s1", newest.get(1).tickId(), 0);
        assertEquals(List.of(2.0, 1.0, 0.0), next.stream().map(InstigatorTick::timestamp).toList());
        assertEquals(4.0, instigators.getLatestTick("s1").orElseThrow().timestamp());
        assertTrue(instigators.getLatestTick("none").isEmpty());
    }

    @Test
    void unification_mergesLegacyTables_typedBySource() throws Exception {
        instigators.migrator().upgrade(SchemaRevisions.INSTIGATORS_JOBS);
        update("INSERT INTO schedules (schedule_origin_id, schedule_body, create_timestamp, update_timestamp) "
                + "VALUES ('sched-1', ?, 1, 1)", """
                {"__class__": "ScheduleState", "schedule_origin_id": "sched-1", "schedule_name": "nightly",
                 "status": {"__enum__": "ScheduleStatus.RUNNING"}}
                """);
        update("INSERT INTO schedules (schedule_origin_id, schedule_body, create_timestamp, update_timestamp) "
                + "VALUES ('both', ?, 1, 1)", """
                {"__class__": "ScheduleState", "schedule_origin_id": "both", "schedule_name": "dup",
                 "status": {"__enum__": "ScheduleStatus.STOPPED"}}
                """);
        update("INSERT INTO jobs (job_origin_id, status, job_type, job_body, create_timestamp, update_timestamp) "
                + "VALUES ('both', 'RUNNING', NULL, ?, 2, 2)", """
                {"__class__": "JobState", "job_origin_id": "both", "job_name": "dup_sensor",
                 "status": {"__enum__": "JobStatus.RUNNING"},
                 "job_specific_data": {"__class__": "SensorJobData", "min_interval": 60}}
                """);
        update("INSERT INTO schedule_ticks (schedule_origin_id, status, timestamp, tick_body, create_timestamp, "
                + "update_timestamp) VALUES ('sched-1', 'SUCCESS', 5.0, ?, 1, 1)", """
                {"__class__": "JobTickData", "job_origin_id": "sched-1", "job_name": "nightly",
                 "job_type": {"__enum__": "JobType.SCHEDULE"}, "status": {"__enum__": "JobTickStatus.SUCCESS"},
                 "timestamp": 5.0, "run_ids": ["r1"]}
                """);
        update("INSERT INTO job_ticks (job_origin_id, status, type, timestamp, tick_body, create_timestamp, "
                + "update_timestamp) VALUES ('both', 'STARTED', 'SENSOR', 7.0, ?, 1, 1)", """
                {"__class__": "JobTickData", "job_origin_id": "both", "job_name": "dup_sensor",
                 "job_type": {"__enum__": "JobType.SENSOR"}, "status": {"__enum__": "JobTickStatus.STARTED"},
                 "timestamp": 7.0}
                """);

        instigators.migrator().upgrade();

        assertFalse(hasTable("schedules"));
        assertFalse(hasTable("job_ticks"));
        InstigatorState sched = instigators.getInstigatorState("sched-1").orElseThrow();
        assertEquals(InstigatorType.SCHEDULE, sched.instigatorType());
        assertEquals("nightly", sched.instigatorName());
        InstigatorState both = instigators.getInstigatorState("both").orElseThrow();
        assertEquals(InstigatorType.SENSOR, both.instigatorType());
        assertEquals(InstigatorStatus.RUNNING, both.status());
        assertEquals(new SensorInstigatorData(null, null, 60, null), both.instigatorData());
        assertEquals(2, instigators.allInstigatorState().size());

        InstigatorTick legacyTick = instigators.getLatestTick("sched-1").orElseThrow();
        assertEquals(TickStatus.SUCCESS, legacyTick.status());
        assertEquals(5.0, legacyTick.endTimestamp());
        assertEquals(List.of(5.0), column("SELECT end_timestamp FROM ticks WHERE origin_id = 'sched-1'"));
        InstigatorTick open = instigators.getLatestTick("both").orElseThrow();
        assertNull(open.endTimestamp());
        instigators.updateTick(open.withData(open.tickData().skip("no files", 8.0)));
    }

    @Test
    void unification_failsOnUnreadableState_andLeavesLegacyTablesInPlace() throws Exception {
        instigators.migrator().upgrade(SchemaRevisions.INSTIGATORS_JOBS);
        update("INSERT INTO schedules (schedule_origin_id, schedule_body, create_timestamp, update_timestamp) "
                + "VALUES ('bad', '{\"__class__\": \"Garbage\"}', 1, 1)");

        assertThrows(MalformedRecordException.class, () -> instigators.migrator().upgrade());

        assertTrue(hasTable("schedules"));
        assertFalse(hasTable("instigators"));
        assertEquals(SchemaRevisions.INSTIGATORS_JOBS, instigators.migrator().currentRevision().orElseThrow());
    }

    @Test
    void unification_isReversible() throws Exception {
        instigators.migrator().upgrade();
        instigators.addInstigatorState(new InstigatorState("sched-1", "nightly", InstigatorType.SCHEDULE,
                InstigatorStatus.RUNNING, new ScheduleInstigatorData("0 0 * * *", null, "UTC")));

        instigators.migrator().downgrade(SchemaRevisions.INSTIGATORS_JOBS);

        assertTrue(hasTable("schedules"));
        assertTrue(hasTable("jobs"));
        assertFalse(hasTable("instigators"));
        assertFalse(hasTable("ticks"));
    }
}
