package net.tessera.adapter.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import net.tessera.core.error.RunAlreadyExistsException;
import net.tessera.core.error.RunNotFoundException;
import net.tessera.core.error.SchemaMismatchException;
import net.tessera.core.model.EngineEvent;
import net.tessera.core.model.EventLogEntry;
import net.tessera.core.model.EventType;
import net.tessera.core.model.Run;
import net.tessera.core.model.RunBundle;
import net.tessera.core.model.RunStatus;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunBundleServiceTest extends TestSupport {

    @Test
    void exportedRun_importsIntoAnotherInstance() throws Exception {
        storages.instanceMigrations().upgrade();
        storages.runStorage().createRun(Run.builder("r1", "etl").status(RunStatus.SUCCESS).tag("team", "data").build());
        storages.eventLogStorage().appendEvent(
                EventLogEntry.of("r1", 1.0, EngineEvent.step(EventType.STEP_START, "etl", "extract")));
        storages.eventLogStorage().appendEvent(EventLogEntry.logMessage("r1", 2.0, EventLogEntry.INFO, "rows: 10"));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        RunBundle bundle = storages.runBundles().exportRun("r1", out);
        assertEquals(2, bundle.events().size());

        try (HikariDataSource other = SqliteDataSources.create(tmp.resolve("other.db"))) {
            JdbcStorages target = JdbcStorages.builder(other).clock(clock).build();
            target.instanceMigrations().upgrade();

            Run imported = target.runBundles().importRun(new ByteArrayInputStream(out.toByteArray()));

            assertEquals("etl", imported.jobName());
            Run stored = target.runStorage().getRun("r1").orElseThrow();
            assertEquals(RunStatus.SUCCESS, stored.status());
            assertEquals("data", stored.tags().get("team"));
            List<EventLogEntry> events = target.eventLogStorage().getLogsForRun("r1").entries();
            assertEquals(EventType.STEP_START, events.get(0).eventType());
            assertEquals("extract", events.get(0).resolvedStepKey());
            assertEquals("rows: 10", events.get(1).message());

            assertThrows(RunAlreadyExistsException.class,
                    () -> target.runBundles().importRun(new ByteArrayInputStream(out.toByteArray())));
        }
    }

    @Test
    void importIntoAnOutdatedEventLog_isRejected_beforeTheRunIsCreated() throws Exception {
        storages.instanceMigrations().upgrade();
        storages.runStorage().createRun(Run.builder("r1", "etl").build());
        storages.eventLogStorage().appendEvent(EventLogEntry.logMessage("r1", 1.0, EventLogEntry.INFO, "hello"));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        storages.runBundles().exportRun("r1", out);

        try (HikariDataSource other = SqliteDataSources.create(tmp.resolve("other.db"))) {
            JdbcStorages target = JdbcStorages.builder(other).clock(clock).build();
            target.runStorage().migrator().upgrade();

            assertThrows(SchemaMismatchException.class,
                    () -> target.runBundles().importRun(new ByteArrayInputStream(out.toByteArray())));

            assertTrue(target.runStorage().getRun("r1").isEmpty());
            target.eventLogStorage().migrator().upgrade();
            assertEquals("etl", target.runBundles().importRun(new ByteArrayInputStream(out.toByteArray())).jobName());
            assertEquals(1, target.eventLogStorage().getLogsForRun("r1").entries().size());
        }
    }

    @Test
    void exportingAnUnknownRun_fails() throws Exception {
        storages.instanceMigrations().upgrade();
        assertThrows(RunNotFoundException.class,
                () -> storages.runBundles().exportRun("missing", new ByteArrayOutputStream()));
    }
}
