package net.tessera.adapter.jdbc.migration;

import net.tessera.core.migration.Migration;
import net.tessera.core.migration.MigrationChain;
import net.tessera.core.serdes.Serdes;

import javax.sql.DataSource;

import static net.tessera.adapter.jdbc.migration.Ddl.sql;
import static net.tessera.core.migration.SchemaRevisions.*;

/**
 * Schema history of instigator storage. Schedules and sensors started out in separate table pairs and
 * were later merged into {@code instigators} and {@code ticks}.
 */
public final class InstigatorSchema {
    public static final String REVISION_TABLE = "instigator_schema_revision";

    static final String CREATE_SCHEDULES = """
            CREATE TABLE schedules (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                schedule_origin_id TEXT NOT NULL UNIQUE,
                schedule_body TEXT NOT NULL,
                create_timestamp INTEGER NOT NULL,
                update_timestamp INTEGER NOT NULL
            )
            """;
    static final String CREATE_SCHEDULE_TICKS = """
            CREATE TABLE schedule_ticks (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                schedule_origin_id TEXT NOT NULL,
                status TEXT NOT NULL,
                timestamp REAL NOT NULL,
                tick_body TEXT NOT NULL,
                create_timestamp INTEGER NOT NULL,
                update_timestamp INTEGER NOT NULL
            )
            """;
    static final String CREATE_JOBS = """
            CREATE TABLE jobs (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                job_origin_id TEXT NOT NULL UNIQUE,
                status TEXT NOT NULL,
                job_type TEXT,
                job_body TEXT NOT NULL,
                create_timestamp INTEGER NOT NULL,
                update_timestamp INTEGER NOT NULL
            )
            """;
    static final String CREATE_JOB_TICKS = """
            CREATE TABLE job_ticks (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                job_origin_id TEXT NOT NULL,
                status TEXT NOT NULL,
                type TEXT,
                timestamp REAL NOT NULL,
                tick_body TEXT NOT NULL,
                create_timestamp INTEGER NOT NULL,
                update_timestamp INTEGER NOT NULL
            )
            """;

    private InstigatorSchema() {}

    public static MigrationChain chain(DataSource ds, Serdes serdes) {
        return MigrationChain.of(
                Migration.builder(INSTIGATORS_SCHEDULES, Migration.BASE)
                        .description("create schedules and schedule_ticks")
                        .up(sql(ds, CREATE_SCHEDULES, CREATE_SCHEDULE_TICKS))
                        .down(sql(ds, "DROP TABLE schedule_ticks", "DROP TABLE schedules"))
                        .build(),
                Migration.builder(INSTIGATORS_JOBS, INSTIGATORS_SCHEDULES)
                        .description("create jobs and job_ticks")
                        .up(sql(ds, CREATE_JOBS, CREATE_JOB_TICKS))
                        .down(sql(ds, "DROP TABLE job_ticks", "DROP TABLE jobs"))
                        .build(),
                Migration.builder(INSTIGATORS_UNIFIED, INSTIGATORS_JOBS)
                        .description("merge schedules and jobs into instigators and ticks")
                        .up(new InstigatorUnification(ds, serdes))
                        .down(sql(ds,
                                CREATE_SCHEDULES, CREATE_SCHEDULE_TICKS, CREATE_JOBS, CREATE_JOB_TICKS,
                                "DROP TABLE ticks",
                                "DROP TABLE instigators"))
                        .build()
        );
    }
}
