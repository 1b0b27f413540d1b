package net.tessera.adapter.jdbc.migration;

import net.tessera.core.migration.Migration;
import net.tessera.core.migration.MigrationChain;

import javax.sql.DataSource;

import static net.tessera.adapter.jdbc.migration.Ddl.sql;
import static net.tessera.core.migration.SchemaRevisions.*;

/** Schema history of run storage. */
public final class RunSchema {
    public static final String REVISION_TABLE = "run_schema_revision";
    public static final String SECONDARY_INDEX_TABLE = "run_secondary_indexes";

    private RunSchema() {}

    public static MigrationChain chain(DataSource ds) {
        return MigrationChain.of(
                Migration.builder(RUNS_CREATE, Migration.BASE)
                        .description("create runs and run_tags")
                        .up(sql(ds,
                                """
                                CREATE TABLE runs (
                                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                                    run_id TEXT NOT NULL UNIQUE,
                                    job_name TEXT NOT NULL,
                                    status TEXT NOT NULL,
                                    run_body TEXT NOT NULL,
                                    snapshot_id TEXT,
                                    create_timestamp INTEGER NOT NULL,
                                    update_timestamp INTEGER NOT NULL
                                )
                                """,
                                """
                                CREATE TABLE run_tags (
                                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                                    run_id TEXT NOT NULL,
                                    tag_key TEXT NOT NULL,
                                    tag_value TEXT
                                )
                                """,
                                "CREATE INDEX idx_run_tags ON run_tags (tag_key, tag_value)",
                                "CREATE INDEX idx_run_tags_run_id ON run_tags (run_id)",
                                "CREATE INDEX idx_runs_job_name ON runs (job_name)",
                                "CREATE INDEX idx_runs_status ON runs (status)"))
                        .down(sql(ds, "DROP TABLE run_tags", "DROP TABLE runs"))
                        .build(),
                Migration.builder(RUNS_SNAPSHOTS, RUNS_CREATE)
                        .description("create snapshots")
                        .up(sql(ds,
                                """
                                CREATE TABLE snapshots (
                                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                                    snapshot_id TEXT NOT NULL UNIQUE,
                                    snapshot_kind TEXT NOT NULL,
                                    snapshot_body TEXT NOT NULL,
                                    create_timestamp INTEGER NOT NULL
                                )
                                """,
                                "CREATE INDEX idx_runs_snapshot_id ON runs (snapshot_id)"))
                        .down(sql(ds, "DROP INDEX idx_runs_snapshot_id", "DROP TABLE snapshots"))
                        .build(),
                Migration.builder(RUNS_PARTITIONS, RUNS_SNAPSHOTS)
                        .description("add partition columns and the secondary index table")
                        .up(sql(ds,
                                "ALTER TABLE runs ADD COLUMN partition_key TEXT",
                                "ALTER TABLE runs ADD COLUMN partition_set TEXT",
                                "CREATE INDEX idx_run_partitions ON runs (partition_set, partition_key)",
                                Ddl.secondaryIndexTable(SECONDARY_INDEX_TABLE)))
                        .down(sql(ds,
                                "DROP TABLE " + SECONDARY_INDEX_TABLE,
                                "DROP INDEX idx_run_partitions",
                                "ALTER TABLE runs DROP COLUMN partition_set",
                                "ALTER TABLE runs DROP COLUMN partition_key"))
                        .build(),
                Migration.builder(RUNS_START_END_TIMES, RUNS_PARTITIONS)
                        .description("add run start and end times")
                        .optional()
                        .up(sql(ds,
                                "ALTER TABLE runs ADD COLUMN start_time REAL",
                                "ALTER TABLE runs ADD COLUMN end_time REAL"))
                        .down(sql(ds,
                                "ALTER TABLE runs DROP COLUMN end_time",
                                "ALTER TABLE runs DROP COLUMN start_time"))
                        .build()
        );
    }
}
