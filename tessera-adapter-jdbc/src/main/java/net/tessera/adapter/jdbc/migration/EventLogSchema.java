package net.tessera.adapter.jdbc.migration;

import net.tessera.core.migration.Migration;
import net.tessera.core.migration.MigrationChain;

import javax.sql.DataSource;

import static net.tessera.adapter.jdbc.migration.Ddl.sql;
import static net.tessera.core.migration.SchemaRevisions.*;

/** Schema history of event log storage. */
public final class EventLogSchema {
    public static final String REVISION_TABLE = "event_log_schema_revision";
    public static final String SECONDARY_INDEX_TABLE = "event_log_secondary_indexes";

    private EventLogSchema() {}

    public static MigrationChain chain(DataSource ds) {
        return MigrationChain.of(
                Migration.builder(EVENTS_CREATE, Migration.BASE)
                        .description("create event_logs")
                        .up(sql(ds,
                                """
                                CREATE TABLE event_logs (
                                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                                    run_id TEXT NOT NULL,
                                    event TEXT NOT NULL,
                                    event_type TEXT,
                                    timestamp REAL NOT NULL
                                )
                                """,
                                "CREATE INDEX idx_event_logs_run_id ON event_logs (run_id, id)",
                                "CREATE INDEX idx_event_logs_event_type ON event_logs (event_type)"))
                        .down(sql(ds, "DROP TABLE event_logs"))
                        .build(),
                Migration.builder(EVENTS_STEP_KEY, EVENTS_CREATE)
                        .description("add step_key")
                        .up(sql(ds, "ALTER TABLE event_logs ADD COLUMN step_key TEXT"))
                        .down(sql(ds, "ALTER TABLE event_logs DROP COLUMN step_key"))
                        .build(),
                Migration.builder(EVENTS_ASSET_KEYS, EVENTS_STEP_KEY)
                        .description("add asset_key, asset_keys and the secondary index table")
                        .up(sql(ds,
                                "ALTER TABLE event_logs ADD COLUMN asset_key TEXT",
                                "CREATE INDEX idx_event_logs_asset_key ON event_logs (asset_key)",
                                """
                                CREATE TABLE asset_keys (
                                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                                    asset_key TEXT NOT NULL UNIQUE,
                                    create_timestamp INTEGER NOT NULL
                                )
                                """,
                                Ddl.secondaryIndexTable(SECONDARY_INDEX_TABLE)))
                        .down(sql(ds,
                                "DROP TABLE " + SECONDARY_INDEX_TABLE,
                                "DROP TABLE asset_keys",
                                "DROP INDEX idx_event_logs_asset_key",
                                "ALTER TABLE event_logs DROP COLUMN asset_key"))
                        .build(),
                Migration.builder(EVENTS_PARTITION, EVENTS_ASSET_KEYS)
                        .description("add partition_key")
                        .up(sql(ds,
                                "ALTER TABLE event_logs ADD COLUMN partition_key TEXT",
                                "CREATE INDEX idx_event_logs_asset_partition ON event_logs (asset_key, partition_key)"))
                        .down(sql(ds,
                                "DROP INDEX idx_event_logs_asset_partition",
                                "ALTER TABLE event_logs DROP COLUMN partition_key"))
                        .build(),
                Migration.builder(EVENTS_ASSET_INDEX_COLUMNS, EVENTS_PARTITION)
                        .description("add materialization and wipe columns to asset_keys")
                        .optional()
                        .up(sql(ds,
                                "ALTER TABLE asset_keys ADD COLUMN last_materialization_timestamp REAL",
                                "ALTER TABLE asset_keys ADD COLUMN last_run_id TEXT",
                                "ALTER TABLE asset_keys ADD COLUMN wipe_timestamp REAL",
                                "ALTER TABLE asset_keys ADD COLUMN tags TEXT",
                                """
                                UPDATE asset_keys
                                   SET last_materialization_timestamp =
                                         (SELECT MAX(e.timestamp) FROM event_logs e WHERE e.asset_key = asset_keys.asset_key),
                                       last_run_id =
                                         (SELECT e.run_id FROM event_logs e WHERE e.asset_key = asset_keys.asset_key
                                           ORDER BY e.id DESC LIMIT 1)
                                """))
                        .down(sql(ds,
                                "ALTER TABLE asset_keys DROP COLUMN tags",
                                "ALTER TABLE asset_keys DROP COLUMN wipe_timestamp",
                                "ALTER TABLE asset_keys DROP COLUMN last_run_id",
                                "ALTER TABLE asset_keys DROP COLUMN last_materialization_timestamp"))
                        .build()
        );
    }
}
