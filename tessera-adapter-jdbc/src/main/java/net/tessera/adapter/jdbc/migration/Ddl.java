package net.tessera.adapter.jdbc.migration;

import net.tessera.adapter.jdbc.JdbcSchema;
import net.tessera.adapter.jdbc.TxContext;
import net.tessera.core.migration.Migration;

import javax.sql.DataSource;

final class Ddl {
    private Ddl() {}

    /** An action running the statements on the migration's transaction. */
    static Migration.Action sql(DataSource ds, String... statements) {
        return () -> JdbcSchema.execute(TxContext.require(ds), statements);
    }

    static String secondaryIndexTable(String table) {
        return """
                CREATE TABLE %s (
                    name TEXT NOT NULL PRIMARY KEY,
                    create_timestamp INTEGER NOT NULL,
                    migration_completed INTEGER,
                    last_row_id INTEGER NOT NULL DEFAULT 0
                )
                """.formatted(table);
    }
}
