package net.tessera.adapter.jdbc.migration;

import net.tessera.adapter.jdbc.JdbcSchema;
import net.tessera.adapter.jdbc.TxContext;
import net.tessera.core.error.MalformedRecordException;
import net.tessera.core.error.SerializationException;
import net.tessera.core.migration.Migration;
import net.tessera.core.model.InstigatorState;
import net.tessera.core.model.InstigatorType;
import net.tessera.core.serdes.Serdes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Copies legacy schedule and job rows into {@code instigators}/{@code ticks}, typing each row by the
 * table it came from, then drops the legacy tables. Payloads are copied verbatim; the status column is
 * taken from the decoded state, so an unreadable state payload fails the step.
 */
final class InstigatorUnification implements Migration.Action {
    private static final Logger log = LoggerFactory.getLogger(InstigatorUnification.class);

    private final DataSource ds;
    private final Serdes serdes;

    InstigatorUnification(DataSource ds, Serdes serdes) {
        this.ds = ds;
        this.serdes = serdes;
    }

    @Override
    public void apply() throws Exception {
        Connection c = TxContext.require(ds);
        JdbcSchema.execute(c,
                """
                CREATE TABLE instigators (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    origin_id TEXT NOT NULL UNIQUE,
                    instigator_type TEXT NOT NULL,
                    status TEXT NOT NULL,
                    instigator_body TEXT NOT NULL,
                    create_timestamp INTEGER NOT NULL,
                    update_timestamp INTEGER NOT NULL
                )
                """,
                """
                CREATE TABLE ticks (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    origin_id TEXT NOT NULL,
                    instigator_type TEXT NOT NULL,
                    status TEXT NOT NULL,
                    timestamp REAL NOT NULL,
                    end_timestamp REAL,
                    tick_body TEXT NOT NULL
                )
                """,
                "CREATE INDEX idx_ticks_origin_id ON ticks (origin_id, id)",
                "CREATE INDEX idx_instigators_type ON instigators (instigator_type)");

        int jobs = copyStates(c,
                "SELECT id, job_origin_id AS origin_id, job_type AS type, job_body AS body, "
                        + "create_timestamp, update_timestamp FROM jobs ORDER BY id",
                InstigatorType.SENSOR);
        int schedules = copyStates(c,
                "SELECT id, schedule_origin_id AS origin_id, 'SCHEDULE' AS type, schedule_body AS body, "
                        + "create_timestamp, update_timestamp FROM schedules "
                        + "WHERE schedule_origin_id NOT IN (SELECT origin_id FROM instigators) ORDER BY id",
                InstigatorType.SCHEDULE);

        JdbcSchema.execute(c,
                """
                INSERT INTO ticks (origin_id, instigator_type, status, timestamp, end_timestamp, tick_body)
                SELECT origin_id, type, status, timestamp,
                       CASE WHEN status IN ('SUCCESS', 'FAILURE', 'SKIPPED') THEN timestamp END,
                       tick_body
                  FROM (SELECT schedule_origin_id AS origin_id, 'SCHEDULE' AS type, status, timestamp, tick_body,
                               0 AS source, id
                          FROM schedule_ticks
                        UNION ALL
                        SELECT job_origin_id, COALESCE(type, 'SENSOR'), status, timestamp, tick_body,
                               1, id
                          FROM job_ticks)
                 ORDER BY timestamp, source, id
                """,
                "DROP TABLE schedule_ticks",
                "DROP TABLE schedules",
                "DROP TABLE job_ticks",
                "DROP TABLE jobs");
        log.info("Unified {} job and {} schedule states into instigators", jobs, schedules);
    }

    private int copyStates(Connection c, String select, InstigatorType defaultType) throws SQLException {
        int copied = 0;
        try (PreparedStatement read = c.prepareStatement(select);
             ResultSet rs = read.executeQuery();
             PreparedStatement write = c.prepareStatement(
                     """
                     INSERT INTO instigators (origin_id, instigator_type, status, instigator_body,
                                              create_timestamp, update_timestamp)
                     VALUES (?, ?, ?, ?, ?, ?)
                     """)) {
            while (rs.next()) {
                String body = rs.getString("body");
                InstigatorState state;
                try {
                    state = serdes.deserialize(body, InstigatorState.class);
                } catch (SerializationException e) {
                    throw new MalformedRecordException(rs.getLong("id"), e.getMessage(), e);
                }
                String type = rs.getString("type");
                write.setString(1, rs.getString("origin_id"));
                write.setString(2, type == null ? defaultType.name() : InstigatorType.from(type).name());
                write.setString(3, state.status().name());
                write.setString(4, body);
                write.setLong(5, rs.getLong("create_timestamp"));
                write.setLong(6, rs.getLong("update_timestamp"));
                write.executeUpdate();
                copied++;
            }
        }
        return copied;
    }
}
