package net.tessera.adapter.jdbc.repo;

import net.tessera.adapter.jdbc.JdbcSchema;
import net.tessera.adapter.jdbc.JdbcUtil;
import net.tessera.adapter.jdbc.TxContext;
import net.tessera.adapter.jdbc.mapper.RowMappers;
import net.tessera.core.backfill.SecondaryIndexState;
import net.tessera.core.spi.SecondaryIndexRepository;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.Optional;

/** Progress table of one domain's data migrations; absent before the migration that creates it. */
public final class JdbcSecondaryIndexRepository implements SecondaryIndexRepository {
    private final DataSource ds;
    private final String table;

    public JdbcSecondaryIndexRepository(DataSource ds, String table) {
        this.ds = ds;
        this.table = table;
    }

    private Connection mustConn() {
        return TxContext.require(ds);
    }

    @Override
    public Optional<SecondaryIndexState> find(String name) throws Exception {
        Connection c = mustConn();
        if (!JdbcSchema.hasTable(c, table)) return Optional.empty();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT name, create_timestamp, migration_completed, last_row_id FROM " + table + " WHERE name = ?")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(RowMappers.toSecondaryIndexState(rs));
                return Optional.empty();
            }
        }
    }

    @Override
    public void upsertProgress(String name, long lastRowId, Instant now) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "INSERT INTO " + table + " (name, create_timestamp, last_row_id) VALUES (?, ?, ?) "
                        + "ON CONFLICT (name) DO UPDATE SET last_row_id = excluded.last_row_id")) {
            ps.setString(1, name);
            ps.setLong(2, JdbcUtil.millis(now));
            ps.setLong(3, lastRowId);
            ps.executeUpdate();
        }
    }

    @Override
    public void markCompleted(String name, Instant now) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "INSERT INTO " + table + " (name, create_timestamp, migration_completed, last_row_id) VALUES (?, ?, ?, 0) "
                        + "ON CONFLICT (name) DO UPDATE SET migration_completed = excluded.migration_completed")) {
            ps.setString(1, name);
            ps.setLong(2, JdbcUtil.millis(now));
            ps.setLong(3, JdbcUtil.millis(now));
            ps.executeUpdate();
        }
    }

    @Override
    public void reset(String name) throws Exception {
        Connection c = mustConn();
        if (!JdbcSchema.hasTable(c, table)) return;
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM " + table + " WHERE name = ?")) {
            ps.setString(1, name);
            ps.executeUpdate();
        }
    }
}
