package net.tessera.adapter.jdbc.repo;

import net.tessera.adapter.jdbc.JdbcSchema;
import net.tessera.adapter.jdbc.TxContext;
import net.tessera.core.migration.Migration;
import net.tessera.core.spi.RevisionRepository;

import javax.sql.DataSource;
import java.sql.*;
import java.util.Optional;

/** Single-row {@code version_num} table, one per storage domain. */
public final class JdbcRevisionRepository implements RevisionRepository {
    private final DataSource ds;
    private final String table;

    public JdbcRevisionRepository(DataSource ds, String table) {
        this.ds = ds;
        this.table = table;
    }

    private Connection mustConn() {
        return TxContext.require(ds);
    }

    @Override
    public Optional<String> currentRevision() throws Exception {
        Connection c = mustConn();
        if (!JdbcSchema.hasTable(c, table)) return Optional.empty();
        try (PreparedStatement ps = c.prepareStatement("SELECT version_num FROM " + table + " LIMIT 1");
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) return Optional.ofNullable(rs.getString(1));
            return Optional.empty();
        }
    }

    @Override
    public void setRevision(String revision) throws Exception {
        Connection c = mustConn();
        JdbcSchema.execute(c,
                "CREATE TABLE IF NOT EXISTS " + table + " (version_num TEXT NOT NULL PRIMARY KEY)",
                "DELETE FROM " + table);
        if (Migration.BASE.equals(revision)) return;
        try (PreparedStatement ps = c.prepareStatement("INSERT INTO " + table + " (version_num) VALUES (?)")) {
            ps.setString(1, revision);
            ps.executeUpdate();
        }
    }
}
