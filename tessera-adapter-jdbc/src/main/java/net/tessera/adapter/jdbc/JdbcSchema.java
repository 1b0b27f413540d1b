package net.tessera.adapter.jdbc;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/** Schema introspection and DDL execution on the connection bound to the current transaction. */
public final class JdbcSchema {
    private JdbcSchema() {}

    public static boolean hasTable(Connection c, String table) throws SQLException {
        try (ResultSet rs = c.getMetaData().getTables(null, null, table, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    public static boolean hasColumn(Connection c, String table, String column) throws SQLException {
        return columns(c, table).contains(column);
    }

    public static Set<String> tables(Connection c) throws SQLException {
        Set<String> names = new TreeSet<>();
        try (ResultSet rs = c.getMetaData().getTables(null, null, "%", new String[]{"TABLE"})) {
            while (rs.next()) {
                String name = rs.getString("TABLE_NAME");
                if (!name.startsWith("sqlite_")) names.add(name);
            }
        }
        return names;
    }

    public static List<String> columns(Connection c, String table) throws SQLException {
        DatabaseMetaData md = c.getMetaData();
        List<String> names = new ArrayList<>();
        try (ResultSet rs = md.getColumns(null, null, table, "%")) {
            while (rs.next()) names.add(rs.getString("COLUMN_NAME"));
        }
        return names;
    }

    public static Set<String> indexes(Connection c, String table) throws SQLException {
        Set<String> names = new TreeSet<>();
        try (ResultSet rs = c.getMetaData().getIndexInfo(null, null, table, false, false)) {
            while (rs.next()) {
                String name = rs.getString("INDEX_NAME");
                if (name != null && !name.startsWith("sqlite_autoindex")) names.add(name);
            }
        }
        return names;
    }

    public static void execute(Connection c, String... statements) throws SQLException {
        try (Statement st = c.createStatement()) {
            for (String sql : statements) st.execute(sql);
        }
    }
}
