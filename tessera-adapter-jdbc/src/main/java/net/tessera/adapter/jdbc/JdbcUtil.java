package net.tessera.adapter.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

public final class JdbcUtil {
    private JdbcUtil() {}

    public static long millis(Instant i) { return i.toEpochMilli(); }

    public static Instant toInstant(long millis) { return Instant.ofEpochMilli(millis); }

    public static Instant toInstantOrNull(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(v);
    }

    public static Double getDouble(ResultSet rs, String column) throws SQLException {
        double v = rs.getDouble(column);
        return rs.wasNull() ? null : v;
    }

    public static void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) ps.setNull(index, Types.REAL);
        else ps.setDouble(index, value);
    }

    public static void setLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) ps.setNull(index, Types.INTEGER);
        else ps.setLong(index, value);
    }

    /** Row id of the last insert on this connection. */
    public static long lastInsertId(Connection c) throws SQLException {
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            rs.next();
            return rs.getLong(1);
        }
    }

    public static String placeholders(int n) {
        return String.join(",", Collections.nCopies(n, "?"));
    }

    public static void bindStrings(PreparedStatement ps, int start, List<String> values) throws SQLException {
        for (int i = 0; i < values.size(); i++) ps.setString(start + i, values.get(i));
    }
}
