package net.tessera.adapter.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.IdentityHashMap;
import java.util.Map;

/** Connections bound to the current thread, one per data source, while a transaction is open. */
public final class TxContext {
    private static final ThreadLocal<Map<DataSource, Connection>> LOCAL = ThreadLocal.withInitial(IdentityHashMap::new);
    private TxContext() {}
    public static void set(DataSource ds, Connection c) { LOCAL.get().put(ds, c); }
    public static Connection get(DataSource ds) { return LOCAL.get().get(ds); }
    public static void clear(DataSource ds) {
        Map<DataSource, Connection> bound = LOCAL.get();
        bound.remove(ds);
        if (bound.isEmpty()) LOCAL.remove();
    }

    /** The bound connection, for repository code that must run inside a transaction. */
    public static Connection require(DataSource ds) {
        Connection c = get(ds);
        if (c == null) throw new IllegalStateException("TxContext required (wrap with a TxRunner)");
        return c;
    }
}
