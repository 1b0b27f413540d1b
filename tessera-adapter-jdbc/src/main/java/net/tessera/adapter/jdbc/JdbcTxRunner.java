package net.tessera.adapter.jdbc;

import net.tessera.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

public final class JdbcTxRunner implements TxRunner {
    private static final Logger log = LoggerFactory.getLogger(JdbcTxRunner.class);

    private final DataSource ds;

    public JdbcTxRunner(DataSource ds) { this.ds = ds; }

    public DataSource dataSource() { return ds; }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        Connection outer = TxContext.get(ds);
        if (outer != null) {
            return body.call();
        }
        return inNewTransaction(body);
    }

    /**
     * Suspends any transaction bound for this data source and runs {@code body} on a fresh connection.
     * With SQLite the suspended transaction must not hold the write lock, or the inner one waits for it
     * until the busy timeout.
     */
    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        Connection suspended = TxContext.get(ds);
        if (suspended != null) TxContext.clear(ds);
        try {
            return inNewTransaction(body);
        } finally {
            if (suspended != null) TxContext.set(ds, suspended);
        }
    }

    private <T> T inNewTransaction(Callable<T> body) throws Exception {
        try (Connection c = ds.getConnection()) {
            boolean prevAuto = c.getAutoCommit();
            c.setAutoCommit(false);
            TxContext.set(ds, c);
            try {
                T r = body.call();
                c.commit();
                return r;
            } catch (Throwable t) {
                safeRollback(c);
                sneakyThrow(t);
                return null; // unreachable
            } finally {
                TxContext.clear(ds);
                restoreAutoCommit(c, prevAuto);
            }
        }
    }

    private static void safeRollback(Connection c) {
        try {
            c.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed", e);
        }
    }

    private static void restoreAutoCommit(Connection c, boolean autoCommit) {
        try {
            c.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.debug("Could not restore auto-commit on {}", c, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> void sneakyThrow(Throwable t) throws E { throw (E) t; }
}
