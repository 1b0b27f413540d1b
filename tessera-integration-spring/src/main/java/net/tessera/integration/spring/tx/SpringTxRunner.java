package net.tessera.integration.spring.tx;

import net.tessera.adapter.jdbc.TxContext;
import net.tessera.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * {@link TxRunner} backed by a Spring transaction manager. The connection Spring binds to the
 * transaction is exposed to the JDBC repositories through {@link TxContext}.
 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    /** Checked exceptions cross the template wrapped, so it rolls back, and leave it unwrapped. */
    private <T> T execute(int propagation, Callable<T> body) throws Exception {
        try {
            return inTemplate(propagation, body);
        } catch (TxBodyException e) {
            throw e.body();
        }
    }

    private <T> T inTemplate(int propagation, Callable<T> body) {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);

        return tpl.execute(status -> {
            Connection outer = TxContext.get(ds);
            Connection con = DataSourceUtils.getConnection(ds);
            // joined the outer transaction: same physical connection
            if (con == outer) {
                try {
                    return call(body);
                } finally {
                    DataSourceUtils.releaseConnection(con, ds);
                }
            }
            try {
                TxContext.set(ds, con);
                return call(body);
            } finally {
                if (outer != null) TxContext.set(ds, outer);
                else TxContext.clear(ds);
                DataSourceUtils.releaseConnection(con, ds);
            }
        });
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new TxBodyException(e);
        }
    }
}
