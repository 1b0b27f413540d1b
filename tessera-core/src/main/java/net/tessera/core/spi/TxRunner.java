package net.tessera.core.spi;

import java.util.concurrent.Callable;

/**
 * Transaction boundary used by the services. {@code required} joins a transaction already bound to the
 * calling thread; {@code requiresNew} always commits on its own.
 */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;
    <T> T requiresNew(Callable<T> body) throws Exception;
    default void required(Runnable body) throws Exception { required(() -> { body.run(); return null; }); }
    default void requiresNew(Runnable body) throws Exception { requiresNew(() -> { body.run(); return null; }); }
}
