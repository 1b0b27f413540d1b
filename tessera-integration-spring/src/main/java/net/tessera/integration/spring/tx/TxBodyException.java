package net.tessera.integration.spring.tx;

/** Carries a checked exception out of a Spring transaction callback, which then rolls back. */
final class TxBodyException extends RuntimeException {
    private final Exception body;

    TxBodyException(Exception cause) {
        super(cause.getMessage(), cause);
        this.body = cause;
    }

    Exception body() { return body; }
}
