package net.tessera.core.error;

/** Caller broke a data-model invariant. Always propagated. */
public class InvariantViolationException extends TesseraException {
    public InvariantViolationException(String message) {
        super(message);
    }
}
