package net.tessera.core.error;

/** Encoding or decoding of a single value failed. */
public class SerializationException extends TesseraException {
    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
