package net.tessera.core.error;

/** A stored legacy payload could not be parsed. Backfills count these and move on. */
public class MalformedRecordException extends TesseraException {
    private final long rowId;

    public MalformedRecordException(long rowId, String message, Throwable cause) {
        super("Malformed record at row " + rowId + ": " + message, cause);
        this.rowId = rowId;
    }

    public long rowId() { return rowId; }
}
