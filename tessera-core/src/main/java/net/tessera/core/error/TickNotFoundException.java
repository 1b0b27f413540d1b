package net.tessera.core.error;

public class TickNotFoundException extends TesseraException {
    private final long tickId;

    public TickNotFoundException(long tickId) {
        super("Tick " + tickId + " not found");
        this.tickId = tickId;
    }

    public long tickId() { return tickId; }
}
