package net.tessera.core.error;

public class InstigatorNotFoundException extends TesseraException {
    private final String originId;

    public InstigatorNotFoundException(String originId) {
        super("Instigator state for origin " + originId + " not found");
        this.originId = originId;
    }

    public String originId() { return originId; }
}
