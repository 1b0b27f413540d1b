package net.tessera.core.error;

/** Write-path absence; reads return {@code Optional.empty()} instead. */
public class RunNotFoundException extends TesseraException {
    private final String runId;

    public RunNotFoundException(String runId) {
        super("Run " + runId + " not found");
        this.runId = runId;
    }

    public String runId() { return runId; }
}
