package net.tessera.core.error;

public class RunAlreadyExistsException extends TesseraException {
    private final String runId;

    public RunAlreadyExistsException(String runId) {
        super("Run " + runId + " already exists");
        this.runId = runId;
    }

    public String runId() { return runId; }
}
