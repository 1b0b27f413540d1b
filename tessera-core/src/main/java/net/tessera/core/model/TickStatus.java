package net.tessera.core.model;

public enum TickStatus {
    STARTED, SUCCESS, FAILURE, SKIPPED;

    public boolean isTerminal() { return this != STARTED; }
}
