package net.tessera.core.model;

import java.util.EnumSet;
import java.util.Set;

public enum RunStatus {
    QUEUED, NOT_STARTED, STARTED, SUCCESS, FAILURE, CANCELED;

    private static final Set<RunStatus> TERMINAL = EnumSet.of(SUCCESS, FAILURE, CANCELED);

    public static RunStatus from(String s) {
        if (s == null) throw new IllegalArgumentException("run status is required");
        return RunStatus.valueOf(s.toUpperCase());
    }

    public String code() { return name(); }

    public boolean isTerminal() { return TERMINAL.contains(this); }

    /**
     * Forward transitions of the execution engine:
     * {QUEUED, NOT_STARTED} -> STARTED -> {SUCCESS, FAILURE, CANCELED}.
     * A run may also be dequeued, canceled or failed before it starts.
     */
    public boolean canTransitionTo(RunStatus next) {
        if (next == this) return true;
        return switch (this) {
            case QUEUED -> next == NOT_STARTED || next == STARTED || next == CANCELED || next == FAILURE;
            case NOT_STARTED -> next == STARTED || next == CANCELED || next == FAILURE;
            case STARTED -> next.isTerminal();
            case SUCCESS, FAILURE, CANCELED -> false;
        };
    }
}
