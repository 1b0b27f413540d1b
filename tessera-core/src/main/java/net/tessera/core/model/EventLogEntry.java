package net.tessera.core.model;

import java.util.Objects;
import java.util.Optional;

/** One entry of a run's append-only log: a structured engine event or a plain log message. */
public record EventLogEntry(
        String runId,
        double timestamp,
        int level,
        String message,
        String stepKey,
        EngineEvent event
) {
    public static final int INFO = 20;
    public static final int DEBUG = 10;

    public EventLogEntry {
        Objects.requireNonNull(runId, "runId");
        message = message == null ? "" : message;
    }

    public static EventLogEntry of(String runId, double timestamp, EngineEvent event) {
        return new EventLogEntry(runId, timestamp, DEBUG, event.message(), event.stepKey(), event);
    }

    public static EventLogEntry logMessage(String runId, double timestamp, int level, String message) {
        return new EventLogEntry(runId, timestamp, level, message, null, null);
    }

    public boolean isEngineEvent() { return event != null; }

    public EventType eventType() { return event == null ? null : event.eventType(); }

    public String resolvedStepKey() {
        if (stepKey != null) return stepKey;
        return event == null ? null : event.stepKey();
    }

    public Optional<AssetMaterialization> assetMaterialization() {
        return event == null ? Optional.empty() : event.assetMaterialization();
    }
}
