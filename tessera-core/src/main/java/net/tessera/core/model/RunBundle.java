package net.tessera.core.model;

import java.util.List;
import java.util.Objects;

/** Portable export of one run together with its event log. */
public record RunBundle(Run run, List<EventLogEntry> events) {
    public RunBundle {
        Objects.requireNonNull(run, "run");
        events = events == null ? List.of() : List.copyOf(events);
    }
}
