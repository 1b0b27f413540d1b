package net.tessera.core.model;

import java.util.List;

/** A root run and every retry descending from it. */
public record RunGroup(String rootRunId, List<Run> runs) {
    public RunGroup {
        runs = List.copyOf(runs);
    }
}
