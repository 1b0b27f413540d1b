package net.tessera.core.migration;

import java.util.List;

public record MigrationStatus(StorageDomain domain, String currentRevision, String headRevision, List<String> pending) {
    public MigrationStatus {
        pending = List.copyOf(pending);
    }

    public boolean atHead() { return pending.isEmpty(); }
}
