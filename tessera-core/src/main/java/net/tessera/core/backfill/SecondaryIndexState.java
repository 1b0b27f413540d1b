package net.tessera.core.backfill;

import java.time.Instant;

/** {@code migrationCompleted} is null while the index is still being built. */
public record SecondaryIndexState(String name, Instant createTimestamp, Instant migrationCompleted, long lastRowId) {
    public boolean isBuilt() { return migrationCompleted != null; }
}
