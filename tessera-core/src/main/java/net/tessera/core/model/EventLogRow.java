package net.tessera.core.model;

/** Raw index columns of a stored event, as written or backfilled. */
public record EventLogRow(
        long logId,
        String runId,
        String eventType,
        double timestamp,
        String stepKey,
        String assetKey,
        String partition
) {}
