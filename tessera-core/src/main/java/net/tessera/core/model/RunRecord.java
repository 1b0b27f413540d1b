package net.tessera.core.model;

import java.time.Instant;

/**
 * A stored run with its row metadata. {@code startTime}/{@code endTime} are epoch seconds and stay null
 * until the run-times migration is applied.
 */
public record RunRecord(
        long storageId,
        Run run,
        Instant createTimestamp,
        Instant updateTimestamp,
        Double startTime,
        Double endTime
) {}
