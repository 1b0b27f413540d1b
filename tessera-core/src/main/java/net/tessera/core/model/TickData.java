package net.tessera.core.model;

import net.tessera.core.error.InvariantViolationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One evaluation attempt of an instigator. Moves {@code STARTED -> SUCCESS | FAILURE | SKIPPED};
 * {@code endTimestamp} is set exactly once, on that terminal transition, and a terminal tick never changes again.
 */
public record TickData(
        String originId,
        String instigatorName,
        InstigatorType instigatorType,
        TickStatus status,
        double timestamp,
        Double endTimestamp,
        List<String> runIds,
        List<String> runKeys,
        String cursor,
        String skipReason,
        SerializableErrorInfo error
) {
    public TickData {
        Objects.requireNonNull(originId, "originId");
        Objects.requireNonNull(instigatorType, "instigatorType");
        Objects.requireNonNull(status, "status");
        runIds = runIds == null ? List.of() : List.copyOf(runIds);
        runKeys = runKeys == null ? List.of() : List.copyOf(runKeys);
        if (status.isTerminal() != (endTimestamp != null)) {
            throw new InvariantViolationException("tick " + status + " must " + (status.isTerminal() ? "" : "not ")
                    + "carry an end timestamp");
        }
    }

    public static TickData started(String originId, String instigatorName, InstigatorType type, double timestamp) {
        return new TickData(originId, instigatorName, type, TickStatus.STARTED, timestamp, null,
                List.of(), List.of(), null, null, null);
    }

    public TickData withRun(String runId, String runKey) {
        requireOpen("add a run");
        List<String> ids = new ArrayList<>(runIds);
        ids.add(runId);
        List<String> keys = new ArrayList<>(runKeys);
        if (runKey != null) keys.add(runKey);
        return new TickData(originId, instigatorName, instigatorType, status, timestamp, null,
                ids, keys, cursor, skipReason, error);
    }

    public TickData withCursor(String next) {
        requireOpen("move the cursor");
        return new TickData(originId, instigatorName, instigatorType, status, timestamp, null,
                runIds, runKeys, next, skipReason, error);
    }

    /** Type recorded by the store, which wins over the type in legacy payloads. */
    public TickData withInstigatorType(InstigatorType type) {
        if (type == instigatorType) return this;
        return new TickData(originId, instigatorName, type, status, timestamp, endTimestamp,
                runIds, runKeys, cursor, skipReason, error);
    }

    public TickData succeed(double at) {
        return finish(TickStatus.SUCCESS, at, skipReason, null);
    }

    public TickData skip(String reason, double at) {
        return finish(TickStatus.SKIPPED, at, reason, null);
    }

    public TickData fail(SerializableErrorInfo failure, double at) {
        return finish(TickStatus.FAILURE, at, skipReason, failure);
    }

    private TickData finish(TickStatus next, double at, String reason, SerializableErrorInfo failure) {
        requireOpen("transition to " + next);
        if (at < timestamp) {
            throw new InvariantViolationException("tick cannot end at " + at + " before it started at " + timestamp);
        }
        return new TickData(originId, instigatorName, instigatorType, next, timestamp, at,
                runIds, runKeys, cursor, reason, failure);
    }

    private void requireOpen(String action) {
        if (status.isTerminal()) {
            throw new InvariantViolationException("cannot " + action + " on a " + status + " tick of " + originId);
        }
    }
}
