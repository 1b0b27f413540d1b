package net.tessera.core.model;

import java.util.Objects;

/**
 * Persistent state of a schedule or sensor. {@code instigatorData} is opaque to the store; it is one of
 * {@link ScheduleInstigatorData}, {@link SensorInstigatorData} or any other registered codec value.
 */
public record InstigatorState(
        String originId,
        String instigatorName,
        InstigatorType instigatorType,
        InstigatorStatus status,
        Object instigatorData
) {
    public InstigatorState {
        Objects.requireNonNull(originId, "originId");
        Objects.requireNonNull(instigatorType, "instigatorType");
        Objects.requireNonNull(status, "status");
        instigatorData = PlainValues.normalize(instigatorData);
    }

    public InstigatorState withStatus(InstigatorStatus next) {
        return new InstigatorState(originId, instigatorName, instigatorType, next, instigatorData);
    }

    public InstigatorState withData(Object data) {
        return new InstigatorState(originId, instigatorName, instigatorType, status, data);
    }

    public InstigatorState withType(InstigatorType type) {
        return new InstigatorState(originId, instigatorName, type, status, instigatorData);
    }

    public boolean isRunning() { return status == InstigatorStatus.RUNNING; }
}
