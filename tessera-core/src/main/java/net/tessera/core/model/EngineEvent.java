package net.tessera.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Structured event emitted by the execution engine. {@code eventSpecificData} is any registered codec value,
 * an {@link AssetMaterialization} for {@link EventType#ASSET_MATERIALIZATION}.
 */
public record EngineEvent(
        EventType eventType,
        String jobName,
        String stepKey,
        String message,
        Object eventSpecificData
) {
    public EngineEvent {
        Objects.requireNonNull(eventType, "eventType");
        eventSpecificData = PlainValues.normalize(eventSpecificData);
    }

    public static EngineEvent of(EventType type, String jobName) {
        return new EngineEvent(type, jobName, null, null, null);
    }

    public static EngineEvent step(EventType type, String jobName, String stepKey) {
        return new EngineEvent(type, jobName, stepKey, null, null);
    }

    public static EngineEvent materialization(String jobName, String stepKey, AssetMaterialization materialization) {
        return new EngineEvent(EventType.ASSET_MATERIALIZATION, jobName, stepKey, null, materialization);
    }

    public Optional<AssetMaterialization> assetMaterialization() {
        if (eventType == EventType.ASSET_MATERIALIZATION && eventSpecificData instanceof AssetMaterialization m) {
            return Optional.of(m);
        }
        return Optional.empty();
    }
}
