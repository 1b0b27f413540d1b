package net.tessera.core.model;

/** Query columns derived from an entry at write time, or later by the event-log backfill. */
public record EventIndexColumns(String eventType, String stepKey, String assetKey, String partition) {

    public static EventIndexColumns of(EventLogEntry entry) {
        EventType type = entry.eventType();
        AssetMaterialization m = entry.assetMaterialization().orElse(null);
        return new EventIndexColumns(
                type == null ? null : type.name(),
                entry.resolvedStepKey(),
                m == null ? null : m.assetKey().toDbString(),
                m == null ? null : m.partition());
    }

    public boolean isEmpty() {
        return stepKey == null && assetKey == null && partition == null;
    }
}
