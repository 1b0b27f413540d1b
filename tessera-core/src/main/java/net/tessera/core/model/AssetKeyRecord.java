package net.tessera.core.model;

import java.util.Map;

public record AssetKeyRecord(
        AssetKey assetKey,
        Double lastMaterializationTimestamp,
        String lastRunId,
        Double wipeTimestamp,
        Map<String, String> tags
) {
    public AssetKeyRecord {
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    /** Never wiped, or re-materialized after the last wipe. */
    public boolean isPresent() {
        if (wipeTimestamp == null) return true;
        return lastMaterializationTimestamp != null && lastMaterializationTimestamp > wipeTimestamp;
    }
}
