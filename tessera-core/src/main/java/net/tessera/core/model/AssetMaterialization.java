package net.tessera.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record AssetMaterialization(
        AssetKey assetKey,
        String partition,
        Map<String, String> tags,
        String description
) {
    public AssetMaterialization {
        Objects.requireNonNull(assetKey, "assetKey");
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public static AssetMaterialization of(AssetKey assetKey) {
        return new AssetMaterialization(assetKey, null, Map.of(), null);
    }
}
