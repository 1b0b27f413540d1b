package net.tessera.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/** Identifier of a tracked data asset: an ordered list of path segments. */
public record AssetKey(List<String> path) {
    private static final ObjectMapper JSON = new ObjectMapper();

    public AssetKey {
        if (path == null || path.isEmpty()) throw new IllegalArgumentException("asset key path must not be empty");
        path = List.copyOf(path);
    }

    public static AssetKey of(String... path) {
        return new AssetKey(List.of(path));
    }

    /** Column form, a JSON array of the segments. */
    public String toDbString() {
        try {
            return JSON.writeValueAsString(path);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode asset key " + path, e);
        }
    }

    public static AssetKey fromDbString(String s) {
        try {
            return new AssetKey(JSON.readValue(s, new TypeReference<List<String>>() {}));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("not an asset key column value: " + s, e);
        }
    }

    public String toUserString() {
        return String.join("/", path);
    }

    @Override
    public String toString() {
        return "AssetKey" + path;
    }
}
