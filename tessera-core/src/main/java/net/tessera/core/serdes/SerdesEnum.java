package net.tessera.core.serdes;

import net.tessera.core.error.SerializationException;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** Codec registration of an enum, written as {@code {"__enum__": "Tag.VALUE"}}. */
public final class SerdesEnum<E extends Enum<E>> {

    private final String tag;
    private final Class<E> type;
    private final Set<String> legacyTags;
    private final Map<String, String> valueRenames;

    private SerdesEnum(String tag, Class<E> type, Set<String> legacyTags, Map<String, String> valueRenames) {
        this.tag = tag;
        this.type = type;
        this.legacyTags = Set.copyOf(legacyTags);
        this.valueRenames = Map.copyOf(valueRenames);
    }

    public static <E extends Enum<E>> SerdesEnum<E> of(Class<E> type) {
        return builder(type.getSimpleName(), type).build();
    }

    public static <E extends Enum<E>> Builder<E> builder(String tag, Class<E> type) {
        return new Builder<>(tag, type);
    }

    public String tag() { return tag; }

    public Class<E> type() { return type; }

    public Set<String> legacyTags() { return legacyTags; }

    String pack(Enum<?> value) {
        return tag + "." + value.name();
    }

    E unpack(String name) {
        String current = valueRenames.getOrDefault(name, name);
        try {
            return Enum.valueOf(type, current);
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Unknown value " + name + " for enum " + tag, e);
        }
    }

    public static final class Builder<E extends Enum<E>> {
        private final String tag;
        private final Class<E> type;
        private final Set<String> legacyTags = new LinkedHashSet<>();
        private final Map<String, String> valueRenames = new LinkedHashMap<>();

        private Builder(String tag, Class<E> type) {
            this.tag = Objects.requireNonNull(tag, "tag");
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder<E> legacyTag(String legacyTag) {
            legacyTags.add(legacyTag);
            return this;
        }

        public Builder<E> renamedValue(String oldName, String newName) {
            valueRenames.put(oldName, newName);
            return this;
        }

        public Builder<E> renamedValues(Map<String, String> renames) {
            valueRenames.putAll(renames);
            return this;
        }

        public SerdesEnum<E> build() {
            return new SerdesEnum<>(tag, type, legacyTags, valueRenames);
        }
    }
}
