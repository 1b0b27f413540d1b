package net.tessera.core.serdes;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of codec registrations, keyed by current and legacy tag and by Java class.
 * Built once at startup; {@link #toBuilder()} derives a new registry.
 */
public final class TypeRegistry {

    private final Map<String, SerdesType<?>> typesByTag;
    private final Map<Class<?>, SerdesType<?>> typesByClass;
    private final Map<String, SerdesEnum<?>> enumsByTag;
    private final Map<Class<?>, SerdesEnum<?>> enumsByClass;
    private final boolean fallbackToUnknown;
    private final Builder source;

    private TypeRegistry(Builder b) {
        Map<String, SerdesType<?>> byTag = new LinkedHashMap<>();
        Map<Class<?>, SerdesType<?>> byClass = new LinkedHashMap<>();
        for (SerdesType<?> t : b.types.values()) {
            putTag(byTag, t.tag(), t);
            for (String legacy : t.legacyTags()) putTag(byTag, legacy, t);
            byClass.put(t.type(), t);
        }
        Map<String, SerdesEnum<?>> enumTags = new LinkedHashMap<>();
        Map<Class<?>, SerdesEnum<?>> enumClasses = new LinkedHashMap<>();
        for (SerdesEnum<?> e : b.enums.values()) {
            putTag(enumTags, e.tag(), e);
            for (String legacy : e.legacyTags()) putTag(enumTags, legacy, e);
            enumClasses.put(e.type(), e);
        }
        this.typesByTag = Map.copyOf(byTag);
        this.typesByClass = Map.copyOf(byClass);
        this.enumsByTag = Map.copyOf(enumTags);
        this.enumsByClass = Map.copyOf(enumClasses);
        this.fallbackToUnknown = b.fallbackToUnknown;
        this.source = b.copy();
    }

    private static <V> void putTag(Map<String, V> map, String tag, V value) {
        if (map.putIfAbsent(tag, value) != null) {
            throw new IllegalArgumentException("tag " + tag + " is already registered");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return source.copy();
    }

    Optional<SerdesType<?>> typeForTag(String tag) {
        return Optional.ofNullable(typesByTag.get(tag));
    }

    Optional<SerdesType<?>> typeForClass(Class<?> type) {
        return Optional.ofNullable(typesByClass.get(type));
    }

    Optional<SerdesEnum<?>> enumForTag(String tag) {
        return Optional.ofNullable(enumsByTag.get(tag));
    }

    Optional<SerdesEnum<?>> enumForClass(Class<?> type) {
        return Optional.ofNullable(enumsByClass.get(type));
    }

    public boolean fallbackToUnknown() { return fallbackToUnknown; }

    public boolean isRegistered(String tag) {
        return typesByTag.containsKey(tag) || enumsByTag.containsKey(tag);
    }

    public Collection<SerdesType<?>> types() { return typesByClass.values(); }

    public static final class Builder {
        private final Map<String, SerdesType<?>> types = new LinkedHashMap<>();
        private final Map<String, SerdesEnum<?>> enums = new LinkedHashMap<>();
        private boolean fallbackToUnknown;

        private Builder() {}

        public Builder register(SerdesType<?> type) {
            if (types.putIfAbsent(type.tag(), type) != null) {
                throw new IllegalArgumentException("tag " + type.tag() + " is already registered");
            }
            return this;
        }

        public Builder registerEnum(SerdesEnum<?> e) {
            if (enums.putIfAbsent(e.tag(), e) != null) {
                throw new IllegalArgumentException("enum tag " + e.tag() + " is already registered");
            }
            return this;
        }

        public <E extends Enum<E>> Builder registerEnum(Class<E> type) {
            return registerEnum(SerdesEnum.of(type));
        }

        /** Decode unregistered tags to {@link UnknownValue} instead of failing. */
        public Builder fallbackToUnknown() {
            this.fallbackToUnknown = true;
            return this;
        }

        private Builder copy() {
            Builder b = new Builder();
            b.types.putAll(types);
            b.enums.putAll(enums);
            b.fallbackToUnknown = fallbackToUnknown;
            return b;
        }

        public TypeRegistry build() {
            return new TypeRegistry(this);
        }
    }
}
