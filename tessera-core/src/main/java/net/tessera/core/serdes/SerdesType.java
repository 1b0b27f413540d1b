package net.tessera.core.serdes;

import net.tessera.core.error.SerializationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Codec registration of one composite type: its tag, the fields it writes, how absent or renamed
 * fields are resolved on read, and the factory that rebuilds the value.
 */
public final class SerdesType<T> {

    private final String tag;
    private final Class<T> type;
    private final List<Field<T>> fields;
    private final Map<String, String> renames;
    private final Set<String> legacyTags;
    private final UnaryOperator<Map<String, Object>> unpackHook;
    private final Function<FieldValues, T> factory;

    private SerdesType(Builder<T> b) {
        this.tag = b.tag;
        this.type = b.type;
        this.fields = List.copyOf(b.fields);
        this.renames = Map.copyOf(b.renames);
        this.legacyTags = Set.copyOf(b.legacyTags);
        this.unpackHook = b.unpackHook;
        this.factory = Objects.requireNonNull(b.factory, "factory of " + b.tag);
    }

    public static <T> Builder<T> builder(String tag, Class<T> type) {
        return new Builder<>(tag, type);
    }

    public String tag() { return tag; }

    public Class<T> type() { return type; }

    public Set<String> legacyTags() { return legacyTags; }

    List<Field<T>> fields() { return fields; }

    /** Resolves a decoded field map into the constructor arguments. */
    T construct(Map<String, Object> decoded) {
        Map<String, Object> values = new LinkedHashMap<>(decoded);
        for (Map.Entry<String, String> rename : renames.entrySet()) {
            if (!values.containsKey(rename.getKey())) continue;
            Object legacy = values.remove(rename.getKey());
            values.putIfAbsent(rename.getValue(), legacy);
        }
        if (unpackHook != null) {
            values = unpackHook.apply(values);
        }
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Field<T> f : fields) {
            if (values.containsKey(f.name)) {
                resolved.put(f.name, values.get(f.name));
            } else if (f.defaultValue != null) {
                resolved.put(f.name, f.defaultValue.get());
            } else {
                throw new SerializationException("Missing required field '" + f.name + "' for " + tag);
            }
        }
        return factory.apply(new FieldValues(tag, resolved));
    }

    static final class Field<T> {
        final String name;
        final Function<T, Object> getter;
        final Supplier<Object> defaultValue;
        final boolean skipWhenEmpty;

        Field(String name, Function<T, Object> getter, Supplier<Object> defaultValue, boolean skipWhenEmpty) {
            this.name = name;
            this.getter = getter;
            this.defaultValue = defaultValue;
            this.skipWhenEmpty = skipWhenEmpty;
        }

        boolean skip(Object value) {
            if (!skipWhenEmpty) return false;
            if (value == null) return true;
            if (value instanceof Collection<?> c) return c.isEmpty();
            if (value instanceof Map<?, ?> m) return m.isEmpty();
            return false;
        }
    }

    public static final class Builder<T> {
        private final String tag;
        private final Class<T> type;
        private final List<Field<T>> fields = new ArrayList<>();
        private final Map<String, String> renames = new LinkedHashMap<>();
        private final Set<String> legacyTags = new LinkedHashSet<>();
        private UnaryOperator<Map<String, Object>> unpackHook;
        private Function<FieldValues, T> factory;

        private Builder(String tag, Class<T> type) {
            this.tag = Objects.requireNonNull(tag, "tag");
            this.type = Objects.requireNonNull(type, "type");
        }

        /** Required field: decoding fails when it is absent. */
        public Builder<T> field(String name, Function<T, Object> getter) {
            fields.add(new Field<>(name, getter, null, false));
            return this;
        }

        public Builder<T> field(String name, Function<T, Object> getter, Supplier<Object> defaultValue) {
            fields.add(new Field<>(name, getter, Objects.requireNonNull(defaultValue, "defaultValue"), false));
            return this;
        }

        /** Field that decodes to null when absent. */
        public Builder<T> optionalField(String name, Function<T, Object> getter) {
            fields.add(new Field<>(name, getter, () -> null, false));
            return this;
        }

        /** Field left out of the encoding while null or empty; absent on read means {@code defaultValue}. */
        public Builder<T> skipWhenEmpty(String name, Function<T, Object> getter, Supplier<Object> defaultValue) {
            fields.add(new Field<>(name, getter, Objects.requireNonNull(defaultValue, "defaultValue"), true));
            return this;
        }

        /** Reads {@code oldName} as {@code newName}. When both are present the current name wins. */
        public Builder<T> renamedField(String oldName, String newName) {
            renames.put(oldName, newName);
            return this;
        }

        public Builder<T> legacyTag(String legacyTag) {
            legacyTags.add(legacyTag);
            return this;
        }

        /** Runs after renames and before defaults; may rewrite the decoded field map. */
        public Builder<T> unpackHook(UnaryOperator<Map<String, Object>> hook) {
            this.unpackHook = hook;
            return this;
        }

        public Builder<T> factory(Function<FieldValues, T> factory) {
            this.factory = factory;
            return this;
        }

        public SerdesType<T> build() {
            Set<String> names = new LinkedHashSet<>();
            for (Field<T> f : fields) {
                if (!names.add(f.name)) throw new IllegalArgumentException("duplicate field " + f.name + " in " + tag);
            }
            return new SerdesType<>(this);
        }
    }
}
