package net.tessera.core.serdes;

import net.tessera.core.error.SerializationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolved fields handed to a {@link SerdesType} factory. Getters check the decoded type and fail the
 * decode with a {@link SerializationException} on a mismatch.
 */
public final class FieldValues {

    private final String tag;
    private final Map<String, Object> values;

    FieldValues(String tag, Map<String, Object> values) {
        this.tag = tag;
        this.values = values;
    }

    public Object get(String name) {
        return values.get(name);
    }

    public <V> V value(String name, Class<V> type) {
        Object v = values.get(name);
        if (v == null) return null;
        if (!type.isInstance(v)) throw mismatch(name, type.getSimpleName(), v);
        return type.cast(v);
    }

    public String getString(String name) {
        return value(name, String.class);
    }

    public Boolean getBoolean(String name) {
        return value(name, Boolean.class);
    }

    public Double getDouble(String name) {
        Number n = value(name, Number.class);
        return n == null ? null : n.doubleValue();
    }

    public Long getLong(String name) {
        Number n = value(name, Number.class);
        return n == null ? null : n.longValue();
    }

    public Integer getInt(String name) {
        Number n = value(name, Number.class);
        if (n == null) return null;
        long l = n.longValue();
        if (l != n.doubleValue() || l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) throw mismatch(name, "int", n);
        return (int) l;
    }

    public <E extends Enum<E>> E getEnum(String name, Class<E> type) {
        return value(name, type);
    }

    @SuppressWarnings("unchecked")
    public <V> List<V> getList(String name, Class<V> elementType) {
        Object v = values.get(name);
        if (v == null) return null;
        if (!(v instanceof List<?> list)) throw mismatch(name, "list", v);
        for (Object e : list) {
            if (e != null && !elementType.isInstance(e)) throw mismatch(name, "list of " + elementType.getSimpleName(), e);
        }
        return new ArrayList<>((List<V>) list);
    }

    /** Accepts a decoded set or, for values written before the field became a set, a list. */
    @SuppressWarnings("unchecked")
    public <V> Set<V> getSet(String name, Class<V> elementType) {
        Object v = values.get(name);
        if (v == null) return null;
        if (!(v instanceof Set<?>) && !(v instanceof List<?>)) throw mismatch(name, "set", v);
        for (Object e : (Iterable<?>) v) {
            if (e != null && !elementType.isInstance(e)) throw mismatch(name, "set of " + elementType.getSimpleName(), e);
        }
        return new LinkedHashSet<>((java.util.Collection<V>) v);
    }

    @SuppressWarnings("unchecked")
    public <V> Map<String, V> getMap(String name, Class<V> valueType) {
        Object v = values.get(name);
        if (v == null) return null;
        if (!(v instanceof Map<?, ?> map)) throw mismatch(name, "map", v);
        for (Object e : map.values()) {
            if (e != null && !valueType.isInstance(e)) throw mismatch(name, "map of " + valueType.getSimpleName(), e);
        }
        return new LinkedHashMap<>((Map<String, V>) map);
    }

    private SerializationException mismatch(String name, String expected, Object actual) {
        return new SerializationException("Field '" + name + "' of " + tag + " expected " + expected
                + " but was " + actual.getClass().getSimpleName());
    }
}
