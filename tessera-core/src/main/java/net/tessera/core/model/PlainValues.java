package net.tessera.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Free-form values (run config, untyped event data) in the shape the codec reads them back:
 * whole numbers as {@link Long}, fractional numbers as {@link Double}, collections unmodifiable.
 */
public final class PlainValues {
    private PlainValues() {}

    public static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) return f.doubleValue();
        if (value instanceof Map<?, ?> map) return normalizeMap(map);
        if (value instanceof Set<?> set) {
            Set<Object> out = new LinkedHashSet<>();
            for (Object o : set) out.add(normalize(o));
            return Collections.unmodifiableSet(out);
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object o : list) out.add(normalize(o));
            return Collections.unmodifiableList(out);
        }
        return value;
    }

    public static <K> Map<K, Object> normalizeMap(Map<K, ?> map) {
        Map<K, Object> out = new LinkedHashMap<>();
        for (Map.Entry<K, ?> e : map.entrySet()) out.put(e.getKey(), normalize(e.getValue()));
        return Collections.unmodifiableMap(out);
    }
}
