package net.tessera.core.serdes;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.tessera.core.error.SerializationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Tagged JSON codec over a {@link TypeRegistry}.
 *
 * <p>Composites are written as objects carrying {@value #CLASS_KEY}, enums as
 * {@code {"__enum__": "Tag.VALUE"}}, sets as {@code {"__set__": [...]}}. Object keys and set elements are
 * emitted in sorted order, so equal values always encode to the same string. Whole numbers decode as
 * {@link Long} and fractional ones as {@link Double}; narrower number types are widened on write.
 */
public final class Serdes {

    public static final String CLASS_KEY = "__class__";
    public static final String ENUM_KEY = "__enum__";
    public static final String SET_KEY = "__set__";
    public static final String FROZENSET_KEY = "__frozenset__";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final TypeRegistry registry;
    private final ObjectMapper mapper;

    public Serdes(TypeRegistry registry) {
        this.registry = registry;
        this.mapper = new ObjectMapper();
    }

    public TypeRegistry registry() { return registry; }

    public String serialize(Object value) {
        try {
            return mapper.writeValueAsString(pack(value));
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to write " + value.getClass().getSimpleName(), e);
        }
    }

    public Object deserialize(String json) {
        if (json == null) throw new SerializationException("Cannot deserialize null");
        JsonNode tree;
        try {
            tree = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        return unpack(tree);
    }

    public <T> T deserialize(String json, Class<T> type) {
        Object value = deserialize(json);
        if (!type.isInstance(value)) {
            throw new SerializationException("Expected " + type.getSimpleName() + " but decoded "
                    + (value == null ? "null" : value.getClass().getSimpleName()));
        }
        return type.cast(value);
    }

    public JsonNode pack(Object value) {
        if (value == null) return NODES.nullNode();
        if (value instanceof String s) return NODES.textNode(s);
        if (value instanceof Boolean b) return NODES.booleanNode(b);
        if (value instanceof Long l) return NODES.numberNode(l);
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return NODES.numberNode(((Number) value).longValue());
        }
        if (value instanceof Double d) return NODES.numberNode(d);
        if (value instanceof Float f) return NODES.numberNode(f.doubleValue());
        if (value instanceof UnknownValue u) return u.raw().deepCopy();
        if (value instanceof Enum<?> e) return packEnum(e);
        if (value instanceof Set<?> set) return packSet(set);
        if (value instanceof Collection<?> list) {
            ArrayNode array = NODES.arrayNode();
            for (Object o : list) array.add(pack(o));
            return array;
        }
        if (value instanceof Map<?, ?> map) return packMap(map);
        SerdesType<?> type = registry.typeForClass(value.getClass())
                .orElseThrow(() -> new SerializationException("Type " + value.getClass().getName() + " is not registered"));
        return packComposite(type, value);
    }

    private <T> ObjectNode packComposite(SerdesType<T> type, Object value) {
        T typed = type.type().cast(value);
        Map<String, JsonNode> sorted = new TreeMap<>();
        for (SerdesType.Field<T> f : type.fields()) {
            Object v = f.getter.apply(typed);
            if (f.skip(v)) continue;
            sorted.put(f.name, pack(v));
        }
        ObjectNode node = NODES.objectNode();
        node.put(CLASS_KEY, type.tag());
        sorted.forEach(node::set);
        return node;
    }

    private ObjectNode packEnum(Enum<?> value) {
        SerdesEnum<?> e = registry.enumForClass(value.getDeclaringClass())
                .orElseThrow(() -> new SerializationException("Enum " + value.getDeclaringClass().getName() + " is not registered"));
        ObjectNode node = NODES.objectNode();
        node.put(ENUM_KEY, e.pack(value));
        return node;
    }

    private ObjectNode packSet(Set<?> set) {
        Map<String, JsonNode> byEncoding = new TreeMap<>();
        for (Object o : set) {
            JsonNode packed = pack(o);
            byEncoding.put(packed.toString(), packed);
        }
        ArrayNode array = NODES.arrayNode();
        byEncoding.values().forEach(array::add);
        ObjectNode node = NODES.objectNode();
        node.set(SET_KEY, array);
        return node;
    }

    private ObjectNode packMap(Map<?, ?> map) {
        Map<String, JsonNode> sorted = new TreeMap<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (!(e.getKey() instanceof String key)) {
                throw new SerializationException("Map keys must be strings, found " + e.getKey());
            }
            if (key.equals(CLASS_KEY) || key.equals(ENUM_KEY) || key.equals(SET_KEY) || key.equals(FROZENSET_KEY)) {
                throw new SerializationException("Map key " + key + " is reserved");
            }
            sorted.put(key, pack(e.getValue()));
        }
        ObjectNode node = NODES.objectNode();
        sorted.forEach(node::set);
        return node;
    }

    public Object unpack(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isTextual()) return node.textValue();
        if (node.isBoolean()) return node.booleanValue();
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) throw new SerializationException("Integer out of range: " + node.asText());
            return node.longValue();
        }
        if (node.isNumber()) return node.doubleValue();
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            for (JsonNode n : node) list.add(unpack(n));
            return list;
        }
        if (!node.isObject()) throw new SerializationException("Unsupported JSON node " + node.getNodeType());
        ObjectNode obj = (ObjectNode) node;
        if (obj.has(CLASS_KEY)) return unpackComposite(obj);
        if (obj.has(ENUM_KEY)) return unpackEnum(obj.get(ENUM_KEY));
        if (obj.has(SET_KEY)) return unpackSet(obj.get(SET_KEY));
        if (obj.has(FROZENSET_KEY)) return unpackSet(obj.get(FROZENSET_KEY));
        Map<String, Object> map = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = obj.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            map.put(e.getKey(), unpack(e.getValue()));
        }
        return map;
    }

    private Object unpackComposite(ObjectNode obj) {
        String tag = obj.get(CLASS_KEY).asText();
        SerdesType<?> type = registry.typeForTag(tag).orElse(null);
        if (type == null) {
            if (registry.fallbackToUnknown()) return new UnknownValue(tag, obj);
            throw new SerializationException("Unknown type tag " + tag);
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = obj.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (CLASS_KEY.equals(e.getKey())) continue;
            fields.put(e.getKey(), unpack(e.getValue()));
        }
        try {
            return type.construct(fields);
        } catch (SerializationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SerializationException("Cannot construct " + tag + ": " + e.getMessage(), e);
        }
    }

    private Object unpackEnum(JsonNode node) {
        String text = node.asText();
        int dot = text.lastIndexOf('.');
        if (dot <= 0) throw new SerializationException("Malformed enum value " + text);
        String tag = text.substring(0, dot);
        SerdesEnum<?> e = registry.enumForTag(tag)
                .orElseThrow(() -> new SerializationException("Unknown enum tag " + tag));
        return e.unpack(text.substring(dot + 1));
    }

    private Set<Object> unpackSet(JsonNode node) {
        if (!node.isArray()) throw new SerializationException("Set payload must be an array");
        Set<Object> set = new LinkedHashSet<>();
        for (JsonNode n : node) set.add(unpack(n));
        return set;
    }
}
