package com.slidebind.template.parser;

import java.io.File;
import java.lang.reflect.Array;
import java.net.URI;
import java.nio.file.Path;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Collections;
import java.util.Date;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.slidebind.debug.Debug;

/**
 * Converts host data into {@link Value}s.
 *
 * Maps and JSON objects become property sources; lists, arrays, iterables and JSON
 * arrays become indexable sources; other beans are converted to a JSON tree through
 * Jackson and then bound like any JSON object. Conversion is lazy: children are
 * bound when first accessed.
 */
public final class ValueBinder {

    private static final String TAG = "slidebind.eval";

    // java.time fields of beans are written as ISO-8601 text
    private static final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private ValueBinder() {}

    public static Value bind(Object o) {
        if (o == null) return Value.nil();
        if (o instanceof Value) return (Value) o;
        if (o instanceof JsonNode) return bindJson((JsonNode) o);
        if (isScalar(o)) return Value.scalar(o);

        if (o instanceof Map<?, ?>) return Value.properties(new MapSource((Map<?, ?>) o));
        if (o instanceof List<?>) return Value.indexable(new ListSource((List<?>) o));
        if (o.getClass().isArray()) return Value.indexable(new ArraySource(o));
        if (o instanceof Iterable<?>) return Value.indexable(new ListSource(drain((Iterable<?>) o)));

        JsonNode tree = om.valueToTree(o);
        return bindJson(tree);
    }

    /**
     * Binds every entry of a host data map. An entry Jackson cannot convert is
     * logged and left unbound, so its expressions resolve as unresolved.
     */
    public static Map<String, Value> bindAll(Map<String, ?> data) {
        Map<String, Value> out = new LinkedHashMap<>();
        if (data == null) return out;
        for (Map.Entry<String, ?> e : data.entrySet()) {
            try {
                out.put(e.getKey(), bind(e.getValue()));
            } catch (IllegalArgumentException ex) {
                Debug.get().w(TAG, "Data entry '" + e.getKey() + "' could not be bound: " + ex.getMessage(), ex);
            }
        }
        return out;
    }

    public static Value bindJson(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) return Value.nil();
        if (n.isObject()) return Value.properties(new JsonObjectSource(n));
        if (n.isArray()) return Value.indexable(new JsonArraySource(n));
        if (n.isBoolean()) return Value.scalar(n.booleanValue());
        if (n.isNumber()) return Value.scalar(n.numberValue());
        return Value.scalar(n.asText());
    }

    static boolean isScalar(Object o) {
        return o instanceof CharSequence
                || o instanceof Number
                || o instanceof Boolean
                || o instanceof Character
                || o instanceof Enum<?>
                || o instanceof TemporalAccessor
                || o instanceof Date
                || o instanceof Calendar
                || o instanceof UUID
                || o instanceof File
                || o instanceof Path
                || o instanceof URI;
    }

    private static List<Object> drain(Iterable<?> it) {
        List<Object> out = new ArrayList<>();
        for (Object e : it) out.add(e);
        return out;
    }

    // -------------------------
    // Sources
    // -------------------------

    private static final class MapSource implements Value.PropertySource {
        private final Map<?, ?> map;

        MapSource(Map<?, ?> map) {
            this.map = map;
        }

        @Override
        public Value property(String name) {
            if (map.containsKey(name)) return bind(map.get(name));
            String key = Value.fold(name);
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (e.getKey() != null && Value.fold(e.getKey().toString()).equals(key)) {
                    return bind(e.getValue());
                }
            }
            return null;
        }

        @Override
        public List<String> names() {
            List<String> out = new ArrayList<>(map.size());
            for (Object k : map.keySet()) out.add(String.valueOf(k));
            return out;
        }
    }

    private static final class ListSource implements Value.IndexSource {
        private final List<?> list;

        ListSource(List<?> list) {
            this.list = list;
        }

        @Override
        public int count() { return list.size(); }

        @Override
        public Value item(int index) { return bind(list.get(index)); }
    }

    private static final class ArraySource implements Value.IndexSource {
        private final Object array;

        ArraySource(Object array) {
            this.array = array;
        }

        @Override
        public int count() { return Array.getLength(array); }

        @Override
        public Value item(int index) { return bind(Array.get(array, index)); }
    }

    private static final class JsonObjectSource implements Value.PropertySource {
        private final JsonNode node;

        JsonObjectSource(JsonNode node) {
            this.node = node;
        }

        @Override
        public Value property(String name) {
            if (node.has(name)) return bindJson(node.get(name));
            String key = Value.fold(name);
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (Value.fold(e.getKey()).equals(key)) return bindJson(e.getValue());
            }
            return null;
        }

        @Override
        public List<String> names() {
            List<String> out = new ArrayList<>();
            node.fieldNames().forEachRemaining(out::add);
            return Collections.unmodifiableList(out);
        }
    }

    private static final class JsonArraySource implements Value.IndexSource {
        private final JsonNode node;

        JsonArraySource(JsonNode node) {
            this.node = node;
        }

        @Override
        public int count() { return node.size(); }

        @Override
        public Value item(int index) { return bindJson(node.get(index)); }
    }
}
