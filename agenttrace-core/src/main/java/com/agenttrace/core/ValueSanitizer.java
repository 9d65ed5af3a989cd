package com.agenttrace.core;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Converts arbitrary values into JSON-safe form.
 *
 * Rules:
 * - null, String, Boolean: unchanged
 * - Byte, Short, Integer, Long, AtomicInteger, AtomicLong: Long
 * - Float, Double: Double (NaN and infinities are not representable)
 * - Character: String; Enum: its name
 * - Collections and arrays: List of converted elements
 * - Maps with string, number, boolean, char or enum keys: Map&lt;String, Object&gt; of converted values
 * - Anything else, or a structure containing itself: not representable
 *
 * A value that is not representable anywhere inside it is replaced as a whole by
 * {@code String.valueOf(value) + " [NON-SERIALIZABLE]"}.
 */
public final class ValueSanitizer {

    public static final String NON_SERIALIZABLE_MARKER = "[NON-SERIALIZABLE]";

    private ValueSanitizer() {}

    public static Object sanitize(Object value) {
        try {
            return convert(value, new IdentityHashMap<>());
        } catch (NotRepresentable e) {
            return fallback(value);
        }
    }

    /**
     * Cuts strings longer than {@code limit} code points and records the original length in code
     * points. Surrogate pairs are never split. Non-strings, and any value when {@code limit <= 0},
     * pass through.
     */
    public static Object truncate(Object value, int limit) {
        if (limit <= 0 || !(value instanceof String s)) {
            return value;
        }
        int length = s.codePointCount(0, s.length());
        if (length <= limit) {
            return value;
        }
        return s.substring(0, s.offsetByCodePoints(0, limit)) + "... [TRUNCATED: original_size=" + length + "]";
    }

    private static Object convert(Object value, IdentityHashMap<Object, Boolean> visiting) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof AtomicInteger || value instanceof AtomicLong) {
            return ((Number) value).longValue();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) throw new NotRepresentable();
            return d;
        }
        if (value instanceof Character) {
            return value.toString();
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }

        if (visiting.containsKey(value)) {
            throw new NotRepresentable();
        }
        visiting.put(value, Boolean.TRUE);
        try {
            if (value instanceof Map<?, ?> map) {
                Map<String, Object> out = new LinkedHashMap<>();
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    out.put(convertKey(entry.getKey()), convert(entry.getValue(), visiting));
                }
                return out;
            }
            if (value instanceof Collection<?> col) {
                List<Object> out = new ArrayList<>(col.size());
                for (Object elem : col) {
                    out.add(convert(elem, visiting));
                }
                return out;
            }
            if (value.getClass().isArray()) {
                int len = Array.getLength(value);
                List<Object> out = new ArrayList<>(len);
                for (int i = 0; i < len; i++) {
                    out.add(convert(Array.get(value, i), visiting));
                }
                return out;
            }
        } finally {
            visiting.remove(value);
        }
        throw new NotRepresentable();
    }

    private static String convertKey(Object key) {
        if (key instanceof String s) return s;
        if (key instanceof Enum<?> e) return e.name();
        if (key instanceof Number || key instanceof Boolean || key instanceof Character) {
            return String.valueOf(key);
        }
        throw new NotRepresentable();
    }

    private static String fallback(Object value) {
        String text;
        try {
            text = String.valueOf(value);
        } catch (RuntimeException e) {
            // a broken toString() must not break capture
            text = "<" + value.getClass().getName() + ">";
        }
        return text + " " + NON_SERIALIZABLE_MARKER;
    }

    private static final class NotRepresentable extends RuntimeException {
        NotRepresentable() {
            super(null, null, false, false);
        }
    }
}
