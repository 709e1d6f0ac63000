package work.canopy.shared;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the free-form value universe used by params, choices and metadata:
 * {@code null}, {@link Boolean}, {@link Number}, {@link String}, {@link List} and insertion-ordered {@link Map}.
 */
public final class Values {
    private Values() {}

    public static Object copy(Object value) {
        if (value == null || value instanceof Boolean || value instanceof String) {
            return value;
        }
        if (value instanceof Number number) {
            return number(number);
        }
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), copy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<>(list.size());
            for (var item : list) {
                copy.add(copy(item));
            }
            return copy;
        }
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }

    /**
     * The form Jackson reads a number back as: integral values become {@code Integer} when they fit, then
     * {@code Long}, then {@code BigInteger}; everything else becomes {@code Double}.
     */
    public static Number number(Number value) {
        if (value instanceof Integer || value instanceof Double) {
            return value;
        }
        if (value instanceof Byte || value instanceof Short) {
            return value.intValue();
        }
        if (value instanceof Long longValue) {
            return integral(BigInteger.valueOf(longValue));
        }
        if (value instanceof BigInteger big) {
            return integral(big);
        }
        if (value instanceof Float) {
            return Double.valueOf(value.toString());
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        return value.doubleValue();
    }

    private static Number integral(BigInteger value) {
        if (value.bitLength() < Integer.SIZE) {
            return value.intValue();
        }
        if (value.bitLength() < Long.SIZE) {
            return value.longValue();
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> copyMap(Map<String, ?> map) {
        if (map == null) {
            return new LinkedHashMap<>();
        }
        return (Map<String, Object>) copy(map);
    }

    @SuppressWarnings("unchecked")
    public static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<>(list.size());
            for (var item : list) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return copy(value);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> freezeMap(Map<String, ?> map) {
        if (map == null) {
            return Map.of();
        }
        return (Map<String, Object>) freeze(map);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    public static List<?> asList(Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        return List.of();
    }

    public static String asString(Object value, String fallback) {
        if (value == null) {
            return fallback;
        }
        return String.valueOf(value);
    }
}
