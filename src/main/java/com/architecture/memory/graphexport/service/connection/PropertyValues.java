package com.architecture.memory.graphexport.service.connection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts node attributes into values Neo4j can store as properties:
 * strings, booleans, integral and floating point numbers. Collections become string lists,
 * anything else is stored as its string form, nulls are dropped.
 */
final class PropertyValues {

    private PropertyValues() {
    }

    static Map<String, Object> coerceAll(Map<String, Object> properties) {
        Map<String, Object> coerced = new LinkedHashMap<>();
        if (properties == null) {
            return coerced;
        }
        properties.forEach((key, value) -> {
            Object converted = coerce(value);
            if (key != null && converted != null) {
                coerced.put(key, converted);
            }
        });
        return coerced;
    }

    static Object coerce(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                Object scalar = scalar(item);
                if (scalar != null) {
                    items.add(String.valueOf(scalar));
                }
            }
            return items;
        }
        return scalar(value);
    }

    private static Object scalar(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Double || value instanceof Float) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Enum<?> enumValue) {
            return enumValue.name();
        }
        return value.toString();
    }
}
