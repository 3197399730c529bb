package no.cantara.cargo.model;

import no.cantara.cargo.InvalidManifestException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Helpers for splitting raw TOML tables into typed fields and merging them back.
 *
 * <p>Raw tables are {@code Map<String, Object>} trees whose leaves are the values the TOML
 * reader produced. A {@code null} value is the "absent" marker: it is carried in memory
 * but never written out.
 */
public final class Tables {

    private Tables() {}

    /**
     * Returns a deep, read-only copy of a raw value. Maps keep their key order.
     */
    public static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeTable(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    public static Map<String, Object> freezeTable(Map<?, ?> table) {
        if (table == null) return Map.of();
        Map<String, Object> copy = new LinkedHashMap<>();
        table.forEach((k, v) -> copy.put(String.valueOf(k), freeze(v)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * The keys of {@code table} not named in {@code consumed}, in their original order.
     */
    public static Map<String, Object> remainder(Map<String, Object> table, Set<String> consumed) {
        Map<String, Object> rest = new LinkedHashMap<>();
        table.forEach((k, v) -> {
            if (!consumed.contains(k)) rest.put(k, v);
        });
        return rest;
    }

    /**
     * Builds the output table for a typed section: typed values first, then every unhandled
     * entry whose key the typed fields did not claim. Null values are dropped on both sides.
     */
    public static Map<String, Object> merge(Map<String, Object> typed, Map<String, Object> unhandled) {
        Map<String, Object> out = new LinkedHashMap<>();
        typed.forEach((k, v) -> {
            if (v != null) out.put(k, v);
        });
        if (unhandled != null) {
            unhandled.forEach((k, v) -> {
                if (v != null && !typed.containsKey(k)) out.put(k, v);
            });
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> table(Object value, String context) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new InvalidManifestException(context + ": expected a table, got " + describe(value));
    }

    public static List<?> array(Object value, String context) {
        if (value instanceof List<?> list) {
            return list;
        }
        throw new InvalidManifestException(context + ": expected an array, got " + describe(value));
    }

    /**
     * Reads an optional string field. Missing keys yield {@code null}.
     */
    public static String string(Map<String, Object> table, String key, String context) {
        Object value = table.get(key);
        if (value == null) return null;
        if (value instanceof String s) return s;
        throw new InvalidManifestException(context + ": '" + key + "' must be a string, got " + describe(value));
    }

    public static String requiredString(Map<String, Object> table, String key, String context) {
        String value = string(table, key, context);
        if (value == null) {
            throw new InvalidManifestException(context + ": '" + key + "' is required");
        }
        return value;
    }

    static String describe(Object value) {
        return value == null ? "nothing" : value.getClass().getSimpleName();
    }
}
