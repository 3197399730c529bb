package no.cantara.cargo.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A {@code [[bin]]} entry: an explicitly declared executable target.
 * Extra keys such as {@code required-features} are kept in {@code unhandled}.
 */
public record Bin(
        String name,
        String path,
        Map<String, Object> unhandled
) {
    static final Set<String> KEYS = Set.of("name", "path");

    public Bin {
        unhandled = Tables.freezeTable(Tables.remainder(
                unhandled != null ? unhandled : Map.of(), KEYS));
    }

    public Bin(String name, String path) {
        this(name, path, null);
    }

    public static Bin fromMap(Map<String, Object> table) {
        return new Bin(
                Tables.requiredString(table, "name", "bin"),
                Tables.string(table, "path", "bin"),
                Tables.remainder(table, KEYS)
        );
    }

    public Map<String, Object> toMap() {
        Map<String, Object> typed = new LinkedHashMap<>();
        typed.put("name", name);
        typed.put("path", path);
        return Tables.merge(typed, unhandled);
    }
}
