package no.cantara.cargo.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Typed view of the {@code [package]} table.
 *
 * <p>{@code name}, {@code version} and {@code edition} are decoded; every other key is kept
 * verbatim in {@code unhandled} and written back unchanged.
 */
public record PackageSection(
        String name,
        String version,
        String edition,
        Map<String, Object> unhandled
) {
    static final Set<String> KEYS = Set.of("name", "version", "edition");

    public PackageSection {
        unhandled = Tables.freezeTable(Tables.remainder(
                unhandled != null ? unhandled : Map.of(), KEYS));
    }

    public PackageSection(String name, String version, String edition) {
        this(name, version, edition, null);
    }

    public static PackageSection fromMap(Map<String, Object> table) {
        return new PackageSection(
                Tables.requiredString(table, "name", "package"),
                Tables.string(table, "version", "package"),
                Tables.string(table, "edition", "package"),
                Tables.remainder(table, KEYS)
        );
    }

    public Map<String, Object> toMap() {
        Map<String, Object> typed = new LinkedHashMap<>();
        typed.put("name", name);
        typed.put("version", version);
        typed.put("edition", edition);
        return Tables.merge(typed, unhandled);
    }

    public PackageSection withVersion(String version) {
        return new PackageSection(name, version, edition, unhandled);
    }

    public PackageSection withEdition(String edition) {
        return new PackageSection(name, version, edition, unhandled);
    }

    /** Sets an unhandled key; {@code null} removes it from the written manifest. */
    public PackageSection withUnhandled(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(unhandled);
        copy.put(key, value);
        return new PackageSection(name, version, edition, copy);
    }
}
