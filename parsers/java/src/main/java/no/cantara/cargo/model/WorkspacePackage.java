package no.cantara.cargo.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Typed view of {@code [workspace.package]}, the defaults members may inherit.
 * Unlike {@link PackageSection} it has no name.
 */
public record WorkspacePackage(
        String version,
        String edition,
        Map<String, Object> unhandled
) {
    static final Set<String> KEYS = Set.of("version", "edition");

    public WorkspacePackage {
        unhandled = Tables.freezeTable(Tables.remainder(
                unhandled != null ? unhandled : Map.of(), KEYS));
    }

    public static WorkspacePackage fromMap(Map<String, Object> table) {
        return new WorkspacePackage(
                Tables.string(table, "version", "workspace.package"),
                Tables.string(table, "edition", "workspace.package"),
                Tables.remainder(table, KEYS)
        );
    }

    public Map<String, Object> toMap() {
        Map<String, Object> typed = new LinkedHashMap<>();
        typed.put("version", version);
        typed.put("edition", edition);
        return Tables.merge(typed, unhandled);
    }

    public WorkspacePackage withVersion(String version) {
        return new WorkspacePackage(version, edition, unhandled);
    }
}
