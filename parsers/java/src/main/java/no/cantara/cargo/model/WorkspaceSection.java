package no.cantara.cargo.model;

import no.cantara.cargo.InvalidManifestException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed view of the {@code [workspace]} table. Only {@code package} and {@code members}
 * are decoded; {@code resolver}, {@code exclude}, {@code dependencies} and anything else
 * round-trip through {@code unhandled}.
 *
 * <p>An empty member list is written out the same as an absent one.
 */
public record WorkspaceSection(
        WorkspacePackage workspacePackage,
        List<String> members,
        Map<String, Object> unhandled
) {
    static final Set<String> KEYS = Set.of("package", "members");

    public WorkspaceSection {
        members = members != null ? List.copyOf(members) : null;
        unhandled = Tables.freezeTable(Tables.remainder(
                unhandled != null ? unhandled : Map.of(), KEYS));
    }

    public static WorkspaceSection fromMap(Map<String, Object> table) {
        WorkspacePackage pkg = table.containsKey("package")
                ? WorkspacePackage.fromMap(Tables.table(table.get("package"), "workspace.package"))
                : null;
        List<String> members = null;
        if (table.containsKey("members")) {
            members = new ArrayList<>();
            for (Object member : Tables.array(table.get("members"), "workspace.members")) {
                if (!(member instanceof String s)) {
                    throw new InvalidManifestException(
                            "workspace.members: entries must be strings, got " + Tables.describe(member));
                }
                members.add(s);
            }
        }
        return new WorkspaceSection(pkg, members, Tables.remainder(table, KEYS));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> typed = new LinkedHashMap<>();
        typed.put("package", workspacePackage != null ? workspacePackage.toMap() : null);
        typed.put("members", members != null && !members.isEmpty() ? members : null);
        return Tables.merge(typed, unhandled);
    }

    public WorkspaceSection withMembers(List<String> members) {
        return new WorkspaceSection(workspacePackage, members, unhandled);
    }

    public WorkspaceSection withPackage(WorkspacePackage workspacePackage) {
        return new WorkspaceSection(workspacePackage, members, unhandled);
    }
}
