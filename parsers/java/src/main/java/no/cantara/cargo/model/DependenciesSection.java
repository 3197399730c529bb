package no.cantara.cargo.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The {@code [dependencies]} table, carried as an opaque mapping. A dependency spec may be a
 * version string or a table of git/path/features options; none of it is interpreted here.
 */
public record DependenciesSection(Map<String, Object> data) {

    public DependenciesSection {
        data = Tables.freezeTable(data);
    }

    public static DependenciesSection fromMap(Map<String, Object> table) {
        return new DependenciesSection(table);
    }

    public Map<String, Object> toMap() {
        return new LinkedHashMap<>(data);
    }

    public Set<String> names() {
        return data.keySet();
    }

    public Object get(String name) {
        return data.get(name);
    }

    public DependenciesSection with(String name, Object spec) {
        Map<String, Object> copy = new LinkedHashMap<>(data);
        copy.put(name, spec);
        return new DependenciesSection(copy);
    }

    public DependenciesSection without(String name) {
        Map<String, Object> copy = new LinkedHashMap<>(data);
        copy.remove(name);
        return new DependenciesSection(copy);
    }
}
