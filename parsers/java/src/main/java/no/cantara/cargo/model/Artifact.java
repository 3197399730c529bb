package no.cantara.cargo.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A build output of a workspace member, derived from its metadata targets.
 */
public record Artifact(
        String name,
        String path,
        ArtifactKind kind
) {
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", name);
        m.put("path", path);
        m.put("kind", kind.name());
        return m;
    }
}
