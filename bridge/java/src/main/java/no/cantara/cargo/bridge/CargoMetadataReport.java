package no.cantara.cargo.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import no.cantara.cargo.CargoMetadata;
import no.cantara.cargo.model.Artifact;
import no.cantara.cargo.model.WorkspaceMember;

/**
 * Pure rendering functions: {@link CargoMetadata} → text and JSON reports.
 * No I/O.
 */
public final class CargoMetadataReport {

    private CargoMetadataReport() {}

    private static final ObjectMapper JSON = new ObjectMapper();

    // ── Text ──────────────────────────────────────────────────────────────────────

    public static String toText(CargoMetadata metadata) {
        StringBuilder sb = new StringBuilder();
        sb.append("Workspace members (").append(metadata.workspaceMembers().size()).append("):\n");
        for (WorkspaceMember m : metadata.workspaceMembers()) {
            sb.append("  ").append(m.name()).append(' ').append(m.version())
              .append(" (edition ").append(m.edition()).append(")\n");
        }
        sb.append("Artifacts (").append(metadata.artifacts().size()).append("):\n");
        for (Artifact a : metadata.artifacts()) {
            sb.append("  ").append(a.kind().name().toLowerCase()).append(' ')
              .append(a.name()).append(" <- ").append(a.path()).append('\n');
        }
        return sb.toString();
    }

    // ── JSON ──────────────────────────────────────────────────────────────────────

    public static ObjectNode toJsonNode(CargoMetadata metadata) {
        ObjectNode root = JSON.createObjectNode();
        ArrayNode members = root.putArray("workspace_members");
        for (WorkspaceMember m : metadata.workspaceMembers()) {
            ObjectNode node = members.addObject();
            node.put("id", m.id());
            node.put("name", m.name());
            node.put("version", m.version());
            node.put("edition", m.edition());
            node.put("manifest_path", m.manifestPath() != null ? m.manifestPath().toString() : null);
        }
        ArrayNode artifacts = root.putArray("artifacts");
        for (Artifact a : metadata.artifacts()) {
            artifacts.add(JSON.valueToTree(a.toMap()));
        }
        return root;
    }

    public static String toJson(CargoMetadata metadata) {
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(toJsonNode(metadata));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render metadata report", e);
        }
    }
}
