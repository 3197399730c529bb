package no.cantara.cargo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import no.cantara.cargo.model.Artifact;
import no.cantara.cargo.model.ArtifactKind;
import no.cantara.cargo.model.Tables;
import no.cantara.cargo.model.WorkspaceMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The workspace members and build artifacts reported by one
 * {@code cargo metadata --no-deps --format-version=1} run.
 *
 * <p>Only packages listed in {@code workspace_members} are kept. Each of their targets is
 * classified by its {@code kind} tags; targets that are neither {@code bin} nor {@code lib}
 * (examples, tests, benches, build scripts) produce no artifact.
 */
public record CargoMetadata(
        Path path,
        Map<String, Object> data,
        List<WorkspaceMember> workspaceMembers,
        List<Artifact> artifacts
) {
    private static final Logger log = LoggerFactory.getLogger(CargoMetadata.class);

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT = new TypeReference<>() {};

    public CargoMetadata {
        data = Tables.freezeTable(data);
        workspaceMembers = workspaceMembers != null ? List.copyOf(workspaceMembers) : List.of();
        artifacts = artifacts != null ? List.copyOf(artifacts) : List.of();
    }

    /**
     * Parses metadata JSON produced for the project at {@code projectDir}.
     *
     * @throws CargoParseException if the text is not a JSON object
     */
    public static CargoMetadata parse(Path projectDir, String json) {
        Map<String, Object> data;
        try {
            data = JSON.readValue(json, OBJECT);
        } catch (JsonProcessingException e) {
            throw new CargoParseException("Malformed cargo metadata for " + projectDir + ": " + e.getOriginalMessage(), e);
        }
        if (data == null) {
            throw new CargoParseException("Malformed cargo metadata for " + projectDir + ": not a JSON object");
        }
        return of(projectDir, data);
    }

    public static CargoMetadata of(Path projectDir, Map<String, Object> data) {
        Set<String> memberIds = new HashSet<>();
        for (Object id : list(data.get("workspace_members"), "workspace_members")) {
            if (!(id instanceof String s)) {
                throw new CargoParseException("cargo metadata: 'workspace_members[]' must be a string");
            }
            memberIds.add(s);
        }

        List<WorkspaceMember> members = new ArrayList<>();
        List<Artifact> artifacts = new ArrayList<>();
        for (Object entry : list(data.get("packages"), "packages")) {
            Map<String, Object> pkg = object(entry, "packages[]");
            String id = string(pkg, "id");
            if (!memberIds.contains(id)) continue;

            String manifestPath = string(pkg, "manifest_path");
            members.add(new WorkspaceMember(
                    id,
                    string(pkg, "name"),
                    string(pkg, "version"),
                    string(pkg, "edition"),
                    manifestPath != null ? Path.of(manifestPath) : null
            ));

            for (Object t : list(pkg.get("targets"), "targets")) {
                Map<String, Object> target = object(t, "targets[]");
                classify(list(target.get("kind"), "kind")).ifPresent(kind -> artifacts.add(
                        new Artifact(string(target, "name"), string(target, "src_path"), kind)));
            }
        }

        log.debug("Read cargo metadata for {}: {} workspace member(s), {} artifact(s)",
                projectDir, members.size(), artifacts.size());
        return new CargoMetadata(projectDir, data, members, artifacts);
    }

    /**
     * Maps a target's kind tags to an artifact kind. {@code bin} is checked before
     * {@code lib}; any other tag set is unclassified.
     */
    static Optional<ArtifactKind> classify(List<?> kinds) {
        if (kinds.contains("bin")) {
            return Optional.of(ArtifactKind.BIN);
        } else if (kinds.contains("lib")) {
            return Optional.of(ArtifactKind.LIB);
        } else {
            return Optional.empty();
        }
    }

    public List<Artifact> binaries() {
        return artifacts.stream().filter(a -> a.kind() == ArtifactKind.BIN).toList();
    }

    public List<Artifact> libraries() {
        return artifacts.stream().filter(a -> a.kind() == ArtifactKind.LIB).toList();
    }

    public Optional<WorkspaceMember> member(String name) {
        return workspaceMembers.stream().filter(m -> name.equals(m.name())).findFirst();
    }

    private static List<?> list(Object value, String field) {
        if (value == null) return List.of();
        if (value instanceof List<?> l) return l;
        throw new CargoParseException("cargo metadata: '" + field + "' must be an array");
    }

    private static String string(Map<String, Object> object, String field) {
        Object value = object.get(field);
        if (value == null || value instanceof String) return (String) value;
        throw new CargoParseException("cargo metadata: '" + field + "' must be a string");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> object(Object value, String field) {
        if (value instanceof Map<?, ?> m) return (Map<String, Object>) m;
        throw new CargoParseException("cargo metadata: '" + field + "' must be an object");
    }
}
