package no.cantara.cargo;

import no.cantara.cargo.model.Artifact;
import no.cantara.cargo.model.ArtifactKind;
import no.cantara.cargo.model.WorkspaceMember;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static no.cantara.cargo.Fixtures.fixture;
import static org.junit.jupiter.api.Assertions.*;

class CargoMetadataTest {

    private static final Path PROJECT = Path.of("/work");

    private static Map<String, Object> target(String name, String... kinds) {
        return Map.of("name", name, "src_path", "src/" + name + ".rs", "kind", List.of(kinds));
    }

    private static Map<String, Object> pkg(String id, String name, List<Map<String, Object>> targets) {
        return Map.of(
                "id", id,
                "name", name,
                "version", "0.1.0",
                "edition", "2021",
                "manifest_path", "/work/" + name + "/Cargo.toml",
                "targets", targets);
    }

    private static CargoMetadata fixtureMetadata() throws IOException {
        return CargoMetadata.parse(PROJECT, Files.readString(fixture("workspace", "metadata.json")));
    }

    // -----------------------------------------------------------------------
    // Classification
    // -----------------------------------------------------------------------

    @Test
    void binAndLibTargetsBecomeArtifactsInOrder() {
        Map<String, Object> data = Map.of(
                "packages", List.of(pkg("a", "a", List.of(
                        target("main", "bin"),
                        target("a", "lib"),
                        target("demo", "example")))),
                "workspace_members", List.of("a"));

        CargoMetadata metadata = CargoMetadata.of(PROJECT, data);
        assertEquals(List.of(
                new Artifact("main", "src/main.rs", ArtifactKind.BIN),
                new Artifact("a", "src/a.rs", ArtifactKind.LIB)
        ), metadata.artifacts());
    }

    @Test
    void binTagWinsOverLib() {
        assertEquals(Optional.of(ArtifactKind.BIN), CargoMetadata.classify(List.of("lib", "bin")));
    }

    @Test
    void unknownKindsAreUnclassified() {
        assertEquals(Optional.empty(), CargoMetadata.classify(List.of("proc-macro-v2")));
        assertEquals(Optional.empty(), CargoMetadata.classify(List.of()));
    }

    @Test
    void nonMemberPackagesContributeNothing() {
        Map<String, Object> data = Map.of(
                "packages", List.of(
                        pkg("dep", "dep", List.of(target("dep", "lib"), target("dep-bin", "bin"))),
                        pkg("me", "me", List.of(target("me", "lib")))),
                "workspace_members", List.of("me"));

        CargoMetadata metadata = CargoMetadata.of(PROJECT, data);
        assertEquals(1, metadata.workspaceMembers().size());
        assertEquals("me", metadata.workspaceMembers().get(0).name());
        assertEquals(1, metadata.artifacts().size());
        assertEquals("me", metadata.artifacts().get(0).name());
    }

    @Test
    void emptyDocumentYieldsNothing() {
        CargoMetadata metadata = CargoMetadata.of(PROJECT, Map.of());
        assertTrue(metadata.workspaceMembers().isEmpty());
        assertTrue(metadata.artifacts().isEmpty());
    }

    // -----------------------------------------------------------------------
    // Fixture
    // -----------------------------------------------------------------------

    @Test
    void fixtureMembersFollowPackageOrder() throws IOException {
        CargoMetadata metadata = fixtureMetadata();
        List<String> names = metadata.workspaceMembers().stream().map(WorkspaceMember::name).toList();
        // ghost is listed as a member but has no package entry
        assertEquals(List.of("demo-core", "demo-cli"), names);
    }

    @Test
    void fixtureMemberFields() throws IOException {
        WorkspaceMember core = fixtureMetadata().member("demo-core").orElseThrow();
        assertEquals("path+file:///work/crates/core#demo-core@1.2.3", core.id());
        assertEquals("1.2.3", core.version());
        assertEquals("2021", core.edition());
        assertEquals(Path.of("/work/crates/core/Cargo.toml"), core.manifestPath());
    }

    @Test
    void fixtureArtifacts() throws IOException {
        CargoMetadata metadata = fixtureMetadata();
        List<String> names = metadata.artifacts().stream().map(Artifact::name).toList();
        assertEquals(List.of("demo_core", "demo", "demo-admin"), names);
        assertEquals(List.of("demo", "demo-admin"),
                metadata.binaries().stream().map(Artifact::name).toList());
        assertEquals(List.of("demo_core"),
                metadata.libraries().stream().map(Artifact::name).toList());
    }

    @Test
    void fixtureKeepsRawData() throws IOException {
        CargoMetadata metadata = fixtureMetadata();
        assertEquals("/work", metadata.data().get("workspace_root"));
        assertEquals(PROJECT, metadata.path());
    }

    @Test
    void unknownMemberLookupIsEmpty() throws IOException {
        assertTrue(fixtureMetadata().member("serde").isEmpty());
    }

    // -----------------------------------------------------------------------
    // Errors
    // -----------------------------------------------------------------------

    @Test
    void rejectsMalformedJson() {
        assertThrows(CargoParseException.class, () -> CargoMetadata.parse(PROJECT, "{\"packages\": ["));
    }

    @Test
    void rejectsEmptyOutput() {
        assertThrows(CargoParseException.class, () -> CargoMetadata.parse(PROJECT, ""));
    }

    @Test
    void rejectsNonObjectRoot() {
        assertThrows(CargoParseException.class, () -> CargoMetadata.parse(PROJECT, "[1, 2]"));
    }

    @Test
    void rejectsWrongTypedPackageName() {
        assertThrows(CargoParseException.class, () -> CargoMetadata.parse(PROJECT,
                "{\"packages\": [{\"id\": \"a\", \"name\": 7, \"targets\": []}], \"workspace_members\": [\"a\"]}"));
    }

    @Test
    void rejectsWrongTypedTargetPath() {
        Map<String, Object> data = Map.of(
                "packages", List.of(pkg("a", "a", List.of(
                        Map.of("name", "a", "src_path", List.of("x"), "kind", List.of("lib"))))),
                "workspace_members", List.of("a"));
        assertThrows(CargoParseException.class, () -> CargoMetadata.of(PROJECT, data));
    }

    @Test
    void rejectsWrongTypedMemberId() {
        assertThrows(CargoParseException.class, () -> CargoMetadata.parse(PROJECT,
                "{\"packages\": [], \"workspace_members\": [{}]}"));
    }

    @Test
    void rejectsPackagesThatIsNotAnArray() {
        assertThrows(CargoParseException.class,
                () -> CargoMetadata.parse(PROJECT, "{\"packages\": {}, \"workspace_members\": []}"));
    }
}
