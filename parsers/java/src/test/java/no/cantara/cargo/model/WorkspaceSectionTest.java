package no.cantara.cargo.model;

import no.cantara.cargo.InvalidManifestException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceSectionTest {

    private static Map<String, Object> raw() {
        Map<String, Object> pkg = new LinkedHashMap<>();
        pkg.put("version", "2.0.0");
        pkg.put("repository", "https://example.org/repo");
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("members", List.of("a", "b"));
        m.put("resolver", "2");
        m.put("package", pkg);
        m.put("default-members", List.of("a"));
        return m;
    }

    @Test
    void splitsPackageAndMembers() {
        WorkspaceSection ws = WorkspaceSection.fromMap(raw());
        assertEquals(List.of("a", "b"), ws.members());
        assertEquals("2.0.0", ws.workspacePackage().version());
        assertEquals("https://example.org/repo", ws.workspacePackage().unhandled().get("repository"));
        assertEquals(List.of("resolver", "default-members"), List.copyOf(ws.unhandled().keySet()));
    }

    @Test
    void toMapRestoresInput() {
        assertEquals(raw(), WorkspaceSection.fromMap(raw()).toMap());
    }

    @Test
    void workspaceWithoutPackageOrMembers() {
        WorkspaceSection ws = WorkspaceSection.fromMap(Map.of("resolver", "2"));
        assertNull(ws.workspacePackage());
        assertNull(ws.members());
        assertEquals(Map.of("resolver", "2"), ws.toMap());
    }

    @Test
    void emptyMembersAreLeftOut() {
        WorkspaceSection ws = WorkspaceSection.fromMap(raw()).withMembers(List.of());
        assertFalse(ws.toMap().containsKey("members"));
    }

    @Test
    void membersMustBeStrings() {
        assertThrows(InvalidManifestException.class,
                () -> WorkspaceSection.fromMap(Map.of("members", List.of("a", 1))));
    }

    @Test
    void packageMustBeATable() {
        assertThrows(InvalidManifestException.class,
                () -> WorkspaceSection.fromMap(Map.of("package", "nope")));
    }
}
