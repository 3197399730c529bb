package no.cantara.cargo;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TomlWriterTest {

    private static Map<String, Object> table(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return m;
    }

    @Test
    void writesScalarsBeforeTables() {
        String toml = TomlWriter.write(table(
                "package", table("name", "foo"),
                "cargo-features", List.of("a")));
        assertEquals("cargo-features = [\"a\"]\n\n[package]\nname = \"foo\"\n", toml);
    }

    @Test
    void writesArraysOfTablesWithDoubleBrackets() {
        String toml = TomlWriter.write(table(
                "bin", List.of(table("name", "a"), table("name", "b"))));
        assertEquals("[[bin]]\nname = \"a\"\n\n[[bin]]\nname = \"b\"\n", toml);
    }

    @Test
    void writesEmptyTableAsHeader() {
        assertEquals("[dependencies]\n", TomlWriter.write(table("dependencies", table())));
    }

    @Test
    void nestedTablesUseDottedHeaders() {
        String toml = TomlWriter.write(table(
                "package", table("name", "x", "metadata", table("docs", table("all-features", true)))));
        assertTrue(toml.contains("[package.metadata.docs]\nall-features = true\n"), toml);
    }

    @Test
    void tablesInsideArraysAreInline() {
        String toml = TomlWriter.write(table("targets", List.of(table("a", 1L), "x")));
        assertEquals("targets = [{ a = 1 }, \"x\"]\n", toml);
    }

    @Test
    void skipsNullValues() {
        assertEquals("a = 1\n", TomlWriter.write(table("a", 1, "b", null)));
    }

    @Test
    void quotesKeysThatAreNotBare() {
        assertEquals("\"cfg(unix)\"", TomlWriter.key("cfg(unix)"));
        assertEquals("serde_json", TomlWriter.key("serde_json"));
    }

    @Test
    void escapesStrings() {
        assertEquals("\"a\\\"b\\\\c\\nd\\te\\u0001\"", TomlWriter.quote("a\"b\\c\nd\te\u0001"));
    }

    @Test
    void writesSpecialValues() {
        assertEquals("2024-01-15", TomlWriter.inline(LocalDate.of(2024, 1, 15)));
        assertEquals("inf", TomlWriter.inline(Double.POSITIVE_INFINITY));
        assertEquals("nan", TomlWriter.inline(Double.NaN));
        assertEquals("1.5", TomlWriter.inline(1.5));
        assertEquals("false", TomlWriter.inline(false));
    }

    @Test
    void rejectsUnknownValueTypes() {
        assertThrows(IllegalArgumentException.class, () -> TomlWriter.inline(new Object()));
    }

    @Test
    void outputParsesBackToTheSameTree() {
        Map<String, Object> doc = table(
                "title", "x = \"y\"",
                "target", table("cfg(unix)", table("dependencies", table("libc", "0.2"))),
                "bin", List.of(table("name", "a", "test", false)),
                "workspace", table("members", List.of("a", "b"), "metadata", table()));
        String toml = TomlWriter.write(doc);
        assertEquals(doc, CargoManifestParser.readToml(toml, Path.of("Cargo.toml")));
    }
}
