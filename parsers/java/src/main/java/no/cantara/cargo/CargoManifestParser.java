package no.cantara.cargo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseError;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlPosition;
import org.tomlj.TomlTable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses a Cargo.toml file into a {@link CargoManifest}.
 */
public class CargoManifestParser {

    private static final Logger log = LoggerFactory.getLogger(CargoManifestParser.class);

    // Keys without a recorded position (none in practice) sort after positioned ones.
    private static final Comparator<TomlPosition> SOURCE_ORDER = Comparator.nullsLast(
            Comparator.comparingInt(TomlPosition::line).thenComparingInt(TomlPosition::column));

    public static CargoManifest parse(Path path) throws IOException {
        String text = Files.readString(path, StandardCharsets.UTF_8);
        log.debug("Read {} ({} chars)", path, text.length());
        return parse(text, path);
    }

    /**
     * Parses manifest text that was loaded from (or will be saved to) {@code location}.
     */
    public static CargoManifest parse(String text, Path location) {
        return fromMap(location, readToml(text, location));
    }

    public static CargoManifest fromMap(Path location, Map<String, Object> data) {
        return CargoManifest.of(location, data);
    }

    /**
     * Reads TOML into a tree of {@link LinkedHashMap}s and {@link ArrayList}s. Keys keep the
     * order they appear in the source; integers are {@code Long}, floats {@code Double}, and
     * dates and times {@code java.time} values.
     */
    static Map<String, Object> readToml(String text, Path location) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            TomlParseError first = result.errors().get(0);
            throw new CargoParseException("Malformed TOML in " + location + ": " + first.toString(), first);
        }
        return toMap(result);
    }

    private static Map<String, Object> toMap(TomlTable table) {
        List<String> keys = new ArrayList<>(table.keySet());
        keys.sort(Comparator.comparing((String k) -> table.inputPositionOf(List.of(k)), SOURCE_ORDER));

        Map<String, Object> out = new LinkedHashMap<>();
        for (String key : keys) {
            out.put(key, toValue(table.get(List.of(key))));
        }
        return out;
    }

    private static List<Object> toList(TomlArray array) {
        List<Object> out = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            out.add(toValue(array.get(i)));
        }
        return out;
    }

    private static Object toValue(Object value) {
        if (value instanceof TomlTable table) return toMap(table);
        if (value instanceof TomlArray array) return toList(array);
        return value;
    }
}
