package no.cantara.cargo;

import no.cantara.cargo.model.Bin;
import no.cantara.cargo.model.DependenciesSection;
import no.cantara.cargo.model.PackageSection;
import no.cantara.cargo.model.Tables;
import no.cantara.cargo.model.WorkspaceSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A Cargo.toml manifest with typed access to a few sections.
 *
 * <p>The parsed document is kept as-is. {@code package}, {@code workspace},
 * {@code dependencies} and {@code bin} are decoded into typed values that callers replace
 * to make changes; {@link #toMap()} merges those values back over the original document,
 * so keys the typed model does not know about are written out unchanged.
 *
 * <p>Instances are not thread-safe.
 */
public class CargoManifest {

    private static final Logger log = LoggerFactory.getLogger(CargoManifest.class);

    private final Path path;
    private final Map<String, Object> data;

    private PackageSection packageSection;
    private WorkspaceSection workspace;
    private DependenciesSection dependencies;
    private List<Bin> bin;

    CargoManifest(Path path, Map<String, Object> data, PackageSection packageSection,
                  WorkspaceSection workspace, DependenciesSection dependencies, List<Bin> bin) {
        this.path = path;
        this.data = Tables.freezeTable(data);
        this.packageSection = packageSection;
        this.workspace = workspace;
        this.dependencies = dependencies;
        this.bin = List.copyOf(bin);
    }

    public static CargoManifest read(Path path) throws IOException {
        return CargoManifestParser.parse(path);
    }

    /**
     * Builds a manifest from an already parsed document.
     *
     * @throws InvalidManifestException if neither {@code package} nor {@code workspace} is
     *                                  present, or a recognized section has the wrong shape
     */
    public static CargoManifest of(Path path, Map<String, Object> data) {
        PackageSection pkg = data.containsKey("package")
                ? PackageSection.fromMap(Tables.table(data.get("package"), "package"))
                : null;
        WorkspaceSection workspace = data.containsKey("workspace")
                ? WorkspaceSection.fromMap(Tables.table(data.get("workspace"), "workspace"))
                : null;
        DependenciesSection dependencies = data.containsKey("dependencies")
                ? DependenciesSection.fromMap(Tables.table(data.get("dependencies"), "dependencies"))
                : null;

        List<Bin> bins = new ArrayList<>();
        if (data.containsKey("bin")) {
            for (Object entry : Tables.array(data.get("bin"), "bin")) {
                bins.add(Bin.fromMap(Tables.table(entry, "bin")));
            }
        }

        if (pkg == null && workspace == null) {
            throw new InvalidManifestException(path + ": manifest has neither [package] nor [workspace]");
        }
        return new CargoManifest(path, data, pkg, workspace, dependencies, bins);
    }

    public Path path() {
        return path;
    }

    /** The document as it was parsed, read-only. */
    public Map<String, Object> data() {
        return data;
    }

    public PackageSection getPackage() {
        return packageSection;
    }

    public void setPackage(PackageSection packageSection) {
        this.packageSection = packageSection;
    }

    public WorkspaceSection getWorkspace() {
        return workspace;
    }

    public void setWorkspace(WorkspaceSection workspace) {
        this.workspace = workspace;
    }

    public DependenciesSection getDependencies() {
        return dependencies;
    }

    public void setDependencies(DependenciesSection dependencies) {
        this.dependencies = dependencies;
    }

    public List<Bin> getBin() {
        return bin;
    }

    public void setBin(List<Bin> bin) {
        this.bin = bin != null ? List.copyOf(bin) : List.of();
    }

    /**
     * The document to write: the parsed data with the typed sections merged over it.
     * An empty {@code bin} list removes the key; an absent typed section leaves the
     * original key untouched.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>(data);
        if (!bin.isEmpty()) {
            result.put("bin", bin.stream().map(Bin::toMap).toList());
        } else {
            result.remove("bin");
        }
        if (packageSection != null) {
            result.put("package", packageSection.toMap());
        }
        if (workspace != null) {
            result.put("workspace", workspace.toMap());
        }
        if (dependencies != null) {
            result.put("dependencies", dependencies.toMap());
        }
        return result;
    }

    public String toTomlString() {
        return TomlWriter.write(toMap());
    }

    /** Writes the manifest back to the file it was read from. */
    public void save() throws IOException {
        save(null);
    }

    /**
     * Writes the manifest to {@code target}, or to {@link #path()} when {@code target} is null.
     * The file is replaced completely.
     */
    public void save(Path target) throws IOException {
        Path out = target != null ? target : path;
        if (out == null) {
            throw new IOException("No target path: manifest was not read from a file");
        }
        String text = toTomlString();
        Files.writeString(out, text, StandardCharsets.UTF_8);
        log.debug("Wrote {} ({} chars)", out, text.length());
    }

    @Override
    public String toString() {
        return "CargoManifest[" + path + "]";
    }
}
