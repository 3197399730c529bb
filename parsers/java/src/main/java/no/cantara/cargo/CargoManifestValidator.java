package no.cantara.cargo;

import no.cantara.cargo.model.Bin;
import no.cantara.cargo.model.PackageSection;
import no.cantara.cargo.model.WorkspacePackage;
import no.cantara.cargo.model.WorkspaceSection;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lints a parsed {@link CargoManifest} for the fields this library models.
 *
 * <p>This is not a schema check of Cargo.toml. It returns a {@link ValidationResult} with
 * separate {@code errors} (the manifest will not build) and {@code warnings} (suspicious).
 */
public class CargoManifestValidator {

    private static final Set<String> KNOWN_EDITIONS = Set.of("2015", "2018", "2021", "2024");
    private static final Pattern SEMVER = Pattern.compile(
            "^\\d+\\.\\d+\\.\\d+(-[0-9A-Za-z.\\-]+)?(\\+[0-9A-Za-z.\\-]+)?$");

    /**
     * Immutable result of validating a manifest.
     *
     * @param errors   Conditions that make the manifest unusable (MUST fix).
     * @param warnings Conditions that are permitted but suspicious (SHOULD fix).
     */
    public record ValidationResult(List<String> errors, List<String> warnings) {
        public ValidationResult {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        public boolean isValid() { return errors.isEmpty(); }
        public boolean hasWarnings() { return !warnings.isEmpty(); }
    }

    /**
     * Validate a manifest without path existence checking.
     */
    public static ValidationResult validate(CargoManifest manifest) {
        return validate(manifest, null);
    }

    /**
     * Validate a manifest, optionally checking that declared bin paths exist relative
     * to {@code manifestDir}.
     *
     * @param manifest    The parsed manifest to validate.
     * @param manifestDir The directory containing Cargo.toml, or {@code null}
     *                    to skip path existence checks.
     */
    public static ValidationResult validate(CargoManifest manifest, Path manifestDir) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        PackageSection pkg = manifest.getPackage();
        if (pkg != null) {
            if (pkg.name() == null || pkg.name().isBlank()) {
                errors.add("package: 'name' is required");
            }
            checkVersion("package", pkg.version(), warnings);
            checkEdition("package", pkg.edition(), warnings);
        }

        WorkspaceSection workspace = manifest.getWorkspace();
        if (workspace != null) {
            WorkspacePackage shared = workspace.workspacePackage();
            if (shared != null) {
                checkVersion("workspace.package", shared.version(), warnings);
                checkEdition("workspace.package", shared.edition(), warnings);
            }
            if (workspace.members() != null) {
                Set<String> seen = new HashSet<>();
                for (String member : workspace.members()) {
                    if (!seen.add(member)) {
                        warnings.add("workspace: member '" + member + "' is listed more than once");
                    }
                }
            }
        }

        Set<String> binNames = new HashSet<>();
        for (Bin bin : manifest.getBin()) {
            if (bin.name() == null || bin.name().isBlank()) {
                errors.add("bin: 'name' is required");
                continue;
            }
            String p = "bin '" + bin.name() + "'";
            if (!binNames.add(bin.name())) {
                warnings.add(p + ": duplicate 'name'");
            }
            if (bin.path() == null) continue;

            String problem = pathProblem(bin.path());
            if (problem != null) {
                warnings.add(p + ": " + problem);
            } else if (manifestDir != null && !Files.exists(manifestDir.resolve(bin.path()))) {
                warnings.add(p + ": path '" + bin.path() + "' does not exist");
            }
        }

        return new ValidationResult(errors, warnings);
    }

    /**
     * Returns why a target path is unsuitable (absolute, escapes the package root, or not a
     * valid path), or {@code null} if it is fine.
     */
    static String pathProblem(String rawPath) {
        if (rawPath.startsWith("/") || rawPath.startsWith("\\")) {
            return "path must be relative: " + rawPath;
        }
        try {
            Path normalised = Path.of(rawPath).normalize();
            if (normalised.isAbsolute()) {
                return "path must be relative: " + rawPath;
            }
            if (normalised.startsWith("..")) {
                return "path escapes package root: " + rawPath;
            }
        } catch (InvalidPathException e) {
            return "invalid path: " + rawPath;
        }
        return null;
    }

    private static void checkVersion(String section, String version, List<String> warnings) {
        if (version != null && !SEMVER.matcher(version).matches()) {
            warnings.add(section + ": 'version' is not a semver version: '" + version + "'");
        }
    }

    private static void checkEdition(String section, String edition, List<String> warnings) {
        if (edition != null && !KNOWN_EDITIONS.contains(edition)) {
            warnings.add(section + ": unknown 'edition' value '" + edition + "'");
        }
    }
}
