package no.cantara.cargo;

import no.cantara.cargo.model.PackageSection;
import no.cantara.cargo.model.WorkspaceSection;

import java.nio.file.Path;

/**
 * Command-line interface for inspecting and bumping a Cargo manifest.
 * Usage: java -jar cargo-manifest-parser.jar &lt;path-to-Cargo.toml&gt; [--set-version &lt;v&gt;] [--print]
 */
public class CargoManifestCli {

    public static void main(String[] args) {
        Path path = null;
        String newVersion = null;
        boolean print = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--print" -> print = true;
                case "--set-version" -> {
                    if (i + 1 >= args.length) {
                        System.err.println("Error: --set-version needs a value");
                        System.exit(1);
                    }
                    newVersion = args[++i];
                }
                default -> {
                    if (!args[i].startsWith("-")) {
                        path = Path.of(args[i]);
                    }
                }
            }
        }

        if (path == null) {
            System.err.println("Usage: java -jar cargo-manifest-parser.jar <path-to-Cargo.toml> [--set-version <v>] [--print]");
            System.exit(1);
        }
        if (!path.toFile().exists()) {
            System.err.println("Error: file not found: " + path);
            System.exit(1);
        }

        CargoManifest manifest;
        try {
            manifest = CargoManifest.read(path);
        } catch (Exception e) {
            System.err.println("Parse error: " + e.getMessage());
            System.exit(1);
            return;
        }

        CargoManifestValidator.ValidationResult result =
                CargoManifestValidator.validate(manifest, path.toAbsolutePath().getParent());
        if (result.hasWarnings()) {
            result.warnings().forEach(w -> System.err.println("  ! " + w));
        }
        if (!result.isValid()) {
            System.err.println("Validation failed: " + result.errors().size() + " error(s)");
            result.errors().forEach(e -> System.err.println("  * " + e));
            System.exit(1);
        }

        if (newVersion != null) {
            if (!setVersion(manifest, newVersion)) {
                System.err.println("Error: " + path + " has neither [package] nor [workspace.package] to version");
                System.exit(1);
            }
            try {
                manifest.save();
            } catch (Exception e) {
                System.err.println("Write error: " + e.getMessage());
                System.exit(1);
            }
        }

        if (print) {
            System.out.print(manifest.toTomlString());
        } else {
            System.out.println(summary(manifest));
        }
    }

    /**
     * Replaces the package version, or the shared workspace version for a virtual manifest.
     *
     * @return false if the manifest has nothing to carry a version
     */
    static boolean setVersion(CargoManifest manifest, String version) {
        PackageSection pkg = manifest.getPackage();
        if (pkg != null) {
            manifest.setPackage(pkg.withVersion(version));
            return true;
        }
        WorkspaceSection workspace = manifest.getWorkspace();
        if (workspace != null && workspace.workspacePackage() != null) {
            manifest.setWorkspace(workspace.withPackage(workspace.workspacePackage().withVersion(version)));
            return true;
        }
        return false;
    }

    static String summary(CargoManifest manifest) {
        PackageSection pkg = manifest.getPackage();
        WorkspaceSection workspace = manifest.getWorkspace();
        int dependencies = manifest.getDependencies() != null ? manifest.getDependencies().names().size() : 0;
        int members = workspace != null && workspace.members() != null ? workspace.members().size() : 0;
        String what = pkg != null
                ? "package '" + pkg.name() + "' v" + (pkg.version() != null ? pkg.version() : "?")
                : "virtual workspace";
        return String.format("%s is valid: %s, %d dependency(ies), %d bin target(s), %d workspace member(s)",
                manifest.path(), what, dependencies, manifest.getBin().size(), members);
    }
}
