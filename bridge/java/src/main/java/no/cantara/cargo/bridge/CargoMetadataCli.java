package no.cantara.cargo.bridge;

import no.cantara.cargo.CargoMetadata;

import java.nio.file.Path;

/**
 * CLI entry point for cargo-metadata.
 *
 * <pre>
 * Usage: cargo-metadata [project-dir] [--cargo &lt;exe&gt;] [--json]
 * </pre>
 */
public class CargoMetadataCli {

    public static void main(String[] args) {
        Path    projectDir = Path.of(".");
        String  cargo      = null;
        boolean json       = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--json"  -> json = true;
                case "--cargo" -> {
                    if (i + 1 >= args.length) {
                        System.err.println("[cargo-metadata] Error: --cargo needs a value");
                        System.exit(1);
                    }
                    cargo = args[++i];
                }
                default -> {
                    if (!args[i].startsWith("-")) {
                        projectDir = Path.of(args[i]);
                    }
                }
            }
        }

        if (!projectDir.resolve(CargoMetadataCommand.MANIFEST_FILE).toFile().exists()) {
            System.err.println("[cargo-metadata] Error: Cargo.toml not found in " + projectDir);
            System.exit(1);
        }

        CargoMetadata metadata;
        try {
            metadata = new CargoMetadataReader(new CargoMetadataCommand(cargo)).read(projectDir);
        } catch (Exception e) {
            System.err.println("[cargo-metadata] Error: " + e.getMessage());
            System.exit(1);
            return;
        }

        System.out.print(json
            ? CargoMetadataReport.toJson(metadata) + System.lineSeparator()
            : CargoMetadataReport.toText(metadata));
    }
}
