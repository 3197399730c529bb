package no.cantara.cargo.bridge;

import java.nio.file.Path;

/**
 * Produces {@code cargo metadata} JSON for a project directory.
 */
@FunctionalInterface
public interface MetadataSource {

    /**
     * Blocks until the metadata for the project at {@code projectDir} is available.
     *
     * @throws ExternalToolException if the tool cannot be run, fails, or prints nothing
     */
    String fetch(Path projectDir);
}
