package no.cantara.cargo.bridge;

import no.cantara.cargo.CargoMetadata;
import no.cantara.cargo.CargoParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Reads {@link CargoMetadata} for a project by running a {@link MetadataSource}.
 */
public class CargoMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(CargoMetadataReader.class);

    private final MetadataSource source;

    public CargoMetadataReader() {
        this(new CargoMetadataCommand());
    }

    public CargoMetadataReader(MetadataSource source) {
        this.source = source;
    }

    /**
     * @throws ExternalToolException if the metadata could not be produced, or the tool's
     *                               output is not valid metadata JSON
     */
    public CargoMetadata read(Path projectDir) {
        String json = source.fetch(projectDir);
        CargoMetadata metadata;
        try {
            metadata = CargoMetadata.parse(projectDir, json);
        } catch (CargoParseException e) {
            throw new ExternalToolException("Unusable cargo metadata output for " + projectDir + ": " + e.getMessage(), e);
        }
        log.info("Loaded cargo metadata for {}: {} workspace member(s), {} artifact(s)",
            projectDir,
            metadata.workspaceMembers().size(),
            metadata.artifacts().size());
        return metadata;
    }
}
