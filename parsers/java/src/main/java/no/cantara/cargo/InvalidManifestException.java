package no.cantara.cargo;

/**
 * Thrown when a manifest parses but is not a usable Cargo manifest: it has neither
 * {@code [package]} nor {@code [workspace]}, or a recognized key has the wrong shape.
 */
public class InvalidManifestException extends IllegalArgumentException {

    public InvalidManifestException(String message) {
        super(message);
    }
}
