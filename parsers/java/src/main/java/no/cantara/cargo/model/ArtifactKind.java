package no.cantara.cargo.model;

/**
 * The build output kinds tracked from cargo metadata.
 */
public enum ArtifactKind {
    BIN,
    LIB
}
