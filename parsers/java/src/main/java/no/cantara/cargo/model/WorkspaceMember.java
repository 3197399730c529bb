package no.cantara.cargo.model;

import java.nio.file.Path;

/**
 * A package built locally as part of a workspace, as reported by {@code cargo metadata}.
 */
public record WorkspaceMember(
        String id,
        String name,
        String version,
        String edition,
        Path manifestPath
) {}
