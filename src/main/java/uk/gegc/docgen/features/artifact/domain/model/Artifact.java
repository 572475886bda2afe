package uk.gegc.docgen.features.artifact.domain.model;

import java.nio.file.Path;

/**
 * A directory of generated files addressed by an opaque id.
 */
public record Artifact(String id, Path path) {

    public Artifact {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Artifact id cannot be null or blank");
        }
        if (path == null) {
            throw new IllegalArgumentException("Artifact path cannot be null");
        }
    }

    public Path resolve(String filename) {
        return path.resolve(filename);
    }
}
