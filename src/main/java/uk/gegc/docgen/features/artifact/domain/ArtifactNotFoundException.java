package uk.gegc.docgen.features.artifact.domain;

/**
 * The artifact or file never existed, or it expired and was reclaimed.
 */
public class ArtifactNotFoundException extends RuntimeException {

    public ArtifactNotFoundException(String artifactId, String filename) {
        super("Artifact not found: " + artifactId + "/" + filename);
    }
}
