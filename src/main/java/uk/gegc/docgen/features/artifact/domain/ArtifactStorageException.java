package uk.gegc.docgen.features.artifact.domain;

public class ArtifactStorageException extends RuntimeException {

    public ArtifactStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
