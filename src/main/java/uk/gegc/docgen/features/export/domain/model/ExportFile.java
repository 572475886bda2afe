package uk.gegc.docgen.features.export.domain.model;

/**
 * A rendered file ready to be written into an artifact.
 */
public record ExportFile(
        String filename,
        String contentType,
        byte[] content
) {
    public ExportFile {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Filename cannot be null or blank");
        }
        if (contentType == null || contentType.isBlank()) {
            throw new IllegalArgumentException("Content type cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("Content cannot be null");
        }
    }
}
