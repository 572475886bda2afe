package uk.gegc.docgen.features.export.domain.model;

/**
 * One markdown section of a bundle.
 *
 * @param name file-safe section name, used as the base of generated filenames
 */
public record ExportSection(String name, String markdown) {

    public ExportSection {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Section name cannot be null or blank");
        }
        markdown = markdown == null ? "" : markdown;
    }
}
