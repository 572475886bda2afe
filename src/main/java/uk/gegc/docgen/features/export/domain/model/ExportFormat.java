package uk.gegc.docgen.features.export.domain.model;

import uk.gegc.docgen.features.export.domain.UnsupportedExportFormatException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Supported export formats and the request values that select them.
 */
public enum ExportFormat {
    /**
     * One PDF per section
     */
    PDF("pdf"),

    /**
     * A single zip holding one markdown file per section
     */
    ARCHIVE("archive", "zip"),

    /**
     * One markdown file per section
     */
    MARKDOWN("markdown", "md");

    private final List<String> values;

    ExportFormat(String... values) {
        this.values = List.of(values);
    }

    public String value() {
        return values.get(0);
    }

    public static ExportFormat fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new UnsupportedExportFormatException(value);
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(format -> format.values.contains(normalized))
                .findFirst()
                .orElseThrow(() -> new UnsupportedExportFormatException(value));
    }
}
