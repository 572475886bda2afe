package uk.gegc.docgen.features.export.domain.model;

import java.util.List;

public record ExportResult(String artifactId, List<String> filenames) {

    public ExportResult {
        filenames = filenames == null ? List.of() : List.copyOf(filenames);
    }
}
