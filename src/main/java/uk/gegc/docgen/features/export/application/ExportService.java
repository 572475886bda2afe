package uk.gegc.docgen.features.export.application;

import uk.gegc.docgen.features.export.domain.model.ExportResult;

import java.nio.file.Path;
import java.util.Map;

public interface ExportService {

    /**
     * Renders the bundle in the requested format and stores the files under a new artifact.
     * Nothing stays reachable if rendering or writing fails.
     *
     * @param bundle section name to markdown; non-string values are ignored
     * @param format {@code pdf}, {@code archive}/{@code zip} or {@code markdown}/{@code md}
     */
    ExportResult export(Map<String, ?> bundle, String format);

    /**
     * @throws uk.gegc.docgen.features.artifact.domain.ArtifactNotFoundException if the file expired or never existed
     */
    Path resolveFile(String artifactId, String filename);
}
