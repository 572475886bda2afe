package uk.gegc.docgen.features.export.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.docgen.features.artifact.application.ArtifactStore;
import uk.gegc.docgen.features.artifact.domain.model.Artifact;
import uk.gegc.docgen.features.export.application.ExportRenderer;
import uk.gegc.docgen.features.export.application.ExportService;
import uk.gegc.docgen.features.export.domain.UnsupportedExportFormatException;
import uk.gegc.docgen.features.export.domain.model.ExportBundle;
import uk.gegc.docgen.features.export.domain.model.ExportFile;
import uk.gegc.docgen.features.export.domain.model.ExportFormat;
import uk.gegc.docgen.features.export.domain.model.ExportResult;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class ExportServiceImpl implements ExportService {

    private final ArtifactStore artifactStore;
    private final List<ExportRenderer> renderers;

    @Override
    public ExportResult export(Map<String, ?> bundle, String format) {
        ExportFormat exportFormat = ExportFormat.fromValue(format);
        ExportBundle exportBundle = ExportBundle.fromMap(bundle);
        ExportRenderer renderer = renderers.stream()
                .filter(r -> r.supports(exportFormat))
                .findFirst()
                .orElseThrow(() -> new UnsupportedExportFormatException(format));

        Artifact artifact = artifactStore.createNew();
        try {
            List<ExportFile> files = renderer.render(exportBundle);
            List<String> filenames = new ArrayList<>(files.size());
            for (ExportFile file : files) {
                artifactStore.writeFile(artifact, file.filename(), file.content());
                filenames.add(file.filename());
            }
            log.info("Exported {} section(s) as {} into artifact {} ({} file(s))",
                    exportBundle.sections().size(), exportFormat.value(), artifact.id(), filenames.size());
            return new ExportResult(artifact.id(), filenames);
        } catch (RuntimeException e) {
            log.error("Export into artifact {} failed, discarding it", artifact.id(), e);
            artifactStore.discard(artifact);
            throw e;
        }
    }

    @Override
    public Path resolveFile(String artifactId, String filename) {
        return artifactStore.getArtifactPath(artifactId, filename);
    }
}
