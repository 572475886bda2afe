package uk.gegc.docgen.features.export.application.impl;

import org.springframework.stereotype.Component;
import uk.gegc.docgen.features.export.application.ExportRenderer;
import uk.gegc.docgen.features.export.domain.model.ExportBundle;
import uk.gegc.docgen.features.export.domain.model.ExportFile;
import uk.gegc.docgen.features.export.domain.model.ExportFormat;

import java.nio.charset.StandardCharsets;
import java.util.List;

@Component
public class MarkdownExportRenderer implements ExportRenderer {

    private static final String CONTENT_TYPE = "text/markdown";

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.MARKDOWN;
    }

    @Override
    public List<ExportFile> render(ExportBundle bundle) {
        return bundle.sections().stream()
                .map(section -> new ExportFile(
                        section.name() + ".md",
                        CONTENT_TYPE,
                        section.markdown().getBytes(StandardCharsets.UTF_8)))
                .toList();
    }
}
