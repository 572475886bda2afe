package uk.gegc.docgen.features.export.application;

import uk.gegc.docgen.features.export.domain.model.ExportBundle;
import uk.gegc.docgen.features.export.domain.model.ExportFile;
import uk.gegc.docgen.features.export.domain.model.ExportFormat;

import java.util.List;

/**
 * SPI for rendering markdown bundles into downloadable files.
 */
public interface ExportRenderer {
    boolean supports(ExportFormat format);

    List<ExportFile> render(ExportBundle bundle);
}
