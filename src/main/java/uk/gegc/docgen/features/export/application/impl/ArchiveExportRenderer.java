package uk.gegc.docgen.features.export.application.impl;

import org.springframework.stereotype.Component;
import uk.gegc.docgen.features.export.application.ExportRenderer;
import uk.gegc.docgen.features.export.domain.ExportRenderingException;
import uk.gegc.docgen.features.export.domain.model.ExportBundle;
import uk.gegc.docgen.features.export.domain.model.ExportFile;
import uk.gegc.docgen.features.export.domain.model.ExportFormat;
import uk.gegc.docgen.features.export.domain.model.ExportSection;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Packages every section as a markdown entry of a single zip file.
 */
@Component
public class ArchiveExportRenderer implements ExportRenderer {

    static final String ARCHIVE_FILENAME = "docgen-bundle.zip";
    private static final String CONTENT_TYPE = "application/zip";

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.ARCHIVE;
    }

    @Override
    public List<ExportFile> render(ExportBundle bundle) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(baos, StandardCharsets.UTF_8)) {
            for (ExportSection section : bundle.sections()) {
                zip.putNextEntry(new ZipEntry(section.name() + ".md"));
                zip.write(section.markdown().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new ExportRenderingException("Failed to build export archive", e);
        }
        return List.of(new ExportFile(ARCHIVE_FILENAME, CONTENT_TYPE, baos.toByteArray()));
    }
}
