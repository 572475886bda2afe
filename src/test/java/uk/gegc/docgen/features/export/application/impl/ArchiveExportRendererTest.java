package uk.gegc.docgen.features.export.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.docgen.features.export.domain.model.ExportBundle;
import uk.gegc.docgen.features.export.domain.model.ExportFile;
import uk.gegc.docgen.features.export.domain.model.ExportFormat;
import uk.gegc.docgen.features.export.domain.model.ExportSection;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ArchiveExportRenderer")
class ArchiveExportRendererTest {

    private final ArchiveExportRenderer renderer = new ArchiveExportRenderer();

    @Test
    @DisplayName("packs every section into one zip of markdown entries")
    void singleZip() throws IOException {
        // Given
        ExportBundle bundle = new ExportBundle(List.of(
                new ExportSection("summary_md", "# Summary\nCafé"),
                new ExportSection("plan_md", "# Plan")));

        // When
        List<ExportFile> files = renderer.render(bundle);

        // Then
        assertThat(files).singleElement().satisfies(file -> {
            assertThat(file.filename()).isEqualTo(ArchiveExportRenderer.ARCHIVE_FILENAME);
            assertThat(file.contentType()).isEqualTo("application/zip");
        });

        Map<String, String> entries = new LinkedHashMap<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(files.get(0).content()), StandardCharsets.UTF_8)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                entries.put(entry.getName(), new String(zip.readAllBytes(), StandardCharsets.UTF_8));
            }
        }
        assertThat(entries).containsExactly(
                Map.entry("summary_md.md", "# Summary\nCafé"),
                Map.entry("plan_md.md", "# Plan"));
    }

    @Test
    @DisplayName("supports only the archive format")
    void supportsArchive() {
        assertThat(renderer.supports(ExportFormat.ARCHIVE)).isTrue();
        assertThat(renderer.supports(ExportFormat.PDF)).isFalse();
    }
}
