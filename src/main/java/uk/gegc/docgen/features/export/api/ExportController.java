package uk.gegc.docgen.features.export.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.docgen.features.artifact.domain.ArtifactNotFoundException;
import uk.gegc.docgen.features.export.api.dto.ExportRequest;
import uk.gegc.docgen.features.export.api.dto.ExportResponse;
import uk.gegc.docgen.features.export.application.ExportService;

import java.nio.file.Path;

@RestController
@RequestMapping("/v1/docgen")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Export", description = "Export generated sections and download the resulting files")
public class ExportController {

    private static final MediaType MARKDOWN = MediaType.parseMediaType("text/markdown");

    private final ExportService exportService;

    @Operation(
            summary = "Export markdown sections",
            description = "Renders the bundle and stores the files under a short-lived artifact"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Export stored",
                    content = @Content(schema = @Schema(implementation = ExportResponse.class))),
            @ApiResponse(responseCode = "400", description = "Empty bundle or unsupported format"),
            @ApiResponse(responseCode = "500", description = "Rendering or storage failed")
    })
    @PostMapping("/export")
    public ResponseEntity<ExportResponse> export(@Valid @RequestBody ExportRequest request) {
        log.info("Export requested: format={}, sections={}", request.format(), request.bundle().size());
        return ResponseEntity.ok(ExportResponse.from(exportService.export(request.bundle(), request.format())));
    }

    @Operation(summary = "Download an exported file")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "File content"),
            @ApiResponse(responseCode = "404", description = "Artifact expired or never existed")
    })
    @GetMapping("/files/{artifactId}/{filename}")
    public ResponseEntity<Resource> download(
            @Parameter(description = "Artifact identifier") @PathVariable String artifactId,
            @Parameter(description = "File name within the artifact") @PathVariable String filename) {
        Path path = exportService.resolveFile(artifactId, filename);
        FileSystemResource resource = new FileSystemResource(path);
        // the janitor may reclaim the artifact between lookup and streaming
        if (!resource.isReadable()) {
            throw new ArtifactNotFoundException(artifactId, filename);
        }
        return ResponseEntity.ok()
                .contentType(contentTypeOf(filename))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(filename).build().toString())
                .body(resource);
    }

    private static MediaType contentTypeOf(String filename) {
        if (filename.endsWith(".md")) {
            return MARKDOWN;
        }
        return MediaTypeFactory.getMediaType(filename).orElse(MediaType.APPLICATION_OCTET_STREAM);
    }
}
