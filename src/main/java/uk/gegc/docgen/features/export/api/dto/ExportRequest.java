package uk.gegc.docgen.features.export.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

@Schema(name = "ExportRequest", description = "Markdown sections to export")
public record ExportRequest(
        @Schema(description = "Section name to markdown content; non-string values are ignored",
                example = "{\"summary\": \"# Summary\\nShort text\", \"plan\": \"# Plan\"}")
        @NotNull(message = "Bundle is required")
        Map<String, Object> bundle,

        @Schema(description = "Export format", example = "pdf", allowableValues = {"pdf", "archive", "zip", "markdown", "md"})
        @NotBlank(message = "Format must not be blank")
        String format
) {
}
