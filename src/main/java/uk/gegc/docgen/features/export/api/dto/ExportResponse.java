package uk.gegc.docgen.features.export.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.docgen.features.export.domain.model.ExportResult;

import java.util.List;

@Schema(name = "ExportResponse", description = "Stored export artifact")
public record ExportResponse(
        @Schema(description = "Artifact identifier", example = "4f8a4c1e-2a55-4a57-9d0e-3c2f7b1a9e10")
        @JsonProperty("artifact_id") String artifactId,

        @Schema(description = "Files written into the artifact")
        List<String> filenames
) {
    public static ExportResponse from(ExportResult result) {
        return new ExportResponse(result.artifactId(), result.filenames());
    }
}
