package uk.gegc.docgen.features.generation.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Diagram source plus classification metadata. The code is not parsed or validated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "Diagram", description = "Generated diagram source")
public record Diagram(
        @Schema(description = "Diagram identifier", example = "mermaid_component-3f2a9c1d")
        String id,

        @Schema(description = "Diagram type", example = "component")
        String type,

        @Schema(description = "Markup language of the code", example = "mermaid")
        String language,

        @Schema(description = "Optional display title", example = "Component Diagram")
        String title,

        @Schema(description = "Raw diagram source")
        String code,

        @Schema(description = "Prompt id of the section that produced the diagram", example = "mermaid_component")
        @JsonProperty("source_section")
        String sourceSection
) {
}
