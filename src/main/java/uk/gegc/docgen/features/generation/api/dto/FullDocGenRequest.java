package uk.gegc.docgen.features.generation.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import uk.gegc.docgen.features.generation.domain.model.GenerationInput;

import java.util.List;

@Schema(name = "FullDocGenRequest", description = "Problem plus the set of sections to generate")
public record FullDocGenRequest(
        @Schema(description = "Problem title", example = "Order tracking service")
        @NotBlank(message = "Title must not be blank")
        @Size(max = 500, message = "Title must not exceed 500 characters")
        String title,

        @Schema(description = "Problem description")
        @NotBlank(message = "Description must not be blank")
        @Size(max = 20000, message = "Description must not exceed 20000 characters")
        String description,

        @Size(max = 50, message = "At most 50 constraints are allowed")
        List<String> constraints,

        String model,

        @Schema(description = "Section (prompt) ids to generate; the configured default set when omitted",
                example = "[\"exec_summary\", \"solution_plan\", \"mermaid_component\"]")
        @JsonAlias("sections")
        List<String> prompts
) {
    public GenerationInput toInput() {
        return new GenerationInput(title, description, constraints, model);
    }
}
