package uk.gegc.docgen.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import uk.gegc.docgen.features.generation.domain.model.GenerationInput;

import java.util.List;

@Schema(name = "DocGenRequest", description = "Problem to generate a single document section for")
public record DocGenRequest(
        @Schema(description = "Problem title", example = "Order tracking service")
        @NotBlank(message = "Title must not be blank")
        @Size(max = 500, message = "Title must not exceed 500 characters")
        String title,

        @Schema(description = "Problem description", example = "Customers need real-time order status updates")
        @NotBlank(message = "Description must not be blank")
        @Size(max = 20000, message = "Description must not exceed 20000 characters")
        String description,

        @Schema(description = "Constraints the solution must respect")
        @Size(max = 50, message = "At most 50 constraints are allowed")
        List<String> constraints,

        @Schema(description = "Upstream model id; a default is chosen when omitted", example = "openrouter/auto")
        String model
) {
    public GenerationInput toInput() {
        return new GenerationInput(title, description, constraints, model);
    }
}
