package uk.gegc.docgen.features.generation.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.docgen.features.generation.domain.model.Diagram;

import java.util.List;

/**
 * Multi-section result. Every markdown field is optional; absent sections are omitted from the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "FullDocumentResponse", description = "Generated sections and diagrams")
public record FullDocumentResponse(
        @JsonProperty("summary_md") String summaryMd,
        @JsonProperty("plan_md") String planMd,
        @JsonProperty("design_md") String designMd,
        @JsonProperty("breakdown_md") String breakdownMd,
        @JsonProperty("tradeoffs_md") String tradeoffsMd,
        @JsonProperty("data_model_md") String dataModelMd,
        @JsonProperty("risks_md") String risksMd,
        @JsonProperty("acceptance_md") String acceptanceMd,
        @JsonProperty("testing_md") String testingMd,
        @JsonProperty("api_md") String apiMd,
        @JsonProperty("capacity_md") String capacityMd,
        @JsonInclude(JsonInclude.Include.ALWAYS)
        List<Diagram> diagrams
) {
    public FullDocumentResponse {
        diagrams = diagrams == null ? List.of() : List.copyOf(diagrams);
    }
}
