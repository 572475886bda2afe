package uk.gegc.docgen.features.generation.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import uk.gegc.docgen.features.generation.domain.model.Diagram;

import java.util.List;

public record DesignResponse(
        @JsonProperty("design_md") String designMd,
        List<Diagram> diagrams
) {
    public DesignResponse {
        diagrams = diagrams == null ? List.of() : List.copyOf(diagrams);
    }
}
