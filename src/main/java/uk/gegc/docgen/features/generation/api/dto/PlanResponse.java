package uk.gegc.docgen.features.generation.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PlanResponse(@JsonProperty("plan_md") String planMd) {
}
