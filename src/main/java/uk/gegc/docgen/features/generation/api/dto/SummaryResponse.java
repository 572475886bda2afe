package uk.gegc.docgen.features.generation.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SummaryResponse(@JsonProperty("summary_md") String summaryMd) {
}
