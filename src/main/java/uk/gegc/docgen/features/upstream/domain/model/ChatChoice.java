package uk.gegc.docgen.features.upstream.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatChoice(ChatMessage message) {
}
