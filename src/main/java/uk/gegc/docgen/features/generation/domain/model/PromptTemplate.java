package uk.gegc.docgen.features.generation.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * A prompt definition loaded from {@code prompts/*.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PromptTemplate(
        String id,
        String template,
        List<String> constraints,
        List<String> outputs
) {
    public PromptTemplate {
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }
}
