package uk.gegc.docgen.features.generation.domain.model;

import java.util.List;

/**
 * The problem being documented, as supplied by the caller.
 *
 * @param model upstream model id, or {@code null} to use a configured default
 */
public record GenerationInput(
        String title,
        String description,
        List<String> constraints,
        String model
) {
    public GenerationInput {
        constraints = constraints == null
                ? List.of()
                : constraints.stream().filter(c -> c != null && !c.isBlank()).map(String::strip).toList();
    }
}
