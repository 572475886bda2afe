package uk.gegc.docgen.features.generation.application;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import uk.gegc.docgen.features.generation.config.GenerationProperties;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntUnaryOperator;

/**
 * Resolves the upstream model for a request: the caller's choice, or a random configured default.
 */
@Component
public class ModelSelector {

    private final List<String> defaultModels;
    private final IntUnaryOperator indexChooser;

    @Autowired
    public ModelSelector(GenerationProperties properties) {
        this(properties.getDefaultModels(), bound -> ThreadLocalRandom.current().nextInt(bound));
    }

    ModelSelector(List<String> defaultModels, IntUnaryOperator indexChooser) {
        if (defaultModels == null || defaultModels.isEmpty()) {
            throw new IllegalStateException("At least one default model must be configured");
        }
        this.defaultModels = List.copyOf(defaultModels);
        this.indexChooser = indexChooser;
    }

    public String select(String requested) {
        if (requested != null && !requested.isBlank()) {
            return requested.trim();
        }
        return defaultModels.get(indexChooser.applyAsInt(defaultModels.size()));
    }
}
