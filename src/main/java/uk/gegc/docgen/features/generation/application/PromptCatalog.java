package uk.gegc.docgen.features.generation.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;
import uk.gegc.docgen.features.generation.config.GenerationProperties;
import uk.gegc.docgen.features.generation.domain.UnknownSectionException;
import uk.gegc.docgen.features.generation.domain.model.DocSection;
import uk.gegc.docgen.features.generation.domain.model.PromptTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Prompt templates keyed by section id. Loaded once when the bean is created;
 * any unreadable or incomplete template set prevents the application from starting.
 */
@Component
@Slf4j
public class PromptCatalog {

    private final Map<String, PromptTemplate> templates;

    public PromptCatalog(ResourcePatternResolver resourceResolver,
                         ObjectMapper objectMapper,
                         GenerationProperties properties) {
        this.templates = Collections.unmodifiableMap(
                load(resourceResolver, objectMapper, properties.getPromptLocation()));
        log.info("Loaded {} prompt templates from {}", templates.size(), properties.getPromptLocation());
    }

    public PromptTemplate getPrompt(String id) {
        PromptTemplate template = id == null ? null : templates.get(id.trim());
        if (template == null) {
            throw new UnknownSectionException(id);
        }
        return template;
    }

    public PromptTemplate getPrompt(DocSection section) {
        return getPrompt(section.id());
    }

    private static Map<String, PromptTemplate> load(ResourcePatternResolver resolver,
                                                    ObjectMapper objectMapper,
                                                    String location) {
        Resource[] resources;
        try {
            resources = resolver.getResources(location);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to list prompt templates at " + location, e);
        }
        if (resources.length == 0) {
            throw new IllegalStateException("No prompt templates found at " + location);
        }

        Map<String, PromptTemplate> loaded = new HashMap<>();
        for (Resource resource : resources) {
            PromptTemplate template = read(resource, objectMapper);
            if (template.id() == null || template.id().isBlank()) {
                throw new IllegalStateException("Prompt template " + resource.getFilename() + " has no id");
            }
            if (template.template() == null || template.template().isBlank()) {
                throw new IllegalStateException("Prompt template " + template.id() + " has an empty template");
            }
            PromptTemplate previous = loaded.put(template.id(), template);
            if (previous != null) {
                log.warn("Prompt template {} defined more than once, using {}", template.id(), resource.getFilename());
            }
        }

        List<String> missing = Arrays.stream(DocSection.values())
                .map(DocSection::id)
                .filter(id -> !loaded.containsKey(id))
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Missing prompt templates for sections: " + missing);
        }
        return loaded;
    }

    private static PromptTemplate read(Resource resource, ObjectMapper objectMapper) {
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, PromptTemplate.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read prompt template " + resource.getFilename(), e);
        }
    }
}
