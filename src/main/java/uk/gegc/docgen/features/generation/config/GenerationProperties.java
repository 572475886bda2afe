package uk.gegc.docgen.features.generation.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for section generation.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "docgen.generation")
public class GenerationProperties {

    /**
     * Models picked from at random when a request does not name one.
     */
    @NotEmpty
    private List<String> defaultModels = new ArrayList<>(List.of(
            "openai/gpt-oss-20b:free",
            "google/gemini-flash-1.5",
            "moonshotai/kimi-k2:free",
            "google/gemma-3n-e2b-it:free"
    ));

    /**
     * Sections generated by the full endpoint when the request names none.
     */
    @NotEmpty
    private List<String> defaultSections = new ArrayList<>(List.of(
            "exec_summary",
            "solution_plan",
            "architecture_overview",
            "mermaid_component"
    ));

    @NotBlank
    private String systemPrompt = "You are a helpful assistant that generates documents based on user input.";

    /**
     * Resource pattern the prompt templates are loaded from.
     */
    @NotBlank
    private String promptLocation = "classpath*:prompts/*.json";
}
