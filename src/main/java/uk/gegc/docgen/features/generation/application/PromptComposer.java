package uk.gegc.docgen.features.generation.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.docgen.features.generation.config.GenerationProperties;
import uk.gegc.docgen.features.generation.domain.model.DocSection;
import uk.gegc.docgen.features.generation.domain.model.GenerationInput;
import uk.gegc.docgen.features.generation.domain.model.PromptTemplate;
import uk.gegc.docgen.features.upstream.domain.model.ChatMessage;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the {@code [system, user]} message pairs sent upstream for each kind of call.
 */
@Component
@RequiredArgsConstructor
public class PromptComposer {

    public static final String DIAGRAMS_KEY = "diagrams";

    private final PromptCatalog promptCatalog;
    private final GenerationProperties properties;

    /**
     * One structured section answered on its own, as a JSON object.
     */
    public List<ChatMessage> singleSection(DocSection section, GenerationInput input) {
        PromptTemplate template = promptCatalog.getPrompt(section);
        List<String> keys = template.outputs().isEmpty() ? List.of(section.outputKey()) : template.outputs();
        StringBuilder user = new StringBuilder(instructions(template))
                .append("\n\n").append(problemStatement(input))
                .append("\n\nRespond with a single JSON object containing the keys ")
                .append(quoted(keys))
                .append(".");
        if (keys.contains(DIAGRAMS_KEY)) {
            user.append(" \"").append(DIAGRAMS_KEY).append("\" is an array of objects with the fields")
                    .append(" id, type, language (always \"").append(DocSection.DIAGRAM_LANGUAGE).append("\"), title and code.");
        }
        return messages(user.toString());
    }

    /**
     * Every structured section in one call. The instruction names each output key the answer must carry.
     */
    public List<ChatMessage> combinedStructured(List<DocSection> sections, GenerationInput input) {
        if (sections.isEmpty()) {
            throw new IllegalArgumentException("At least one structured section is required");
        }
        StringBuilder user = new StringBuilder();
        for (DocSection section : sections) {
            if (section.isDiagram()) {
                throw new IllegalArgumentException("Diagram section " + section.id() + " cannot be combined");
            }
            user.append(instructions(promptCatalog.getPrompt(section))).append("\n\n");
        }
        user.append(problemStatement(input));

        List<String> keys = sections.stream().map(DocSection::outputKey).toList();
        user.append("\n\nRespond with a single JSON object containing the keys ")
                .append(quoted(keys))
                .append(". Each value must be a markdown string.");
        return messages(user.toString());
    }

    /**
     * One diagram. The answer is expected to be raw Mermaid source with nothing around it.
     */
    public List<ChatMessage> diagram(DocSection section, GenerationInput input) {
        if (!section.isDiagram()) {
            throw new IllegalArgumentException("Section " + section.id() + " is not a diagram section");
        }
        String user = instructions(promptCatalog.getPrompt(section))
                + "\n\n" + problemStatement(input)
                + "\n\nReturn only the raw " + DocSection.DIAGRAM_LANGUAGE
                + " source for the " + section.diagramType()
                + " diagram. Do not wrap it in JSON, code fences or any explanation.";
        return messages(user);
    }

    static String instructions(PromptTemplate template) {
        StringBuilder sb = new StringBuilder(template.template().strip());
        if (!template.constraints().isEmpty()) {
            sb.append("\nGuidelines:");
            template.constraints().forEach(c -> sb.append("\n- ").append(c));
        }
        return sb.toString();
    }

    private static String quoted(List<String> keys) {
        return keys.stream().map(key -> "\"" + key + "\"").collect(Collectors.joining(", "));
    }

    private List<ChatMessage> messages(String user) {
        return List.of(ChatMessage.system(properties.getSystemPrompt()), ChatMessage.user(user));
    }

    static String problemStatement(GenerationInput input) {
        StringBuilder sb = new StringBuilder()
                .append("Problem Title: ").append(input.title())
                .append("\nProblem Description: ").append(input.description());
        if (!input.constraints().isEmpty()) {
            sb.append("\nConstraints:");
            input.constraints().forEach(c -> sb.append("\n- ").append(c));
        }
        return sb.toString();
    }
}
