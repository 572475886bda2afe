package uk.gegc.docgen.features.generation.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import uk.gegc.docgen.features.generation.api.dto.DesignResponse;
import uk.gegc.docgen.features.generation.api.dto.FullDocumentResponse;
import uk.gegc.docgen.features.generation.api.dto.PlanResponse;
import uk.gegc.docgen.features.generation.api.dto.SummaryResponse;
import uk.gegc.docgen.features.generation.application.DocumentGenerationService;
import uk.gegc.docgen.features.generation.application.ModelSelector;
import uk.gegc.docgen.features.generation.application.PromptComposer;
import uk.gegc.docgen.features.generation.config.GenerationProperties;
import uk.gegc.docgen.features.generation.domain.UnknownSectionException;
import uk.gegc.docgen.features.generation.domain.model.Diagram;
import uk.gegc.docgen.features.generation.domain.model.DocSection;
import uk.gegc.docgen.features.generation.domain.model.GenerationInput;
import uk.gegc.docgen.features.generation.domain.model.SectionKind;
import uk.gegc.docgen.features.upstream.application.UpstreamLlmClient;
import uk.gegc.docgen.features.upstream.domain.UpstreamException;
import uk.gegc.docgen.features.upstream.domain.UpstreamResponseParseException;
import uk.gegc.docgen.features.upstream.domain.model.ChatCompletionRequest;
import uk.gegc.docgen.features.upstream.domain.model.ChatCompletionResponse;
import uk.gegc.docgen.features.upstream.domain.model.ChatMessage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

@Service
@Slf4j
public class DocumentGenerationServiceImpl implements DocumentGenerationService {

    private final UpstreamLlmClient llmClient;
    private final PromptComposer promptComposer;
    private final ModelSelector modelSelector;
    private final GenerationProperties properties;
    private final ObjectMapper objectMapper;
    private final Executor generationExecutor;

    public DocumentGenerationServiceImpl(UpstreamLlmClient llmClient,
                                         PromptComposer promptComposer,
                                         ModelSelector modelSelector,
                                         GenerationProperties properties,
                                         ObjectMapper objectMapper,
                                         @Qualifier("generationTaskExecutor") Executor generationExecutor) {
        this.llmClient = llmClient;
        this.promptComposer = promptComposer;
        this.modelSelector = modelSelector;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.generationExecutor = generationExecutor;
    }

    @Override
    public SummaryResponse generateSummary(GenerationInput input) {
        JsonNode root = generateSingle(DocSection.EXEC_SUMMARY, input);
        return new SummaryResponse(textField(root, DocSection.EXEC_SUMMARY.outputKey()));
    }

    @Override
    public PlanResponse generatePlan(GenerationInput input) {
        JsonNode root = generateSingle(DocSection.SOLUTION_PLAN, input);
        return new PlanResponse(textField(root, DocSection.SOLUTION_PLAN.outputKey()));
    }

    @Override
    public DesignResponse generateDesign(GenerationInput input) {
        DocSection section = DocSection.ARCHITECTURE_OVERVIEW;
        JsonNode root = generateSingle(section, input);

        List<Diagram> diagrams = new ArrayList<>();
        JsonNode diagramNodes = root.path(PromptComposer.DIAGRAMS_KEY);
        if (diagramNodes.isArray()) {
            for (JsonNode node : diagramNodes) {
                Diagram diagram = embeddedDiagram(node, section);
                if (diagram != null) {
                    diagrams.add(diagram);
                }
            }
        }
        return new DesignResponse(textField(root, section.outputKey()), diagrams);
    }

    @Override
    public FullDocumentResponse generateFull(GenerationInput input, List<String> sectionIds) {
        Set<DocSection> sections = resolveSections(sectionIds);
        List<DocSection> structured = sections.stream().filter(s -> s.kind() == SectionKind.STRUCTURED).toList();
        List<DocSection> diagramSections = sections.stream().filter(DocSection::isDiagram).toList();
        String model = modelSelector.select(input.model());

        log.info("Generating {} structured and {} diagram section(s) with model {}",
                structured.size(), diagramSections.size(), model);

        AtomicReference<RuntimeException> firstFailure = new AtomicReference<>();
        BooleanSupplier cancelled = () -> firstFailure.get() != null;

        List<CompletableFuture<Diagram>> diagramFutures = diagramSections.stream()
                .map(section -> CompletableFuture
                        .supplyAsync(() -> generateDiagram(section, input, model, cancelled), generationExecutor)
                        .whenComplete((diagram, ex) -> {
                            if (ex != null) {
                                firstFailure.compareAndSet(null, unwrap(ex));
                            }
                        }))
                .toList();

        Map<String, String> markdown = Map.of();
        if (!structured.isEmpty()) {
            try {
                markdown = generateStructured(structured, input, model, cancelled);
            } catch (RuntimeException e) {
                firstFailure.compareAndSet(null, e);
            }
        }

        List<Diagram> diagrams = new ArrayList<>(diagramFutures.size());
        for (CompletableFuture<Diagram> future : diagramFutures) {
            try {
                diagrams.add(future.join());
            } catch (CompletionException e) {
                firstFailure.compareAndSet(null, unwrap(e));
            }
        }

        RuntimeException failure = firstFailure.get();
        if (failure != null) {
            log.warn("Full generation failed: {}", failure.getMessage());
            throw failure;
        }
        return assemble(markdown, diagrams);
    }

    private Set<DocSection> resolveSections(List<String> sectionIds) {
        List<String> ids = sectionIds == null || sectionIds.stream().allMatch(id -> id == null || id.isBlank())
                ? properties.getDefaultSections()
                : sectionIds;
        Set<DocSection> sections = new LinkedHashSet<>();
        for (String id : ids) {
            if (id == null || id.isBlank()) {
                continue;
            }
            sections.add(DocSection.fromId(id).orElseThrow(() -> new UnknownSectionException(id)));
        }
        return sections;
    }

    private JsonNode generateSingle(DocSection section, GenerationInput input) {
        String model = modelSelector.select(input.model());
        List<ChatMessage> messages = promptComposer.singleSection(section, input);
        String content = call(model, messages, section.kind(), () -> false);
        return parseObject(content);
    }

    private Map<String, String> generateStructured(List<DocSection> sections,
                                                   GenerationInput input,
                                                   String model,
                                                   BooleanSupplier cancelled) {
        List<ChatMessage> messages = promptComposer.combinedStructured(sections, input);
        JsonNode root = parseObject(call(model, messages, SectionKind.STRUCTURED, cancelled));

        Map<String, String> markdown = new HashMap<>();
        for (DocSection section : sections) {
            String value = textField(root, section.outputKey());
            if (value != null) {
                markdown.put(section.outputKey(), value);
            } else {
                log.debug("Upstream answer has no usable '{}' field", section.outputKey());
            }
        }
        return markdown;
    }

    private Diagram generateDiagram(DocSection section, GenerationInput input, String model, BooleanSupplier cancelled) {
        List<ChatMessage> messages = promptComposer.diagram(section, input);
        String content = call(model, messages, section.kind(), cancelled);
        return new Diagram(
                diagramId(section),
                section.diagramType(),
                DocSection.DIAGRAM_LANGUAGE,
                section.title(),
                ModelOutputs.cleanDiagramSource(content),
                section.id()
        );
    }

    private String call(String model, List<ChatMessage> messages, SectionKind kind, BooleanSupplier cancelled) {
        ChatCompletionRequest request = new ChatCompletionRequest(model, messages, kind.responseFormat().orElse(null));
        ChatCompletionResponse response = llmClient.createChatCompletion(request, cancelled);
        return response.firstContent()
                .orElseThrow(() -> new UpstreamException("Upstream returned no choices"));
    }

    private JsonNode parseObject(String content) {
        String json = ModelOutputs.stripCodeFence(content);
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new UpstreamResponseParseException("Model output is not a JSON object", content, null);
            }
            return root;
        } catch (JsonProcessingException e) {
            log.debug("Unparseable model output: {}", content);
            throw new UpstreamResponseParseException("Model output is not valid JSON", content, e);
        }
    }

    private static String textField(JsonNode root, String key) {
        JsonNode value = root.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            log.warn("Ignoring non-text value for '{}'", key);
            return null;
        }
        return value.asText();
    }

    private Diagram embeddedDiagram(JsonNode node, DocSection source) {
        if (!node.isObject()) {
            return null;
        }
        String code = node.path("code").isTextual() ? ModelOutputs.cleanDiagramSource(node.get("code").asText()) : "";
        if (code.isEmpty()) {
            log.debug("Skipping embedded diagram without code");
            return null;
        }
        String id = node.path("id").isTextual() ? node.get("id").asText() : diagramId(source);
        String language = node.path("language").isTextual() ? node.get("language").asText() : DocSection.DIAGRAM_LANGUAGE;
        String title = node.path("title").isTextual() ? node.get("title").asText() : null;
        String type = node.path("type").isTextual() ? node.get("type").asText() : null;
        return new Diagram(id, type, language, title, code, source.id());
    }

    private static String diagramId(DocSection section) {
        return section.id() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static FullDocumentResponse assemble(Map<String, String> markdown, List<Diagram> diagrams) {
        return new FullDocumentResponse(
                markdown.get(DocSection.EXEC_SUMMARY.outputKey()),
                markdown.get(DocSection.SOLUTION_PLAN.outputKey()),
                markdown.get(DocSection.ARCHITECTURE_OVERVIEW.outputKey()),
                markdown.get(DocSection.WORK_BREAKDOWN.outputKey()),
                markdown.get(DocSection.TRADEOFFS.outputKey()),
                markdown.get(DocSection.DATA_MODEL.outputKey()),
                markdown.get(DocSection.RISK_REGISTER.outputKey()),
                markdown.get(DocSection.ACCEPTANCE_CRITERIA.outputKey()),
                markdown.get(DocSection.TEST_PLAN.outputKey()),
                markdown.get(DocSection.API_DESIGN.outputKey()),
                markdown.get(DocSection.CAPACITY_ESTIMATE.outputKey()),
                diagrams
        );
    }

    private static RuntimeException unwrap(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException("Diagram generation failed", cause);
    }
}
