package uk.gegc.docgen.features.generation.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Every section a caller can request, keyed by its prompt id.
 * Structured sections name the output key they fill; diagram sections name the diagram type they produce.
 */
public enum DocSection {

    EXEC_SUMMARY("exec_summary", "Executive Summary", SectionKind.STRUCTURED, "summary_md", null),
    SOLUTION_PLAN("solution_plan", "Solution Plan", SectionKind.STRUCTURED, "plan_md", null),
    ARCHITECTURE_OVERVIEW("architecture_overview", "System Design", SectionKind.STRUCTURED, "design_md", null),
    WORK_BREAKDOWN("work_breakdown", "Work Breakdown", SectionKind.STRUCTURED, "breakdown_md", null),
    TRADEOFFS("tradeoffs", "Trade-offs", SectionKind.STRUCTURED, "tradeoffs_md", null),
    DATA_MODEL("data_model", "Data Model", SectionKind.STRUCTURED, "data_model_md", null),
    RISK_REGISTER("risk_register", "Risks", SectionKind.STRUCTURED, "risks_md", null),
    ACCEPTANCE_CRITERIA("acceptance_criteria", "Acceptance Criteria", SectionKind.STRUCTURED, "acceptance_md", null),
    TEST_PLAN("test_plan", "Test Plan", SectionKind.STRUCTURED, "testing_md", null),
    API_DESIGN("api_design", "API Design", SectionKind.STRUCTURED, "api_md", null),
    CAPACITY_ESTIMATE("capacity_estimate", "Capacity Estimate", SectionKind.STRUCTURED, "capacity_md", null),

    MERMAID_COMPONENT("mermaid_component", "Component Diagram", SectionKind.DIAGRAM, null, "component"),
    MERMAID_DEPLOYMENT("mermaid_deployment", "Deployment Diagram", SectionKind.DIAGRAM, null, "deployment"),
    MERMAID_SEQUENCE("mermaid_sequence", "Sequence Diagram", SectionKind.DIAGRAM, null, "sequence");

    public static final String DIAGRAM_LANGUAGE = "mermaid";

    private final String id;
    private final String title;
    private final SectionKind kind;
    private final String outputKey;
    private final String diagramType;

    DocSection(String id, String title, SectionKind kind, String outputKey, String diagramType) {
        this.id = id;
        this.title = title;
        this.kind = kind;
        this.outputKey = outputKey;
        this.diagramType = diagramType;
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public SectionKind kind() {
        return kind;
    }

    /**
     * Key of the JSON field holding this section's markdown; {@code null} for diagram sections.
     */
    public String outputKey() {
        return outputKey;
    }

    /**
     * Diagram type; {@code null} for structured sections.
     */
    public String diagramType() {
        return diagramType;
    }

    public boolean isDiagram() {
        return kind == SectionKind.DIAGRAM;
    }

    public static Optional<DocSection> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim();
        return Arrays.stream(values())
                .filter(section -> section.id.equalsIgnoreCase(normalized))
                .findFirst();
    }
}
