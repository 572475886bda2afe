package uk.gegc.docgen.features.generation.application;

import uk.gegc.docgen.features.generation.api.dto.DesignResponse;
import uk.gegc.docgen.features.generation.api.dto.FullDocumentResponse;
import uk.gegc.docgen.features.generation.api.dto.PlanResponse;
import uk.gegc.docgen.features.generation.api.dto.SummaryResponse;
import uk.gegc.docgen.features.generation.domain.model.GenerationInput;

import java.util.List;

public interface DocumentGenerationService {

    SummaryResponse generateSummary(GenerationInput input);

    PlanResponse generatePlan(GenerationInput input);

    DesignResponse generateDesign(GenerationInput input);

    /**
     * Generates the requested sections. Structured sections share one upstream call;
     * each diagram section gets its own.
     *
     * @param sectionIds section (prompt) ids; {@code null} or empty selects the configured defaults
     * @throws uk.gegc.docgen.features.generation.domain.UnknownSectionException if an id is not a known section
     */
    FullDocumentResponse generateFull(GenerationInput input, List<String> sectionIds);
}
