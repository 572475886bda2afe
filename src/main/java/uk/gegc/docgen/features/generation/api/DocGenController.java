package uk.gegc.docgen.features.generation.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.docgen.features.generation.api.dto.DesignResponse;
import uk.gegc.docgen.features.generation.api.dto.DocGenRequest;
import uk.gegc.docgen.features.generation.api.dto.FullDocGenRequest;
import uk.gegc.docgen.features.generation.api.dto.FullDocumentResponse;
import uk.gegc.docgen.features.generation.api.dto.PlanResponse;
import uk.gegc.docgen.features.generation.api.dto.SummaryResponse;
import uk.gegc.docgen.features.generation.application.DocumentGenerationService;

/**
 * Document generation endpoints
 */
@RestController
@RequestMapping("/v1/docgen")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Document Generation", description = "LLM-backed generation of design document sections")
public class DocGenController {

    private final DocumentGenerationService generationService;

    @Operation(summary = "Generate an executive summary")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Summary generated",
                    content = @Content(schema = @Schema(implementation = SummaryResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "502", description = "Upstream provider failed or returned unusable output")
    })
    @PostMapping("/summary")
    public ResponseEntity<SummaryResponse> summary(@Valid @RequestBody DocGenRequest request) {
        log.info("Summary requested for '{}'", request.title());
        return ResponseEntity.ok(generationService.generateSummary(request.toInput()));
    }

    @Operation(summary = "Generate a solution plan")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Plan generated",
                    content = @Content(schema = @Schema(implementation = PlanResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "502", description = "Upstream provider failed or returned unusable output")
    })
    @PostMapping("/plan")
    public ResponseEntity<PlanResponse> plan(@Valid @RequestBody DocGenRequest request) {
        log.info("Plan requested for '{}'", request.title());
        return ResponseEntity.ok(generationService.generatePlan(request.toInput()));
    }

    @Operation(summary = "Generate a system design narrative with diagrams")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Design generated",
                    content = @Content(schema = @Schema(implementation = DesignResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "502", description = "Upstream provider failed or returned unusable output")
    })
    @PostMapping("/design")
    public ResponseEntity<DesignResponse> design(@Valid @RequestBody DocGenRequest request) {
        log.info("Design requested for '{}'", request.title());
        return ResponseEntity.ok(generationService.generateDesign(request.toInput()));
    }

    @Operation(
            summary = "Generate several sections at once",
            description = "Structured sections are generated in one combined upstream call, each diagram in its own call. "
                    + "Sections missing from the model's answer are omitted from the response."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Sections generated",
                    content = @Content(schema = @Schema(implementation = FullDocumentResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request or unknown section id"),
            @ApiResponse(responseCode = "429", description = "Upstream provider rate limit reached"),
            @ApiResponse(responseCode = "502", description = "Upstream provider failed or returned unusable output"),
            @ApiResponse(responseCode = "503", description = "Upstream provider unreachable")
    })
    @PostMapping("/full")
    public ResponseEntity<FullDocumentResponse> full(@Valid @RequestBody FullDocGenRequest request) {
        log.info("Full generation requested for '{}' with sections {}", request.title(), request.prompts());
        return ResponseEntity.ok(generationService.generateFull(request.toInput(), request.prompts()));
    }
}
