package uk.gegc.docgen.shared.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@Tag(name = "Utility", description = "Utility & administrative endpoints")
public class UtilityController {

    private static final Map<String, String> OK = Map.of("status", "ok");

    @Operation(
            summary = "Liveness check",
            description = "Returns 200 with `{ \"status\": \"ok\" }` while the process is serving requests"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Service is alive",
                    content = @Content(
                            mediaType = "application/json",
                            schema = @Schema(example = "{\"status\":\"ok\"}")
                    )
            )
    })
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(OK);
    }
}
