package uk.gegc.docgen.shared.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.docgen.features.artifact.domain.ArtifactNotFoundException;
import uk.gegc.docgen.features.artifact.domain.ArtifactStorageException;
import uk.gegc.docgen.features.export.domain.ExportRenderingException;
import uk.gegc.docgen.features.export.domain.InvalidExportBundleException;
import uk.gegc.docgen.features.export.domain.UnsupportedExportFormatException;
import uk.gegc.docgen.features.generation.domain.UnknownSectionException;
import uk.gegc.docgen.features.upstream.domain.UpstreamCallCancelledException;
import uk.gegc.docgen.features.upstream.domain.UpstreamException;
import uk.gegc.docgen.features.upstream.domain.UpstreamForbiddenException;
import uk.gegc.docgen.features.upstream.domain.UpstreamRateLimitedException;
import uk.gegc.docgen.features.upstream.domain.UpstreamResponseParseException;
import uk.gegc.docgen.features.upstream.domain.UpstreamServerErrorException;
import uk.gegc.docgen.features.upstream.domain.UpstreamUnauthorizedException;
import uk.gegc.docgen.features.upstream.domain.UpstreamUnavailableException;
import uk.gegc.docgen.shared.api.problem.ErrorTypes;
import uk.gegc.docgen.shared.api.problem.ProblemDetailBuilder;

import java.net.URI;
import java.util.List;

@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // ==================== Request Errors ====================

    @ExceptionHandler(UnknownSectionException.class)
    public ResponseEntity<ProblemDetail> handleUnknownSection(UnknownSectionException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.UNKNOWN_SECTION,
                "Unknown Section",
                ex.getMessage(),
                request
        );
        problem.setProperty("section", ex.getSectionId());
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(UnsupportedExportFormatException.class)
    public ResponseEntity<ProblemDetail> handleUnsupportedFormat(UnsupportedExportFormatException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.UNSUPPORTED_FORMAT,
                "Unsupported Format",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(InvalidExportBundleException.class)
    public ResponseEntity<ProblemDetail> handleInvalidBundle(InvalidExportBundleException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                "Validation Failed",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    // ==================== Artifact Errors ====================

    @ExceptionHandler(ArtifactNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleArtifactNotFound(ArtifactNotFoundException ex, HttpServletRequest request) {
        logger.warn("Artifact lookup failed: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.NOT_FOUND,
                ErrorTypes.ARTIFACT_NOT_FOUND,
                "Artifact Not Found",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem);
    }

    @ExceptionHandler(ArtifactStorageException.class)
    public ResponseEntity<ProblemDetail> handleArtifactStorage(ArtifactStorageException ex, HttpServletRequest request) {
        logger.error("Artifact storage failure: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.ARTIFACT_STORAGE_FAILED,
                "Artifact Storage Failed",
                "Failed to store the generated files",
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    @ExceptionHandler(ExportRenderingException.class)
    public ResponseEntity<ProblemDetail> handleExportRendering(ExportRenderingException ex, HttpServletRequest request) {
        logger.error("Export rendering failure: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.EXPORT_FAILED,
                "Export Failed",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    // ==================== Upstream Errors ====================

    @ExceptionHandler(UpstreamRateLimitedException.class)
    public ResponseEntity<ProblemDetail> handleUpstreamRateLimited(UpstreamRateLimitedException ex, HttpServletRequest request) {
        ProblemDetail problem = upstreamProblem(HttpStatus.TOO_MANY_REQUESTS, ErrorTypes.UPSTREAM_RATE_LIMITED,
                "Upstream Rate Limited", ex, request);
        problem.setProperty("retryAfterSeconds", ex.getRetryAfterSeconds());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(problem);
    }

    @ExceptionHandler(UpstreamUnauthorizedException.class)
    public ResponseEntity<ProblemDetail> handleUpstreamUnauthorized(UpstreamUnauthorizedException ex, HttpServletRequest request) {
        logger.error("Upstream rejected the configured credential");
        ProblemDetail problem = upstreamProblem(HttpStatus.BAD_GATEWAY, ErrorTypes.UPSTREAM_UNAUTHORIZED,
                "Upstream Unauthorized", ex, request);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problem);
    }

    @ExceptionHandler(UpstreamForbiddenException.class)
    public ResponseEntity<ProblemDetail> handleUpstreamForbidden(UpstreamForbiddenException ex, HttpServletRequest request) {
        ProblemDetail problem = upstreamProblem(HttpStatus.BAD_GATEWAY, ErrorTypes.UPSTREAM_FORBIDDEN,
                "Upstream Forbidden", ex, request);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problem);
    }

    @ExceptionHandler(UpstreamServerErrorException.class)
    public ResponseEntity<ProblemDetail> handleUpstreamServerError(UpstreamServerErrorException ex, HttpServletRequest request) {
        ProblemDetail problem = upstreamProblem(HttpStatus.BAD_GATEWAY, ErrorTypes.UPSTREAM_SERVER_ERROR,
                "Upstream Server Error", ex, request);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problem);
    }

    @ExceptionHandler(UpstreamResponseParseException.class)
    public ResponseEntity<ProblemDetail> handleUpstreamParse(UpstreamResponseParseException ex, HttpServletRequest request) {
        logger.error("Unparseable upstream response: {}", ex.getMessage());
        ProblemDetail problem = upstreamProblem(HttpStatus.BAD_GATEWAY, ErrorTypes.UPSTREAM_RESPONSE_UNPARSEABLE,
                "Upstream Response Unparseable", ex, request);
        problem.setProperty("rawBody", ex.getRawBody());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problem);
    }

    @ExceptionHandler({UpstreamUnavailableException.class, UpstreamCallCancelledException.class})
    public ResponseEntity<ProblemDetail> handleUpstreamUnavailable(UpstreamException ex, HttpServletRequest request) {
        ProblemDetail problem = upstreamProblem(HttpStatus.SERVICE_UNAVAILABLE, ErrorTypes.UPSTREAM_UNAVAILABLE,
                "Upstream Unavailable", ex, request);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<ProblemDetail> handleUpstream(UpstreamException ex, HttpServletRequest request) {
        ProblemDetail problem = upstreamProblem(HttpStatus.BAD_GATEWAY, ErrorTypes.UPSTREAM_ERROR,
                "Upstream Error", ex, request);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problem);
    }

    private ProblemDetail upstreamProblem(HttpStatus status, URI type, String title,
                                          UpstreamException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(status, type, title, ex.getMessage(), request);
        problem.setProperty("upstreamErrorKind", ex.getKind().name());
        if (ex.getStatus() != null) {
            problem.setProperty("upstreamStatus", ex.getStatus());
        }
        return problem;
    }

    // ==================== Framework Overrides ====================

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        String msg = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.MALFORMED_JSON,
                "Malformed JSON",
                "Request body is malformed or cannot be read",
                request
        );
        problem.setProperty("parseError", msg);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        List<FieldValidationError> fieldErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> new FieldValidationError(error.getField(), error.getDefaultMessage(), error.getRejectedValue()))
                .toList();
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                "Validation Failed",
                "Validation failed for one or more fields",
                request
        );
        problem.setProperty("fieldErrors", fieldErrors);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleAllOthers(Exception ex, HttpServletRequest request) {
        logger.error("Unhandled exception: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred",
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    private record FieldValidationError(String field, String message, Object rejectedValue) {
    }
}
