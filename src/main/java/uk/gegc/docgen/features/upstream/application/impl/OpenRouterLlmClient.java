package uk.gegc.docgen.features.upstream.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import uk.gegc.docgen.features.upstream.application.UpstreamLlmClient;
import uk.gegc.docgen.features.upstream.config.OpenRouterProperties;
import uk.gegc.docgen.features.upstream.domain.UpstreamCallCancelledException;
import uk.gegc.docgen.features.upstream.domain.UpstreamException;
import uk.gegc.docgen.features.upstream.domain.UpstreamForbiddenException;
import uk.gegc.docgen.features.upstream.domain.UpstreamRateLimitedException;
import uk.gegc.docgen.features.upstream.domain.UpstreamResponseParseException;
import uk.gegc.docgen.features.upstream.domain.UpstreamServerErrorException;
import uk.gegc.docgen.features.upstream.domain.UpstreamUnauthorizedException;
import uk.gegc.docgen.features.upstream.domain.UpstreamUnavailableException;
import uk.gegc.docgen.features.upstream.domain.model.ChatCompletionRequest;
import uk.gegc.docgen.features.upstream.domain.model.ChatCompletionResponse;
import uk.gegc.docgen.shared.http.OutboundRequest;
import uk.gegc.docgen.shared.http.RetryCancelledException;
import uk.gegc.docgen.shared.http.RetryPolicy;
import uk.gegc.docgen.shared.http.RetryableHttpTransport;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * OpenRouter implementation of {@link UpstreamLlmClient}.
 * Builds chat-completion calls, executes them through {@link RetryableHttpTransport}
 * and maps provider statuses onto the upstream exception hierarchy.
 */
@Service
@Slf4j
public class OpenRouterLlmClient implements UpstreamLlmClient {

    static final String REFERER_HEADER = "HTTP-Referer";
    static final String TITLE_HEADER = "X-Title";
    private static final long DEFAULT_RETRY_AFTER_SECONDS = 60;
    private static final int MAX_ERROR_DETAIL_LENGTH = 500;

    private final RetryableHttpTransport transport;
    private final ObjectMapper objectMapper;
    private final URI endpoint;
    private final RetryPolicy retryPolicy;
    private final String apiKey;
    private final String referer;
    private final String title;

    public OpenRouterLlmClient(RetryableHttpTransport transport,
                               OpenRouterProperties properties,
                               ObjectMapper objectMapper) {
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            throw new IllegalStateException("OpenRouter API key is not configured (OPENROUTER_API_KEY)");
        }
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.endpoint = properties.chatCompletionsUri();
        this.retryPolicy = properties.retryPolicy();
        this.apiKey = properties.getApiKey();
        this.referer = properties.getReferer();
        this.title = properties.getTitle();
    }

    @Override
    public ChatCompletionResponse createChatCompletion(ChatCompletionRequest request,
                                                       BooleanSupplier cancellationChecker) {
        OutboundRequest outbound = OutboundRequest.post(endpoint, buildHeaders(), serialize(request));
        long startedAt = System.currentTimeMillis();

        try (ClientHttpResponse response = transport.execute(outbound, retryPolicy, cancellationChecker)) {
            HttpStatusCode status = response.getStatusCode();
            String body = readBody(response);

            if (!status.is2xxSuccessful()) {
                throw mapError(status, body, response.getHeaders());
            }

            ChatCompletionResponse parsed = parse(body);
            if (parsed.usage() != null) {
                log.info("Upstream call for model {} completed in {} ms ({} tokens)",
                        request.model(), System.currentTimeMillis() - startedAt, parsed.usage().totalTokens());
            } else {
                log.info("Upstream call for model {} completed in {} ms",
                        request.model(), System.currentTimeMillis() - startedAt);
            }
            return parsed;
        } catch (RetryCancelledException e) {
            log.info("Upstream call for model {} cancelled after {} attempt(s)", request.model(), e.getAttemptsMade());
            throw new UpstreamCallCancelledException("Upstream call cancelled: " + e.getMessage(), e);
        } catch (IOException e) {
            log.error("Upstream call for model {} failed after {} retries", request.model(), retryPolicy.maxRetries(), e);
            throw new UpstreamUnavailableException("Failed to reach upstream provider: " + e.getMessage(), e);
        }
    }

    private HttpHeaders buildHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (referer != null && !referer.isBlank()) {
            headers.set(REFERER_HEADER, referer);
        }
        if (title != null && !title.isBlank()) {
            headers.set(TITLE_HEADER, title);
        }
        return headers;
    }

    private byte[] serialize(ChatCompletionRequest request) {
        try {
            return objectMapper.writeValueAsBytes(request);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize chat request", e);
        }
    }

    private String readBody(ClientHttpResponse response) throws IOException {
        return new String(StreamUtils.copyToByteArray(response.getBody()), StandardCharsets.UTF_8);
    }

    private ChatCompletionResponse parse(String body) {
        try {
            ChatCompletionResponse parsed = objectMapper.readValue(body, ChatCompletionResponse.class);
            if (parsed == null) {
                throw new UpstreamResponseParseException("Upstream returned an empty body", body, null);
            }
            return parsed;
        } catch (JsonProcessingException e) {
            log.error("Failed to parse upstream response: {}", e.getOriginalMessage());
            log.debug("Unparseable upstream body: {}", body);
            throw new UpstreamResponseParseException("Failed to parse upstream response", body, e);
        }
    }

    private UpstreamException mapError(HttpStatusCode status, String body, HttpHeaders headers) {
        int code = status.value();
        log.warn("Upstream returned status {}", code);
        return switch (code) {
            case 401 -> new UpstreamUnauthorizedException();
            case 403 -> new UpstreamForbiddenException();
            case 429 -> new UpstreamRateLimitedException(parseRetryAfter(headers));
            default -> status.is5xxServerError()
                    ? new UpstreamServerErrorException(code, abbreviate(body))
                    : new UpstreamException("Received non-2xx status code from upstream: " + code, code);
        };
    }

    private long parseRetryAfter(HttpHeaders headers) {
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) {
            return DEFAULT_RETRY_AFTER_SECONDS;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After header '{}'", value);
            return DEFAULT_RETRY_AFTER_SECONDS;
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return null;
        }
        String trimmed = body.strip();
        return trimmed.length() <= MAX_ERROR_DETAIL_LENGTH
                ? trimmed
                : trimmed.substring(0, MAX_ERROR_DETAIL_LENGTH) + "...";
    }
}
