package uk.gegc.docgen.features.upstream.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.mock.http.client.MockClientHttpResponse;
import uk.gegc.docgen.features.upstream.config.OpenRouterProperties;
import uk.gegc.docgen.features.upstream.domain.UpstreamCallCancelledException;
import uk.gegc.docgen.features.upstream.domain.UpstreamErrorKind;
import uk.gegc.docgen.features.upstream.domain.UpstreamException;
import uk.gegc.docgen.features.upstream.domain.UpstreamForbiddenException;
import uk.gegc.docgen.features.upstream.domain.UpstreamRateLimitedException;
import uk.gegc.docgen.features.upstream.domain.UpstreamResponseParseException;
import uk.gegc.docgen.features.upstream.domain.UpstreamServerErrorException;
import uk.gegc.docgen.features.upstream.domain.UpstreamUnauthorizedException;
import uk.gegc.docgen.features.upstream.domain.UpstreamUnavailableException;
import uk.gegc.docgen.features.upstream.domain.model.ChatCompletionRequest;
import uk.gegc.docgen.features.upstream.domain.model.ChatCompletionResponse;
import uk.gegc.docgen.features.upstream.domain.model.ChatMessage;
import uk.gegc.docgen.features.upstream.domain.model.ResponseFormat;
import uk.gegc.docgen.shared.http.RetryableHttpTransport;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("OpenRouterLlmClient")
class OpenRouterLlmClientTest {

    private static final URI ENDPOINT = URI.create("https://openrouter.test/api/v1/chat/completions");
    private static final String SUCCESS_BODY = """
            {
              "id": "gen-123",
              "choices": [{"message": {"role": "assistant", "content": "{\\"summary_md\\": \\"# Hi\\"}"}}],
              "usage": {"prompt_tokens": 10, "completion_tokens": 5, "total_tokens": 15}
            }
            """;

    @Mock
    private ClientHttpRequestFactory requestFactory;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OpenRouterProperties properties;
    private OpenRouterLlmClient client;

    @BeforeEach
    void setUp() {
        properties = new OpenRouterProperties();
        properties.setApiKey("sk-test-key");
        properties.setBaseUrl(URI.create("https://openrouter.test/api/v1/"));
        properties.setReferer("https://docgen.example");
        properties.setTitle("DocGen");
        properties.setMaxRetries(1);
        properties.setBaseBackoff(Duration.ofMillis(10));
        client = new OpenRouterLlmClient(new NoSleepTransport(requestFactory), properties, objectMapper);
    }

    @Test
    @DisplayName("every request carries the bearer credential and attribution headers")
    void sendsBearerAndAttributionHeaders() throws IOException {
        // Given
        MockClientHttpRequest sent = respondWith(HttpStatus.OK, SUCCESS_BODY);

        // When
        client.createChatCompletion(chatRequest());

        // Then
        assertThat(sent.getHeaders().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-test-key");
        assertThat(sent.getHeaders().getFirst(OpenRouterLlmClient.REFERER_HEADER)).isEqualTo("https://docgen.example");
        assertThat(sent.getHeaders().getFirst(OpenRouterLlmClient.TITLE_HEADER)).isEqualTo("DocGen");
        verify(requestFactory).createRequest(ENDPOINT, HttpMethod.POST);
    }

    @Test
    @DisplayName("attribution headers are omitted when not configured")
    void omitsBlankAttributionHeaders() throws IOException {
        // Given
        properties.setReferer(" ");
        properties.setTitle(null);
        client = new OpenRouterLlmClient(new NoSleepTransport(requestFactory), properties, objectMapper);
        MockClientHttpRequest sent = respondWith(HttpStatus.OK, SUCCESS_BODY);

        // When
        client.createChatCompletion(chatRequest());

        // Then
        assertThat(sent.getHeaders().containsKey(OpenRouterLlmClient.REFERER_HEADER)).isFalse();
        assertThat(sent.getHeaders().containsKey(OpenRouterLlmClient.TITLE_HEADER)).isFalse();
        assertThat(sent.getHeaders().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-test-key");
    }

    @Test
    @DisplayName("request body carries model, messages and response format")
    void serializesRequestBody() throws IOException {
        // Given
        MockClientHttpRequest sent = respondWith(HttpStatus.OK, SUCCESS_BODY);

        // When
        client.createChatCompletion(chatRequest());

        // Then
        JsonNode body = objectMapper.readTree(sent.getBodyAsString());
        assertThat(body.get("model").asText()).isEqualTo("openai/gpt-oss-20b:free");
        assertThat(body.get("messages")).hasSize(2);
        assertThat(body.get("messages").get(0).get("role").asText()).isEqualTo("system");
        assertThat(body.get("response_format").get("type").asText()).isEqualTo("json_object");
    }

    @Test
    @DisplayName("successful response is parsed into the chat response shape")
    void parsesSuccessfulResponse() throws IOException {
        respondWith(HttpStatus.OK, SUCCESS_BODY);

        ChatCompletionResponse response = client.createChatCompletion(chatRequest());

        assertThat(response.id()).isEqualTo("gen-123");
        assertThat(response.firstContent()).contains("{\"summary_md\": \"# Hi\"}");
        assertThat(response.usage().totalTokens()).isEqualTo(15);
    }

    @Test
    @DisplayName("constructing without a credential fails")
    void blankApiKey_failsConstruction() {
        properties.setApiKey("  ");

        assertThatThrownBy(() -> new OpenRouterLlmClient(new NoSleepTransport(requestFactory), properties, objectMapper))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("OPENROUTER_API_KEY");
    }

    @Nested
    @DisplayName("error mapping")
    class ErrorMapping {

        @Test
        @DisplayName("401 maps to Unauthorized after a single attempt")
        void unauthorized() throws IOException {
            respondWith(HttpStatus.UNAUTHORIZED, "{\"error\":{\"message\":\"No auth credentials found\"}}");

            assertThatThrownBy(() -> client.createChatCompletion(chatRequest()))
                    .isInstanceOf(UpstreamUnauthorizedException.class)
                    .satisfies(ex -> assertThat(((UpstreamException) ex).getStatus()).isEqualTo(401));
            verify(requestFactory, times(1)).createRequest(any(URI.class), any(HttpMethod.class));
        }

        @Test
        @DisplayName("403 maps to Forbidden without retry")
        void forbidden() throws IOException {
            respondWith(HttpStatus.FORBIDDEN, "");

            assertThatThrownBy(() -> client.createChatCompletion(chatRequest()))
                    .isInstanceOf(UpstreamForbiddenException.class);
            verify(requestFactory, times(1)).createRequest(any(URI.class), any(HttpMethod.class));
        }

        @Test
        @DisplayName("429 maps to RateLimited after the retry budget, honouring Retry-After")
        void rateLimited() throws IOException {
            // Given
            MockClientHttpResponse first = new MockClientHttpResponse(new byte[0], HttpStatus.TOO_MANY_REQUESTS);
            MockClientHttpResponse second = new MockClientHttpResponse(new byte[0], HttpStatus.TOO_MANY_REQUESTS);
            second.getHeaders().set(HttpHeaders.RETRY_AFTER, "7");
            when(requestFactory.createRequest(any(URI.class), any(HttpMethod.class)))
                    .thenReturn(requestReturning(first), requestReturning(second));

            // When / Then
            assertThatThrownBy(() -> client.createChatCompletion(chatRequest()))
                    .isInstanceOf(UpstreamRateLimitedException.class)
                    .satisfies(ex -> {
                        UpstreamRateLimitedException rateLimited = (UpstreamRateLimitedException) ex;
                        assertThat(rateLimited.getRetryAfterSeconds()).isEqualTo(7);
                        assertThat(rateLimited.getKind()).isEqualTo(UpstreamErrorKind.RATE_LIMITED);
                        assertThat(rateLimited.getKind().isTransient()).isTrue();
                    });
            verify(requestFactory, times(2)).createRequest(any(URI.class), any(HttpMethod.class));
        }

        @Test
        @DisplayName("5xx maps to UpstreamServerError carrying the status")
        void serverError() throws IOException {
            when(requestFactory.createRequest(any(URI.class), any(HttpMethod.class)))
                    .thenReturn(
                            requestReturning(new MockClientHttpResponse("x".getBytes(StandardCharsets.UTF_8), HttpStatus.BAD_GATEWAY)),
                            requestReturning(new MockClientHttpResponse("upstream down".getBytes(StandardCharsets.UTF_8), HttpStatus.SERVICE_UNAVAILABLE)));

            assertThatThrownBy(() -> client.createChatCompletion(chatRequest()))
                    .isInstanceOf(UpstreamServerErrorException.class)
                    .hasMessageContaining("upstream down")
                    .satisfies(ex -> assertThat(((UpstreamException) ex).getStatus()).isEqualTo(503));
        }

        @Test
        @DisplayName("other non-2xx statuses map to a generic error with the status")
        void genericError() throws IOException {
            respondWith(HttpStatus.NOT_FOUND, "no such model");

            assertThatThrownBy(() -> client.createChatCompletion(chatRequest()))
                    .isExactlyInstanceOf(UpstreamException.class)
                    .satisfies(ex -> {
                        UpstreamException upstream = (UpstreamException) ex;
                        assertThat(upstream.getStatus()).isEqualTo(404);
                        assertThat(upstream.getKind()).isEqualTo(UpstreamErrorKind.GENERIC);
                    });
        }

        @Test
        @DisplayName("unparseable success body keeps the raw body")
        void parseError_keepsRawBody() throws IOException {
            respondWith(HttpStatus.OK, "<html>gateway hiccup</html>");

            assertThatThrownBy(() -> client.createChatCompletion(chatRequest()))
                    .isInstanceOf(UpstreamResponseParseException.class)
                    .satisfies(ex -> assertThat(((UpstreamResponseParseException) ex).getRawBody())
                            .isEqualTo("<html>gateway hiccup</html>"));
        }

        @Test
        @DisplayName("exhausted connection failures map to UpstreamUnavailable")
        void connectionFailure() throws IOException {
            when(requestFactory.createRequest(any(URI.class), any(HttpMethod.class)))
                    .thenThrow(new ConnectException("refused"));

            assertThatThrownBy(() -> client.createChatCompletion(chatRequest()))
                    .isInstanceOf(UpstreamUnavailableException.class)
                    .hasCauseInstanceOf(ConnectException.class);
            verify(requestFactory, times(2)).createRequest(any(URI.class), any(HttpMethod.class));
        }

        @Test
        @DisplayName("a cancelled call maps to UpstreamCallCancelled and sends nothing")
        void cancelled() throws IOException {
            assertThatThrownBy(() -> client.createChatCompletion(chatRequest(), () -> true))
                    .isInstanceOf(UpstreamCallCancelledException.class);
            verify(requestFactory, never()).createRequest(any(URI.class), any(HttpMethod.class));
        }
    }

    private ChatCompletionRequest chatRequest() {
        return new ChatCompletionRequest(
                "openai/gpt-oss-20b:free",
                List.of(ChatMessage.system("You are helpful."), ChatMessage.user("Summarise this.")),
                ResponseFormat.jsonObject()
        );
    }

    private MockClientHttpRequest respondWith(HttpStatus status, String body) throws IOException {
        MockClientHttpRequest request = requestReturning(
                new MockClientHttpResponse(body.getBytes(StandardCharsets.UTF_8), status));
        when(requestFactory.createRequest(any(URI.class), any(HttpMethod.class))).thenReturn(request);
        return request;
    }

    private static MockClientHttpRequest requestReturning(MockClientHttpResponse response) {
        MockClientHttpRequest request = new MockClientHttpRequest(HttpMethod.POST, ENDPOINT);
        request.setResponse(response);
        return request;
    }

    private static class NoSleepTransport extends RetryableHttpTransport {
        NoSleepTransport(ClientHttpRequestFactory requestFactory) {
            super(requestFactory);
        }

        @Override
        protected void sleepForBackoff(long delayMs) {
            // no waiting in unit tests
        }
    }
}
