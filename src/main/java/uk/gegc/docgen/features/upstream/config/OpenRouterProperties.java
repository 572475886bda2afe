package uk.gegc.docgen.features.upstream.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import uk.gegc.docgen.shared.http.RetryPolicy;

import java.net.URI;
import java.time.Duration;

/**
 * Connection, credential and retry settings for the OpenRouter chat-completions API.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "docgen.openrouter")
public class OpenRouterProperties {

    /**
     * Bearer credential. The application refuses to start without it.
     */
    @NotBlank(message = "docgen.openrouter.api-key (OPENROUTER_API_KEY) must be set")
    private String apiKey;

    @NotNull
    private URI baseUrl = URI.create("https://openrouter.ai/api/v1");

    /**
     * Optional attribution forwarded as {@code HTTP-Referer}.
     */
    private String referer;

    /**
     * Optional attribution forwarded as {@code X-Title}.
     */
    private String title;

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(30);

    @Min(0)
    private int maxRetries = 1;

    @NotNull
    private Duration baseBackoff = Duration.ofSeconds(2);

    @NotNull
    private Duration maxBackoff = Duration.ofSeconds(60);

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitterFactor = 0.25;

    public URI chatCompletionsUri() {
        String base = baseUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/chat/completions");
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxRetries, baseBackoff, maxBackoff, jitterFactor);
    }
}
