package uk.gegc.docgen.features.upstream.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatCompletionResponse(
        String id,
        List<ChatChoice> choices,
        TokenUsage usage
) {
    public ChatCompletionResponse {
        choices = choices == null ? List.of() : List.copyOf(choices);
    }

    /**
     * Content of the first choice, if the provider returned one with a message.
     */
    public Optional<String> firstContent() {
        return choices.stream()
                .findFirst()
                .map(ChatChoice::message)
                .map(ChatMessage::content);
    }
}
