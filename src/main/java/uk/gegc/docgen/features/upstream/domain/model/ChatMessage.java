package uk.gegc.docgen.features.upstream.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One turn of a chat-completion conversation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatMessage(
        String role,
        String content
) {
    public static ChatMessage system(String content) {
        return new ChatMessage("system", content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage("user", content);
    }
}
