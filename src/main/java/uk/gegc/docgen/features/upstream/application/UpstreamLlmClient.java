package uk.gegc.docgen.features.upstream.application;

import uk.gegc.docgen.features.upstream.domain.model.ChatCompletionRequest;
import uk.gegc.docgen.features.upstream.domain.model.ChatCompletionResponse;

import java.util.function.BooleanSupplier;

/**
 * Client for the upstream chat-completion provider.
 *
 * <p>Failures surface as subclasses of {@link uk.gegc.docgen.features.upstream.domain.UpstreamException}.
 */
public interface UpstreamLlmClient {

    /**
     * Send one chat-completion request, retrying transient failures.
     *
     * @param request the model, messages and optional response-format hint
     * @return the parsed provider response
     */
    default ChatCompletionResponse createChatCompletion(ChatCompletionRequest request) {
        return createChatCompletion(request, () -> false);
    }

    /**
     * Same as {@link #createChatCompletion(ChatCompletionRequest)}, abandoning pending retries once
     * {@code cancellationChecker} returns {@code true}.
     */
    ChatCompletionResponse createChatCompletion(ChatCompletionRequest request, BooleanSupplier cancellationChecker);
}
