package com.gembridge.provider;

import com.gembridge.model.ChatCompletionChunk;
import com.gembridge.model.ChatCompletionRequest;
import com.gembridge.model.ChatCompletionResponse;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Interface for chat completion providers.
 * Implementations handle provider-specific authentication, request/response mapping,
 * and API communication.
 */
public interface ChatProvider {

    /**
     * Get provider name (e.g., "code-assist").
     *
     * @return provider name
     */
    String getName();

    /**
     * Check if this provider supports the given model.
     *
     * @param model model name as sent by the client
     * @return true if supported
     */
    boolean supports(String model);

    /**
     * Complete a chat request.
     *
     * @param request OpenAI-compatible request
     * @return provider response (normalized to OpenAI format)
     */
    Mono<ChatCompletionResponse> complete(ChatCompletionRequest request);

    /**
     * Stream a chat request as OpenAI chunks.
     *
     * @param request OpenAI-compatible request
     * @return chunks in arrival order
     */
    Flux<ChatCompletionChunk> stream(ChatCompletionRequest request);
}
