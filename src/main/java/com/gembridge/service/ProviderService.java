package com.gembridge.service;

import com.gembridge.model.ChatCompletionChunk;
import com.gembridge.model.ChatCompletionRequest;
import com.gembridge.model.ChatCompletionResponse;
import com.gembridge.provider.ChatProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Service for forwarding requests to AI providers using the provider adapter pattern.
 * Automatically routes requests to the appropriate provider based on model name.
 */
@Slf4j
@Service
public class ProviderService {

    private final List<ChatProvider> providers;

    public ProviderService(List<ChatProvider> providers) {
        this.providers = providers;
        log.info("Initialized ProviderService with {} providers: {}",
                providers.size(),
                providers.stream().map(ChatProvider::getName).toList());
    }

    /**
     * Forward request to the first provider that supports the model.
     */
    public Mono<ChatCompletionResponse> forward(ChatCompletionRequest request) {
        return Mono.fromCallable(() -> route(request.getModel()))
                .flatMap(provider -> provider.complete(request)
                        .doOnSuccess(response -> log.info("Completed {} via provider {}",
                                request.getModel(), provider.getName()))
                        .doOnError(error -> log.error("Error from provider {}: {}",
                                provider.getName(), error.getMessage())));
    }

    /**
     * Stream request through the first provider that supports the model.
     *
     * @throws IllegalArgumentException right away when no provider supports the model,
     *                                  so the caller can reject it before the stream opens
     */
    public Flux<ChatCompletionChunk> stream(ChatCompletionRequest request) {
        ChatProvider provider = route(request.getModel());
        return provider.stream(request)
                .doOnComplete(() -> log.info("Streamed {} via provider {}",
                        request.getModel(), provider.getName()))
                .doOnError(error -> log.error("Stream error from provider {}: {}",
                        provider.getName(), error.getMessage()));
    }

    private ChatProvider route(String model) {
        ChatProvider provider = providers.stream()
                .filter(p -> p.supports(model))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported model: " + model));
        log.debug("Routing model '{}' to provider '{}'", model, provider.getName());
        return provider;
    }
}
