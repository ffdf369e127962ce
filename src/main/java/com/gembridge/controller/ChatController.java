package com.gembridge.controller;

import com.gembridge.model.ChatCompletionRequest;
import com.gembridge.service.ProviderService;
import com.gembridge.service.StreamingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * OpenAI-compatible chat completions controller.
 * Supports both regular and SSE streaming responses.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class ChatController {

    private final ProviderService providerService;
    private final StreamingService streamingService;

    public ChatController(ProviderService providerService, StreamingService streamingService) {
        this.providerService = providerService;
        this.streamingService = streamingService;
    }

    /**
     * Chat completions endpoint.
     * Returns JSON, or server-sent events when the request sets {@code stream}.
     */
    @PostMapping(value = "/chat/completions",
                 consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<?>> createChatCompletion(@RequestBody ChatCompletionRequest request) {
        log.info("Received chat completion request for model: {}, stream: {}",
                request.getModel(), request.isStreaming());

        // Validate request
        if (request.getMessages() == null || request.getMessages().isEmpty()) {
            return Mono.error(new IllegalArgumentException("Messages cannot be empty"));
        }

        if (request.getModel() == null || request.getModel().isEmpty()) {
            return Mono.error(new IllegalArgumentException("Model must be specified"));
        }

        if (request.isStreaming()) {
            return Mono.just(handleStreamingRequest(request));
        }
        return handleRegularRequest(request);
    }

    private Mono<ResponseEntity<?>> handleRegularRequest(ChatCompletionRequest request) {
        return providerService.forward(request)
                .map(ResponseEntity::ok);
    }

    private ResponseEntity<Flux<ServerSentEvent<String>>> handleStreamingRequest(ChatCompletionRequest request) {
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .cacheControl(CacheControl.noCache())
                .body(streamingService.toEvents(providerService.stream(request)));
    }
}
