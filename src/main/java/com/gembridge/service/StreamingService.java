package com.gembridge.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gembridge.model.ChatCompletionChunk;
import com.gembridge.model.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/**
 * Frames completion chunks as OpenAI server-sent events.
 * The stream always ends with {@code data: [DONE]}; a failure is sent as one error event first.
 */
@Slf4j
@Service
public class StreamingService {

    static final String DONE = "[DONE]";

    private static final String ERROR_FALLBACK_JSON =
            "{\"error\":{\"message\":\"Error serialization failed\",\"type\":\"api_error\",\"code\":500}}";

    private final ObjectMapper objectMapper;

    public StreamingService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Flux<ServerSentEvent<String>> toEvents(Flux<ChatCompletionChunk> chunks) {
        return chunks
                .map(chunk -> event(serialize(chunk)))
                .onErrorResume(error -> {
                    log.error("Streaming failed: {}", error.getMessage());
                    return Flux.just(event(serializeError(error)));
                })
                .concatWith(Flux.just(event(DONE)));
    }

    private static ServerSentEvent<String> event(String data) {
        return ServerSentEvent.<String>builder().data(data).build();
    }

    private String serialize(ChatCompletionChunk chunk) {
        try {
            return objectMapper.writeValueAsString(chunk);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize chunk " + chunk.getId(), e);
        }
    }

    private String serializeError(Throwable error) {
        try {
            return objectMapper.writeValueAsString(ErrorResponse.from(error));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize stream error", e);
            return ERROR_FALLBACK_JSON;
        }
    }
}
