package com.gembridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * OpenAI-compatible streaming chat completion chunk.
 * Sent as SSE events during streaming responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatCompletionChunk {

    public static final String OBJECT_TYPE = "chat.completion.chunk";

    @JsonProperty("id")
    private String id;

    @JsonProperty("object")
    private String object;

    @JsonProperty("created")
    private Long created;

    @JsonProperty("model")
    private String model;

    @JsonProperty("choices")
    private List<ChunkChoice> choices;

    /**
     * Choice for streaming chunk with delta instead of message.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChunkChoice {

        @JsonProperty("index")
        private Integer index;

        @JsonProperty("delta")
        private Delta delta;

        // Serialized as null until the final chunk
        @JsonProperty("finish_reason")
        @JsonInclude(JsonInclude.Include.ALWAYS)
        private String finishReason;
    }
}
