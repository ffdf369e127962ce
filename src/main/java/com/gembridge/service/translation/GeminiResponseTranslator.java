package com.gembridge.service.translation;

import com.fasterxml.jackson.databind.JsonNode;
import com.gembridge.model.ChatCompletionChunk;
import com.gembridge.model.ChatCompletionResponse;
import com.gembridge.model.Choice;
import com.gembridge.model.Delta;
import com.gembridge.model.Message;
import com.gembridge.model.Usage;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Converts Gemini responses, whole or streamed, into OpenAI chat completion objects.
 * Parts flagged {@code thought} become {@code reasoning_content}; every other text part
 * is answer content.
 */
@Component
public class GeminiResponseTranslator {

    private final Clock clock;

    public GeminiResponseTranslator(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param model model name the client asked for
     */
    public ChatCompletionResponse toChatCompletion(JsonNode gemini, String model) {
        List<Choice> choices = new ArrayList<>();
        for (JsonNode candidate : gemini.path("candidates")) {
            SplitText text = splitParts(candidate);
            Message message = Message.builder()
                    .role(mapRole(candidate.path("content").path("role").asText("assistant")))
                    .content(text.content())
                    .reasoningContent(text.reasoning().isEmpty() ? null : text.reasoning())
                    .build();
            choices.add(Choice.builder()
                    .index(candidate.path("index").asInt(0))
                    .message(message)
                    .finishReason(mapFinishReason(candidate.path("finishReason").asText(null)))
                    .build());
        }

        return ChatCompletionResponse.builder()
                .id(newResponseId())
                .object(ChatCompletionResponse.OBJECT_TYPE)
                .created(clock.instant().getEpochSecond())
                .model(model)
                .choices(choices)
                .usage(toUsage(gemini.get("usageMetadata")))
                .build();
    }

    /**
     * One streamed chunk. All chunks of a stream carry the same {@code responseId}.
     */
    public ChatCompletionChunk toChunk(JsonNode gemini, String model, String responseId) {
        List<ChatCompletionChunk.ChunkChoice> choices = new ArrayList<>();
        for (JsonNode candidate : gemini.path("candidates")) {
            SplitText text = splitParts(candidate);
            Delta delta = Delta.builder()
                    .content(text.content().isEmpty() ? null : text.content())
                    .reasoningContent(text.reasoning().isEmpty() ? null : text.reasoning())
                    .build();
            choices.add(ChatCompletionChunk.ChunkChoice.builder()
                    .index(candidate.path("index").asInt(0))
                    .delta(delta)
                    .finishReason(mapFinishReason(candidate.path("finishReason").asText(null)))
                    .build());
        }

        return ChatCompletionChunk.builder()
                .id(responseId)
                .object(ChatCompletionChunk.OBJECT_TYPE)
                .created(clock.instant().getEpochSecond())
                .model(model)
                .choices(choices)
                .build();
    }

    public String newResponseId() {
        return "chatcmpl-" + UUID.randomUUID();
    }

    public static String mapFinishReason(String geminiReason) {
        if (geminiReason == null) {
            return null;
        }
        return switch (geminiReason) {
            case "STOP" -> "stop";
            case "MAX_TOKENS" -> "length";
            case "SAFETY", "RECITATION" -> "content_filter";
            default -> null;
        };
    }

    private static String mapRole(String role) {
        return "model".equals(role) ? "assistant" : role;
    }

    private static SplitText splitParts(JsonNode candidate) {
        StringBuilder content = new StringBuilder();
        StringBuilder reasoning = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            String text = part.path("text").asText("");
            if (text.isEmpty()) {
                continue;
            }
            if (part.path("thought").asBoolean(false)) {
                reasoning.append(text);
            } else {
                content.append(text);
            }
        }
        return new SplitText(content.toString(), reasoning.toString());
    }

    private static Usage toUsage(JsonNode usageMetadata) {
        if (usageMetadata == null || !usageMetadata.isObject()) {
            return null;
        }
        int prompt = usageMetadata.path("promptTokenCount").asInt(0);
        int completion = usageMetadata.path("candidatesTokenCount").asInt(0)
                + usageMetadata.path("thoughtsTokenCount").asInt(0);
        int total = usageMetadata.path("totalTokenCount").asInt(prompt + completion);
        return Usage.builder()
                .promptTokens(prompt)
                .completionTokens(completion)
                .totalTokens(total)
                .build();
    }

    private record SplitText(String content, String reasoning) {
    }
}
