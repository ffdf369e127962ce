package com.gembridge.service.translation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gembridge.config.GembridgeProperties;
import com.gembridge.model.ChatCompletionRequest;
import com.gembridge.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Converts OpenAI chat completion requests into Gemini {@code generateContent} bodies.
 * Stateless.
 */
@Slf4j
@Component
public class GeminiRequestTranslator {

    private final ObjectMapper objectMapper;
    private final ModelCatalog modelCatalog;
    private final List<GembridgeProperties.SafetySetting> safetySettings;

    public GeminiRequestTranslator(ObjectMapper objectMapper,
                                   ModelCatalog modelCatalog,
                                   GembridgeProperties properties) {
        this.objectMapper = objectMapper;
        this.modelCatalog = modelCatalog;
        this.safetySettings = properties.getSafetySettings();
    }

    /**
     * Build the Gemini request body. The upstream model name is not part of the body;
     * see {@link ModelCatalog#baseModelName(String)}.
     */
    public ObjectNode toGeminiRequest(ChatCompletionRequest request) {
        ObjectNode gemini = objectMapper.createObjectNode();

        ArrayNode contents = gemini.putArray("contents");
        for (Message message : request.getMessages()) {
            ObjectNode content = contents.addObject();
            content.put("role", mapRole(message.getRole()));
            content.set("parts", toParts(message.getContent()));
        }

        ObjectNode generationConfig = gemini.putObject("generationConfig");
        applyGenerationParameters(request, generationConfig);

        ArrayNode safety = gemini.putArray("safetySettings");
        for (GembridgeProperties.SafetySetting setting : safetySettings) {
            safety.addObject()
                    .put("category", setting.getCategory())
                    .put("threshold", setting.getThreshold());
        }

        String model = request.getModel();
        if (modelCatalog.isSearchModel(model)) {
            gemini.putArray("tools").addObject().putObject("googleSearch");
        }
        modelCatalog.thinkingBudget(model).ifPresent(budget -> generationConfig.putObject("thinkingConfig")
                .put("thinkingBudget", budget)
                .put("includeThoughts", modelCatalog.includeThoughts(model)));

        return gemini;
    }

    static String mapRole(String role) {
        if ("assistant".equals(role)) {
            return "model";
        }
        // Gemini has no system role in contents
        if ("system".equals(role)) {
            return "user";
        }
        return role;
    }

    private ArrayNode toParts(Object content) {
        ArrayNode parts = objectMapper.createArrayNode();
        if (!(content instanceof List<?>)) {
            parts.addObject().put("text", content == null ? "" : content.toString());
            return parts;
        }

        JsonNode items = objectMapper.valueToTree(content);
        for (JsonNode part : items) {
            String type = part.path("type").asText();
            if ("text".equals(type)) {
                parts.addObject().put("text", part.path("text").asText(""));
            } else if ("image_url".equals(type)) {
                String url = part.path("image_url").path("url").asText("");
                Optional<ObjectNode> inline = toInlineData(url);
                if (inline.isPresent()) {
                    parts.add(inline.get());
                } else if (!url.isEmpty()) {
                    log.debug("Dropping image part that is not a base64 data URL");
                }
            }
        }
        return parts;
    }

    /**
     * Split {@code data:<mime>;base64,<data>} into an {@code inlineData} part.
     *
     * @return empty unless the URL has exactly that structure
     */
    Optional<ObjectNode> toInlineData(String url) {
        String[] header = url.split(";", -1);
        if (header.length != 2) {
            return Optional.empty();
        }
        String[] scheme = header[0].split(":", -1);
        String[] payload = header[1].split(",", -1);
        if (scheme.length != 2 || payload.length != 2) {
            return Optional.empty();
        }

        ObjectNode part = objectMapper.createObjectNode();
        part.putObject("inlineData")
                .put("mimeType", scheme[1])
                .put("data", payload[1]);
        return Optional.of(part);
    }

    private void applyGenerationParameters(ChatCompletionRequest request, ObjectNode config) {
        if (request.getTemperature() != null) {
            config.put("temperature", request.getTemperature());
        }
        if (request.getTopP() != null) {
            config.put("topP", request.getTopP());
        }
        if (request.getMaxTokens() != null) {
            config.put("maxOutputTokens", request.getMaxTokens());
        }
        if (request.getStop() instanceof String) {
            config.putArray("stopSequences").add((String) request.getStop());
        } else if (request.getStop() instanceof List) {
            ArrayNode sequences = config.putArray("stopSequences");
            ((List<?>) request.getStop()).forEach(stop -> sequences.add(String.valueOf(stop)));
        }
        if (request.getFrequencyPenalty() != null) {
            config.put("frequencyPenalty", request.getFrequencyPenalty());
        }
        if (request.getPresencePenalty() != null) {
            config.put("presencePenalty", request.getPresencePenalty());
        }
        if (request.getN() != null) {
            config.put("candidateCount", request.getN());
        }
        if (request.getSeed() != null) {
            config.put("seed", request.getSeed());
        }
        if (request.getResponseFormat() != null
                && "json_object".equals(request.getResponseFormat().get("type"))) {
            config.put("responseMimeType", "application/json");
        }
    }
}
