package com.gembridge.service.translation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gembridge.config.GembridgeProperties;
import com.gembridge.model.ChatCompletionRequest;
import com.gembridge.model.Message;
import com.gembridge.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GeminiRequestTranslator.
 */
class GeminiRequestTranslatorTest {

    private GeminiRequestTranslator translator;

    @BeforeEach
    void setUp() {
        GembridgeProperties properties = TestProperties.defaults();
        translator = new GeminiRequestTranslator(new ObjectMapper(), new ModelCatalog(properties), properties);
    }

    @Test
    void testRolesAndPlainText() {
        ObjectNode gemini = translator.toGeminiRequest(request("gemini-2.5-pro",
                message("system", "be brief"),
                message("user", "hi"),
                message("assistant", "hello")));

        JsonNode contents = gemini.get("contents");
        assertEquals(3, contents.size());
        assertEquals("user", contents.get(0).get("role").asText());
        assertEquals("be brief", contents.get(0).at("/parts/0/text").asText());
        assertEquals("user", contents.get(1).get("role").asText());
        assertEquals("model", contents.get(2).get("role").asText());
        assertFalse(gemini.has("model"));
    }

    @Test
    void testTextAndImagePartsKeepOrder() {
        Message multimodal = Message.builder()
                .role("user")
                .content(List.of(
                        Map.of("type", "text", "text", "what is this"),
                        Map.of("type", "image_url", "image_url", Map.of("url", "data:image/png;base64,AAAA"))))
                .build();

        JsonNode parts = translator.toGeminiRequest(request("gemini-2.5-pro", multimodal)).at("/contents/0/parts");

        assertEquals(2, parts.size());
        assertEquals("what is this", parts.get(0).get("text").asText());
        assertEquals("image/png", parts.get(1).at("/inlineData/mimeType").asText());
        assertEquals("AAAA", parts.get(1).at("/inlineData/data").asText());
    }

    @Test
    void testMalformedImageUrlIsDropped() {
        Message multimodal = Message.builder()
                .role("user")
                .content(List.of(
                        Map.of("type", "text", "text", "look"),
                        Map.of("type", "image_url", "image_url", Map.of("url", "https://example.com/cat.png"))))
                .build();

        JsonNode parts = translator.toGeminiRequest(request("gemini-2.5-pro", multimodal)).at("/contents/0/parts");

        assertEquals(1, parts.size());
        assertEquals("look", parts.get(0).get("text").asText());
    }

    @Test
    void testInlineDataRequiresExactStructure() {
        assertTrue(translator.toInlineData("data:image/jpeg;base64,QUJD").isPresent());
        assertTrue(translator.toInlineData("data:image/jpeg;charset=x;base64,QUJD").isEmpty());
        assertTrue(translator.toInlineData("data:image/jpeg;base64,QU,JD").isEmpty());
        assertTrue(translator.toInlineData("image/jpeg;base64,QUJD").isEmpty());
    }

    @Test
    void testGenerationParameters() {
        ChatCompletionRequest request = request("gemini-2.5-flash", message("user", "hi"));
        request.setTemperature(0.5);
        request.setTopP(0.9);
        request.setMaxTokens(256);
        request.setStop(List.of("END", "STOP"));
        request.setN(2);
        request.setSeed(42L);
        request.setResponseFormat(Map.of("type", "json_object"));

        JsonNode config = translator.toGeminiRequest(request).get("generationConfig");

        assertEquals(0.5, config.get("temperature").asDouble());
        assertEquals(0.9, config.get("topP").asDouble());
        assertEquals(256, config.get("maxOutputTokens").asInt());
        assertEquals("STOP", config.at("/stopSequences/1").asText());
        assertEquals(2, config.get("candidateCount").asInt());
        assertEquals(42, config.get("seed").asLong());
        assertEquals("application/json", config.get("responseMimeType").asText());
    }

    @Test
    void testSingleStopStringBecomesList() {
        ChatCompletionRequest request = request("gemini-2.5-pro", message("user", "hi"));
        request.setStop("END");

        JsonNode stops = translator.toGeminiRequest(request).at("/generationConfig/stopSequences");

        assertEquals(1, stops.size());
        assertEquals("END", stops.get(0).asText());
    }

    @Test
    void testSearchVariantAddsGoogleSearchTool() {
        ObjectNode plain = translator.toGeminiRequest(request("gemini-2.5-pro", message("user", "hi")));
        ObjectNode search = translator.toGeminiRequest(request("gemini-2.5-pro-search", message("user", "hi")));

        assertFalse(plain.has("tools"));
        assertTrue(search.at("/tools/0/googleSearch").isObject());
    }

    @Test
    void testThinkingConfigPerVariant() {
        JsonNode dynamic = translator.toGeminiRequest(request("gemini-2.5-pro", message("user", "hi")))
                .at("/generationConfig/thinkingConfig");
        JsonNode minimal = translator.toGeminiRequest(request("gemini-2.5-flash-nothinking", message("user", "hi")))
                .at("/generationConfig/thinkingConfig");

        assertEquals(-1, dynamic.get("thinkingBudget").asInt());
        assertTrue(dynamic.get("includeThoughts").asBoolean());
        assertEquals(0, minimal.get("thinkingBudget").asInt());
        assertFalse(minimal.get("includeThoughts").asBoolean());
    }

    @Test
    void testSafetySettingsFromConfiguration() {
        JsonNode safety = translator.toGeminiRequest(request("gemini-2.5-pro", message("user", "hi")))
                .get("safetySettings");

        assertEquals(2, safety.size());
        assertEquals("HARM_CATEGORY_HARASSMENT", safety.get(0).get("category").asText());
        assertEquals("BLOCK_NONE", safety.get(0).get("threshold").asText());
    }

    private static ChatCompletionRequest request(String model, Message... messages) {
        return ChatCompletionRequest.builder()
                .model(model)
                .messages(List.of(messages))
                .build();
    }

    private static Message message(String role, String content) {
        return Message.builder().role(role).content(content).build();
    }
}
