package com.gembridge.support;

import com.gembridge.config.GembridgeProperties;

import java.time.Duration;
import java.util.List;

/**
 * Properties matching the shipped configuration, with fast onboarding polls.
 */
public final class TestProperties {

    private TestProperties() {
    }

    public static GembridgeProperties defaults() {
        GembridgeProperties properties = new GembridgeProperties();
        properties.getCredentials().setClientId("test-client-id");
        properties.getCredentials().setClientSecret("test-client-secret");
        properties.getUpstream().setEndpoint("https://code-assist.test");
        properties.getOnboarding().setPollInterval(Duration.ofMillis(1));
        properties.getOnboarding().setMaxPollAttempts(3);
        properties.setModels(List.of(
                model("gemini-2.5-pro", 128, 32768, true),
                model("gemini-2.5-flash", 0, 24576, false)));
        properties.setSafetySettings(List.of(
                safety("HARM_CATEGORY_HARASSMENT"),
                safety("HARM_CATEGORY_HATE_SPEECH")));
        return properties;
    }

    private static GembridgeProperties.ModelConfig model(String name, int min, int max, boolean thoughts) {
        GembridgeProperties.ModelConfig model = new GembridgeProperties.ModelConfig();
        model.setName(name);
        model.setMinThinkingBudget(min);
        model.setMaxThinkingBudget(max);
        model.setThoughtsWithoutThinking(thoughts);
        return model;
    }

    private static GembridgeProperties.SafetySetting safety(String category) {
        GembridgeProperties.SafetySetting setting = new GembridgeProperties.SafetySetting();
        setting.setCategory(category);
        return setting;
    }
}
