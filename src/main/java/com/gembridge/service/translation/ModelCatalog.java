package com.gembridge.service.translation;

import com.gembridge.config.GembridgeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Capability table of the Gemini models exposed by the gateway.
 * <p>
 * Every configured base model is also reachable through suffixed variants:
 * {@code -search} adds the Google Search tool, {@code -nothinking} asks for the
 * smallest thinking budget and {@code -maxthinking} for the largest.
 */
@Slf4j
@Component
public class ModelCatalog {

    public static final String SEARCH_SUFFIX = "-search";
    public static final String NO_THINKING_SUFFIX = "-nothinking";
    public static final String MAX_THINKING_SUFFIX = "-maxthinking";

    // Lets the model choose its own budget
    static final int DYNAMIC_THINKING_BUDGET = -1;

    private static final List<String> SUFFIXES = List.of(SEARCH_SUFFIX, NO_THINKING_SUFFIX, MAX_THINKING_SUFFIX);

    private final Map<String, GembridgeProperties.ModelConfig> models = new LinkedHashMap<>();

    public ModelCatalog(GembridgeProperties properties) {
        for (GembridgeProperties.ModelConfig model : properties.getModels()) {
            models.put(model.getName(), model);
        }
        log.info("Model catalog: {}", models.keySet());
    }

    /**
     * Model name with every capability suffix stripped.
     */
    public String baseModelName(String model) {
        String base = model;
        boolean stripped;
        do {
            stripped = false;
            for (String suffix : SUFFIXES) {
                if (base.endsWith(suffix)) {
                    base = base.substring(0, base.length() - suffix.length());
                    stripped = true;
                }
            }
        } while (stripped);
        return base;
    }

    public boolean supports(String model) {
        return model != null && models.containsKey(baseModelName(model));
    }

    public boolean isSearchModel(String model) {
        return model.contains(SEARCH_SUFFIX);
    }

    /**
     * Thinking budget for a model, empty when the model cannot think.
     */
    public Optional<Integer> thinkingBudget(String model) {
        return thinkingModel(model).map(config -> {
            if (model.contains(NO_THINKING_SUFFIX)) {
                return config.getMinThinkingBudget();
            }
            if (model.contains(MAX_THINKING_SUFFIX)) {
                return config.getMaxThinkingBudget();
            }
            return DYNAMIC_THINKING_BUDGET;
        });
    }

    /**
     * Whether thought summaries are requested. Some models cannot turn them off even
     * at the minimal budget, so {@code -nothinking} defers to the model's configuration.
     */
    public boolean includeThoughts(String model) {
        if (model.contains(NO_THINKING_SUFFIX)) {
            return thinkingModel(model)
                    .map(GembridgeProperties.ModelConfig::isThoughtsWithoutThinking)
                    .orElse(false);
        }
        return true;
    }

    /**
     * Every base model followed by its variants, in configuration order.
     */
    public List<String> listModelIds() {
        List<String> ids = new ArrayList<>();
        for (GembridgeProperties.ModelConfig model : models.values()) {
            ids.add(model.getName());
            ids.add(model.getName() + SEARCH_SUFFIX);
            if (model.isThinking()) {
                ids.add(model.getName() + NO_THINKING_SUFFIX);
                ids.add(model.getName() + MAX_THINKING_SUFFIX);
            }
        }
        return ids;
    }

    private Optional<GembridgeProperties.ModelConfig> thinkingModel(String model) {
        return Optional.ofNullable(models.get(baseModelName(model)))
                .filter(GembridgeProperties.ModelConfig::isThinking);
    }
}
