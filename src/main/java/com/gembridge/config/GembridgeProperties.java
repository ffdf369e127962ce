package com.gembridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for Gembridge.
 */
@Data
@Component
@ConfigurationProperties(prefix = "gembridge")
public class GembridgeProperties {

    private AuthConfig auth = new AuthConfig();
    private CredentialsConfig credentials = new CredentialsConfig();
    private CooldownConfig cooldown = new CooldownConfig();
    private OnboardingConfig onboarding = new OnboardingConfig();
    private UpstreamConfig upstream = new UpstreamConfig();
    private CorsConfig cors = new CorsConfig();

    /**
     * Project id used when a credential does not embed one.
     */
    private String projectId;

    private List<ModelConfig> models = new ArrayList<>();
    private List<SafetySetting> safetySettings = new ArrayList<>();

    @Data
    public static class AuthConfig {
        public static final String DEFAULT_PASSWORD = "123456";

        private String password = DEFAULT_PASSWORD;
    }

    @Data
    public static class CredentialsConfig {
        private String dir = "./auth";
        // Full credential JSON supplied out-of-band
        private String json;
        private String tokenUri = "https://oauth2.googleapis.com/token";
        private String clientId;
        private String clientSecret;
        private Duration refreshSkew = Duration.ofMinutes(5);
    }

    @Data
    public static class CooldownConfig {
        private Duration base = Duration.ofSeconds(60);
        private Duration max = Duration.ofSeconds(1800);
        private int maxLevel = 5;
    }

    @Data
    public static class OnboardingConfig {
        private Duration pollInterval = Duration.ofSeconds(5);
        private int maxPollAttempts = 60;
        private int stateCacheSize = 1000;
    }

    @Data
    public static class UpstreamConfig {
        private String endpoint = "https://cloudcode-pa.googleapis.com";
        private String apiVersion = "v1internal";
        private String cliVersion = "0.1.5";
        private Duration timeout = Duration.ofSeconds(300);
    }

    @Data
    public static class CorsConfig {
        private List<String> allowedOrigins = List.of("*");
        private long maxAgeSeconds = 3600;
    }

    @Data
    public static class ModelConfig {
        private String name;
        private boolean thinking = true;
        private int minThinkingBudget = 128;
        private int maxThinkingBudget = 32768;
        // Whether thoughts are still requested for the -nothinking variant
        private boolean thoughtsWithoutThinking;
    }

    @Data
    public static class SafetySetting {
        private String category;
        private String threshold = "BLOCK_NONE";
    }
}
