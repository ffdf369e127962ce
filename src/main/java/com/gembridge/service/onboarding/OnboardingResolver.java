package com.gembridge.service.onboarding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gembridge.config.GembridgeProperties;
import com.gembridge.exception.ConfigurationException;
import com.gembridge.exception.GatewayException;
import com.gembridge.exception.OnboardingException;
import com.gembridge.exception.OnboardingTimeoutException;
import com.gembridge.exception.ProjectDiscoveryException;
import com.gembridge.exception.RefreshException;
import com.gembridge.model.CredentialRecord;
import com.gembridge.model.OnboardingState;
import com.gembridge.provider.CodeAssistClient;
import com.gembridge.service.credential.CredentialPoolManager;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves which cloud project a credential works against and runs the Code Assist
 * onboarding handshake for that project once per process.
 * <p>
 * Handshake state is kept per project id. Concurrent callers for the same project share
 * one in-flight handshake; a failed handshake leaves the project {@code NOT_STARTED}.
 */
@Slf4j
@Service
public class OnboardingResolver {

    static final String LEGACY_TIER_ID = "legacy-tier";

    // Cache key for handshakes run without a project id
    private static final String NO_PROJECT = "";

    private final CodeAssistClient codeAssistClient;
    private final CredentialPoolManager poolManager;
    private final ObjectMapper objectMapper;
    private final GembridgeProperties.OnboardingConfig config;
    private final String configuredProjectId;

    private final Cache<String, OnboardingState> states;
    private final Map<String, Mono<Void>> handshakesInFlight = new ConcurrentHashMap<>();

    public OnboardingResolver(CodeAssistClient codeAssistClient,
                              CredentialPoolManager poolManager,
                              ObjectMapper objectMapper,
                              GembridgeProperties properties) {
        this.codeAssistClient = codeAssistClient;
        this.poolManager = poolManager;
        this.objectMapper = objectMapper;
        this.config = properties.getOnboarding();
        this.configuredProjectId = properties.getProjectId();
        this.states = Caffeine.newBuilder()
                .maximumSize(config.getStateCacheSize())
                .build();
    }

    /**
     * Project for a credential: the one stored with it, else the configured override,
     * else whatever Code Assist reports for the account.
     *
     * @throws ProjectDiscoveryException (as error signal) when discovery finds nothing
     */
    public Mono<String> resolveProjectId(CredentialRecord credential) {
        if (credential.hasProjectId()) {
            return Mono.just(credential.getProjectId());
        }
        if (configuredProjectId != null && !configuredProjectId.isBlank()) {
            return Mono.just(configuredProjectId);
        }
        return discoverProjectId(credential);
    }

    /**
     * Make sure the project is onboarded onto a tier. Completes immediately for a project
     * already onboarded in this process.
     */
    public Mono<Void> ensureOnboarded(CredentialRecord credential, String projectId) {
        String key = stateKey(projectId);
        if (getState(projectId) == OnboardingState.COMPLETE) {
            return Mono.empty();
        }
        return handshakesInFlight.computeIfAbsent(key, k -> handshake(credential, projectId)
                .doFinally(signal -> handshakesInFlight.remove(k))
                .cache());
    }

    public OnboardingState getState(String projectId) {
        OnboardingState state = states.getIfPresent(stateKey(projectId));
        return state != null ? state : OnboardingState.NOT_STARTED;
    }

    private Mono<String> discoverProjectId(CredentialRecord credential) {
        String identity = credential.getIdentity();
        return poolManager.refreshIfExpired(credential)
                .onErrorResume(RefreshException.class, e -> {
                    log.warn("Refresh before project discovery failed, trying current token: {}", e.getMessage());
                    return Mono.just(credential);
                })
                .flatMap(current -> {
                    if (!current.hasAccessToken()) {
                        return Mono.error(new ProjectDiscoveryException(
                                "Credential " + identity + " has no access token for project discovery"));
                    }
                    return codeAssistClient.loadCodeAssist(current.getAccessToken(), null);
                })
                .onErrorMap(e -> !(e instanceof GatewayException),
                        e -> new ProjectDiscoveryException("Project discovery failed: " + describe(e), e))
                .flatMap(reply -> projectFrom(reply)
                        .map(Mono::just)
                        .orElseGet(() -> Mono.error(new ProjectDiscoveryException(
                                "Code Assist reported no project for credential " + identity
                                        + "; set GOOGLE_CLOUD_PROJECT"))))
                .doOnNext(projectId -> log.info("Discovered project {} for credential {}", projectId, identity));
    }

    private Mono<Void> handshake(CredentialRecord credential, String projectId) {
        String key = stateKey(projectId);
        return poolManager.refreshIfExpired(credential)
                .flatMap(current -> codeAssistClient.loadCodeAssist(current.getAccessToken(), projectId)
                        .flatMap(reply -> onTierReply(current, projectId, reply)))
                .doOnSuccess(ignored -> {
                    states.put(key, OnboardingState.COMPLETE);
                    log.info("Project {} onboarded", projectId);
                })
                .doOnError(e -> {
                    states.invalidate(key);
                    log.warn("Onboarding of project {} failed: {}", projectId, e.getMessage());
                })
                .onErrorMap(this::toOnboardingError);
    }

    private Mono<Void> onTierReply(CredentialRecord credential, String projectId, JsonNode reply) {
        String key = stateKey(projectId);
        JsonNode currentTier = reply.get("currentTier");
        boolean alreadyOnboarded = currentTier != null && !currentTier.isNull();
        JsonNode tier = selectTier(reply);
        states.put(key, OnboardingState.TIER_RESOLVED);

        if (tier.path("userDefinedCloudaicompanionProject").asBoolean(false)
                && (projectId == null || projectId.isBlank())) {
            return Mono.error(new ConfigurationException(
                    "This account requires a cloud project; set GOOGLE_CLOUD_PROJECT"));
        }
        if (alreadyOnboarded) {
            log.debug("Project {} already on tier {}", projectId, tier.path("id").asText());
            return Mono.empty();
        }

        String tierId = tier.path("id").asText(LEGACY_TIER_ID);
        states.put(key, OnboardingState.ONBOARDING_IN_PROGRESS);
        log.info("Onboarding project {} onto tier {}", projectId, tierId);
        return pollOnboarding(credential.getAccessToken(), tierId, projectId);
    }

    private Mono<Void> pollOnboarding(String accessToken, String tierId, String projectId) {
        int maxAttempts = Math.max(1, config.getMaxPollAttempts());
        return Mono.defer(() -> codeAssistClient.onboardUser(accessToken, tierId, projectId))
                .flatMap(reply -> reply.path("done").asBoolean(false)
                        ? Mono.just(reply)
                        : Mono.<JsonNode>error(new OnboardingPending()))
                .retryWhen(Retry.fixedDelay(maxAttempts - 1, config.getPollInterval())
                        .filter(OnboardingPending.class::isInstance)
                        .doBeforeRetry(signal -> log.debug("Onboarding of project {} pending, poll {}",
                                projectId, signal.totalRetries() + 2))
                        .onRetryExhaustedThrow((spec, signal) ->
                                new OnboardingTimeoutException(projectId, maxAttempts)))
                .then();
    }

    /**
     * Current tier, else the default allowed tier, else a synthesized legacy tier.
     */
    JsonNode selectTier(JsonNode reply) {
        JsonNode currentTier = reply.get("currentTier");
        if (currentTier != null && currentTier.isObject()) {
            return currentTier;
        }
        for (JsonNode allowed : reply.path("allowedTiers")) {
            if (allowed.path("isDefault").asBoolean(false)) {
                return allowed;
            }
        }
        ObjectNode legacy = objectMapper.createObjectNode();
        legacy.put("name", "");
        legacy.put("description", "");
        legacy.put("id", LEGACY_TIER_ID);
        legacy.put("userDefinedCloudaicompanionProject", true);
        return legacy;
    }

    /**
     * {@code cloudaicompanionProject} is either the id itself or an object carrying {@code id}.
     */
    static Optional<String> projectFrom(JsonNode reply) {
        JsonNode project = reply.path("cloudaicompanionProject");
        String id = project.isObject() ? project.path("id").asText("") : project.asText("");
        return id.isBlank() ? Optional.empty() : Optional.of(id);
    }

    private Throwable toOnboardingError(Throwable error) {
        if (error instanceof RefreshException
                || error instanceof ConfigurationException
                || error instanceof OnboardingException) {
            return error;
        }
        if (error instanceof WebClientResponseException) {
            WebClientResponseException responseError = (WebClientResponseException) error;
            return new OnboardingException(
                    "Onboarding failed, check the project's permissions: " + responseError.getStatusCode().value(),
                    responseError.getStatusCode().value(),
                    responseError.getResponseBodyAsString(),
                    responseError);
        }
        return new OnboardingException("Onboarding failed unexpectedly: " + describe(error), error);
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static String stateKey(String projectId) {
        return projectId == null ? NO_PROJECT : projectId;
    }

    /**
     * Marker for an onboardUser reply that is not yet done.
     */
    private static final class OnboardingPending extends RuntimeException {
        OnboardingPending() {
            super("onboarding pending", null, false, false);
        }
    }
}
