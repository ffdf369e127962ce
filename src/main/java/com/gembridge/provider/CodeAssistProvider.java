package com.gembridge.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gembridge.exception.CredentialLoadException;
import com.gembridge.exception.NoUsableCredentialException;
import com.gembridge.exception.OnboardingException;
import com.gembridge.exception.RateLimitException;
import com.gembridge.exception.RefreshException;
import com.gembridge.model.ChatCompletionChunk;
import com.gembridge.model.ChatCompletionRequest;
import com.gembridge.model.ChatCompletionResponse;
import com.gembridge.model.CooldownState;
import com.gembridge.model.CredentialRecord;
import com.gembridge.service.credential.CredentialPoolManager;
import com.gembridge.service.onboarding.OnboardingResolver;
import com.gembridge.service.translation.GeminiRequestTranslator;
import com.gembridge.service.translation.GeminiResponseTranslator;
import com.gembridge.service.translation.ModelCatalog;
import lombok.extern.slf4j.Slf4j;
import org.reactivestreams.Publisher;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Gemini through Code Assist, rotating over the credential pool.
 * <p>
 * Each attempt loads one credential, refreshes it, resolves and onboards its project and
 * calls upstream. A rate-limited credential is put in cooldown and the next one is tried;
 * credentials that cannot be loaded, refreshed or onboarded are skipped without a cooldown.
 * Any other failure ends the request. A stream only rotates while it has not emitted anything yet.
 */
@Slf4j
@Component
public class CodeAssistProvider implements ChatProvider {

    private final CredentialPoolManager poolManager;
    private final OnboardingResolver onboardingResolver;
    private final CodeAssistClient codeAssistClient;
    private final ModelCatalog modelCatalog;
    private final GeminiRequestTranslator requestTranslator;
    private final GeminiResponseTranslator responseTranslator;

    public CodeAssistProvider(CredentialPoolManager poolManager,
                              OnboardingResolver onboardingResolver,
                              CodeAssistClient codeAssistClient,
                              ModelCatalog modelCatalog,
                              GeminiRequestTranslator requestTranslator,
                              GeminiResponseTranslator responseTranslator) {
        this.poolManager = poolManager;
        this.onboardingResolver = onboardingResolver;
        this.codeAssistClient = codeAssistClient;
        this.modelCatalog = modelCatalog;
        this.requestTranslator = requestTranslator;
        this.responseTranslator = responseTranslator;
    }

    @Override
    public String getName() {
        return "code-assist";
    }

    @Override
    public boolean supports(String model) {
        return modelCatalog.supports(model);
    }

    @Override
    public Mono<ChatCompletionResponse> complete(ChatCompletionRequest request) {
        ObjectNode body = requestTranslator.toGeminiRequest(request);
        String upstreamModel = modelCatalog.baseModelName(request.getModel());

        return withRotation(attempt -> codeAssistClient.generateContent(
                        attempt.accessToken(), attempt.projectId(), upstreamModel, body))
                .next()
                .map(response -> responseTranslator.toChatCompletion(response, request.getModel()));
    }

    @Override
    public Flux<ChatCompletionChunk> stream(ChatCompletionRequest request) {
        ObjectNode body = requestTranslator.toGeminiRequest(request);
        String upstreamModel = modelCatalog.baseModelName(request.getModel());
        String responseId = responseTranslator.newResponseId();

        return withRotation(attempt -> codeAssistClient.streamGenerateContent(
                        attempt.accessToken(), attempt.projectId(), upstreamModel, body))
                .map(chunk -> responseTranslator.toChunk(chunk, request.getModel(), responseId));
    }

    private Flux<JsonNode> withRotation(Function<Attempt, Publisher<JsonNode>> call) {
        return poolManager.listCredentials()
                .flatMapMany(identities -> {
                    List<String> candidates = identities.stream()
                            .filter(identity -> !poolManager.isInCooldown(identity))
                            .toList();
                    if (candidates.isEmpty()) {
                        return Flux.error(new NoUsableCredentialException(identities.isEmpty()
                                ? "No credentials configured"
                                : "All " + identities.size() + " credentials are cooling down"));
                    }
                    return attempt(candidates, 0, null, call);
                });
    }

    private Flux<JsonNode> attempt(List<String> candidates,
                                   int index,
                                   RateLimitException lastRateLimit,
                                   Function<Attempt, Publisher<JsonNode>> call) {
        if (index >= candidates.size()) {
            if (lastRateLimit != null) {
                return Flux.error(lastRateLimit);
            }
            return Flux.error(new NoUsableCredentialException(
                    "None of " + candidates.size() + " credentials could be used"));
        }

        String identity = candidates.get(index);
        return Flux.defer(() -> {
            AtomicBoolean emitted = new AtomicBoolean();
            return prepare(identity)
                    .flatMapMany(call)
                    .doOnNext(item -> {
                        if (emitted.compareAndSet(false, true)) {
                            poolManager.resetCooldown(identity);
                        }
                    })
                    .doOnComplete(() -> {
                        if (!emitted.get()) {
                            poolManager.resetCooldown(identity);
                        }
                    })
                    .onErrorResume(error -> !emitted.get() && isRotatable(error), error -> {
                        RateLimitException rateLimit = lastRateLimit;
                        if (error instanceof RateLimitException) {
                            CooldownState state = poolManager.setCooldown(identity);
                            log.warn("Credential {} rate limited (backoff level {}), rotating",
                                    identity, state.getBackoffLevel());
                            rateLimit = (RateLimitException) error;
                        } else {
                            log.warn("Skipping credential {}: {}", identity, error.getMessage());
                        }
                        return attempt(candidates, index + 1, rateLimit, call);
                    });
        });
    }

    private Mono<Attempt> prepare(String identity) {
        return poolManager.load(identity)
                .flatMap(poolManager::refreshIfExpired)
                .flatMap(credential -> {
                    if (!credential.hasAccessToken()) {
                        return Mono.error(new CredentialLoadException(identity, "no access token"));
                    }
                    return onboardingResolver.resolveProjectId(credential)
                            .flatMap(projectId -> onboardingResolver.ensureOnboarded(credential, projectId)
                                    .thenReturn(new Attempt(credential, projectId)));
                })
                .doOnNext(attempt -> log.debug("Using credential {} for project {}",
                        identity, attempt.projectId()));
    }

    private static boolean isRotatable(Throwable error) {
        return error instanceof RateLimitException
                || error instanceof CredentialLoadException
                || error instanceof RefreshException
                || error instanceof OnboardingException;
    }

    private record Attempt(CredentialRecord credential, String projectId) {

        String accessToken() {
            return credential.getAccessToken();
        }
    }
}
