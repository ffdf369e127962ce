package com.gembridge.service.credential;

import com.gembridge.config.GembridgeProperties;
import com.gembridge.exception.CredentialLoadException;
import com.gembridge.exception.NoUsableCredentialException;
import com.gembridge.model.CooldownState;
import com.gembridge.model.CredentialRecord;
import com.gembridge.repository.CredentialFileRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the credential pool: loading and normalizing stored records, refreshing
 * expired tokens, and the cooldown bookkeeping used by request dispatch.
 * Never loops over attempts itself; rotation is the caller's decision.
 */
@Slf4j
@Service
public class CredentialPoolManager {

    private final CredentialFileRepository repository;
    private final CredentialNormalizer normalizer;
    private final TokenRefresher tokenRefresher;
    private final CooldownTracker cooldownTracker;
    private final Clock clock;
    private final Duration refreshSkew;

    private final Map<String, Mono<CredentialRecord>> refreshesInFlight = new ConcurrentHashMap<>();

    public CredentialPoolManager(CredentialFileRepository repository,
                                 CredentialNormalizer normalizer,
                                 TokenRefresher tokenRefresher,
                                 CooldownTracker cooldownTracker,
                                 GembridgeProperties properties,
                                 Clock clock) {
        this.repository = repository;
        this.normalizer = normalizer;
        this.tokenRefresher = tokenRefresher;
        this.cooldownTracker = cooldownTracker;
        this.clock = clock;
        this.refreshSkew = properties.getCredentials().getRefreshSkew();
    }

    /**
     * Ordered identities of every stored credential.
     */
    public Mono<List<String>> listCredentials() {
        return Mono.fromCallable(repository::listIdentities)
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Read and normalize one identity.
     *
     * @return the record, or {@link CredentialLoadException} when the content is unreadable
     */
    public Mono<CredentialRecord> load(String identity) {
        return Mono.fromCallable(() -> normalizer.normalize(identity, readRaw(identity)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Record whose stored project id matches. Unreadable credentials are skipped.
     */
    public Mono<CredentialRecord> findForProject(String projectId) {
        return listCredentials()
                .flatMapMany(Flux::fromIterable)
                .concatMap(this::loadQuietly)
                .filter(record -> projectId.equals(record.getProjectId()))
                .next();
    }

    /**
     * First credential not in cooldown that parses and carries an access token.
     * Cooling-down identities are not read at all.
     */
    public Mono<CredentialRecord> loadAny() {
        return listCredentials()
                .flatMapMany(Flux::fromIterable)
                .filter(identity -> {
                    if (cooldownTracker.isInCooldown(identity)) {
                        log.debug("Skipping credential {} in cooldown", identity);
                        return false;
                    }
                    return true;
                })
                .concatMap(this::loadQuietly)
                .filter(CredentialRecord::hasAccessToken)
                .next();
    }

    /**
     * Credential for a project when one is stored, otherwise any usable credential.
     */
    public Mono<CredentialRecord> resolve(String projectId) {
        Mono<CredentialRecord> byProject = projectId == null || projectId.isBlank()
                ? Mono.empty()
                : findForProject(projectId);
        return byProject
                .switchIfEmpty(Mono.defer(this::loadAny))
                .switchIfEmpty(Mono.error(() -> new NoUsableCredentialException(
                        "No usable credential found in " + repository.getDirectory())));
    }

    /**
     * Refresh the record when its token is expired, persisting the result.
     * Concurrent callers for the same identity share one token exchange.
     *
     * @return the given record when still valid or not refreshable, else the refreshed one
     */
    public Mono<CredentialRecord> refreshIfExpired(CredentialRecord record) {
        if (!record.isExpired(clock, refreshSkew) || !record.hasRefreshToken()) {
            return Mono.just(record);
        }
        String identity = record.getIdentity();
        return refreshesInFlight.computeIfAbsent(identity, key -> tokenRefresher.refresh(record)
                .flatMap(this::persist)
                .doFinally(signal -> refreshesInFlight.remove(key))
                .cache());
    }

    public CooldownState setCooldown(String identity) {
        return cooldownTracker.setCooldown(identity);
    }

    public boolean isInCooldown(String identity) {
        return cooldownTracker.isInCooldown(identity);
    }

    public Duration remainingCooldown(String identity) {
        return cooldownTracker.remainingCooldown(identity);
    }

    public void resetCooldown(String identity) {
        cooldownTracker.resetCooldown(identity);
    }

    // A failed write keeps the refreshed token in use; the next load refreshes again
    private Mono<CredentialRecord> persist(CredentialRecord refreshed) {
        return Mono.fromCallable(() -> {
                    String identity = refreshed.getIdentity();
                    try {
                        String previous = repository.read(identity);
                        repository.write(identity, normalizer.serialize(refreshed, previous));
                        log.info("Persisted refreshed credential {} ({})", identity, refreshed.fingerprint());
                    } catch (IOException e) {
                        log.error("Failed to persist refreshed credential {}", identity, e);
                    }
                    return refreshed;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<CredentialRecord> loadQuietly(String identity) {
        return load(identity)
                .onErrorResume(CredentialLoadException.class, e -> {
                    log.warn("Skipping credential: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    private String readRaw(String identity) {
        try {
            return repository.read(identity);
        } catch (IOException e) {
            throw new CredentialLoadException(identity, "unreadable: " + e.getMessage(), e);
        }
    }
}
