package com.gembridge.config;

import com.gembridge.exception.CredentialLoadException;
import com.gembridge.model.CredentialRecord;
import com.gembridge.service.credential.CredentialPoolManager;
import com.gembridge.service.onboarding.OnboardingResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Reports the credential pool at startup and onboards the first usable project in the
 * background. Nothing here stops the server from starting.
 */
@Slf4j
@Component
public class StartupInitializer implements ApplicationRunner {

    private final GembridgeProperties properties;
    private final CredentialPoolManager poolManager;
    private final OnboardingResolver onboardingResolver;

    public StartupInitializer(GembridgeProperties properties,
                              CredentialPoolManager poolManager,
                              OnboardingResolver onboardingResolver) {
        this.properties = properties;
        this.poolManager = poolManager;
        this.onboardingResolver = onboardingResolver;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (GembridgeProperties.AuthConfig.DEFAULT_PASSWORD.equals(properties.getAuth().getPassword())) {
            log.warn("Using the default gateway password; set GEMINI_AUTH_PASSWORD");
        }

        poolManager.listCredentials()
                .flatMapMany(Flux::fromIterable)
                .concatMap(identity -> poolManager.load(identity)
                        .onErrorResume(CredentialLoadException.class, e -> {
                            log.warn("Ignoring credential at startup: {}", e.getMessage());
                            return Mono.empty();
                        }))
                .filter(CredentialRecord::hasAccessToken)
                .collectList()
                .flatMap(this::onboardFirst)
                .subscribe(
                        projectId -> log.info("Onboarded project {} at startup", projectId),
                        error -> log.error("Startup onboarding failed, requests will retry it: {}",
                                error.getMessage()));
    }

    private Mono<String> onboardFirst(List<CredentialRecord> records) {
        if (records.isEmpty()) {
            log.warn("No usable credentials in {}", properties.getCredentials().getDir());
            return Mono.empty();
        }

        List<String> projects = records.stream()
                .filter(CredentialRecord::hasProjectId)
                .map(CredentialRecord::getProjectId)
                .toList();
        log.info("Loaded {} credential(s), projects: {}", records.size(), projects);

        CredentialRecord first = records.stream()
                .filter(CredentialRecord::hasProjectId)
                .findFirst()
                .orElse(records.get(0));
        return poolManager.refreshIfExpired(first)
                .flatMap(credential -> onboardingResolver.resolveProjectId(credential)
                        .flatMap(projectId -> onboardingResolver.ensureOnboarded(credential, projectId)
                                .thenReturn(projectId)));
    }
}
