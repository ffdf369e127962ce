package com.gembridge.service.credential;

import com.fasterxml.jackson.databind.JsonNode;
import com.gembridge.config.GembridgeProperties;
import com.gembridge.exception.RefreshException;
import com.gembridge.model.CredentialRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * OAuth 2.0 refresh-token grant against Google's token endpoint.
 * Only exchanges tokens; persisting the result is the pool's job.
 */
@Slf4j
@Component
public class TokenRefresher {

    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final WebClient webClient;
    private final GembridgeProperties.CredentialsConfig config;
    private final Clock clock;

    public TokenRefresher(WebClient webClient, GembridgeProperties properties, Clock clock) {
        this.webClient = webClient;
        this.config = properties.getCredentials();
        this.clock = clock;
    }

    /**
     * Exchange the record's refresh token for a new access token.
     *
     * @return a copy of the record with the new token, expiry and, when Google
     * rotates it, refresh token; fails with {@link RefreshException}
     */
    public Mono<CredentialRecord> refresh(CredentialRecord record) {
        String identity = record.getIdentity();
        if (!record.hasRefreshToken()) {
            return Mono.error(new RefreshException(identity, "no refresh token"));
        }

        String tokenUri = firstNonBlank(record.getTokenUri(), config.getTokenUri());
        String clientId = firstNonBlank(record.getClientId(), config.getClientId());
        String clientSecret = firstNonBlank(record.getClientSecret(), config.getClientSecret());
        if (clientId == null) {
            return Mono.error(new RefreshException(identity, "no OAuth client id configured"));
        }

        log.info("Refreshing access token for credential {} ({})", identity, record.fingerprint());

        BodyInserters.FormInserter<String> form = BodyInserters
                .fromFormData("grant_type", "refresh_token")
                .with("refresh_token", record.getRefreshToken())
                .with("client_id", clientId);
        if (clientSecret != null) {
            form = form.with("client_secret", clientSecret);
        }

        return webClient.post()
                .uri(tokenUri)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(form)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new RefreshException(identity,
                                "token endpoint returned " + response.statusCode().value() + ": " + body)))
                .bodyToMono(JsonNode.class)
                .map(json -> applyTokenResponse(record, json))
                .doOnSuccess(refreshed -> log.info("Access token refreshed for credential {}", identity))
                .onErrorMap(error -> !(error instanceof RefreshException),
                        error -> new RefreshException(identity, error.getMessage(), error));
    }

    private CredentialRecord applyTokenResponse(CredentialRecord record, JsonNode json) {
        String accessToken = json.path("access_token").asText("");
        if (accessToken.isBlank()) {
            throw new RefreshException(record.getIdentity(), "token response carried no access_token");
        }

        long expiresIn = json.path("expires_in").asLong(DEFAULT_EXPIRES_IN_SECONDS);
        CredentialRecord.CredentialRecordBuilder builder = record.toBuilder()
                .accessToken(accessToken)
                .expiry(clock.instant().plusSeconds(expiresIn));

        // Google usually omits refresh_token on refresh; keep the current one then
        String refreshToken = json.path("refresh_token").asText("");
        if (!refreshToken.isBlank()) {
            builder.refreshToken(refreshToken);
        }

        String scope = json.path("scope").asText("");
        if (!scope.isBlank()) {
            Set<String> scopes = new LinkedHashSet<>(Arrays.asList(scope.trim().split("\\s+")));
            builder.scopes(scopes);
        }
        return builder.build();
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred;
        }
        return fallback != null && !fallback.isBlank() ? fallback : null;
    }
}
