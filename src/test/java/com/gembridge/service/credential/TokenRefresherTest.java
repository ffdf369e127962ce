package com.gembridge.service.credential;

import com.gembridge.exception.RefreshException;
import com.gembridge.model.CredentialRecord;
import com.gembridge.support.MutableClock;
import com.gembridge.support.StubExchange;
import com.gembridge.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Refresh-token grant against a stubbed token endpoint.
 */
class TokenRefresherTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private StubExchange upstream;
    private TokenRefresher refresher;

    @BeforeEach
    void setUp() {
        upstream = new StubExchange();
        refresher = new TokenRefresher(upstream.webClient(), TestProperties.defaults(), new MutableClock(NOW));
    }

    @Test
    void testPostsRefreshGrantAsForm() {
        upstream.json(HttpStatus.OK, "{\"access_token\":\"fresh\",\"expires_in\":1800}");

        CredentialRecord refreshed = refresher.refresh(record(null)).block();

        StubExchange.Recorded request = upstream.lastRequest();
        assertEquals("https://oauth2.googleapis.com/token", request.url());
        assertTrue(request.header(HttpHeaders.CONTENT_TYPE).startsWith("application/x-www-form-urlencoded"));
        assertTrue(request.body().contains("grant_type=refresh_token"));
        assertTrue(request.body().contains("refresh_token=old-refresh"));
        assertTrue(request.body().contains("client_id=test-client-id"));
        assertTrue(request.body().contains("client_secret=test-client-secret"));

        assertEquals("fresh", refreshed.getAccessToken());
        assertEquals(NOW.plusSeconds(1800), refreshed.getExpiry());
        assertEquals("old-refresh", refreshed.getRefreshToken());
        assertEquals("proj-a", refreshed.getProjectId());
    }

    @Test
    void testRecordClientIdWinsOverConfiguration() {
        upstream.json(HttpStatus.OK, "{\"access_token\":\"fresh\"}");

        refresher.refresh(record("own-client")).block();

        assertTrue(upstream.lastRequest().body().contains("client_id=own-client"));
    }

    @Test
    void testAppliesRotatedRefreshTokenScopeAndDefaultLifetime() {
        upstream.json(HttpStatus.OK,
                "{\"access_token\":\"fresh\",\"refresh_token\":\"rotated\",\"scope\":\"a b\"}");

        CredentialRecord refreshed = refresher.refresh(record(null)).block();

        assertEquals("rotated", refreshed.getRefreshToken());
        assertEquals(Set.of("a", "b"), refreshed.getScopes());
        assertEquals(NOW.plusSeconds(3600), refreshed.getExpiry());
    }

    @Test
    void testErrorStatusBecomesRefreshException() {
        upstream.json(HttpStatus.BAD_REQUEST, "{\"error\":\"invalid_grant\"}");

        StepVerifier.create(refresher.refresh(record(null)))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(RefreshException.class, error);
                    assertTrue(error.getMessage().contains("invalid_grant"));
                    assertEquals("/auth/proj-a.json", ((RefreshException) error).getIdentity());
                })
                .verify();
    }

    @Test
    void testResponseWithoutAccessTokenFails() {
        upstream.json(HttpStatus.OK, "{\"expires_in\":3600}");

        StepVerifier.create(refresher.refresh(record(null)))
                .expectError(RefreshException.class)
                .verify();
    }

    @Test
    void testMissingRefreshTokenFailsWithoutCallingEndpoint() {
        CredentialRecord record = record(null).toBuilder().refreshToken(null).build();

        StepVerifier.create(refresher.refresh(record))
                .expectError(RefreshException.class)
                .verify();
        assertTrue(upstream.requests().isEmpty());
    }

    private static CredentialRecord record(String clientId) {
        return CredentialRecord.builder()
                .identity("/auth/proj-a.json")
                .projectId("proj-a")
                .accessToken("stale")
                .refreshToken("old-refresh")
                .clientId(clientId)
                .build();
    }
}
