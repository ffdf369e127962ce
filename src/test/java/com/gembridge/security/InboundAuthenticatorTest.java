package com.gembridge.security;

import com.gembridge.config.GembridgeProperties;
import com.gembridge.exception.AuthenticationException;
import com.gembridge.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class InboundAuthenticatorTest {

    private static final String PASSWORD = "s3cret";

    private InboundAuthenticator authenticator;
    private HttpHeaders headers;
    private MultiValueMap<String, String> query;

    @BeforeEach
    void setUp() {
        GembridgeProperties properties = TestProperties.defaults();
        properties.getAuth().setPassword(PASSWORD);
        authenticator = new InboundAuthenticator(properties);
        headers = new HttpHeaders();
        query = new LinkedMultiValueMap<>();
    }

    @Test
    void testQueryKey() {
        query.add("key", PASSWORD);

        assertEquals("api_key_user", authenticator.authenticate(headers, query));
    }

    @Test
    void testGoogApiKeyHeader() {
        headers.set("x-goog-api-key", PASSWORD);

        assertEquals("goog_api_key_user", authenticator.authenticate(headers, query));
    }

    @Test
    void testBearerToken() {
        headers.setBearerAuth(PASSWORD);

        assertEquals("bearer_user", authenticator.authenticate(headers, query));
    }

    @Test
    void testBasicReturnsUsername() {
        headers.set(HttpHeaders.AUTHORIZATION, basic("alice:" + PASSWORD));

        assertEquals("alice", authenticator.authenticate(headers, query));
    }

    @Test
    void testFirstMatchingMethodWins() {
        query.add("key", PASSWORD);
        headers.setBearerAuth(PASSWORD);

        assertEquals("api_key_user", authenticator.authenticate(headers, query));
    }

    @Test
    void testWrongQueryKeyStillFallsThroughToHeader() {
        query.add("key", "wrong");
        headers.set("x-goog-api-key", PASSWORD);

        assertEquals("goog_api_key_user", authenticator.authenticate(headers, query));
    }

    @Test
    void testRejectsWrongOrMissingSecret() {
        assertThrows(AuthenticationException.class, () -> authenticator.authenticate(headers, query));

        headers.setBearerAuth("wrong");
        assertThrows(AuthenticationException.class, () -> authenticator.authenticate(headers, query));

        headers.set(HttpHeaders.AUTHORIZATION, basic("alice:wrong"));
        assertThrows(AuthenticationException.class, () -> authenticator.authenticate(headers, query));

        headers.set(HttpHeaders.AUTHORIZATION, "Basic not-base64!");
        assertThrows(AuthenticationException.class, () -> authenticator.authenticate(headers, query));
    }

    private static String basic(String credentials) {
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }
}
