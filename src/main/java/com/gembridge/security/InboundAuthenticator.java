package com.gembridge.security;

import com.gembridge.config.GembridgeProperties;
import com.gembridge.exception.AuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * Checks the shared gateway password. Clients may present it as the {@code key} query
 * parameter, an {@code x-goog-api-key} header, a bearer token, or the password of HTTP Basic
 * credentials.
 */
@Slf4j
@Component
public class InboundAuthenticator {

    static final String API_KEY_PARAM = "key";
    static final String GOOG_API_KEY_HEADER = "x-goog-api-key";

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String BASIC_PREFIX = "Basic ";

    private final byte[] password;

    public InboundAuthenticator(GembridgeProperties properties) {
        this.password = properties.getAuth().getPassword().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @return name of the authenticated principal
     * @throws AuthenticationException when no presented secret matches
     */
    public String authenticate(HttpHeaders headers, MultiValueMap<String, String> queryParams) {
        if (matches(queryParams.getFirst(API_KEY_PARAM))) {
            return "api_key_user";
        }
        if (matches(headers.getFirst(GOOG_API_KEY_HEADER))) {
            return "goog_api_key_user";
        }

        String authorization = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null) {
            if (authorization.startsWith(BEARER_PREFIX)
                    && matches(authorization.substring(BEARER_PREFIX.length()))) {
                return "bearer_user";
            }
            if (authorization.startsWith(BASIC_PREFIX)) {
                String username = basicUsername(authorization.substring(BASIC_PREFIX.length()));
                if (username != null) {
                    return username;
                }
            }
        }

        throw new AuthenticationException("Invalid authentication credentials. Use HTTP Basic Auth, "
                + "Bearer token, 'key' query parameter, or 'x-goog-api-key' header.");
    }

    /**
     * @return the username when the Basic credentials carry the right password, else null
     */
    private String basicUsername(String encoded) {
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(encoded.trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("Rejecting malformed Basic credentials: {}", e.getMessage());
            return null;
        }
        int separator = decoded.indexOf(':');
        if (separator < 0) {
            return null;
        }
        return matches(decoded.substring(separator + 1)) ? decoded.substring(0, separator) : null;
    }

    private boolean matches(String candidate) {
        return candidate != null
                && !candidate.isEmpty()
                && MessageDigest.isEqual(password, candidate.getBytes(StandardCharsets.UTF_8));
    }
}
