package com.gembridge.model;

import lombok.Builder;
import lombok.Value;
import org.apache.commons.codec.digest.DigestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * One OAuth identity bound to at most one cloud project.
 * Immutable; a successful refresh produces a new record that replaces this one in the store.
 */
@Value
@Builder(toBuilder = true)
public class CredentialRecord {

    /**
     * Storage handle, usually the credential file path.
     */
    String identity;

    /**
     * May be null until resolved by discovery or configuration.
     */
    String projectId;

    String accessToken;
    String refreshToken;

    @Builder.Default
    Set<String> scopes = Set.of();

    /**
     * Absolute UTC expiry. {@link Instant#EPOCH} when missing or malformed.
     */
    @Builder.Default
    Instant expiry = Instant.EPOCH;

    String clientId;
    String clientSecret;
    String tokenUri;

    public boolean hasAccessToken() {
        return accessToken != null && !accessToken.isBlank();
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    public boolean hasProjectId() {
        return projectId != null && !projectId.isBlank();
    }

    /**
     * A record without an access token is always expired. {@code skew} pulls the
     * expiry forward so tokens are replaced shortly before Google rejects them.
     */
    public boolean isExpired(Clock clock, Duration skew) {
        if (!hasAccessToken() || expiry == null) {
            return true;
        }
        return !clock.instant().isBefore(expiry.minus(skew));
    }

    /**
     * Short, log-safe fingerprint of the refresh token.
     */
    public String fingerprint() {
        String source = hasRefreshToken() ? refreshToken : identity;
        return DigestUtils.sha256Hex(source == null ? "" : source).substring(0, 12);
    }

    @Override
    public String toString() {
        return "CredentialRecord[" + identity + ", project=" + projectId + ", fp=" + fingerprint() + "]";
    }
}
