package com.gembridge.model;

import lombok.Value;

import java.time.Instant;

/**
 * Rate-limit memory for one credential.
 */
@Value
public class CooldownState {

    Instant cooldownUntil;

    /**
     * 1 after the first rate-limit signal, capped by configuration.
     */
    int backoffLevel;

    public boolean isExpired(Instant now) {
        return !now.isBefore(cooldownUntil);
    }
}
