package com.gembridge.service.credential;

import com.gembridge.config.GembridgeProperties;
import com.gembridge.model.CooldownState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide rate-limit backoff per credential identity.
 * Every read-modify-write goes through {@link ConcurrentHashMap#compute} so concurrent
 * signals for the same credential never lose a backoff increment.
 */
@Slf4j
@Component
public class CooldownTracker {

    private final Map<String, CooldownState> cooldowns = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration baseCooldown;
    private final Duration maxCooldown;
    private final int maxLevel;

    public CooldownTracker(GembridgeProperties properties, Clock clock) {
        this.clock = clock;
        this.baseCooldown = properties.getCooldown().getBase();
        this.maxCooldown = properties.getCooldown().getMax();
        this.maxLevel = properties.getCooldown().getMaxLevel();
    }

    /**
     * Record a rate-limit signal. The level starts at 1 and grows by one per signal
     * while the previous cooldown is still running, up to the configured cap.
     *
     * @return the new state
     */
    public CooldownState setCooldown(String identity) {
        Instant now = clock.instant();
        CooldownState state = cooldowns.compute(identity, (key, previous) -> {
            int level = previous == null || previous.isExpired(now)
                    ? 1
                    : Math.min(previous.getBackoffLevel() + 1, maxLevel);
            return new CooldownState(now.plus(cooldownFor(level)), level);
        });
        log.warn("Credential {} rate limited, cooling down for {}s (backoff level {})",
                identity, Duration.between(now, state.getCooldownUntil()).toSeconds(), state.getBackoffLevel());
        return state;
    }

    public boolean isInCooldown(String identity) {
        return currentState(identity).isPresent();
    }

    /**
     * @return time left, {@link Duration#ZERO} when not cooling down
     */
    public Duration remainingCooldown(String identity) {
        return currentState(identity)
                .map(state -> Duration.between(clock.instant(), state.getCooldownUntil()))
                .filter(remaining -> !remaining.isNegative())
                .orElse(Duration.ZERO);
    }

    /**
     * Clear cooldown and backoff after a confirmed successful use.
     */
    public void resetCooldown(String identity) {
        if (cooldowns.remove(identity) != null) {
            log.info("Credential {} used successfully, cooldown cleared", identity);
        }
    }

    /**
     * Live state of a credential; an expired entry is evicted and reported as absent.
     */
    public Optional<CooldownState> currentState(String identity) {
        Instant now = clock.instant();
        return Optional.ofNullable(cooldowns.computeIfPresent(identity,
                (key, state) -> state.isExpired(now) ? null : state));
    }

    /**
     * min(base * 2^(level-1), max)
     */
    Duration cooldownFor(int level) {
        Duration cooldown = baseCooldown.multipliedBy(1L << (level - 1));
        return cooldown.compareTo(maxCooldown) > 0 ? maxCooldown : cooldown;
    }
}
