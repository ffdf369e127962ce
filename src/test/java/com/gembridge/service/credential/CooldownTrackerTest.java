package com.gembridge.service.credential;

import com.gembridge.model.CooldownState;
import com.gembridge.support.MutableClock;
import com.gembridge.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies cooldown durations and backoff level transitions.
 */
class CooldownTrackerTest {

    private static final String IDENTITY = "/auth/p1.json";

    private MutableClock clock;
    private CooldownTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        tracker = new CooldownTracker(TestProperties.defaults(), clock);
    }

    @Test
    void testConsecutiveSignalsDoubleUntilCap() {
        long[] expectedSeconds = {60, 120, 240, 480, 960, 960, 960};

        for (int n = 0; n < expectedSeconds.length; n++) {
            CooldownState state = tracker.setCooldown(IDENTITY);

            assertEquals(Math.min(n + 1, 5), state.getBackoffLevel());
            assertEquals(Duration.ofSeconds(expectedSeconds[n]), tracker.remainingCooldown(IDENTITY));
        }
    }

    @Test
    void testCooldownForIsCappedAtMaximum() {
        assertEquals(Duration.ofSeconds(60), tracker.cooldownFor(1));
        assertEquals(Duration.ofSeconds(960), tracker.cooldownFor(5));
        assertEquals(Duration.ofSeconds(1800), tracker.cooldownFor(6));
    }

    @Test
    void testResetClearsImmediately() {
        tracker.setCooldown(IDENTITY);
        tracker.setCooldown(IDENTITY);
        assertTrue(tracker.isInCooldown(IDENTITY));

        tracker.resetCooldown(IDENTITY);

        assertFalse(tracker.isInCooldown(IDENTITY));
        assertEquals(Duration.ZERO, tracker.remainingCooldown(IDENTITY));
        assertEquals(1, tracker.setCooldown(IDENTITY).getBackoffLevel());
    }

    @Test
    void testExpiredCooldownIsEvictedOnQuery() {
        tracker.setCooldown(IDENTITY);

        clock.advance(Duration.ofSeconds(59));
        assertTrue(tracker.isInCooldown(IDENTITY));

        clock.advance(Duration.ofSeconds(1));
        assertFalse(tracker.isInCooldown(IDENTITY));
        assertTrue(tracker.currentState(IDENTITY).isEmpty());
    }

    @Test
    void testSignalAfterExpiryStartsOverAtLevelOne() {
        tracker.setCooldown(IDENTITY);
        tracker.setCooldown(IDENTITY);

        clock.advance(Duration.ofMinutes(5));

        assertEquals(1, tracker.setCooldown(IDENTITY).getBackoffLevel());
    }

    @Test
    void testIdentitiesAreIndependent() {
        tracker.setCooldown(IDENTITY);

        assertFalse(tracker.isInCooldown("/auth/p2.json"));
    }
}
