package com.intermission.scheduler.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Minimum quiet period after an interruption closes.
 * <p>
 * The platform's natural timer may report ready before its own bookkeeping has
 * reset after a close, so admission is refused for a fixed window regardless of
 * what the timer claims.
 */
public class CooldownGuard {

    private static final double STALE_TIMER_THRESHOLD_SECONDS = 0.1;
    private static final Duration STALE_TIMER_GRACE = Duration.ofSeconds(1);

    private final Duration window;
    private Instant lastClose;

    public CooldownGuard(Duration window) {
        if (window == null || window.isNegative()) {
            throw new IllegalArgumentException("Cooldown window must be >= 0, got " + window);
        }
        this.window = window;
    }

    public boolean isReady(Instant now) {
        return lastClose == null || Duration.between(lastClose, now).compareTo(window) >= 0;
    }

    public void recordClose(Instant now) {
        this.lastClose = now;
    }

    public Duration remaining(Instant now) {
        if (lastClose == null) {
            return Duration.ZERO;
        }
        Duration left = window.minus(Duration.between(lastClose, now));
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * A timer that reads (almost) zero shortly after a close is most likely still
     * showing the previous cycle's value.
     */
    public boolean isStaleTimerSuspect(Instant now, double secondsUntilTimer) {
        if (lastClose == null || secondsUntilTimer > STALE_TIMER_THRESHOLD_SECONDS) {
            return false;
        }
        return Duration.between(lastClose, now).compareTo(window.plus(STALE_TIMER_GRACE)) < 0;
    }

    public Optional<Instant> lastClose() {
        return Optional.ofNullable(lastClose);
    }
}
