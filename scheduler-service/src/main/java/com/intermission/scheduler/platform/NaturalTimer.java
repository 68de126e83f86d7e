package com.intermission.scheduler.platform;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Recurring readiness signal: ready once {@code interval} has elapsed since the
 * last reset. Starts counting at construction.
 */
public class NaturalTimer {

    private final Clock clock;
    private final Duration interval;
    private Instant readyAt;

    public NaturalTimer(Clock clock, Duration interval) {
        if (interval.isNegative()) {
            throw new IllegalArgumentException("Natural timer interval must be >= 0, got " + interval);
        }
        this.clock = clock;
        this.interval = interval;
        this.readyAt = clock.instant().plus(interval);
    }

    public synchronized boolean isReady() {
        return !clock.instant().isBefore(readyAt);
    }

    public synchronized double secondsUntilReady() {
        long millis = Duration.between(clock.instant(), readyAt).toMillis();
        return millis <= 0 ? 0.0 : millis / 1000.0;
    }

    public synchronized void forceReady() {
        readyAt = clock.instant();
    }

    public synchronized void resetToFullInterval() {
        readyAt = clock.instant().plus(interval);
    }
}
