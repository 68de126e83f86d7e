package com.intermission.scheduler.platform;

import com.intermission.scheduler.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class NaturalTimerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

    @Test
    void becomesReadyAfterInterval() {
        NaturalTimer timer = new NaturalTimer(clock, Duration.ofSeconds(60));
        assertThat(timer.isReady()).isFalse();
        assertThat(timer.secondsUntilReady()).isEqualTo(60.0);

        clock.advance(Duration.ofSeconds(60));

        assertThat(timer.isReady()).isTrue();
        assertThat(timer.secondsUntilReady()).isZero();
    }

    @Test
    void forceAndReset() {
        NaturalTimer timer = new NaturalTimer(clock, Duration.ofSeconds(60));

        timer.forceReady();
        assertThat(timer.isReady()).isTrue();

        clock.advance(Duration.ofSeconds(5));
        timer.resetToFullInterval();
        assertThat(timer.isReady()).isFalse();
        assertThat(timer.secondsUntilReady()).isEqualTo(60.0);
    }
}
