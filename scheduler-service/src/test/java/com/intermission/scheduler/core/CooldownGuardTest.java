package com.intermission.scheduler.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CooldownGuardTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void readyBeforeAnyClose() {
        CooldownGuard guard = new CooldownGuard(Duration.ofSeconds(3));

        assertThat(guard.isReady(T0)).isTrue();
        assertThat(guard.remaining(T0)).isEqualTo(Duration.ZERO);
        assertThat(guard.lastClose()).isEmpty();
    }

    @Test
    void refusesInsideWindowAndAdmitsAtBoundary() {
        CooldownGuard guard = new CooldownGuard(Duration.ofSeconds(3));
        guard.recordClose(T0);

        assertThat(guard.isReady(T0.plusSeconds(1))).isFalse();
        assertThat(guard.remaining(T0.plusSeconds(1))).isEqualTo(Duration.ofSeconds(2));
        assertThat(guard.isReady(T0.plusSeconds(3))).isTrue();
        assertThat(guard.remaining(T0.plusSeconds(5))).isEqualTo(Duration.ZERO);
    }

    @Test
    void zeroWindowIsAlwaysReady() {
        CooldownGuard guard = new CooldownGuard(Duration.ZERO);
        guard.recordClose(T0);

        assertThat(guard.isReady(T0)).isTrue();
    }

    @Test
    void negativeWindowIsRejected() {
        assertThatThrownBy(() -> new CooldownGuard(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void zeroTimerShortlyAfterCloseIsStale() {
        CooldownGuard guard = new CooldownGuard(Duration.ofSeconds(3));
        guard.recordClose(T0);

        assertThat(guard.isStaleTimerSuspect(T0.plusMillis(3500), 0.0)).isTrue();
        assertThat(guard.isStaleTimerSuspect(T0.plusMillis(3500), 12.0)).isFalse();
        assertThat(guard.isStaleTimerSuspect(T0.plusSeconds(4), 0.0)).isFalse();
    }
}
