package com.intermission.scheduler.core;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ZoneGateTest {

    @Test
    void unknownZoneIsNotAllowedWhileRestricted() {
        ZoneGate gate = new ZoneGate(Set.of("WORKSHOP"), true, null);

        assertThat(gate.isAllowed()).isFalse();
    }

    @Test
    void unrestrictedAllowsEverything() {
        ZoneGate gate = new ZoneGate(Set.of("WORKSHOP"), false, "MENU");

        assertThat(gate.isAllowed()).isTrue();
        assertThat(gate.isAllowed(null)).isTrue();
    }

    @Test
    void leavingAndReturningIsReported() {
        ZoneGate gate = new ZoneGate(Set.of("WORKSHOP"), true, "WORKSHOP");

        ZoneGate.Transition leave = gate.update("MENU");
        assertThat(leave.isWasAllowed()).isTrue();
        assertThat(leave.isNowAllowed()).isFalse();
        assertThat(leave.isReturn()).isFalse();

        ZoneGate.Transition back = gate.update("WORKSHOP");
        assertThat(back.isReturn()).isTrue();
        assertThat(back.getPreviousZone()).isEqualTo("MENU");
        assertThat(gate.currentZone()).isEqualTo("WORKSHOP");
    }

    @Test
    void firstReportAfterStartupIsNotAReturn() {
        ZoneGate gate = new ZoneGate(Set.of("WORKSHOP"), true, null);

        ZoneGate.Transition first = gate.update("WORKSHOP");

        assertThat(first.isNowAllowed()).isTrue();
        assertThat(first.isReturn()).isFalse();
    }

    @Test
    void reEnteringSameAllowedZoneIsNotAReturn() {
        ZoneGate gate = new ZoneGate(Set.of("WORKSHOP"), true, "WORKSHOP");

        ZoneGate.Transition same = gate.update("WORKSHOP");

        assertThat(same.isSameZone()).isTrue();
        assertThat(same.isReturn()).isFalse();
    }
}
