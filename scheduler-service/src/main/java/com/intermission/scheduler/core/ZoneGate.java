package com.intermission.scheduler.core;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Objects;
import java.util.Set;

/**
 * Restricts admission to a configured set of zones. With {@code restricted=false}
 * every zone admits. An unknown current zone (no zone collaborator reported yet)
 * never admits while restricted.
 */
public class ZoneGate {

    private final Set<String> allowedZones;
    private final boolean restricted;
    private String currentZone;

    public ZoneGate(Set<String> allowedZones, boolean restricted, String initialZone) {
        this.allowedZones = Set.copyOf(allowedZones);
        this.restricted = restricted;
        this.currentZone = initialZone;
    }

    public boolean isAllowed() {
        return isAllowed(currentZone);
    }

    public boolean isAllowed(String zone) {
        if (!restricted) {
            return true;
        }
        return zone != null && allowedZones.contains(zone);
    }

    public Transition update(String newZone) {
        String previous = currentZone;
        boolean wasAllowed = isAllowed(previous);
        currentZone = newZone;
        return new Transition(previous, newZone, wasAllowed, isAllowed(newZone));
    }

    public String currentZone() {
        return currentZone;
    }

    @Getter
    @AllArgsConstructor
    public static class Transition {
        private final String previousZone;
        private final String newZone;
        private final boolean wasAllowed;
        private final boolean nowAllowed;

        /** An unknown previous zone (first report after startup) is not a return. */
        public boolean isReturn() {
            return previousZone != null && !wasAllowed && nowAllowed;
        }

        public boolean isSameZone() {
            return Objects.equals(previousZone, newZone);
        }
    }
}
