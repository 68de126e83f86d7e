package com.intermission.scheduler.core;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Phases of one admission cycle and the transitions between them.
 * An event without an entry for the current phase is not applicable and is ignored,
 * which is what makes duplicate OPENED / CLOSED notifications harmless.
 */
public enum SchedulerPhase {
    IDLE,
    COUNTING_DOWN,
    AWAITING_OPEN,
    SHOWING;

    private static final Map<SchedulerPhase, Map<SchedulerEvent, SchedulerPhase>> TRANSITIONS =
            new EnumMap<>(SchedulerPhase.class);

    static {
        for (SchedulerPhase phase : values()) {
            TRANSITIONS.put(phase, new EnumMap<>(SchedulerEvent.class));
        }
        allow(IDLE, SchedulerEvent.COUNTDOWN_STARTED, COUNTING_DOWN);
        allow(IDLE, SchedulerEvent.SHOW_REQUESTED, AWAITING_OPEN);
        allow(IDLE, SchedulerEvent.SHOW_FAILED, IDLE);
        allow(IDLE, SchedulerEvent.OPENED, SHOWING);

        allow(COUNTING_DOWN, SchedulerEvent.COUNTDOWN_CANCELLED, IDLE);
        allow(COUNTING_DOWN, SchedulerEvent.SHOW_REQUESTED, AWAITING_OPEN);
        allow(COUNTING_DOWN, SchedulerEvent.SHOW_FAILED, IDLE);
        allow(COUNTING_DOWN, SchedulerEvent.OPENED, SHOWING);

        allow(AWAITING_OPEN, SchedulerEvent.OPENED, SHOWING);
        allow(AWAITING_OPEN, SchedulerEvent.CLOSED, IDLE);
        allow(AWAITING_OPEN, SchedulerEvent.SHOW_EXPIRED, IDLE);

        allow(SHOWING, SchedulerEvent.CLOSED, IDLE);
    }

    private static void allow(SchedulerPhase from, SchedulerEvent event, SchedulerPhase to) {
        TRANSITIONS.get(from).put(event, to);
    }

    public Optional<SchedulerPhase> on(SchedulerEvent event) {
        return Optional.ofNullable(TRANSITIONS.get(this).get(event));
    }
}
