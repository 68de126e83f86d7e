package com.intermission.scheduler.core;

/**
 * Outcome of one admission tick, in gate evaluation order.
 */
public enum PollResult {
    COUNTDOWN_RUNNING,
    BUSY,               // awaiting open or showing
    ZONE_DISALLOWED,
    BLOCKED,
    COOLDOWN,
    NO_PLATFORM,
    TIMER_NOT_READY,
    STALE_TIMER,
    ADMITTED
}
