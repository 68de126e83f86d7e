package com.intermission.scheduler.core;

/** Inputs that can move the scheduler between phases. */
public enum SchedulerEvent {
    COUNTDOWN_STARTED,
    COUNTDOWN_CANCELLED,
    SHOW_REQUESTED,
    SHOW_FAILED,
    SHOW_EXPIRED,
    OPENED,
    CLOSED
}
