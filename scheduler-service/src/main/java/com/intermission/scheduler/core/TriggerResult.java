package com.intermission.scheduler.core;

public enum TriggerResult {
    REJECTED_SHOWING,
    REJECTED_PENDING,
    REJECTED_BLOCKED,
    NO_PLATFORM,
    SKIPPED_BY_FREQUENCY,
    COUNTDOWN_STARTED,
    SHOW_REQUESTED,
    SHOW_FAILED
}
