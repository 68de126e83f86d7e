package com.intermission.common.model;

public enum AdmissionEventType {
    COUNTDOWN_STARTED,
    COUNTDOWN_TICK,
    COUNTDOWN_ENDED,
    EVENT_SHOWN,
    REWARD_GRANTED
}
