package com.intermission.common.model;

public enum NotificationType {
    OPENED,
    CLOSED,
    REWARD_GRANTED,
    PAUSE_RELEASED
}
