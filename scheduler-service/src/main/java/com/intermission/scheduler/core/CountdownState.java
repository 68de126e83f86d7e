package com.intermission.scheduler.core;

public enum CountdownState {
    IDLE,
    COUNTING,
    COMPLETED,
    CANCELLED
}
