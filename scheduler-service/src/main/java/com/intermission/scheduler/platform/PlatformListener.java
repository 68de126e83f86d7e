package com.intermission.scheduler.platform;

/**
 * Notifications relayed from the interruption platform. Delivery may repeat.
 */
public interface PlatformListener {

    void onOpened();

    void onClosed();

    default void onRewardGranted(String rewardId) {
    }

    /** The platform released its own pause; a fallback point to restore input. */
    default void onPauseReleased() {
    }
}
