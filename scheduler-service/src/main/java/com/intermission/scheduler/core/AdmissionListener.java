package com.intermission.scheduler.core;

import com.intermission.common.model.TriggerSource;

/**
 * Observer for countdown displays and dashboards. All callbacks run on the
 * admission loop thread and must return quickly.
 */
public interface AdmissionListener {

    default void onCountdownStarted() {
    }

    default void onCountdownTick(int remainingSeconds) {
    }

    default void onCountdownEnded() {
    }

    /** {@code trigger} is null when the platform opened an event this scheduler did not request. */
    default void onEventShown(TriggerSource trigger) {
    }

    default void onRewardGranted(String rewardId) {
    }
}
