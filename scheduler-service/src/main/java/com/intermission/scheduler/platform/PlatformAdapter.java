package com.intermission.scheduler.platform;

import com.intermission.common.model.TriggerSource;

/**
 * Boundary to the platform that actually displays interruptions and owns the
 * natural timer. All calls return immediately; outcomes arrive later through
 * {@link PlatformListener}.
 */
public interface PlatformAdapter {

    boolean isNaturalTimerReady();

    /** Diagnostic / display only. */
    double secondsUntilNaturalTimer();

    void show(TriggerSource trigger);

    void showRewarded(String rewardId);

    /** Privileged: used by the manual trigger path only. */
    void forceNaturalTimerReady();

    /** Privileged: used when returning to an allowed zone. */
    void resetNaturalTimerToFullInterval();

    void subscribe(PlatformListener listener);
}
