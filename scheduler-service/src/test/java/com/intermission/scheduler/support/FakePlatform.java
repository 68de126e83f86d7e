package com.intermission.scheduler.support;

import com.intermission.common.model.TriggerSource;
import com.intermission.scheduler.platform.PlatformAdapter;
import com.intermission.scheduler.platform.PlatformListener;

import java.util.ArrayList;
import java.util.List;

/**
 * Platform double whose timer is set directly by the test.
 */
public class FakePlatform implements PlatformAdapter {

    public boolean timerReady = true;
    public double secondsUntilTimer = 30;
    public RuntimeException failShow;

    public final List<TriggerSource> shows = new ArrayList<>();
    public final List<String> rewardedShows = new ArrayList<>();
    public int forcedReady;
    public int timerResets;
    public PlatformListener listener;

    @Override
    public boolean isNaturalTimerReady() {
        return timerReady;
    }

    @Override
    public double secondsUntilNaturalTimer() {
        return secondsUntilTimer;
    }

    @Override
    public void show(TriggerSource trigger) {
        if (failShow != null) {
            throw failShow;
        }
        shows.add(trigger);
    }

    @Override
    public void showRewarded(String rewardId) {
        rewardedShows.add(rewardId);
    }

    @Override
    public void forceNaturalTimerReady() {
        forcedReady++;
        timerReady = true;
    }

    @Override
    public void resetNaturalTimerToFullInterval() {
        timerResets++;
        timerReady = false;
    }

    @Override
    public void subscribe(PlatformListener listener) {
        this.listener = listener;
    }
}
