package com.intermission.scheduler.support;

import com.intermission.common.model.TriggerSource;
import com.intermission.scheduler.core.AdmissionListener;

import java.util.ArrayList;
import java.util.List;

public class RecordingListener implements AdmissionListener {

    public final List<String> events = new ArrayList<>();

    @Override
    public void onCountdownStarted() {
        events.add("started");
    }

    @Override
    public void onCountdownTick(int remainingSeconds) {
        events.add("tick:" + remainingSeconds);
    }

    @Override
    public void onCountdownEnded() {
        events.add("ended");
    }

    @Override
    public void onEventShown(TriggerSource trigger) {
        events.add("shown:" + trigger);
    }

    @Override
    public void onRewardGranted(String rewardId) {
        events.add("reward:" + rewardId);
    }
}
