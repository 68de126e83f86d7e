package com.intermission.scheduler.core;

import com.intermission.common.model.TriggerSource;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans a notification out to every listener. A failing listener is logged and
 * skipped so it can never break the tick.
 */
@Slf4j
public class AdmissionListeners {

    private final List<AdmissionListener> listeners = new CopyOnWriteArrayList<>();

    public AdmissionListeners() {
    }

    public AdmissionListeners(List<? extends AdmissionListener> initial) {
        listeners.addAll(initial);
    }

    public void add(AdmissionListener listener) {
        listeners.add(listener);
    }

    public void countdownStarted() {
        fire("countdownStarted", AdmissionListener::onCountdownStarted);
    }

    public void countdownTick(int remainingSeconds) {
        fire("countdownTick", l -> l.onCountdownTick(remainingSeconds));
    }

    public void countdownEnded() {
        fire("countdownEnded", AdmissionListener::onCountdownEnded);
    }

    public void eventShown(TriggerSource trigger) {
        fire("eventShown", l -> l.onEventShown(trigger));
    }

    public void rewardGranted(String rewardId) {
        fire("rewardGranted", l -> l.onRewardGranted(rewardId));
    }

    private void fire(String what, Consumer<AdmissionListener> call) {
        for (AdmissionListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Admission listener {} failed on {}: {}", listener.getClass().getSimpleName(), what, e.getMessage(), e);
            }
        }
    }
}
