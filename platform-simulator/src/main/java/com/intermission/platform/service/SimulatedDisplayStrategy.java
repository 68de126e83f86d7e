package com.intermission.platform.service;

import com.intermission.common.model.EventKind;
import com.intermission.common.model.ShowRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Simulates a full-screen interruption.
 * - waits for the load delay, then reports OPENED
 * - keeps it on screen for the display duration
 * - grants the reward (rewarded only) and reports CLOSED
 */
@Slf4j
@Service
public class SimulatedDisplayStrategy implements DisplayStrategy {

    private final long openDelayMs;
    private final long displayDurationMs;

    public SimulatedDisplayStrategy(@Value("${platform.open-delay-ms:500}") long openDelayMs,
                                    @Value("${platform.display-duration-ms:5000}") long displayDurationMs) {
        this.openDelayMs = openDelayMs;
        this.displayDurationMs = displayDurationMs;
    }

    @Override
    public void display(ShowRequest request, DisplayCallbacks callbacks) {
        log.info("SHOW {} requestId={} trigger={} (on screen for {}ms)",
                request.getKind(), request.getRequestId(), request.getTrigger(), displayDurationMs);

        boolean completed = pause(openDelayMs);
        callbacks.opened();

        if (completed) {
            completed = pause(displayDurationMs);
        }

        if (completed && request.getKind() == EventKind.REWARDED) {
            callbacks.rewardGranted();
        } else if (!completed) {
            log.warn("Display of requestId={} interrupted, closing early", request.getRequestId());
        }
        callbacks.closed();
    }

    private static boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
