package com.intermission.platform.service;

import com.intermission.common.model.EventKind;
import com.intermission.platform.model.DisplayState;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory read model and idempotency store.
 * - Tracks processed requestIds so redelivered requests are not shown twice.
 * - Tracks what is currently on screen for querying.
 */
@Component
public class DisplayStateStore {

    private final Map<String, Boolean> processed = new ConcurrentHashMap<>();
    private final DisplayState state = DisplayState.builder().build();

    public boolean markProcessed(String requestId) {
        return processed.putIfAbsent(requestId, true) == null;
    }

    /** Claims the screen. Returns false if something else is already showing. */
    public synchronized boolean begin(String requestId, EventKind kind) {
        if (state.isDisplaying()) {
            state.setTotalRejected(state.getTotalRejected() + 1);
            return false;
        }
        state.setDisplaying(true);
        state.setCurrentRequestId(requestId);
        state.setCurrentKind(kind);
        state.setLastUpdatedAt(Instant.now());
        return true;
    }

    public synchronized void opened() {
        state.setTotalShown(state.getTotalShown() + 1);
        state.setLastUpdatedAt(Instant.now());
    }

    public synchronized void rewarded() {
        state.setTotalRewarded(state.getTotalRewarded() + 1);
        state.setLastUpdatedAt(Instant.now());
    }

    public synchronized void end() {
        state.setDisplaying(false);
        state.setCurrentRequestId(null);
        state.setCurrentKind(null);
        state.setLastUpdatedAt(Instant.now());
    }

    public synchronized DisplayState snapshot() {
        return DisplayState.builder()
                .displaying(state.isDisplaying())
                .currentRequestId(state.getCurrentRequestId())
                .currentKind(state.getCurrentKind())
                .totalShown(state.getTotalShown())
                .totalRewarded(state.getTotalRewarded())
                .totalRejected(state.getTotalRejected())
                .lastUpdatedAt(state.getLastUpdatedAt())
                .build();
    }
}
