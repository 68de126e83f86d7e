package com.intermission.scheduler.core;

import com.intermission.scheduler.control.ControllerRegistry;
import com.intermission.scheduler.control.SuspendableController;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Pre-event warning for one admission cycle.
 * <p>
 * {@code IDLE -> COUNTING} on {@link #start}, which suspends every registered controller.
 * Each {@link #tick()} takes one second off; reaching zero moves to {@code COMPLETED}
 * and runs the completion callback exactly once, leaving controllers suspended for
 * the interruption itself. {@link #cancel()} moves to {@code CANCELLED}, restores
 * immediately and never runs the callback.
 * <p>
 * A new instance is created per cycle; restoration only ever touches the
 * controllers this instance suspended. The enabled flag recorded per suspension
 * is for logging only: whether a controller comes back is decided by
 * {@link ControllerRegistry}, which keeps the flag seen by the first holder.
 */
@Slf4j
public class CountdownController {

    private final String cycleId;
    private final ControllerRegistry registry;
    private final AdmissionListeners listeners;

    private final List<Suspension> suspensions = new ArrayList<>();
    private CountdownState state = CountdownState.IDLE;
    private int remaining;
    private Runnable onComplete;

    public CountdownController(String cycleId, ControllerRegistry registry, AdmissionListeners listeners) {
        this.cycleId = cycleId;
        this.registry = registry;
        this.listeners = listeners;
    }

    /**
     * @return false if this countdown was already started once
     */
    public boolean start(Duration duration, Runnable onComplete) {
        if (state != CountdownState.IDLE) {
            log.warn("Countdown {} already {}, ignoring start", cycleId, state);
            return false;
        }
        this.onComplete = onComplete;
        this.remaining = (int) Math.max(0, (duration.toMillis() + 999) / 1000);
        this.state = CountdownState.COUNTING;

        suspendControllers();
        log.info("⏳ Countdown {} started ({}s, {} controllers suspended)", cycleId, remaining, suspensions.size());
        listeners.countdownStarted();

        if (remaining == 0) {
            complete();
        } else {
            listeners.countdownTick(remaining);
        }
        return true;
    }

    public void tick() {
        if (state != CountdownState.COUNTING) {
            return;
        }
        remaining--;
        if (remaining <= 0) {
            complete();
        } else {
            listeners.countdownTick(remaining);
        }
    }

    /**
     * Aborts a running countdown and gives control back to the user.
     *
     * @return true if the countdown was running
     */
    public boolean cancel() {
        if (state != CountdownState.COUNTING) {
            return false;
        }
        state = CountdownState.CANCELLED;
        onComplete = null;
        int restored = ensureRestored();
        log.info("Countdown {} cancelled at {}s ({} controllers restored)", cycleId, remaining, restored);
        listeners.countdownEnded();
        return true;
    }

    /**
     * Stops a running countdown because the interruption opened anyway. Unlike
     * {@link #cancel()} controllers stay suspended until {@link #ensureRestored()}.
     */
    public boolean dismiss() {
        if (state != CountdownState.COUNTING) {
            return false;
        }
        state = CountdownState.CANCELLED;
        onComplete = null;
        log.info("Countdown {} dismissed at {}s, controllers stay suspended", cycleId, remaining);
        listeners.countdownEnded();
        return true;
    }

    /**
     * Restores every controller suspended by this cycle that has not been restored yet.
     * Safe to call from any path and any number of times.
     *
     * @return number of controllers restored by this call
     */
    public int ensureRestored() {
        int restored = 0;
        for (Suspension s : suspensions) {
            if (s.alreadyRestored) {
                continue;
            }
            s.alreadyRestored = true;
            boolean enabled = registry.release(s.controller, this);
            if (enabled) {
                restored++;
            }
            log.debug("Countdown {} released {} (wasEnabled={}, reEnabled={})",
                    cycleId, s.controller.name(), s.wasEnabledBeforeSuspend, enabled);
        }
        return restored;
    }

    public boolean hasPendingRestoration() {
        return suspensions.stream().anyMatch(s -> !s.alreadyRestored);
    }

    public CountdownState getState() {
        return state;
    }

    public int getRemaining() {
        return remaining;
    }

    private void suspendControllers() {
        for (SuspendableController controller : registry.controllers()) {
            boolean wasEnabled = registry.acquire(controller, this);
            suspensions.add(new Suspension(controller, wasEnabled));
        }
    }

    private void complete() {
        state = CountdownState.COMPLETED;
        remaining = 0;
        log.info("Countdown {} completed", cycleId);
        listeners.countdownEnded();

        Runnable callback = onComplete;
        onComplete = null;
        if (callback != null) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.error("Completion callback of countdown {} failed", cycleId, e);
            }
        }
    }

    @Override
    public String toString() {
        return "Countdown[" + cycleId + "]";
    }

    private static final class Suspension {
        private final SuspendableController controller;
        private final boolean wasEnabledBeforeSuspend;
        private boolean alreadyRestored;

        private Suspension(SuspendableController controller, boolean wasEnabledBeforeSuspend) {
            this.controller = controller;
            this.wasEnabledBeforeSuspend = wasEnabledBeforeSuspend;
        }
    }
}
