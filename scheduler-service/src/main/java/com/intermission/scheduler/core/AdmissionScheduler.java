package com.intermission.scheduler.core;

import com.intermission.common.model.AdmissionStatus;
import com.intermission.common.model.TriggerSource;
import com.intermission.scheduler.control.ControllerRegistry;
import com.intermission.scheduler.platform.PlatformAdapter;
import com.intermission.scheduler.platform.PlatformListener;
import com.intermission.scheduler.store.CounterStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides when an interruption may fire.
 * <p>
 * Every tick either advances the running countdown or evaluates the admission gates
 * in a fixed order (zone, block, cooldown, timer). Manual triggers skip the natural
 * timer but still respect the block counter and their own frequency policy. Platform
 * notifications move the cycle through {@link SchedulerPhase}; the countdown that
 * belongs to the cycle is restored when the cycle ends, whichever path ends it.
 * <p>
 * Not thread-safe: every call must come from the admission loop thread.
 */
@Slf4j
public class AdmissionScheduler implements PlatformListener {

    private final AdmissionSettings settings;
    private final PlatformAdapter platform;
    private final ZoneGate zoneGate;
    private final ControllerRegistry controllers;
    private final AdmissionListeners listeners;
    private final Clock clock;

    private final BlockCounter blockCounter = new BlockCounter();
    private final CooldownGuard cooldownGuard;
    private final ManualTriggerPolicy manualTriggerPolicy;

    private SchedulerPhase phase = SchedulerPhase.IDLE;
    private CountdownController countdown;   // countdown of the current cycle
    private TriggerSource pendingTrigger;
    private Instant showRequestedAt;
    private boolean initialized;
    private long cycleSequence;
    private long totalShown;
    private long totalRewards;

    public AdmissionScheduler(AdmissionSettings settings,
                              PlatformAdapter platform,
                              ZoneGate zoneGate,
                              ControllerRegistry controllers,
                              CounterStore counterStore,
                              AdmissionListeners listeners,
                              Clock clock) {
        this.settings = settings;
        this.platform = platform;
        this.zoneGate = zoneGate;
        this.controllers = controllers;
        this.listeners = listeners;
        this.clock = clock;
        this.cooldownGuard = new CooldownGuard(settings.getCooldownWindow());
        this.manualTriggerPolicy = new ManualTriggerPolicy(counterStore,
                settings.getManualTriggerCounterKey(), settings.getManualTriggerFrequency());

        if (platform == null) {
            log.warn("No platform adapter available - interruptions are disabled");
        } else {
            platform.subscribe(this);
        }
        if (settings.isStartupHold()) {
            blockCounter.block();
            log.info("Admission held until the host reports it is initialized");
        }
    }

    // ---- tick ----

    public PollResult tick() {
        Instant now = clock.instant();

        if (countdown != null && countdown.getState() == CountdownState.COUNTING) {
            countdown.tick();
            return PollResult.COUNTDOWN_RUNNING;
        }
        if (phase == SchedulerPhase.AWAITING_OPEN) {
            expireShowRequest(now);
        }
        return poll(now);
    }

    private PollResult poll(Instant now) {
        PollResult result = evaluateGates(now);
        if (result != PollResult.ADMITTED) {
            if (result == PollResult.BLOCKED) {
                log.debug("Admission check skipped (blockCount: {})", blockCounter.count());
            } else if (result == PollResult.COOLDOWN) {
                log.debug("Admission check skipped (cooldown: {}ms remaining)", cooldownGuard.remaining(now).toMillis());
            } else {
                log.debug("Admission check skipped: {}", result);
            }
            return result;
        }
        log.info("Natural timer ready, starting warning");
        startCycle(TriggerSource.NATURAL);
        return PollResult.ADMITTED;
    }

    private PollResult evaluateGates(Instant now) {
        if (phase != SchedulerPhase.IDLE) {
            return phase == SchedulerPhase.COUNTING_DOWN ? PollResult.COUNTDOWN_RUNNING : PollResult.BUSY;
        }
        if (!zoneGate.isAllowed()) {
            return PollResult.ZONE_DISALLOWED;
        }
        if (blockCounter.isBlocked()) {
            return PollResult.BLOCKED;
        }
        if (!cooldownGuard.isReady(now)) {
            return PollResult.COOLDOWN;
        }
        if (platform == null) {
            return PollResult.NO_PLATFORM;
        }
        if (!platform.isNaturalTimerReady()) {
            return PollResult.TIMER_NOT_READY;
        }
        if (cooldownGuard.isStaleTimerSuspect(now, platform.secondsUntilNaturalTimer())) {
            return PollResult.STALE_TIMER;
        }
        return PollResult.ADMITTED;
    }

    // ---- cycle ----

    private void startCycle(TriggerSource trigger) {
        if (!settings.isCountdownEnabled()) {
            showEvent(trigger);
            return;
        }
        CountdownController cycle = new CountdownController("cycle-" + (++cycleSequence), controllers, listeners);
        countdown = cycle;
        transition(SchedulerEvent.COUNTDOWN_STARTED);
        cycle.start(settings.getCountdownDuration(), () -> onCountdownCompleted(cycle, trigger));
    }

    private void onCountdownCompleted(CountdownController cycle, TriggerSource trigger) {
        if (cycle != countdown) {
            log.warn("{} completed after being replaced, restoring its controllers", cycle);
            cycle.ensureRestored();
            return;
        }
        showEvent(trigger);
    }

    /**
     * Asks the platform to display the interruption. The event only counts as
     * showing once the platform confirms it opened.
     */
    boolean showEvent(TriggerSource trigger) {
        if (phase == SchedulerPhase.SHOWING || phase == SchedulerPhase.AWAITING_OPEN) {
            log.warn("Interruption already {}, ignoring {} show", phase, trigger);
            return false;
        }
        if (platform == null) {
            endCycle(SchedulerEvent.SHOW_FAILED);
            return false;
        }
        try {
            platform.show(trigger);
        } catch (RuntimeException e) {
            log.warn("Platform refused {} show: {}", trigger, e.getMessage(), e);
            endCycle(SchedulerEvent.SHOW_FAILED);
            return false;
        }
        requested(trigger);
        return true;
    }

    private void requested(TriggerSource trigger) {
        pendingTrigger = trigger;
        showRequestedAt = clock.instant();
        transition(SchedulerEvent.SHOW_REQUESTED);
        log.info("🎬 Show requested (trigger={})", trigger);
    }

    private void expireShowRequest(Instant now) {
        if (showRequestedAt == null) {
            return;
        }
        Duration waited = Duration.between(showRequestedAt, now);
        if (waited.compareTo(settings.getShowRequestTimeout()) >= 0) {
            log.warn("Platform did not open the {} interruption within {}s, giving up",
                    pendingTrigger, settings.getShowRequestTimeout().toSeconds());
            cooldownGuard.recordClose(now);
            endCycle(SchedulerEvent.SHOW_EXPIRED);
        }
    }

    private void cancelCountdown(String reason) {
        if (countdown != null && countdown.cancel()) {
            log.info("Warning cancelled: {}", reason);
            countdown = null;
            transition(SchedulerEvent.COUNTDOWN_CANCELLED);
        }
    }

    /** Restores the current cycle's controllers and applies {@code event}. */
    private void endCycle(SchedulerEvent event) {
        if (countdown != null) {
            countdown.cancel();
            countdown.ensureRestored();
            countdown = null;
        }
        pendingTrigger = null;
        showRequestedAt = null;
        transition(event);
    }

    private boolean transition(SchedulerEvent event) {
        return phase.on(event).map(next -> {
            if (next != phase) {
                log.debug("Phase {} -[{}]-> {}", phase, event, next);
            }
            phase = next;
            return true;
        }).orElseGet(() -> {
            log.debug("Ignoring {} in phase {}", event, phase);
            return false;
        });
    }

    // ---- manual & rewarded triggers ----

    public TriggerResult requestManualTrigger() {
        if (phase == SchedulerPhase.SHOWING) {
            log.warn("Interruption already showing, manual trigger rejected");
            return TriggerResult.REJECTED_SHOWING;
        }
        if (phase == SchedulerPhase.AWAITING_OPEN) {
            return TriggerResult.REJECTED_PENDING;
        }
        if (blockCounter.isBlocked()) {
            log.info("Manual trigger rejected (blockCount: {})", blockCounter.count());
            return TriggerResult.REJECTED_BLOCKED;
        }
        if (platform == null) {
            return TriggerResult.NO_PLATFORM;
        }
        if (!manualTriggerPolicy.shouldAdmit()) {
            log.info("Skipping manual trigger (counter: {}, frequency: {}, next show at: {})",
                    manualTriggerPolicy.counter(), manualTriggerPolicy.frequency(),
                    manualTriggerPolicy.nextAdmittingCounter());
            return TriggerResult.SKIPPED_BY_FREQUENCY;
        }

        log.info("Manual trigger admitted (counter: {}, frequency: {})",
                manualTriggerPolicy.counter(), manualTriggerPolicy.frequency());
        if (!platform.isNaturalTimerReady()) {
            platform.forceNaturalTimerReady();
        }

        if (phase == SchedulerPhase.COUNTING_DOWN) {
            // the natural warning is already on screen; the manual request takes it over
            countdown.dismiss();
            return showEvent(TriggerSource.MANUAL) ? TriggerResult.SHOW_REQUESTED : TriggerResult.SHOW_FAILED;
        }
        if (settings.isManualTriggerUsesCountdown() && settings.isCountdownEnabled()) {
            startCycle(TriggerSource.MANUAL);
            return phase == SchedulerPhase.COUNTING_DOWN ? TriggerResult.COUNTDOWN_STARTED
                    : phase == SchedulerPhase.AWAITING_OPEN ? TriggerResult.SHOW_REQUESTED
                    : TriggerResult.SHOW_FAILED;
        }
        return showEvent(TriggerSource.MANUAL) ? TriggerResult.SHOW_REQUESTED : TriggerResult.SHOW_FAILED;
    }

    /** Non-mutating preview of {@link #requestManualTrigger()}. */
    public boolean wouldManualTriggerFire() {
        if (phase == SchedulerPhase.SHOWING || phase == SchedulerPhase.AWAITING_OPEN) {
            return false;
        }
        if (platform == null || blockCounter.isBlocked()) {
            return false;
        }
        return manualTriggerPolicy.peek();
    }

    public TriggerResult requestRewarded(String rewardId) {
        if (rewardId == null || rewardId.isBlank()) {
            throw new IllegalArgumentException("rewardId must not be blank");
        }
        if (phase == SchedulerPhase.SHOWING) {
            return TriggerResult.REJECTED_SHOWING;
        }
        if (phase == SchedulerPhase.AWAITING_OPEN) {
            return TriggerResult.REJECTED_PENDING;
        }
        if (platform == null) {
            return TriggerResult.NO_PLATFORM;
        }
        cancelCountdown("rewarded interruption requested");
        try {
            platform.showRewarded(rewardId);
        } catch (RuntimeException e) {
            log.warn("Platform refused rewarded show {}: {}", rewardId, e.getMessage(), e);
            return TriggerResult.SHOW_FAILED;
        }
        log.info("Showing rewarded interruption with ID: {}", rewardId);
        requested(TriggerSource.REWARDED);
        return TriggerResult.SHOW_REQUESTED;
    }

    // ---- blocking ----

    public int block() {
        int count = blockCounter.block();
        log.info("Admission blocked (count: {})", count);
        cancelCountdown("blocked by fullscreen UI");
        return count;
    }

    public int unblock() {
        int count = blockCounter.unblock();
        if (count == 0) {
            log.info("All blocks cleared, admission resumes (zone allowed: {})", zoneGate.isAllowed());
        } else {
            log.info("Admission unblocked (count: {})", count);
        }
        return count;
    }

    public void forceReset() {
        log.warn("Force resetting block count from {} to 0", blockCounter.count());
        blockCounter.forceReset();
    }

    public boolean isAdmissionBlocked() {
        return blockCounter.isBlocked();
    }

    /** Releases the startup hold. Only the first call has an effect. */
    public void markInitialized() {
        if (initialized) {
            return;
        }
        initialized = true;
        log.info("Host initialized, starting admission checks");
        if (settings.isStartupHold()) {
            unblock();
        }
    }

    // ---- zone ----

    public void onZoneChanged(String newZone) {
        ZoneGate.Transition t = zoneGate.update(newZone);
        log.info("Zone changed to {} (previous: {})", newZone, t.getPreviousZone());

        if (!t.isNowAllowed()) {
            cancelCountdown("zone " + newZone + " does not allow interruptions");
            log.info("Admission checks stopped (zone {} not allowed)", newZone);
            return;
        }
        if (t.isReturn()) {
            if (settings.isResetBlocksOnZoneReturn() && blockCounter.isBlocked()) {
                log.warn("Block count is {} when returning to {}, resetting", blockCounter.count(), newZone);
                blockCounter.forceReset();
            }
            if (platform != null) {
                platform.resetNaturalTimerToFullInterval();
                log.info("Natural timer reset to full interval ({}s remaining)", platform.secondsUntilNaturalTimer());
            }
        }
    }

    // ---- platform notifications ----

    @Override
    public void onOpened() {
        if (!transition(SchedulerEvent.OPENED)) {
            log.debug("Duplicate opened notification ignored");
            return;
        }
        if (countdown != null) {
            countdown.dismiss();
        }
        showRequestedAt = null;
        totalShown++;
        log.info("Interruption opened (trigger={})", pendingTrigger);
        listeners.eventShown(pendingTrigger);
    }

    @Override
    public void onClosed() {
        Instant now = clock.instant();
        CountdownController closing = countdown;
        if (!transition(SchedulerEvent.CLOSED)) {
            log.debug("Duplicate closed notification ignored");
            return;
        }
        cooldownGuard.recordClose(now);
        if (closing != null) {
            int restored = closing.ensureRestored();
            log.debug("{} restored {} controllers on close", closing, restored);
        }
        countdown = null;
        pendingTrigger = null;
        showRequestedAt = null;
        log.info("Interruption closed, cooldown {}s started", settings.getCooldownWindow().toSeconds());
    }

    @Override
    public void onRewardGranted(String rewardId) {
        totalRewards++;
        log.info("Reward received with ID: {}", rewardId);
        listeners.rewardGranted(rewardId);
    }

    @Override
    public void onPauseReleased() {
        if (countdown != null && countdown.getState() != CountdownState.COUNTING) {
            int restored = countdown.ensureRestored();
            if (restored > 0) {
                log.info("Pause released, restored {} controllers", restored);
            }
        }
    }

    // ---- diagnostics ----

    public AdmissionStatus status() {
        Instant now = clock.instant();
        return AdmissionStatus.builder()
                .phase(phase.name())
                .currentZone(zoneGate.currentZone())
                .zoneAllowed(zoneGate.isAllowed())
                .blockCount(blockCounter.count())
                .waiting(isWaiting())
                .eventShowing(isEventShowing())
                .countdownRemaining(isWaiting() ? countdown.getRemaining() : null)
                .lastEventCloseTime(cooldownGuard.lastClose().orElse(null))
                .cooldownRemainingMs(cooldownGuard.remaining(now).toMillis())
                .platformAvailable(platform != null)
                .secondsUntilNaturalTimer(platform != null ? platform.secondsUntilNaturalTimer() : -1)
                .manualTriggerCounter(manualTriggerPolicy.counter())
                .manualTriggerFrequency(manualTriggerPolicy.frequency())
                .nextManualTriggerAt(manualTriggerPolicy.nextAdmittingCounter())
                .totalShown(totalShown)
                .totalRewards(totalRewards)
                .controllers(controllers.snapshot())
                .build();
    }

    public SchedulerPhase getPhase() {
        return phase;
    }

    public boolean isWaiting() {
        return phase == SchedulerPhase.COUNTING_DOWN;
    }

    public boolean isEventShowing() {
        return phase == SchedulerPhase.SHOWING;
    }

    public int getBlockCount() {
        return blockCounter.count();
    }

    public CountdownController getCountdown() {
        return countdown;
    }

    public Instant getLastEventCloseTime() {
        return cooldownGuard.lastClose().orElse(null);
    }
}
