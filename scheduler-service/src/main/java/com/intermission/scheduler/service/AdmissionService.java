package com.intermission.scheduler.service;

import com.intermission.common.model.AdmissionStatus;
import com.intermission.common.model.PlatformNotification;
import com.intermission.scheduler.control.ControllerRegistry;
import com.intermission.scheduler.core.AdmissionScheduler;
import com.intermission.scheduler.core.PollResult;
import com.intermission.scheduler.core.TriggerResult;
import com.intermission.scheduler.platform.KafkaPlatformAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Entry point for the rest of the application. Every operation is executed on
 * the admission loop so the scheduler never sees concurrent calls.
 */
@Slf4j
@Service
public class AdmissionService {

    private final AdmissionScheduler scheduler;
    private final AdmissionLoop loop;
    private final ControllerRegistry controllerRegistry;
    private final KafkaPlatformAdapter platformAdapter;

    public AdmissionService(AdmissionScheduler scheduler,
                            AdmissionLoop loop,
                            ControllerRegistry controllerRegistry,
                            ObjectProvider<KafkaPlatformAdapter> platformAdapter) {
        this.scheduler = scheduler;
        this.loop = loop;
        this.controllerRegistry = controllerRegistry;
        this.platformAdapter = platformAdapter.getIfAvailable();
    }

    @Scheduled(fixedRateString = "${intermission.tick-interval-ms:1000}")
    public void onTick() {
        PollResult result = scheduler.tick();
        if (result == PollResult.ADMITTED) {
            log.debug("Tick admitted a natural interruption");
        }
    }

    public int block() {
        return loop.call("block", scheduler::block);
    }

    public int unblock() {
        return loop.call("unblock", scheduler::unblock);
    }

    public void forceReset() {
        loop.call("forceReset", () -> {
            scheduler.forceReset();
            return null;
        });
    }

    public boolean isAdmissionBlocked() {
        return loop.call("isAdmissionBlocked", scheduler::isAdmissionBlocked);
    }

    public TriggerResult requestManualTrigger() {
        return loop.call("requestManualTrigger", scheduler::requestManualTrigger);
    }

    public boolean wouldManualTriggerFire() {
        return loop.call("wouldManualTriggerFire", scheduler::wouldManualTriggerFire);
    }

    public TriggerResult requestRewarded(String rewardId) {
        return loop.call("requestRewarded", () -> scheduler.requestRewarded(rewardId));
    }

    public void changeZone(String zoneId) {
        if (zoneId == null || zoneId.isBlank()) {
            throw new IllegalArgumentException("zoneId must not be blank");
        }
        loop.execute("changeZone", () -> scheduler.onZoneChanged(zoneId));
    }

    public void markInitialized() {
        loop.execute("markInitialized", scheduler::markInitialized);
    }

    public void holdController(String controllerName, String holderId) {
        loop.call("holdController", () -> {
            controllerRegistry.hold(controllerName, holderId);
            return null;
        });
    }

    public boolean releaseController(String controllerName, String holderId) {
        return loop.call("releaseController", () -> controllerRegistry.releaseHold(controllerName, holderId));
    }

    public void onPlatformNotification(PlatformNotification notification) {
        if (platformAdapter == null) {
            log.warn("Platform integration disabled, dropping {}", notification);
            return;
        }
        loop.execute("platformNotification", () -> platformAdapter.dispatch(notification));
    }

    public AdmissionStatus status() {
        return loop.call("status", scheduler::status);
    }
}
