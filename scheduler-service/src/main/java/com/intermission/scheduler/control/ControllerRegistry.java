package com.intermission.scheduler.control;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registered controllers plus the set of holders currently keeping each one disabled.
 * <p>
 * The enabled flag seen before the FIRST holder acquired a controller is what gets
 * restored when the LAST holder releases it. If that flag could not be read the
 * controller is restored as enabled.
 */
@Slf4j
public class ControllerRegistry {

    private final Map<String, SuspendableController> controllers = new LinkedHashMap<>();
    private final Map<SuspendableController, Set<Object>> holders = new IdentityHashMap<>();
    private final Map<SuspendableController, Boolean> priorState = new IdentityHashMap<>();
    private final Map<String, Object> externalHolders = new HashMap<>();

    public synchronized void register(SuspendableController controller) {
        controllers.put(controller.name(), controller);
        log.info("Registered controller {}", controller.name());
    }

    public synchronized List<SuspendableController> controllers() {
        return new ArrayList<>(controllers.values());
    }

    /**
     * Disables the controller on behalf of {@code holder}.
     *
     * @return the enabled flag read just before this acquisition
     */
    public synchronized boolean acquire(SuspendableController controller, Object holder) {
        boolean enabledNow = readEnabled(controller);
        Set<Object> current = holders.computeIfAbsent(controller, c -> new LinkedHashSet<>());
        if (current.isEmpty()) {
            priorState.put(controller, enabledNow);
        }
        current.add(holder);
        writeEnabled(controller, false);
        return enabledNow;
    }

    /**
     * Drops {@code holder}'s claim. Re-enables the controller only when no other
     * holder remains and it was enabled before the first acquisition.
     *
     * @return true if the controller was re-enabled by this call
     */
    public synchronized boolean release(SuspendableController controller, Object holder) {
        Set<Object> current = holders.get(controller);
        if (current == null || !current.remove(holder)) {
            return false;
        }
        if (!current.isEmpty()) {
            log.debug("Controller {} still held by {}", controller.name(), current);
            return false;
        }
        holders.remove(controller);
        boolean restore = priorState.getOrDefault(controller, Boolean.TRUE);
        priorState.remove(controller);
        if (restore) {
            writeEnabled(controller, true);
        }
        return restore;
    }

    /** Hold taken by another system (e.g. a dialog) identified by name. */
    public synchronized void hold(String controllerName, String holderId) {
        SuspendableController controller = require(controllerName);
        Object holder = externalHolders.computeIfAbsent(controllerName + "/" + holderId, ExternalHolder::new);
        acquire(controller, holder);
        log.info("Controller {} held by {}", controllerName, holderId);
    }

    public synchronized boolean releaseHold(String controllerName, String holderId) {
        SuspendableController controller = require(controllerName);
        Object holder = externalHolders.remove(controllerName + "/" + holderId);
        if (holder == null) {
            log.debug("Controller {} has no hold from {}", controllerName, holderId);
            return false;
        }
        boolean restored = release(controller, holder);
        log.info("Controller {} released by {} (restored={})", controllerName, holderId, restored);
        return restored;
    }

    public synchronized Map<String, Boolean> snapshot() {
        Map<String, Boolean> out = new LinkedHashMap<>();
        controllers.forEach((name, c) -> out.put(name, readEnabled(c)));
        return out;
    }

    private SuspendableController require(String name) {
        SuspendableController controller = controllers.get(name);
        if (controller == null) {
            throw new IllegalArgumentException("Unknown controller: " + name);
        }
        return controller;
    }

    private static boolean readEnabled(SuspendableController controller) {
        try {
            return controller.isEnabled();
        } catch (RuntimeException e) {
            log.warn("Could not read state of controller {}, assuming enabled: {}", controller.name(), e.getMessage());
            return true;
        }
    }

    private static void writeEnabled(SuspendableController controller, boolean enabled) {
        try {
            controller.setEnabled(enabled);
        } catch (RuntimeException e) {
            log.error("Failed to {} controller {}", enabled ? "enable" : "disable", controller.name(), e);
        }
    }

    private static final class ExternalHolder {
        private final String id;

        private ExternalHolder(String id) {
            this.id = id;
        }

        @Override
        public String toString() {
            return id;
        }
    }
}
