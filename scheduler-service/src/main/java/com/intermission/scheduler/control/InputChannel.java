package com.intermission.scheduler.control;

import lombok.extern.slf4j.Slf4j;

/**
 * Named on/off input channel mirrored to clients through the status endpoint.
 */
@Slf4j
public class InputChannel implements SuspendableController {

    private final String name;
    private volatile boolean enabled;

    public InputChannel(String name, boolean enabled) {
        this.name = name;
        this.enabled = enabled;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void setEnabled(boolean enabled) {
        if (this.enabled != enabled) {
            log.debug("Input channel {} -> {}", name, enabled ? "enabled" : "disabled");
        }
        this.enabled = enabled;
    }

    @Override
    public String toString() {
        return "InputChannel[" + name + "=" + enabled + "]";
    }
}
