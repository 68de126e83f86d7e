package com.intermission.scheduler.control;

/**
 * Contract an input controller exposes so the countdown can suspend it.
 * Nothing else about the controller is touched.
 */
public interface SuspendableController {

    String name();

    boolean isEnabled();

    void setEnabled(boolean enabled);
}
