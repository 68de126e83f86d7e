package com.intermission.platform.service;

/**
 * Lifecycle hooks a {@link DisplayStrategy} fires while it shows something.
 * {@link #closed()} is always the last call.
 */
public interface DisplayCallbacks {

    void opened();

    void rewardGranted();

    void closed();
}
