package com.intermission.platform.service;

import com.intermission.common.model.ShowRequest;

/**
 * Strategy for actually putting the interruption on screen.
 * Swap with an implementation that drives a real ad network SDK.
 */
public interface DisplayStrategy {

    void display(ShowRequest request, DisplayCallbacks callbacks);
}
