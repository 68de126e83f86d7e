package com.intermission.platform.service;

import com.intermission.common.model.EventKind;
import com.intermission.common.model.ShowRequest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SimulatedDisplayStrategyTest {

    private final List<String> calls = new ArrayList<>();

    private final DisplayCallbacks callbacks = new DisplayCallbacks() {
        @Override
        public void opened() {
            calls.add("opened");
        }

        @Override
        public void rewardGranted() {
            calls.add("reward");
        }

        @Override
        public void closed() {
            calls.add("closed");
        }
    };

    @Test
    void interstitialHasNoReward() {
        new SimulatedDisplayStrategy(0, 0).display(
                ShowRequest.builder().requestId("r").kind(EventKind.INTERSTITIAL).build(), callbacks);

        assertThat(calls).containsExactly("opened", "closed");
    }

    @Test
    void interruptedRewardedClosesWithoutReward() {
        Thread.currentThread().interrupt();
        try {
            new SimulatedDisplayStrategy(0, 1000).display(
                    ShowRequest.builder().requestId("r").kind(EventKind.REWARDED).build(), callbacks);

            assertThat(calls).containsExactly("opened", "closed");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
