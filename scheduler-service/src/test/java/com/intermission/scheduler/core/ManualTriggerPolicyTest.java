package com.intermission.scheduler.core;

import com.intermission.scheduler.store.CounterStore;
import com.intermission.scheduler.store.InMemoryCounterStore;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ManualTriggerPolicyTest {

    @Test
    void frequencyTwoAdmitsEverySecondRequest() {
        ManualTriggerPolicy policy = new ManualTriggerPolicy(new InMemoryCounterStore(), "k", 2);

        assertThat(policy.shouldAdmit()).isFalse();
        assertThat(policy.shouldAdmit()).isTrue();
        assertThat(policy.shouldAdmit()).isFalse();
        assertThat(policy.shouldAdmit()).isTrue();
        assertThat(policy.counter()).isEqualTo(4);
    }

    @Test
    void frequencyOneAdmitsEveryRequest() {
        ManualTriggerPolicy policy = new ManualTriggerPolicy(new InMemoryCounterStore(), "k", 1);

        assertThat(policy.shouldAdmit()).isTrue();
        assertThat(policy.shouldAdmit()).isTrue();
    }

    @Test
    void nonPositiveFrequencyDisablesWithoutCounting() {
        CounterStore store = mock(CounterStore.class);
        when(store.load("k", 0)).thenReturn(5);
        ManualTriggerPolicy policy = new ManualTriggerPolicy(store, "k", 0);

        assertThat(policy.shouldAdmit()).isFalse();
        assertThat(policy.peek()).isFalse();
        assertThat(policy.counter()).isEqualTo(5);
        assertThat(policy.nextAdmittingCounter()).isEqualTo(-1);
        verify(store, never()).save(anyString(), anyInt());
    }

    @Test
    void counterSurvivesRestartThroughStore() {
        InMemoryCounterStore store = new InMemoryCounterStore();
        ManualTriggerPolicy first = new ManualTriggerPolicy(store, "k", 3);
        first.shouldAdmit();
        first.shouldAdmit();

        ManualTriggerPolicy restarted = new ManualTriggerPolicy(store, "k", 3);

        assertThat(restarted.counter()).isEqualTo(2);
        assertThat(restarted.peek()).isTrue();
        assertThat(restarted.shouldAdmit()).isTrue();
    }

    @Test
    void peekDoesNotMutate() {
        ManualTriggerPolicy policy = new ManualTriggerPolicy(new InMemoryCounterStore(), "k", 2);

        assertThat(policy.peek()).isFalse();
        assertThat(policy.peek()).isFalse();
        assertThat(policy.counter()).isZero();
    }

    @Test
    void nextAdmittingCounterPointsAtNextMultiple() {
        ManualTriggerPolicy policy = new ManualTriggerPolicy(new InMemoryCounterStore(), "k", 3);
        assertThat(policy.nextAdmittingCounter()).isEqualTo(3);

        policy.shouldAdmit();
        policy.shouldAdmit();
        policy.shouldAdmit();

        assertThat(policy.nextAdmittingCounter()).isEqualTo(6);
    }
}
