package com.intermission.scheduler.core;

import com.intermission.scheduler.store.CounterStore;
import lombok.extern.slf4j.Slf4j;

/**
 * Frequency gate for explicitly requested interruptions.
 * <p>
 * The counter is incremented BEFORE the modulo check, so with frequency 2 the
 * 2nd, 4th, 6th... request is admitted. Frequency 1 admits every request and a
 * frequency of 0 or less disables manual triggers without touching the counter.
 */
@Slf4j
public class ManualTriggerPolicy {

    private final CounterStore store;
    private final String counterKey;
    private final int frequency;
    private int counter;

    public ManualTriggerPolicy(CounterStore store, String counterKey, int frequency) {
        this.store = store;
        this.counterKey = counterKey;
        this.frequency = frequency;
        this.counter = store.load(counterKey, 0);
        if (frequency <= 0) {
            log.warn("Manual trigger frequency is {}, manual triggers are disabled", frequency);
        }
        log.info("Loaded manual trigger counter {}={} (frequency={})", counterKey, counter, frequency);
    }

    public boolean shouldAdmit() {
        if (frequency <= 0) {
            return false;
        }
        counter++;
        store.save(counterKey, counter);
        boolean admit = admits(counter);
        log.debug("Manual trigger counter -> {} (frequency={}, admit={})", counter, frequency, admit);
        return admit;
    }

    /** Whether the next {@link #shouldAdmit()} would admit. Does not mutate. */
    public boolean peek() {
        return frequency > 0 && admits(counter + 1);
    }

    /** Counter value at which the next admission happens, or -1 when disabled. */
    public int nextAdmittingCounter() {
        if (frequency <= 0) {
            return -1;
        }
        if (frequency == 1) {
            return counter + 1;
        }
        return ((counter / frequency) + 1) * frequency;
    }

    public int counter() {
        return counter;
    }

    public int frequency() {
        return frequency;
    }

    private boolean admits(int value) {
        return frequency == 1 || value % frequency == 0;
    }
}
