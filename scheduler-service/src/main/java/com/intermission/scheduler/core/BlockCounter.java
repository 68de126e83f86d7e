package com.intermission.scheduler.core;

/**
 * Reference count of open requests to suppress admission (fullscreen UIs,
 * loading screens, the startup hold). Never negative: surplus unblocks are clamped.
 */
public class BlockCounter {

    private int count;

    public int block() {
        return ++count;
    }

    public int unblock() {
        if (count > 0) {
            count--;
        }
        return count;
    }

    /** Last resort for mismatched block/unblock pairs. */
    public void forceReset() {
        count = 0;
    }

    public int count() {
        return count;
    }

    public boolean isBlocked() {
        return count > 0;
    }
}
