package com.example.clipper.service.keys;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin position for one key pool. Reading and advancing happen in a single atomic step, so two
 * concurrent callers never get the same slot and never skip one.
 */
final class RotationCursor {
    private final AtomicInteger position = new AtomicInteger();

    /**
     * @param size current pool size, at least 1.
     * @return the slot to use now, in {@code [0, size)}.
     */
    int next(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("pool size must be positive: " + size);
        }
        // the modulo on the old value keeps the cursor in range after a reload shrank the pool
        int current = position.getAndUpdate(i -> (i % size + 1) % size);
        return current % size;
    }

    int peek() {
        return position.get();
    }

    void reset() {
        position.set(0);
    }
}
