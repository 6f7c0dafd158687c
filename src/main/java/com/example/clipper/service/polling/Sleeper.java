package com.example.clipper.service.polling;

import java.time.Duration;

/**
 * Waits between poll attempts. Must return early once {@code cancellation} fires.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration, PollCancellation cancellation);

    static Sleeper interruptible() {
        return (duration, cancellation) -> cancellation.await(duration);
    }
}
