package com.questrail.diameter.server;

import java.time.Duration;

/**
 * Delay schedule for retrying temporary accept failures: 5ms after the first
 * failure, doubling on each consecutive one, never more than one second.
 * A successful accept resets the schedule.
 *
 * <p>Not thread-safe; owned by a single accept loop.</p>
 */
final class AcceptBackoff
{
    static final Duration INITIAL_DELAY = Duration.ofMillis(5);
    static final Duration MAX_DELAY = Duration.ofSeconds(1);

    private Duration current = Duration.ZERO;

    Duration next() {
        if (current.isZero()) {
            current = INITIAL_DELAY;
        } else {
            current = current.multipliedBy(2);
        }
        if (current.compareTo(MAX_DELAY) > 0) {
            current = MAX_DELAY;
        }
        return current;
    }

    void reset() {
        current = Duration.ZERO;
    }

    Duration current() {
        return current;
    }
}
