package com.questrail.diameter.internal.time;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocks the calling thread for a delay. The accept loop sleeps through this
 * seam so tests can record backoff delays instead of waiting them out.
 */
@FunctionalInterface
public interface Sleeper
{
    Sleeper SYSTEM = delay -> TimeUnit.NANOSECONDS.sleep(delay.toNanos());

    void sleep(Duration delay) throws InterruptedException;
}
