package com.questrail.diameter.transport;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class BoundedConnectionStrategyTest
{
    @Test
    void refusesWhenEveryWorkerIsBusy() throws Exception
    {
        BoundedConnectionStrategy strategy = new BoundedConnectionStrategy(2);
        CountDownLatch started = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        Runnable busy = () -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        try {
            assertTrue(strategy.execute(busy));
            assertTrue(strategy.execute(busy));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            assertFalse(strategy.execute(() -> {}));
            assertEquals(2, strategy.activeConnections());
        }
        finally {
            release.countDown();
            strategy.close();
        }
    }

    @Test
    void freedWorkerAcceptsNextConnection() throws Exception
    {
        BoundedConnectionStrategy strategy = new BoundedConnectionStrategy(1);
        CountDownLatch done = new CountDownLatch(1);
        try {
            assertTrue(strategy.execute(done::countDown));
            assertTrue(done.await(5, TimeUnit.SECONDS));

            CountDownLatch second = new CountDownLatch(1);
            long deadline = System.currentTimeMillis() + 5000;
            boolean admitted = false;
            while (!admitted && System.currentTimeMillis() < deadline) {
                admitted = strategy.execute(second::countDown);
                if (!admitted) {
                    Thread.sleep(5);
                }
            }
            assertTrue(admitted);
            assertTrue(second.await(5, TimeUnit.SECONDS));
        }
        finally {
            strategy.close();
        }
    }

    @Test
    void limitMustBePositive()
    {
        assertThrows(IllegalArgumentException.class, () -> new BoundedConnectionStrategy(0));
    }
}
