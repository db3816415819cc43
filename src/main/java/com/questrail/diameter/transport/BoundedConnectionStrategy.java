package com.questrail.diameter.transport;

import io.netty.util.concurrent.DefaultThreadFactory;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * BoundedConnectionStrategy
 * -----------------------------------------------------------------------------
 * Serves at most {@code maxConnections} peers at once on a worker pool.
 *
 * <h2>Admission control</h2>
 * There is no waiting queue: a connection arriving while every worker is busy
 * is refused immediately. Queuing an accepted connection would leave the peer
 * connected but unanswered, which it would eventually treat as a dead peer.
 *
 * <p>Idle workers are retired after one minute.</p>
 */
public final class BoundedConnectionStrategy implements ConnectionExecutionStrategy
{
    private final ThreadPoolExecutor workers;
    private final int maxConnections;

    public BoundedConnectionStrategy(int maxConnections) {
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be >= 1 (was " + maxConnections + ")");
        }
        this.maxConnections = maxConnections;
        this.workers = new ThreadPoolExecutor(
                maxConnections,
                maxConnections,
                60, TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                new DefaultThreadFactory("diameter-conn-pool", true),
                new ThreadPoolExecutor.AbortPolicy());
        this.workers.allowCoreThreadTimeOut(true);
    }

    @Override
    public boolean execute(Runnable connectionTask) {
        Objects.requireNonNull(connectionTask, "connectionTask");
        try {
            workers.execute(connectionTask);
            return true;
        }
        catch (RejectedExecutionException e) {
            return false;
        }
    }

    public int maxConnections() {
        return maxConnections;
    }

    /**
     * Approximate number of connections currently being served.
     */
    public int activeConnections() {
        return workers.getActiveCount();
    }

    @Override
    public void close() {
        workers.shutdown();
    }
}
