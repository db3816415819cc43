package com.questrail.diameter.transport;

import io.netty.util.concurrent.DefaultThreadFactory;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;

/**
 * Runs every connection on its own new daemon thread. No connection is ever
 * refused; admission control, if needed, belongs to a different strategy.
 */
public final class UnboundedConnectionStrategy implements ConnectionExecutionStrategy
{
    private final ThreadFactory threads;

    public UnboundedConnectionStrategy() {
        this(new DefaultThreadFactory("diameter-conn", true));
    }

    public UnboundedConnectionStrategy(ThreadFactory threads) {
        this.threads = Objects.requireNonNull(threads, "threads");
    }

    @Override
    public boolean execute(Runnable connectionTask) {
        Objects.requireNonNull(connectionTask, "connectionTask");
        threads.newThread(connectionTask).start();
        return true;
    }

    @Override
    public void close() {
        // Threads end with their connections.
    }
}
