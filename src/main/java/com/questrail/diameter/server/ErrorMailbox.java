package com.questrail.diameter.server;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ErrorMailbox
 * -----------------------------------------------------------------------------
 * Bounded error report channel with non-blocking producers.
 *
 * <h2>Backpressure policy</h2>
 * {@link #offer(ErrorReport)} never waits. When the mailbox is full the new
 * report is dropped and {@link #droppedCount()} is incremented; a slow or
 * absent consumer must never stall a connection's serving loop.
 *
 * <p>The default capacity is one report.</p>
 */
public final class ErrorMailbox implements ErrorReports
{
    public static final int DEFAULT_CAPACITY = 1;

    private final BlockingQueue<ErrorReport> slot;
    private final AtomicLong dropped = new AtomicLong();

    public ErrorMailbox() {
        this(DEFAULT_CAPACITY);
    }

    public ErrorMailbox(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.slot = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Attempt to deliver a report.
     *
     * @return {@code false} if the report was dropped
     */
    public boolean offer(ErrorReport report) {
        Objects.requireNonNull(report, "report");
        if (slot.offer(report)) {
            return true;
        }
        dropped.incrementAndGet();
        return false;
    }

    @Override
    public Optional<ErrorReport> poll() {
        return Optional.ofNullable(slot.poll());
    }

    @Override
    public Optional<ErrorReport> poll(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        return Optional.ofNullable(slot.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
    }

    @Override
    public ErrorReport take() throws InterruptedException {
        return slot.take();
    }

    @Override
    public long droppedCount() {
        return dropped.get();
    }

    /**
     * Read-only view for consumers; it cannot be used to submit reports.
     */
    public ErrorReports view() {
        return new ErrorReports() {
            @Override public Optional<ErrorReport> poll() { return ErrorMailbox.this.poll(); }
            @Override public Optional<ErrorReport> poll(Duration timeout) throws InterruptedException { return ErrorMailbox.this.poll(timeout); }
            @Override public ErrorReport take() throws InterruptedException { return ErrorMailbox.this.take(); }
            @Override public long droppedCount() { return ErrorMailbox.this.droppedCount(); }
        };
    }
}
