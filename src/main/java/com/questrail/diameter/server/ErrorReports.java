package com.questrail.diameter.server;

import java.time.Duration;
import java.util.Optional;

/**
 * Read-only view of an error report channel, for an out-of-band monitor.
 */
public interface ErrorReports
{
    /**
     * Take the pending report without waiting.
     */
    Optional<ErrorReport> poll();

    /**
     * Wait up to {@code timeout} for a report.
     */
    Optional<ErrorReport> poll(Duration timeout) throws InterruptedException;

    /**
     * Wait for the next report.
     */
    ErrorReport take() throws InterruptedException;

    /**
     * Number of reports discarded because the channel was full.
     */
    long droppedCount();
}
