package com.questrail.diameter.server;

/**
 * Implemented by {@link Handler}s that accept errors from the connections
 * they serve, such as message parse failures or network errors.
 *
 * <p>The serving loop checks the configured handler for this interface at
 * run time; handlers that do not implement it never see read faults.</p>
 */
public interface ErrorReporter
{
    /**
     * Hand a report to the reporter. Must not block: the caller is a
     * connection's serving thread.
     */
    void error(ErrorReport report);

    /**
     * Read side of the reports handed to {@link #error(ErrorReport)}.
     */
    ErrorReports errorReports();
}
