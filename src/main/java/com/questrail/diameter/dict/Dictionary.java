package com.questrail.diameter.dict;

import java.util.Optional;

/**
 * Dictionary
 * -----------------------------------------------------------------------------
 * Read-only view of the Diameter schema used for command dispatch.
 *
 * <p>The connection core needs exactly one query: map an
 * {@code (applicationId, commandCode)} pair to the command's short name
 * (for example {@code "CC"} for Credit-Control). The multiplexer appends
 * {@code "R"} or {@code "A"} to that name to build its dispatch key.</p>
 *
 * <p>Loading and parsing schema definitions is outside this interface.
 * Implementations must be safe for concurrent lookups.</p>
 */
public interface Dictionary
{
    /**
     * Resolve the short name of a command.
     *
     * @param applicationId the application id from the message header
     * @param commandCode   the command code from the message header
     * @return the short name, or {@link Optional#empty()} when the dictionary
     *         has no entry for this application and code
     */
    Optional<String> findCommand(long applicationId, int commandCode);
}
