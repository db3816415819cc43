package com.questrail.diameter.transport;

/**
 * ConnectionExecutionStrategy
 * -----------------------------------------------------------------------------
 * Decides where the serving loop of each accepted connection runs.
 *
 * <p>Every connection runs isolated from the accept loop and from the other
 * connections. The strategy only decides how many may run at once:</p>
 * <ul>
 *   <li>{@link UnboundedConnectionStrategy}: one new thread per connection, no limit</li>
 *   <li>{@link BoundedConnectionStrategy}: a fixed number of workers; a
 *       connection beyond the limit is refused</li>
 * </ul>
 */
public interface ConnectionExecutionStrategy extends AutoCloseable
{
    /**
     * Start running {@code connectionTask}.
     *
     * @return {@code false} if the connection was refused admission; the
     *         caller then closes the channel
     */
    boolean execute(Runnable connectionTask);

    /**
     * Release worker resources. Connections that are still running are not
     * interrupted.
     */
    @Override
    void close();
}
