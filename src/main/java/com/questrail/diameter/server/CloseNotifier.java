package com.questrail.diameter.server;

import java.util.concurrent.CompletionStage;

/**
 * Implemented by {@link Conn}s that can detect when the peer has gone away.
 *
 * <p>This mechanism can be used to detect that a peer disconnected while a
 * handler is still working on one of its messages.</p>
 */
public interface CloseNotifier
{
    /**
     * Returns a signal that completes exactly once, when the connection has
     * gone away: the peer closed it, it failed, or it was closed locally.
     * Every call returns the same signal. Messages still arriving do not
     * complete it.
     *
     * <p>Dependent actions may run on a transport I/O thread and must not
     * block.</p>
     */
    CompletionStage<Void> closeNotify();
}
