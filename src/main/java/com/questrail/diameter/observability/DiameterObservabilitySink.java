package com.questrail.diameter.observability;

import java.net.SocketAddress;
import java.time.Duration;

/**
 * Main interface for receiving connection-layer observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive from connection threads and from the accept loop
 * concurrently; implementations must be thread-safe and must not block.</p>
 */
public interface DiameterObservabilitySink {
    /**
     * Called when a peer connection has been accepted.
     * @param remote the peer address
     */
    void onConnectionOpened(SocketAddress remote);

    /**
     * Called once a peer connection's serving loop has exited and its channel is closed.
     * @param remote the peer address
     */
    void onConnectionClosed(SocketAddress remote);

    /**
     * Called when a temporary accept failure is retried after a backoff.
     * @param cause the accept failure
     * @param delay the delay before the next attempt
     */
    void onAcceptRetry(Throwable cause, Duration delay);

    /**
     * Called for faults that no handler will see: handler failures, read
     * faults when the handler does not report errors, refused admissions.
     * @param event the error event
     */
    void onError(DiameterErrorEvent event);
}
