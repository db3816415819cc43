package com.questrail.diameter.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a fault in the connection layer.
 *
 * @param remote the peer involved, or {@code null} for listener-level faults
 * @param cause  the underlying throwable, logged with its stack trace
 */
public record DiameterErrorEvent(
    Instant timestamp,
    String message,
    SocketAddress remote,
    Throwable cause
) {
}
