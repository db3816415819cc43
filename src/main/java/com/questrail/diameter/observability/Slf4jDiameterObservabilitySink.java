package com.questrail.diameter.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.time.Duration;

/**
 * Production implementation of DiameterObservabilitySink that emits logs via SLF4J.
 * This is the default sink of a server configuration.
 */
public final class Slf4jDiameterObservabilitySink implements DiameterObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDiameterObservabilitySink.class);

    @Override
    public void onConnectionOpened(SocketAddress remote) {
        log.debug("DIAM: connection from {}", remote);
    }

    @Override
    public void onConnectionClosed(SocketAddress remote) {
        log.debug("DIAM: connection from {} closed", remote);
    }

    @Override
    public void onAcceptRetry(Throwable cause, Duration delay) {
        log.warn("DIAM: Accept error: {}; retrying in {}ms", cause.toString(), delay.toMillis());
    }

    @Override
    public void onError(DiameterErrorEvent event) {
        if (event.remote() != null) {
            log.error("DIAM: {} ({})", event.message(), event.remote(), event.cause());
        } else {
            log.error("DIAM: {}", event.message(), event.cause());
        }
    }
}
