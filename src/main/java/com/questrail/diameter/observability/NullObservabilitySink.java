package com.questrail.diameter.observability;

import java.net.SocketAddress;
import java.time.Duration;

/**
 * No-op implementation of DiameterObservabilitySink.
 */
public final class NullObservabilitySink implements DiameterObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onConnectionOpened(SocketAddress remote) {}

    @Override
    public void onConnectionClosed(SocketAddress remote) {}

    @Override
    public void onAcceptRetry(Throwable cause, Duration delay) {}

    @Override
    public void onError(DiameterErrorEvent event) {}
}
