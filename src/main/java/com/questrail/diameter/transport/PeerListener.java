package com.questrail.diameter.transport;

import java.io.Closeable;
import java.io.IOException;
import java.net.SocketAddress;

/**
 * PeerListener
 * -----------------------------------------------------------------------------
 * Minimal port for a stream listener that hands out accepted peers.
 *
 * <p>The accept loop in {@code DiameterServer} is written against this port
 * only. The production implementation is
 * {@link com.questrail.diameter.transport.tcp.netty.NettyTcpPeerListener};
 * tests use a double that scripts accept failures.</p>
 */
public interface PeerListener extends Closeable
{
    /**
     * Block until a peer connects.
     *
     * <p>For TLS listeners the handshake of the returned channel may still be
     * running; see {@link PeerChannel#awaitHandshake}.</p>
     *
     * @throws IOException on accept failure; after {@link #close()} every
     *         call fails
     */
    PeerChannel accept() throws IOException;

    /**
     * The bound local address.
     */
    SocketAddress localAddress();

    /**
     * Stop listening. Unblocks a pending {@link #accept()}. Channels already
     * accepted are not closed.
     */
    @Override
    void close() throws IOException;
}
