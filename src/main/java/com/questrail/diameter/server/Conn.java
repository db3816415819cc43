package com.questrail.diameter.server;

import com.questrail.diameter.message.Message;

import java.io.IOException;
import java.net.SocketAddress;
import java.util.Optional;

/**
 * Conn
 * -----------------------------------------------------------------------------
 * The peer connection as seen by a {@link Handler}: used to send messages and
 * to keep per-connection application state.
 *
 * <p>One {@code Conn} exists per accepted connection and lives as long as
 * the connection. Writes from several threads are serialized.</p>
 *
 * <p>Implementations returned by the server also implement
 * {@link CloseNotifier}.</p>
 */
public interface Conn
{
    /**
     * Write raw message bytes and flush them.
     *
     * <p>If a write timeout is configured and the write does not complete in
     * time, a {@link java.net.SocketTimeoutException} is thrown. The
     * connection is not closed by this; bytes already being sent may still
     * reach the peer, so the caller decides whether to close. Failed writes
     * are never retried.</p>
     *
     * @return number of bytes written
     * @throws IOException if the write or flush fails
     */
    int write(byte[] bytes) throws IOException;

    /**
     * Write the wire form of {@code message}.
     */
    default int write(Message message) throws IOException {
        return write(message.toBytes());
    }

    /**
     * Close the connection. The serving loop notices on its next read.
     */
    void close();

    SocketAddress localAddress();

    SocketAddress remoteAddress();

    /**
     * TLS state captured after the handshake, or empty for plain TCP.
     */
    Optional<TlsConnectionState> tls();

    /**
     * Returns the stored context, or {@link ConnContext#empty()} if none was set.
     */
    ConnContext context();

    /**
     * Replace the stored context.
     */
    void setContext(ConnContext context);
}
