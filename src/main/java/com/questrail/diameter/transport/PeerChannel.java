package com.questrail.diameter.transport;

import javax.net.ssl.SSLSession;
import java.io.IOException;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * PeerChannel
 * -----------------------------------------------------------------------------
 * Transport-neutral port for one accepted peer stream.
 *
 * <p>The stream is already split into whole Diameter messages: each
 * {@link #readFrame(Duration)} returns the bytes of exactly one message
 * (header included). When a header announces a length no message can have,
 * the 20 header bytes are returned alone so the message reader can reject
 * them.</p>
 *
 * <h2>Threading</h2>
 * {@link #readFrame(Duration)} is called by a single serving thread.
 * {@link #write(byte[], Duration)} may be called from any thread except the
 * transport's own I/O threads; callers serialize writes themselves.
 */
public interface PeerChannel
{
    /**
     * Wait for the TLS handshake to finish.
     *
     * @param timeout zero waits without limit
     * @return the negotiated session, or empty for plain TCP
     * @throws IOException if the handshake fails or does not finish in time
     */
    Optional<SSLSession> awaitHandshake(Duration timeout) throws IOException;

    /**
     * Block until the next whole message has arrived.
     *
     * <p>The timeout is a deadline for the whole message, counted from this
     * call: a peer trickling a message in byte by byte does not extend it.</p>
     *
     * @param timeout zero waits without limit
     * @throws java.io.EOFException once the peer has closed the stream;
     *         bytes of an unfinished message are discarded
     * @throws java.net.SocketTimeoutException if no whole message arrived in time
     * @throws IOException if the transport failed
     */
    byte[] readFrame(Duration timeout) throws IOException;

    /**
     * Send {@code bytes} and wait until they have been handed to the network.
     *
     * <p>When the timeout passes first, a
     * {@link java.net.SocketTimeoutException} is thrown and the channel
     * stays open. Bytes not yet started are withdrawn; a write already in
     * progress may still complete later.</p>
     *
     * @param timeout zero waits without limit
     */
    void write(byte[] bytes, Duration timeout) throws IOException;

    /**
     * Completes exactly once, when the channel has closed for any reason.
     * Callbacks may run on a transport I/O thread and must not block.
     */
    CompletionStage<Void> closeFuture();

    boolean isOpen();

    /**
     * Close the channel. Idempotent.
     */
    void close();

    SocketAddress localAddress();

    SocketAddress remoteAddress();
}
