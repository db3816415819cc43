package com.questrail.diameter.transport.tcp.netty;

import com.questrail.diameter.transport.PeerChannel;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.ssl.SslHandler;
import io.netty.util.concurrent.Future;

import javax.net.ssl.SSLSession;
import java.io.EOFException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * NettyPeerChannel
 * -----------------------------------------------------------------------------
 * Netty-backed implementation of the {@link PeerChannel} port for one
 * accepted TCP or TLS connection.
 *
 * <h2>Inbound Path</h2>
 * The pipeline is {@code [SslHandler] -> DiameterFrameDecoder -> InboundHandler}.
 * Each whole frame is copied into a {@code byte[]} and queued for the serving
 * thread; all reference-counted buffers are released here. The channel keeps
 * reading while the serving thread is busy, so a peer that disconnects is
 * noticed at once. When {@value #HIGH_WATERMARK} frames are waiting, reading
 * pauses until the backlog drops to {@value #LOW_WATERMARK}.
 *
 * <h2>Deadlines</h2>
 * The read deadline applies to the wait for a whole frame, so it bounds the
 * time the peer takes to send an entire message. The write deadline bounds
 * the wait for the write future; it never closes the channel.
 *
 * <h2>Netty containment rule</h2>
 * Netty types do not escape this package.
 */
final class NettyPeerChannel implements PeerChannel
{
    static final int HIGH_WATERMARK = 32;
    static final int LOW_WATERMARK = 8;

    private static final Object END_OF_STREAM = new Object();

    private final Channel channel;
    private final SslHandler sslHandler;

    private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
    private final AtomicInteger pendingFrames = new AtomicInteger();
    private final CompletableFuture<Void> closed = new CompletableFuture<>();

    // Only touched by the serving thread.
    private Object terminal;

    /**
     * @param sslHandler the channel's TLS handler, or {@code null} for plain TCP
     */
    NettyPeerChannel(Channel channel, SslHandler sslHandler) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.sslHandler = sslHandler;
        channel.closeFuture().addListener(f -> closed.complete(null));
    }

    ChannelHandler inboundHandler() {
        return new InboundHandler();
    }

    @Override
    public Optional<SSLSession> awaitHandshake(Duration timeout) throws IOException {
        if (sslHandler == null) {
            return Optional.empty();
        }
        Future<Channel> handshake = sslHandler.handshakeFuture();
        if (!await(handshake, timeout, "TLS handshake")) {
            throw new SocketTimeoutException("TLS handshake not finished within " + timeout.toMillis() + "ms");
        }
        if (!handshake.isSuccess()) {
            throw asIOException(handshake.cause());
        }
        return Optional.of(sslHandler.engine().getSession());
    }

    @Override
    public byte[] readFrame(Duration timeout) throws IOException {
        Objects.requireNonNull(timeout, "timeout");
        Object next = terminal;
        if (next == null) {
            try {
                next = timeout.isZero()
                        ? inbound.take()
                        : inbound.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw interrupted("a message", e);
            }
        }
        if (next == null) {
            throw new SocketTimeoutException("read deadline of " + timeout.toMillis() + "ms exceeded");
        }
        if (next instanceof byte[] frame) {
            frameTaken();
            return frame;
        }
        terminal = next;
        if (next instanceof IOException failure) {
            throw failure;
        }
        throw new EOFException("peer " + remoteAddress() + " closed the connection");
    }

    private void frameTaken() {
        if (pendingFrames.decrementAndGet() == LOW_WATERMARK) {
            // Decided on the event loop, ordered after any pause it applied.
            channel.eventLoop().execute(() -> {
                if (pendingFrames.get() <= LOW_WATERMARK && !channel.config().isAutoRead()) {
                    channel.config().setAutoRead(true);
                }
            });
        }
    }

    @Override
    public void write(byte[] bytes, Duration timeout) throws IOException {
        Objects.requireNonNull(bytes, "bytes");
        Objects.requireNonNull(timeout, "timeout");
        // Copied: after a timeout the caller owns the array again while Netty may still hold the buffer.
        ChannelFuture written = channel.writeAndFlush(Unpooled.copiedBuffer(bytes));
        if (!await(written, timeout, "a write")) {
            if (written.cancel(false) || !written.isDone()) {
                throw new SocketTimeoutException("write deadline of " + timeout.toMillis() + "ms exceeded");
            }
        }
        if (!written.isSuccess()) {
            throw asIOException(written.cause());
        }
    }

    private boolean await(Future<?> future, Duration timeout, String what) throws InterruptedIOException {
        try {
            if (timeout.isZero()) {
                future.await();
                return true;
            }
            return future.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw interrupted(what, e);
        }
    }

    private InterruptedIOException interrupted(String what, InterruptedException cause) {
        InterruptedIOException e = new InterruptedIOException(
                "interrupted waiting for " + what + " on " + remoteAddress());
        e.initCause(cause);
        return e;
    }

    @Override
    public CompletionStage<Void> closeFuture() {
        return closed.minimalCompletionStage();
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() {
        channel.close();
    }

    @Override
    public SocketAddress localAddress() {
        return channel.localAddress();
    }

    @Override
    public SocketAddress remoteAddress() {
        return channel.remoteAddress();
    }

    @Override
    public String toString() {
        return "NettyPeerChannel[" + channel.remoteAddress() + (sslHandler != null ? ", tls]" : "]");
    }

    /**
     * Netty wraps failures of inbound handlers, TLS ones included, in a
     * {@link DecoderException}; callers get the underlying I/O error.
     */
    static IOException asIOException(Throwable cause) {
        Throwable t = (cause instanceof DecoderException && cause.getCause() != null) ? cause.getCause() : cause;
        if (t instanceof IOException io) {
            return io;
        }
        return new IOException(String.valueOf(t), t);
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Queues decoded frames and the end of the stream for the serving thread.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame) {
            byte[] bytes = new byte[frame.readableBytes()];
            frame.getBytes(frame.readerIndex(), bytes);

            if (pendingFrames.incrementAndGet() >= HIGH_WATERMARK) {
                ctx.channel().config().setAutoRead(false);
            }
            inbound.offer(bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            inbound.offer(END_OF_STREAM);
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            inbound.offer(asIOException(cause));
            ctx.close();
        }
    }
}
