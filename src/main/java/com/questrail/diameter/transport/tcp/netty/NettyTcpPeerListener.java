package com.questrail.diameter.transport.tcp.netty;

import com.questrail.diameter.message.PayloadMessageReader;
import com.questrail.diameter.transport.PeerChannel;
import com.questrail.diameter.transport.PeerListener;
import com.questrail.diameter.transport.tls.TlsSettings;
import com.questrail.diameter.transport.tls.netty.NettyTlsContextFactory;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.SocketException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpPeerListener
 * =============================================================================
 * Netty-backed implementation of the {@link PeerListener} port for Diameter
 * over TCP, optionally with TLS.
 *
 * <h2>Architectural Role</h2>
 * This class is a transport adapter. It binds the server channel, frames
 * inbound bytes into whole messages and hands accepted connections out as
 * {@link PeerChannel}s. It does not decode messages or dispatch them.
 *
 * <h2>Accepting</h2>
 * The server channel does not read on its own: each {@link #accept()} call
 * asks it for the next connection. Accept failures are not retried here;
 * they are handed to the caller of {@code accept()}, whose accept loop
 * decides whether to back off and try again.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Lifecycle</h2>
 * - {@link #bind(InetSocketAddress)} / {@link #bindTls} bind before returning.
 * - {@link #close()} stops accepting and releases the accept thread. The I/O
 *   threads are released once every connection accepted so far has closed.
 */
public final class NettyTcpPeerListener implements PeerListener
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpPeerListener.class);

    private static final int BACKLOG = 128;
    private static final long ACCEPT_POLL_MILLIS = 200;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 2;

    private static final Object CLOSED = new Object();

    private final EventLoopGroup acceptGroup;
    private final EventLoopGroup ioGroup;
    private final ServerBootstrap bootstrap;
    private final ChannelGroup children = new DefaultChannelGroup("diameter-peers", GlobalEventExecutor.INSTANCE);

    private final BlockingQueue<Object> accepted = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile Channel serverChannel;

    private NettyTcpPeerListener(SslContext sslContext, int maxMessageLength) {
        this.acceptGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("diameter-accept", true));
        this.ioGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("diameter-io", true));
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(acceptGroup, ioGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, BACKLOG)
                .option(ChannelOption.AUTO_READ, false)
                .handler(new AcceptFailureHandler())
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        SslHandler tls = sslContext == null ? null : sslContext.newHandler(ch.alloc());
                        NettyPeerChannel peer = new NettyPeerChannel(ch, tls);

                        ChannelPipeline p = ch.pipeline();
                        if (tls != null) {
                            p.addLast("tls", tls);
                        }
                        p.addLast("framer", new DiameterFrameDecoder(maxMessageLength));
                        p.addLast("inbound", peer.inboundHandler());

                        if (closed.get()) {
                            ch.close();
                            return;
                        }
                        children.add(ch);
                        accepted.offer(peer);
                    }
                });
    }

    /**
     * Bind a plain TCP listener on {@code address}.
     */
    public static NettyTcpPeerListener bind(InetSocketAddress address) throws IOException {
        return bind(address, null, PayloadMessageReader.MAX_MESSAGE_LENGTH);
    }

    /**
     * Load the key material and bind a TLS listener on {@code address}.
     * Nothing is bound if the key material cannot be loaded.
     *
     * @throws com.questrail.diameter.config.DiameterConfigurationException if
     *         the certificate or key cannot be loaded
     */
    public static NettyTcpPeerListener bindTls(InetSocketAddress address,
                                               Path certChainFile,
                                               Path keyFile,
                                               TlsSettings settings) throws IOException {
        SslContext sslContext = NettyTlsContextFactory.serverContext(certChainFile, keyFile, settings);
        return bind(address, sslContext, PayloadMessageReader.MAX_MESSAGE_LENGTH);
    }

    static NettyTcpPeerListener bind(InetSocketAddress address, SslContext sslContext, int maxMessageLength)
            throws IOException {
        Objects.requireNonNull(address, "address");
        NettyTcpPeerListener listener = new NettyTcpPeerListener(sslContext, maxMessageLength);
        ChannelFuture bound = listener.bootstrap.bind(address).awaitUninterruptibly();
        if (!bound.isSuccess()) {
            listener.releaseThreads();
            throw NettyPeerChannel.asIOException(bound.cause());
        }
        listener.serverChannel = bound.channel();
        log.info("DIAM: listening on {}{}", bound.channel().localAddress(), sslContext != null ? " (TLS)" : "");
        return listener;
    }

    @Override
    public PeerChannel accept() throws IOException {
        Object next = accepted.poll();
        try {
            while (next == null) {
                serverChannel.read();
                next = accepted.poll(ACCEPT_POLL_MILLIS, TimeUnit.MILLISECONDS);
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("interrupted while accepting");
            interrupted.initCause(e);
            throw interrupted;
        }
        if (next == CLOSED) {
            accepted.offer(CLOSED);
            throw new SocketException("listener on " + localAddress() + " is closed");
        }
        if (next instanceof IOException failure) {
            throw failure;
        }
        return (PeerChannel) next;
    }

    @Override
    public SocketAddress localAddress() {
        Channel ch = serverChannel;
        return ch == null ? null : ch.localAddress();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        // Connections accepted by Netty but never handed out have no serving loop.
        Object pending;
        while ((pending = accepted.poll()) != null) {
            if (pending instanceof PeerChannel peer) {
                peer.close();
            }
        }
        accepted.offer(CLOSED);

        acceptGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        children.newCloseFuture().addListener(f -> ioGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS));
        log.info("DIAM: listener on {} closed", ch == null ? null : ch.localAddress());
    }

    private void releaseThreads() {
        acceptGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        ioGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    @Override
    public String toString() {
        return "NettyTcpPeerListener[" + localAddress() + ']';
    }

    /**
     * AcceptFailureHandler
     * -------------------------------------------------------------------------
     * Sits on the server channel and turns accept failures into results of
     * {@link #accept()}. They are not passed further down the pipeline, so
     * Netty applies no backoff of its own.
     */
    private final class AcceptFailureHandler extends ChannelInboundHandlerAdapter
    {
        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            accepted.offer(NettyPeerChannel.asIOException(cause));
        }
    }
}
