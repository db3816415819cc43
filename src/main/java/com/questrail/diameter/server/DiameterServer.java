package com.questrail.diameter.server;

import com.questrail.diameter.config.DiameterServerConfig;
import com.questrail.diameter.dict.Dictionary;
import com.questrail.diameter.internal.time.Sleeper;
import com.questrail.diameter.observability.DiameterErrorEvent;
import com.questrail.diameter.observability.DiameterObservabilitySink;
import com.questrail.diameter.transport.ConnectionExecutionStrategy;
import com.questrail.diameter.transport.PeerChannel;
import com.questrail.diameter.transport.PeerListener;
import com.questrail.diameter.transport.tcp.netty.NettyTcpPeerListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DiameterServer
 * -----------------------------------------------------------------------------
 * Accepts Diameter peers on a stream listener and serves each one on its own
 * {@link PeerConnection}.
 *
 * <h2>Accept Loop</h2>
 * <ul>
 *   <li>A temporary accept failure (see
 *       {@link com.questrail.diameter.transport.AcceptErrorClassifier}) is
 *       retried after 5ms, doubling per consecutive failure up to one second.</li>
 *   <li>Any other failure closes the listener and is thrown to the caller of
 *       {@link #serve(PeerListener)}.</li>
 *   <li>Each accepted channel is handed to the server's
 *       {@link ConnectionExecutionStrategy}; a channel it refuses is closed
 *       and logged.</li>
 * </ul>
 *
 * <h2>Ownership</h2>
 * A server serves once. It creates its connection strategy from the
 * configuration's factory and closes it, together with the listener, when
 * {@code serve} ends for any reason. Connections already running are left
 * to finish. The configuration itself is never changed and can be reused.
 *
 * <h2>Shutdown</h2>
 * {@link #shutdown()} closes the listener and every live connection; the
 * {@code serve} call that was running then returns normally.
 */
public final class DiameterServer
{
    private static final Logger log = LoggerFactory.getLogger(DiameterServer.class);

    private final DiameterServerConfig config;
    private final Sleeper sleeper;
    private final DiameterObservabilitySink sink;
    private final ConnectionExecutionStrategy connectionStrategy;
    private final AtomicBoolean strategyClosed = new AtomicBoolean();

    private final Set<PeerConnection> live = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean shuttingDown = new AtomicBoolean();
    private volatile PeerListener listener;

    public DiameterServer(DiameterServerConfig config) {
        this(config, Sleeper.SYSTEM);
    }

    DiameterServer(DiameterServerConfig config, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.sink = config.observabilitySink();
        this.connectionStrategy = Objects.requireNonNull(
                config.connectionStrategy().get(), "connection strategy factory returned null");
    }

    // ---------------------------------------------------------------------
    // Static conveniences
    // ---------------------------------------------------------------------

    /**
     * Serve {@code listener} with default settings. A {@code null} handler
     * selects an empty {@link ServeMux}.
     */
    public static void serve(PeerListener listener, Handler handler) throws IOException {
        new DiameterServer(DiameterServerConfig.builder().withHandler(handler).build()).serve(listener);
    }

    /**
     * Listen on {@code address} ({@code host:port}, default {@code :3868}) and serve.
     * {@code null} handler or dictionary select the defaults.
     */
    public static void listenAndServe(String address, Handler handler, Dictionary dictionary) throws IOException {
        new DiameterServer(DiameterServerConfig.builder()
                .withAddress(address)
                .withHandler(handler)
                .withDictionary(dictionary)
                .build()).listenAndServe();
    }

    /**
     * As {@link #listenAndServe(String, Handler, Dictionary)}, over TLS with the
     * given PEM certificate chain and PKCS#8 private key.
     */
    public static void listenAndServeTls(String address,
                                         Path certFile,
                                         Path keyFile,
                                         Handler handler,
                                         Dictionary dictionary) throws IOException {
        new DiameterServer(DiameterServerConfig.builder()
                .withAddress(address)
                .withHandler(handler)
                .withDictionary(dictionary)
                .build()).listenAndServeTls(certFile, keyFile);
    }

    // ---------------------------------------------------------------------
    // Serving
    // ---------------------------------------------------------------------

    /**
     * Bind the configured address and serve until shutdown or a permanent
     * accept failure.
     */
    public void listenAndServe() throws IOException {
        NettyTcpPeerListener bound;
        try {
            bound = NettyTcpPeerListener.bind(config.address());
        }
        catch (IOException | RuntimeException e) {
            closeStrategy();
            throw e;
        }
        serve(bound);
    }

    /**
     * Load the key material, bind a TLS listener on the configured address,
     * and serve. Nothing is bound if the key material cannot be loaded.
     *
     * @throws com.questrail.diameter.config.DiameterConfigurationException if
     *         the certificate or key cannot be loaded
     */
    public void listenAndServeTls(Path certFile, Path keyFile) throws IOException {
        NettyTcpPeerListener bound;
        try {
            bound = NettyTcpPeerListener.bindTls(config.address(), certFile, keyFile, config.tlsSettings());
        }
        catch (IOException | RuntimeException e) {
            closeStrategy();
            throw e;
        }
        serve(bound);
    }

    /**
     * Run the accept loop on {@code listener}. The listener and the
     * connection strategy are closed when this method returns.
     *
     * @throws IOException the first accept failure that is not temporary
     */
    public void serve(PeerListener listener) throws IOException {
        Objects.requireNonNull(listener, "listener");
        this.listener = listener;
        AcceptBackoff backoff = new AcceptBackoff();
        try {
            while (!shuttingDown.get()) {
                PeerChannel channel;
                try {
                    channel = listener.accept();
                }
                catch (IOException e) {
                    if (shuttingDown.get()) {
                        return;
                    }
                    if (!config.acceptErrorClassifier().isTemporary(e)) {
                        throw e;
                    }
                    Duration delay = backoff.next();
                    sink.onAcceptRetry(e, delay);
                    pause(delay);
                    continue;
                }
                backoff.reset();
                startConnection(channel);
            }
        }
        finally {
            closeListener(listener);
            closeStrategy();
        }
    }

    private void pause(Duration delay) throws InterruptedIOException {
        try {
            sleeper.sleep(delay);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("accept loop interrupted");
            interrupted.initCause(e);
            throw interrupted;
        }
    }

    private void startConnection(PeerChannel channel) {
        PeerConnection connection = new PeerConnection(channel, config, live::remove);
        live.add(connection);
        if (!connectionStrategy.execute(connection)) {
            live.remove(connection);
            sink.onError(new DiameterErrorEvent(
                    Instant.now(), "connection refused: admission limit reached", channel.remoteAddress(), null));
            connection.closeLocally();
            return;
        }
        if (shuttingDown.get()) {
            connection.closeLocally();
        }
    }

    /**
     * Close the listener and every live connection. Idempotent.
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        PeerListener current = listener;
        if (current != null) {
            closeListener(current);
        }
        for (PeerConnection connection : live) {
            connection.closeLocally();
        }
        closeStrategy();
    }

    private void closeStrategy() {
        if (strategyClosed.compareAndSet(false, true)) {
            connectionStrategy.close();
        }
    }

    /**
     * The address the current listener is bound to, once serving has started.
     */
    public Optional<SocketAddress> boundAddress() {
        PeerListener current = listener;
        return current == null ? Optional.empty() : Optional.ofNullable(current.localAddress());
    }

    /**
     * Number of connections currently being served.
     */
    public int liveConnections() {
        return live.size();
    }

    public DiameterServerConfig config() {
        return config;
    }

    private static void closeListener(PeerListener listener) {
        try {
            listener.close();
        }
        catch (IOException e) {
            log.debug("DIAM: error closing listener {}: {}", listener, e.toString());
        }
    }
}
