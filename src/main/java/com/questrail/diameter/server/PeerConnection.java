package com.questrail.diameter.server;

import com.questrail.diameter.config.DiameterServerConfig;
import com.questrail.diameter.message.Message;
import com.questrail.diameter.message.MessageReadException;
import com.questrail.diameter.observability.DiameterErrorEvent;
import com.questrail.diameter.observability.DiameterObservabilitySink;
import com.questrail.diameter.transport.PeerChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLSession;
import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.SocketAddress;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * PeerConnection
 * -----------------------------------------------------------------------------
 * Server side of one accepted peer channel.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>TLS channels complete their handshake first; a failed handshake closes
 *       the connection without reading anything.</li>
 *   <li>Messages are read strictly one at a time. Each is passed to the
 *       configured {@link Handler} on this connection's thread, and the next
 *       read starts only after the handler returns. With a read timeout
 *       configured, every message must arrive in full within it, counted
 *       from the start of its read.</li>
 *   <li>The first read failure closes the channel. A clean end of stream is
 *       silent; any other failure is delivered to the handler if it is an
 *       {@link ErrorReporter}, otherwise to the observability sink.</li>
 * </ol>
 *
 * <h2>Fault Barrier</h2>
 * Anything thrown by the handler, checked or not, is caught at the top of
 * {@link #run()}, logged with its stack trace, and ends only this connection.
 *
 * <h2>Writes</h2>
 * A write that overruns the write timeout fails with a
 * {@link java.net.SocketTimeoutException}; the connection stays open and the
 * serving loop is not affected.
 */
final class PeerConnection implements Runnable
{
    private static final Logger log = LoggerFactory.getLogger(PeerConnection.class);

    private final PeerChannel channel;
    private final DiameterServerConfig config;
    private final Consumer<PeerConnection> onExit;
    private final DiameterObservabilitySink sink;

    private final SocketAddress remote;
    private final ConnHandle handle;

    private final AtomicBoolean closedLocally = new AtomicBoolean();
    private volatile TlsConnectionState tlsState;

    /**
     * @param onExit called once when the connection has ended
     */
    PeerConnection(PeerChannel channel, DiameterServerConfig config, Consumer<PeerConnection> onExit) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.config = Objects.requireNonNull(config, "config");
        this.onExit = Objects.requireNonNull(onExit, "onExit");
        this.sink = config.observabilitySink();
        this.remote = channel.remoteAddress();
        this.handle = new ConnHandle(this);
    }

    @Override
    public void run() {
        sink.onConnectionOpened(remote);
        try {
            if (handshake()) {
                serve();
            }
        }
        catch (Throwable t) {
            sink.onError(new DiameterErrorEvent(
                    Instant.now(), "handler failed serving " + remote + ": " + t, remote, t));
        }
        finally {
            channel.close();
            onExit.accept(this);
            sink.onConnectionClosed(remote);
        }
    }

    private boolean handshake() {
        Optional<SSLSession> session;
        try {
            session = channel.awaitHandshake(config.readTimeout());
        }
        catch (IOException e) {
            log.debug("DIAM: TLS handshake with {} failed: {}", remote, e.toString());
            return false;
        }
        tlsState = session.map(TlsConnectionState::capture).orElse(null);
        return true;
    }

    private void serve() {
        Handler handler = config.handler();
        while (true) {
            Message message;
            try {
                byte[] frame = channel.readFrame(config.readTimeout());
                message = config.messageReader().read(new ByteArrayInputStream(frame), config.dictionary());
            }
            catch (IOException e) {
                channel.close();
                if (!isQuietEnd(e)) {
                    reportReadFailure(handler, e);
                }
                return;
            }
            handler.serveMessage(handle, message);
        }
    }

    /**
     * End of stream, including one that cuts a message short, and failures
     * caused by closing the channel from this side are not faults.
     */
    private boolean isQuietEnd(IOException e) {
        return e instanceof EOFException || closedLocally.get();
    }

    private void reportReadFailure(Handler handler, IOException e) {
        if (handler instanceof ErrorReporter reporter) {
            Message partial = (e instanceof MessageReadException mre) ? mre.partialMessage().orElse(null) : null;
            reporter.error(new ErrorReport(handle, partial, e));
        } else {
            sink.onError(new DiameterErrorEvent(Instant.now(), "read from " + remote + " failed", remote, e));
        }
    }

    int write(byte[] bytes) throws IOException {
        channel.write(bytes, config.writeTimeout());
        return bytes.length;
    }

    CompletionStage<Void> closeNotify() {
        return channel.closeFuture();
    }

    void closeLocally() {
        closedLocally.set(true);
        channel.close();
    }

    Conn conn() {
        return handle;
    }

    SocketAddress localAddress() {
        return channel.localAddress();
    }

    SocketAddress remoteAddress() {
        return remote;
    }

    Optional<TlsConnectionState> tlsState() {
        return Optional.ofNullable(tlsState);
    }

    @Override
    public String toString() {
        return "PeerConnection[" + remote + ']';
    }
}
