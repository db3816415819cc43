package com.questrail.diameter.server;

import java.io.IOException;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The {@link Conn} handed to handlers for one peer connection.
 *
 * <p>Writes from concurrent handler threads are serialized so that encoded
 * messages never interleave on the wire. The context is created lazily and
 * guarded by its own lock, so reading it never waits behind a slow write.</p>
 */
final class ConnHandle implements Conn, CloseNotifier
{
    private final PeerConnection connection;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final ReentrantLock contextLock = new ReentrantLock();

    // Guarded by contextLock.
    private ConnContext context;

    ConnHandle(PeerConnection connection) {
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    @Override
    public int write(byte[] bytes) throws IOException {
        Objects.requireNonNull(bytes, "bytes");
        writeLock.lock();
        try {
            return connection.write(bytes);
        }
        finally {
            writeLock.unlock();
        }
    }

    @Override
    public void close() {
        connection.closeLocally();
    }

    @Override
    public SocketAddress localAddress() {
        return connection.localAddress();
    }

    @Override
    public SocketAddress remoteAddress() {
        return connection.remoteAddress();
    }

    @Override
    public Optional<TlsConnectionState> tls() {
        return connection.tlsState();
    }

    @Override
    public ConnContext context() {
        contextLock.lock();
        try {
            if (context == null) {
                context = ConnContext.empty();
            }
            return context;
        }
        finally {
            contextLock.unlock();
        }
    }

    @Override
    public void setContext(ConnContext context) {
        Objects.requireNonNull(context, "context");
        contextLock.lock();
        try {
            this.context = context;
        }
        finally {
            contextLock.unlock();
        }
    }

    @Override
    public CompletionStage<Void> closeNotify() {
        return connection.closeNotify();
    }

    @Override
    public String toString() {
        return "Conn[" + remoteAddress() + ']';
    }
}
