package com.questrail.diameter.server;

import java.io.ByteArrayOutputStream;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Optional;

/**
 * In-memory {@link Conn} that records writes.
 */
final class RecordingConn implements Conn
{
    private final ByteArrayOutputStream written = new ByteArrayOutputStream();
    private ConnContext context = ConnContext.empty();
    private boolean closed;

    @Override
    public synchronized int write(byte[] bytes) {
        written.writeBytes(bytes);
        return bytes.length;
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    @Override
    public SocketAddress localAddress() {
        return new InetSocketAddress("127.0.0.1", 3868);
    }

    @Override
    public SocketAddress remoteAddress() {
        return new InetSocketAddress("127.0.0.1", 40000);
    }

    @Override
    public Optional<TlsConnectionState> tls() {
        return Optional.empty();
    }

    @Override
    public synchronized ConnContext context() {
        return context;
    }

    @Override
    public synchronized void setContext(ConnContext context) {
        this.context = context;
    }

    synchronized byte[] written() {
        return written.toByteArray();
    }

    synchronized boolean isClosed() {
        return closed;
    }
}
