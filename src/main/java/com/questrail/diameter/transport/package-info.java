/**
 * Stream transport ports for the Diameter server: the listener and channel
 * ports, accept error classification, and the strategies that decide where
 * each connection's serving loop runs.
 *
 * <p>Netty appears here only as a thread-naming utility. The Netty TCP/TLS
 * implementation of the ports lives in {@code transport.tcp.netty}, and
 * TLS key loading in {@code transport.tls.netty}.</p>
 */
package com.questrail.diameter.transport;
