/**
 * Netty implementation of the stream transport ports: a
 * {@link io.netty.bootstrap.ServerBootstrap} listener with optional TLS and
 * length-field framing of Diameter messages. Netty types stay inside this
 * package.
 */
package com.questrail.diameter.transport.tcp.netty;
