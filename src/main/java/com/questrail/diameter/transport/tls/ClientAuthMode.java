package com.questrail.diameter.transport.tls;

/**
 * Whether a TLS listener asks connecting peers for a certificate.
 */
public enum ClientAuthMode
{
    /** No certificate is requested. */
    NONE,
    /** A certificate is requested; peers without one are still accepted. */
    OPTIONAL,
    /** Peers without a valid certificate fail the handshake. */
    REQUIRE
}
