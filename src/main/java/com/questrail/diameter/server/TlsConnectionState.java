package com.questrail.diameter.server;

import javax.net.ssl.SSLPeerUnverifiedException;
import javax.net.ssl.SSLSession;
import java.security.cert.Certificate;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of a TLS session taken right after the handshake. It never
 * changes afterwards, even if the underlying session is renegotiated.
 *
 * @param peerCertificates empty when the peer did not authenticate
 */
public record TlsConnectionState(
        String protocol,
        String cipherSuite,
        List<Certificate> localCertificates,
        List<Certificate> peerCertificates
) {
    public TlsConnectionState {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(cipherSuite, "cipherSuite");
        localCertificates = List.copyOf(localCertificates);
        peerCertificates = List.copyOf(peerCertificates);
    }

    public boolean peerAuthenticated() {
        return !peerCertificates.isEmpty();
    }

    static TlsConnectionState capture(SSLSession session) {
        Certificate[] local = session.getLocalCertificates();
        Certificate[] peer;
        try {
            peer = session.getPeerCertificates();
        }
        catch (SSLPeerUnverifiedException e) {
            peer = null;
        }
        return new TlsConnectionState(
                session.getProtocol(),
                session.getCipherSuite(),
                local == null ? List.of() : List.of(local),
                peer == null ? List.of() : List.of(peer));
    }
}
