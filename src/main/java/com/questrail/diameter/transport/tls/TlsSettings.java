package com.questrail.diameter.transport.tls;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TlsSettings
 * -----------------------------------------------------------------------------
 * Operational TLS options applied to a listener before it accepts peers.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>protocols</b>: enabled protocol versions; empty keeps the JDK defaults</li>
 *   <li><b>cipherSuites</b>: enabled suites; empty keeps the JDK defaults</li>
 *   <li><b>clientAuth</b>: whether peer certificates are requested</li>
 *   <li><b>trustCertCollection</b>: PEM file of CA certificates used to verify
 *       peer certificates; {@code null} uses the JDK trust store</li>
 * </ul>
 *
 * <p>The server's own certificate chain and key are not part of these
 * settings; they are supplied when TLS serving starts.</p>
 */
public record TlsSettings(
        List<String> protocols,
        List<String> cipherSuites,
        ClientAuthMode clientAuth,
        Path trustCertCollection
) {
    public TlsSettings {
        protocols = List.copyOf(Objects.requireNonNull(protocols, "protocols"));
        cipherSuites = List.copyOf(Objects.requireNonNull(cipherSuites, "cipherSuites"));
        Objects.requireNonNull(clientAuth, "clientAuth");
    }

    /**
     * JDK default protocols and suites, no client authentication.
     */
    public static TlsSettings defaults() {
        return new TlsSettings(List.of(), List.of(), ClientAuthMode.NONE, null);
    }

    public Optional<Path> trustCertCollectionIfPresent() {
        return Optional.ofNullable(trustCertCollection);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<String> protocols = List.of();
        private List<String> cipherSuites = List.of();
        private ClientAuthMode clientAuth = ClientAuthMode.NONE;
        private Path trustCertCollection;

        public Builder withProtocols(String... protocols) {
            this.protocols = List.of(protocols);
            return this;
        }

        public Builder withCipherSuites(String... cipherSuites) {
            this.cipherSuites = List.of(cipherSuites);
            return this;
        }

        public Builder withClientAuth(ClientAuthMode clientAuth) {
            this.clientAuth = clientAuth;
            return this;
        }

        public Builder withTrustCertCollection(Path trustCertCollection) {
            this.trustCertCollection = trustCertCollection;
            return this;
        }

        public TlsSettings build() {
            return new TlsSettings(protocols, cipherSuites, clientAuth, trustCertCollection);
        }
    }
}
