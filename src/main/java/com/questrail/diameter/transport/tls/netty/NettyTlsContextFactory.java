package com.questrail.diameter.transport.tls.netty;

import com.questrail.diameter.config.DiameterConfigurationException;
import com.questrail.diameter.transport.tls.ClientAuthMode;
import com.questrail.diameter.transport.tls.TlsSettings;
import io.netty.handler.ssl.ClientAuth;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;

import javax.net.ssl.SSLException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * NettyTlsContextFactory
 * -----------------------------------------------------------------------------
 * Loads PEM key material into a Netty server {@link SslContext}.
 *
 * <h2>Settings</h2>
 * The protocols, cipher suites, client authentication mode and trust
 * collection of {@link TlsSettings} are applied on the builder, so every
 * {@link io.netty.handler.ssl.SslHandler} created from the context carries
 * them.
 *
 * <h2>Netty Containment Rule</h2>
 * The context is consumed only by {@code transport.tcp.netty}; nothing
 * outside the Netty packages sees it.
 */
public final class NettyTlsContextFactory
{
    private NettyTlsContextFactory() {}

    /**
     * Build a server context from a certificate chain and private key.
     *
     * @throws DiameterConfigurationException if either file is missing or
     *         does not hold usable key material
     */
    public static SslContext serverContext(Path certChainFile, Path keyFile, TlsSettings settings) {
        Objects.requireNonNull(certChainFile, "certChainFile");
        Objects.requireNonNull(keyFile, "keyFile");
        Objects.requireNonNull(settings, "settings");

        requireReadable(certChainFile, "certificate");
        requireReadable(keyFile, "key");
        settings.trustCertCollectionIfPresent().ifPresent(p -> requireReadable(p, "trust collection"));

        try {
            SslContextBuilder builder = SslContextBuilder
                    .forServer(certChainFile.toFile(), keyFile.toFile())
                    .sslProvider(SslProvider.JDK)
                    .clientAuth(toNetty(settings.clientAuth()));
            if (!settings.protocols().isEmpty()) {
                builder.protocols(settings.protocols());
            }
            if (!settings.cipherSuites().isEmpty()) {
                builder.ciphers(settings.cipherSuites());
            }
            settings.trustCertCollectionIfPresent().ifPresent(p -> builder.trustManager(p.toFile()));
            return builder.build();
        }
        catch (SSLException | IllegalArgumentException e) {
            throw new DiameterConfigurationException(
                    "DIAM: cannot load TLS key material from " + certChainFile + " and " + keyFile, e);
        }
    }

    static ClientAuth toNetty(ClientAuthMode mode) {
        return switch (mode) {
            case NONE -> ClientAuth.NONE;
            case OPTIONAL -> ClientAuth.OPTIONAL;
            case REQUIRE -> ClientAuth.REQUIRE;
        };
    }

    private static void requireReadable(Path file, String what) {
        if (!Files.isReadable(file)) {
            throw new DiameterConfigurationException("DIAM: TLS " + what + " file not readable: " + file);
        }
    }
}
