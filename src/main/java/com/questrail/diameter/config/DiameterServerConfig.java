package com.questrail.diameter.config;

import com.questrail.diameter.dict.Dictionary;
import com.questrail.diameter.dict.StaticDictionary;
import com.questrail.diameter.message.MessageReader;
import com.questrail.diameter.message.PayloadMessageReader;
import com.questrail.diameter.observability.DiameterObservabilitySink;
import com.questrail.diameter.observability.Slf4jDiameterObservabilitySink;
import com.questrail.diameter.server.Handler;
import com.questrail.diameter.server.ServeMux;
import com.questrail.diameter.transport.AcceptErrorClassifier;
import com.questrail.diameter.transport.ConnectionExecutionStrategy;
import com.questrail.diameter.transport.UnboundedConnectionStrategy;
import com.questrail.diameter.transport.tls.TlsSettings;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * DiameterServerConfig
 * -----------------------------------------------------------------------------
 * Aggregated configuration for a {@code DiameterServer}.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>address</b>: listen address; defaults to the wildcard address on port 3868</li>
 *   <li><b>handler</b>: invoked once per inbound message; defaults to a new, empty {@link ServeMux}</li>
 *   <li><b>dictionary</b>: resolves command names; defaults to the base protocol commands</li>
 *   <li><b>messageReader</b>: frames messages off the stream</li>
 *   <li><b>readTimeout</b>: maximum wait for each inbound message; zero disables it</li>
 *   <li><b>writeTimeout</b>: maximum duration of each write; zero disables it.
 *       A write that overruns fails, and its connection stays open.</li>
 *   <li><b>tlsSettings</b>: options applied when serving over TLS</li>
 *   <li><b>connectionStrategy</b>: creates the strategy deciding where
 *       connection loops run. Each server calls it once and owns, and
 *       eventually closes, the strategy it gets, so one configuration can
 *       back any number of servers.</li>
 *   <li><b>acceptErrorClassifier</b>: which accept failures are retried</li>
 *   <li><b>observabilitySink</b>: lifecycle and fault events; defaults to SLF4J</li>
 * </ul>
 */
public record DiameterServerConfig(
        InetSocketAddress address,
        Handler handler,
        Dictionary dictionary,
        MessageReader messageReader,
        Duration readTimeout,
        Duration writeTimeout,
        TlsSettings tlsSettings,
        Supplier<? extends ConnectionExecutionStrategy> connectionStrategy,
        AcceptErrorClassifier acceptErrorClassifier,
        DiameterObservabilitySink observabilitySink
) {
    public static final int DEFAULT_PORT = 3868;

    public DiameterServerConfig {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(dictionary, "dictionary");
        Objects.requireNonNull(messageReader, "messageReader");
        Objects.requireNonNull(readTimeout, "readTimeout");
        Objects.requireNonNull(writeTimeout, "writeTimeout");
        Objects.requireNonNull(tlsSettings, "tlsSettings");
        Objects.requireNonNull(connectionStrategy, "connectionStrategy");
        Objects.requireNonNull(acceptErrorClassifier, "acceptErrorClassifier");
        Objects.requireNonNull(observabilitySink, "observabilitySink");

        if (readTimeout.isNegative()) {
            throw new IllegalArgumentException("readTimeout must be non-negative");
        }
        if (writeTimeout.isNegative()) {
            throw new IllegalArgumentException("writeTimeout must be non-negative");
        }
    }

    /**
     * Parse a {@code host:port} listen address. An empty string, or an empty
     * host as in {@code ":3868"}, selects the wildcard address; a missing
     * port selects {@value #DEFAULT_PORT}. IPv6 hosts are written in brackets.
     */
    public static InetSocketAddress parseAddress(String address) {
        if (address == null || address.isBlank()) {
            return new InetSocketAddress(DEFAULT_PORT);
        }
        String host = address;
        int port = DEFAULT_PORT;
        int colon = address.lastIndexOf(':');
        int bracket = address.lastIndexOf(']');
        if (colon > bracket) {
            host = address.substring(0, colon);
            String portText = address.substring(colon + 1);
            if (!portText.isEmpty()) {
                try {
                    port = Integer.parseInt(portText);
                }
                catch (NumberFormatException e) {
                    throw new DiameterConfigurationException("DIAM: invalid port in address " + address, e);
                }
            }
        }
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        if (port < 0 || port > 0xFFFF) {
            throw new DiameterConfigurationException("DIAM: port out of range in address " + address);
        }
        return host.isEmpty() ? new InetSocketAddress(port) : new InetSocketAddress(host, port);
    }

    public static DiameterServerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress address = new InetSocketAddress(DEFAULT_PORT);
        private Handler handler;
        private Dictionary dictionary;
        private MessageReader messageReader = new PayloadMessageReader();
        private Duration readTimeout = Duration.ZERO;
        private Duration writeTimeout = Duration.ZERO;
        private TlsSettings tlsSettings = TlsSettings.defaults();
        private Supplier<? extends ConnectionExecutionStrategy> connectionStrategy;
        private AcceptErrorClassifier acceptErrorClassifier = AcceptErrorClassifier.DEFAULT;
        private DiameterObservabilitySink observabilitySink;

        public Builder withAddress(InetSocketAddress address) {
            this.address = address;
            return this;
        }

        public Builder withAddress(String address) {
            this.address = parseAddress(address);
            return this;
        }

        public Builder withHandler(Handler handler) {
            this.handler = handler;
            return this;
        }

        public Builder withDictionary(Dictionary dictionary) {
            this.dictionary = dictionary;
            return this;
        }

        public Builder withMessageReader(MessageReader messageReader) {
            this.messageReader = messageReader;
            return this;
        }

        public Builder withReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder withWriteTimeout(Duration writeTimeout) {
            this.writeTimeout = writeTimeout;
            return this;
        }

        public Builder withTlsSettings(TlsSettings tlsSettings) {
            this.tlsSettings = tlsSettings;
            return this;
        }

        /**
         * @param connectionStrategy called once by each server built from
         *        this configuration; it must return a new strategy per call
         */
        public Builder withConnectionStrategy(Supplier<? extends ConnectionExecutionStrategy> connectionStrategy) {
            this.connectionStrategy = connectionStrategy;
            return this;
        }

        public Builder withAcceptErrorClassifier(AcceptErrorClassifier acceptErrorClassifier) {
            this.acceptErrorClassifier = acceptErrorClassifier;
            return this;
        }

        public Builder withObservabilitySink(DiameterObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public DiameterServerConfig build() {
            return new DiameterServerConfig(
                    address,
                    handler != null ? handler : new ServeMux(),
                    dictionary != null ? dictionary : StaticDictionary.baseProtocol(),
                    messageReader,
                    readTimeout,
                    writeTimeout,
                    tlsSettings,
                    connectionStrategy != null ? connectionStrategy : UnboundedConnectionStrategy::new,
                    acceptErrorClassifier,
                    observabilitySink != null ? observabilitySink : new Slf4jDiameterObservabilitySink());
        }
    }
}
