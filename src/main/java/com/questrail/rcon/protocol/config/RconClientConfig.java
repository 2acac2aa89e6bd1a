package com.questrail.rcon.protocol.config;

import com.questrail.rcon.protocol.codec.RconTextEncoding;
import com.questrail.rcon.protocol.model.RconProtocol;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection and protocol settings for one RCON client.
 *
 * @param maxPacketSize   largest encoded request in bytes; {@code 0} disables the check
 * @param responseTimeout how long a sent request may wait for its reply;
 *                        {@link Duration#ZERO} disables the timer
 * @param webSocketPath   request path used by {@link TransportKind#WEBSOCKET}
 */
public record RconClientConfig(
    String host,
    int port,
    int maxPacketSize,
    RconTextEncoding encoding,
    Duration responseTimeout,
    TransportKind transport,
    FragmentPolicy fragmentPolicy,
    String webSocketPath
) {
    public RconClientConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(encoding, "encoding");
        Objects.requireNonNull(responseTimeout, "responseTimeout");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(fragmentPolicy, "fragmentPolicy");
        Objects.requireNonNull(webSocketPath, "webSocketPath");

        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be 1-65535");
        }
        if (maxPacketSize < 0) {
            throw new IllegalArgumentException("maxPacketSize must be >= 0");
        }
        if (responseTimeout.isNegative()) {
            throw new IllegalArgumentException("responseTimeout must be non-negative");
        }
        if (!webSocketPath.startsWith("/")) {
            throw new IllegalArgumentException("webSocketPath must start with '/'");
        }
    }

    public boolean packetSizeLimited() {
        return maxPacketSize > 0;
    }

    public static RconClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = RconProtocol.DEFAULT_HOST;
        private int port = RconProtocol.DEFAULT_PORT;
        private int maxPacketSize = RconProtocol.DEFAULT_MAX_PACKET_SIZE;
        private RconTextEncoding encoding = RconTextEncoding.ASCII;
        private Duration responseTimeout = Duration.ofMillis(1000);
        private TransportKind transport = TransportKind.WEBSOCKET;
        private FragmentPolicy fragmentPolicy = FragmentPolicy.FIRST_FRAGMENT;
        private String webSocketPath = "/";

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withMaxPacketSize(int maxPacketSize) {
            this.maxPacketSize = maxPacketSize;
            return this;
        }

        public Builder withEncoding(RconTextEncoding encoding) {
            this.encoding = encoding;
            return this;
        }

        public Builder withResponseTimeout(Duration responseTimeout) {
            this.responseTimeout = responseTimeout;
            return this;
        }

        public Builder withTransport(TransportKind transport) {
            this.transport = transport;
            return this;
        }

        public Builder withFragmentPolicy(FragmentPolicy fragmentPolicy) {
            this.fragmentPolicy = fragmentPolicy;
            return this;
        }

        public Builder withWebSocketPath(String webSocketPath) {
            this.webSocketPath = webSocketPath;
            return this;
        }

        public RconClientConfig build() {
            return new RconClientConfig(host, port, maxPacketSize, encoding, responseTimeout,
                    transport, fragmentPolicy, webSocketPath);
        }
    }
}
