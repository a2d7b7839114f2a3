package com.questrail.unitbus.protocol.bus.config;

import com.questrail.unitbus.protocol.bus.model.BusByteOrder;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of a bus client connection.
 *
 * @param remoteAddress  address of the bus daemon's TCP listener
 * @param byteOrder      byte order used for outgoing messages
 * @param connectTimeout how long {@code open()} waits for the transport
 * @param callTimeout    how long a blocking call waits for its reply
 */
public record BusClientConfig(
    InetSocketAddress remoteAddress,
    BusByteOrder byteOrder,
    Duration connectTimeout,
    Duration callTimeout
) {
    public static final int DEFAULT_PORT = 55556;

    public BusClientConfig {
        Objects.requireNonNull(remoteAddress, "remoteAddress");
        Objects.requireNonNull(byteOrder, "byteOrder");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(callTimeout, "callTimeout");
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("callTimeout must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = "127.0.0.1";
        private int port = DEFAULT_PORT;
        private BusByteOrder byteOrder = BusByteOrder.LITTLE_ENDIAN;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration callTimeout = Duration.ofSeconds(25);

        public Builder withHost(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        public Builder withPort(int port) {
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("port out of range: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder withByteOrder(BusByteOrder byteOrder) {
            this.byteOrder = byteOrder;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
            return this;
        }

        public BusClientConfig build() {
            return new BusClientConfig(InetSocketAddress.createUnresolved(host, port),
                    byteOrder, connectTimeout, callTimeout);
        }
    }
}
