package com.questrail.modbus.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection configuration for a {@code ModbusTcpClient}.
 *
 * @param host           server host name or address
 * @param port           server TCP port (502 by default)
 * @param connectTimeout maximum time to establish the connection
 * @param readTimeout    maximum time to wait for response bytes
 */
public record ModbusClientConfig(
    String host,
    int port,
    Duration connectTimeout,
    Duration readTimeout
) {
    public static final int DEFAULT_PORT = 502;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(1000);

    /** Longest timeout accepted; the transport takes timeouts as int milliseconds. */
    public static final Duration MAX_TIMEOUT = Duration.ofMillis(Integer.MAX_VALUE);

    public ModbusClientConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(readTimeout, "readTimeout");

        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be 1-65535 (was " + port + ")");
        }
        checkTimeout("connectTimeout", connectTimeout);
        checkTimeout("readTimeout", readTimeout);
    }

    private static void checkTimeout(String name, Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        if (timeout.compareTo(MAX_TIMEOUT) > 0) {
            throw new IllegalArgumentException(name + " must not exceed " + MAX_TIMEOUT.toMillis() + " ms");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host;
        private int port = DEFAULT_PORT;
        private Duration connectTimeout = DEFAULT_TIMEOUT;
        private Duration readTimeout = DEFAULT_TIMEOUT;

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        /**
         * Sets connect and read timeout to the same value.
         */
        public Builder withTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            this.readTimeout = timeout;
            return this;
        }

        public ModbusClientConfig build() {
            return new ModbusClientConfig(host, port, connectTimeout, readTimeout);
        }
    }
}
