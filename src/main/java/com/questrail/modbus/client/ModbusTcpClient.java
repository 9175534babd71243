package com.questrail.modbus.client;

import com.questrail.modbus.codec.ModbusRequestEncoder;
import com.questrail.modbus.codec.ModbusResponseDecoder;
import com.questrail.modbus.codec.impl.DefaultModbusRequestEncoder;
import com.questrail.modbus.codec.impl.DefaultModbusResponseDecoder;
import com.questrail.modbus.config.ModbusClientConfig;
import com.questrail.modbus.model.FunctionCode;
import com.questrail.modbus.model.ModbusReadRequest;
import com.questrail.modbus.model.ModbusReadResult;
import com.questrail.modbus.observability.ModbusErrorEvent;
import com.questrail.modbus.observability.ModbusExchangeEvent;
import com.questrail.modbus.observability.ModbusFrameEvent;
import com.questrail.modbus.observability.ModbusObservabilitySink;
import com.questrail.modbus.observability.ModbusTransportObservabilityEvent;
import com.questrail.modbus.observability.NullObservabilitySink;
import com.questrail.modbus.transport.ModbusStream;
import com.questrail.modbus.transport.ModbusStreamConnector;
import com.questrail.modbus.transport.ModbusTransportException;
import com.questrail.modbus.transport.tcp.netty.NettyTcpStreamConnector;

import java.io.Closeable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * ModbusTcpClient
 * =============================================================================
 * Composition root and owner of one Modbus TCP connection.
 *
 * <h2>Exchange</h2>
 * Each call to {@link #read(ModbusReadRequest)} performs exactly one
 * request/response exchange:
 *
 * <pre>
 *   ModbusReadRequest
 *        → ModbusRequestEncoder → ModbusStream.write
 *   ModbusStream.readFully(9)                       (MBAP + function + 1 byte)
 *        → exception echo?  done
 *        → otherwise readFully(expectedResponseLength - 9)
 *   → ModbusResponseDecoder → ModbusReadResult
 * </pre>
 *
 * <p>The read is sized from the request, never open-ended. A short read is a
 * {@link ModbusTransportException}.</p>
 *
 * <h2>Failed exchanges</h2>
 * <p>A transport failure or a {@link ModbusReadResult.ProtocolError} leaves the
 * position of the next frame on the stream unknown. The client closes the
 * connection in both cases; {@link #isConnected()} then reports {@code false}
 * and the caller must {@link #connect()} again. Server faults are complete
 * frames and keep the connection open.</p>
 *
 * <h2>Explicit Non-Responsibilities</h2>
 * This class MUST NOT:
 * <ul>
 *   <li>Retry a failed exchange or reconnect</li>
 *   <li>Pipeline requests or match out-of-order responses</li>
 *   <li>Interpret frame bytes itself beyond sizing the read</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Not thread-safe. One exchange may be in flight at a time; callers sharing a
 * client across threads must serialize access themselves.
 */
public final class ModbusTcpClient implements Closeable {
    /** Offset of the echoed function code within the response prefix. */
    private static final int FUNCTION_OFFSET = ModbusReadRequest.RESPONSE_HEADER_LENGTH - 1;

    private final ModbusClientConfig config;
    private final ModbusStreamConnector connector;
    private final ModbusRequestEncoder encoder;
    private final ModbusResponseDecoder decoder;
    private final ModbusObservabilitySink observabilitySink;

    private ModbusStream stream;

    private ModbusTcpClient(ModbusClientConfig config,
                            ModbusStreamConnector connector,
                            ModbusRequestEncoder encoder,
                            ModbusResponseDecoder decoder,
                            ModbusObservabilitySink observabilitySink) {
        this.config = config;
        this.connector = connector;
        this.encoder = encoder;
        this.decoder = decoder;
        this.observabilitySink = observabilitySink;
    }

    /**
     * Open the connection described by the configuration.
     *
     * @throws IllegalStateException    if already connected
     * @throws ModbusTransportException if the connection cannot be established
     */
    public void connect() throws ModbusTransportException {
        if (stream != null) {
            throw new IllegalStateException("Already connected");
        }
        try {
            stream = connector.connect(
                    config.host(), config.port(), config.connectTimeout(), config.readTimeout());
        } catch (ModbusTransportException e) {
            observabilitySink.onError(new ModbusErrorEvent(Instant.now(),
                    "Connect to " + config.host() + ":" + config.port() + " failed", e));
            throw e;
        }
        observabilitySink.onTransportEvent(new ModbusTransportObservabilityEvent(
                Instant.now(),
                ModbusTransportObservabilityEvent.Kind.CONNECTED,
                config.host(),
                config.port()));
    }

    public boolean isConnected() {
        return stream != null;
    }

    /**
     * Perform one read exchange.
     *
     * @param request validated request
     * @return decoded registers, server fault or protocol error
     * @throws IllegalStateException    if not connected
     * @throws ModbusTransportException if writing or reading the stream fails;
     *         the connection is closed first
     */
    public ModbusReadResult read(ModbusReadRequest request) throws ModbusTransportException {
        Objects.requireNonNull(request, "request");
        ModbusStream s = requireStream();

        final long startNanos = System.nanoTime();
        final byte[] adu = encoder.encode(request);

        final byte[] response;
        try {
            s.write(adu);
            observabilitySink.onFrame(new ModbusFrameEvent(Instant.now(), ModbusFrameEvent.Direction.SENT, adu));

            response = receive(s, request);
            observabilitySink.onFrame(new ModbusFrameEvent(Instant.now(), ModbusFrameEvent.Direction.RECEIVED, response));
        } catch (ModbusTransportException e) {
            observabilitySink.onError(new ModbusErrorEvent(Instant.now(),
                    "Exchange failed for transaction " + request.transactionId(), e));
            // Part of the response may still be in flight.
            close();
            throw e;
        }

        ModbusReadResult result = decoder.decode(request, response);
        observabilitySink.onExchange(new ModbusExchangeEvent(
                Instant.now(),
                request,
                result,
                Duration.ofNanos(System.nanoTime() - startNanos)));

        if (result instanceof ModbusReadResult.ProtocolError) {
            // The read was sized for a frame that did not arrive, so the
            // next frame boundary on the stream is unknown.
            close();
        }
        return result;
    }

    public ModbusReadResult readCoils(int transactionId, int unitId, int startingAddress, int quantity)
            throws ModbusTransportException {
        return read(request(FunctionCode.READ_COILS, transactionId, unitId, startingAddress, quantity));
    }

    public ModbusReadResult readDiscreteInputs(int transactionId, int unitId, int startingAddress, int quantity)
            throws ModbusTransportException {
        return read(request(FunctionCode.READ_DISCRETE_INPUTS, transactionId, unitId, startingAddress, quantity));
    }

    public ModbusReadResult readHoldingRegisters(int transactionId, int unitId, int startingAddress, int quantity)
            throws ModbusTransportException {
        return read(request(FunctionCode.READ_HOLDING_REGISTERS, transactionId, unitId, startingAddress, quantity));
    }

    public ModbusReadResult readInputRegisters(int transactionId, int unitId, int startingAddress, int quantity)
            throws ModbusTransportException {
        return read(request(FunctionCode.READ_INPUT_REGISTERS, transactionId, unitId, startingAddress, quantity));
    }

    /**
     * Close the connection if open. Idempotent. The client may be connected
     * again afterwards.
     */
    @Override
    public void close() {
        ModbusStream s = stream;
        if (s == null) {
            return;
        }
        stream = null;
        s.close();
        observabilitySink.onTransportEvent(new ModbusTransportObservabilityEvent(
                Instant.now(),
                ModbusTransportObservabilityEvent.Kind.DISCONNECTED,
                config.host(),
                config.port()));
    }

    public ModbusClientConfig config() {
        return config;
    }

    private ModbusStream requireStream() {
        ModbusStream s = stream;
        if (s == null) {
            throw new IllegalStateException("Not connected; call connect() first");
        }
        return s;
    }

    private static byte[] receive(ModbusStream s, ModbusReadRequest request) throws ModbusTransportException {
        byte[] prefix = s.readFully(ModbusReadRequest.MIN_RESPONSE_LENGTH);
        if ((prefix[FUNCTION_OFFSET] & FunctionCode.EXCEPTION_FLAG) != 0) {
            // Exception responses end after the exception code, whichever
            // function they echo.
            return prefix;
        }

        byte[] rest = s.readFully(request.expectedResponseLength() - ModbusReadRequest.MIN_RESPONSE_LENGTH);
        byte[] full = new byte[prefix.length + rest.length];
        System.arraycopy(prefix, 0, full, 0, prefix.length);
        System.arraycopy(rest, 0, full, prefix.length, rest.length);
        return full;
    }

    private static ModbusReadRequest request(FunctionCode fc,
                                             int transactionId,
                                             int unitId,
                                             int startingAddress,
                                             int quantity) {
        return ModbusReadRequest.builder()
                .withTransactionId(transactionId)
                .withUnitId(unitId)
                .withFunctionCode(fc)
                .withStartingAddress(startingAddress)
                .withQuantity(quantity)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ModbusClientConfig config;
        private ModbusStreamConnector connector = NettyTcpStreamConnector.INSTANCE;
        private ModbusRequestEncoder encoder = new DefaultModbusRequestEncoder();
        private ModbusResponseDecoder decoder = new DefaultModbusResponseDecoder();
        private ModbusObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConfig(ModbusClientConfig config) {
            this.config = config;
            return this;
        }

        public Builder withConnector(ModbusStreamConnector connector) {
            this.connector = connector;
            return this;
        }

        public Builder withEncoder(ModbusRequestEncoder encoder) {
            this.encoder = encoder;
            return this;
        }

        public Builder withDecoder(ModbusResponseDecoder decoder) {
            this.decoder = decoder;
            return this;
        }

        public Builder withObservabilitySink(ModbusObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public ModbusTcpClient build() {
            return new ModbusTcpClient(
                    Objects.requireNonNull(config, "config"),
                    Objects.requireNonNull(connector, "connector"),
                    Objects.requireNonNull(encoder, "encoder"),
                    Objects.requireNonNull(decoder, "decoder"),
                    Objects.requireNonNull(observabilitySink, "observabilitySink"));
        }
    }
}
