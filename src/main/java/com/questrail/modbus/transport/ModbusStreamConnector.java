package com.questrail.modbus.transport;

import java.time.Duration;

/**
 * Opens {@link ModbusStream}s.
 */
@FunctionalInterface
public interface ModbusStreamConnector
{
    /**
     * Connect to a Modbus TCP server.
     *
     * @param host           server host name or address
     * @param port           server port
     * @param connectTimeout maximum time to establish the connection
     * @param readTimeout    maximum time a single {@link ModbusStream#read} may block
     * @return a connected stream owned by the caller
     * @throws ModbusTransportException if the connection cannot be established in time
     */
    ModbusStream connect(String host, int port, Duration connectTimeout, Duration readTimeout)
            throws ModbusTransportException;
}
