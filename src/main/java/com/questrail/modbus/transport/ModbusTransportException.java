package com.questrail.modbus.transport;

import java.io.IOException;

/**
 * Failure of the byte stream underneath the Modbus codec: connect failure or
 * timeout, read timeout, write failure, or the peer closing the connection.
 *
 * <p>Propagated to the caller unchanged. Nothing in this library retries.</p>
 */
public class ModbusTransportException extends IOException
{
    public ModbusTransportException(String message) {
        super(message);
    }

    public ModbusTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
