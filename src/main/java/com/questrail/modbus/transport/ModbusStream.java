package com.questrail.modbus.transport;

import java.io.Closeable;

/**
 * ModbusStream
 * -----------------------------------------------------------------------------
 * Minimal port for a connected, blocking byte stream (TCP-style).
 *
 * <p>Implementations may be backed by Netty, a plain socket, or a test
 * harness. The stream moves bytes only: it does not frame, decode or retry.</p>
 */
public interface ModbusStream extends Closeable
{
    /**
     * Write all bytes to the peer.
     *
     * @throws ModbusTransportException if the bytes could not be sent
     */
    void write(byte[] data) throws ModbusTransportException;

    /**
     * Read up to {@code length} bytes into {@code buffer}, blocking until at
     * least one byte is available or the read timeout elapses.
     *
     * @return number of bytes read, always at least 1
     * @throws ModbusTransportException on timeout or if the peer closed the stream
     */
    int read(byte[] buffer, int offset, int length) throws ModbusTransportException;

    /**
     * Read exactly {@code length} bytes.
     *
     * <p>A short read is a transport failure: the method either returns a full
     * buffer or throws.</p>
     */
    default byte[] readFully(int length) throws ModbusTransportException {
        byte[] buffer = new byte[length];
        int read = 0;
        while (read < length) {
            read += read(buffer, read, length - read);
        }
        return buffer;
    }

    /**
     * Close the stream and release its resources. Idempotent.
     */
    @Override
    void close();
}
