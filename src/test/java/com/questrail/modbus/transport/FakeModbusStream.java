package com.questrail.modbus.transport;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Deterministic in-memory {@link ModbusStream} for tests.
 *
 * <p>Inbound bytes are scripted with {@link #enqueue(byte[])} and handed out
 * at most {@code maxChunk} bytes per {@link #read} call, so callers see the
 * partial reads a real socket produces. Reading with nothing queued behaves
 * like a read timeout.</p>
 */
public final class FakeModbusStream implements ModbusStream
{
    private final Deque<Byte> inbound = new ArrayDeque<>();
    private final List<byte[]> written = new ArrayList<>();
    private final int maxChunk;

    private int bytesRead;
    private boolean closed;

    public FakeModbusStream() {
        this(Integer.MAX_VALUE);
    }

    public FakeModbusStream(int maxChunk) {
        this.maxChunk = maxChunk;
    }

    public void enqueue(byte[] bytes) {
        for (byte b : bytes) {
            inbound.addLast(b);
        }
    }

    @Override
    public void write(byte[] data) throws ModbusTransportException {
        if (closed) {
            throw new ModbusTransportException("Stream is closed");
        }
        written.add(data.clone());
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws ModbusTransportException {
        if (closed) {
            throw new ModbusTransportException("Stream is closed");
        }
        if (inbound.isEmpty()) {
            throw new ModbusTransportException("Read timed out");
        }
        int n = Math.min(Math.min(length, maxChunk), inbound.size());
        for (int i = 0; i < n; i++) {
            buffer[offset + i] = inbound.removeFirst();
        }
        bytesRead += n;
        return n;
    }

    @Override
    public void close() {
        closed = true;
    }

    public List<byte[]> written() {
        return written;
    }

    public int bytesRead() {
        return bytesRead;
    }

    public int remaining() {
        return inbound.size();
    }

    public boolean isClosed() {
        return closed;
    }
}
