package com.questrail.modbus.observability;

import java.time.Instant;
import java.util.HexFormat;

/**
 * Record representing raw ADU bytes written to or read from the stream.
 */
public record ModbusFrameEvent(
    Instant timestamp,
    Direction direction,
    byte[] bytes
) {
    private static final HexFormat HEX = HexFormat.ofDelimiter(" ");

    public enum Direction {
        SENT,
        RECEIVED
    }

    public ModbusFrameEvent {
        bytes = bytes.clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    /**
     * Space-separated lowercase hex, e.g. {@code "00 7b 00 00"}.
     */
    public String hex() {
        return HEX.formatHex(bytes);
    }
}
