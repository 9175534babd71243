package com.questrail.modbus.observability;

import java.time.Instant;

/**
 * Record representing a change in the connection to a Modbus server.
 */
public record ModbusTransportObservabilityEvent(
    Instant timestamp,
    Kind kind,
    String host,
    int port
) {
    public enum Kind {
        CONNECTED,
        DISCONNECTED
    }
}
