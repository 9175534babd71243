package com.questrail.modbus.observability;

import java.time.Instant;

/**
 * Record representing an error in the Modbus client stack.
 */
public record ModbusErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
