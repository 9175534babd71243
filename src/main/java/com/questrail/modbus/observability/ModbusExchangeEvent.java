package com.questrail.modbus.observability;

import com.questrail.modbus.model.ModbusReadRequest;
import com.questrail.modbus.model.ModbusReadResult;

import java.time.Duration;
import java.time.Instant;

/**
 * Record representing one completed request/response exchange.
 */
public record ModbusExchangeEvent(
    Instant timestamp,
    ModbusReadRequest request,
    ModbusReadResult result,
    Duration elapsed
) {
}
