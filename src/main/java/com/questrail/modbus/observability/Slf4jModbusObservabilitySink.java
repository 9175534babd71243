package com.questrail.modbus.observability;

import com.questrail.modbus.model.ModbusReadRequest;
import com.questrail.modbus.model.ModbusReadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ModbusObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jModbusObservabilitySink implements ModbusObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jModbusObservabilitySink.class);

    @Override
    public void onExchange(ModbusExchangeEvent event) {
        ModbusReadRequest request = event.request();
        ModbusReadResult result = event.result();

        if (result instanceof ModbusReadResult.Success success) {
            log.debug("Modbus read {} unit {} addr {} x{}: {} registers in {} ms",
                request.functionCode(),
                request.unitId(),
                request.startingAddress(),
                request.quantity(),
                success.values().size(),
                event.elapsed().toMillis());
        } else if (result instanceof ModbusReadResult.ServerFault fault) {
            log.warn("Modbus exception 0x{} ({}) from unit {} for {} transaction {}",
                Integer.toHexString(fault.rawCode()),
                fault.exceptionCode().title(),
                request.unitId(),
                request.functionCode(),
                request.transactionId());
        } else if (result instanceof ModbusReadResult.ProtocolError error) {
            log.warn("Modbus protocol error {} for transaction {}: {}",
                error.kind(),
                request.transactionId(),
                error.detail());
        }
    }

    @Override
    public void onFrame(ModbusFrameEvent event) {
        if (log.isTraceEnabled()) {
            log.trace("{}: {}", event.direction(), event.hex());
        }
    }

    @Override
    public void onTransportEvent(ModbusTransportObservabilityEvent event) {
        log.info("Modbus Transport Event: {} {}:{}", event.kind(), event.host(), event.port());
    }

    @Override
    public void onError(ModbusErrorEvent event) {
        log.error("Modbus Error: {}", event.message(), event.cause());
    }
}
