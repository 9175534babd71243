package com.questrail.modbus.codec;

import com.questrail.modbus.model.ModbusReadRequest;

/**
 * ModbusRequestEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for outbound Modbus TCP read requests.
 *
 * <p>This interface is the outbound boundary between a validated
 * {@link ModbusReadRequest} and the bytes handed to the transport. It performs
 * no I/O.</p>
 */
public interface ModbusRequestEncoder
{
    /**
     * Encode a request as a complete Modbus TCP ADU (MBAP header + PDU).
     *
     * @param request validated request parameters
     * @return bytes ready to be written to the stream
     */
    byte[] encode(ModbusReadRequest request);
}
