package com.questrail.modbus.codec;

import com.questrail.modbus.model.ModbusReadRequest;
import com.questrail.modbus.model.ModbusReadResult;

/**
 * ModbusResponseDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for inbound Modbus TCP read responses.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Correlating the response header with the originating request</li>
 *   <li>Separating normal responses from exception responses</li>
 *   <li>Checking the declared lengths against the request</li>
 *   <li>Decoding register data into typed values</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Reading from the stream or sizing the read</li>
 *   <li>Retrying or buffering partial frames</li>
 *   <li>Matching responses to anything but the single request it is given</li>
 * </ul>
 */
public interface ModbusResponseDecoder
{
    /**
     * Decode one complete response ADU against the request that produced it.
     *
     * <p>Never throws for malformed wire content; every wire-level outcome is
     * returned as a {@link ModbusReadResult}.</p>
     *
     * @param request the request this response answers
     * @param adu     the complete response bytes as read from the stream
     * @return the decoded registers, a server fault, or a protocol error
     */
    ModbusReadResult decode(ModbusReadRequest request, byte[] adu);
}
