/**
 * Modbus TCP Codec: Read Functions
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for Modbus TCP read
 * requests (function codes 1–4). The codec layer implements the wire-level
 * rules of the Modbus Application Protocol over TCP:</p>
 *
 * <ul>
 *   <li>MBAP header construction and correlation</li>
 *   <li>Big-endian encoding of address and quantity fields</li>
 *   <li>Exception response detection ({@code function | 0x80})</li>
 *   <li>Byte count validation and register decoding</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <p>The codec sits <strong>below</strong> the client and
 * <strong>above</strong> transport I/O:</p>
 *
 * <pre>
 *   ModbusReadRequest
 *        → ModbusRequestEncoder    → byte[] → ModbusStream.write
 *   ModbusStream.read → byte[]
 *        → ModbusResponseDecoder   → ModbusReadResult
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The codec never opens, reads, writes or closes a stream.</li>
 *   <li>The codec holds no state between exchanges.</li>
 *   <li>Wire defects are returned as values, never thrown.</li>
 * </ul>
 */
package com.questrail.modbus.codec;
