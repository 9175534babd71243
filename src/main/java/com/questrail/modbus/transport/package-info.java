/**
 * Modbus Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (e.g., Netty TCP, a plain
 * socket, or a test double) and the Modbus client.
 *
 * <h2>Why these ports exist</h2>
 * We use Netty for the TCP connection <strong>without</strong> allowing Netty
 * types to leak into the codec or the client. Everything above the transport
 * sees only:
 * <ul>
 *   <li>Raw bytes as {@code byte[]}</li>
 *   <li>Blocking reads bounded by a read timeout</li>
 *   <li>{@link com.questrail.modbus.transport.ModbusTransportException} on failure</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no frame interpretation)</li>
 *   <li>Surface timeouts as errors, never retry internally</li>
 *   <li>Not reconnect on their own</li>
 * </ul>
 */
package com.questrail.modbus.transport;
