package com.questrail.modbus.model;

/**
 * Base type for read outcomes rethrown as exceptions.
 *
 * <p>Only raised on request, via {@link ModbusReadResult#registers()}. The
 * codec itself reports faults and protocol errors as
 * {@link ModbusReadResult} values.</p>
 */
public abstract class ModbusException extends RuntimeException
{
    protected ModbusException(String message) {
        super(message);
    }
}
