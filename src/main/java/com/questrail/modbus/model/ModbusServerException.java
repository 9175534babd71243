package com.questrail.modbus.model;

/**
 * A server-reported exception response, rethrown.
 */
public final class ModbusServerException extends ModbusException
{
    private final ModbusReadResult.ServerFault fault;

    public ModbusServerException(ModbusReadResult.ServerFault fault) {
        super(message(fault));
        this.fault = fault;
    }

    public ModbusReadResult.ServerFault fault() {
        return fault;
    }

    public ModbusExceptionCode exceptionCode() {
        return fault.exceptionCode();
    }

    private static String message(ModbusReadResult.ServerFault fault) {
        ModbusExceptionCode code = fault.exceptionCode();
        return code.title() + " (0x" + Integer.toHexString(fault.rawCode()) + "): " + code.description();
    }
}
