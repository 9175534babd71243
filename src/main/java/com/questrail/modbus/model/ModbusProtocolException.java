package com.questrail.modbus.model;

/**
 * A response that could not be matched to its request or decoded, rethrown.
 */
public final class ModbusProtocolException extends ModbusException
{
    private final ModbusReadResult.ProtocolError error;

    public ModbusProtocolException(ModbusReadResult.ProtocolError error) {
        super(error.kind() + ": " + error.detail());
        this.error = error;
    }

    public ModbusReadResult.ProtocolError error() {
        return error;
    }

    public ModbusReadResult.ProtocolError.Kind kind() {
        return error.kind();
    }
}
