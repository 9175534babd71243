package com.questrail.modbus.model;

/**
 * ModbusResponseFrame
 * -----------------------------------------------------------------------------
 * Immutable header fields and data bytes of a successful read response.
 *
 * <h2>What this represents</h2>
 * A {@code ModbusResponseFrame} is produced only after the response decoder has
 * checked the transaction id, protocol id, unit id, function echo, length
 * field and byte count against the originating {@link ModbusReadRequest}.
 * It is wire-adjacent: the typed register values live in
 * {@link RegisterValues}, not here.
 *
 * Immutability is enforced via defensive copying.
 */
public final class ModbusResponseFrame
{
    private final int transactionId;
    private final int protocolId;

    /**
     * Declared number of bytes following the length field
     * (unit id + function code + byte count + data).
     */
    private final int length;

    private final int unitId;
    private final int functionCode;
    private final int byteCount;

    /**
     * Register data bytes (exactly {@code byteCount} long, never null).
     */
    private final byte[] payload;

    public ModbusResponseFrame(int transactionId,
                               int protocolId,
                               int length,
                               int unitId,
                               int functionCode,
                               int byteCount,
                               byte[] payload) {

        this.transactionId = transactionId;
        this.protocolId = protocolId;
        this.length = length;
        this.unitId = unitId;
        this.functionCode = functionCode;
        this.byteCount = byteCount;
        this.payload = (payload == null) ? new byte[0] : payload.clone();
    }

    public int transactionId() {
        return transactionId;
    }

    public int protocolId() {
        return protocolId;
    }

    public int length() {
        return length;
    }

    public int unitId() {
        return unitId;
    }

    /**
     * Returns the echoed function code as an unsigned wire value.
     */
    public int functionCode() {
        return functionCode;
    }

    public int byteCount() {
        return byteCount;
    }

    /**
     * Returns a copy of the register data bytes.
     */
    public byte[] payload() {
        return payload.clone();
    }

    @Override
    public String toString() {
        return "ModbusResponseFrame[" +
                "transactionId=" + transactionId +
                ", unitId=" + unitId +
                ", function=0x" + Integer.toHexString(functionCode) +
                ", length=" + length +
                ", byteCount=" + byteCount +
                ']';
    }
}
