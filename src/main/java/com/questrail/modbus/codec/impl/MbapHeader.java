package com.questrail.modbus.codec.impl;

/**
 * MbapHeader
 * -----------------------------------------------------------------------------
 * The 7-byte Modbus Application Protocol header that prefixes every Modbus TCP
 * ADU, together with the big-endian field helpers shared by the encoder and
 * decoder.
 *
 * <pre>
 *   offset 0  transaction id   2 bytes
 *   offset 2  protocol id      2 bytes (always 0)
 *   offset 4  length           2 bytes (unit id + PDU)
 *   offset 6  unit id          1 byte
 * </pre>
 *
 * <p>This type carries no validation. Whether a header matches a request is
 * decided by {@link DefaultModbusResponseDecoder}.</p>
 */
record MbapHeader(int transactionId, int protocolId, int length, int unitId)
{
    static final int SIZE = 7;

    static final int TRANSACTION_ID_OFFSET = 0;
    static final int PROTOCOL_ID_OFFSET = 2;
    static final int LENGTH_OFFSET = 4;
    static final int UNIT_ID_OFFSET = 6;

    /** Offset of the function code, the first PDU byte. */
    static final int FUNCTION_OFFSET = SIZE;

    /**
     * Reads the header from the start of an ADU.
     *
     * <p>The caller guarantees {@code adu.length >= SIZE}.</p>
     */
    static MbapHeader read(byte[] adu)
    {
        return new MbapHeader(
                readUInt16(adu, TRANSACTION_ID_OFFSET),
                readUInt16(adu, PROTOCOL_ID_OFFSET),
                readUInt16(adu, LENGTH_OFFSET),
                adu[UNIT_ID_OFFSET] & 0xFF
        );
    }

    /**
     * Writes this header into the first {@link #SIZE} bytes of {@code adu}.
     */
    void writeTo(byte[] adu)
    {
        writeUInt16(adu, TRANSACTION_ID_OFFSET, transactionId);
        writeUInt16(adu, PROTOCOL_ID_OFFSET, protocolId);
        writeUInt16(adu, LENGTH_OFFSET, length);
        adu[UNIT_ID_OFFSET] = (byte) unitId;
    }

    static int readUInt16(byte[] data, int offset)
    {
        return ((data[offset] & 0xFF) << 8) | (data[offset + 1] & 0xFF);
    }

    // Modbus is big-endian: most significant byte first.
    static void writeUInt16(byte[] data, int offset, int value)
    {
        data[offset] = (byte) ((value >>> 8) & 0xFF);
        data[offset + 1] = (byte) (value & 0xFF);
    }
}
