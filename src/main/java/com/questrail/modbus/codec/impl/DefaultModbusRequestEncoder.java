package com.questrail.modbus.codec.impl;

import com.questrail.modbus.codec.ModbusRequestEncoder;
import com.questrail.modbus.model.ModbusReadRequest;

import java.util.Objects;

/**
 * DefaultModbusRequestEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ModbusRequestEncoder}.
 *
 * <p>Every supported read request has the same 12-byte layout:</p>
 * <pre>
 *   [ transaction id ][ protocol id = 0 ][ length = 6 ][ unit id ]
 *   [ function code ][ starting address ][ quantity ]
 * </pre>
 */
public final class DefaultModbusRequestEncoder implements ModbusRequestEncoder
{
    /** Starting address and quantity, two bytes each. */
    static final int REQUEST_DATA_LENGTH = 4;

    static final int REQUEST_LENGTH = MbapHeader.SIZE + 1 + REQUEST_DATA_LENGTH;

    @Override
    public byte[] encode(ModbusReadRequest request)
    {
        Objects.requireNonNull(request, "request");

        // The quantity is checked against the function code that is actually
        // about to be written.
        request.functionCode().checkQuantity(request.quantity());

        final byte[] adu = new byte[REQUEST_LENGTH];

        // Length covers unit id + function code + data.
        new MbapHeader(
                request.transactionId(),
                ModbusReadRequest.PROTOCOL_ID,
                2 + REQUEST_DATA_LENGTH,
                request.unitId()
        ).writeTo(adu);

        adu[MbapHeader.FUNCTION_OFFSET] = (byte) request.functionCode().code();
        MbapHeader.writeUInt16(adu, MbapHeader.FUNCTION_OFFSET + 1, request.startingAddress());
        MbapHeader.writeUInt16(adu, MbapHeader.FUNCTION_OFFSET + 3, request.quantity());

        return adu;
    }
}
