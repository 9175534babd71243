package com.questrail.modbus.codec.impl;

import com.questrail.modbus.codec.ModbusResponseDecoder;
import com.questrail.modbus.model.FunctionCode;
import com.questrail.modbus.model.ModbusReadRequest;
import com.questrail.modbus.model.ModbusReadResult;
import com.questrail.modbus.model.ModbusReadResult.ProtocolError;
import com.questrail.modbus.model.ModbusResponseFrame;
import com.questrail.modbus.model.RegisterValues;

import java.util.Arrays;
import java.util.Objects;

/**
 * DefaultModbusResponseDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ModbusResponseDecoder}.
 *
 * <p>This decoder performs the following steps, in order, stopping at the
 * first failure:</p>
 * <ol>
 *   <li>Minimum length (MBAP header, function code, one PDU byte)</li>
 *   <li>Transaction id, protocol id and unit id correlation</li>
 *   <li>Function echo: normal, exception ({@code code | 0x80}) or unrecognised</li>
 *   <li>Byte count and length field against the request's quantity</li>
 *   <li>Register decoding into {@link RegisterValues}</li>
 * </ol>
 *
 * <p>Bit data is packed least-significant bit first, bytes in ascending
 * order. Word data is big-endian. Padding bits in the last coil byte are
 * ignored.</p>
 */
public final class DefaultModbusResponseDecoder implements ModbusResponseDecoder
{
    static final int BYTE_COUNT_OFFSET = MbapHeader.FUNCTION_OFFSET + 1;
    static final int EXCEPTION_CODE_OFFSET = MbapHeader.FUNCTION_OFFSET + 1;
    static final int DATA_OFFSET = BYTE_COUNT_OFFSET + 1;

    @Override
    public ModbusReadResult decode(ModbusReadRequest request, byte[] adu)
    {
        Objects.requireNonNull(request, "request");

        // 1) Anything shorter cannot even carry an exception code.
        if (adu == null || adu.length < ModbusReadRequest.MIN_RESPONSE_LENGTH) {
            return malformed("Response too short: " + (adu == null ? 0 : adu.length)
                    + " bytes, need at least " + ModbusReadRequest.MIN_RESPONSE_LENGTH);
        }

        // 2) Header correlation
        final MbapHeader header = MbapHeader.read(adu);

        if (header.transactionId() != request.transactionId()) {
            return new ProtocolError(ProtocolError.Kind.TRANSACTION_MISMATCH,
                    "Transaction id " + header.transactionId()
                            + " does not match request " + request.transactionId());
        }
        if (header.protocolId() != ModbusReadRequest.PROTOCOL_ID) {
            return malformed("Protocol id must be 0 (was " + header.protocolId() + ")");
        }
        if (header.unitId() != request.unitId()) {
            return new ProtocolError(ProtocolError.Kind.UNIT_ID_MISMATCH,
                    "Unit id " + header.unitId() + " does not match request " + request.unitId());
        }

        // 3) Function echo
        final FunctionCode fc = request.functionCode();
        final int echoed = adu[MbapHeader.FUNCTION_OFFSET] & 0xFF;

        if (echoed == fc.exceptionCode()) {
            return ModbusReadResult.ServerFault.of(adu[EXCEPTION_CODE_OFFSET] & 0xFF);
        }
        if (echoed != fc.code()) {
            return new ProtocolError(ProtocolError.Kind.UNRECOGNIZED_FUNCTION_ECHO,
                    "Function code 0x" + Integer.toHexString(echoed)
                            + " does not answer request function 0x" + Integer.toHexString(fc.code()));
        }

        // 4) Lengths
        final int byteCount = adu[BYTE_COUNT_OFFSET] & 0xFF;
        final int expectedByteCount = request.expectedByteCount();

        if (byteCount != expectedByteCount) {
            return malformed("Byte count " + byteCount + " does not match expected "
                    + expectedByteCount + " for " + request.quantity() + " registers");
        }
        // unit id + function code + byte count + data
        if (header.length() != byteCount + 3) {
            return malformed("Length field " + header.length()
                    + " inconsistent with byte count " + byteCount);
        }
        if (adu.length < DATA_OFFSET + byteCount) {
            return malformed("Response truncated: " + adu.length + " bytes, need "
                    + (DATA_OFFSET + byteCount));
        }

        final byte[] payload = Arrays.copyOfRange(adu, DATA_OFFSET, DATA_OFFSET + byteCount);

        // 5) Registers
        final RegisterValues values = fc.isBitAccess()
                ? decodeBits(payload, request.quantity())
                : decodeWords(payload, request.quantity());

        final ModbusResponseFrame frame = new ModbusResponseFrame(
                header.transactionId(),
                header.protocolId(),
                header.length(),
                header.unitId(),
                echoed,
                byteCount,
                payload
        );
        return new ModbusReadResult.Success(frame, values);
    }

    private static RegisterValues.BitRegisters decodeBits(byte[] payload, int quantity)
    {
        boolean[] bits = new boolean[quantity];
        for (int i = 0; i < quantity; i++) {
            bits[i] = ((payload[i / 8] >> (i % 8)) & 1) != 0;
        }
        return new RegisterValues.BitRegisters(bits);
    }

    private static RegisterValues.WordRegisters decodeWords(byte[] payload, int quantity)
    {
        int[] words = new int[quantity];
        for (int i = 0; i < quantity; i++) {
            words[i] = MbapHeader.readUInt16(payload, i * 2);
        }
        return new RegisterValues.WordRegisters(words);
    }

    private static ProtocolError malformed(String detail)
    {
        return new ProtocolError(ProtocolError.Kind.MALFORMED_RESPONSE, detail);
    }
}
