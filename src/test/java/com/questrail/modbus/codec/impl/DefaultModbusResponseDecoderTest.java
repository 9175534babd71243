package com.questrail.modbus.codec.impl;

import com.questrail.modbus.model.FunctionCode;
import com.questrail.modbus.model.ModbusExceptionCode;
import com.questrail.modbus.model.ModbusReadRequest;
import com.questrail.modbus.model.ModbusReadResult;
import com.questrail.modbus.model.ModbusReadResult.ProtocolError;
import com.questrail.modbus.model.RegisterValues;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultModbusResponseDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultModbusResponseDecoder}.
 *
 * <p>Covers the three result shapes: decoded registers, server exception
 * responses, and each kind of protocol error. Responses are hand-built so the
 * decoder is tested independently of the encoder.</p>
 */
final class DefaultModbusResponseDecoderTest
{
    private final DefaultModbusResponseDecoder decoder = new DefaultModbusResponseDecoder();

    @Test
    void decodesCoilsLsbFirst()
    {
        ModbusReadRequest request = new ModbusReadRequest(123, 1, FunctionCode.READ_COILS, 0, 8);
        byte[] adu = { 0x00, 0x7B, 0x00, 0x00, 0x00, 0x04, 0x01, 0x01, 0x01, (byte) 0b1011_0010 };

        ModbusReadResult result = decoder.decode(request, adu);

        RegisterValues.BitRegisters bits = assertInstanceOf(RegisterValues.BitRegisters.class, result.registers());
        assertArrayEquals(
                new boolean[] { false, true, false, false, true, true, false, true },
                bits.toArray());
    }

    @Test
    void decodesDiscreteInputsAcrossBytesAndIgnoresPadding()
    {
        ModbusReadRequest request = new ModbusReadRequest(2, 5, FunctionCode.READ_DISCRETE_INPUTS, 100, 9);
        // Second byte: only bit 0 counts; 0xFE padding must be ignored.
        byte[] adu = { 0x00, 0x02, 0x00, 0x00, 0x00, 0x05, 0x05, 0x02, 0x02, (byte) 0xFF, (byte) 0xFE };

        RegisterValues values = decoder.decode(request, adu).registers();

        assertEquals(9, values.size());
        RegisterValues.BitRegisters bits = (RegisterValues.BitRegisters) values;
        for (int i = 0; i < 8; i++) {
            assertTrue(bits.get(i));
        }
        assertFalse(bits.get(8));
    }

    @Test
    void decodesHoldingRegistersBigEndian()
    {
        ModbusReadRequest request = new ModbusReadRequest(7, 1, FunctionCode.READ_HOLDING_REGISTERS, 0, 2);
        byte[] adu = { 0x00, 0x07, 0x00, 0x00, 0x00, 0x07, 0x01, 0x03, 0x04, 0x00, 0x0A, 0x01, 0x2C };

        ModbusReadResult result = decoder.decode(request, adu);

        assertTrue(result.isSuccess());
        assertEquals(new RegisterValues.WordRegisters(new int[] { 10, 300 }), result.registers());

        ModbusReadResult.Success success = (ModbusReadResult.Success) result;
        assertEquals(7, success.frame().transactionId());
        assertEquals(4, success.frame().byteCount());
        assertArrayEquals(new byte[] { 0x00, 0x0A, 0x01, 0x2C }, success.frame().payload());
    }

    @Test
    void decodesInputRegistersAsUnsigned()
    {
        ModbusReadRequest request = new ModbusReadRequest(1, 0, FunctionCode.READ_INPUT_REGISTERS, 0, 1);
        byte[] adu = { 0x00, 0x01, 0x00, 0x00, 0x00, 0x05, 0x00, 0x04, 0x02, (byte) 0xFF, (byte) 0xFF };

        RegisterValues.WordRegisters words = (RegisterValues.WordRegisters) decoder.decode(request, adu).registers();
        assertEquals(65535, words.get(0));
    }

    @Test
    void exceptionResponseBecomesServerFault()
    {
        ModbusReadRequest request = new ModbusReadRequest(123, 1, FunctionCode.READ_COILS, 0, 8);
        byte[] adu = { 0x00, 0x7B, 0x00, 0x00, 0x00, 0x03, 0x01, (byte) 0x81, 0x02 };

        ModbusReadResult result = decoder.decode(request, adu);

        ModbusReadResult.ServerFault fault = assertInstanceOf(ModbusReadResult.ServerFault.class, result);
        assertEquals(ModbusExceptionCode.ILLEGAL_DATA_ADDRESS, fault.exceptionCode());
        assertEquals(2, fault.rawCode());
    }

    @Test
    void unknownExceptionCodeKeepsRawValue()
    {
        ModbusReadRequest request = new ModbusReadRequest(9, 1, FunctionCode.READ_HOLDING_REGISTERS, 0, 4);
        byte[] adu = { 0x00, 0x09, 0x00, 0x00, 0x00, 0x03, 0x01, (byte) 0x83, 0x19 };

        ModbusReadResult.ServerFault fault = (ModbusReadResult.ServerFault) decoder.decode(request, adu);
        assertEquals(ModbusExceptionCode.UNKNOWN, fault.exceptionCode());
        assertEquals(0x19, fault.rawCode());
    }

    @Test
    void transactionMismatch()
    {
        ModbusReadRequest request = new ModbusReadRequest(5, 1, FunctionCode.READ_COILS, 0, 8);
        byte[] adu = { 0x00, 0x06, 0x00, 0x00, 0x00, 0x04, 0x01, 0x01, 0x01, 0x00 };

        assertKind(ProtocolError.Kind.TRANSACTION_MISMATCH, decoder.decode(request, adu));
    }

    @Test
    void transactionMismatchWinsOverExceptionEcho()
    {
        ModbusReadRequest request = new ModbusReadRequest(5, 1, FunctionCode.READ_COILS, 0, 8);
        byte[] adu = { 0x00, 0x06, 0x00, 0x00, 0x00, 0x03, 0x01, (byte) 0x81, 0x02 };

        assertKind(ProtocolError.Kind.TRANSACTION_MISMATCH, decoder.decode(request, adu));
    }

    @Test
    void unitIdMismatch()
    {
        ModbusReadRequest request = new ModbusReadRequest(5, 1, FunctionCode.READ_COILS, 0, 8);
        byte[] adu = { 0x00, 0x05, 0x00, 0x00, 0x00, 0x04, 0x02, 0x01, 0x01, 0x00 };

        assertKind(ProtocolError.Kind.UNIT_ID_MISMATCH, decoder.decode(request, adu));
    }

    @Test
    void unrecognizedFunctionEcho()
    {
        ModbusReadRequest request = new ModbusReadRequest(5, 1, FunctionCode.READ_HOLDING_REGISTERS, 0, 1);
        // Echo of another function, and the exception form of another function.
        byte[] other = { 0x00, 0x05, 0x00, 0x00, 0x00, 0x05, 0x01, 0x04, 0x02, 0x00, 0x01 };
        byte[] otherException = { 0x00, 0x05, 0x00, 0x00, 0x00, 0x03, 0x01, (byte) 0x84, 0x02 };

        assertKind(ProtocolError.Kind.UNRECOGNIZED_FUNCTION_ECHO, decoder.decode(request, other));
        assertKind(ProtocolError.Kind.UNRECOGNIZED_FUNCTION_ECHO, decoder.decode(request, otherException));
    }

    @Test
    void byteCountMismatchIsMalformed()
    {
        ModbusReadRequest request = new ModbusReadRequest(5, 1, FunctionCode.READ_HOLDING_REGISTERS, 0, 2);
        byte[] adu = { 0x00, 0x05, 0x00, 0x00, 0x00, 0x05, 0x01, 0x03, 0x02, 0x00, 0x01 };

        assertKind(ProtocolError.Kind.MALFORMED_RESPONSE, decoder.decode(request, adu));
    }

    @Test
    void lengthFieldMismatchIsMalformed()
    {
        ModbusReadRequest request = new ModbusReadRequest(5, 1, FunctionCode.READ_COILS, 0, 8);
        byte[] adu = { 0x00, 0x05, 0x00, 0x00, 0x00, 0x09, 0x01, 0x01, 0x01, 0x00 };

        assertKind(ProtocolError.Kind.MALFORMED_RESPONSE, decoder.decode(request, adu));
    }

    @Test
    void nonZeroProtocolIdIsMalformed()
    {
        ModbusReadRequest request = new ModbusReadRequest(5, 1, FunctionCode.READ_COILS, 0, 8);
        byte[] adu = { 0x00, 0x05, 0x00, 0x01, 0x00, 0x04, 0x01, 0x01, 0x01, 0x00 };

        assertKind(ProtocolError.Kind.MALFORMED_RESPONSE, decoder.decode(request, adu));
    }

    @Test
    void truncatedResponseIsMalformed()
    {
        ModbusReadRequest request = new ModbusReadRequest(5, 1, FunctionCode.READ_HOLDING_REGISTERS, 0, 2);
        byte[] full = { 0x00, 0x05, 0x00, 0x00, 0x00, 0x07, 0x01, 0x03, 0x04, 0x00, 0x0A, 0x01, 0x2C };

        assertKind(ProtocolError.Kind.MALFORMED_RESPONSE,
                decoder.decode(request, Arrays.copyOf(full, full.length - 1)));
        assertKind(ProtocolError.Kind.MALFORMED_RESPONSE,
                decoder.decode(request, Arrays.copyOf(full, 8)));
        assertKind(ProtocolError.Kind.MALFORMED_RESPONSE, decoder.decode(request, new byte[0]));
    }

    @Test
    void trailingBytesAreIgnored()
    {
        ModbusReadRequest request = new ModbusReadRequest(5, 1, FunctionCode.READ_COILS, 0, 8);
        byte[] adu = { 0x00, 0x05, 0x00, 0x00, 0x00, 0x04, 0x01, 0x01, 0x01, 0x01, 0x7F, 0x7F };

        RegisterValues.BitRegisters bits = (RegisterValues.BitRegisters) decoder.decode(request, adu).registers();
        assertTrue(bits.get(0));
        assertFalse(bits.get(1));
    }

    private static void assertKind(ProtocolError.Kind expected, ModbusReadResult result)
    {
        ProtocolError error = assertInstanceOf(ProtocolError.class, result);
        assertEquals(expected, error.kind());
        assertFalse(error.detail().isEmpty());
    }
}
