package com.questrail.modbus.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class FunctionCodeTest
{
    @Test
    void resolvesSupportedWireCodes()
    {
        assertEquals(FunctionCode.READ_COILS, FunctionCode.of(1));
        assertEquals(FunctionCode.READ_DISCRETE_INPUTS, FunctionCode.of(2));
        assertEquals(FunctionCode.READ_HOLDING_REGISTERS, FunctionCode.of(3));
        assertEquals(FunctionCode.READ_INPUT_REGISTERS, FunctionCode.of(4));
    }

    @Test
    void rejectsWriteAndUnknownCodes()
    {
        for (int code : new int[] { 0, 5, 6, 15, 16, 0x81, 255 }) {
            InvalidRequestException e = assertThrows(InvalidRequestException.class, () -> FunctionCode.of(code));
            assertEquals(InvalidRequestException.Reason.UNSUPPORTED_FUNCTION, e.reason());
        }
    }

    @Test
    void exceptionCodeSetsHighBit()
    {
        assertEquals(0x81, FunctionCode.READ_COILS.exceptionCode());
        assertEquals(0x82, FunctionCode.READ_DISCRETE_INPUTS.exceptionCode());
        assertEquals(0x83, FunctionCode.READ_HOLDING_REGISTERS.exceptionCode());
        assertEquals(0x84, FunctionCode.READ_INPUT_REGISTERS.exceptionCode());
    }

    @Test
    void bitFunctionsAcceptUpTo2000()
    {
        FunctionCode.READ_COILS.checkQuantity(1);
        FunctionCode.READ_COILS.checkQuantity(2000);
        FunctionCode.READ_DISCRETE_INPUTS.checkQuantity(2000);

        assertEquals(InvalidRequestException.Reason.OUT_OF_RANGE,
                assertThrows(InvalidRequestException.class,
                        () -> FunctionCode.READ_COILS.checkQuantity(0)).reason());
        assertThrows(InvalidRequestException.class, () -> FunctionCode.READ_COILS.checkQuantity(2001));
    }

    @Test
    void wordFunctionsAcceptUpTo125()
    {
        FunctionCode.READ_HOLDING_REGISTERS.checkQuantity(125);
        FunctionCode.READ_INPUT_REGISTERS.checkQuantity(1);

        assertThrows(InvalidRequestException.class, () -> FunctionCode.READ_HOLDING_REGISTERS.checkQuantity(126));
        assertThrows(InvalidRequestException.class, () -> FunctionCode.READ_INPUT_REGISTERS.checkQuantity(0));
    }

    @Test
    void responseByteCountPacksBitsAndDoublesWords()
    {
        assertEquals(1, FunctionCode.READ_COILS.responseByteCount(1));
        assertEquals(1, FunctionCode.READ_COILS.responseByteCount(8));
        assertEquals(2, FunctionCode.READ_DISCRETE_INPUTS.responseByteCount(9));
        assertEquals(250, FunctionCode.READ_COILS.responseByteCount(2000));

        assertEquals(2, FunctionCode.READ_HOLDING_REGISTERS.responseByteCount(1));
        assertEquals(250, FunctionCode.READ_INPUT_REGISTERS.responseByteCount(125));
    }
}
