package com.questrail.modbus.model;

import java.util.Objects;

/**
 * ModbusReadRequest
 * -----------------------------------------------------------------------------
 * Immutable, validated parameters of a single Modbus TCP read request.
 *
 * <p>A request carries everything needed to build the outgoing ADU and to
 * validate the matching response: transaction id, unit id, function code,
 * starting address and register quantity. The protocol identifier is always
 * {@link #PROTOCOL_ID} and is not a field.</p>
 *
 * <h2>Validation</h2>
 * <p>The canonical constructor checks every field, including the quantity
 * against the function code. Because all fields arrive together there is no
 * ordering between them: a quantity valid for coils but not for registers is
 * rejected no matter whether the function code was chosen before or after the
 * quantity on the {@link Builder}.</p>
 *
 * @param transactionId   correlator echoed by the server (0–65535)
 * @param unitId          addressed unit (0–255)
 * @param functionCode    read function
 * @param startingAddress address of the first register (0–65535)
 * @param quantity        number of registers to read
 */
public record ModbusReadRequest(
        int transactionId,
        int unitId,
        FunctionCode functionCode,
        int startingAddress,
        int quantity
) {
    /** Modbus protocol identifier carried in every MBAP header. */
    public static final int PROTOCOL_ID = 0;

    /** MBAP header (7 bytes) plus the echoed function code. */
    public static final int RESPONSE_HEADER_LENGTH = 8;

    /**
     * Length of an exception response, and the shortest prefix that tells a
     * normal response from an exception response.
     */
    public static final int MIN_RESPONSE_LENGTH = RESPONSE_HEADER_LENGTH + 1;

    public static final int MAX_UINT16 = 0xFFFF;
    public static final int MAX_UNIT_ID = 0xFF;

    public ModbusReadRequest {
        if (functionCode == null) {
            throw new InvalidRequestException(
                    InvalidRequestException.Reason.UNSUPPORTED_FUNCTION,
                    "Function code must be set");
        }
        checkRange("Transaction id", transactionId, 0, MAX_UINT16);
        checkRange("Unit id", unitId, 0, MAX_UNIT_ID);
        checkRange("Starting address", startingAddress, 0, MAX_UINT16);
        functionCode.checkQuantity(quantity);
    }

    /**
     * Number of bytes a successful response to this request occupies on the
     * wire: MBAP header, function code, byte count and register data.
     *
     * <p>Callers size their receive buffer with this value. Exception
     * responses are shorter (9 bytes) and are recognised from the prefix.</p>
     */
    public int expectedResponseLength() {
        return RESPONSE_HEADER_LENGTH + expectedByteCount() + 1;
    }

    /** Value the response byte-count field must hold. */
    public int expectedByteCount() {
        return functionCode.responseByteCount(quantity);
    }

    public static Builder builder() {
        return new Builder();
    }

    static void checkRange(String field, int value, int min, int max) {
        if (value < min || value > max) {
            throw InvalidRequestException.outOfRange(field, value, min, max);
        }
    }

    /**
     * Builder for {@link ModbusReadRequest}.
     *
     * <p>Setters reject values that are invalid on their own. The quantity is
     * checked against the function code only in {@link #build()}, against the
     * final parameter set.</p>
     */
    public static final class Builder {
        private int transactionId = 1;
        private int unitId = 0;
        private FunctionCode functionCode;
        private int startingAddress = 0;
        private Integer quantity;

        private Builder() {}

        public Builder withTransactionId(int transactionId) {
            checkRange("Transaction id", transactionId, 0, MAX_UINT16);
            this.transactionId = transactionId;
            return this;
        }

        public Builder withUnitId(int unitId) {
            checkRange("Unit id", unitId, 0, MAX_UNIT_ID);
            this.unitId = unitId;
            return this;
        }

        public Builder withFunctionCode(FunctionCode functionCode) {
            this.functionCode = Objects.requireNonNull(functionCode, "functionCode");
            return this;
        }

        /**
         * @throws InvalidRequestException with reason
         *         {@code UNSUPPORTED_FUNCTION} for codes other than 1–4
         */
        public Builder withFunctionCode(int code) {
            this.functionCode = FunctionCode.of(code);
            return this;
        }

        public Builder withStartingAddress(int startingAddress) {
            checkRange("Starting address", startingAddress, 0, MAX_UINT16);
            this.startingAddress = startingAddress;
            return this;
        }

        public Builder withQuantity(int quantity) {
            checkRange("Register quantity", quantity,
                    FunctionCode.MIN_QUANTITY, FunctionCode.READ_COILS.maxQuantity());
            this.quantity = quantity;
            return this;
        }

        /**
         * @throws InvalidRequestException if the function code or quantity is
         *         missing, or the quantity exceeds the function's range
         */
        public ModbusReadRequest build() {
            if (quantity == null) {
                throw new InvalidRequestException(
                        InvalidRequestException.Reason.OUT_OF_RANGE,
                        "Register quantity must be set");
            }
            return new ModbusReadRequest(transactionId, unitId, functionCode, startingAddress, quantity);
        }
    }
}
