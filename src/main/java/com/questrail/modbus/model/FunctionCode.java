package com.questrail.modbus.model;

/**
 * The Modbus read function codes supported by this client.
 *
 * <h2>What a function code decides</h2>
 * <ul>
 *   <li>The permitted register quantity for a single request</li>
 *   <li>Whether response data is packed bits or big-endian 16-bit words</li>
 *   <li>The byte count a well-formed response must carry</li>
 * </ul>
 *
 * <p>Write, diagnostic and user-defined function codes are not representable.
 * Attempting to resolve one through {@link #of(int)} fails with
 * {@link InvalidRequestException.Reason#UNSUPPORTED_FUNCTION}.</p>
 */
public enum FunctionCode
{
    READ_COILS(0x01, true, 2000),
    READ_DISCRETE_INPUTS(0x02, true, 2000),
    READ_HOLDING_REGISTERS(0x03, false, 125),
    READ_INPUT_REGISTERS(0x04, false, 125);

    /** Bit set in the echoed function code of an exception response. */
    public static final int EXCEPTION_FLAG = 0x80;

    /** Smallest quantity any read function accepts. */
    public static final int MIN_QUANTITY = 1;

    private final int code;
    private final boolean bitAccess;
    private final int maxQuantity;

    FunctionCode(int code, boolean bitAccess, int maxQuantity) {
        this.code = code;
        this.bitAccess = bitAccess;
        this.maxQuantity = maxQuantity;
    }

    /**
     * Resolves a wire function code.
     *
     * @param code function code value
     * @return the matching read function
     * @throws InvalidRequestException if {@code code} is not 1, 2, 3 or 4
     */
    public static FunctionCode of(int code) {
        for (FunctionCode fc : values()) {
            if (fc.code == code) {
                return fc;
            }
        }
        throw new InvalidRequestException(
                InvalidRequestException.Reason.UNSUPPORTED_FUNCTION,
                "Function code not supported: " + code
        );
    }

    /** Wire value of this function code. */
    public int code() {
        return code;
    }

    /** Function code the server echoes when it rejects the request. */
    public int exceptionCode() {
        return code | EXCEPTION_FLAG;
    }

    /** True for coils and discrete inputs, false for 16-bit registers. */
    public boolean isBitAccess() {
        return bitAccess;
    }

    public int maxQuantity() {
        return maxQuantity;
    }

    /**
     * Checks a register quantity against this function's range.
     *
     * @throws InvalidRequestException if the quantity is out of range
     */
    public void checkQuantity(int quantity) {
        if (quantity < MIN_QUANTITY || quantity > maxQuantity) {
            throw InvalidRequestException.outOfRange(
                    "Register quantity for " + this, quantity, MIN_QUANTITY, maxQuantity);
        }
    }

    /**
     * Number of data bytes a successful response carries for {@code quantity}
     * registers (the value of the response byte-count field).
     */
    public int responseByteCount(int quantity) {
        if (bitAccess) {
            return (quantity + 7) / 8;
        }
        return quantity * 2;
    }
}
