package com.questrail.modbus.model;

import java.util.Objects;

/**
 * Raised when read request parameters cannot form a valid Modbus request.
 *
 * <p>This is a construction-time failure. It is thrown synchronously while a
 * {@link ModbusReadRequest} is being assembled and is never produced by the
 * codec or transport layers.</p>
 */
public final class InvalidRequestException extends IllegalArgumentException
{
    /**
     * Classification of the rejected parameter.
     */
    public enum Reason {
        /** Function code is not one of the four supported read functions. */
        UNSUPPORTED_FUNCTION,
        /** A numeric field lies outside its permitted range. */
        OUT_OF_RANGE
    }

    private final Reason reason;

    public InvalidRequestException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }

    static InvalidRequestException outOfRange(String field, int value, int min, int max) {
        return new InvalidRequestException(
                Reason.OUT_OF_RANGE,
                field + " must be in range " + min + "–" + max + " (was " + value + ")"
        );
    }
}
