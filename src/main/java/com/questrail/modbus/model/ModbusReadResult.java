package com.questrail.modbus.model;

import java.util.Objects;

/**
 * Outcome of a single read exchange.
 *
 * <p>Exactly one of:</p>
 * <ul>
 *   <li>{@link Success}: the response matched the request and was decoded</li>
 *   <li>{@link ServerFault}: the server answered with an exception response</li>
 *   <li>{@link ProtocolError}: the response could not be matched or decoded</li>
 * </ul>
 *
 * <p>Server faults and protocol errors are ordinary values here. A server
 * fault means the server is working and rejected the request; a protocol
 * error means the bytes received do not belong to, or do not fit, the
 * request. Transport failures never appear as a result; they are thrown by
 * the transport layer.</p>
 */
public sealed interface ModbusReadResult
        permits ModbusReadResult.Success, ModbusReadResult.ServerFault, ModbusReadResult.ProtocolError
{
    /**
     * Returns the decoded registers of a {@link Success}.
     *
     * @throws ModbusServerException   if this is a {@link ServerFault}
     * @throws ModbusProtocolException if this is a {@link ProtocolError}
     */
    RegisterValues registers();

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * Decoded response.
     */
    record Success(ModbusResponseFrame frame, RegisterValues values) implements ModbusReadResult {
        public Success {
            Objects.requireNonNull(frame, "frame");
            Objects.requireNonNull(values, "values");
        }

        @Override
        public RegisterValues registers() {
            return values;
        }
    }

    /**
     * Exception response reported by the server.
     *
     * @param exceptionCode resolved exception kind ({@code UNKNOWN} if unmapped)
     * @param rawCode       exception byte as received
     */
    record ServerFault(ModbusExceptionCode exceptionCode, int rawCode) implements ModbusReadResult {
        public ServerFault {
            Objects.requireNonNull(exceptionCode, "exceptionCode");
        }

        public static ServerFault of(int rawCode) {
            return new ServerFault(ModbusExceptionCode.of(rawCode), rawCode);
        }

        @Override
        public RegisterValues registers() {
            throw new ModbusServerException(this);
        }
    }

    /**
     * Response that does not correspond to, or is inconsistent with, the request.
     */
    record ProtocolError(Kind kind, String detail) implements ModbusReadResult {
        public enum Kind {
            /** Echoed transaction id differs from the request's. */
            TRANSACTION_MISMATCH,
            /** Echoed unit id differs from the request's. */
            UNIT_ID_MISMATCH,
            /** Echoed function code is neither the request's nor its exception form. */
            UNRECOGNIZED_FUNCTION_ECHO,
            /** Header or byte count inconsistent with the request, or frame truncated. */
            MALFORMED_RESPONSE
        }

        public ProtocolError {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(detail, "detail");
        }

        @Override
        public RegisterValues registers() {
            throw new ModbusProtocolException(this);
        }
    }
}
