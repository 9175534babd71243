package com.questrail.modbus.model;

/**
 * Exception codes a Modbus server reports in an exception response.
 *
 * <p>Any code without a named constant resolves to {@link #UNKNOWN}. The raw
 * wire value is kept by {@link ModbusReadResult.ServerFault} so an unknown
 * code is never lost.</p>
 */
public enum ModbusExceptionCode
{
    ILLEGAL_FUNCTION(0x01, "Illegal Function",
            "The function code received in the query is not an allowable action for the server."),
    ILLEGAL_DATA_ADDRESS(0x02, "Illegal Data Address",
            "The data address received in the query is not an allowable address for the server."),
    ILLEGAL_DATA_VALUE(0x03, "Illegal Data Value",
            "A value contained in the query data field is not an allowable value for the server."),
    SERVER_DEVICE_FAILURE(0x04, "Server Device Failure",
            "An unrecoverable error occurred while the server was attempting to perform the requested action."),
    ACKNOWLEDGE(0x05, "Acknowledge",
            "The server has accepted the request and is processing it, but a long duration of time will be required."),
    SERVER_DEVICE_BUSY(0x06, "Server Device Busy",
            "The server is engaged in processing a long-duration program command."),
    NEGATIVE_ACKNOWLEDGE(0x07, "Negative Acknowledge",
            "The server cannot perform the program function received in the query."),
    MEMORY_PARITY_ERROR(0x08, "Memory Parity Error",
            "The server attempted to read extended memory or record file, but detected a parity error in memory."),
    GATEWAY_PATH_UNAVAILABLE(0x0A, "Gateway Path Unavailable",
            "The gateway was unable to allocate an internal communication path from the input port to the output port."),
    GATEWAY_TARGET_DEVICE_FAILED_TO_RESPOND(0x0B, "Gateway Target Device Failed to Respond",
            "No response was obtained from the target device."),
    UNKNOWN(-1, "Unknown Exception",
            "The server reported an exception code this client does not recognise.");

    private final int code;
    private final String title;
    private final String description;

    ModbusExceptionCode(int code, String title, String description) {
        this.code = code;
        this.title = title;
        this.description = description;
    }

    /**
     * Resolves a wire exception code; never returns null.
     */
    public static ModbusExceptionCode of(int code) {
        for (ModbusExceptionCode e : values()) {
            if (e != UNKNOWN && e.code == code) {
                return e;
            }
        }
        return UNKNOWN;
    }

    /** Wire value, or -1 for {@link #UNKNOWN}. */
    public int code() {
        return code;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }
}
