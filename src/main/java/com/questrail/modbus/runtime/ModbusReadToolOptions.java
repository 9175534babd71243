package com.questrail.modbus.runtime;

import com.questrail.modbus.config.ModbusClientConfig;
import com.questrail.modbus.model.ModbusReadRequest;

import java.time.Duration;

/**
 * Command-line options for {@link ModbusReadTool}, given as {@code key=value}
 * arguments.
 *
 * <pre>
 *   host=10.0.0.5 port=502 unit=1 function=3 address=0 quantity=10 tid=1 timeout=1000
 * </pre>
 *
 * Only {@code host} is required.
 */
final class ModbusReadToolOptions {
    final String host;
    final int port;
    final int unitId;
    final int functionCode;
    final int startingAddress;
    final int quantity;
    final int transactionId;
    final int timeoutMs;

    ModbusReadToolOptions(String[] args) {
        String h = null;
        int p = ModbusClientConfig.DEFAULT_PORT;
        int unit = 1, fn = 1, addr = 0, qty = 8, tid = 1;
        int to = (int) ModbusClientConfig.DEFAULT_TIMEOUT.toMillis();

        for (String a : args) {
            String[] kv = a.split("=", 2);
            if (kv.length != 2 || kv[1].isBlank()) {
                throw new IllegalArgumentException("Expected key=value, got: " + a);
            }
            String val = kv[1].trim();
            switch (kv[0]) {
                case "host" -> h = val;
                case "port" -> p = parse("port", val);
                case "unit" -> unit = parse("unit", val);
                case "function", "fc" -> fn = parse("function", val);
                case "address", "addr" -> addr = parse("address", val);
                case "quantity", "qty" -> qty = parse("quantity", val);
                case "tid" -> tid = parse("tid", val);
                case "timeout" -> to = parse("timeout", val);
                default -> throw new IllegalArgumentException("Unknown option: " + kv[0]);
            }
        }

        if (h == null) {
            throw new IllegalArgumentException("Missing required option: host");
        }

        host = h;
        port = p;
        unitId = unit;
        functionCode = fn;
        startingAddress = addr;
        quantity = qty;
        transactionId = tid;
        timeoutMs = to;
    }

    ModbusClientConfig toConfig() {
        return ModbusClientConfig.builder()
                .withHost(host)
                .withPort(port)
                .withTimeout(Duration.ofMillis(timeoutMs))
                .build();
    }

    /**
     * @throws com.questrail.modbus.model.InvalidRequestException if the
     *         options do not form a valid read request
     */
    ModbusReadRequest toRequest() {
        return ModbusReadRequest.builder()
                .withTransactionId(transactionId)
                .withUnitId(unitId)
                .withFunctionCode(functionCode)
                .withStartingAddress(startingAddress)
                .withQuantity(quantity)
                .build();
    }

    static String usage() {
        return "usage: host=<address> [port=502] [unit=1] [function=1..4] [address=0] "
                + "[quantity=8] [tid=1] [timeout=1000]";
    }

    /**
     * Decimal, or hexadecimal with a {@code 0x} prefix. Leading zeros stay
     * decimal.
     */
    private static int parse(String key, String val) {
        try {
            if (val.startsWith("0x") || val.startsWith("0X")) {
                return Integer.parseInt(val.substring(2), 16);
            }
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got: " + val, e);
        }
    }
}
