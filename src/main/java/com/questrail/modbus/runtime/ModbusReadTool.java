package com.questrail.modbus.runtime;

import com.questrail.modbus.client.ModbusTcpClient;
import com.questrail.modbus.config.ModbusClientConfig;
import com.questrail.modbus.model.ModbusReadRequest;
import com.questrail.modbus.model.ModbusReadResult;
import com.questrail.modbus.model.RegisterValues;
import com.questrail.modbus.observability.Slf4jModbusObservabilitySink;
import com.questrail.modbus.transport.ModbusStreamConnector;
import com.questrail.modbus.transport.ModbusTransportException;
import com.questrail.modbus.transport.tcp.netty.NettyTcpStreamConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * ModbusReadTool
 * =============================================================================
 * Command-line entry point: connect, perform one read, print the registers.
 *
 * <p>Output is one line per register, {@code <address>: <value>}. A server
 * fault or protocol error is printed instead of registers.</p>
 *
 * <p>Exit codes: {@code 0} registers printed, {@code 1} fault, protocol error
 * or transport failure, {@code 2} invalid arguments.</p>
 */
public final class ModbusReadTool {
    private static final Logger log = LoggerFactory.getLogger(ModbusReadTool.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private ModbusReadTool() {}

    public static void main(String[] args) {
        System.exit(run(args, NettyTcpStreamConnector.INSTANCE, System.out));
    }

    static int run(String[] args, ModbusStreamConnector connector, PrintStream out) {
        final ModbusReadToolOptions options;
        final ModbusReadRequest request;
        final ModbusClientConfig config;
        try {
            options = new ModbusReadToolOptions(args);
            request = options.toRequest();
            config = options.toConfig();
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            out.println(ModbusReadToolOptions.usage());
            return EXIT_USAGE;
        }

        ModbusTcpClient client = ModbusTcpClient.builder()
                .withConfig(config)
                .withConnector(connector)
                .withObservabilitySink(new Slf4jModbusObservabilitySink())
                .build();

        try (client) {
            client.connect();
            return print(request, client.read(request), out);
        } catch (ModbusTransportException e) {
            log.debug("Read against {}:{} failed", options.host, options.port, e);
            out.println("Transport error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static int print(ModbusReadRequest request, ModbusReadResult result, PrintStream out) {
        if (result instanceof ModbusReadResult.ServerFault fault) {
            out.println("Modbus exception 0x" + Integer.toHexString(fault.rawCode()) + ": "
                    + fault.exceptionCode().title());
            return EXIT_FAILURE;
        }
        if (result instanceof ModbusReadResult.ProtocolError error) {
            out.println("Protocol error " + error.kind() + ": " + error.detail());
            return EXIT_FAILURE;
        }

        RegisterValues values = result.registers();
        for (int i = 0; i < values.size(); i++) {
            int address = request.startingAddress() + i;
            if (values instanceof RegisterValues.BitRegisters bits) {
                out.println(address + ": " + bits.get(i));
            } else if (values instanceof RegisterValues.WordRegisters words) {
                out.println(address + ": " + words.get(i));
            }
        }
        return EXIT_OK;
    }
}
