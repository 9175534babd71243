package com.questrail.modbus.transport.tcp.netty;

import com.questrail.modbus.transport.ModbusStream;
import com.questrail.modbus.transport.ModbusStreamConnector;
import com.questrail.modbus.transport.ModbusTransportException;

import java.time.Duration;

/**
 * {@link ModbusStreamConnector} that opens {@link NettyTcpModbusStream}s.
 */
public final class NettyTcpStreamConnector implements ModbusStreamConnector
{
    public static final NettyTcpStreamConnector INSTANCE = new NettyTcpStreamConnector();

    private NettyTcpStreamConnector() {}

    @Override
    public ModbusStream connect(String host, int port, Duration connectTimeout, Duration readTimeout)
            throws ModbusTransportException
    {
        return NettyTcpModbusStream.open(host, port, connectTimeout, readTimeout);
    }
}
