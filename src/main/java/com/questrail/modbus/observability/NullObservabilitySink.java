package com.questrail.modbus.observability;

/**
 * No-op implementation of ModbusObservabilitySink.
 */
public final class NullObservabilitySink implements ModbusObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onExchange(ModbusExchangeEvent event) {}

    @Override
    public void onFrame(ModbusFrameEvent event) {}

    @Override
    public void onTransportEvent(ModbusTransportObservabilityEvent event) {}

    @Override
    public void onError(ModbusErrorEvent event) {}
}
