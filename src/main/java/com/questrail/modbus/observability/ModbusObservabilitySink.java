package com.questrail.modbus.observability;

/**
 * Main interface for receiving Modbus client observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface ModbusObservabilitySink {
    /**
     * Called when an exchange produced a result (success, server fault or protocol error).
     * @param event the exchange details
     */
    void onExchange(ModbusExchangeEvent event);

    /**
     * Called for every ADU written to or read from the stream.
     * @param event the raw frame
     */
    void onFrame(ModbusFrameEvent event);

    /**
     * Called when the connection is opened or closed.
     * @param event the transport event
     */
    void onTransportEvent(ModbusTransportObservabilityEvent event);

    /**
     * Called when a transport failure aborts an exchange or a connect.
     * @param event the error event
     */
    void onError(ModbusErrorEvent event);
}
