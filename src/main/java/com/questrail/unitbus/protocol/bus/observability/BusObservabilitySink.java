package com.questrail.unitbus.protocol.bus.observability;

/**
 * Receives observability events from the bus client stack.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface BusObservabilitySink {
    /**
     * Called after a message has been handed to the transport.
     * @param event the sent message
     */
    void onMessageSent(BusMessageEvent event);

    /**
     * Called when a valid message has been decoded from the transport.
     * @param event the received message
     */
    void onMessageReceived(BusMessageEvent event);

    /**
     * Called when a transport-level event occurs (connection up/down).
     * @param event the transport event
     */
    void onTransportEvent(BusTransportEvent event);

    /**
     * Called when an error or anomaly occurs, such as an undecodable frame.
     * @param event the error event
     */
    void onError(BusErrorEvent event);
}
