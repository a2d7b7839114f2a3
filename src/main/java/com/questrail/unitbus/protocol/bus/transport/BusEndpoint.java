package com.questrail.unitbus.protocol.bus.transport;

import java.io.IOException;

/**
 * BusEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a stream transport carrying bus messages.
 *
 * <p>The endpoint owns framing only: it cuts the inbound byte stream into
 * complete messages and writes outbound messages as given. Decoding,
 * validation and reply correlation happen above this port.</p>
 *
 * <p>Implementations may be backed by Netty or a test harness.</p>
 */
public interface BusEndpoint
{
    /**
     * Start the endpoint and begin connecting.
     *
     * <p>On success the endpoint MUST notify its listener via
     * {@link BusEndpointListener#onTransportUp()}; on failure via
     * {@link BusEndpointListener#onTransportDown(Throwable)}.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     *
     * <p>The listener is notified via
     * {@link BusEndpointListener#onTransportDown(Throwable)} at most once per
     * transition.</p>
     */
    void stop();

    /**
     * Write one complete, encoded message.
     *
     * @throws IOException if the transport is not connected or the write fails
     */
    void send(byte[] message) throws IOException;

    /**
     * Register the listener that receives inbound messages and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(BusEndpointListener listener);
}
