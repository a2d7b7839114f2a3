package com.questrail.unitbus.protocol.bus.transport;

/**
 * BusEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link BusEndpoint}.
 *
 * <p>Callbacks are delivered serially. Netty endpoints deliver them on the
 * channel's event loop.</p>
 */
public interface BusEndpointListener
{
    /**
     * Called when the transport becomes usable.
     */
    void onTransportUp();

    /**
     * Called when the transport becomes unusable.
     *
     * @param cause the failure; {@code null} for an orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called with exactly one complete message, as received.
     *
     * <p>The frame has been sized from its preamble but not decoded or
     * validated.</p>
     */
    void onFrame(byte[] frame);
}
