package com.questrail.unitbus.protocol.bus.connection;

import com.questrail.unitbus.protocol.bus.model.BusMessage;

/**
 * Receives SIGNAL messages matching a registration on {@link BusConnection}.
 *
 * <p>Handlers run on the transport's event loop and must not block on a
 * method call of the same connection.</p>
 */
@FunctionalInterface
public interface SignalHandler
{
    void onSignal(BusMessage signal);
}
