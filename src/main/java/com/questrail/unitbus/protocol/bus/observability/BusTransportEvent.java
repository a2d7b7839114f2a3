package com.questrail.unitbus.protocol.bus.observability;

import java.time.Instant;

/**
 * Record of a transport lifecycle change.
 *
 * @param cause failure that brought the transport down; {@code null} for
 *              {@link State#UP} and for an orderly shutdown
 */
public record BusTransportEvent(
    Instant timestamp,
    State state,
    Throwable cause
) {
    public enum State {
        UP,
        DOWN
    }
}
