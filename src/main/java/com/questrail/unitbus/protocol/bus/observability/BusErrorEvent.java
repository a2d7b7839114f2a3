package com.questrail.unitbus.protocol.bus.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the bus client stack.
 */
public record BusErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
