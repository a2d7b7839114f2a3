package com.questrail.unitbus.protocol.bus.observability;

import com.questrail.unitbus.protocol.bus.model.BusMessage;

import java.time.Instant;

/**
 * Record of a message crossing the transport boundary in either direction.
 */
public record BusMessageEvent(
    Instant timestamp,
    BusMessage message
) {
}
