package com.questrail.unitbus.protocol.bus.model;

/**
 * Boolean header value (signature {@code b}).
 */
public record BooleanValue(boolean value) implements HeaderValue
{
    @Override
    public Kind kind() {
        return Kind.BOOLEAN;
    }
}
