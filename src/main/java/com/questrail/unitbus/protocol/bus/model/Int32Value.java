package com.questrail.unitbus.protocol.bus.model;

/**
 * Signed 32-bit header value (signature {@code i}).
 */
public record Int32Value(int value) implements HeaderValue
{
    @Override
    public Kind kind() {
        return Kind.INT32;
    }
}
