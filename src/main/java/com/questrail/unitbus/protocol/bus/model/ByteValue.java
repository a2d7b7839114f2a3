package com.questrail.unitbus.protocol.bus.model;

/**
 * Unsigned byte header value (signature {@code y}).
 */
public record ByteValue(int value) implements HeaderValue
{
    public ByteValue {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException("byte out of range: " + value);
        }
    }

    @Override
    public Kind kind() {
        return Kind.BYTE;
    }
}
