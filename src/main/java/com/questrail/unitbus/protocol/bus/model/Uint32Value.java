package com.questrail.unitbus.protocol.bus.model;

/**
 * Unsigned 32-bit header value (signature {@code u}), held in a {@code long}.
 */
public record Uint32Value(long value) implements HeaderValue
{
    public Uint32Value {
        if (value < 0 || value > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("uint32 out of range: " + value);
        }
    }

    @Override
    public Kind kind() {
        return Kind.UINT32;
    }
}
