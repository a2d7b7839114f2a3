package com.questrail.unitbus.protocol.bus.model;

import java.util.Objects;

/**
 * UTF-8 string header value (signature {@code s}).
 */
public record StringValue(String value) implements HeaderValue
{
    public StringValue {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public Kind kind() {
        return Kind.STRING;
    }
}
