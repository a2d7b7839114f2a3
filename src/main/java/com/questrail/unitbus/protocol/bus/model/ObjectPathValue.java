package com.questrail.unitbus.protocol.bus.model;

import java.util.Objects;

/**
 * Object path header value (signature {@code o}), e.g. {@code /org/freedesktop/systemd1}.
 *
 * <p>Kept distinct from {@link StringValue}: a string where the registry
 * expects an object path is a type mismatch.</p>
 */
public record ObjectPathValue(String path) implements HeaderValue
{
    public ObjectPathValue {
        Objects.requireNonNull(path, "path");
    }

    @Override
    public Kind kind() {
        return Kind.OBJECT_PATH;
    }
}
