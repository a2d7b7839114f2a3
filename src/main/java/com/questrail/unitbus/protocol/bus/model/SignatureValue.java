package com.questrail.unitbus.protocol.bus.model;

import java.util.Objects;

/**
 * Type signature header value (signature {@code g}), e.g. {@code "ss"}.
 */
public record SignatureValue(String signature) implements HeaderValue
{
    /** Longest signature the wire format can carry (one-byte length prefix). */
    public static final int MAX_LENGTH = 255;

    public SignatureValue {
        Objects.requireNonNull(signature, "signature");
        if (signature.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                    "signature longer than " + MAX_LENGTH + " characters");
        }
    }

    @Override
    public Kind kind() {
        return Kind.SIGNATURE;
    }
}
