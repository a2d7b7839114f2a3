package com.questrail.unitbus.protocol.bus.model;

import java.util.Optional;

/**
 * Tagged variant value carried by a header field.
 *
 * <h2>Why a sealed hierarchy</h2>
 * <p>
 * On the wire every header value is a variant: a one-character type signature
 * followed by the value. Each permitted implementation corresponds to exactly
 * one {@link Kind}, so checking a header against the registry is a comparison
 * of two enum constants rather than an inspection of runtime classes.
 * </p>
 *
 * <p>
 * Only single basic types are representable. Header fields defined by the
 * protocol never carry containers.
 * </p>
 */
public sealed interface HeaderValue
        permits StringValue, ObjectPathValue, SignatureValue, Uint32Value,
                ByteValue, BooleanValue, Int32Value {

    /**
     * Wire kind of a header value, with its signature character and alignment.
     */
    enum Kind {
        BYTE('y', 1),
        BOOLEAN('b', 4),
        INT32('i', 4),
        UINT32('u', 4),
        STRING('s', 4),
        OBJECT_PATH('o', 4),
        SIGNATURE('g', 1);

        private final char signature;
        private final int alignment;

        Kind(char signature, int alignment) {
            this.signature = signature;
            this.alignment = alignment;
        }

        public char signature() {
            return signature;
        }

        public int alignment() {
            return alignment;
        }

        public static Optional<Kind> fromSignature(char c) {
            for (Kind k : values()) {
                if (k.signature == c) {
                    return Optional.of(k);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Returns the explicit kind tag of this value.
     */
    Kind kind();

    static StringValue string(String value) {
        return new StringValue(value);
    }

    static ObjectPathValue objectPath(String path) {
        return new ObjectPathValue(path);
    }

    static SignatureValue signature(String signature) {
        return new SignatureValue(signature);
    }

    static Uint32Value uint32(long value) {
        return new Uint32Value(value);
    }
}
