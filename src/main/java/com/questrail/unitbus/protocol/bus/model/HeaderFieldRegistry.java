package com.questrail.unitbus.protocol.bus.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HeaderFieldRegistry
 * -----------------------------------------------------------------------------
 * Static protocol metadata for header fields.
 *
 * <p>Two tables, both built once during class initialization and never
 * mutated afterwards:</p>
 * <ul>
 *   <li>field code → expected {@link HeaderValue.Kind}</li>
 *   <li>message type → header fields that must be present</li>
 * </ul>
 *
 * <p>The tables are unmodifiable and safe to read from any thread without
 * synchronization. The validator checks messages against them, the decoder
 * relies on them indirectly through validation, and higher layers use them to
 * build well-formed method calls.</p>
 */
public final class HeaderFieldRegistry
{
    private static final Map<HeaderField, HeaderValue.Kind> EXPECTED_KINDS;
    private static final Map<MessageType, List<HeaderField>> REQUIRED_FIELDS;

    static {
        Map<HeaderField, HeaderValue.Kind> kinds = new EnumMap<>(HeaderField.class);
        kinds.put(HeaderField.PATH, HeaderValue.Kind.OBJECT_PATH);
        kinds.put(HeaderField.INTERFACE, HeaderValue.Kind.STRING);
        kinds.put(HeaderField.MEMBER, HeaderValue.Kind.STRING);
        kinds.put(HeaderField.ERROR_NAME, HeaderValue.Kind.STRING);
        kinds.put(HeaderField.REPLY_SERIAL, HeaderValue.Kind.UINT32);
        kinds.put(HeaderField.DESTINATION, HeaderValue.Kind.STRING);
        kinds.put(HeaderField.SENDER, HeaderValue.Kind.STRING);
        kinds.put(HeaderField.SIGNATURE, HeaderValue.Kind.SIGNATURE);
        kinds.put(HeaderField.UNIX_FDS, HeaderValue.Kind.UINT32);
        EXPECTED_KINDS = Collections.unmodifiableMap(kinds);

        Map<MessageType, List<HeaderField>> required = new EnumMap<>(MessageType.class);
        required.put(MessageType.METHOD_CALL, List.of(HeaderField.PATH, HeaderField.MEMBER));
        required.put(MessageType.METHOD_RETURN, List.of(HeaderField.REPLY_SERIAL));
        required.put(MessageType.ERROR, List.of(HeaderField.ERROR_NAME, HeaderField.REPLY_SERIAL));
        required.put(MessageType.SIGNAL, List.of(HeaderField.PATH, HeaderField.INTERFACE, HeaderField.MEMBER));
        REQUIRED_FIELDS = Collections.unmodifiableMap(required);
    }

    private HeaderFieldRegistry() {}

    /**
     * Returns the kind a value of {@code field} must have.
     */
    public static HeaderValue.Kind expectedKind(HeaderField field)
    {
        return EXPECTED_KINDS.get(field);
    }

    /**
     * Returns the kind expected for a raw field code, or empty if the code is
     * not a known field.
     */
    public static Optional<HeaderValue.Kind> expectedKind(int code)
    {
        return HeaderField.fromCode(code).map(EXPECTED_KINDS::get);
    }

    /**
     * Returns true if {@code code} names a known, non-zero header field.
     */
    public static boolean isKnownField(int code)
    {
        return HeaderField.fromCode(code).isPresent();
    }

    /**
     * Returns the fields that must be present for a message of {@code type},
     * in the order validation checks them.
     */
    public static List<HeaderField> requiredFields(MessageType type)
    {
        return REQUIRED_FIELDS.get(type);
    }

    /**
     * Unmodifiable view of the full field → kind table.
     */
    public static Map<HeaderField, HeaderValue.Kind> expectedKinds()
    {
        return EXPECTED_KINDS;
    }
}
