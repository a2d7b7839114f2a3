package com.questrail.unitbus.protocol.bus.validate;

import com.questrail.unitbus.protocol.bus.internal.wire.MalformedWireDataException;
import com.questrail.unitbus.protocol.bus.internal.wire.ObjectPaths;
import com.questrail.unitbus.protocol.bus.internal.wire.Signatures;
import com.questrail.unitbus.protocol.bus.model.BusMessage;
import com.questrail.unitbus.protocol.bus.model.HeaderField;
import com.questrail.unitbus.protocol.bus.model.HeaderFieldRegistry;
import com.questrail.unitbus.protocol.bus.model.HeaderValue;
import com.questrail.unitbus.protocol.bus.model.MessageFlag;
import com.questrail.unitbus.protocol.bus.model.MessageType;
import com.questrail.unitbus.protocol.bus.model.ObjectPathValue;
import com.questrail.unitbus.protocol.bus.model.SignatureValue;
import com.questrail.unitbus.protocol.bus.model.StringValue;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * MessageValidator
 * -----------------------------------------------------------------------------
 * Checks a {@link BusMessage} against the structural invariants of the protocol.
 *
 * <p>Checks run in a fixed order and stop at the first violation:</p>
 * <ol>
 *   <li>byte order is one of the two known orders</li>
 *   <li>no flag bit outside {@link MessageFlag#KNOWN_MASK}</li>
 *   <li>message type is a known, non-zero type</li>
 *   <li>every header has a known code and a value of the registered kind
 *       (headers are visited in ascending code order)</li>
 *   <li>every header value is writable: object paths are well formed,
 *       signatures are ASCII and parse into complete types, strings hold no
 *       unpaired surrogates</li>
 *   <li>every field required for the message type is present</li>
 *   <li>a non-empty body is accompanied by a SIGNATURE header</li>
 * </ol>
 *
 * <p>The validator has no side effects and holds no state.</p>
 */
public final class MessageValidator
{
    private MessageValidator() {}

    /**
     * Validates {@code message}.
     *
     * @throws InvalidMessageException describing the first violation found
     */
    public static void validate(BusMessage message) throws InvalidMessageException
    {
        Objects.requireNonNull(message, "message");

        if (message.byteOrder() == null) {
            throw new InvalidMessageException(Violation.INVALID_BYTE_ORDER, "byte order not set");
        }

        if ((message.flags() & ~MessageFlag.KNOWN_MASK) != 0) {
            throw new InvalidMessageException(Violation.INVALID_FLAGS,
                    "unknown flag bits 0x" + Integer.toHexString(message.flags() & ~MessageFlag.KNOWN_MASK));
        }

        final MessageType type = message.type().orElseThrow(() ->
                new InvalidMessageException(Violation.INVALID_MESSAGE_TYPE,
                        "type code " + message.typeCode()));

        for (Map.Entry<Integer, HeaderValue> e : message.headers().entrySet()) {
            final int code = e.getKey();
            final HeaderField field = HeaderField.fromCode(code).orElseThrow(() ->
                    new InvalidMessageException(Violation.INVALID_HEADER_FIELD, "header field code " + code));

            final HeaderValue.Kind expected = HeaderFieldRegistry.expectedKind(field);
            if (e.getValue().kind() != expected) {
                throw new InvalidMessageException(Violation.HEADER_TYPE_MISMATCH, field,
                        field + " expects " + expected + " but carries " + e.getValue().kind());
            }
            checkWritable(field, e.getValue());
        }

        for (HeaderField required : HeaderFieldRegistry.requiredFields(type)) {
            if (!message.hasHeader(required)) {
                throw new InvalidMessageException(Violation.MISSING_REQUIRED_HEADER, required,
                        type + " requires " + required);
            }
        }

        if (message.bodyLength() != 0 && !message.hasHeader(HeaderField.SIGNATURE)) {
            throw new InvalidMessageException(Violation.MISSING_SIGNATURE,
                    "body of " + message.bodyLength() + " bytes without SIGNATURE header");
        }
    }

    private static void checkWritable(HeaderField field, HeaderValue value) throws InvalidMessageException
    {
        if (value instanceof ObjectPathValue p) {
            if (!ObjectPaths.isValid(p.path())) {
                throw new InvalidMessageException(Violation.MALFORMED_HEADER, field,
                        field + " is not a valid object path: '" + p.path() + "'");
            }
        }
        else if (value instanceof SignatureValue s) {
            if (!isAscii(s.signature())) {
                throw new InvalidMessageException(Violation.MALFORMED_HEADER, field,
                        field + " contains non-ASCII characters");
            }
            try {
                Signatures.split(s.signature());
            } catch (MalformedWireDataException ex) {
                throw new InvalidMessageException(Violation.MALFORMED_HEADER, field, ex.getMessage());
            }
        }
        else if (value instanceof StringValue str) {
            if (!StandardCharsets.UTF_8.newEncoder().canEncode(str.value())) {
                throw new InvalidMessageException(Violation.MALFORMED_HEADER, field,
                        field + " is not encodable as UTF-8");
            }
        }
    }

    private static boolean isAscii(String s)
    {
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) >= 0x80) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns true if {@link #validate(BusMessage)} would accept {@code message}.
     */
    public static boolean isValid(BusMessage message)
    {
        try {
            validate(message);
            return true;
        } catch (InvalidMessageException e) {
            return false;
        }
    }
}
