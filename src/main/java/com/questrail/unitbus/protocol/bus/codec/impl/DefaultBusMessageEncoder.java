package com.questrail.unitbus.protocol.bus.codec.impl;

import com.questrail.unitbus.protocol.bus.codec.BusMessageEncoder;
import com.questrail.unitbus.protocol.bus.internal.wire.WireWriter;
import com.questrail.unitbus.protocol.bus.model.BooleanValue;
import com.questrail.unitbus.protocol.bus.model.BusMessage;
import com.questrail.unitbus.protocol.bus.model.BusProtocol;
import com.questrail.unitbus.protocol.bus.model.ByteValue;
import com.questrail.unitbus.protocol.bus.model.HeaderValue;
import com.questrail.unitbus.protocol.bus.model.Int32Value;
import com.questrail.unitbus.protocol.bus.model.ObjectPathValue;
import com.questrail.unitbus.protocol.bus.model.SignatureValue;
import com.questrail.unitbus.protocol.bus.model.StringValue;
import com.questrail.unitbus.protocol.bus.model.Uint32Value;
import com.questrail.unitbus.protocol.bus.validate.InvalidMessageException;
import com.questrail.unitbus.protocol.bus.validate.MessageValidator;
import com.questrail.unitbus.protocol.bus.validate.Violation;

import java.util.Map;
import java.util.Objects;

/**
 * DefaultBusMessageEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link BusMessageEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultBusMessageDecoder}.
 * The message is written in its own declared byte order, so a decoded
 * message re-encodes to the same preamble it was read from.</p>
 *
 * <p>Headers are written in ascending field-code order. Receivers must not
 * depend on it; it only makes the output reproducible.</p>
 */
public final class DefaultBusMessageEncoder implements BusMessageEncoder
{
    @Override
    public byte[] encode(BusMessage message) throws InvalidMessageException
    {
        Objects.requireNonNull(message, "message");

        // ---------------------------------------------------------------------
        // 1) Validate before producing a single byte
        // ---------------------------------------------------------------------

        MessageValidator.validate(message);

        final byte[] body = message.body();
        final WireWriter writer = new WireWriter(message.byteOrder().toByteOrder());

        // ---------------------------------------------------------------------
        // 2) Preamble; the body length is taken from the body itself
        // ---------------------------------------------------------------------

        writer.writeByte(message.byteOrder().marker());
        writer.writeByte(message.typeCode());
        writer.writeByte(message.flags());
        writer.writeByte(BusProtocol.PROTOCOL_VERSION);
        writer.writeUint32(body.length);
        writer.writeUint32(message.serial());

        // ---------------------------------------------------------------------
        // 3) Header field array of (byte, variant) structs
        // ---------------------------------------------------------------------

        WireWriter.ArrayMark mark = writer.beginArray(8);
        for (Map.Entry<Integer, HeaderValue> e : message.headers().entrySet()) {
            writer.align(8);
            writer.writeByte(e.getKey());
            writeVariant(writer, e.getValue());
        }
        writer.endArray(mark);

        // ---------------------------------------------------------------------
        // 4) Pad to the body boundary and append the body verbatim
        // ---------------------------------------------------------------------

        checkSize(writer.position() - mark.contentStart(),
                BusProtocol.align(writer.position(), BusProtocol.BODY_ALIGNMENT) + body.length);

        writer.align(BusProtocol.BODY_ALIGNMENT);
        if (body.length != 0) {
            writer.writeBytes(body);
        }
        return writer.toByteArray();
    }

    /**
     * Rejects a header array or whole message above the protocol limits.
     */
    static void checkSize(long headerArrayLength, long messageLength) throws InvalidMessageException
    {
        if (headerArrayLength > BusProtocol.MAX_ARRAY_LENGTH) {
            throw new InvalidMessageException(Violation.MESSAGE_TOO_LARGE,
                    "header array of " + headerArrayLength + " bytes exceeds " + BusProtocol.MAX_ARRAY_LENGTH);
        }
        if (messageLength > BusProtocol.MAX_MESSAGE_LENGTH) {
            throw new InvalidMessageException(Violation.MESSAGE_TOO_LARGE,
                    "message of " + messageLength + " bytes exceeds " + BusProtocol.MAX_MESSAGE_LENGTH);
        }
    }

    private static void writeVariant(WireWriter writer, HeaderValue value)
    {
        writer.writeSignature(String.valueOf(value.kind().signature()));

        if (value instanceof StringValue v) {
            writer.writeString(v.value());
        }
        else if (value instanceof ObjectPathValue v) {
            writer.writeObjectPath(v.path());
        }
        else if (value instanceof SignatureValue v) {
            writer.writeSignature(v.signature());
        }
        else if (value instanceof Uint32Value v) {
            writer.writeUint32(v.value());
        }
        else if (value instanceof ByteValue v) {
            writer.writeByte(v.value());
        }
        else if (value instanceof BooleanValue v) {
            writer.writeBoolean(v.value());
        }
        else if (value instanceof Int32Value v) {
            writer.writeInt32(v.value());
        }
        else {
            // unreachable while HeaderValue stays sealed
            throw new IllegalArgumentException("Unsupported header value type: " + value.getClass());
        }
    }
}
