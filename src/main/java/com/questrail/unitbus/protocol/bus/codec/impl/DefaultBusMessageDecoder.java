package com.questrail.unitbus.protocol.bus.codec.impl;

import com.questrail.unitbus.protocol.bus.codec.BusMessageDecoder;
import com.questrail.unitbus.protocol.bus.internal.wire.MalformedWireDataException;
import com.questrail.unitbus.protocol.bus.internal.wire.WireReader;
import com.questrail.unitbus.protocol.bus.model.BooleanValue;
import com.questrail.unitbus.protocol.bus.model.BusByteOrder;
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

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * DefaultBusMessageDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link BusMessageDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Byte-order negotiation: one byte, {@code 'l'} or {@code 'B'}</li>
 *   <li>Preamble: type, flags, protocol version, body length, serial</li>
 *   <li>Header field array, each value a single-type variant</li>
 *   <li>Padding up to the 8-byte body boundary</li>
 *   <li>Body bytes</li>
 *   <li>Validation of the assembled message</li>
 * </ol>
 *
 * <p>Any protocol version other than {@link BusProtocol#PROTOCOL_VERSION} is
 * rejected. Duplicate header codes keep the last value read.</p>
 */
public final class DefaultBusMessageDecoder implements BusMessageDecoder
{
    @Override
    public BusMessage decode(InputStream in) throws IOException, InvalidMessageException
    {
        Objects.requireNonNull(in, "in");

        // 1) Byte order. Nothing past the marker is read if it is unknown.
        final int marker = in.read();
        if (marker < 0) {
            throw new EOFException("stream ended before byte-order marker");
        }
        final BusByteOrder order = BusByteOrder.fromMarker(marker).orElseThrow(() ->
                new InvalidMessageException(Violation.INVALID_BYTE_ORDER,
                        "marker byte 0x" + Integer.toHexString(marker)));

        // The marker counts towards the alignment offset.
        final WireReader reader = new WireReader(in, order.toByteOrder(), 1);

        final BusMessage.Builder builder = BusMessage.builder().byteOrder(order);
        final long bodyLength;
        try {
            // 2) Fixed preamble
            builder.typeCode(reader.readByte());
            builder.flags(reader.readByte());
            final int version = reader.readByte();
            if (version != BusProtocol.PROTOCOL_VERSION) {
                throw new InvalidMessageException(Violation.UNSUPPORTED_PROTOCOL_VERSION,
                        "protocol version " + version);
            }
            bodyLength = reader.readUint32();
            builder.serial(reader.readUint32());

            // 3) Header field array
            readHeaderFields(reader, builder, bodyLength);
        }
        catch (MalformedWireDataException e) {
            throw new InvalidMessageException(Violation.MALFORMED_HEADER, e.getMessage(), e);
        }

        // 4) Structural padding before the body
        reader.align(BusProtocol.BODY_ALIGNMENT);

        // 5) Body
        if (bodyLength != 0) {
            builder.body(reader.readBytes((int) bodyLength));
        }

        // 6) Validate; an invalid message is never handed out
        final BusMessage message = builder.build();
        MessageValidator.validate(message);
        return message;
    }

    private static void readHeaderFields(WireReader reader, BusMessage.Builder builder, long bodyLength)
            throws IOException, MalformedWireDataException, InvalidMessageException
    {
        final long arrayLength = reader.readUint32();
        if (arrayLength > BusProtocol.MAX_ARRAY_LENGTH) {
            throw new InvalidMessageException(Violation.MESSAGE_TOO_LARGE,
                    "header array of " + arrayLength + " bytes");
        }
        final long total = BusProtocol.align(BusProtocol.FIXED_HEADER_LENGTH + arrayLength, BusProtocol.BODY_ALIGNMENT)
                + bodyLength;
        if (total > BusProtocol.MAX_MESSAGE_LENGTH) {
            throw new InvalidMessageException(Violation.MESSAGE_TOO_LARGE, "message of " + total + " bytes");
        }

        reader.align(8);
        final long end = reader.position() + arrayLength;
        while (reader.position() < end) {
            reader.align(8);
            final int code = reader.readByte();
            builder.header(code, readVariant(reader));
        }
        if (reader.position() != end) {
            throw new MalformedWireDataException("header array overruns its declared length");
        }
    }

    private static HeaderValue readVariant(WireReader reader) throws IOException, MalformedWireDataException
    {
        final String signature = reader.readSignature();
        if (signature.length() != 1) {
            throw new MalformedWireDataException("unsupported header variant signature '" + signature + "'");
        }
        final HeaderValue.Kind kind = HeaderValue.Kind.fromSignature(signature.charAt(0)).orElseThrow(() ->
                new MalformedWireDataException("unsupported header variant signature '" + signature + "'"));

        return switch (kind) {
            case BYTE -> new ByteValue(reader.readByte());
            case BOOLEAN -> new BooleanValue(reader.readBoolean());
            case INT32 -> new Int32Value(reader.readInt32());
            case UINT32 -> new Uint32Value(reader.readUint32());
            case STRING -> new StringValue(reader.readString());
            case OBJECT_PATH -> new ObjectPathValue(reader.readObjectPath());
            case SIGNATURE -> new SignatureValue(reader.readSignature());
        };
    }
}
