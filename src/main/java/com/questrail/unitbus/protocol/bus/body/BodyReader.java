package com.questrail.unitbus.protocol.bus.body;

import com.questrail.unitbus.protocol.bus.internal.wire.MalformedWireDataException;
import com.questrail.unitbus.protocol.bus.internal.wire.Signatures;
import com.questrail.unitbus.protocol.bus.internal.wire.WireReader;
import com.questrail.unitbus.protocol.bus.model.BusByteOrder;
import com.questrail.unitbus.protocol.bus.model.BusMessage;
import com.questrail.unitbus.protocol.bus.model.BusProtocol;
import com.questrail.unitbus.protocol.bus.validate.InvalidMessageException;
import com.questrail.unitbus.protocol.bus.validate.Violation;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * BodyReader
 * -----------------------------------------------------------------------------
 * Signature-driven reader for message bodies.
 *
 * <p>Values are mapped onto plain Java objects:</p>
 * <ul>
 *   <li>{@code y q i h} → {@link Integer}, {@code n} → {@link Short},
 *       {@code u x t} → {@link Long}, {@code d} → {@link Double},
 *       {@code b} → {@link Boolean}, {@code s o g} → {@link String}</li>
 *   <li>{@code ay} → {@code byte[]}</li>
 *   <li>{@code a{..}} → {@link LinkedHashMap} in wire order</li>
 *   <li>other arrays → {@link List}; structs → {@code List<Object>}</li>
 *   <li>{@code v} → the contained value</li>
 * </ul>
 *
 * <p>Any mismatch between signature and bytes is reported as
 * {@link Violation#MALFORMED_BODY}.</p>
 */
public final class BodyReader
{
    private static final int MAX_VARIANT_DEPTH = 64;

    private final String signature;
    private final byte[] body;
    private final WireReader wire;

    public BodyReader(BusByteOrder order, String signature, byte[] body)
    {
        this.signature = Objects.requireNonNull(signature, "signature");
        this.body = Objects.requireNonNull(body, "body");
        this.wire = new WireReader(new ByteArrayInputStream(body),
                Objects.requireNonNull(order, "order").toByteOrder(), 0);
    }

    public static BodyReader of(BusMessage message)
    {
        return new BodyReader(message.byteOrder(), message.signature(), message.body());
    }

    /**
     * Reads every value the signature declares and requires the body to end there.
     */
    public List<Object> readAll() throws InvalidMessageException
    {
        try {
            List<Object> values = new ArrayList<>();
            for (String type : Signatures.split(signature)) {
                values.add(readValue(type, 0));
            }
            if (wire.position() != body.length) {
                throw new MalformedWireDataException((body.length - wire.position())
                        + " trailing bytes after signature '" + signature + "'");
            }
            return values;
        } catch (IOException | MalformedWireDataException e) {
            throw new InvalidMessageException(Violation.MALFORMED_BODY, e.getMessage(), e);
        }
    }

    /**
     * Reads the body of {@code message} and returns its first value as a
     * string, or empty when the body does not start with a readable one.
     */
    public static Optional<String> firstString(BusMessage message)
    {
        if (!message.signature().startsWith("s")) {
            return Optional.empty();
        }
        try {
            return Optional.of((String) of(message).readAll().get(0));
        } catch (InvalidMessageException e) {
            return Optional.empty();
        }
    }

    private Object readValue(String type, int variantDepth) throws IOException, MalformedWireDataException
    {
        final char code = type.charAt(0);
        switch (code) {
            case 'y':
                return wire.readByte();
            case 'b':
                return wire.readBoolean();
            case 'n':
                return wire.readInt16();
            case 'q':
                return wire.readUint16();
            case 'i':
            case 'h':
                return wire.readInt32();
            case 'u':
                return wire.readUint32();
            case 'x':
            case 't':
                return wire.readInt64();
            case 'd':
                return wire.readDouble();
            case 's':
                return wire.readString();
            case 'o':
                return wire.readObjectPath();
            case 'g':
                return wire.readSignature();
            case 'v':
                return readVariant(variantDepth);
            case 'a':
                return readArray(type.substring(1), variantDepth);
            case '(':
                return readStruct(type.substring(1, type.length() - 1), variantDepth);
            default:
                throw new MalformedWireDataException("unsupported type '" + type + "'");
        }
    }

    private Object readVariant(int variantDepth) throws IOException, MalformedWireDataException
    {
        if (variantDepth >= MAX_VARIANT_DEPTH) {
            throw new MalformedWireDataException("variants nested too deeply");
        }
        String inner = wire.readSignature();
        if (inner.isEmpty() || Signatures.endOfCompleteType(inner, 0) != inner.length()) {
            throw new MalformedWireDataException("variant signature '" + inner + "' is not a single complete type");
        }
        return readValue(inner, variantDepth + 1);
    }

    private Object readArray(String elementType, int variantDepth) throws IOException, MalformedWireDataException
    {
        long length = wire.readUint32();
        if (length > BusProtocol.MAX_ARRAY_LENGTH || length > body.length - wire.position()) {
            throw new MalformedWireDataException("array of " + length + " bytes");
        }
        wire.align(Signatures.alignmentOf(elementType.charAt(0)));

        if (elementType.equals("y")) {
            return wire.readBytes((int) length);
        }

        final long end = wire.position() + length;
        if (elementType.charAt(0) == '{') {
            String keyType = elementType.substring(1, 2);
            String valueType = elementType.substring(2, elementType.length() - 1);
            Map<Object, Object> entries = new LinkedHashMap<>();
            while (wire.position() < end) {
                wire.align(8);
                Object key = readValue(keyType, variantDepth);
                entries.put(key, readValue(valueType, variantDepth));
            }
            requireEnd(end);
            return entries;
        }

        List<Object> elements = new ArrayList<>();
        while (wire.position() < end) {
            elements.add(readValue(elementType, variantDepth));
        }
        requireEnd(end);
        return elements;
    }

    private List<Object> readStruct(String fieldTypes, int variantDepth) throws IOException, MalformedWireDataException
    {
        wire.align(8);
        List<Object> fields = new ArrayList<>();
        for (String t : Signatures.split(fieldTypes)) {
            fields.add(readValue(t, variantDepth));
        }
        return fields;
    }

    private void requireEnd(long end) throws MalformedWireDataException
    {
        if (wire.position() != end) {
            throw new MalformedWireDataException("array overruns its declared length");
        }
    }
}
