package com.questrail.unitbus.protocol.bus.body;

import com.questrail.unitbus.protocol.bus.internal.wire.MalformedWireDataException;
import com.questrail.unitbus.protocol.bus.internal.wire.Signatures;
import com.questrail.unitbus.protocol.bus.internal.wire.WireWriter;
import com.questrail.unitbus.protocol.bus.model.BusByteOrder;

import java.util.Objects;

/**
 * BodyWriter
 * -----------------------------------------------------------------------------
 * Typed writer for message bodies.
 *
 * <p>The caller is responsible for writing values in the order of the
 * signature it later attaches to the message. Alignment is relative to the
 * start of the body, which the encoder places on an 8-byte boundary.</p>
 *
 * <pre>{@code
 * byte[] body = new BodyWriter(BusByteOrder.LITTLE_ENDIAN)
 *         .writeString("nginx.service")
 *         .writeString("replace")
 *         .toByteArray();
 * }</pre>
 */
public final class BodyWriter
{
    /**
     * Writes a nested piece of body content (struct fields, variant value).
     */
    @FunctionalInterface
    public interface Content
    {
        void write(BodyWriter writer);
    }

    /**
     * Writes one array element.
     */
    @FunctionalInterface
    public interface ElementWriter<T>
    {
        void write(BodyWriter writer, T element);
    }

    private final WireWriter wire;

    public BodyWriter(BusByteOrder order)
    {
        this.wire = new WireWriter(Objects.requireNonNull(order, "order").toByteOrder());
    }

    public BodyWriter writeByte(int value)
    {
        wire.writeByte(value);
        return this;
    }

    public BodyWriter writeBoolean(boolean value)
    {
        wire.writeBoolean(value);
        return this;
    }

    public BodyWriter writeInt32(int value)
    {
        wire.writeInt32(value);
        return this;
    }

    public BodyWriter writeUint32(long value)
    {
        wire.writeUint32(value);
        return this;
    }

    public BodyWriter writeInt64(long value)
    {
        wire.writeInt64(value);
        return this;
    }

    public BodyWriter writeDouble(double value)
    {
        wire.writeDouble(value);
        return this;
    }

    public BodyWriter writeString(String value)
    {
        wire.writeString(Objects.requireNonNull(value, "value"));
        return this;
    }

    public BodyWriter writeObjectPath(String path)
    {
        wire.writeObjectPath(Objects.requireNonNull(path, "path"));
        return this;
    }

    public BodyWriter writeSignature(String signature)
    {
        wire.writeSignature(Objects.requireNonNull(signature, "signature"));
        return this;
    }

    /**
     * Writes an array whose elements have the complete type {@code elementSignature}.
     */
    public <T> BodyWriter writeArray(String elementSignature, Iterable<T> elements, ElementWriter<T> elementWriter)
    {
        Objects.requireNonNull(elements, "elements");
        Objects.requireNonNull(elementWriter, "elementWriter");

        WireWriter.ArrayMark mark = wire.beginArray(alignmentOf(elementSignature));
        for (T element : elements) {
            elementWriter.write(this, element);
        }
        wire.endArray(mark);
        return this;
    }

    public BodyWriter writeStringArray(Iterable<String> values)
    {
        return writeArray("s", values, BodyWriter::writeString);
    }

    /**
     * Writes a struct (or dict entry): 8-byte alignment, then the fields.
     */
    public BodyWriter writeStruct(Content fields)
    {
        wire.align(8);
        Objects.requireNonNull(fields, "fields").write(this);
        return this;
    }

    /**
     * Writes a variant holding one value of the complete type {@code signature}.
     */
    public BodyWriter writeVariant(String signature, Content value)
    {
        requireSingleCompleteType(signature);
        wire.writeSignature(signature);
        Objects.requireNonNull(value, "value").write(this);
        return this;
    }

    public int position()
    {
        return wire.position();
    }

    public byte[] toByteArray()
    {
        return wire.toByteArray();
    }

    private static int alignmentOf(String elementSignature)
    {
        Objects.requireNonNull(elementSignature, "elementSignature");
        // dict entries are only complete inside an array
        requireSingleCompleteType("a" + elementSignature);
        try {
            return Signatures.alignmentOf(elementSignature.charAt(0));
        } catch (MalformedWireDataException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    private static void requireSingleCompleteType(String signature)
    {
        Objects.requireNonNull(signature, "signature");
        try {
            if (signature.isEmpty() || Signatures.endOfCompleteType(signature, 0) != signature.length()) {
                throw new IllegalArgumentException("not a single complete type: '" + signature + "'");
            }
        } catch (MalformedWireDataException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }
}
