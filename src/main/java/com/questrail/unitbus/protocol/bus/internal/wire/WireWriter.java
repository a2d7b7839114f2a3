package com.questrail.unitbus.protocol.bus.internal.wire;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * WireWriter
 * -----------------------------------------------------------------------------
 * Byte-order and alignment aware writer of primitive wire values into an
 * in-memory buffer.
 *
 * <p>Everything is assembled in memory first; callers hand the finished array
 * to the transport in a single write. Padding is always written as zero bytes.
 * Offsets are measured from the first byte written, so the same writer serves
 * both a whole message and a stand-alone body (the body begins at an 8-byte
 * boundary, which makes body-relative and message-relative alignment agree).</p>
 */
public final class WireWriter
{
    /**
     * Position bookkeeping for an array under construction.
     *
     * @param lengthOffset  offset of the uint32 length word to patch
     * @param contentStart  offset of the first element (after element padding)
     */
    public record ArrayMark(int lengthOffset, int contentStart) {}

    private final ByteOrder order;
    private byte[] buf = new byte[64];
    private int size;

    public WireWriter(ByteOrder order)
    {
        this.order = Objects.requireNonNull(order, "order");
    }

    public int position()
    {
        return size;
    }

    public ByteOrder order()
    {
        return order;
    }

    public void align(int alignment)
    {
        int pad = (alignment - (size % alignment)) % alignment;
        ensure(pad);
        // buffer slack is already zero-filled
        size += pad;
    }

    public void writeByte(int value)
    {
        ensure(1);
        buf[size++] = (byte) value;
    }

    public void writeBoolean(boolean value)
    {
        writeUint32(value ? 1 : 0);
    }

    public void writeInt16(short value)
    {
        align(2);
        ensure(2);
        ByteBuffer.wrap(buf, size, 2).order(order).putShort(value);
        size += 2;
    }

    public void writeInt32(int value)
    {
        align(4);
        ensure(4);
        ByteBuffer.wrap(buf, size, 4).order(order).putInt(value);
        size += 4;
    }

    public void writeUint32(long value)
    {
        if (value < 0 || value > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("uint32 out of range: " + value);
        }
        writeInt32((int) value);
    }

    public void writeInt64(long value)
    {
        align(8);
        ensure(8);
        ByteBuffer.wrap(buf, size, 8).order(order).putLong(value);
        size += 8;
    }

    public void writeDouble(double value)
    {
        writeInt64(Double.doubleToRawLongBits(value));
    }

    /**
     * Writes a length-prefixed, NUL-terminated UTF-8 string.
     *
     * @throws IllegalArgumentException if {@code value} holds an unpaired surrogate
     */
    public void writeString(String value)
    {
        final ByteBuffer encoded;
        try {
            encoded = StandardCharsets.UTF_8.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(value));
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("string is not encodable as UTF-8", e);
        }
        byte[] bytes = new byte[encoded.remaining()];
        encoded.get(bytes);
        writeUint32(bytes.length);
        writeBytes(bytes);
        writeByte(0);
    }

    public void writeObjectPath(String path)
    {
        if (!ObjectPaths.isValid(path)) {
            throw new IllegalArgumentException("invalid object path '" + path + "'");
        }
        writeString(path);
    }

    public void writeSignature(String signature)
    {
        for (int i = 0; i < signature.length(); i++) {
            if (signature.charAt(i) >= 0x80) {
                throw new IllegalArgumentException("signature contains non-ASCII character at " + i);
            }
        }
        byte[] bytes = signature.getBytes(StandardCharsets.US_ASCII);
        if (bytes.length > 255) {
            throw new IllegalArgumentException("signature longer than 255 bytes");
        }
        writeByte(bytes.length);
        writeBytes(bytes);
        writeByte(0);
    }

    public void writeBytes(byte[] bytes)
    {
        ensure(bytes.length);
        System.arraycopy(bytes, 0, buf, size, bytes.length);
        size += bytes.length;
    }

    /**
     * Writes a placeholder length word and the padding required before the
     * first element. Finish with {@link #endArray(ArrayMark)}.
     */
    public ArrayMark beginArray(int elementAlignment)
    {
        align(4);
        int lengthOffset = size;
        writeInt32(0);
        // padding before the first element is not counted in the array length
        align(elementAlignment);
        return new ArrayMark(lengthOffset, size);
    }

    public void endArray(ArrayMark mark)
    {
        int length = size - mark.contentStart();
        ByteBuffer.wrap(buf, mark.lengthOffset(), 4).order(order).putInt(length);
    }

    public byte[] toByteArray()
    {
        return Arrays.copyOf(buf, size);
    }

    private void ensure(int extra)
    {
        if (size + extra > buf.length) {
            buf = Arrays.copyOf(buf, Math.max(buf.length * 2, size + extra));
        }
    }
}
