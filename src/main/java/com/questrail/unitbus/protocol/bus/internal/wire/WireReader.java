package com.questrail.unitbus.protocol.bus.internal.wire;

import com.questrail.unitbus.protocol.bus.model.BusProtocol;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * WireReader
 * -----------------------------------------------------------------------------
 * Byte-order and alignment aware reader of primitive wire values.
 *
 * <p>The reader tracks its offset from the start of the message (or body) so
 * that every value can be aligned to its natural boundary. Padding bytes are
 * consumed and discarded.</p>
 *
 * <p>Two kinds of failure are kept apart:</p>
 * <ul>
 *   <li>{@link IOException}: the stream itself failed or ended early
 *       ({@link EOFException}); propagated unchanged</li>
 *   <li>{@link MalformedWireDataException}: the bytes were read but do not
 *       form a valid value</li>
 * </ul>
 *
 * <p>Instances are single-use and not thread-safe.</p>
 */
public final class WireReader
{
    private final InputStream in;
    private final ByteOrder order;
    private final byte[] scratch = new byte[8];
    private long position;

    /**
     * @param in       source stream
     * @param order    byte order for multi-byte scalars
     * @param position offset of the next byte relative to the alignment origin
     */
    public WireReader(InputStream in, ByteOrder order, long position)
    {
        this.in = Objects.requireNonNull(in, "in");
        this.order = Objects.requireNonNull(order, "order");
        this.position = position;
    }

    public long position()
    {
        return position;
    }

    public ByteOrder order()
    {
        return order;
    }

    /**
     * Skips padding up to the next multiple of {@code alignment}.
     */
    public void align(int alignment) throws IOException
    {
        long pad = (alignment - (position % alignment)) % alignment;
        if (pad > 0) {
            readFully(scratch, 0, (int) pad);
        }
    }

    public int readByte() throws IOException
    {
        readFully(scratch, 0, 1);
        return scratch[0] & 0xFF;
    }

    public boolean readBoolean() throws IOException, MalformedWireDataException
    {
        long v = readUint32();
        if (v > 1) {
            throw new MalformedWireDataException("boolean must be 0 or 1 (was " + v + ")");
        }
        return v == 1;
    }

    public short readInt16() throws IOException
    {
        align(2);
        readFully(scratch, 0, 2);
        return ByteBuffer.wrap(scratch, 0, 2).order(order).getShort();
    }

    public int readUint16() throws IOException
    {
        return readInt16() & 0xFFFF;
    }

    public int readInt32() throws IOException
    {
        align(4);
        readFully(scratch, 0, 4);
        return ByteBuffer.wrap(scratch, 0, 4).order(order).getInt();
    }

    public long readUint32() throws IOException
    {
        return readInt32() & 0xFFFF_FFFFL;
    }

    public long readInt64() throws IOException
    {
        align(8);
        readFully(scratch, 0, 8);
        return ByteBuffer.wrap(scratch, 0, 8).order(order).getLong();
    }

    public double readDouble() throws IOException
    {
        return Double.longBitsToDouble(readInt64());
    }

    /**
     * Reads a string: uint32 byte length, UTF-8 bytes, NUL terminator.
     */
    public String readString() throws IOException, MalformedWireDataException
    {
        long length = readUint32();
        if (length > BusProtocol.MAX_ARRAY_LENGTH) {
            throw new MalformedWireDataException("string length " + length + " too large");
        }
        return readTerminated((int) length);
    }

    public String readObjectPath() throws IOException, MalformedWireDataException
    {
        String path = readString();
        if (!ObjectPaths.isValid(path)) {
            throw new MalformedWireDataException("invalid object path '" + path + "'");
        }
        return path;
    }

    /**
     * Reads a signature: one length byte, ASCII type codes, NUL terminator.
     */
    public String readSignature() throws IOException, MalformedWireDataException
    {
        int length = readByte();
        return readTerminated(length);
    }

    /**
     * Reads exactly {@code length} raw bytes.
     */
    public byte[] readBytes(int length) throws IOException
    {
        byte[] out = new byte[length];
        readFully(out, 0, length);
        return out;
    }

    private String readTerminated(int length) throws IOException, MalformedWireDataException
    {
        byte[] bytes = readBytes(length);
        if (readByte() != 0) {
            throw new MalformedWireDataException("string not NUL-terminated");
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new MalformedWireDataException("string is not valid UTF-8");
        }
    }

    private void readFully(byte[] buf, int off, int len) throws IOException
    {
        int done = 0;
        while (done < len) {
            int n = in.read(buf, off + done, len - done);
            if (n < 0) {
                throw new EOFException("stream ended after " + (position + done)
                        + " bytes, " + (len - done) + " more expected");
            }
            done += n;
        }
        position += len;
    }
}
