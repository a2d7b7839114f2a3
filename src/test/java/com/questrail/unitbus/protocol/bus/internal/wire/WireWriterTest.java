package com.questrail.unitbus.protocol.bus.internal.wire;

import org.junit.jupiter.api.Test;

import java.nio.ByteOrder;

import static org.junit.jupiter.api.Assertions.*;

final class WireWriterTest
{
    @Test
    void alignsScalarsWithZeroPadding()
    {
        WireWriter w = new WireWriter(ByteOrder.LITTLE_ENDIAN);
        w.writeByte(0xAA);
        w.writeInt32(0x01020304);
        w.writeByte(0xBB);
        w.writeInt64(1);

        assertArrayEquals(new byte[] {
                (byte) 0xAA, 0, 0, 0, 4, 3, 2, 1,
                (byte) 0xBB, 0, 0, 0, 0, 0, 0, 0,
                1, 0, 0, 0, 0, 0, 0, 0 }, w.toByteArray());
    }

    @Test
    void bigEndianScalars()
    {
        WireWriter w = new WireWriter(ByteOrder.BIG_ENDIAN);
        w.writeInt16((short) 0x0102);
        w.writeUint32(0xFFFF_FFFEL);

        assertArrayEquals(new byte[] { 1, 2, 0, 0, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFE },
                w.toByteArray());
    }

    @Test
    void stringsAndSignaturesAreNulTerminated()
    {
        WireWriter w = new WireWriter(ByteOrder.LITTLE_ENDIAN);
        w.writeString("ab");
        w.writeSignature("s");

        assertArrayEquals(new byte[] { 2, 0, 0, 0, 'a', 'b', 0, 1, 's', 0 }, w.toByteArray());
    }

    @Test
    void arrayLengthExcludesLeadingPadding()
    {
        WireWriter w = new WireWriter(ByteOrder.LITTLE_ENDIAN);
        WireWriter.ArrayMark mark = w.beginArray(8);
        w.writeInt64(7);
        w.writeInt64(8);
        w.endArray(mark);

        byte[] bytes = w.toByteArray();
        assertEquals(24, bytes.length);
        assertEquals(16, bytes[0]);
        assertEquals(8, mark.contentStart());
    }

    @Test
    void rejectsUnrepresentableValues()
    {
        WireWriter w = new WireWriter(ByteOrder.LITTLE_ENDIAN);
        assertThrows(IllegalArgumentException.class, () -> w.writeUint32(-1));
        assertThrows(IllegalArgumentException.class, () -> w.writeUint32(0x1_0000_0000L));
        assertThrows(IllegalArgumentException.class, () -> w.writeObjectPath("relative/path"));
        assertThrows(IllegalArgumentException.class, () -> w.writeSignature("y".repeat(256)));
    }

    @Test
    void refusesToSubstituteUnencodableCharacters()
    {
        WireWriter w = new WireWriter(ByteOrder.LITTLE_ENDIAN);
        assertThrows(IllegalArgumentException.class, () -> w.writeString("a\ud800"));
        assertThrows(IllegalArgumentException.class, () -> w.writeSignature("\u00e9"));
        assertEquals(0, w.position());

        w.writeString("caf\u00e9");
        assertArrayEquals(new byte[] { 5, 0, 0, 0, 'c', 'a', 'f', (byte) 0xC3, (byte) 0xA9, 0 }, w.toByteArray());
    }
}
