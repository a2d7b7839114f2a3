package com.questrail.unitbus.protocol.bus.model;

import java.nio.ByteOrder;
import java.util.Optional;

/**
 * Byte order of a bus message, as announced by the first byte on the wire.
 *
 * <p>The order governs every multi-byte scalar that follows in the same
 * message, including the body.</p>
 */
public enum BusByteOrder
{
    LITTLE_ENDIAN((byte) 'l', ByteOrder.LITTLE_ENDIAN),
    BIG_ENDIAN((byte) 'B', ByteOrder.BIG_ENDIAN);

    private final byte marker;
    private final ByteOrder order;

    BusByteOrder(byte marker, ByteOrder order)
    {
        this.marker = marker;
        this.order = order;
    }

    /**
     * Returns the wire marker byte ({@code 'l'} or {@code 'B'}).
     */
    public byte marker()
    {
        return marker;
    }

    /**
     * Returns the equivalent NIO byte order.
     */
    public ByteOrder toByteOrder()
    {
        return order;
    }

    /**
     * Maps a wire marker byte to a byte order.
     *
     * @return the byte order, or {@link Optional#empty()} for any other byte
     */
    public static Optional<BusByteOrder> fromMarker(int marker)
    {
        for (BusByteOrder o : values()) {
            if (o.marker == (byte) marker) {
                return Optional.of(o);
            }
        }
        return Optional.empty();
    }
}
