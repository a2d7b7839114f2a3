package com.questrail.unitbus.protocol.bus.internal.wire;

import com.questrail.unitbus.protocol.bus.model.BusByteOrder;
import com.questrail.unitbus.protocol.bus.model.BusProtocol;
import com.questrail.unitbus.protocol.bus.validate.InvalidMessageException;
import com.questrail.unitbus.protocol.bus.validate.Violation;

import java.nio.ByteBuffer;

/**
 * Computes the total length of a message from its fixed 16-byte preamble.
 *
 * <p>Stream transports use this to cut a byte stream into whole messages
 * before handing each one to the decoder:</p>
 * <pre>
 *   total = align8(16 + headerArrayLength) + bodyLength
 * </pre>
 */
public final class MessageSizing
{
    private MessageSizing() {}

    /**
     * @param preamble at least the first {@link BusProtocol#FIXED_HEADER_LENGTH} bytes of a message
     * @return the number of bytes the complete message occupies
     * @throws InvalidMessageException if the marker byte is unknown or the
     *         message exceeds the protocol's size limits
     */
    public static long totalLength(byte[] preamble) throws InvalidMessageException
    {
        if (preamble.length < BusProtocol.FIXED_HEADER_LENGTH) {
            throw new IllegalArgumentException("preamble needs " + BusProtocol.FIXED_HEADER_LENGTH + " bytes");
        }
        final BusByteOrder order = BusByteOrder.fromMarker(preamble[0]).orElseThrow(() ->
                new InvalidMessageException(Violation.INVALID_BYTE_ORDER,
                        "marker byte 0x" + Integer.toHexString(preamble[0] & 0xFF)));

        ByteBuffer bb = ByteBuffer.wrap(preamble).order(order.toByteOrder());
        long bodyLength = bb.getInt(4) & 0xFFFF_FFFFL;
        long headerLength = bb.getInt(12) & 0xFFFF_FFFFL;

        if (headerLength > BusProtocol.MAX_ARRAY_LENGTH) {
            throw new InvalidMessageException(Violation.MESSAGE_TOO_LARGE,
                    "header array of " + headerLength + " bytes");
        }
        long total = BusProtocol.align(BusProtocol.FIXED_HEADER_LENGTH + headerLength, BusProtocol.BODY_ALIGNMENT)
                + bodyLength;
        if (total > BusProtocol.MAX_MESSAGE_LENGTH) {
            throw new InvalidMessageException(Violation.MESSAGE_TOO_LARGE, "message of " + total + " bytes");
        }
        return total;
    }
}
