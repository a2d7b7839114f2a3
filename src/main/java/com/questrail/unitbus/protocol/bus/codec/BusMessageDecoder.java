package com.questrail.unitbus.protocol.bus.codec;

import com.questrail.unitbus.protocol.bus.model.BusMessage;
import com.questrail.unitbus.protocol.bus.validate.InvalidMessageException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * BusMessageDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary between raw bytes and a validated {@link BusMessage}.
 *
 * <p>The decoder is responsible for:</p>
 * <ul>
 *   <li>Byte-order negotiation from the first byte</li>
 *   <li>Parsing the fixed preamble and the header field array</li>
 *   <li>Discarding the padding that aligns the body to 8 bytes</li>
 *   <li>Reading the body and validating the assembled message</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Interpreting the body</li>
 *   <li>Correlating replies with calls</li>
 *   <li>Retrying, buffering across calls, or timeouts</li>
 * </ul>
 */
public interface BusMessageDecoder
{
    /**
     * Reads exactly one message from {@code in}.
     *
     * <p>The caller must have exclusive use of the stream for the duration of
     * the call. On failure no message is returned; how many bytes were
     * consumed is unspecified.</p>
     *
     * @throws IOException             any failure of the stream, unchanged,
     *                                 including {@link java.io.EOFException}
     *                                 when it ends mid-message
     * @throws InvalidMessageException if the bytes are not a valid message
     */
    BusMessage decode(InputStream in) throws IOException, InvalidMessageException;

    /**
     * Decodes a complete message held in memory.
     */
    default BusMessage decode(byte[] frame) throws IOException, InvalidMessageException
    {
        return decode(new ByteArrayInputStream(frame));
    }
}
