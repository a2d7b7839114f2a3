package com.questrail.unitbus.protocol.bus.codec;

import com.questrail.unitbus.protocol.bus.model.BusMessage;
import com.questrail.unitbus.protocol.bus.validate.InvalidMessageException;

import java.io.IOException;
import java.io.OutputStream;

/**
 * BusMessageEncoder
 * -----------------------------------------------------------------------------
 * Outbound boundary between a {@link BusMessage} and raw bytes.
 *
 * <p>The message is validated before anything is produced, so an invalid
 * message never reaches the transport, not even partially.</p>
 */
public interface BusMessageEncoder
{
    /**
     * Validates and serializes {@code message} into its complete wire form.
     *
     * @throws InvalidMessageException if the message violates a protocol invariant
     */
    byte[] encode(BusMessage message) throws InvalidMessageException;

    /**
     * Validates and serializes {@code message}, then writes it to {@code out}
     * with a single {@link OutputStream#write(byte[])} call.
     *
     * <p>Write failures propagate unchanged; a transport may still have
     * accepted part of the message when one occurs.</p>
     */
    default void encode(BusMessage message, OutputStream out) throws IOException, InvalidMessageException
    {
        byte[] bytes = encode(message);
        out.write(bytes);
    }
}
