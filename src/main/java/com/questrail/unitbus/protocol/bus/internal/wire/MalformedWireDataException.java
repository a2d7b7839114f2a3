package com.questrail.unitbus.protocol.bus.internal.wire;

/**
 * Raised by the primitive codec when bytes cannot be read as the requested type.
 *
 * <p>Callers translate it into the protocol violation that fits their context
 * (a malformed header while decoding the preamble, a malformed body when
 * reading arguments).</p>
 */
public final class MalformedWireDataException extends Exception
{
    public MalformedWireDataException(String message)
    {
        super(message);
    }
}
