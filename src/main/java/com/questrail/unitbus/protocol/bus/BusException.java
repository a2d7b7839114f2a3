package com.questrail.unitbus.protocol.bus;

/**
 * Base type of every checked, protocol-level failure raised by this library.
 *
 * <p>Transport failures are not represented here: they surface as the
 * {@link java.io.IOException} raised by the underlying stream or channel,
 * unwrapped.</p>
 */
public abstract class BusException extends Exception
{
    protected BusException(String message)
    {
        super(message);
    }

    protected BusException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
