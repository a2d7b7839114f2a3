package com.questrail.unitbus.protocol.bus.connection;

import java.io.IOException;

/**
 * Raised when a blocking call gets no reply within the configured call timeout.
 */
public final class BusCallTimeoutException extends IOException
{
    private final long serial;

    public BusCallTimeoutException(long serial, String message)
    {
        super(message);
        this.serial = serial;
    }

    /**
     * Serial of the call that timed out.
     */
    public long serial()
    {
        return serial;
    }
}
