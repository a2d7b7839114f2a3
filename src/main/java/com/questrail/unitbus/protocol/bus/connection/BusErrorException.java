package com.questrail.unitbus.protocol.bus.connection;

import com.questrail.unitbus.protocol.bus.BusException;
import com.questrail.unitbus.protocol.bus.body.BodyReader;
import com.questrail.unitbus.protocol.bus.model.BusMessage;

import java.util.Objects;
import java.util.Optional;

/**
 * Raised when the peer answers a method call with an ERROR message.
 *
 * <p>The error name (e.g. {@code org.freedesktop.systemd1.NoSuchUnit}) is the
 * stable part callers branch on; the detail is the first string argument of
 * the error body, when present.</p>
 */
public final class BusErrorException extends BusException
{
    private final String errorName;
    private final String detail;

    public BusErrorException(String errorName, String detail)
    {
        super(detail == null ? errorName : errorName + ": " + detail);
        this.errorName = Objects.requireNonNull(errorName, "errorName");
        this.detail = detail;
    }

    /**
     * Builds the exception from a received ERROR message.
     */
    public static BusErrorException fromReply(BusMessage error)
    {
        String name = error.errorName().orElse("org.freedesktop.DBus.Error.Failed");
        return new BusErrorException(name, BodyReader.firstString(error).orElse(null));
    }

    public String errorName()
    {
        return errorName;
    }

    public Optional<String> detail()
    {
        return Optional.ofNullable(detail);
    }

    public boolean is(String name)
    {
        return errorName.equals(name);
    }
}
