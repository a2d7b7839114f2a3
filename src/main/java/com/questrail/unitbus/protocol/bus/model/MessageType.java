package com.questrail.unitbus.protocol.bus.model;

import java.util.Optional;

/**
 * The four message types carried by the bus.
 *
 * <p>Code {@code 0} is reserved as invalid; codes above {@code 4} are unknown
 * and rejected by validation.</p>
 */
public enum MessageType
{
    METHOD_CALL(1),
    METHOD_RETURN(2),
    ERROR(3),
    SIGNAL(4);

    private final int code;

    MessageType(int code)
    {
        this.code = code;
    }

    public int code()
    {
        return code;
    }

    public static Optional<MessageType> fromCode(int code)
    {
        for (MessageType t : values()) {
            if (t.code == code) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
