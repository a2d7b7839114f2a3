package com.questrail.unitbus.protocol.bus.model;

import java.util.Optional;

/**
 * Known header field codes.
 *
 * <p>The value kind each field must carry is defined by
 * {@link HeaderFieldRegistry}, not by this enum.</p>
 */
public enum HeaderField
{
    PATH(1),
    INTERFACE(2),
    MEMBER(3),
    ERROR_NAME(4),
    REPLY_SERIAL(5),
    DESTINATION(6),
    SENDER(7),
    SIGNATURE(8),
    UNIX_FDS(9);

    private final int code;

    HeaderField(int code)
    {
        this.code = code;
    }

    public int code()
    {
        return code;
    }

    public static Optional<HeaderField> fromCode(int code)
    {
        for (HeaderField f : values()) {
            if (f.code == code) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }
}
