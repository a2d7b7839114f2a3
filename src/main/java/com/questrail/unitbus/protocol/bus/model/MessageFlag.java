package com.questrail.unitbus.protocol.bus.model;

/**
 * Flag bits of the message preamble.
 */
public enum MessageFlag
{
    /** The sender does not want a METHOD_RETURN or ERROR for this call. */
    NO_REPLY_EXPECTED(0x1),

    /** The bus must not launch an owner for the destination name. */
    NO_AUTO_START(0x2);

    /** Union of every known flag bit. Any other bit makes a message invalid. */
    public static final int KNOWN_MASK = NO_REPLY_EXPECTED.mask | NO_AUTO_START.mask;

    private final int mask;

    MessageFlag(int mask)
    {
        this.mask = mask;
    }

    public int mask()
    {
        return mask;
    }

    public boolean isSetIn(int flags)
    {
        return (flags & mask) != 0;
    }
}
