package com.questrail.unitbus.protocol.bus.model;

/**
 * Wire-level constants shared by the codec and the transport framing.
 */
public final class BusProtocol
{
    /** Major protocol version written into every message and required on decode. */
    public static final int PROTOCOL_VERSION = 1;

    /** Size of the fixed preamble, including the header array length word. */
    public static final int FIXED_HEADER_LENGTH = 16;

    /** The body always starts at a multiple of this many bytes from the message start. */
    public static final int BODY_ALIGNMENT = 8;

    /** Largest array (including the header field array) the protocol permits. */
    public static final long MAX_ARRAY_LENGTH = 64L * 1024 * 1024;

    /** Largest complete message the protocol permits. */
    public static final long MAX_MESSAGE_LENGTH = 128L * 1024 * 1024;

    private BusProtocol() {}

    /**
     * Rounds {@code offset} up to the next multiple of {@code alignment}.
     */
    public static long align(long offset, int alignment)
    {
        long rem = offset % alignment;
        return rem == 0 ? offset : offset + (alignment - rem);
    }
}
