package com.questrail.unitbus.protocol.bus.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * BusMessage
 * -----------------------------------------------------------------------------
 * In-memory representation of one bus message.
 *
 * <h2>Construction vs. validity</h2>
 * <p>
 * Instances are immutable. Applications assemble outgoing messages through the
 * mutable {@link Builder}; the decoder produces instances only after they have
 * passed validation.
 * </p>
 *
 * <p>
 * Construction deliberately does <em>not</em> enforce the protocol invariants
 * (known flag bits, known type, header kinds, required headers, signature for a
 * non-empty body). Those are checked by {@code MessageValidator} before any
 * encode and after every decode, so that every violation is reported through a
 * single, discriminated error path. The builder rejects only values that
 * cannot be represented on the wire at all (e.g. a type code above 255).
 * </p>
 *
 * <h2>Headers</h2>
 * <p>
 * Headers are keyed by raw field code so that unknown codes read off the wire
 * remain visible to validation. Iteration order is ascending field code; the
 * protocol attaches no meaning to that order.
 * </p>
 */
public final class BusMessage
{
    private final BusByteOrder byteOrder;
    private final int typeCode;
    private final int flags;
    private final long serial;
    private final SortedMap<Integer, HeaderValue> headers;
    private final byte[] body;

    private BusMessage(Builder b)
    {
        this.byteOrder = b.byteOrder;
        this.typeCode = b.typeCode;
        this.flags = b.flags;
        this.serial = b.serial;
        this.headers = Collections.unmodifiableSortedMap(new TreeMap<>(b.headers));
        this.body = b.body.clone();
    }

    /**
     * Byte order of this message; {@code null} only for an invalid, hand-built message.
     */
    public BusByteOrder byteOrder()
    {
        return byteOrder;
    }

    /**
     * Raw message type code as carried on the wire.
     */
    public int typeCode()
    {
        return typeCode;
    }

    /**
     * Message type, or empty if {@link #typeCode()} is not a known type.
     */
    public Optional<MessageType> type()
    {
        return MessageType.fromCode(typeCode);
    }

    public int flags()
    {
        return flags;
    }

    public boolean hasFlag(MessageFlag flag)
    {
        return flag.isSetIn(flags);
    }

    /**
     * Unsigned 32-bit serial.
     */
    public long serial()
    {
        return serial;
    }

    /**
     * Unmodifiable view of all headers, in ascending field-code order.
     */
    public Map<Integer, HeaderValue> headers()
    {
        return headers;
    }

    public Optional<HeaderValue> header(HeaderField field)
    {
        return Optional.ofNullable(headers.get(field.code()));
    }

    public boolean hasHeader(HeaderField field)
    {
        return headers.containsKey(field.code());
    }

    public Optional<String> path()
    {
        return header(HeaderField.PATH)
                .filter(ObjectPathValue.class::isInstance)
                .map(v -> ((ObjectPathValue) v).path());
    }

    public Optional<String> interfaceName()
    {
        return stringHeader(HeaderField.INTERFACE);
    }

    public Optional<String> member()
    {
        return stringHeader(HeaderField.MEMBER);
    }

    public Optional<String> errorName()
    {
        return stringHeader(HeaderField.ERROR_NAME);
    }

    public Optional<String> destination()
    {
        return stringHeader(HeaderField.DESTINATION);
    }

    public Optional<String> sender()
    {
        return stringHeader(HeaderField.SENDER);
    }

    public OptionalLong replySerial()
    {
        HeaderValue v = headers.get(HeaderField.REPLY_SERIAL.code());
        return (v instanceof Uint32Value u) ? OptionalLong.of(u.value()) : OptionalLong.empty();
    }

    /**
     * Body signature, or the empty string when no SIGNATURE header is present.
     */
    public String signature()
    {
        HeaderValue v = headers.get(HeaderField.SIGNATURE.code());
        return (v instanceof SignatureValue s) ? s.signature() : "";
    }

    /**
     * Returns a copy of the body bytes (never null, possibly empty).
     */
    public byte[] body()
    {
        return body.clone();
    }

    public int bodyLength()
    {
        return body.length;
    }

    private Optional<String> stringHeader(HeaderField field)
    {
        HeaderValue v = headers.get(field.code());
        return (v instanceof StringValue s) ? Optional.of(s.value()) : Optional.empty();
    }

    /**
     * Returns a builder initialised with this message's contents.
     */
    public Builder toBuilder()
    {
        Builder b = new Builder()
                .byteOrder(byteOrder)
                .typeCode(typeCode)
                .flags(flags)
                .serial(serial)
                .body(body);
        b.headers.putAll(headers);
        return b;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof BusMessage that)) return false;
        return typeCode == that.typeCode
                && flags == that.flags
                && serial == that.serial
                && byteOrder == that.byteOrder
                && headers.equals(that.headers)
                && Arrays.equals(body, that.body);
    }

    @Override
    public int hashCode()
    {
        int result = Objects.hash(byteOrder, typeCode, flags, serial, headers);
        return 31 * result + Arrays.hashCode(body);
    }

    @Override
    public String toString()
    {
        return "BusMessage[" +
                "type=" + type().map(Enum::name).orElse("0x" + Integer.toHexString(typeCode)) +
                ", serial=" + serial +
                ", flags=0x" + Integer.toHexString(flags) +
                ", order=" + byteOrder +
                ", headers=" + headers +
                ", bodyLength=" + body.length +
                ']';
    }

    /**
     * Mutable assembly of a {@link BusMessage}.
     *
     * <p>Defaults: little-endian, no flags, serial 0, no headers, empty body.
     * The serial is normally assigned by the connection just before sending.</p>
     */
    public static final class Builder
    {
        private BusByteOrder byteOrder = BusByteOrder.LITTLE_ENDIAN;
        private int typeCode;
        private int flags;
        private long serial;
        private final Map<Integer, HeaderValue> headers = new TreeMap<>();
        private byte[] body = new byte[0];

        private Builder() {}

        public Builder byteOrder(BusByteOrder byteOrder)
        {
            this.byteOrder = byteOrder;
            return this;
        }

        public Builder type(MessageType type)
        {
            this.typeCode = Objects.requireNonNull(type, "type").code();
            return this;
        }

        public Builder typeCode(int typeCode)
        {
            this.typeCode = requireByte(typeCode, "typeCode");
            return this;
        }

        public Builder flag(MessageFlag flag)
        {
            this.flags |= Objects.requireNonNull(flag, "flag").mask();
            return this;
        }

        public Builder flags(int flags)
        {
            this.flags = requireByte(flags, "flags");
            return this;
        }

        public Builder serial(long serial)
        {
            if (serial < 0 || serial > 0xFFFF_FFFFL) {
                throw new IllegalArgumentException("serial must be an unsigned 32-bit value (was " + serial + ")");
            }
            this.serial = serial;
            return this;
        }

        public Builder header(HeaderField field, HeaderValue value)
        {
            return header(Objects.requireNonNull(field, "field").code(), value);
        }

        public Builder header(int code, HeaderValue value)
        {
            headers.put(requireByte(code, "header code"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder removeHeader(HeaderField field)
        {
            headers.remove(field.code());
            return this;
        }

        public Builder path(String path)
        {
            return header(HeaderField.PATH, HeaderValue.objectPath(path));
        }

        public Builder interfaceName(String interfaceName)
        {
            return header(HeaderField.INTERFACE, HeaderValue.string(interfaceName));
        }

        public Builder member(String member)
        {
            return header(HeaderField.MEMBER, HeaderValue.string(member));
        }

        public Builder errorName(String errorName)
        {
            return header(HeaderField.ERROR_NAME, HeaderValue.string(errorName));
        }

        public Builder destination(String destination)
        {
            return header(HeaderField.DESTINATION, HeaderValue.string(destination));
        }

        public Builder replySerial(long replySerial)
        {
            return header(HeaderField.REPLY_SERIAL, HeaderValue.uint32(replySerial));
        }

        /**
         * Sets the body bytes. An empty body leaves any SIGNATURE header untouched.
         */
        public Builder body(byte[] body)
        {
            this.body = (body == null) ? new byte[0] : body.clone();
            return this;
        }

        /**
         * Sets the body together with its SIGNATURE header.
         */
        public Builder body(String signature, byte[] body)
        {
            header(HeaderField.SIGNATURE, HeaderValue.signature(signature));
            return body(body);
        }

        public BusMessage build()
        {
            return new BusMessage(this);
        }

        private static int requireByte(int value, String name)
        {
            if (value < 0 || value > 0xFF) {
                throw new IllegalArgumentException(name + " must fit in one unsigned byte (was " + value + ")");
            }
            return value;
        }
    }
}
