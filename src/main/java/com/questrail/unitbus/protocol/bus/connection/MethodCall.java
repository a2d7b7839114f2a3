package com.questrail.unitbus.protocol.bus.connection;

import com.questrail.unitbus.protocol.bus.body.BodyWriter;
import com.questrail.unitbus.protocol.bus.model.BusByteOrder;
import com.questrail.unitbus.protocol.bus.model.BusMessage;
import com.questrail.unitbus.protocol.bus.model.MessageFlag;
import com.questrail.unitbus.protocol.bus.model.MessageType;

import java.util.Objects;

/**
 * MethodCall
 * -----------------------------------------------------------------------------
 * Fluent description of an outgoing method call.
 *
 * <pre>{@code
 * MethodCall.to("org.freedesktop.systemd1", "/org/freedesktop/systemd1",
 *               "org.freedesktop.systemd1.Manager", "StartUnit")
 *     .arguments("ss", w -> w.writeString("nginx.service").writeString("replace"));
 * }</pre>
 *
 * <p>The body is written when the call is turned into a message, in the byte
 * order of the connection that sends it. The serial is left to the
 * connection.</p>
 */
public final class MethodCall
{
    private final String destination;
    private final String path;
    private final String interfaceName;
    private final String member;

    private String signature = "";
    private BodyWriter.Content arguments;
    private boolean noReplyExpected;
    private boolean noAutoStart;

    private MethodCall(String destination, String path, String interfaceName, String member)
    {
        this.destination = destination;
        this.path = Objects.requireNonNull(path, "path");
        this.interfaceName = interfaceName;
        this.member = Objects.requireNonNull(member, "member");
    }

    /**
     * @param destination   bus name of the receiver; may be {@code null}
     * @param path          object path
     * @param interfaceName interface of the member; may be {@code null}
     * @param member        method name
     */
    public static MethodCall to(String destination, String path, String interfaceName, String member)
    {
        return new MethodCall(destination, path, interfaceName, member);
    }

    /**
     * Sets the body signature and the code that writes the matching values.
     */
    public MethodCall arguments(String signature, BodyWriter.Content arguments)
    {
        this.signature = Objects.requireNonNull(signature, "signature");
        this.arguments = Objects.requireNonNull(arguments, "arguments");
        return this;
    }

    public MethodCall noReplyExpected()
    {
        this.noReplyExpected = true;
        return this;
    }

    public MethodCall noAutoStart()
    {
        this.noAutoStart = true;
        return this;
    }

    public boolean isNoReplyExpected()
    {
        return noReplyExpected;
    }

    public String destination()
    {
        return destination;
    }

    public String path()
    {
        return path;
    }

    public String interfaceName()
    {
        return interfaceName;
    }

    public String member()
    {
        return member;
    }

    /**
     * Assembles the METHOD_CALL message, writing the arguments in {@code order}.
     */
    public BusMessage.Builder toBuilder(BusByteOrder order)
    {
        BusMessage.Builder b = BusMessage.builder()
                .byteOrder(order)
                .type(MessageType.METHOD_CALL)
                .path(path)
                .member(member);
        if (interfaceName != null) {
            b.interfaceName(interfaceName);
        }
        if (destination != null) {
            b.destination(destination);
        }
        if (noReplyExpected) {
            b.flag(MessageFlag.NO_REPLY_EXPECTED);
        }
        if (noAutoStart) {
            b.flag(MessageFlag.NO_AUTO_START);
        }
        if (arguments != null) {
            BodyWriter w = new BodyWriter(order);
            arguments.write(w);
            b.body(signature, w.toByteArray());
        }
        return b;
    }

    @Override
    public String toString()
    {
        return "MethodCall[" + destination + " " + path + " " + interfaceName + "." + member + "(" + signature + ")]";
    }
}
