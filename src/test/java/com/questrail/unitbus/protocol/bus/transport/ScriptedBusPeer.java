package com.questrail.unitbus.protocol.bus.transport;

import com.questrail.unitbus.protocol.bus.body.BodyWriter;
import com.questrail.unitbus.protocol.bus.codec.BusMessageDecoder;
import com.questrail.unitbus.protocol.bus.codec.BusMessageEncoder;
import com.questrail.unitbus.protocol.bus.codec.impl.DefaultBusMessageDecoder;
import com.questrail.unitbus.protocol.bus.codec.impl.DefaultBusMessageEncoder;
import com.questrail.unitbus.protocol.bus.model.BusByteOrder;
import com.questrail.unitbus.protocol.bus.model.BusMessage;
import com.questrail.unitbus.protocol.bus.model.HeaderField;
import com.questrail.unitbus.protocol.bus.model.HeaderValue;
import com.questrail.unitbus.protocol.bus.model.MessageType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * ScriptedBusPeer
 * -----------------------------------------------------------------------------
 * Test-only stand-in for the bus daemon and the services behind it.
 *
 * <p>Installed as the {@link FakeBusEndpoint.Responder}, it decodes every
 * method call the client sends and answers through the handler registered
 * for the call's member. Calls without a handler get an
 * {@code UnknownMethod} error. Replies are injected synchronously.</p>
 */
public final class ScriptedBusPeer implements FakeBusEndpoint.Responder
{
    public static final String PEER_NAME = ":1.1";
    public static final String CLIENT_NAME = ":1.42";

    @FunctionalInterface
    public interface Handler
    {
        void handle(BusMessage call, Replies replies) throws Exception;
    }

    private final BusMessageDecoder decoder = new DefaultBusMessageDecoder();
    private final BusMessageEncoder encoder = new DefaultBusMessageEncoder();
    private final BusByteOrder order;

    private final Map<String, Handler> handlers = new HashMap<>();
    private final List<BusMessage> calls = new ArrayList<>();
    private final List<BusMessage> others = new ArrayList<>();
    private long serial;

    public ScriptedBusPeer(BusByteOrder order)
    {
        this.order = order;
        on("Hello", (call, r) -> r.methodReturn("s", w -> w.writeString(CLIENT_NAME)));
        on("AddMatch", (call, r) -> r.methodReturn());
        on("RemoveMatch", (call, r) -> r.methodReturn());
    }

    public ScriptedBusPeer()
    {
        this(BusByteOrder.LITTLE_ENDIAN);
    }

    public ScriptedBusPeer on(String member, Handler handler)
    {
        handlers.put(member, handler);
        return this;
    }

    /**
     * Registers a member that is never answered.
     */
    public ScriptedBusPeer silent(String member)
    {
        return on(member, (call, r) -> { });
    }

    public synchronized List<BusMessage> calls()
    {
        return new ArrayList<>(calls);
    }

    public synchronized List<BusMessage> calls(String member)
    {
        List<BusMessage> matching = new ArrayList<>();
        for (BusMessage m : calls) {
            if (m.member().filter(member::equals).isPresent()) {
                matching.add(m);
            }
        }
        return matching;
    }

    /**
     * Non-call messages the client sent (replies, errors).
     */
    public synchronized List<BusMessage> others()
    {
        return new ArrayList<>(others);
    }

    @Override
    public void onSent(byte[] message, FakeBusEndpoint endpoint)
    {
        final BusMessage call;
        try {
            call = decoder.decode(message);
        } catch (Exception e) {
            throw new AssertionError("client sent an undecodable message", e);
        }

        if (call.type().orElseThrow() != MessageType.METHOD_CALL) {
            synchronized (this) {
                others.add(call);
            }
            return;
        }
        synchronized (this) {
            calls.add(call);
        }

        Replies replies = new Replies(call, endpoint);
        Handler handler = handlers.get(call.member().orElse(""));
        try {
            if (handler == null) {
                replies.error("org.freedesktop.DBus.Error.UnknownMethod", "no handler for " + call.member().orElse(""));
            } else {
                handler.handle(call, replies);
            }
        } catch (Exception e) {
            throw new AssertionError("scripted handler failed for " + call, e);
        }
    }

    private synchronized long nextSerial()
    {
        return ++serial;
    }

    /**
     * Reply and signal factory bound to one received call.
     */
    public final class Replies
    {
        private final BusMessage call;
        private final FakeBusEndpoint endpoint;

        private Replies(BusMessage call, FakeBusEndpoint endpoint)
        {
            this.call = call;
            this.endpoint = endpoint;
        }

        public void methodReturn() throws Exception
        {
            inject(reply(MessageType.METHOD_RETURN));
        }

        public void methodReturn(String signature, BodyWriter.Content body) throws Exception
        {
            inject(reply(MessageType.METHOD_RETURN).body(signature, write(body)));
        }

        public void error(String errorName, String text) throws Exception
        {
            inject(reply(MessageType.ERROR)
                    .errorName(errorName)
                    .body("s", write(w -> w.writeString(text))));
        }

        public void signal(String path, String interfaceName, String member,
                           String signature, BodyWriter.Content body) throws Exception
        {
            BusMessage.Builder b = BusMessage.builder()
                    .byteOrder(order)
                    .type(MessageType.SIGNAL)
                    .serial(nextSerial())
                    .path(path)
                    .interfaceName(interfaceName)
                    .member(member)
                    .header(HeaderField.SENDER, HeaderValue.string(PEER_NAME))
                    .body(signature, write(body));
            inject(b);
        }

        private BusMessage.Builder reply(MessageType type)
        {
            return BusMessage.builder()
                    .byteOrder(order)
                    .type(type)
                    .serial(nextSerial())
                    .replySerial(call.serial())
                    .destination(CLIENT_NAME)
                    .header(HeaderField.SENDER, HeaderValue.string(PEER_NAME));
        }

        private byte[] write(BodyWriter.Content body)
        {
            BodyWriter w = new BodyWriter(order);
            body.write(w);
            return w.toByteArray();
        }

        private void inject(BusMessage.Builder message) throws Exception
        {
            endpoint.injectFrame(encoder.encode(message.build()));
        }
    }
}
