package com.questrail.unitbus.protocol.bus.connection;

import com.questrail.unitbus.protocol.bus.BusException;
import com.questrail.unitbus.protocol.bus.body.BodyReader;
import com.questrail.unitbus.protocol.bus.body.BodyWriter;
import com.questrail.unitbus.protocol.bus.codec.BusMessageDecoder;
import com.questrail.unitbus.protocol.bus.codec.BusMessageEncoder;
import com.questrail.unitbus.protocol.bus.codec.impl.DefaultBusMessageDecoder;
import com.questrail.unitbus.protocol.bus.codec.impl.DefaultBusMessageEncoder;
import com.questrail.unitbus.protocol.bus.config.BusClientConfig;
import com.questrail.unitbus.protocol.bus.model.BusMessage;
import com.questrail.unitbus.protocol.bus.model.MessageFlag;
import com.questrail.unitbus.protocol.bus.model.MessageType;
import com.questrail.unitbus.protocol.bus.observability.BusErrorEvent;
import com.questrail.unitbus.protocol.bus.observability.BusMessageEvent;
import com.questrail.unitbus.protocol.bus.observability.BusObservabilitySink;
import com.questrail.unitbus.protocol.bus.observability.BusTransportEvent;
import com.questrail.unitbus.protocol.bus.observability.Slf4jBusObservabilitySink;
import com.questrail.unitbus.protocol.bus.transport.BusEndpoint;
import com.questrail.unitbus.protocol.bus.transport.BusEndpointListener;
import com.questrail.unitbus.protocol.bus.transport.netty.NettyBusEndpoint;
import com.questrail.unitbus.protocol.bus.validate.InvalidMessageException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * BusConnection
 * =============================================================================
 * Client side of a bus connection on top of a {@link BusEndpoint}.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Allocating serials (1 upwards, never 0, wrapping after 2^32-1)</li>
 *   <li>Encoding outgoing messages and handing them to the endpoint</li>
 *   <li>Decoding inbound frames; invalid frames are reported and dropped</li>
 *   <li>Correlating METHOD_RETURN and ERROR replies with pending calls</li>
 *   <li>Dispatching SIGNAL messages to registered handlers</li>
 *   <li>Answering inbound method calls with {@link #UNKNOWN_METHOD}</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Inbound dispatch runs on the endpoint's callback thread. Sends may come from
 * any thread; serial allocation, encoding and the endpoint write happen under
 * one lock, so serials reach the wire in increasing order.
 */
public final class BusConnection implements BusEndpointListener, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(BusConnection.class);

    public static final String BUS_NAME = "org.freedesktop.DBus";
    public static final String BUS_PATH = "/org/freedesktop/DBus";
    public static final String BUS_INTERFACE = "org.freedesktop.DBus";
    public static final String UNKNOWN_METHOD = "org.freedesktop.DBus.Error.UnknownMethod";

    /**
     * A signal handler registration; pass it to {@link #removeSignalHandler}.
     */
    public static final class Subscription
    {
        private final String interfaceName;
        private final String member;
        private final SignalHandler handler;

        private Subscription(String interfaceName, String member, SignalHandler handler)
        {
            this.interfaceName = interfaceName;
            this.member = member;
            this.handler = handler;
        }

        boolean matches(BusMessage signal)
        {
            return (interfaceName == null || signal.interfaceName().filter(interfaceName::equals).isPresent())
                    && (member == null || signal.member().filter(member::equals).isPresent());
        }
    }

    private final BusEndpoint endpoint;
    private final BusClientConfig config;
    private final BusObservabilitySink sink;

    private final BusMessageEncoder encoder = new DefaultBusMessageEncoder();
    private final BusMessageDecoder decoder = new DefaultBusMessageDecoder();

    private final ConcurrentMap<Long, CompletableFuture<BusMessage>> pending = new ConcurrentHashMap<>();
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final CompletableFuture<Void> connected = new CompletableFuture<>();

    private final Object sendLock = new Object();
    private long lastSerial;

    private volatile boolean closed;
    private volatile String uniqueName;

    public BusConnection(BusEndpoint endpoint, BusClientConfig config, BusObservabilitySink sink)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
        endpoint.setListener(this);
    }

    /**
     * Connects over TCP with a Netty endpoint, logging through SLF4J, and
     * registers with the bus daemon.
     */
    public static BusConnection connect(BusClientConfig config) throws IOException, BusException
    {
        BusConnection connection = new BusConnection(
                new NettyBusEndpoint(config.remoteAddress(), config.connectTimeout()),
                config,
                new Slf4jBusObservabilitySink());
        try {
            connection.open();
            connection.hello();
        } catch (IOException | BusException | RuntimeException e) {
            connection.close();
            throw e;
        }
        return connection;
    }

    /**
     * Starts the endpoint and waits until the transport is up.
     */
    public void open() throws IOException
    {
        endpoint.start();
        try {
            connected.get(config.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new IOException("timed out connecting to " + config.remoteAddress());
        } catch (ExecutionException e) {
            throw asIOException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while connecting");
        }
    }

    /**
     * Registers with the bus daemon and returns the unique name it assigned.
     */
    public String hello() throws IOException, BusException
    {
        BusMessage reply = call(MethodCall.to(BUS_NAME, BUS_PATH, BUS_INTERFACE, "Hello"));
        List<Object> args = BodyReader.of(reply).readAll();
        if (args.isEmpty() || !(args.get(0) instanceof String name)) {
            throw new IOException("Hello reply carries no unique name");
        }
        uniqueName = name;
        log.info("Registered on the bus as {}", name);
        return name;
    }

    /**
     * Unique name from {@link #hello()}, or {@code null} before registration.
     */
    public String uniqueName()
    {
        return uniqueName;
    }

    public void addMatch(String rule) throws IOException, BusException
    {
        call(MethodCall.to(BUS_NAME, BUS_PATH, BUS_INTERFACE, "AddMatch")
                .arguments("s", w -> w.writeString(rule)));
    }

    public void removeMatch(String rule) throws IOException, BusException
    {
        call(MethodCall.to(BUS_NAME, BUS_PATH, BUS_INTERFACE, "RemoveMatch")
                .arguments("s", w -> w.writeString(rule)));
    }

    /**
     * Sends a method call and blocks for the reply.
     *
     * @return the METHOD_RETURN message
     * @throws BusErrorException        if the peer replied with an ERROR
     * @throws BusCallTimeoutException  if no reply arrived within the call timeout
     * @throws IOException              if the transport failed or went down
     * @throws InvalidMessageException  if the call could not be encoded
     */
    public BusMessage call(MethodCall call) throws IOException, BusException
    {
        if (call.isNoReplyExpected()) {
            throw new IllegalArgumentException("call expects no reply; use send()");
        }
        final long serial;
        final CompletableFuture<BusMessage> reply = new CompletableFuture<>();
        synchronized (sendLock) {
            BusMessage message = call.toBuilder(config.byteOrder()).serial(nextSerial()).build();
            serial = message.serial();
            pending.put(serial, reply);
            try {
                write(message);
            } catch (IOException | InvalidMessageException | RuntimeException e) {
                pending.remove(serial);
                throw e;
            }
        }

        try {
            return reply.get(config.callTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.remove(serial);
            throw new BusCallTimeoutException(serial, "no reply to " + call + " within " + config.callTimeout());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BusErrorException bee) {
                throw bee;
            }
            throw asIOException(cause);
        } catch (InterruptedException e) {
            pending.remove(serial);
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while waiting for reply to " + call);
        }
    }

    /**
     * Sends a method call and returns a future for the reply. The future
     * fails with {@link BusErrorException} for an ERROR reply and with an
     * {@link IOException} when the transport goes down. It never times out
     * by itself.
     */
    public CompletableFuture<BusMessage> callAsync(MethodCall call) throws IOException, InvalidMessageException
    {
        if (call.isNoReplyExpected()) {
            throw new IllegalArgumentException("call expects no reply; use send()");
        }
        final CompletableFuture<BusMessage> reply = new CompletableFuture<>();
        synchronized (sendLock) {
            BusMessage message = call.toBuilder(config.byteOrder()).serial(nextSerial()).build();
            final long serial = message.serial();
            pending.put(serial, reply);
            reply.whenComplete((r, e) -> pending.remove(serial, reply));
            try {
                write(message);
            } catch (IOException | InvalidMessageException | RuntimeException e) {
                pending.remove(serial);
                throw e;
            }
        }
        return reply;
    }

    /**
     * Sends a method call without waiting for, or expecting, a reply.
     *
     * @return the serial assigned to the call
     */
    public long send(MethodCall call) throws IOException, InvalidMessageException
    {
        return send(call.toBuilder(config.byteOrder()).flag(MessageFlag.NO_REPLY_EXPECTED));
    }

    /**
     * Assigns a serial to {@code message}, encodes it and writes it.
     *
     * @return the serial assigned
     */
    public long send(BusMessage.Builder message) throws IOException, InvalidMessageException
    {
        synchronized (sendLock) {
            BusMessage m = message.byteOrder(config.byteOrder()).serial(nextSerial()).build();
            write(m);
            return m.serial();
        }
    }

    /**
     * Registers a handler for signals of the given interface and member.
     * A {@code null} interface or member matches any.
     *
     * <p>The bus daemon only routes signals matching a rule added with
     * {@link #addMatch(String)}.</p>
     */
    public Subscription addSignalHandler(String interfaceName, String member, SignalHandler handler)
    {
        Subscription s = new Subscription(interfaceName, member, Objects.requireNonNull(handler, "handler"));
        subscriptions.add(s);
        return s;
    }

    public void removeSignalHandler(Subscription subscription)
    {
        subscriptions.remove(subscription);
    }

    /**
     * Number of calls still waiting for a reply.
     */
    public int pendingCalls()
    {
        return pending.size();
    }

    @Override
    public void close()
    {
        if (closed) {
            return;
        }
        closed = true;
        endpoint.stop();
        failPending(new IOException("connection closed"));
    }

    // ---------------------------------------------------------------------
    // BusEndpointListener
    // ---------------------------------------------------------------------

    @Override
    public void onTransportUp()
    {
        sink.onTransportEvent(new BusTransportEvent(Instant.now(), BusTransportEvent.State.UP, null));
        connected.complete(null);
    }

    @Override
    public void onTransportDown(Throwable cause)
    {
        sink.onTransportEvent(new BusTransportEvent(Instant.now(), BusTransportEvent.State.DOWN, cause));
        IOException failure = (cause == null)
                ? new IOException("bus transport closed")
                : new IOException("bus transport failed", cause);
        connected.completeExceptionally(failure);
        failPending(failure);
    }

    @Override
    public void onFrame(byte[] frame)
    {
        final BusMessage message;
        try {
            message = decoder.decode(frame);
        } catch (IOException | InvalidMessageException e) {
            sink.onError(new BusErrorEvent(Instant.now(), "dropped undecodable frame of " + frame.length + " bytes", e));
            return;
        }
        sink.onMessageReceived(new BusMessageEvent(Instant.now(), message));

        // validated messages always carry a known type
        switch (message.type().orElseThrow()) {
            case METHOD_RETURN, ERROR -> completeCall(message);
            case SIGNAL -> dispatchSignal(message);
            case METHOD_CALL -> rejectCall(message);
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void completeCall(BusMessage reply)
    {
        long replySerial = reply.replySerial().orElseThrow();
        CompletableFuture<BusMessage> call = pending.remove(replySerial);
        if (call == null) {
            log.debug("Ignoring reply to unknown or expired serial {}", replySerial);
            return;
        }
        if (reply.type().orElseThrow() == MessageType.ERROR) {
            call.completeExceptionally(BusErrorException.fromReply(reply));
        } else {
            call.complete(reply);
        }
    }

    private void dispatchSignal(BusMessage signal)
    {
        for (Subscription s : subscriptions) {
            if (!s.matches(signal)) {
                continue;
            }
            try {
                s.handler.onSignal(signal);
            } catch (RuntimeException e) {
                sink.onError(new BusErrorEvent(Instant.now(), "signal handler failed for " + signal, e));
            }
        }
    }

    private void rejectCall(BusMessage call)
    {
        if (call.hasFlag(MessageFlag.NO_REPLY_EXPECTED)) {
            return;
        }
        String text = "no method " + call.interfaceName().orElse("") + "." + call.member().orElse("")
                + " on " + call.path().orElse("");
        BusMessage.Builder error = BusMessage.builder()
                .type(MessageType.ERROR)
                .errorName(UNKNOWN_METHOD)
                .replySerial(call.serial())
                .body("s", new BodyWriter(config.byteOrder()).writeString(text).toByteArray());
        call.sender().ifPresent(error::destination);
        try {
            send(error);
        } catch (IOException | InvalidMessageException e) {
            sink.onError(new BusErrorEvent(Instant.now(), "could not reject " + call, e));
        }
    }

    private void write(BusMessage message) throws IOException, InvalidMessageException
    {
        if (closed) {
            throw new IOException("connection closed");
        }
        endpoint.send(encoder.encode(message));
        sink.onMessageSent(new BusMessageEvent(Instant.now(), message));
    }

    private long nextSerial()
    {
        lastSerial = (lastSerial % 0xFFFF_FFFFL) + 1;
        return lastSerial;
    }

    private void failPending(IOException failure)
    {
        for (Long serial : pending.keySet()) {
            CompletableFuture<BusMessage> call = pending.remove(serial);
            if (call != null) {
                call.completeExceptionally(failure);
            }
        }
    }

    private static IOException asIOException(Throwable t)
    {
        if (t instanceof IOException io) {
            return io;
        }
        return new IOException(t);
    }
}
