package com.questrail.unitbus.protocol.bus.transport.netty;

import com.questrail.unitbus.protocol.bus.codec.impl.DefaultBusMessageEncoder;
import com.questrail.unitbus.protocol.bus.model.BusMessage;
import com.questrail.unitbus.protocol.bus.model.MessageType;
import com.questrail.unitbus.protocol.bus.transport.BusEndpointListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyBusEndpointTest
 * -----------------------------------------------------------------------------
 * Runs the endpoint against a plain socket peer on the loopback interface.
 */
final class NettyBusEndpointTest
{
    private static final long WAIT_SECONDS = 5;

    /**
     * Records callbacks from the event loop for the test thread.
     */
    private static final class RecordingListener implements BusEndpointListener
    {
        final CountDownLatch upLatch = new CountDownLatch(1);
        final CountDownLatch downLatch = new CountDownLatch(1);
        final AtomicInteger downs = new AtomicInteger();
        final BlockingQueue<byte[]> frames = new LinkedBlockingQueue<>();

        @Override
        public void onTransportUp()
        {
            upLatch.countDown();
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            downs.incrementAndGet();
            downLatch.countDown();
        }

        @Override
        public void onFrame(byte[] frame)
        {
            frames.add(frame);
        }
    }

    private ServerSocket server;
    private NettyBusEndpoint endpoint;
    private RecordingListener listener;

    @BeforeEach
    void setUp() throws IOException
    {
        server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        server.setSoTimeout((int) TimeUnit.SECONDS.toMillis(WAIT_SECONDS));

        endpoint = new NettyBusEndpoint(
                new InetSocketAddress(InetAddress.getLoopbackAddress(), server.getLocalPort()),
                Duration.ofSeconds(WAIT_SECONDS));
        listener = new RecordingListener();
        endpoint.setListener(listener);
    }

    @AfterEach
    void tearDown() throws IOException
    {
        endpoint.stop();
        server.close();
    }

    private static byte[] message(long serial, String member) throws Exception
    {
        return new DefaultBusMessageEncoder().encode(BusMessage.builder()
                .type(MessageType.SIGNAL)
                .serial(serial)
                .path("/org/freedesktop/systemd1")
                .interfaceName("org.freedesktop.systemd1.Manager")
                .member(member)
                .body("y", new byte[] { 42 })
                .build());
    }

    private Socket connect() throws Exception
    {
        endpoint.start();
        Socket peer = server.accept();
        assertTrue(listener.upLatch.await(WAIT_SECONDS, TimeUnit.SECONDS), "transport never came up");
        return peer;
    }

    @Test
    void sendBeforeConnectingFails()
    {
        assertThrows(IOException.class, () -> endpoint.send(new byte[16]));
    }

    @Test
    void startWithoutListenerIsRejected()
    {
        NettyBusEndpoint bare = new NettyBusEndpoint(
                new InetSocketAddress(InetAddress.getLoopbackAddress(), server.getLocalPort()),
                Duration.ofSeconds(1));
        try {
            assertThrows(IllegalStateException.class, bare::start);
        } finally {
            bare.stop();
        }
    }

    @Test
    void framesTravelInBothDirections() throws Exception
    {
        try (Socket peer = connect()) {
            byte[] first = message(1, "JobNew");
            byte[] second = message(2, "JobRemoved");

            // the first message split across two writes, the second coalesced with its tail
            OutputStream out = peer.getOutputStream();
            out.write(Arrays.copyOfRange(first, 0, 10));
            out.flush();
            byte[] rest = new byte[first.length - 10 + second.length];
            System.arraycopy(first, 10, rest, 0, first.length - 10);
            System.arraycopy(second, 0, rest, first.length - 10, second.length);
            out.write(rest);
            out.flush();

            assertArrayEquals(first, listener.frames.poll(WAIT_SECONDS, TimeUnit.SECONDS));
            assertArrayEquals(second, listener.frames.poll(WAIT_SECONDS, TimeUnit.SECONDS));

            byte[] outbound = message(3, "Reloading");
            endpoint.send(outbound);

            byte[] received = new byte[outbound.length];
            peer.setSoTimeout((int) TimeUnit.SECONDS.toMillis(WAIT_SECONDS));
            new DataInputStream(peer.getInputStream()).readFully(received);
            assertArrayEquals(outbound, received);
        }
    }

    @Test
    void peerCloseReportsTransportDownOnce() throws Exception
    {
        Socket peer = connect();
        peer.close();

        assertTrue(listener.downLatch.await(WAIT_SECONDS, TimeUnit.SECONDS), "transport never went down");
        assertThrows(IOException.class, () -> endpoint.send(message(1, "Reload")));

        endpoint.stop();
        assertEquals(1, listener.downs.get());
    }

    @Test
    void stopReportsTransportDownOnce() throws Exception
    {
        try (Socket peer = connect()) {
            endpoint.stop();
            endpoint.stop();

            assertTrue(listener.downLatch.await(WAIT_SECONDS, TimeUnit.SECONDS));
            assertEquals(1, listener.downs.get());
        }
    }
}
