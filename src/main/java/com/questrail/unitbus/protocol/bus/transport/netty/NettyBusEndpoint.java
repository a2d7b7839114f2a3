package com.questrail.unitbus.protocol.bus.transport.netty;

import com.questrail.unitbus.protocol.bus.transport.BusEndpoint;
import com.questrail.unitbus.protocol.bus.transport.BusEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyBusEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link BusEndpoint} port over TCP.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It connects,
 * splits the stream into whole messages ({@link BusFrameSplitter}) and writes
 * encoded messages. It does not decode, validate or correlate messages.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound frames are delivered as {@code byte[]}.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} connects to the remote address asynchronously.
 * - {@link #stop()} closes the channel and shuts down the event loop group.
 */
public final class NettyBusEndpoint implements BusEndpoint
{
    private final InetSocketAddress remoteAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final AtomicBoolean up = new AtomicBoolean(false);

    private volatile BusEndpointListener listener;
    private volatile Channel channel;

    public NettyBusEndpoint(InetSocketAddress remoteAddress, Duration connectTimeout)
    {
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");
        Objects.requireNonNull(connectTimeout, "connectTimeout");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new BusFrameSplitter());
                        p.addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(BusEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        BusEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.connect(remoteAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                up.set(true);
                l.onTransportUp();
            }
            else {
                l.onTransportDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }

        group.shutdownGracefully();
        notifyDown(null);
    }

    @Override
    public void send(byte[] message) throws IOException
    {
        Objects.requireNonNull(message, "message");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw new IOException("not connected to " + remoteAddress);
        }

        // Write failures close the channel through exceptionCaught.
        ch.writeAndFlush(Unpooled.wrappedBuffer(message))
                .addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
    }

    private BusEndpointListener requireListener()
    {
        BusEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("BusEndpointListener must be set before start()");
        }
        return l;
    }

    private void notifyDown(Throwable cause)
    {
        BusEndpointListener l = listener;
        if (up.compareAndSet(true, false) && l != null) {
            l.onTransportDown(cause);
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Forwards whole frames from {@link BusFrameSplitter} to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<byte[]>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, byte[] frame)
        {
            BusEndpointListener l = listener;
            if (l != null) {
                l.onFrame(frame);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            notifyDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            notifyDown(cause);
            ctx.close();
        }
    }
}
