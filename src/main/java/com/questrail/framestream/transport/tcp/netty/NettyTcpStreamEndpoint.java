package com.questrail.framestream.transport.tcp.netty;

import com.questrail.framestream.transport.StreamEndpoint;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.AttributeKey;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * NettyTcpStreamEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StreamEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Encode or interpret frames</li>
 *   <li>Schedule reconnects</li>
 *   <li>Queue frames while disconnected</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <p>Inbound bytes are copied off the event loop into a bounded queue and
 * handed out one at a time by {@link #pollByte()}. If the viewer sends more
 * acknowledgments than the queue holds, the newest are dropped.</p>
 *
 * <h2>Lifecycle</h2>
 * - {@link #connect} closes any previous channel, waiting no longer than the
 *   connect timeout, and dials the remote.
 * - {@link #close()} closes the channel and shuts down the event loop group.
 */
public final class NettyTcpStreamEndpoint implements StreamEndpoint
{
    private static final int ACK_QUEUE_CAPACITY = 1024;
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(1);
    private static final AttributeKey<Boolean> RETIRED = AttributeKey.valueOf("framestream.retired");

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final BlockingQueue<Byte> received = new ArrayBlockingQueue<>(ACK_QUEUE_CAPACITY);

    private volatile Channel channel;

    /**
     * Construct an endpoint with a dedicated single-threaded {@link NioEventLoopGroup}.
     */
    public NettyTcpStreamEndpoint()
    {
        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public boolean connect(InetSocketAddress remote, Duration timeout)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(timeout, "timeout");

        closeChannel(timeout);

        int millis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        ChannelFuture f = bootstrap.clone()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, millis)
                .connect(remote);

        if (!f.awaitUninterruptibly(millis) || !f.isSuccess()) {
            f.cancel(false);
            f.channel().close();
            return false;
        }

        channel = f.channel();
        return true;
    }

    @Override
    public boolean isConnected()
    {
        Channel ch = channel;
        return ch != null && ch.isActive();
    }

    @Override
    public boolean send(byte[] payload, Duration timeout)
    {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(timeout, "timeout");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return false;
        }

        ChannelFuture f = ch.writeAndFlush(Unpooled.wrappedBuffer(payload));
        if (!f.awaitUninterruptibly(timeout.toMillis()) || !f.isSuccess()) {
            // Unflushed or failed write leaves the stream in an unknown state.
            ch.close();
            return false;
        }
        return true;
    }

    @Override
    public int pollByte()
    {
        Byte b = received.poll();
        return (b == null) ? -1 : (b & 0xFF);
    }

    @Override
    public void close()
    {
        closeChannel(CLOSE_TIMEOUT);
        group.shutdownGracefully();
    }

    /**
     * Close the current channel, waiting at most {@code timeout} for the close
     * to complete. Bytes the old channel still delivers afterwards are ignored.
     */
    private void closeChannel(Duration timeout)
    {
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.attr(RETIRED).set(Boolean.TRUE);
            ch.close().awaitUninterruptibly(timeout.toMillis());
        }
        received.clear();
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies received bytes into the acknowledgment queue. Channels retired by
     * {@link #closeChannel(Duration)} no longer contribute.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception
        {
            // A new connection starts with no pending acknowledgments.
            received.clear();
            super.channelActive(ctx);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf content)
        {
            if (Boolean.TRUE.equals(ctx.channel().attr(RETIRED).get())) {
                return;
            }
            while (content.isReadable()) {
                received.offer(content.readByte());
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // Surfaced as isConnected() == false on the next tick.
            ctx.close();
        }
    }
}
