package com.questrail.netsdr.protocol.netsdr.transport.tcp.netty;

import com.questrail.netsdr.protocol.netsdr.transport.CommandChannel;
import com.questrail.netsdr.protocol.netsdr.transport.CommandChannelListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpCommandChannel
 * =============================================================================
 * Netty-backed implementation of the {@link CommandChannel} port.
 *
 * <h2>Architectural Role</h2>
 * A transport adapter. The only protocol knowledge it has is the frame
 * length in the header, used by {@link NetSdrStreamFrameDecoder} to split the
 * TCP stream. It does not interpret message kinds and does not correlate
 * replies.
 *
 * <h2>Lifecycle</h2>
 * Each {@link #connect()} owns a fresh event-loop group. It is released by
 * {@link #disconnect()}, or by the next {@link #connect()} when the peer
 * closed the previous connection, so the channel can be connected again.
 *
 * <p>A failed connect is logged and leaves the channel disconnected; it is
 * not thrown to the caller.</p>
 */
public final class NettyTcpCommandChannel implements CommandChannel
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpCommandChannel.class);

    private final String host;
    private final int port;
    private final Duration connectTimeout;

    private volatile CommandChannelListener listener;
    private volatile Connection connection;

    public NettyTcpCommandChannel(String host, int port, Duration connectTimeout)
    {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public void setListener(CommandChannelListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public synchronized void connect()
    {
        if (isConnected()) {
            return;
        }
        release(connection);

        EventLoopGroup group = new NioEventLoopGroup(1);
        Connection conn = new Connection(group);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast("frameDecoder", new NetSdrStreamFrameDecoder());
                        p.addLast("inbound", new InboundHandler(conn));
                    }
                });

        ChannelFuture f = bootstrap.connect(host, port).awaitUninterruptibly();
        if (!f.isSuccess()) {
            log.warn("Failed to connect to {}:{}: {}", host, port,
                    f.cause() != null ? f.cause().getMessage() : "timed out");
            group.shutdownGracefully();
            return;
        }

        conn.channel = f.channel();
        connection = conn;
        log.info("Connected to {}:{}", host, port);
    }

    @Override
    public synchronized void disconnect()
    {
        Connection conn = connection;
        connection = null;
        if (conn == null) {
            return;
        }
        conn.closedByUs.set(true);
        release(conn);
        log.info("Disconnected from {}:{}", host, port);
    }

    @Override
    public boolean isConnected()
    {
        Connection conn = connection;
        return conn != null && conn.channel != null && conn.channel.isActive();
    }

    @Override
    public CompletableFuture<Void> send(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");

        Connection conn = connection;
        Channel ch = conn == null ? null : conn.channel;
        if (ch == null || !ch.isActive()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Command channel is not connected"));
        }

        CompletableFuture<Void> result = new CompletableFuture<>();
        ch.writeAndFlush(Unpooled.wrappedBuffer(frame)).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                result.complete(null);
            }
            else {
                log.error("Failed to send frame: {}", future.cause().getMessage());
                result.completeExceptionally(future.cause());
            }
        });
        return result;
    }

    private static void release(Connection conn)
    {
        if (conn == null) {
            return;
        }
        if (conn.channel != null) {
            conn.channel.close().awaitUninterruptibly();
        }
        conn.group.shutdownGracefully();
    }

    /**
     * Per-connection resources.
     */
    private static final class Connection
    {
        final EventLoopGroup group;
        final AtomicBoolean closedByUs = new AtomicBoolean(false);
        final AtomicBoolean downNotified = new AtomicBoolean(false);
        volatile Channel channel;

        Connection(EventLoopGroup group)
        {
            this.group = group;
        }
    }

    /**
     * Forwards decoded frames and the end of the connection to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<byte[]>
    {
        private final Connection conn;

        InboundHandler(Connection conn)
        {
            this.conn = conn;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, byte[] frame)
        {
            CommandChannelListener l = listener;
            if (l != null) {
                l.onMessage(frame);
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
            log.error("Command channel error: {}", cause.getMessage());
            notifyDown(cause);
            ctx.close();
        }

        private void notifyDown(Throwable cause)
        {
            if (conn.closedByUs.get() || !conn.downNotified.compareAndSet(false, true)) {
                return;
            }
            CommandChannelListener l = listener;
            if (l != null) {
                l.onDisconnected(cause);
            }
        }
    }
}
