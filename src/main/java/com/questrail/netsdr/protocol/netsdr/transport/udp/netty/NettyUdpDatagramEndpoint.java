package com.questrail.netsdr.protocol.netsdr.transport.udp.netty;

import com.questrail.netsdr.protocol.netsdr.transport.DatagramEndpoint;
import com.questrail.netsdr.protocol.netsdr.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It does not decode
 * NetSDR frames or extract samples.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Inbound payloads are copied into
 * {@code byte[]}; reference-counted buffers are released internally.
 *
 * <h2>Listening sessions</h2>
 * Every {@link #startListening()} creates its own event-loop group and binds
 * a new socket. The session ends when {@link #stopListening()} closes the
 * channel, when the bind fails, or when the pipeline reports an error. On
 * every one of those paths the channel is closed and the group shut down
 * before the session future completes, so a new session can bind the same
 * port afterwards. A session started while the previous one is still
 * shutting down defers its bind until that future has completed.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpDatagramEndpoint.class);

    private final InetSocketAddress bindAddress;

    private volatile DatagramEndpointListener listener;
    private Session current;
    private CompletableFuture<Void> lastSessionDone = CompletableFuture.completedFuture(null);

    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public synchronized CompletableFuture<Void> startListening()
    {
        if (current != null) {
            return current.done;
        }
        requireListener();

        log.info("Start listening for UDP messages...");

        Session session = new Session(new NioEventLoopGroup(1));
        current = session;

        // A session still shutting down holds the port until its group terminates.
        CompletableFuture<Void> previous = lastSessionDone;
        lastSessionDone = session.done;
        previous.whenComplete((ignored, error) -> bind(session));

        return session.done;
    }

    private void bind(Session session)
    {
        synchronized (session) {
            if (session.stopRequested) {
                end(session);
                return;
            }
        }

        Bootstrap bootstrap = new Bootstrap()
                .group(session.group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });

        bootstrap.bind(bindAddress).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.error("Error receiving message: {}", future.cause().getMessage());
                end(session);
                return;
            }
            Channel ch = future.channel();
            ch.closeFuture().addListener(closed -> end(session));
            synchronized (session) {
                session.channel = ch;
                if (session.stopRequested) {
                    ch.close();
                }
            }
        });
    }

    /**
     * Detaches the running session at once; its socket and event loop are
     * released asynchronously. A following {@link #startListening()} binds
     * only after that release has completed.
     */
    @Override
    public void stopListening()
    {
        Session session;
        synchronized (this) {
            session = current;
            current = null;
        }
        if (session == null) {
            return;
        }
        synchronized (session) {
            session.stopRequested = true;
            if (session.channel != null) {
                session.channel.close();
            }
        }
    }

    /**
     * {@code false} as soon as {@link #stopListening()} has been called, even
     * while the stopped session is still shutting down.
     */
    @Override
    public synchronized boolean isListening()
    {
        return current != null;
    }

    /**
     * Releases a session's resources and completes its future. Runs once per
     * session, on whichever exit path gets there first.
     */
    private void end(Session session)
    {
        if (!session.ended.compareAndSet(false, true)) {
            return;
        }
        synchronized (this) {
            if (current == session) {
                current = null;
            }
        }
        session.group.shutdownGracefully(0, 100, TimeUnit.MILLISECONDS)
                .addListener(terminated -> {
                    log.info("Stopped listening for UDP messages");
                    session.done.complete(null);
                });
    }

    private DatagramEndpointListener requireListener()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before startListening()");
        }
        return l;
    }

    private static final class Session
    {
        final EventLoopGroup group;
        final CompletableFuture<Void> done = new CompletableFuture<>();
        final AtomicBoolean ended = new AtomicBoolean(false);
        Channel channel;
        boolean stopRequested;

        Session(EventLoopGroup group)
        {
            this.group = group;
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives Netty {@link DatagramPacket}s and forwards raw payload bytes
     * to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            DatagramEndpointListener l = listener;
            if (l == null) {
                return;
            }

            // Copy the payload into a plain byte[] (Netty containment rule).
            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            log.debug("Received from {}: {} bytes", packet.sender(), bytes.length);
            l.onDatagram(bytes);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.error("Error receiving message: {}", cause.getMessage());
            ctx.close();
        }
    }
}
