package com.questrail.network.transport.netty;

import com.questrail.network.api.Reliability;
import com.questrail.network.config.NetworkRuntimeConfig;
import com.questrail.network.internal.time.SystemMonotonicClock;
import com.questrail.network.transport.SendOutcome;
import com.questrail.network.transport.TransportBinding;
import com.questrail.network.transport.TransportBindingListener;
import com.questrail.network.transport.TransportMetrics;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.*;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NettyChannelTransportBinding
 * =============================================================================
 * {@link TransportBinding} over one Netty TCP {@link Channel}, used for both
 * accepted (server) and dialled (client) sessions.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   ByteCounter → LengthFieldBasedFrameDecoder → LengthFieldPrepender
 *               → TransportFrameCodec → SessionHandler
 * </pre>
 *
 * <h2>Reliability</h2>
 * TCP delivers both reliability classes reliably and in order. The class is
 * still tagged on the wire so the peer can tell them apart.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>Accepted session: the channel is already connected but reads are
 *       paused until {@link #start()}, which reports up and resumes reading.</li>
 *   <li>Dialled session: {@link #start()} connects; up is reported when the
 *       connect completes, down if it fails.</li>
 * </ul>
 * Up is reported at most once, and down at most once, always on the
 * channel's event loop.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package.
 */
final class NettyChannelTransportBinding implements TransportBinding
{
    private final NetworkRuntimeConfig config;
    private final Bootstrap bootstrap;
    private final SocketAddress remote;

    private final HeartbeatMonitor heartbeat = new HeartbeatMonitor();
    private final AtomicLong bytesSent = new AtomicLong();
    private final AtomicLong bytesReceived = new AtomicLong();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicBoolean up = new AtomicBoolean(false);
    private final AtomicBoolean down = new AtomicBoolean(false);

    private volatile TransportBindingListener listener;
    private volatile Channel channel;
    private volatile ScheduledFuture<?> heartbeatTask;

    private NettyChannelTransportBinding(NetworkRuntimeConfig config,
                                         Channel channel,
                                         Bootstrap bootstrap,
                                         SocketAddress remote)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.channel = channel;
        this.bootstrap = bootstrap;
        this.remote = remote;
    }

    /**
     * Binding for a channel handed out by a server bootstrap. Installs the
     * pipeline immediately; the channel must have auto-read disabled.
     */
    static NettyChannelTransportBinding accepted(SocketChannel channel, NetworkRuntimeConfig config) {
        Objects.requireNonNull(channel, "channel");
        NettyChannelTransportBinding binding = new NettyChannelTransportBinding(config, channel, null, null);
        binding.installPipeline(channel);
        return binding;
    }

    /**
     * Binding that dials {@code remote} when started.
     *
     * @param bootstrap a bootstrap private to this binding; its handler is
     *                  replaced
     */
    static NettyChannelTransportBinding dialling(Bootstrap bootstrap, SocketAddress remote, NetworkRuntimeConfig config) {
        Objects.requireNonNull(bootstrap, "bootstrap");
        Objects.requireNonNull(remote, "remote");
        NettyChannelTransportBinding binding = new NettyChannelTransportBinding(config, null, bootstrap, remote);
        bootstrap.handler(new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch)
            {
                binding.installPipeline(ch);
            }
        });
        return binding;
    }

    @Override
    public void setListener(TransportBindingListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        requireListener();
        if (!started.compareAndSet(false, true)) {
            return;
        }

        if (bootstrap == null) {
            Channel ch = channel;
            ch.eventLoop().execute(() -> {
                if (!ch.isActive()) {
                    fireDown(null);
                    return;
                }
                fireUp(ch);
                ch.config().setAutoRead(true);
            });
            return;
        }

        ChannelFuture f = bootstrap.connect(remote);
        channel = f.channel();
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                fireUp(future.channel());
            }
            else {
                fireDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        Channel ch = channel;
        if (ch == null) {
            fireDown(null);
            return;
        }
        ch.close().addListener((ChannelFutureListener) future -> fireDown(null));
    }

    @Override
    public SendOutcome send(String payload, Reliability reliability)
    {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(reliability, "reliability");

        Channel ch = channel;
        if (ch == null || !up.get() || down.get() || !ch.isActive()) {
            return SendOutcome.FAILED;
        }
        if (TransportFrame.HEADER_LENGTH + ByteBufUtil.utf8Bytes(payload) > config.maxFrameLength()) {
            return SendOutcome.FAILED;
        }
        if (!ch.isWritable()) {
            return SendOutcome.BACKPRESSURE;
        }

        ch.writeAndFlush(TransportFrame.message(payload, reliability), ch.voidPromise());
        return SendOutcome.SENT;
    }

    @Override
    public TransportMetrics metrics()
    {
        return new TransportMetrics(
                heartbeat.rttMillis(),
                heartbeat.qualityPercent(),
                bytesSent.get(),
                bytesReceived.get());
    }

    @Override
    public String toString()
    {
        Channel ch = channel;
        return "NettyChannelTransportBinding{" + (ch != null ? ch : remote) + "}";
    }

    // -------------------------------------------------------------------------
    // Event loop helpers
    // -------------------------------------------------------------------------

    private void installPipeline(Channel ch)
    {
        ChannelPipeline p = ch.pipeline();
        p.addLast(new ByteCounter());
        p.addLast(new LengthFieldBasedFrameDecoder(config.maxFrameLength(), 0, 4, 0, 4));
        p.addLast(new LengthFieldPrepender(4));
        p.addLast(new TransportFrameCodec());
        p.addLast(new SessionHandler());
    }

    private void fireUp(Channel ch)
    {
        if (down.get() || !up.compareAndSet(false, true)) {
            return;
        }

        long intervalMillis = Math.max(1L, config.heartbeatInterval().toMillis());
        heartbeatTask = ch.eventLoop().scheduleAtFixedRate(
                () -> sendPing(ch), intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);

        requireListener().onTransportUp();
    }

    private void fireDown(Throwable cause)
    {
        if (!down.compareAndSet(false, true)) {
            return;
        }

        ScheduledFuture<?> task = heartbeatTask;
        if (task != null) {
            task.cancel(false);
        }

        TransportBindingListener l = listener;
        if (l != null) {
            l.onTransportDown(cause);
        }
    }

    private void sendPing(Channel ch)
    {
        if (!ch.isActive()) {
            return;
        }
        long token = SystemMonotonicClock.INSTANCE.nowNanos();
        heartbeat.pingSent(token);
        ch.writeAndFlush(TransportFrame.ping(token), ch.voidPromise());
    }

    private TransportBindingListener requireListener()
    {
        TransportBindingListener l = listener;
        if (l == null) {
            throw new IllegalStateException("TransportBindingListener must be set before start()");
        }
        return l;
    }

    /**
     * Counts raw bytes in both directions, length prefixes included.
     */
    private final class ByteCounter extends ChannelDuplexHandler
    {
        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            if (msg instanceof ByteBuf buf) {
                bytesReceived.addAndGet(buf.readableBytes());
            }
            ctx.fireChannelRead(msg);
        }

        @Override
        public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise)
        {
            if (msg instanceof ByteBuf buf) {
                bytesSent.addAndGet(buf.readableBytes());
            }
            ctx.write(msg, promise);
        }
    }

    /**
     * Routes decoded frames: messages to the listener, pings answered, pongs
     * fed to the heartbeat monitor.
     */
    private final class SessionHandler extends SimpleChannelInboundHandler<TransportFrame>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, TransportFrame frame)
        {
            switch (frame.type()) {
                case RELIABLE, UNRELIABLE -> {
                    TransportBindingListener l = listener;
                    if (l != null) {
                        l.onMessage(frame.payload());
                    }
                }
                case PING -> ctx.writeAndFlush(TransportFrame.pong(frame.token()), ctx.voidPromise());
                case PONG -> heartbeat.pongReceived(frame.token(), SystemMonotonicClock.INSTANCE.nowNanos());
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            fireDown(null);
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            fireDown(cause);
            ctx.close();
        }
    }
}
