package com.questrail.network.transport.netty;

import com.questrail.network.config.NetworkRuntimeConfig;
import com.questrail.network.transport.TransportAcceptor;
import com.questrail.network.transport.TransportAcceptorListener;
import com.questrail.network.transport.TransportException;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyTransportAcceptor
 * =============================================================================
 * Netty TCP implementation of {@link TransportAcceptor}.
 *
 * <p>Each accepted channel gets its pipeline installed and is handed to the
 * listener as a {@link NettyChannelTransportBinding} with reads paused, so no
 * inbound message can arrive before the receiver has wired up the
 * connection.</p>
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} binds {@link NetworkRuntimeConfig#bindAddress()} and
 *       waits for the bind to complete.</li>
 *   <li>{@link #stop()} closes the listen channel; accepted sessions keep
 *       running.</li>
 *   <li>{@link #close()} shuts down both event loop groups, which closes any
 *       session still open.</li>
 * </ul>
 */
public final class NettyTransportAcceptor implements TransportAcceptor
{
    private final NetworkRuntimeConfig config;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;

    private volatile TransportAcceptorListener listener;
    private volatile Channel serverChannel;

    public NettyTransportAcceptor(NetworkRuntimeConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.AUTO_READ, false)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        TransportAcceptorListener l = listener;
                        if (l == null) {
                            ch.close();
                            return;
                        }
                        l.onAccepted(NettyChannelTransportBinding.accepted(ch, config));
                    }
                });
    }

    @Override
    public void setListener(TransportAcceptorListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        if (listener == null) {
            throw new IllegalStateException("TransportAcceptorListener must be set before start()");
        }
        if (serverChannel != null) {
            return;
        }

        ChannelFuture f = bootstrap.bind(config.bindAddress()).awaitUninterruptibly();
        if (!f.isSuccess()) {
            throw new TransportException("Failed to bind " + config.bindAddress(), f.cause());
        }
        serverChannel = f.channel();
    }

    @Override
    public void stop()
    {
        Channel ch = serverChannel;
        serverChannel = null;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
    }

    @Override
    public void close()
    {
        stop();
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
    }

    @Override
    public SocketAddress localAddress()
    {
        Channel ch = serverChannel;
        return ch != null ? ch.localAddress() : null;
    }
}
