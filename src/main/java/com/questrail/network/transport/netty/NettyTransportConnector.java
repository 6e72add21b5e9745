package com.questrail.network.transport.netty;

import com.questrail.network.config.NetworkRuntimeConfig;
import com.questrail.network.transport.TransportBinding;
import com.questrail.network.transport.TransportConnector;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Netty TCP implementation of {@link TransportConnector}.
 *
 * <p>All bindings created by one connector share a single event loop
 * thread, released by {@link #close()}.</p>
 */
public final class NettyTransportConnector implements TransportConnector
{
    private final NetworkRuntimeConfig config;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    public NettyTransportConnector(NetworkRuntimeConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true);
    }

    @Override
    public TransportBinding open(SocketAddress remote)
    {
        Objects.requireNonNull(remote, "remote");
        return NettyChannelTransportBinding.dialling(bootstrap.clone(), remote, config);
    }

    @Override
    public void close()
    {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
    }
}
