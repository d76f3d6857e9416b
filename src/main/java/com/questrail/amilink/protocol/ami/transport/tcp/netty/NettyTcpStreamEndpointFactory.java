package com.questrail.amilink.protocol.ami.transport.tcp.netty;

import com.questrail.amilink.protocol.ami.transport.AmiStreamEndpoint;
import com.questrail.amilink.protocol.ami.transport.AmiStreamEndpointFactory;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Produces {@link NettyTcpStreamEndpoint}s that share one single-threaded
 * {@link NioEventLoopGroup}. One manager connection is open at a time, so one
 * I/O thread is enough, and inbound lines are handled strictly in order.
 *
 * <p>The factory owns the group; {@link #close()} shuts it down.</p>
 */
public final class NettyTcpStreamEndpointFactory implements AmiStreamEndpointFactory, AutoCloseable
{
    private final EventLoopGroup group = new NioEventLoopGroup(1, new DefaultThreadFactory("ami-io", true));

    @Override
    public AmiStreamEndpoint create(String host, int port, Duration connectTimeout, int maxLineLength) {
        return new NettyTcpStreamEndpoint(group, host, port, connectTimeout, maxLineLength);
    }

    @Override
    public void close() {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
    }
}
