package com.questrail.amilink.protocol.ami.transport.tcp.netty;

import com.questrail.amilink.api.AmiTransportException;
import com.questrail.amilink.protocol.ami.transport.AmiStreamEndpoint;
import com.questrail.amilink.protocol.ami.transport.AmiStreamEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.*;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpStreamEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link AmiStreamEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Group lines into blocks or classify them</li>
 *   <li>Correlate responses</li>
 *   <li>Schedule retries or timeouts, or reconnect</li>
 * </ul>
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   LineBasedFrameDecoder(maxLineLength)   CRLF or LF, terminator stripped
 *     → StringDecoder(UTF-8)
 *       → LineForwardingHandler            → AmiStreamEndpointListener
 *   StringEncoder(UTF-8)                   ← send(String)
 * </pre>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. The listener sees plain {@code String} lines.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} connects and blocks until connected or the connect timeout expires.
 * - {@link #stop()} closes the channel. The event loop group belongs to the
 *   {@link NettyTcpStreamEndpointFactory} and outlives the endpoint.
 */
public final class NettyTcpStreamEndpoint implements AmiStreamEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpStreamEndpoint.class);

    private final String host;
    private final int port;
    private final Duration connectTimeout;
    private final int maxLineLength;
    private final EventLoopGroup group;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile AmiStreamEndpointListener listener;
    private volatile Channel channel;

    NettyTcpStreamEndpoint(EventLoopGroup group, String host, int port, Duration connectTimeout, int maxLineLength)
    {
        this.group = Objects.requireNonNull(group, "group");
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.maxLineLength = maxLineLength;
    }

    @Override
    public void setListener(AmiStreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        AmiStreamEndpointListener l = requireListener();
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("endpoint already started");
        }

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LineBasedFrameDecoder(maxLineLength, true, false));
                        p.addLast(new StringDecoder(StandardCharsets.UTF_8));
                        p.addLast(new StringEncoder(StandardCharsets.UTF_8));
                        p.addLast(new LineForwardingHandler(l));
                    }
                });

        ChannelFuture f = bootstrap.connect(host, port);
        if (!f.awaitUninterruptibly().isSuccess()) {
            throw new AmiTransportException("Cannot connect to " + host + ":" + port, f.cause());
        }

        channel = f.channel();
        log.debug("Connected to {}:{} from {}", host, port, channel.localAddress());
        l.onTransportUp();
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        if (ch == null) {
            return;
        }
        ChannelFuture closed = ch.close();
        // Waiting on the I/O thread itself would deadlock.
        if (!ch.eventLoop().inEventLoop()) {
            closed.awaitUninterruptibly(connectTimeout.toMillis());
        }
    }

    @Override
    public CompletableFuture<Void> send(String text)
    {
        Objects.requireNonNull(text, "text");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return CompletableFuture.failedFuture(
                    new AmiTransportException("Not connected to " + host + ":" + port));
        }

        CompletableFuture<Void> written = new CompletableFuture<>();
        ch.writeAndFlush(text).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                written.complete(null);
            } else {
                written.completeExceptionally(future.cause());
                // A broken write means a broken connection; let the normal close path report it.
                future.channel().pipeline().fireExceptionCaught(future.cause());
            }
        });
        return written;
    }

    @Override
    public boolean isOpen()
    {
        Channel ch = channel;
        return ch != null && ch.isActive();
    }

    private AmiStreamEndpointListener requireListener()
    {
        AmiStreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("AmiStreamEndpointListener must be set before start()");
        }
        return l;
    }
}
