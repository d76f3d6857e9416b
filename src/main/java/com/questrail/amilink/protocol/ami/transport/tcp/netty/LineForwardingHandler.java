package com.questrail.amilink.protocol.ami.transport.tcp.netty;

import com.questrail.amilink.protocol.ami.transport.AmiStreamEndpointListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.TooLongFrameException;

import java.util.Objects;

/**
 * LineForwardingHandler
 * -------------------------------------------------------------------------
 * Last handler of the pipeline. Receives decoded {@code String} lines and
 * forwards them, together with the channel lifecycle, to the port listener.
 *
 * <p>A {@link TooLongFrameException} rejects one line and keeps the channel
 * open. Any other exception is remembered and closes the channel; it is then
 * reported as the cause of the single {@code onTransportDown} call made from
 * {@link #channelInactive(ChannelHandlerContext)}.</p>
 */
final class LineForwardingHandler extends SimpleChannelInboundHandler<String>
{
    private final AmiStreamEndpointListener listener;

    private Throwable failure;

    LineForwardingHandler(AmiStreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String line)
    {
        listener.onLine(line);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        listener.onTransportDown(failure);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        if (cause instanceof TooLongFrameException) {
            listener.onLineRejected(cause);
            return;
        }
        if (failure == null) {
            failure = cause;
        }
        ctx.close();
    }
}
