package com.questrail.rcon.protocol.transport.netty;

import com.questrail.rcon.protocol.transport.MessageEndpoint;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;

import java.net.InetSocketAddress;
import java.nio.ByteOrder;

/**
 * NettyTcpMessageEndpoint
 * =============================================================================
 * {@link MessageEndpoint} over a raw TCP stream, as spoken by Source-engine
 * game servers.
 *
 * <p>The stream is split into packets on the little-endian size field. Each
 * delivered message is one complete packet, size field included, so the codec
 * sees the same bytes it would from a message transport. A size field that is
 * negative or exceeds {@code maxInboundPacketSize} is a stream defect: the
 * connection is closed with that failure as the cause.</p>
 */
public final class NettyTcpMessageEndpoint extends AbstractNettyMessageEndpoint
{
    /**
     * Default upper bound on one inbound packet, size field included.
     */
    public static final int DEFAULT_MAX_INBOUND_PACKET_SIZE = 64 * 1024;

    private static final int SIZE_FIELD_LENGTH = 4;

    private final int maxInboundPacketSize;

    public NettyTcpMessageEndpoint(InetSocketAddress remote)
    {
        this(remote, DEFAULT_MAX_INBOUND_PACKET_SIZE);
    }

    public NettyTcpMessageEndpoint(InetSocketAddress remote, int maxInboundPacketSize)
    {
        super(remote);
        if (maxInboundPacketSize <= SIZE_FIELD_LENGTH) {
            throw new IllegalArgumentException("maxInboundPacketSize must exceed " + SIZE_FIELD_LENGTH);
        }
        this.maxInboundPacketSize = maxInboundPacketSize;
    }

    @Override
    protected void initPipeline(ChannelPipeline pipeline)
    {
        pipeline.addLast(new LengthFieldBasedFrameDecoder(
                ByteOrder.LITTLE_ENDIAN,
                maxInboundPacketSize,
                0,                  // size field at offset 0
                SIZE_FIELD_LENGTH,
                0,                  // size counts the bytes after the field
                0,                  // keep the size field in the frame
                true));
        pipeline.addLast(new InboundHandler());
    }

    @Override
    protected Object outbound(byte[] message)
    {
        return Unpooled.wrappedBuffer(message);
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies each reassembled packet into a {@code byte[]}.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception
        {
            ready(ctx.channel());
            super.channelActive(ctx);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
        {
            byte[] bytes = new byte[frame.readableBytes()];
            frame.getBytes(frame.readerIndex(), bytes);
            deliver(bytes);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            fail(ctx.channel(), cause);
        }
    }
}
