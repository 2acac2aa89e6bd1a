package com.questrail.rcon.protocol.transport.netty;

import com.questrail.rcon.protocol.transport.MessageEndpoint;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.EmptyHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.URI;
import java.util.Objects;

/**
 * NettyWebSocketMessageEndpoint
 * =============================================================================
 * {@link MessageEndpoint} over a WebSocket connection to
 * {@code ws://host:port/path}.
 *
 * <p>Each binary frame carries exactly one RCON packet. Fragmented frames are
 * reassembled before delivery. The endpoint reports itself up only once the
 * opening handshake has completed.</p>
 *
 * <p>Non-binary data frames are not RCON packets; they are logged and
 * dropped.</p>
 */
public final class NettyWebSocketMessageEndpoint extends AbstractNettyMessageEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyWebSocketMessageEndpoint.class);

    /**
     * Default upper bound on one inbound frame payload.
     */
    public static final int DEFAULT_MAX_FRAME_PAYLOAD = 64 * 1024;

    private static final int MAX_HANDSHAKE_RESPONSE = 8 * 1024;

    private final URI uri;
    private final int maxFramePayload;

    public NettyWebSocketMessageEndpoint(InetSocketAddress remote, String path)
    {
        this(remote, path, DEFAULT_MAX_FRAME_PAYLOAD);
    }

    public NettyWebSocketMessageEndpoint(InetSocketAddress remote, String path, int maxFramePayload)
    {
        super(remote);
        Objects.requireNonNull(path, "path");
        if (maxFramePayload <= 0) {
            throw new IllegalArgumentException("maxFramePayload must be > 0");
        }
        this.uri = URI.create("ws://" + remote.getHostString() + ":" + remote.getPort() + path);
        this.maxFramePayload = maxFramePayload;
    }

    URI uri()
    {
        return uri;
    }

    @Override
    protected void initPipeline(ChannelPipeline pipeline)
    {
        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, false, EmptyHttpHeaders.INSTANCE, maxFramePayload);

        pipeline.addLast(new HttpClientCodec());
        pipeline.addLast(new HttpObjectAggregator(MAX_HANDSHAKE_RESPONSE));
        pipeline.addLast(new WebSocketClientProtocolHandler(handshaker));
        pipeline.addLast(new WebSocketFrameAggregator(maxFramePayload));
        pipeline.addLast(new InboundHandler());
    }

    @Override
    protected Object outbound(byte[] message)
    {
        return new BinaryWebSocketFrame(Unpooled.wrappedBuffer(message));
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Waits for the handshake, then copies each binary frame into a
     * {@code byte[]}.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<WebSocketFrame>
    {
        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
                ready(ctx.channel());
            }
            else if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
                fail(ctx.channel(), new WebSocketHandshakeException("WebSocket handshake timed out: " + uri));
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame)
        {
            if (!(frame instanceof BinaryWebSocketFrame)) {
                log.debug("Dropping {} from {}", frame.getClass().getSimpleName(), uri);
                return;
            }

            ByteBuf content = frame.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            deliver(bytes);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            fail(ctx.channel(), cause);
        }
    }
}
