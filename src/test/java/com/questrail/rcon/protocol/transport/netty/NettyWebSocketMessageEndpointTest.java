package com.questrail.rcon.protocol.transport.netty;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyWebSocketMessageEndpointTest
 * -----------------------------------------------------------------------------
 * Loopback tests against an in-process Netty WebSocket server that echoes
 * binary frames back and answers every echo with a text frame first.
 */
class NettyWebSocketMessageEndpointTest {

    private EventLoopGroup serverGroup;
    private Channel serverChannel;
    private NettyWebSocketMessageEndpoint endpoint;

    @BeforeEach
    void setUp() throws InterruptedException {
        serverGroup = new NioEventLoopGroup(1);
        serverChannel = new ServerBootstrap()
            .group(serverGroup)
            .channel(NioServerSocketChannel.class)
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ch.pipeline().addLast(new HttpServerCodec());
                    ch.pipeline().addLast(new HttpObjectAggregator(8192));
                    ch.pipeline().addLast(new WebSocketServerProtocolHandler("/rcon"));
                    ch.pipeline().addLast(new EchoHandler());
                }
            })
            .bind(new InetSocketAddress("127.0.0.1", 0))
            .sync()
            .channel();
    }

    @AfterEach
    void tearDown() {
        if (endpoint != null) {
            endpoint.close();
        }
        serverChannel.close();
        serverGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    @Test
    void upOnlyAfterHandshakeThenBinaryFramesRoundTrip() throws Exception {
        RecordingEndpointListener listener = start("/rcon");

        assertTrue(listener.up.await(2, TimeUnit.SECONDS), "handshake should complete");
        assertTrue(endpoint.isWritable());

        byte[] packet = NettyTcpMessageEndpointTest.packet(3, "status");
        endpoint.send(packet);

        // The text frame sent ahead of the echo is dropped.
        assertArrayEquals(packet, listener.nextMessage());
        assertTrue(listener.errors.isEmpty());
    }

    @Test
    void closeCompletesWithOrderlyDown() throws Exception {
        RecordingEndpointListener listener = start("/rcon");
        assertTrue(listener.up.await(2, TimeUnit.SECONDS));

        endpoint.close();

        assertTrue(listener.down.await(2, TimeUnit.SECONDS));
        assertNull(listener.downCause.get());
        assertEquals(1, listener.downCount.get());
    }

    @Test
    void uriIsBuiltFromAddressAndPath() {
        endpoint = new NettyWebSocketMessageEndpoint(
            InetSocketAddress.createUnresolved("game.example.org", 27015), "/rcon");

        assertEquals("ws://game.example.org:27015/rcon", endpoint.uri().toString());
    }

    private RecordingEndpointListener start(String path) {
        InetSocketAddress local = (InetSocketAddress) serverChannel.localAddress();
        endpoint = new NettyWebSocketMessageEndpoint(new InetSocketAddress("127.0.0.1", local.getPort()), path);
        RecordingEndpointListener listener = new RecordingEndpointListener();
        endpoint.setListener(listener);
        endpoint.start();
        return listener;
    }

    private static final class EchoHandler extends SimpleChannelInboundHandler<BinaryWebSocketFrame> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, BinaryWebSocketFrame frame) {
            ctx.write(new TextWebSocketFrame("noise"));
            ctx.writeAndFlush(new BinaryWebSocketFrame(frame.content().retain()));
        }
    }
}
