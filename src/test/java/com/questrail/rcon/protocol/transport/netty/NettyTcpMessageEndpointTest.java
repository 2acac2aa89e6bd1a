package com.questrail.rcon.protocol.transport.netty;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyTcpMessageEndpointTest
 * -----------------------------------------------------------------------------
 * Loopback tests against an in-process blocking socket server. They verify
 * stream reassembly and the exactly-once down notification.
 */
class NettyTcpMessageEndpointTest {

    private ServerSocket server;
    private NettyTcpMessageEndpoint endpoint;

    @AfterEach
    void tearDown() throws IOException {
        if (endpoint != null) {
            endpoint.close();
        }
        if (server != null) {
            server.close();
        }
    }

    @Test
    void sendsWholePacketsAndReassemblesSplitReplies() throws Exception {
        server = new ServerSocket(0);
        byte[] first = packet(1, "hello");
        byte[] second = packet(2, "world");

        CompletableFuture<byte[]> received = CompletableFuture.supplyAsync(() -> {
            try (Socket socket = server.accept()) {
                byte[] request = readPacket(new DataInputStream(socket.getInputStream()));

                OutputStream out = socket.getOutputStream();
                // First packet split mid-header, second packet glued to its tail.
                out.write(Arrays.copyOfRange(first, 0, 6));
                out.flush();
                Thread.sleep(50);
                byte[] rest = new byte[first.length - 6 + second.length];
                System.arraycopy(first, 6, rest, 0, first.length - 6);
                System.arraycopy(second, 0, rest, first.length - 6, second.length);
                out.write(rest);
                out.flush();
                Thread.sleep(100);
                return request;
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });

        RecordingEndpointListener listener = start();
        assertTrue(listener.up.await(2, TimeUnit.SECONDS), "endpoint should connect");
        assertTrue(endpoint.isWritable());

        byte[] request = packet(7, "status");
        endpoint.send(request);

        assertArrayEquals(request, received.get(2, TimeUnit.SECONDS));
        assertArrayEquals(first, listener.nextMessage());
        assertArrayEquals(second, listener.nextMessage());

        // Server closed its socket: orderly down.
        assertTrue(listener.down.await(2, TimeUnit.SECONDS));
        assertNull(listener.downCause.get());
        assertFalse(endpoint.isWritable());
    }

    @Test
    void closeReportsDownExactlyOnce() throws Exception {
        server = new ServerSocket(0);
        CompletableFuture.runAsync(() -> {
            try (Socket socket = server.accept()) {
                socket.getInputStream().read();
            } catch (IOException ignored) {
                // socket closed by the test
            }
        });

        RecordingEndpointListener listener = start();
        assertTrue(listener.up.await(2, TimeUnit.SECONDS));

        endpoint.close();
        endpoint.close();

        assertTrue(listener.down.await(2, TimeUnit.SECONDS));
        assertNull(listener.downCause.get());
        Thread.sleep(100);
        assertEquals(1, listener.downCount.get());
    }

    @Test
    void refusedConnectionReportsDownWithCause() throws Exception {
        int port;
        try (ServerSocket probe = new ServerSocket(0)) {
            port = probe.getLocalPort();
        }

        endpoint = new NettyTcpMessageEndpoint(new InetSocketAddress("127.0.0.1", port));
        RecordingEndpointListener listener = new RecordingEndpointListener();
        endpoint.setListener(listener);
        endpoint.start();

        assertTrue(listener.down.await(5, TimeUnit.SECONDS));
        assertNotNull(listener.downCause.get());
        assertEquals(1, listener.up.getCount(), "never reported up");
    }

    @Test
    void oversizedInboundPacketClosesWithCause() throws Exception {
        server = new ServerSocket(0);
        CompletableFuture.runAsync(() -> {
            try (Socket socket = server.accept()) {
                OutputStream out = socket.getOutputStream();
                out.write(ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(1_000_000).array());
                out.flush();
                socket.getInputStream().read();
            } catch (IOException ignored) {
                // closed by the endpoint
            }
        });

        endpoint = new NettyTcpMessageEndpoint(new InetSocketAddress("127.0.0.1", server.getLocalPort()), 1024);
        RecordingEndpointListener listener = new RecordingEndpointListener();
        endpoint.setListener(listener);
        endpoint.start();

        assertTrue(listener.down.await(2, TimeUnit.SECONDS));
        assertNotNull(listener.downCause.get());
    }

    @Test
    void startRequiresListener() {
        endpoint = new NettyTcpMessageEndpoint(new InetSocketAddress("127.0.0.1", 1));
        assertThrows(IllegalStateException.class, endpoint::start);
    }

    private RecordingEndpointListener start() {
        endpoint = new NettyTcpMessageEndpoint(new InetSocketAddress("127.0.0.1", server.getLocalPort()));
        RecordingEndpointListener listener = new RecordingEndpointListener();
        endpoint.setListener(listener);
        endpoint.start();
        return listener;
    }

    static byte[] packet(int id, String body) {
        byte[] text = body.getBytes(StandardCharsets.US_ASCII);
        ByteBuffer out = ByteBuffer.allocate(14 + text.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putInt(10 + text.length).putInt(id).putInt(0).put(text);
        return out.array();
    }

    static byte[] readPacket(DataInputStream in) throws IOException {
        byte[] sizeField = new byte[4];
        in.readFully(sizeField);
        int size = ByteBuffer.wrap(sizeField).order(ByteOrder.LITTLE_ENDIAN).getInt();
        byte[] packet = new byte[4 + size];
        System.arraycopy(sizeField, 0, packet, 0, 4);
        in.readFully(packet, 4, size);
        return packet;
    }
}
