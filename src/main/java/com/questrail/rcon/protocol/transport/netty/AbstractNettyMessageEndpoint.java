package com.questrail.rcon.protocol.transport.netty;

import com.questrail.rcon.protocol.transport.MessageEndpoint;
import com.questrail.rcon.protocol.transport.MessageEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * AbstractNettyMessageEndpoint
 * =============================================================================
 * Connection lifecycle shared by the Netty-backed {@link MessageEndpoint}s.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Subclasses copy inbound payloads into
 * {@code byte[]} before calling {@link #deliver(byte[])}.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} connects asynchronously; subclasses call
 *       {@link #ready(Channel)} once the connection can carry RCON messages.</li>
 *   <li>{@link #close()} closes the channel. Whatever ends the connection,
 *       the listener sees exactly one {@code onTransportDown}, after which the
 *       event loop group is shut down.</li>
 * </ul>
 *
 * <p>Each endpoint owns a single-threaded event loop, so every listener
 * callback arrives on that thread, in order.</p>
 */
abstract class AbstractNettyMessageEndpoint implements MessageEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(AbstractNettyMessageEndpoint.class);

    private static final int CONNECT_TIMEOUT_MILLIS = 5_000;

    private final InetSocketAddress remote;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean closeRequested = new AtomicBoolean();
    private final AtomicBoolean down = new AtomicBoolean();

    private volatile MessageEndpointListener listener;
    private volatile Channel channel;
    private volatile boolean ready;
    private volatile Throwable failure;

    AbstractNettyMessageEndpoint(InetSocketAddress remote)
    {
        this.remote = Objects.requireNonNull(remote, "remote");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        initPipeline(ch.pipeline());
                    }
                });
    }

    /**
     * Install the framing handlers for this transport.
     */
    protected abstract void initPipeline(ChannelPipeline pipeline);

    /**
     * Wrap one outbound message in the object the pipeline expects.
     */
    protected abstract Object outbound(byte[] message);

    @Override
    public void setListener(MessageEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        requireListener();
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Endpoint already started");
        }
        if (closeRequested.get()) {
            return;
        }

        log.debug("Connecting to {}", remote);

        ChannelFuture f = bootstrap.connect(remote);
        f.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.warn("Connection to {} failed", remote, future.cause());
                fireDown(closeRequested.get() ? null : future.cause());
                return;
            }

            Channel ch = future.channel();
            channel = ch;
            ch.closeFuture().addListener((ChannelFutureListener) closed -> fireDown(failure));

            if (closeRequested.get()) {
                ch.close();
            }
        });
    }

    @Override
    public void close()
    {
        if (!closeRequested.compareAndSet(false, true)) {
            return;
        }

        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        else if (!started.get()) {
            fireDown(null);
        }
        // Otherwise the connect listener sees closeRequested and closes.
    }

    @Override
    public void send(byte[] message)
    {
        Objects.requireNonNull(message, "message");

        Channel ch = channel;
        if (ch == null || !ready) {
            MessageEndpointListener l = listener;
            if (l != null) {
                l.onTransportError(new IllegalStateException("Transport not ready"));
            }
            return;
        }

        ch.writeAndFlush(outbound(message)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                MessageEndpointListener l = listener;
                if (l != null) {
                    l.onTransportError(future.cause());
                }
            }
        });
    }

    @Override
    public boolean isWritable()
    {
        Channel ch = channel;
        return ready && ch != null && ch.isActive() && ch.isWritable();
    }

    /**
     * The connection can carry RCON messages.
     */
    protected final void ready(Channel ch)
    {
        if (channel == null) {
            channel = ch;
        }
        ready = true;
        log.debug("Connected to {}", remote);

        MessageEndpointListener l = listener;
        if (l != null) {
            l.onTransportUp();
        }
    }

    /**
     * Hand one complete inbound message to the listener.
     */
    protected final void deliver(byte[] message)
    {
        MessageEndpointListener l = listener;
        if (l != null) {
            l.onMessage(message);
        }
    }

    /**
     * Record a fatal channel failure and close the channel. The failure is
     * reported as the cause of the resulting {@code onTransportDown}.
     */
    protected final void fail(Channel ch, Throwable cause)
    {
        if (failure == null && !closeRequested.get()) {
            failure = cause;
        }
        log.warn("Channel to {} failed", remote, cause);
        ch.close();
    }

    private void fireDown(Throwable cause)
    {
        if (!down.compareAndSet(false, true)) {
            return;
        }
        ready = false;

        MessageEndpointListener l = listener;
        if (l != null) {
            l.onTransportDown(cause);
        }

        group.shutdownGracefully();
    }

    private void requireListener()
    {
        if (listener == null) {
            throw new IllegalStateException("MessageEndpointListener must be set before start()");
        }
    }
}
