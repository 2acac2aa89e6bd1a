package com.questrail.rcon.protocol.runtime;

import com.questrail.rcon.api.RconClient;
import com.questrail.rcon.api.SessionStatus;
import com.questrail.rcon.protocol.codec.impl.DefaultRconPacketDecoder;
import com.questrail.rcon.protocol.codec.impl.DefaultRconPacketEncoder;
import com.questrail.rcon.protocol.config.RconClientConfig;
import com.questrail.rcon.protocol.internal.session.RconSession;
import com.questrail.rcon.protocol.internal.time.MonotonicClock;
import com.questrail.rcon.protocol.internal.time.MonotonicScheduler;
import com.questrail.rcon.protocol.internal.time.ScheduledExecutorScheduler;
import com.questrail.rcon.protocol.internal.time.SystemMonotonicClock;
import com.questrail.rcon.protocol.observability.NullObservabilitySink;
import com.questrail.rcon.protocol.observability.RconObservabilitySink;
import com.questrail.rcon.protocol.transport.MessageEndpoint;
import com.questrail.rcon.protocol.transport.RconTransportAdapter;
import com.questrail.rcon.protocol.transport.netty.NettyTcpMessageEndpoint;
import com.questrail.rcon.protocol.transport.netty.NettyWebSocketMessageEndpoint;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/**
 * RconProductionClient
 * =============================================================================
 * Composition root and lifecycle owner for the production RCON stack.
 *
 * <p>{@link Builder#build()} wires codec, transport, session and timeout
 * scheduler, then opens the transport immediately. The returned client is
 * usable at once: requests issued before the transport is up are queued.</p>
 *
 * <p>The client owns its scheduler thread and shuts it down once the session
 * is closed, whether by {@link #disconnect()}, an auth rejection or the
 * transport dropping.</p>
 */
public final class RconProductionClient implements RconClient {
    private static final String SCHEDULER_THREAD_NAME = "rcon-timeouts";

    private final RconSession session;
    private final ScheduledExecutorService schedulerExecutor;
    private final RconClientConfig config;

    private RconProductionClient(
            RconSession session,
            ScheduledExecutorService schedulerExecutor,
            RconClientConfig config) {
        this.session = session;
        this.schedulerExecutor = schedulerExecutor;
        this.config = config;
        if (schedulerExecutor != null) {
            // Every request has been failed by now; remaining timers are stale.
            session.whenClosed().whenComplete((ignored, error) -> schedulerExecutor.shutdownNow());
        }
    }

    @Override
    public CompletableFuture<Void> authenticate(String password) {
        return session.authenticate(password);
    }

    @Override
    public CompletableFuture<String> execute(String command) {
        return session.execute(command);
    }

    @Override
    public CompletableFuture<Void> disconnect() {
        return session.disconnect();
    }

    @Override
    public boolean isConnected() {
        return session.isConnected();
    }

    @Override
    public boolean isAuthenticated() {
        return session.isAuthenticated();
    }

    @Override
    public SessionStatus status() {
        return session.status();
    }

    public RconClientConfig config() {
        return config;
    }

    ScheduledExecutorService schedulerExecutor() {
        return schedulerExecutor;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RconClientConfig config = RconClientConfig.defaults();
        private RconObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MessageEndpoint endpoint;
        private MonotonicClock clock;
        private MonotonicScheduler scheduler;
        private Supplier<Instant> wallClock = Instant::now;

        public Builder withConfig(RconClientConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(RconObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replace the transport chosen by {@link RconClientConfig#transport()}.
         */
        public Builder withEndpoint(MessageEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        /**
         * Use an external clock and scheduler for response timeouts instead of
         * the client's own scheduler thread. Both must be supplied together.
         */
        public Builder withTiming(MonotonicClock clock, MonotonicScheduler scheduler) {
            this.clock = clock;
            this.scheduler = scheduler;
            return this;
        }

        public Builder withWallClock(Supplier<Instant> wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public RconProductionClient build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(wallClock, "wallClock");
            if ((clock == null) != (scheduler == null)) {
                throw new IllegalStateException("clock and scheduler must be supplied together");
            }

            // 1. Timing
            MonotonicClock effectiveClock = clock;
            MonotonicScheduler effectiveScheduler = scheduler;
            ScheduledExecutorService schedulerExec = null;
            if (effectiveClock == null) {
                effectiveClock = SystemMonotonicClock.INSTANCE;
                schedulerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, SCHEDULER_THREAD_NAME);
                    t.setDaemon(true);
                    return t;
                });
                effectiveScheduler = new ScheduledExecutorScheduler(schedulerExec, effectiveClock);
            }

            // 2. Transport
            MessageEndpoint effectiveEndpoint = endpoint != null ? endpoint : createEndpoint(config);
            RconTransportAdapter adapter = new RconTransportAdapter(
                effectiveEndpoint,
                new DefaultRconPacketEncoder(),
                new DefaultRconPacketDecoder(),
                config.encoding(),
                observabilitySink,
                wallClock
            );

            // 3. Session (registers itself as the adapter's listener)
            RconSession session = new RconSession(
                config,
                adapter,
                effectiveClock,
                effectiveScheduler,
                wallClock,
                observabilitySink
            );

            RconProductionClient client = new RconProductionClient(session, schedulerExec, config);
            session.open();
            return client;
        }

        private static MessageEndpoint createEndpoint(RconClientConfig config) {
            InetSocketAddress remote = InetSocketAddress.createUnresolved(config.host(), config.port());
            switch (config.transport()) {
                case TCP:
                    return new NettyTcpMessageEndpoint(remote);
                case WEBSOCKET:
                    return new NettyWebSocketMessageEndpoint(remote, config.webSocketPath());
                default:
                    throw new IllegalArgumentException("Unsupported transport: " + config.transport());
            }
        }
    }
}
