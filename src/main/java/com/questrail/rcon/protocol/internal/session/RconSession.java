package com.questrail.rcon.protocol.internal.session;

import com.questrail.rcon.api.RconClient;
import com.questrail.rcon.api.RconErrorKind;
import com.questrail.rcon.api.RconException;
import com.questrail.rcon.api.SessionStatus;
import com.questrail.rcon.protocol.config.FragmentPolicy;
import com.questrail.rcon.protocol.config.RconClientConfig;
import com.questrail.rcon.protocol.internal.time.MonotonicClock;
import com.questrail.rcon.protocol.internal.time.MonotonicScheduler;
import com.questrail.rcon.protocol.model.RconPacket;
import com.questrail.rcon.protocol.model.RconPacketType;
import com.questrail.rcon.protocol.model.RconProtocol;
import com.questrail.rcon.protocol.observability.RconObservabilitySink;
import com.questrail.rcon.protocol.observability.RconProtocolObservabilityEvent;
import com.questrail.rcon.protocol.observability.RconStateTransitionEvent;
import com.questrail.rcon.protocol.transport.RconPacketListener;
import com.questrail.rcon.protocol.transport.RconTransportAdapter;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * RconSession
 * =============================================================================
 * The RCON client state machine: connection lifecycle, auth handshake and
 * command dispatch over one exclusively owned transport.
 *
 * <h2>One request in flight</h2>
 * <p>The session holds a single active-request slot. Requests issued while the
 * slot is occupied, or before the transport is up, wait in a FIFO queue.
 * Preconditions are checked when the caller issues a request and again when it
 * is dispatched.</p>
 *
 * <h2>Reply correlation</h2>
 * <ul>
 *   <li>AUTH: every packet whose type is not {@code AUTH_RESPONSE} is ignored
 *       (the server sends an empty RESPONSE_VALUE first). The AUTH_RESPONSE id
 *       decides: {@link RconProtocol#ID_AUTH} accepts, anything else rejects.</li>
 *   <li>EXECCOMMAND: only packets carrying the request id are accepted. Under
 *       {@link FragmentPolicy#FIRST_FRAGMENT} the first non-empty fragment
 *       completes the request; under {@link FragmentPolicy#TERMINATOR_PROBE}
 *       fragments accumulate until the echo of the probe id arrives.</li>
 * </ul>
 *
 * <h2>Execution model</h2>
 * <p>Caller threads, the transport event loop and the timeout scheduler all
 * enter through this object's monitor. Futures are completed after the monitor
 * is released, so continuations never run while the session is locked.</p>
 */
public final class RconSession implements RconClient, RconPacketListener
{
    private final RconClientConfig config;
    private final RconTransportAdapter transport;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Supplier<Instant> wallClock;
    private final RconObservabilitySink observabilitySink;

    private final RequestIdSequence ids = new RequestIdSequence();
    private final Deque<PendingRequest> queue = new ArrayDeque<>();

    // Completions collected under the monitor, run after it is released.
    private final List<Runnable> deferred = new ArrayList<>();

    private PendingRequest active;
    private boolean connected;
    private boolean authenticated;
    private boolean transportDown;
    private SessionStatus status = SessionStatus.CREATED;
    private CompletableFuture<Void> closeFuture;

    // Completed once the session reaches CLOSED, whatever the cause.
    private final CompletableFuture<Void> closed = new CompletableFuture<>();

    public RconSession(RconClientConfig config,
                       RconTransportAdapter transport,
                       MonotonicClock clock,
                       MonotonicScheduler scheduler,
                       Supplier<Instant> wallClock,
                       RconObservabilitySink observabilitySink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");

        this.transport.setListener(this);
    }

    /**
     * Open the transport. {@link #isConnected()} turns true once the transport
     * reports that it is up.
     */
    public void open() {
        transport.start();
    }

    /**
     * Completes when the session reaches {@link SessionStatus#CLOSED}: after
     * {@link #disconnect()}, an auth rejection or a transport drop. Completion
     * happens after the session monitor is released.
     */
    public CompletableFuture<Void> whenClosed() {
        return closed;
    }

    // -------------------------------------------------------------------------
    // RconClient
    // -------------------------------------------------------------------------

    @Override
    public CompletableFuture<Void> authenticate(String password) {
        PendingRequest request = PendingRequest.auth(password);

        synchronized (this) {
            if (authenticated) {
                fail(request, RconErrorKind.ALREADY_AUTHENTICATED, "Already authenticated");
            }
            else if (status == SessionStatus.CLOSED) {
                fail(request, RconErrorKind.SESSION_CLOSED, "Session is closed");
            }
            else {
                queue.addLast(request);
                dispatchNext();
            }
        }
        runDeferred();

        return request.result().thenApply(ignored -> null);
    }

    @Override
    public CompletableFuture<String> execute(String command) {
        PendingRequest request = PendingRequest.command(command);

        synchronized (this) {
            if (!connected) {
                fail(request, RconErrorKind.NOT_CONNECTED, "Not connected. Please reauthenticate.");
            }
            else if (!transport.isWritable()) {
                fail(request, RconErrorKind.SEND_UNAVAILABLE, "Unable to write to transport");
            }
            else if (!authenticated) {
                fail(request, RconErrorKind.NOT_AUTHORIZED, "Not authorized");
            }
            else {
                queue.addLast(request);
                dispatchNext();
            }
        }
        runDeferred();

        return request.result();
    }

    @Override
    public CompletableFuture<Void> disconnect() {
        CompletableFuture<Void> result;
        synchronized (this) {
            if (closeFuture == null) {
                closeFuture = new CompletableFuture<>();
                if (transportDown) {
                    closeFuture.complete(null);
                }
                else {
                    beginClose("disconnect requested");
                }
            }
            result = closeFuture;
        }
        runDeferred();
        return result;
    }

    @Override
    public synchronized boolean isConnected() {
        return connected;
    }

    @Override
    public synchronized boolean isAuthenticated() {
        return authenticated;
    }

    @Override
    public synchronized SessionStatus status() {
        return status;
    }

    // -------------------------------------------------------------------------
    // RconPacketListener
    // -------------------------------------------------------------------------

    @Override
    public void onConnected() {
        synchronized (this) {
            if (status == SessionStatus.CLOSED) {
                return;
            }
            connected = true;
            dispatchNext();
        }
        runDeferred();
    }

    @Override
    public void onPacket(RconPacket packet) {
        Objects.requireNonNull(packet, "packet");

        synchronized (this) {
            PendingRequest request = active;
            if (request == null) {
                publish(RconProtocolObservabilityEvent.Kind.PACKET_IGNORED, packet.type(), packet.id());
            }
            else if (request.isAuth()) {
                onAuthReply(request, packet);
            }
            else {
                onCommandReply(request, packet);
            }
        }
        runDeferred();
    }

    @Override
    public void onTransportError(Throwable cause) {
        synchronized (this) {
            if (closeFuture != null && !closeFuture.isDone()) {
                CompletableFuture<Void> pendingClose = closeFuture;
                RconException error = new RconException(RconErrorKind.TRANSPORT_ERROR,
                        "Transport error before close confirmation", cause);
                deferred.add(() -> pendingClose.completeExceptionally(error));
            }

            PendingRequest request = active;
            if (request != null) {
                abandon(request);
                if (request.isAuth() && status == SessionStatus.AUTHENTICATING) {
                    transition(SessionStatus.CREATED, "transport error during auth");
                }
                fail(request, RconErrorKind.TRANSPORT_ERROR, "Transport error", cause);
                dispatchNext();
            }
        }
        runDeferred();
    }

    @Override
    public void onDisconnected(Throwable cause) {
        synchronized (this) {
            transportDown = true;
            connected = false;
            authenticated = false;
            transition(SessionStatus.CLOSED, cause == null ? "transport closed" : "transport failed");

            if (cause == null) {
                failAll(RconErrorKind.SESSION_CLOSED, "Session closed", null);
            } else {
                failAll(RconErrorKind.TRANSPORT_ERROR, "Transport failed", cause);
            }

            if (closeFuture != null && !closeFuture.isDone()) {
                CompletableFuture<Void> pendingClose = closeFuture;
                if (cause == null) {
                    deferred.add(() -> pendingClose.complete(null));
                } else {
                    RconException error = new RconException(RconErrorKind.TRANSPORT_ERROR,
                            "Transport failed while closing", cause);
                    deferred.add(() -> pendingClose.completeExceptionally(error));
                }
            }
        }
        runDeferred();
    }

    // -------------------------------------------------------------------------
    // Reply handling (monitor held)
    // -------------------------------------------------------------------------

    private void onAuthReply(PendingRequest request, RconPacket packet) {
        if (packet.type() != RconPacketType.AUTH_RESPONSE) {
            publish(RconProtocolObservabilityEvent.Kind.PACKET_IGNORED, packet.type(), packet.id());
            return;
        }

        request.cancelTimeout();
        active = null;
        publish(RconProtocolObservabilityEvent.Kind.REQUEST_COMPLETED, request.type(), request.id());

        if (RconProtocol.isAuthAccepted(packet.id())) {
            authenticated = true;
            transition(SessionStatus.AUTHENTICATED, "auth accepted");
            succeed(request, "");
            dispatchNext();
        }
        else {
            fail(request, RconErrorKind.AUTHENTICATION_FAILED, "Unable to authenticate");
            if (closeFuture == null) {
                closeFuture = new CompletableFuture<>();
            }
            beginClose("auth rejected");
        }
    }

    private void onCommandReply(PendingRequest request, RconPacket packet) {
        if (packet.id() == request.id()) {
            request.append(packet.body());
            publish(RconProtocolObservabilityEvent.Kind.FRAGMENT_ACCEPTED, packet.type(), packet.id());

            if (!request.hasTerminator() && request.hasResponse()) {
                complete(request);
            }
        }
        else if (request.hasTerminator() && packet.id() == request.terminatorId()) {
            complete(request);
        }
        else {
            publish(RconProtocolObservabilityEvent.Kind.PACKET_IGNORED, packet.type(), packet.id());
        }
    }

    private void complete(PendingRequest request) {
        request.cancelTimeout();
        active = null;
        releaseIds(request);
        publish(RconProtocolObservabilityEvent.Kind.REQUEST_COMPLETED, request.type(), request.id());
        succeed(request, request.response());
        dispatchNext();
    }

    // -------------------------------------------------------------------------
    // Dispatch (monitor held)
    // -------------------------------------------------------------------------

    private void dispatchNext() {
        while (active == null && !queue.isEmpty()) {
            if (!connected) {
                // Queued requests wait for onConnected(); closure fails them.
                return;
            }

            PendingRequest next = queue.pollFirst();
            if (next.isAuth() && authenticated) {
                fail(next, RconErrorKind.ALREADY_AUTHENTICATED, "Already authenticated");
            }
            else if (!next.isAuth() && !authenticated) {
                fail(next, RconErrorKind.NOT_AUTHORIZED, "Not authorized");
            }
            else if (!transport.isWritable()) {
                fail(next, RconErrorKind.SEND_UNAVAILABLE, "Unable to write to transport");
            }
            else {
                write(next);
            }
        }
    }

    private void write(PendingRequest request) {
        final int id;
        final int terminatorId;
        if (request.isAuth()) {
            id = RconProtocol.ID_AUTH;
            terminatorId = PendingRequest.UNASSIGNED;
        } else {
            id = ids.next();
            terminatorId = config.fragmentPolicy() == FragmentPolicy.TERMINATOR_PROBE
                    ? ids.next()
                    : PendingRequest.UNASSIGNED;
        }
        request.assign(id, terminatorId);

        byte[] message = transport.encode(request.packet());
        if (config.packetSizeLimited() && message.length > config.maxPacketSize()) {
            releaseIds(request);
            fail(request, RconErrorKind.PACKET_TOO_LARGE,
                    "Packet size " + message.length + " exceeds maximum " + config.maxPacketSize());
            return;
        }

        active = request;
        if (request.isAuth()) {
            transition(SessionStatus.AUTHENTICATING, "auth requested");
        }

        // A send may report a transport error synchronously, which abandons
        // this request and dispatches the next one before returning here.
        transport.send(message);
        if (active != request) {
            return;
        }
        if (request.hasTerminator()) {
            transport.send(transport.encode(RconPacket.terminatorProbe(terminatorId)));
            if (active != request) {
                return;
            }
        }
        publish(RconProtocolObservabilityEvent.Kind.REQUEST_SENT, request.type(), id);

        if (!config.responseTimeout().isZero()) {
            request.armTimeout(scheduler.scheduleAfter(config.responseTimeout(), clock,
                    () -> onResponseTimeout(request)));
        }
    }

    private void onResponseTimeout(PendingRequest request) {
        synchronized (this) {
            // Stale guard: the request already completed, failed or was aborted.
            if (active != request) {
                return;
            }
            abandon(request);
            publish(RconProtocolObservabilityEvent.Kind.RESPONSE_TIMEOUT, request.type(), request.id());
            if (request.isAuth() && status == SessionStatus.AUTHENTICATING) {
                transition(SessionStatus.CREATED, "auth timed out");
            }
            fail(request, RconErrorKind.TIMEOUT,
                    "No reply within " + config.responseTimeout().toMillis() + " ms");
            dispatchNext();
        }
        runDeferred();
    }

    // -------------------------------------------------------------------------
    // Closure (monitor held)
    // -------------------------------------------------------------------------

    private void beginClose(String reason) {
        connected = false;
        authenticated = false;
        transition(SessionStatus.CLOSED, reason);
        failAll(RconErrorKind.SESSION_CLOSED, "Session closed", null);
        transport.close();
    }

    private void failAll(RconErrorKind kind, String message, Throwable cause) {
        PendingRequest request = active;
        if (request != null) {
            abandon(request);
            fail(request, kind, message, cause);
        }
        PendingRequest queued;
        while ((queued = queue.pollFirst()) != null) {
            fail(queued, kind, message, cause);
        }
    }

    /**
     * Clear the active slot for a request that will not see its reply.
     */
    private void abandon(PendingRequest request) {
        request.cancelTimeout();
        active = null;
        if (!request.isAuth()) {
            ids.quarantine(request.id());
            if (request.hasTerminator()) {
                ids.quarantine(request.terminatorId());
            }
        }
    }

    private void releaseIds(PendingRequest request) {
        if (!request.isAuth()) {
            ids.release(request.id());
            if (request.hasTerminator()) {
                ids.release(request.terminatorId());
            }
        }
    }

    // -------------------------------------------------------------------------
    // Helpers (monitor held)
    // -------------------------------------------------------------------------

    private void transition(SessionStatus next, String reason) {
        SessionStatus previous = status;
        if (previous == next) {
            return;
        }
        status = next;
        if (next == SessionStatus.CLOSED) {
            deferred.add(() -> closed.complete(null));
        }
        observabilitySink.onStateTransition(new RconStateTransitionEvent(wallClock.get(), previous, next, reason));
    }

    private void publish(RconProtocolObservabilityEvent.Kind kind, RconPacketType type, int requestId) {
        observabilitySink.onProtocolEvent(new RconProtocolObservabilityEvent(wallClock.get(), kind, type, requestId));
    }

    private void succeed(PendingRequest request, String value) {
        deferred.add(() -> request.result().complete(value));
    }

    private void fail(PendingRequest request, RconErrorKind kind, String message) {
        fail(request, kind, message, null);
    }

    private void fail(PendingRequest request, RconErrorKind kind, String message, Throwable cause) {
        RconException error = cause == null
                ? new RconException(kind, message)
                : new RconException(kind, message, cause);
        deferred.add(() -> request.result().completeExceptionally(error));
    }

    private void runDeferred() {
        // Re-entered from a transport callback under the monitor: the outer
        // frame drains the list once it has released the lock.
        if (Thread.holdsLock(this)) {
            return;
        }
        List<Runnable> tasks;
        synchronized (this) {
            if (deferred.isEmpty()) {
                return;
            }
            tasks = new ArrayList<>(deferred);
            deferred.clear();
        }
        for (Runnable task : tasks) {
            task.run();
        }
    }
}
