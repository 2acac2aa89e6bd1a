package com.questrail.rcon.protocol.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FakeMessageEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link MessageEndpoint} implementation.
 *
 * <p>Contains no RCON semantics; it stores outbound messages and lets tests
 * drive inbound messages and lifecycle callbacks. With {@code autoConnect}
 * the endpoint reports itself up as soon as it is started.</p>
 */
public final class FakeMessageEndpoint implements MessageEndpoint {

    private final boolean autoConnect;

    private MessageEndpointListener listener;
    private final List<byte[]> sent = new ArrayList<>();
    private boolean started;
    private boolean up;
    private boolean down;
    private boolean writable = true;
    private int closeCalls;
    private boolean confirmClose = true;
    private Throwable nextSendFailure;

    public FakeMessageEndpoint() {
        this(true);
    }

    public FakeMessageEndpoint(boolean autoConnect) {
        this.autoConnect = autoConnect;
    }

    @Override
    public void setListener(MessageEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        started = true;
        if (autoConnect) {
            connect();
        }
    }

    @Override
    public void close() {
        closeCalls++;
        if (confirmClose && !down) {
            drop(null);
        }
    }

    @Override
    public void send(byte[] message) {
        Objects.requireNonNull(message, "message");
        if (nextSendFailure != null) {
            Throwable cause = nextSendFailure;
            nextSendFailure = null;
            requireListener().onTransportError(cause);
            return;
        }
        sent.add(message);
    }

    @Override
    public boolean isWritable() {
        return up && writable;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void connect() {
        up = true;
        requireListener().onTransportUp();
    }

    public void inject(byte[] message) {
        requireListener().onMessage(message);
    }

    public void error(Throwable cause) {
        requireListener().onTransportError(cause);
    }

    public void drop(Throwable cause) {
        up = false;
        down = true;
        requireListener().onTransportDown(cause);
    }

    public void setWritable(boolean writable) {
        this.writable = writable;
    }

    /**
     * The next {@link #send(byte[])} is not recorded; it reports
     * {@code cause} to the listener before returning, as a channel that is
     * not ready does.
     */
    public void failNextSend(Throwable cause) {
        this.nextSendFailure = Objects.requireNonNull(cause, "cause");
    }

    /**
     * When false, {@link #close()} does not confirm; the test calls
     * {@link #drop(Throwable)} itself.
     */
    public void setConfirmClose(boolean confirmClose) {
        this.confirmClose = confirmClose;
    }

    public boolean started() {
        return started;
    }

    public int closeCalls() {
        return closeCalls;
    }

    public List<byte[]> sent() {
        return Collections.unmodifiableList(sent);
    }

    public byte[] lastSent() {
        if (sent.isEmpty()) {
            throw new IllegalStateException("Nothing sent");
        }
        return sent.get(sent.size() - 1);
    }

    public void clear() {
        sent.clear();
    }

    private MessageEndpointListener requireListener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }
}
