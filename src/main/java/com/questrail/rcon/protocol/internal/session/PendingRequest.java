package com.questrail.rcon.protocol.internal.session;

import com.questrail.rcon.protocol.internal.time.Cancellable;
import com.questrail.rcon.protocol.model.RconPacket;
import com.questrail.rcon.protocol.model.RconPacketType;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * PendingRequest
 * -----------------------------------------------------------------------------
 * One request awaiting dispatch or reply.
 *
 * <p>Created when the caller issues the request. Its id is assigned only when
 * it is written, so queued requests hold no id. All mutable state is guarded by
 * the owning session's monitor; only {@link #result()} is touched by other
 * threads.</p>
 */
final class PendingRequest
{
    static final int UNASSIGNED = Integer.MIN_VALUE;

    private final RconPacketType type;
    private final String body;
    private final CompletableFuture<String> result = new CompletableFuture<>();
    private final StringBuilder response = new StringBuilder();

    private int id = UNASSIGNED;
    private int terminatorId = UNASSIGNED;
    private Cancellable timeout;

    private PendingRequest(RconPacketType type, String body) {
        this.type = type;
        this.body = body;
    }

    static PendingRequest auth(String password) {
        return new PendingRequest(RconPacketType.AUTH, Objects.requireNonNull(password, "password"));
    }

    static PendingRequest command(String command) {
        return new PendingRequest(RconPacketType.EXECCOMMAND, Objects.requireNonNull(command, "command"));
    }

    boolean isAuth() {
        return type == RconPacketType.AUTH;
    }

    RconPacketType type() {
        return type;
    }

    void assign(int id, int terminatorId) {
        this.id = id;
        this.terminatorId = terminatorId;
    }

    int id() {
        return id;
    }

    boolean hasTerminator() {
        return terminatorId != UNASSIGNED;
    }

    int terminatorId() {
        return terminatorId;
    }

    RconPacket packet() {
        return new RconPacket(type, id, body);
    }

    void append(String fragment) {
        response.append(normalizeFragment(fragment));
    }

    boolean hasResponse() {
        return response.length() > 0;
    }

    String response() {
        return response.toString();
    }

    void armTimeout(Cancellable timeout) {
        this.timeout = timeout;
    }

    void cancelTimeout() {
        Cancellable t = timeout;
        timeout = null;
        if (t != null) {
            t.cancel();
        }
    }

    CompletableFuture<String> result() {
        return result;
    }

    /**
     * A trailing CRLF becomes a single LF; interior content is untouched.
     */
    static String normalizeFragment(String fragment) {
        if (fragment.endsWith("\r\n")) {
            return fragment.substring(0, fragment.length() - 2) + "\n";
        }
        return fragment;
    }
}
