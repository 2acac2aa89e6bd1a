package com.questrail.rcon.api;

import java.util.concurrent.CompletableFuture;

/**
 * RconClient
 * -----------------------------------------------------------------------------
 * Client side of a remote-console session: authenticate once, then issue text
 * commands and receive their text replies over one persistent connection.
 *
 * <h2>Asynchronous contract</h2>
 * Every operation that waits on the remote peer returns a
 * {@link CompletableFuture}. A future fails with an {@link RconException} whose
 * {@link RconException#kind()} names the reason. Precondition failures are
 * reported through the returned future, never thrown from the call itself.
 *
 * <h2>Ordering</h2>
 * At most one request is in flight per client. Requests issued while another
 * is outstanding are queued and sent in call order.
 */
public interface RconClient
{
    /**
     * Perform the one-time credential exchange.
     *
     * @param password RCON password sent as the body of the AUTH packet
     * @return a future completing when the server accepts the password; fails
     *         with {@link RconErrorKind#ALREADY_AUTHENTICATED},
     *         {@link RconErrorKind#AUTHENTICATION_FAILED},
     *         {@link RconErrorKind#TRANSPORT_ERROR} or
     *         {@link RconErrorKind#TIMEOUT}
     */
    CompletableFuture<Void> authenticate(String password);

    /**
     * Execute a single command on the remote server.
     *
     * @param command the command line
     * @return a future completing with the full reply text
     */
    CompletableFuture<String> execute(String command);

    /**
     * Close the session and its transport.
     *
     * <p>Outstanding and queued requests fail with
     * {@link RconErrorKind#SESSION_CLOSED}. The returned future completes once
     * the transport confirms closure.</p>
     */
    CompletableFuture<Void> disconnect();

    boolean isConnected();

    boolean isAuthenticated();

    /**
     * Coarse lifecycle state of the session.
     */
    SessionStatus status();
}
