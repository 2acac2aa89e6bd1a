package com.questrail.rcon.api;

/**
 * SessionStatus
 * -----------------------------------------------------------------------------
 * Lifecycle state of an {@link RconClient} session.
 *
 * <pre>
 *   CREATED ──authenticate──▶ AUTHENTICATING ──accepted──▶ AUTHENTICATED
 *      ▲                          │      │                       │
 *      └──── error / timeout ─────┘      └─ rejected ─┐          │ disconnect
 *                                                     ▼          ▼
 *                                                   CLOSED ◀─────┘
 * </pre>
 *
 * <p>{@link #CLOSED} is terminal. There is no executing sub-state: a command in
 * flight does not change the status.</p>
 */
public enum SessionStatus
{
    /**
     * The transport has been opened (or is opening) and no credentials have
     * been accepted yet.
     */
    CREATED,

    /**
     * An AUTH request has been sent and its authoritative reply has not arrived.
     */
    AUTHENTICATING,

    /**
     * The server accepted the password; commands may be executed.
     */
    AUTHENTICATED,

    /**
     * The session was disconnected, rejected by the server, or lost its
     * transport.
     */
    CLOSED
}
