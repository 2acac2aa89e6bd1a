package com.questrail.rcon.api;

/**
 * Classification of every failure an {@link RconClient} operation can report.
 */
public enum RconErrorKind
{
    /** {@code authenticate} was called on an already authenticated session. */
    ALREADY_AUTHENTICATED,

    /** The server rejected the password. The session is closed as a consequence. */
    AUTHENTICATION_FAILED,

    /** {@code execute} was called while the transport is not connected. */
    NOT_CONNECTED,

    /** {@code execute} was called before a successful authentication. */
    NOT_AUTHORIZED,

    /** The transport cannot currently accept a write. */
    SEND_UNAVAILABLE,

    /** The encoded request exceeds the configured maximum packet size. Nothing was sent. */
    PACKET_TOO_LARGE,

    /** A lower-layer failure; the original cause is attached. */
    TRANSPORT_ERROR,

    /** No matching reply arrived within the configured response timeout. */
    TIMEOUT,

    /** The session was closed while the request was outstanding or queued. */
    SESSION_CLOSED
}
