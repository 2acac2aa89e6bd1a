package com.questrail.rcon.protocol.observability;

import com.questrail.rcon.protocol.model.RconPacketType;

import java.time.Instant;

/**
 * Record representing request-level protocol activity.
 *
 * <p>Never carries packet bodies: they may contain the RCON password.</p>
 */
public record RconProtocolObservabilityEvent(
    Instant timestamp,
    Kind kind,
    RconPacketType packetType,
    int requestId
) {
    public enum Kind {
        /** A request packet was handed to the transport. */
        REQUEST_SENT,
        /** A request was completed by a matching reply. */
        REQUEST_COMPLETED,
        /** An inbound packet matched no outstanding request and was ignored. */
        PACKET_IGNORED,
        /** An accepted reply fragment was appended to the pending reply. */
        FRAGMENT_ACCEPTED,
        /** A request's response timeout expired. */
        RESPONSE_TIMEOUT
    }
}
