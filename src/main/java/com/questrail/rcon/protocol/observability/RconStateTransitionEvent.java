package com.questrail.rcon.protocol.observability;

import com.questrail.rcon.api.SessionStatus;

import java.time.Instant;

/**
 * Record representing a session status transition.
 *
 * @param reason short human-readable trigger, e.g. {@code "auth rejected"}
 */
public record RconStateTransitionEvent(
    Instant timestamp,
    SessionStatus oldStatus,
    SessionStatus newStatus,
    String reason
) {
    public boolean isTerminal() {
        return newStatus == SessionStatus.CLOSED;
    }
}
