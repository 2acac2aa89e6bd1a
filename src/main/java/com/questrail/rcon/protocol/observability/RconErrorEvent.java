package com.questrail.rcon.protocol.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the RCON client stack.
 *
 * @param cause may be {@code null}
 */
public record RconErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
