package com.questrail.rcon.protocol.observability;

import java.time.Instant;

/**
 * Record representing a transport lifecycle signal.
 *
 * @param cause failure detail; {@code null} for {@link Kind#UP} and orderly closes
 */
public record RconTransportObservabilityEvent(
    Instant timestamp,
    Kind kind,
    Throwable cause
) {
    public enum Kind {
        UP,
        ERROR,
        DOWN
    }
}
