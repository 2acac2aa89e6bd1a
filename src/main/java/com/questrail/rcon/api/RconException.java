package com.questrail.rcon.api;

import java.util.Objects;

/**
 * Failure of an {@link RconClient} operation.
 *
 * <p>Always carries an {@link RconErrorKind}. Transport failures attach the
 * underlying cause.</p>
 */
public final class RconException extends RuntimeException
{
    private final RconErrorKind kind;

    public RconException(RconErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public RconException(RconErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public RconErrorKind kind() {
        return kind;
    }
}
