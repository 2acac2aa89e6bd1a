package com.questrail.rcon.protocol.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for response deadlines.
 *
 * <p>Request timeouts are computed only from this clock. Wall-clock time
 * ({@code Instant.now()}) is used for observability timestamps and nothing
 * else.</p>
 */
@FunctionalInterface
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between values are meaningful.
     */
    long nowNanos();
}
