package com.questrail.rcon.protocol.internal.time;

/**
 * Cancellation handle for an armed response timeout.
 */
@FunctionalInterface
public interface Cancellable
{
    /**
     * @return {@code true} if the task will no longer run; {@code false} if it
     *         already ran or was cancelled before
     */
    boolean cancel();
}
