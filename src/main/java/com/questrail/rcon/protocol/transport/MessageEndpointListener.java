package com.questrail.rcon.protocol.transport;

/**
 * MessageEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link MessageEndpoint}.
 *
 * <p>Callbacks are delivered serially and in arrival order. Netty endpoints
 * deliver them on the channel's event loop.</p>
 */
public interface MessageEndpointListener
{
    /**
     * The connection is established and ready for writes.
     */
    void onTransportUp();

    /**
     * One complete inbound message, copied out of any framework buffer.
     */
    void onMessage(byte[] message);

    /**
     * A lower-layer failure that does not by itself close the connection
     * (for example a failed write).
     */
    void onTransportError(Throwable cause);

    /**
     * The connection is closed or could not be opened.
     *
     * @param cause failure that caused the closure, or {@code null} for an
     *              orderly close
     */
    void onTransportDown(Throwable cause);
}
