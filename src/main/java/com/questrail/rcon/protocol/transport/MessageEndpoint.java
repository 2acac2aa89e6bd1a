package com.questrail.rcon.protocol.transport;

/**
 * MessageEndpoint
 * -----------------------------------------------------------------------------
 * Port for a duplex, message-oriented connection to one fixed remote host.
 *
 * <p>Each inbound message handed to the listener is exactly one RCON packet.
 * Stream transports must reassemble packets before delivery; message
 * transports (WebSocket) deliver frames as they arrive.</p>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test double.</p>
 */
public interface MessageEndpoint
{
    /**
     * Register the listener that receives inbound messages and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(MessageEndpointListener listener);

    /**
     * Begin connecting to the remote host.
     *
     * <p>Returns immediately. On success the endpoint notifies
     * {@link MessageEndpointListener#onTransportUp()}; on failure
     * {@link MessageEndpointListener#onTransportDown(Throwable)} with the cause.</p>
     */
    void start();

    /**
     * Initiate shutdown.
     *
     * <p>Returns immediately. Confirmation arrives as exactly one
     * {@link MessageEndpointListener#onTransportDown(Throwable)} call with a
     * {@code null} cause.</p>
     */
    void close();

    /**
     * Send one complete message.
     *
     * <p>Failures to write are reported asynchronously through
     * {@link MessageEndpointListener#onTransportError(Throwable)}.</p>
     */
    void send(byte[] message);

    /**
     * Whether the endpoint can accept a {@link #send(byte[])} right now.
     */
    boolean isWritable();
}
