package com.questrail.rcon.protocol.observability;

/**
 * Main interface for receiving RCON client observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive on the transport event loop, the timeout scheduler,
 * or a caller thread. Implementations must not block.</p>
 */
public interface RconObservabilitySink {
    /**
     * Called when the session lifecycle status changes.
     * @param event the transition details
     */
    void onStateTransition(RconStateTransitionEvent event);

    /**
     * Called for request-level activity (sent, completed, ignored packet, timeout).
     * @param event the protocol event
     */
    void onProtocolEvent(RconProtocolObservabilityEvent event);

    /**
     * Called when the transport comes up, fails, or goes down.
     * @param event the transport event
     */
    void onTransportEvent(RconTransportObservabilityEvent event);

    /**
     * Called when an error or anomaly occurs in the client stack.
     * @param event the error event
     */
    void onError(RconErrorEvent event);
}
