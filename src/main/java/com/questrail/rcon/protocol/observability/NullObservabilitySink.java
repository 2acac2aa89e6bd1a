package com.questrail.rcon.protocol.observability;

/**
 * No-op implementation of RconObservabilitySink.
 */
public final class NullObservabilitySink implements RconObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(RconStateTransitionEvent event) {}

    @Override
    public void onProtocolEvent(RconProtocolObservabilityEvent event) {}

    @Override
    public void onTransportEvent(RconTransportObservabilityEvent event) {}

    @Override
    public void onError(RconErrorEvent event) {}
}
