package com.questrail.rcon.protocol.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RconObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRconObservabilitySink implements RconObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRconObservabilitySink.class);

    @Override
    public void onStateTransition(RconStateTransitionEvent event) {
        log.info("RCON Session: {} -> {} ({})",
            event.oldStatus(),
            event.newStatus(),
            event.reason());
    }

    @Override
    public void onProtocolEvent(RconProtocolObservabilityEvent event) {
        if (event.kind() == RconProtocolObservabilityEvent.Kind.RESPONSE_TIMEOUT) {
            log.warn("RCON request {} ({}) timed out", event.requestId(), event.packetType());
            return;
        }
        log.debug("RCON Protocol Event: {}", event);
    }

    @Override
    public void onTransportEvent(RconTransportObservabilityEvent event) {
        if (event.cause() != null) {
            log.warn("RCON Transport Event: {}", event.kind(), event.cause());
        } else {
            log.info("RCON Transport Event: {}", event.kind());
        }
    }

    @Override
    public void onError(RconErrorEvent event) {
        log.error("RCON Error: {}", event.message(), event.cause());
    }
}
