package com.questrail.ledgerchat.protocol.stomp.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of StompObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jStompObservabilitySink implements StompObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jStompObservabilitySink.class);

    @Override
    public void onStateTransition(StompStateTransitionEvent event) {
        log.info("STOMP connection: {} -> {} ({})",
            event.oldState(),
            event.newState(),
            event.reason());
    }

    @Override
    public void onProtocolEvent(StompProtocolObservabilityEvent event) {
        switch (event.kind()) {
            case HANDSHAKE_TIMEOUT, HEARTBEAT_TIMEOUT ->
                log.warn("STOMP {}: {}", event.kind(), event.detail());
            default ->
                log.debug("STOMP Protocol Event: {} {}", event.kind(), event.detail());
        }
    }

    @Override
    public void onTransportEvent(StompTransportObservabilityEvent event) {
        if (event.kind() == StompTransportObservabilityEvent.Kind.UNDECODABLE_MESSAGE) {
            log.warn("STOMP Transport Event: {}", event);
        }
        else {
            log.info("STOMP Transport Event: {}", event);
        }
    }

    @Override
    public void onError(StompErrorEvent event) {
        log.error("STOMP Error: {}", event.message(), event.cause());
    }
}
