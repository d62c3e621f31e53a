package com.questrail.ledgerchat.protocol.stomp.observability;

import java.time.Instant;

/**
 * Record representing a protocol-level occurrence that is not itself a state
 * transition.
 */
public record StompProtocolObservabilityEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        CONNECT_SENT,
        SESSION_ESTABLISHED,
        HANDSHAKE_TIMEOUT,
        HEARTBEAT_TIMEOUT,
        RECONNECT_SCHEDULED,
        SUBSCRIBED,
        UNSUBSCRIBED,
        RECEIPT
    }
}
