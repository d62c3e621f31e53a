package com.questrail.ledgerchat.protocol.stomp.observability;

import java.time.Instant;

/**
 * Record representing a WebSocket-level occurrence.
 *
 * @param closeCode WebSocket close code for {@link Kind#DOWN}; {@code 0} otherwise
 */
public record StompTransportObservabilityEvent(
    Instant timestamp,
    Kind kind,
    int closeCode,
    String detail
) {
    public enum Kind {
        OPENING,
        UP,
        DOWN,
        UNDECODABLE_MESSAGE
    }
}
