package com.questrail.ledgerchat.protocol.stomp.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the STOMP client stack.
 */
public record StompErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
