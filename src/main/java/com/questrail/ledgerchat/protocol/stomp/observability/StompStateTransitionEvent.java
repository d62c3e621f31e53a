package com.questrail.ledgerchat.protocol.stomp.observability;

import com.questrail.ledgerchat.api.ConnectionStatus;

import java.time.Instant;

/**
 * Record representing a connection state transition.
 *
 * @param reason short human-readable trigger (e.g. {@code "CONNECTED frame"})
 */
public record StompStateTransitionEvent(
    Instant timestamp,
    ConnectionStatus oldState,
    ConnectionStatus newState,
    String reason
) {
}
