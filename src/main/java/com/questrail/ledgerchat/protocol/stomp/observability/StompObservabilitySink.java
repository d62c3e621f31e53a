package com.questrail.ledgerchat.protocol.stomp.observability;

/**
 * Main interface for receiving STOMP client observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface StompObservabilitySink {
    /**
     * Called when the connection state changes.
     * @param event the transition event details
     */
    void onStateTransition(StompStateTransitionEvent event);

    /**
     * Called when a protocol-level event occurs (e.g., handshake, heart-beat timeout, reconnect).
     * @param event the protocol event
     */
    void onProtocolEvent(StompProtocolObservabilityEvent event);

    /**
     * Called when a transport-level event occurs (e.g., WebSocket up/down).
     * @param event the transport event
     */
    void onTransportEvent(StompTransportObservabilityEvent event);

    /**
     * Called when an error or anomaly occurs in the client stack.
     * @param event the error event
     */
    void onError(StompErrorEvent event);
}
