package com.questrail.ledgerchat.protocol.stomp.observability;

/**
 * No-op implementation of StompObservabilitySink.
 */
public final class NullObservabilitySink implements StompObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(StompStateTransitionEvent event) {}

    @Override
    public void onProtocolEvent(StompProtocolObservabilityEvent event) {}

    @Override
    public void onTransportEvent(StompTransportObservabilityEvent event) {}

    @Override
    public void onError(StompErrorEvent event) {}
}
