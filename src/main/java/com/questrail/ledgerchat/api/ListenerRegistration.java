package com.questrail.ledgerchat.api;

/**
 * Handle returned when a listener is registered; removing it stops delivery.
 */
@FunctionalInterface
public interface ListenerRegistration
{
    /**
     * Remove the listener. Idempotent.
     */
    void remove();
}
