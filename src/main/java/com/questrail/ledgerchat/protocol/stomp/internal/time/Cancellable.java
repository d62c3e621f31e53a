package com.questrail.ledgerchat.protocol.stomp.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a scheduled session task (handshake timeout,
 * heart-beat tick, reconnect attempt).
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
