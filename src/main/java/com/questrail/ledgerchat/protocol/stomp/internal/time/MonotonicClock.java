package com.questrail.ledgerchat.protocol.stomp.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for session timing: handshake deadlines, heart-beat supervision
 * and reconnect spacing.
 *
 * <h2>Binding invariant</h2>
 * Timing decisions MUST use this clock. Wall-clock time is permitted only for
 * event timestamps and logging.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful as differences.
     */
    long nowNanos();
}
