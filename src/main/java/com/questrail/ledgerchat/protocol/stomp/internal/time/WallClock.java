package com.questrail.ledgerchat.protocol.stomp.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used only to timestamp observability events.
 *
 * <p>It MUST NOT be used for timeouts, heart-beats or reconnect spacing.</p>
 */
public interface WallClock
{
    Instant now();
}
