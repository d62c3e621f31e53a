package com.questrail.ledgerchat.protocol.stomp.config;

import com.questrail.ledgerchat.protocol.stomp.model.HeartBeat;

import java.time.Duration;
import java.util.Objects;

/**
 * StompTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for the connection manager.
 *
 * <p>This policy only controls <em>when</em> things happen. Which frames are
 * sent and how state changes is decided by the connection manager.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>connectionTimeout</b>: Maximum time from {@code connect()} until the
 *       CONNECTED frame arrives. Zero disables the timeout.</li>
 *   <li><b>heartbeatOutgoing</b>: Heart-beat interval the client offers to send
 *       (first value of the CONNECT {@code heart-beat} header). Zero: never.</li>
 *   <li><b>heartbeatIncoming</b>: Heart-beat interval the client asks to receive
 *       (second value). Zero: no inbound supervision.</li>
 *   <li><b>heartbeatToleranceMultiplier</b>: The connection is considered lost
 *       after {@code negotiatedIncoming * multiplier} without inbound activity.</li>
 * </ul>
 */
public record StompTimingPolicy(
        Duration connectionTimeout,
        Duration heartbeatOutgoing,
        Duration heartbeatIncoming,
        int heartbeatToleranceMultiplier
) {
    public StompTimingPolicy {
        Objects.requireNonNull(connectionTimeout, "connectionTimeout");
        Objects.requireNonNull(heartbeatOutgoing, "heartbeatOutgoing");
        Objects.requireNonNull(heartbeatIncoming, "heartbeatIncoming");

        if (connectionTimeout.isNegative()) {
            throw new IllegalArgumentException("connectionTimeout must be non-negative");
        }
        if (heartbeatOutgoing.isNegative()) {
            throw new IllegalArgumentException("heartbeatOutgoing must be non-negative");
        }
        if (heartbeatIncoming.isNegative()) {
            throw new IllegalArgumentException("heartbeatIncoming must be non-negative");
        }
        if (heartbeatOutgoing.toMillis() > HeartBeat.MAX_INTERVAL_MILLIS
                || heartbeatIncoming.toMillis() > HeartBeat.MAX_INTERVAL_MILLIS) {
            throw new IllegalArgumentException("heart-beat intervals must not exceed "
                    + HeartBeat.MAX_INTERVAL_MILLIS + "ms");
        }
        if (heartbeatToleranceMultiplier < 1) {
            throw new IllegalArgumentException("heartbeatToleranceMultiplier must be >= 1");
        }
    }

    /**
     * Defaults matching the mobile client this library serves:
     * 15s connection timeout, 10s heart-beats both ways, tolerance 2.
     */
    public static StompTimingPolicy defaults() {
        return new StompTimingPolicy(
                Duration.ofSeconds(15),
                Duration.ofSeconds(10),
                Duration.ofSeconds(10),
                2
        );
    }

    public StompTimingPolicy withConnectionTimeout(Duration connectionTimeout) {
        return new StompTimingPolicy(connectionTimeout, heartbeatOutgoing, heartbeatIncoming, heartbeatToleranceMultiplier);
    }

    public StompTimingPolicy withHeartbeats(Duration outgoing, Duration incoming) {
        return new StompTimingPolicy(connectionTimeout, outgoing, incoming, heartbeatToleranceMultiplier);
    }
}
