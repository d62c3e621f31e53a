package com.questrail.ledgerchat.protocol.stomp.config;

import com.questrail.ledgerchat.protocol.stomp.model.HeartBeat;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StompTimingPolicyTest
 * -----------------------------------------------------------------------------
 * Validates timing policy construction and factory methods.
 */
class StompTimingPolicyTest {

    @Test
    void defaultsFactoryReturnsExpectedValues() {
        StompTimingPolicy policy = StompTimingPolicy.defaults();

        assertEquals(Duration.ofSeconds(15), policy.connectionTimeout());
        assertEquals(Duration.ofSeconds(10), policy.heartbeatOutgoing());
        assertEquals(Duration.ofSeconds(10), policy.heartbeatIncoming());
        assertEquals(2, policy.heartbeatToleranceMultiplier());
    }

    @Test
    void canonicalConstructorAcceptsZeroDurations() {
        StompTimingPolicy policy = new StompTimingPolicy(Duration.ZERO, Duration.ZERO, Duration.ZERO, 1);

        assertEquals(Duration.ZERO, policy.connectionTimeout());
        assertEquals(Duration.ZERO, policy.heartbeatOutgoing());
        assertEquals(Duration.ZERO, policy.heartbeatIncoming());
    }

    @Test
    void canonicalConstructorRejectsNulls() {
        assertThrows(NullPointerException.class, () ->
                new StompTimingPolicy(null, Duration.ZERO, Duration.ZERO, 2));
        assertThrows(NullPointerException.class, () ->
                new StompTimingPolicy(Duration.ZERO, null, Duration.ZERO, 2));
        assertThrows(NullPointerException.class, () ->
                new StompTimingPolicy(Duration.ZERO, Duration.ZERO, null, 2));
    }

    @Test
    void canonicalConstructorRejectsNegativeDurations() {
        Duration negative = Duration.ofMillis(-1);

        assertThrows(IllegalArgumentException.class, () ->
                new StompTimingPolicy(negative, Duration.ZERO, Duration.ZERO, 2));
        assertThrows(IllegalArgumentException.class, () ->
                new StompTimingPolicy(Duration.ZERO, negative, Duration.ZERO, 2));
        assertThrows(IllegalArgumentException.class, () ->
                new StompTimingPolicy(Duration.ZERO, Duration.ZERO, negative, 2));
    }

    @Test
    void canonicalConstructorRejectsHeartbeatsAboveLimit() {
        Duration tooLong = Duration.ofMillis(HeartBeat.MAX_INTERVAL_MILLIS + 1);

        assertThrows(IllegalArgumentException.class, () ->
                new StompTimingPolicy(Duration.ZERO, tooLong, Duration.ZERO, 2));
        assertThrows(IllegalArgumentException.class, () ->
                new StompTimingPolicy(Duration.ZERO, Duration.ZERO, tooLong, 2));
    }

    @Test
    void canonicalConstructorRejectsToleranceBelowOne() {
        assertThrows(IllegalArgumentException.class, () ->
                new StompTimingPolicy(Duration.ZERO, Duration.ZERO, Duration.ZERO, 0));
    }

    @Test
    void withersReplaceOnlyTheirFields() {
        StompTimingPolicy policy = StompTimingPolicy.defaults()
                .withConnectionTimeout(Duration.ofSeconds(5))
                .withHeartbeats(Duration.ZERO, Duration.ofSeconds(4));

        assertEquals(Duration.ofSeconds(5), policy.connectionTimeout());
        assertEquals(Duration.ZERO, policy.heartbeatOutgoing());
        assertEquals(Duration.ofSeconds(4), policy.heartbeatIncoming());
        assertEquals(2, policy.heartbeatToleranceMultiplier());
    }
}
