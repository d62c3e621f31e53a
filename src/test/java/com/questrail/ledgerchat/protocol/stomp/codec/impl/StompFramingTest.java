package com.questrail.ledgerchat.protocol.stomp.codec.impl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class StompFramingTest
{
    @Test
    void eolOnlyPayloadsAreHeartBeats()
    {
        assertTrue(StompFraming.isHeartBeat(new byte[] { '\n' }));
        assertTrue(StompFraming.isHeartBeat(new byte[] { '\r', '\n' }));
        assertTrue(StompFraming.isHeartBeat(new byte[] { '\n', '\n' }));
    }

    @Test
    void framesAndEmptyPayloadsAreNotHeartBeats()
    {
        assertFalse(StompFraming.isHeartBeat(new byte[0]));
        assertFalse(StompFraming.isHeartBeat(new byte[] { '\n', 'M' }));
        assertFalse(StompFraming.isHeartBeat(new byte[] { 0 }));
    }
}
