package com.questrail.ledgerchat.protocol.stomp.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class StompFrameTest
{
    @Test
    void equalityComparesBodyBytes()
    {
        StompFrame a = new StompFrame(StompCommand.SEND, Map.of("destination", "/x"), new byte[] { 1, 2 });
        StompFrame b = new StompFrame(StompCommand.SEND, Map.of("destination", "/x"), new byte[] { 1, 2 });
        StompFrame c = new StompFrame(StompCommand.SEND, Map.of("destination", "/x"), new byte[] { 1, 3 });

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    void bodyIsCopiedInAndOut()
    {
        byte[] body = { 'a' };
        StompFrame frame = new StompFrame(StompCommand.SEND, Map.of(), body);

        body[0] = 'z';
        frame.body()[0] = 'y';

        assertEquals("a", frame.bodyAsText());
    }

    @Test
    void headersKeepInsertionOrderAndAreReadOnly()
    {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("b", "1");
        headers.put("a", "2");
        StompFrame frame = new StompFrame(StompCommand.MESSAGE, headers);

        assertEquals("[b, a]", frame.headers().keySet().toString());
        assertThrows(UnsupportedOperationException.class, () -> frame.headers().put("c", "3"));
    }

    @Test
    void rejectsHeadersWithoutWireForm()
    {
        Map<String, String> nullValue = new LinkedHashMap<>();
        nullValue.put("destination", null);

        assertThrows(IllegalArgumentException.class, () -> new StompFrame(StompCommand.SEND, Map.of("", "v")));
        assertThrows(NullPointerException.class, () -> new StompFrame(StompCommand.SEND, nullValue));
    }

    @Test
    void connectFactoryNeverOverridesProtocolHeaders()
    {
        StompFrame connect = StompFrames.connect("host", HeartBeat.NONE, Map.of("host", "other", "login", "u"));

        assertEquals("host", connect.header("host").orElseThrow());
        assertEquals("u", connect.header("login").orElseThrow());
        assertEquals("1.2,1.1,1.0", connect.header("accept-version").orElseThrow());
        assertEquals("0,0", connect.header("heart-beat").orElseThrow());
    }
}
