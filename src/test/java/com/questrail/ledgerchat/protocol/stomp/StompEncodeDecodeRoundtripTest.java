package com.questrail.ledgerchat.protocol.stomp;

import com.questrail.ledgerchat.protocol.stomp.codec.impl.DefaultStompFrameDecoder;
import com.questrail.ledgerchat.protocol.stomp.codec.impl.DefaultStompFrameEncoder;
import com.questrail.ledgerchat.protocol.stomp.model.HeartBeat;
import com.questrail.ledgerchat.protocol.stomp.model.StompCommand;
import com.questrail.ledgerchat.protocol.stomp.model.StompFrame;
import com.questrail.ledgerchat.protocol.stomp.model.StompFrames;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Frame round-trip tests.
 *
 * These tests prove:
 *   StompFrame -> bytes -> StompFrame
 * yields an equal frame for every frame the encoder accepts.
 */
final class StompEncodeDecodeRoundtripTest
{
    private final DefaultStompFrameEncoder encoder = new DefaultStompFrameEncoder();
    private final DefaultStompFrameDecoder decoder = new DefaultStompFrameDecoder();

    private StompFrame roundTrip(StompFrame frame)
    {
        return decoder.decode(encoder.encode(frame));
    }

    @Test
    void everyCommandWithHeadersAndEmptyBody()
    {
        for (StompCommand command : StompCommand.values()) {
            Map<String, String> headers = new LinkedHashMap<>();
            headers.put("id", "x-1");
            headers.put("receipt", "r:1");
            StompFrame frame = new StompFrame(command, headers);

            StompFrame decoded = roundTrip(frame);

            assertEquals(frame, decoded, command.name());
            assertFalse(decoded.hasBody(), command.name());
        }
    }

    @Test
    void everyCommandWithoutHeaders()
    {
        for (StompCommand command : StompCommand.values()) {
            StompFrame frame = new StompFrame(command, Map.of());

            assertEquals(frame, roundTrip(frame), command.name());
        }
    }

    @Test
    void escapedHeaderNamesAndValues()
    {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("destination", "/queue/a");
        headers.put("odd:name", "colon:value");
        headers.put("multi\nline", "first\nsecond\r\nthird");
        headers.put("back\\slash", "C:\\temp\\");
        headers.put("empty", "");
        StompFrame frame = new StompFrame(StompCommand.MESSAGE, headers);

        StompFrame decoded = roundTrip(frame);

        assertEquals(frame, decoded);
        assertEquals("C:\\temp\\", decoded.header("back\\slash").orElseThrow());
        assertEquals("", decoded.header("empty").orElseThrow());
    }

    @Test
    void stompCommandEscapesLikeRegularFrames()
    {
        StompFrame frame = new StompFrame(StompCommand.STOMP, Map.of("login", "a:b\nc"));

        String text = new String(encoder.encode(frame), StandardCharsets.UTF_8);

        assertTrue(text.contains("login:a\\cb\\nc\n"), text);
        assertEquals(frame, decoder.decode(encoder.encode(frame)));
    }

    @Test
    void connectHeadersTravelRaw()
    {
        StompFrame connect = StompFrames.connect("broker.example", new HeartBeat(10000, 10000),
                Map.of("passcode", "p:a\\ss", "login", "user"));

        assertEquals(connect, roundTrip(connect));
    }

    @Test
    void connectedHeadersTravelRaw()
    {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("version", "1.2");
        headers.put("session", "s:1\\2");
        headers.put("heart-beat", "0,0");
        headers.put("server", "broker/1.0 (x:y)");
        StompFrame connected = new StompFrame(StompCommand.CONNECTED, headers);

        assertEquals(connected, roundTrip(connected));
    }

    @Test
    void contentLengthBodyWithEmbeddedNul()
    {
        byte[] body = { 'a', 0, 'b', 0, 0, '\n' };
        StompFrame frame = new StompFrame(StompCommand.MESSAGE,
                Map.of("destination", "/topic/t", "content-length", "6"), body);

        StompFrame decoded = roundTrip(frame);

        assertEquals(frame, decoded);
        assertArrayEquals(body, decoded.body());
    }

    @Test
    void bodyWithoutContentLength()
    {
        StompFrame frame = new StompFrame(StompCommand.ERROR,
                Map.of("message", "bad"), "details\nmore".getBytes(StandardCharsets.UTF_8));

        assertEquals(frame, roundTrip(frame));
    }

    @Test
    void emptyBodyWithZeroContentLength()
    {
        StompFrame frame = new StompFrame(StompCommand.RECEIPT,
                Map.of("receipt-id", "disconnect-1", "content-length", "0"));

        StompFrame decoded = roundTrip(frame);

        assertEquals(frame, decoded);
        assertEquals(0, decoded.body().length);
    }

    @Test
    void factoryFrames()
    {
        assertEquals(StompFrames.subscribe("sub-0", "/queue/messages/42"),
                roundTrip(StompFrames.subscribe("sub-0", "/queue/messages/42")));
        assertEquals(StompFrames.unsubscribe("sub-0"), roundTrip(StompFrames.unsubscribe("sub-0")));
        assertEquals(StompFrames.disconnect("disconnect-1"), roundTrip(StompFrames.disconnect("disconnect-1")));

        StompFrame send = StompFrames.send("/app/chat/stream", "application/json", "{\"text\":\"héllo\"}");
        assertEquals(send, roundTrip(send));
    }
}
