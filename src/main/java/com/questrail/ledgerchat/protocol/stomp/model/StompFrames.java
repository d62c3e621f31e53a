package com.questrail.ledgerchat.protocol.stomp.model;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Factory methods for the client frames this library emits.
 *
 * <p>Each method decides only <em>which</em> headers a frame carries; byte
 * layout is the encoder's job.</p>
 */
public final class StompFrames
{
    public static final String ACCEPTED_VERSIONS = "1.2,1.1,1.0";

    private StompFrames() {}

    /**
     * CONNECT frame opening a session.
     *
     * @param host        virtual host (usually the broker host name)
     * @param heartBeat   client heart-beat offer
     * @param extraHeaders additional connect headers (may be empty); they never
     *                    override the protocol headers set here
     */
    public static StompFrame connect(String host, HeartBeat heartBeat, Map<String, String> extraHeaders)
    {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(heartBeat, "heartBeat");
        Objects.requireNonNull(extraHeaders, "extraHeaders");

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(StompHeaders.ACCEPT_VERSION, ACCEPTED_VERSIONS);
        headers.put(StompHeaders.HOST, host);
        headers.put(StompHeaders.HEART_BEAT, heartBeat.toHeaderValue());
        extraHeaders.forEach(headers::putIfAbsent);
        return new StompFrame(StompCommand.CONNECT, headers);
    }

    public static StompFrame subscribe(String subscriptionId, String destination)
    {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(StompHeaders.ID, Objects.requireNonNull(subscriptionId, "subscriptionId"));
        headers.put(StompHeaders.DESTINATION, Objects.requireNonNull(destination, "destination"));
        headers.put(StompHeaders.ACK, "auto");
        return new StompFrame(StompCommand.SUBSCRIBE, headers);
    }

    public static StompFrame unsubscribe(String subscriptionId)
    {
        return new StompFrame(StompCommand.UNSUBSCRIBE,
                Map.of(StompHeaders.ID, Objects.requireNonNull(subscriptionId, "subscriptionId")));
    }

    /**
     * SEND frame carrying a UTF-8 body. {@code content-length} is always set so
     * the body survives any byte value.
     */
    public static StompFrame send(String destination, String contentType, String body)
    {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(body, "body");

        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(StompHeaders.DESTINATION, destination);
        if (contentType != null) {
            headers.put(StompHeaders.CONTENT_TYPE, contentType);
        }
        headers.put(StompHeaders.CONTENT_LENGTH, Integer.toString(bytes.length));
        return new StompFrame(StompCommand.SEND, headers, bytes);
    }

    public static StompFrame disconnect(String receiptId)
    {
        return new StompFrame(StompCommand.DISCONNECT,
                Map.of(StompHeaders.RECEIPT, Objects.requireNonNull(receiptId, "receiptId")));
    }
}
