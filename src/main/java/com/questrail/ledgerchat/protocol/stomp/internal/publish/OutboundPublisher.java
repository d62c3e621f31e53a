package com.questrail.ledgerchat.protocol.stomp.internal.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.ledgerchat.api.ConnectionStatus;
import com.questrail.ledgerchat.protocol.stomp.StompNotConnectedException;
import com.questrail.ledgerchat.protocol.stomp.internal.session.StompSession;
import com.questrail.ledgerchat.protocol.stomp.model.StompFrames;

import java.util.Objects;

/**
 * OutboundPublisher
 * -----------------------------------------------------------------------------
 * Builds chat and broadcast requests and sends them as JSON SEND frames.
 *
 * <p>Nothing is queued: when the session is not connected the call fails with
 * {@link StompNotConnectedException} before a frame is built.</p>
 */
public final class OutboundPublisher
{
    static final String CONTENT_TYPE = "application/json";

    private final StompSession session;
    private final ObjectMapper mapper;
    private final MessageIdGenerator ids;
    private final String userId;
    private final String token;
    private final String chatDestination;
    private final String broadcastDestination;

    public OutboundPublisher(StompSession session,
                             ObjectMapper mapper,
                             MessageIdGenerator ids,
                             String userId,
                             String token,
                             String chatDestination,
                             String broadcastDestination)
    {
        this.session = Objects.requireNonNull(session, "session");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.ids = Objects.requireNonNull(ids, "ids");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.token = token;
        this.chatDestination = Objects.requireNonNull(chatDestination, "chatDestination");
        this.broadcastDestination = Objects.requireNonNull(broadcastDestination, "broadcastDestination");
    }

    /**
     * @return the {@code messageId} carried by the request
     */
    public String sendChatMessage(String text)
    {
        Objects.requireNonNull(text, "text");
        requireConnected();

        String messageId = ids.next();
        ChatRequest request = new ChatRequest(userId, text, messageId, token);
        session.send(StompFrames.send(chatDestination, CONTENT_TYPE, toJson(request)));
        return messageId;
    }

    public void broadcastMessage(String text)
    {
        Objects.requireNonNull(text, "text");
        requireConnected();

        BroadcastRequest request = new BroadcastRequest(userId, text);
        session.send(StompFrames.send(broadcastDestination, CONTENT_TYPE, toJson(request)));
    }

    private void requireConnected()
    {
        ConnectionStatus state = session.state();
        if (state != ConnectionStatus.CONNECTED) {
            throw new StompNotConnectedException("Cannot send chat message while " + state);
        }
    }

    private String toJson(Object request)
    {
        try {
            return mapper.writeValueAsString(request);
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + request.getClass().getSimpleName(), e);
        }
    }
}
