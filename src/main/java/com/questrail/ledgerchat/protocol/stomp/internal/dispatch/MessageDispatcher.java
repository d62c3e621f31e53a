package com.questrail.ledgerchat.protocol.stomp.internal.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.ledgerchat.api.ChatEvent;
import com.questrail.ledgerchat.protocol.stomp.model.StompFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * MessageDispatcher
 * -----------------------------------------------------------------------------
 * Turns streamed response envelopes into {@link ChatEvent}s.
 *
 * <pre>
 *   START → TYPING (empty content)
 *   CHUNK → MESSAGE, only when content is non-empty
 *   END   → END (empty content)
 *   ERROR → ERROR, content = error text or "Unknown error"
 * </pre>
 *
 * Malformed JSON and unknown types are logged and dropped; nothing is thrown
 * back into the session.
 */
public final class MessageDispatcher
{
    private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

    static final String UNKNOWN_ERROR = "Unknown error";

    private final ObjectMapper mapper;
    private final Consumer<ChatEvent> events;

    public MessageDispatcher(ObjectMapper mapper, Consumer<ChatEvent> events)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.events = Objects.requireNonNull(events, "events");
    }

    /**
     * Subscription handler entry point.
     */
    public void onMessage(StompFrame frame)
    {
        dispatch(frame.bodyAsText());
    }

    public void dispatch(String body)
    {
        Objects.requireNonNull(body, "body");

        final StreamingEnvelope envelope;
        try {
            envelope = mapper.readValue(body, StreamingEnvelope.class);
        }
        catch (JsonProcessingException e) {
            log.warn("Dropping malformed chat message: {}", e.getOriginalMessage());
            return;
        }
        if (envelope == null) {
            log.warn("Dropping empty chat message");
            return;
        }

        toEvent(envelope).ifPresent(events);
    }

    Optional<ChatEvent> toEvent(StreamingEnvelope envelope)
    {
        String type = envelope.type();
        if (type == null) {
            log.warn("Dropping chat message without type");
            return Optional.empty();
        }

        switch (type) {
            case StreamingEnvelope.START:
                return Optional.of(event(ChatEvent.Kind.TYPING, "", envelope));
            case StreamingEnvelope.CHUNK:
                if (envelope.content() == null || envelope.content().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(event(ChatEvent.Kind.MESSAGE, envelope.content(), envelope));
            case StreamingEnvelope.END:
                return Optional.of(event(ChatEvent.Kind.END, "", envelope));
            case StreamingEnvelope.ERROR:
                String error = envelope.error() == null || envelope.error().isEmpty()
                        ? UNKNOWN_ERROR : envelope.error();
                return Optional.of(event(ChatEvent.Kind.ERROR, error, envelope));
            default:
                log.warn("Dropping chat message with unknown type '{}'", type);
                return Optional.empty();
        }
    }

    private static ChatEvent event(ChatEvent.Kind kind, String content, StreamingEnvelope envelope)
    {
        return new ChatEvent(kind, content, envelope.timestamp(), envelope.messageId());
    }
}
