package com.questrail.ledgerchat.api;

import java.util.Objects;
import java.util.Optional;

/**
 * ChatEvent
 * -----------------------------------------------------------------------------
 * One application-level event produced from a streamed AI response.
 *
 * <ul>
 *   <li>{@link Kind#TYPING}: the assistant started a response; content is empty.</li>
 *   <li>{@link Kind#MESSAGE}: a non-empty chunk of response text.</li>
 *   <li>{@link Kind#END}: the response is complete; content is empty.</li>
 *   <li>{@link Kind#ERROR}: the server reported a failure; content is the error text.</li>
 * </ul>
 *
 * @param timestamp server timestamp exactly as received; may be {@code null}
 * @param messageId id of the request this event answers, when the server echoes it
 */
public record ChatEvent(Kind kind, String content, String timestamp, String messageId)
{
    public enum Kind
    {
        TYPING,
        MESSAGE,
        END,
        ERROR
    }

    public ChatEvent
    {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(content, "content");
    }

    public Optional<String> correlationId()
    {
        return Optional.ofNullable(messageId);
    }
}
