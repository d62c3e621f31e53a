package com.questrail.ledgerchat.protocol.stomp.internal.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * JSON body of a MESSAGE frame on the user queue: one step of a streamed AI
 * response.
 *
 * <p>{@code type} is kept as a string so an unknown type can be reported
 * instead of failing deserialization. {@code timestamp} accepts either a
 * string or a number.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StreamingEnvelope(
        String type,
        String content,
        String error,
        String timestamp,
        String messageId
) {
    public static final String START = "START";
    public static final String CHUNK = "CHUNK";
    public static final String END = "END";
    public static final String ERROR = "ERROR";
}
