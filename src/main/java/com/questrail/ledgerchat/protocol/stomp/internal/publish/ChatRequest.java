package com.questrail.ledgerchat.protocol.stomp.internal.publish;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of a chat request sent to the assistant. A {@code null} token is
 * omitted from the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(String userId, String message, String messageId, String token) {
}
