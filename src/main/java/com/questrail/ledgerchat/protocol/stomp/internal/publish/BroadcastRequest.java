package com.questrail.ledgerchat.protocol.stomp.internal.publish;

/**
 * Body of a broadcast message.
 */
public record BroadcastRequest(String userId, String message) {
}
