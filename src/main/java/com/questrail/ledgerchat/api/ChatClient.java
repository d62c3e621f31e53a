package com.questrail.ledgerchat.api;

import java.util.function.Consumer;

/**
 * ChatClient
 * =============================================================================
 * Application-facing contract of the realtime chat channel.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   connect()     → CONNECTING → CONNECTED (and back, on every reconnect)
 *   disconnect()  → DISCONNECTED; no further reconnects
 * </pre>
 *
 * <h2>Threading</h2>
 * Every method may be called from any thread. Listeners are invoked on the
 * client's session thread, one at a time and in registration order; a
 * listener that throws is logged and does not affect the others.
 */
public interface ChatClient
{
    /**
     * Start connecting. Failures are reported through connection listeners
     * and retried according to the reconnect policy; nothing is thrown.
     * Calling {@code connect()} while already active has no effect.
     */
    void connect();

    /**
     * Close the session and stop reconnecting.
     */
    void disconnect();

    /**
     * Send a chat message to the assistant.
     *
     * @return the generated {@code messageId} of the request
     * @throws com.questrail.ledgerchat.protocol.stomp.StompNotConnectedException
     *         if the client is not connected; nothing is sent
     */
    String sendMessage(String text);

    /**
     * Broadcast a message to every connected user.
     *
     * @throws com.questrail.ledgerchat.protocol.stomp.StompNotConnectedException
     *         if the client is not connected; nothing is sent
     */
    void broadcastMessage(String text);

    ListenerRegistration onMessage(Consumer<ChatEvent> listener);

    ListenerRegistration onConnectionChange(Consumer<ConnectionStatus> listener);

    boolean isConnected();

    /**
     * Current connection state; never {@link ConnectionStatus#PROTOCOL_ERROR}.
     */
    ConnectionStatus status();
}
