package com.questrail.ledgerchat.protocol.stomp.transport;

/**
 * MessageEndpoint
 * -----------------------------------------------------------------------------
 * Port for a message-oriented, bidirectional connection (a WebSocket client).
 *
 * <p>This endpoint is intentionally small. It carries whole messages, either
 * text or binary, and reports lifecycle changes. It knows nothing about STOMP.
 * Implementations may be backed by Netty or a test double.</p>
 *
 * <h2>Connection lifecycle</h2>
 * An endpoint holds at most one connection at a time. {@link #connect()} opens
 * a new one; {@link #close(int, String)} tears the current one down. After
 * {@code close} returns, the listener receives no further callbacks for that
 * connection: a locally requested close is never reported back as
 * {@link MessageEndpointListener#onClose(int, String)}.
 */
public interface MessageEndpoint
{
    /**
     * Register the listener. Must be called before {@link #connect()}.
     */
    void setListener(MessageEndpointListener listener);

    /**
     * Start opening a connection. Completion is reported asynchronously via
     * {@link MessageEndpointListener#onOpen()} or
     * {@link MessageEndpointListener#onError(Throwable)} followed by
     * {@link MessageEndpointListener#onClose(int, String)}.
     */
    void connect();

    /**
     * Close the current connection, if any.
     */
    void close(int code, String reason);

    /**
     * Returns {@code true} while a connection is open and able to send.
     */
    boolean isOpen();

    /**
     * Send a text message.
     *
     * @throws IllegalStateException if no connection is open
     */
    void sendText(String text);

    /**
     * Send a binary message.
     *
     * @throws IllegalStateException if no connection is open
     */
    void sendBinary(byte[] payload);

    /**
     * Release every resource held by the endpoint. The endpoint cannot be
     * reused afterwards.
     */
    void shutdown();
}
