package com.questrail.ledgerchat.protocol.stomp.transport;

/**
 * MessageEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link MessageEndpoint}.
 *
 * <p>Callbacks for one connection are delivered in order. Implementations
 * document the thread they deliver on; the runtime re-serializes them onto the
 * session thread.</p>
 */
public interface MessageEndpointListener
{
    /**
     * The connection is open and can carry messages.
     */
    void onOpen();

    /**
     * The connection was closed by the peer or lost.
     *
     * @param code   WebSocket close code ({@code 1006} when no close frame was received)
     * @param reason close reason; may be empty
     */
    void onClose(int code, String reason);

    /**
     * A transport-level failure occurred. Diagnostic only: it is always
     * followed by {@link #onClose(int, String)} for the same connection.
     */
    void onError(Throwable cause);

    /**
     * A complete text message arrived.
     */
    void onText(String text);

    /**
     * A complete binary message arrived. The array is owned by the listener.
     */
    void onBinary(byte[] payload);
}
