package com.questrail.ledgerchat.api;

/**
 * Connection status reported to {@link ChatClient} listeners.
 *
 * <p>{@link #PROTOCOL_ERROR} is a notification only: it is reported when the
 * broker sends an ERROR frame, and the client's actual state does not change.
 * {@link ChatClient#status()} never returns it.</p>
 */
public enum ConnectionStatus
{
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    ERROR,
    PROTOCOL_ERROR
}
