package com.questrail.ledgerchat.protocol.stomp;

/**
 * Thrown when an outbound send is attempted while the session (or the
 * underlying transport) is not available.
 *
 * <p>This client never queues outbound frames across disconnects; the caller
 * decides whether to retry once the connection is back.</p>
 */
public class StompNotConnectedException extends IllegalStateException
{
    public StompNotConnectedException(String message) {
        super(message);
    }
}
