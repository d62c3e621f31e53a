package com.questrail.ledgerchat.protocol.stomp.internal.session;

import com.questrail.ledgerchat.api.ConnectionStatus;
import com.questrail.ledgerchat.protocol.stomp.model.StompFrame;

/**
 * The view of a live STOMP session that subscription and publishing code
 * needs: its current state and a way to send frames.
 */
public interface StompSession
{
    ConnectionStatus state();

    /**
     * Send a frame on the current session.
     *
     * @throws com.questrail.ledgerchat.protocol.stomp.StompNotConnectedException
     *         if the session is not {@link ConnectionStatus#CONNECTED}
     */
    void send(StompFrame frame);
}
