package com.questrail.ledgerchat.protocol.stomp.transport;

import com.questrail.ledgerchat.protocol.stomp.codec.StompFramingException;
import com.questrail.ledgerchat.protocol.stomp.model.StompFrame;

/**
 * Callbacks from {@link StompTransportAdapter} to the session layer.
 *
 * <p>Everything above the adapter sees decoded frames and lifecycle signals
 * only; raw messages never cross this boundary.</p>
 */
public interface StompTransportListener
{
    void onTransportUp();

    /**
     * @param cause last transport error seen on this connection; {@code null}
     *              for an orderly close
     */
    void onTransportDown(int code, String reason, Throwable cause);

    void onFrame(StompFrame frame);

    /** An EOL-only message arrived. */
    void onHeartBeat();

    /** A message arrived but was not a well-formed frame; it has been dropped. */
    void onUndecodable(StompFramingException error);
}
