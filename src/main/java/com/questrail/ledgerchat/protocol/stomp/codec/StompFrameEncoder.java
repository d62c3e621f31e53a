package com.questrail.ledgerchat.protocol.stomp.codec;

import com.questrail.ledgerchat.protocol.stomp.model.StompFrame;

/**
 * StompFrameEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for STOMP framing.
 *
 * <p>This interface defines the outbound boundary between a structured
 * {@link StompFrame} and the bytes handed to the transport adapter. It applies
 * only the mechanical rules of:</p>
 * <ul>
 *   <li>Command and header line layout</li>
 *   <li>Header value escaping</li>
 *   <li>Terminator framing (exactly one NUL)</li>
 * </ul>
 *
 * <p>It does not decide which frame to send or which headers a frame carries;
 * that is done by {@code StompFrames} and the session layer.</p>
 */
public interface StompFrameEncoder
{
    /**
     * Encode a frame into a wire-ready payload, terminator included.
     *
     * @throws IllegalArgumentException if the frame cannot be represented on
     *         the wire (e.g. an embedded NUL without {@code content-length})
     */
    byte[] encode(StompFrame frame);
}
