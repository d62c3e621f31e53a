package com.questrail.ledgerchat.protocol.stomp.codec;

import com.questrail.ledgerchat.protocol.stomp.model.StompFrame;

/**
 * StompFrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for STOMP framing.
 *
 * <p>This interface defines the inbound boundary between one complete
 * transport message (a WebSocket text or binary message) and a structured
 * {@link StompFrame}.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Validating frame-level structure, terminator included</li>
 *   <li>Rejecting unknown commands and malformed headers</li>
 *   <li>Constructing a {@link StompFrame} on success</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for interpreting frame
 * semantics, recognising heart-beats, or accumulating partial data across
 * calls.</p>
 */
public interface StompFrameDecoder
{
    /**
     * Decode a single frame from a complete transport message.
     *
     * @param payload raw bytes of one transport message
     * @return the decoded frame
     * @throws StompFramingException if the payload is not one well-formed frame
     */
    StompFrame decode(byte[] payload);
}
