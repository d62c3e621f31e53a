package com.questrail.ledgerchat.protocol.stomp.transport;

import com.questrail.ledgerchat.protocol.stomp.model.StompFrame;

import java.util.Objects;

/**
 * OutboundPayload
 * -----------------------------------------------------------------------------
 * Tagged variant describing what the caller is handing to the transport.
 *
 * <ul>
 *   <li>{@link Frame}: a protocol frame. Always encoded and sent as a binary
 *       message so the NUL terminator is preserved byte-for-byte.</li>
 *   <li>{@link Text}: raw text. Classified by prefix: text that starts with a
 *       client command token is a hand-built frame and is sent as binary;
 *       anything else (heart-beat EOLs) stays a text message.</li>
 *   <li>{@link Binary}: opaque bytes, passed through unmodified.</li>
 * </ul>
 */
public sealed interface OutboundPayload
        permits OutboundPayload.Frame, OutboundPayload.Text, OutboundPayload.Binary
{
    static OutboundPayload frame(StompFrame frame)
    {
        return new Frame(frame);
    }

    static OutboundPayload text(String text)
    {
        return new Text(text);
    }

    static OutboundPayload binary(byte[] bytes)
    {
        return new Binary(bytes);
    }

    /** Outbound heart-beat: a single LF. */
    static OutboundPayload heartBeat()
    {
        return new Text("\n");
    }

    record Frame(StompFrame frame) implements OutboundPayload
    {
        public Frame
        {
            Objects.requireNonNull(frame, "frame");
        }
    }

    record Text(String text) implements OutboundPayload
    {
        public Text
        {
            Objects.requireNonNull(text, "text");
        }
    }

    record Binary(byte[] bytes) implements OutboundPayload
    {
        public Binary
        {
            Objects.requireNonNull(bytes, "bytes");
        }
    }
}
