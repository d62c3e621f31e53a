package com.questrail.ledgerchat.protocol.stomp.codec.impl;

import com.questrail.ledgerchat.protocol.stomp.codec.StompFrameEncoder;
import com.questrail.ledgerchat.protocol.stomp.model.StompFrame;
import com.questrail.ledgerchat.protocol.stomp.model.StompHeaders;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * DefaultStompFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link StompFrameEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultStompFrameDecoder}. Lines
 * are terminated with a bare LF. Headers are written exactly as given; this
 * encoder never adds {@code content-length} on its own, so that
 * {@code decode(encode(f))} yields {@code f}.</p>
 */
public final class DefaultStompFrameEncoder implements StompFrameEncoder
{
    @Override
    public byte[] encode(StompFrame frame)
    {
        Objects.requireNonNull(frame, "frame");

        final boolean escape = frame.command().escapesHeaders();
        final byte[] body = frame.body();

        // A NUL inside the body is only recoverable when content-length says
        // where the body ends.
        final String contentLength = frame.headers().get(StompHeaders.CONTENT_LENGTH);
        if (contentLength == null) {
            if (StompFraming.indexOf(body, StompFraming.NUL, 0) >= 0) {
                throw new IllegalArgumentException(
                        "Body of " + frame.command() + " contains NUL but has no content-length header");
            }
        }
        else if (!contentLength.trim().equals(Integer.toString(body.length))) {
            throw new IllegalArgumentException("content-length " + contentLength
                    + " does not match body of " + body.length + " bytes");
        }

        // ---------------------------------------------------------------------
        // 1) Command and header block
        // ---------------------------------------------------------------------

        StringBuilder head = new StringBuilder(64);
        head.append(frame.command().name()).append('\n');

        for (Map.Entry<String, String> header : frame.headers().entrySet()) {
            String name = header.getKey();
            String value = header.getValue();
            if (escape) {
                name = StompHeaderEscaping.escape(name);
                value = StompHeaderEscaping.escape(value);
            }
            else {
                requireRaw(frame, name, true);
                requireRaw(frame, value, false);
            }
            head.append(name).append(StompFraming.HEADER_SEPARATOR).append(value).append('\n');
        }
        head.append('\n');

        // ---------------------------------------------------------------------
        // 2) Body and terminator
        // ---------------------------------------------------------------------

        byte[] headBytes = head.toString().getBytes(StandardCharsets.UTF_8);
        byte[] out = new byte[headBytes.length + body.length + 1];
        System.arraycopy(headBytes, 0, out, 0, headBytes.length);
        System.arraycopy(body, 0, out, headBytes.length, body.length);
        out[out.length - 1] = StompFraming.NUL;
        return out;
    }

    // Unescaped frames (CONNECT/CONNECTED) cannot carry line breaks, and a colon
    // in a name would move the name/value split.
    private static void requireRaw(StompFrame frame, String text, boolean isName)
    {
        if (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0
                || (isName && text.indexOf(StompFraming.HEADER_SEPARATOR) >= 0)) {
            throw new IllegalArgumentException(
                    "Header '" + text + "' cannot be represented in an unescaped " + frame.command() + " frame");
        }
    }
}
