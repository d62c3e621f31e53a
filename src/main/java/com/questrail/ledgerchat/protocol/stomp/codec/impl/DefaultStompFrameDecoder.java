package com.questrail.ledgerchat.protocol.stomp.codec.impl;

import com.questrail.ledgerchat.protocol.stomp.codec.StompFrameDecoder;
import com.questrail.ledgerchat.protocol.stomp.codec.StompFramingException;
import com.questrail.ledgerchat.protocol.stomp.model.StompCommand;
import com.questrail.ledgerchat.protocol.stomp.model.StompFrame;
import com.questrail.ledgerchat.protocol.stomp.model.StompHeaders;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DefaultStompFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link StompFrameDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Skip leading EOLs (heart-beats that share the message)</li>
 *   <li>Read and validate the command line</li>
 *   <li>Read header lines up to the blank line, unescaping where required;
 *       the first occurrence of a repeated header wins</li>
 *   <li>Extract the body, by {@code content-length} when present, otherwise up
 *       to the first NUL</li>
 *   <li>Verify the NUL terminator and that only EOLs follow it</li>
 * </ol>
 */
public final class DefaultStompFrameDecoder implements StompFrameDecoder
{
    @Override
    public StompFrame decode(byte[] payload)
    {
        if (payload == null || payload.length == 0) {
            throw new StompFramingException("Empty STOMP payload");
        }

        final Cursor cursor = new Cursor(payload);
        cursor.skipEols();

        // 1) Command
        final String commandLine = cursor.readLine();
        final StompCommand command = StompCommand.fromToken(commandLine)
                .orElseThrow(() -> new StompFramingException("Unknown STOMP command: '" + commandLine + "'"));

        // 2) Headers
        final boolean unescape = command.escapesHeaders();
        final Map<String, String> headers = new LinkedHashMap<>();
        String line;
        while (!(line = cursor.readLine()).isEmpty()) {
            int colon = line.indexOf(StompFraming.HEADER_SEPARATOR);
            if (colon <= 0) {
                throw new StompFramingException("Malformed header line: '" + line + "'");
            }
            String name = line.substring(0, colon);
            String value = line.substring(colon + 1);
            if (unescape) {
                name = StompHeaderEscaping.unescape(name);
                value = StompHeaderEscaping.unescape(value);
            }
            headers.putIfAbsent(name, value);
        }

        // 3) Body
        final int bodyStart = cursor.position();
        final int terminator;
        final String contentLength = headers.get(StompHeaders.CONTENT_LENGTH);
        if (contentLength != null) {
            int length = parseContentLength(contentLength);
            // Compared before adding so a huge content-length cannot overflow.
            if (length > payload.length - bodyStart - 1) {
                throw new StompFramingException(
                        "content-length " + length + " exceeds the " + (payload.length - bodyStart) + " bytes after the headers");
            }
            terminator = bodyStart + length;
            if (payload[terminator] != StompFraming.NUL) {
                throw new StompFramingException(
                        "Body does not end with NUL at content-length " + length);
            }
        }
        else {
            terminator = StompFraming.indexOf(payload, StompFraming.NUL, bodyStart);
            if (terminator < 0) {
                throw new StompFramingException("Missing NUL terminator");
            }
        }

        // 4) Trailer
        if (!StompFraming.isEolOnly(payload, terminator + 1)) {
            throw new StompFramingException("Unexpected bytes after frame terminator");
        }

        byte[] body = Arrays.copyOfRange(payload, bodyStart, terminator);
        return new StompFrame(command, headers, body);
    }

    private static int parseContentLength(String value)
    {
        try {
            int length = Integer.parseInt(value.trim());
            if (length < 0) {
                throw new StompFramingException("Negative content-length: " + value);
            }
            return length;
        }
        catch (NumberFormatException e) {
            throw new StompFramingException("Invalid content-length: " + value, e);
        }
    }

    /**
     * Line reader over the header section. Lines end at LF; a CR immediately
     * before the LF is dropped.
     */
    private static final class Cursor
    {
        private final byte[] bytes;
        private int pos;

        private Cursor(byte[] bytes)
        {
            this.bytes = bytes;
        }

        int position()
        {
            return pos;
        }

        void skipEols()
        {
            while (pos < bytes.length && (bytes[pos] == StompFraming.LF || bytes[pos] == StompFraming.CR)) {
                pos++;
            }
        }

        String readLine()
        {
            int lf = StompFraming.indexOf(bytes, StompFraming.LF, pos);
            int nul = StompFraming.indexOf(bytes, StompFraming.NUL, pos);
            if (lf < 0) {
                throw new StompFramingException(nul < 0
                        ? "Missing NUL terminator"
                        : "Frame terminated inside header block");
            }
            if (nul >= 0 && nul < lf) {
                throw new StompFramingException("Frame terminated inside header block");
            }

            int end = (lf > pos && bytes[lf - 1] == StompFraming.CR) ? lf - 1 : lf;
            String line = new String(bytes, pos, end - pos, StandardCharsets.UTF_8);
            pos = lf + 1;
            return line;
        }
    }
}
