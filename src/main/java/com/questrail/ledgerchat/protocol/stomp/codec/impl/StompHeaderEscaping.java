package com.questrail.ledgerchat.protocol.stomp.codec.impl;

import com.questrail.ledgerchat.protocol.stomp.codec.StompFramingException;

/**
 * StompHeaderEscaping
 * -----------------------------------------------------------------------------
 * Header name/value escaping as defined by STOMP 1.2 ("Value Encoding").
 *
 * <table>
 *   <caption>Escape sequences</caption>
 *   <tr><th>Octet</th><th>Encoded as</th></tr>
 *   <tr><td>CR</td><td>{@code \r}</td></tr>
 *   <tr><td>LF</td><td>{@code \n}</td></tr>
 *   <tr><td>{@code :}</td><td>{@code \c}</td></tr>
 *   <tr><td>{@code \}</td><td>{@code \\}</td></tr>
 * </table>
 *
 * <p>Any other backslash sequence is a fatal protocol error. CONNECT and
 * CONNECTED frames are exempt; callers decide whether to apply these rules.</p>
 */
final class StompHeaderEscaping
{
    private StompHeaderEscaping() {}

    static String escape(String raw)
    {
        // Fast path: nothing to escape.
        if (!needsEscape(raw)) {
            return raw;
        }

        StringBuilder out = new StringBuilder(raw.length() + 8);
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            switch (c) {
                case '\r' -> out.append("\\r");
                case '\n' -> out.append("\\n");
                case ':' -> out.append("\\c");
                case '\\' -> out.append("\\\\");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    static String unescape(String encoded)
    {
        if (encoded.indexOf('\\') < 0) {
            return encoded;
        }

        StringBuilder out = new StringBuilder(encoded.length());
        for (int i = 0; i < encoded.length(); i++) {
            char c = encoded.charAt(i);
            if (c != '\\') {
                out.append(c);
                continue;
            }
            if (i + 1 >= encoded.length()) {
                throw new StompFramingException("Dangling escape at end of header: " + encoded);
            }
            char next = encoded.charAt(++i);
            switch (next) {
                case 'r' -> out.append('\r');
                case 'n' -> out.append('\n');
                case 'c' -> out.append(':');
                case '\\' -> out.append('\\');
                default -> throw new StompFramingException("Undefined escape sequence \\" + next);
            }
        }
        return out.toString();
    }

    private static boolean needsEscape(String raw)
    {
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '\r' || c == '\n' || c == ':' || c == '\\') {
                return true;
            }
        }
        return false;
    }
}
