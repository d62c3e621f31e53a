package com.questrail.ledgerchat.protocol.stomp.codec.impl;

/**
 * StompFraming
 * -----------------------------------------------------------------------------
 * Byte constants and small scanning helpers for STOMP 1.2 framing.
 *
 * <p>A STOMP frame is laid out as:</p>
 * <pre>
 *   COMMAND EOL
 *   (header-name ":" header-value EOL)*
 *   EOL
 *   body NUL
 * </pre>
 *
 * <p>EOL is LF, optionally preceded by CR. NUL ({@code 0x00}) is the frame
 * terminator. Any number of EOLs may follow the terminator; a message made
 * only of EOLs is a heart-beat.</p>
 */
public final class StompFraming
{
    /** Frame terminator. */
    static final byte NUL = 0x00;

    static final byte LF = 0x0A;

    static final byte CR = 0x0D;

    static final char HEADER_SEPARATOR = ':';

    private StompFraming() {}

    /**
     * Returns {@code true} if the payload is a heart-beat: non-empty and made
     * only of EOL bytes.
     */
    public static boolean isHeartBeat(byte[] payload)
    {
        if (payload == null || payload.length == 0) {
            return false;
        }
        return isEolOnly(payload, 0);
    }

    static boolean isEolOnly(byte[] payload, int fromInclusive)
    {
        for (int i = fromInclusive; i < payload.length; i++) {
            if (payload[i] != LF && payload[i] != CR) {
                return false;
            }
        }
        return true;
    }

    static int indexOf(byte[] payload, byte value, int fromInclusive)
    {
        for (int i = fromInclusive; i < payload.length; i++) {
            if (payload[i] == value) {
                return i;
            }
        }
        return -1;
    }
}
