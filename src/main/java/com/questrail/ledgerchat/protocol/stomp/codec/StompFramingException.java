package com.questrail.ledgerchat.protocol.stomp.codec;

/**
 * Indicates that a transport message could not be decoded into a valid
 * {@code StompFrame}.
 *
 * This typically reflects:
 * <ul>
 *   <li>A missing NUL terminator</li>
 *   <li>An unknown command token</li>
 *   <li>A malformed header line or escape sequence</li>
 *   <li>A body that disagrees with its {@code content-length}</li>
 * </ul>
 */
public final class StompFramingException extends RuntimeException
{
    public StompFramingException(String message) {
        super(message);
    }

    public StompFramingException(String message, Throwable cause) {
        super(message, cause);
    }
}
