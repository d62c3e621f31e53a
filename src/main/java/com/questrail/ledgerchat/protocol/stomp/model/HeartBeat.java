package com.questrail.ledgerchat.protocol.stomp.model;

import java.time.Duration;
import java.util.Objects;

/**
 * HeartBeat
 * -----------------------------------------------------------------------------
 * Value of a STOMP {@code heart-beat} header: {@code <outgoing>,<incoming>}
 * in milliseconds, from the point of view of the peer that sent it.
 *
 * <p>Zero means "cannot send" (first value) or "does not want to receive"
 * (second value). Values are limited to {@link #MAX_INTERVAL_MILLIS}.</p>
 */
public record HeartBeat(long outgoingMillis, long incomingMillis)
{
    public static final HeartBeat NONE = new HeartBeat(0, 0);

    /** Largest accepted interval, about 24.8 days. */
    public static final long MAX_INTERVAL_MILLIS = Integer.MAX_VALUE;

    public HeartBeat
    {
        if (outgoingMillis < 0 || incomingMillis < 0) {
            throw new IllegalArgumentException("heart-beat values must be non-negative");
        }
        if (outgoingMillis > MAX_INTERVAL_MILLIS || incomingMillis > MAX_INTERVAL_MILLIS) {
            throw new IllegalArgumentException(
                    "heart-beat values must not exceed " + MAX_INTERVAL_MILLIS + "ms");
        }
    }

    public static HeartBeat of(Duration outgoing, Duration incoming)
    {
        Objects.requireNonNull(outgoing, "outgoing");
        Objects.requireNonNull(incoming, "incoming");
        return new HeartBeat(outgoing.toMillis(), incoming.toMillis());
    }

    /**
     * Parses a header value such as {@code "10000,10000"}.
     *
     * @throws IllegalArgumentException if the value is not two non-negative
     *         integers no larger than {@link #MAX_INTERVAL_MILLIS}
     */
    public static HeartBeat parse(String headerValue)
    {
        Objects.requireNonNull(headerValue, "headerValue");
        String[] parts = headerValue.split(",", -1);
        if (parts.length != 2) {
            throw new IllegalArgumentException("Malformed heart-beat header: " + headerValue);
        }
        try {
            return new HeartBeat(Long.parseLong(parts[0].trim()), Long.parseLong(parts[1].trim()));
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed heart-beat header: " + headerValue, e);
        }
    }

    /**
     * Negotiates the effective intervals for a client that offered
     * {@code this} and a server that answered {@code server}.
     *
     * <p>STOMP 1.2: the client sends every {@code max(cx, sy)} unless either is
     * zero; it expects to receive every {@code max(sx, cy)} unless either is
     * zero.</p>
     *
     * @return the client's effective (outgoing, incoming) intervals
     */
    public HeartBeat negotiate(HeartBeat server)
    {
        Objects.requireNonNull(server, "server");
        long outgoing = (outgoingMillis == 0 || server.incomingMillis == 0)
                ? 0 : Math.max(outgoingMillis, server.incomingMillis);
        long incoming = (incomingMillis == 0 || server.outgoingMillis == 0)
                ? 0 : Math.max(incomingMillis, server.outgoingMillis);
        return new HeartBeat(outgoing, incoming);
    }

    public String toHeaderValue()
    {
        return outgoingMillis + "," + incomingMillis;
    }
}
