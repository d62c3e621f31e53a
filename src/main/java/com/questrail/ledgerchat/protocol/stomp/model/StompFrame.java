package com.questrail.ledgerchat.protocol.stomp.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * StompFrame
 * -----------------------------------------------------------------------------
 * Structured representation of a single STOMP frame.
 *
 * <h2>Architectural role</h2>
 * A {@code StompFrame} is the boundary object between the wire codec and the
 * session layer. It represents a frame <em>after</em> line splitting, header
 * unescaping and terminator removal have already occurred (inbound), or
 * <em>before</em> they are applied (outbound).
 *
 * <p>{@code StompFrame} does not know how it is encoded. All byte-level
 * mechanics live in the codec layer
 * ({@code com.questrail.ledgerchat.protocol.stomp.codec}).</p>
 *
 * <h2>Headers</h2>
 * Headers are kept in insertion order and are unique per frame. Names are
 * non-empty and values non-null; an empty name has no wire form. When a
 * received frame repeats a header, the decoder keeps the first occurrence, as
 * STOMP 1.2 requires.
 *
 * <h2>Equality</h2>
 * Two frames are equal when command, header mappings and body bytes are equal.
 * Header order is not part of equality.
 */
public final class StompFrame
{
    private static final byte[] EMPTY = new byte[0];

    private final StompCommand command;
    private final Map<String, String> headers;
    private final byte[] body;

    public StompFrame(StompCommand command, Map<String, String> headers, byte[] body)
    {
        this.command = Objects.requireNonNull(command, "command");
        Objects.requireNonNull(headers, "headers");
        headers.forEach((name, value) -> {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Header name must not be empty");
            }
            Objects.requireNonNull(value, () -> "value of header " + name);
        });
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = (body == null || body.length == 0) ? EMPTY : body.clone();
    }

    public StompFrame(StompCommand command, Map<String, String> headers)
    {
        this(command, headers, EMPTY);
    }

    public StompCommand command()
    {
        return command;
    }

    /**
     * Ordered, unmodifiable header view.
     */
    public Map<String, String> headers()
    {
        return headers;
    }

    public Optional<String> header(String name)
    {
        return Optional.ofNullable(headers.get(name));
    }

    /**
     * Copy of the body bytes; never {@code null}.
     */
    public byte[] body()
    {
        return body.clone();
    }

    public boolean hasBody()
    {
        return body.length > 0;
    }

    /**
     * Body decoded as UTF-8, the only charset this client exchanges.
     */
    public String bodyAsText()
    {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StompFrame other)) {
            return false;
        }
        return command == other.command
                && headers.equals(other.headers)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode()
    {
        int result = Objects.hash(command, headers);
        return 31 * result + Arrays.hashCode(body);
    }

    @Override
    public String toString()
    {
        return "StompFrame{" + command + ", headers=" + headers + ", body=" + body.length + " bytes}";
    }
}
