package com.questrail.ledgerchat.protocol.stomp.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * StompCommand
 * -----------------------------------------------------------------------------
 * The closed set of STOMP 1.2 frame commands understood by this client.
 *
 * <p>Commands are split by direction. Client commands are the ones a client
 * may put on the wire; they are also the prefixes used to recognise a raw
 * protocol frame in an outbound text payload (see
 * {@code StompTransportAdapter}). Server commands are only ever decoded.</p>
 */
public enum StompCommand
{
    CONNECT(Direction.CLIENT),
    STOMP(Direction.CLIENT),
    SEND(Direction.CLIENT),
    SUBSCRIBE(Direction.CLIENT),
    UNSUBSCRIBE(Direction.CLIENT),
    BEGIN(Direction.CLIENT),
    COMMIT(Direction.CLIENT),
    ABORT(Direction.CLIENT),
    ACK(Direction.CLIENT),
    NACK(Direction.CLIENT),
    DISCONNECT(Direction.CLIENT),

    CONNECTED(Direction.SERVER),
    MESSAGE(Direction.SERVER),
    RECEIPT(Direction.SERVER),
    ERROR(Direction.SERVER);

    public enum Direction { CLIENT, SERVER }

    private static final Map<String, StompCommand> BY_TOKEN = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(StompCommand::name, Function.identity()));

    // Prefixes recognised as raw protocol frames. STOMP is not listed; this
    // client never emits it.
    private static final StompCommand[] TEXT_SENSITIVE = {
            CONNECT, SEND, SUBSCRIBE, UNSUBSCRIBE, BEGIN, COMMIT, ABORT, ACK, NACK, DISCONNECT
    };

    private final Direction direction;

    StompCommand(Direction direction)
    {
        this.direction = direction;
    }

    public Direction direction()
    {
        return direction;
    }

    /**
     * Header values of CONNECT and CONNECTED frames are never escaped
     * (STOMP 1.2, "Value Encoding").
     */
    public boolean escapesHeaders()
    {
        return this != CONNECT && this != CONNECTED;
    }

    /**
     * Looks up a command by its exact wire token.
     */
    public static Optional<StompCommand> fromToken(String token)
    {
        return Optional.ofNullable(BY_TOKEN.get(token));
    }

    /**
     * Returns {@code true} if {@code text} begins with a client command token.
     *
     * <p>This is a prefix test, not a parse: {@code "SENDER"} matches
     * {@code SEND}. That is the behaviour the truncation workaround needs,
     * since any such text would carry a frame terminator the host would strip.</p>
     */
    public static boolean startsWithClientCommand(String text)
    {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (StompCommand command : TEXT_SENSITIVE) {
            if (text.startsWith(command.name())) {
                return true;
            }
        }
        return false;
    }
}
