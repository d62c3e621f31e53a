package com.questrail.ledgerchat.protocol.stomp.internal.publish;

import com.questrail.ledgerchat.protocol.stomp.internal.time.WallClock;

import java.util.Objects;
import java.util.Random;

/**
 * Generates request ids of the form {@code msg_<epochMillis>_<9 base-36 chars>}.
 */
public final class MessageIdGenerator
{
    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    static final int SUFFIX_LENGTH = 9;

    private final WallClock clock;
    private final Random random;

    public MessageIdGenerator(WallClock clock, Random random)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
    }

    public String next()
    {
        StringBuilder sb = new StringBuilder("msg_")
                .append(clock.now().toEpochMilli())
                .append('_');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
