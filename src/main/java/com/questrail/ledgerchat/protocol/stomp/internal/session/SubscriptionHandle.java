package com.questrail.ledgerchat.protocol.stomp.internal.session;

import java.util.Objects;
import java.util.Optional;

/**
 * A subscription intent: a destination that stays subscribed across
 * reconnects until it is explicitly removed.
 *
 * <p>The STOMP {@code id} changes with every session; it is empty while no
 * session is established.</p>
 */
public final class SubscriptionHandle
{
    private final String destination;
    private String subscriptionId;

    SubscriptionHandle(String destination)
    {
        this.destination = Objects.requireNonNull(destination, "destination");
    }

    public String destination()
    {
        return destination;
    }

    public Optional<String> subscriptionId()
    {
        return Optional.ofNullable(subscriptionId);
    }

    void assign(String subscriptionId)
    {
        this.subscriptionId = subscriptionId;
    }

    @Override
    public String toString()
    {
        return "SubscriptionHandle{" + destination + ", id=" + subscriptionId + "}";
    }
}
