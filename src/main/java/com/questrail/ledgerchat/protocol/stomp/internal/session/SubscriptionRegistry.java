package com.questrail.ledgerchat.protocol.stomp.internal.session;

import com.questrail.ledgerchat.api.ConnectionStatus;
import com.questrail.ledgerchat.protocol.stomp.model.StompCommand;
import com.questrail.ledgerchat.protocol.stomp.model.StompFrame;
import com.questrail.ledgerchat.protocol.stomp.model.StompFrames;
import com.questrail.ledgerchat.protocol.stomp.model.StompHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * SubscriptionRegistry
 * =============================================================================
 * Keeps the set of destinations this client wants to receive from and routes
 * inbound MESSAGE frames to their handlers.
 *
 * <h2>Reconnection</h2>
 * Subscriptions are intents. On every session establishment
 * ({@link #onConnected()}) each registered destination is subscribed again,
 * in registration order, under a fresh {@code sub-N} id. When the session is
 * lost ({@link #onConnectionLost()}) the ids are dropped but the intents stay.
 *
 * <h2>Threading</h2>
 * Not thread-safe; used from the session thread only.
 */
public final class SubscriptionRegistry
{
    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final StompSession session;

    // Registration order is resubscription order.
    private final Map<SubscriptionHandle, Consumer<StompFrame>> entries = new LinkedHashMap<>();
    private final Map<String, SubscriptionHandle> byId = new LinkedHashMap<>();

    private long nextId;

    public SubscriptionRegistry(StompSession session)
    {
        this.session = Objects.requireNonNull(session, "session");
    }

    /**
     * Register a destination. If a session is established the SUBSCRIBE frame
     * is sent immediately; otherwise it is sent on the next
     * {@link #onConnected()}.
     */
    public SubscriptionHandle subscribe(String destination, Consumer<StompFrame> handler)
    {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(handler, "handler");

        SubscriptionHandle handle = new SubscriptionHandle(destination);
        entries.put(handle, handler);
        if (session.state() == ConnectionStatus.CONNECTED) {
            issue(handle);
        }
        return handle;
    }

    /**
     * Remove a subscription. UNSUBSCRIBE is sent only when the subscription is
     * live on the current session. Unknown handles are ignored.
     */
    public void unsubscribe(SubscriptionHandle handle)
    {
        Objects.requireNonNull(handle, "handle");
        if (entries.remove(handle) == null) {
            return;
        }
        retire(handle);
    }

    /**
     * Remove every subscription, sending UNSUBSCRIBE for each live one.
     */
    public void unsubscribeAll()
    {
        List<SubscriptionHandle> handles = new ArrayList<>(entries.keySet());
        entries.clear();
        for (SubscriptionHandle handle : handles) {
            retire(handle);
        }
    }

    /**
     * A new session is established: subscribe every registered destination.
     */
    public void onConnected()
    {
        byId.clear();
        for (SubscriptionHandle handle : entries.keySet()) {
            handle.assign(null);
        }
        for (SubscriptionHandle handle : new ArrayList<>(entries.keySet())) {
            issue(handle);
        }
    }

    /**
     * The session is gone: ids are no longer meaningful.
     */
    public void onConnectionLost()
    {
        byId.clear();
        for (SubscriptionHandle handle : entries.keySet()) {
            handle.assign(null);
        }
    }

    /**
     * Forget everything without sending frames.
     */
    public void clear()
    {
        onConnectionLost();
        entries.clear();
    }

    /**
     * Route a MESSAGE frame by its {@code subscription} header.
     *
     * @return {@code true} if a handler received the frame
     */
    public boolean dispatch(StompFrame frame)
    {
        Objects.requireNonNull(frame, "frame");
        if (frame.command() != StompCommand.MESSAGE) {
            throw new IllegalArgumentException("Not a MESSAGE frame: " + frame.command());
        }

        String id = frame.header(StompHeaders.SUBSCRIPTION).orElse(null);
        SubscriptionHandle handle = id == null ? null : byId.get(id);
        Consumer<StompFrame> handler = handle == null ? null : entries.get(handle);
        if (handler == null) {
            log.debug("MESSAGE for unknown subscription {} dropped", id);
            return false;
        }
        handler.accept(frame);
        return true;
    }

    public List<SubscriptionHandle> subscriptions()
    {
        return List.copyOf(entries.keySet());
    }

    private void issue(SubscriptionHandle handle)
    {
        String id = "sub-" + nextId++;
        handle.assign(id);
        byId.put(id, handle);
        session.send(StompFrames.subscribe(id, handle.destination()));
        log.debug("Subscribed {} as {}", handle.destination(), id);
    }

    private void retire(SubscriptionHandle handle)
    {
        String id = handle.subscriptionId().orElse(null);
        handle.assign(null);
        if (id == null) {
            return;
        }
        byId.remove(id);
        if (session.state() == ConnectionStatus.CONNECTED) {
            session.send(StompFrames.unsubscribe(id));
        }
    }
}
