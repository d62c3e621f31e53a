package com.questrail.ledgerchat.protocol.stomp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.ledgerchat.api.ChatClient;
import com.questrail.ledgerchat.api.ChatEvent;
import com.questrail.ledgerchat.api.ConnectionStatus;
import com.questrail.ledgerchat.api.ListenerRegistration;
import com.questrail.ledgerchat.protocol.stomp.config.StompClientConfig;
import com.questrail.ledgerchat.protocol.stomp.internal.dispatch.MessageDispatcher;
import com.questrail.ledgerchat.protocol.stomp.internal.exec.ListenerList;
import com.questrail.ledgerchat.protocol.stomp.internal.exec.SessionExecutor;
import com.questrail.ledgerchat.protocol.stomp.internal.publish.MessageIdGenerator;
import com.questrail.ledgerchat.protocol.stomp.internal.publish.OutboundPublisher;
import com.questrail.ledgerchat.protocol.stomp.internal.session.StompConnectionManager;
import com.questrail.ledgerchat.protocol.stomp.internal.session.SubscriptionHandle;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * StompChatClient
 * =============================================================================
 * {@link ChatClient} over a STOMP session.
 *
 * <h2>Architectural Role</h2>
 * This is the <strong>application boundary</strong>. It:
 * <ul>
 *   <li>Hops every call onto the session thread</li>
 *   <li>Keeps the user queue {@code /queue/messages/{userId}} subscribed</li>
 *   <li>Fans out chat events and connection changes to registered listeners</li>
 * </ul>
 *
 * It does NOT:
 * <ul>
 *   <li>Interpret STOMP frames (see {@link StompConnectionManager})</li>
 *   <li>Own threads or sockets (see {@code StompChatRuntime})</li>
 * </ul>
 */
public final class StompChatClient implements ChatClient
{
    private final SessionExecutor executor;
    private final StompConnectionManager manager;
    private final StompClientConfig config;
    private final OutboundPublisher publisher;
    private final MessageDispatcher dispatcher;

    private final ListenerList<ChatEvent> messageListeners = new ListenerList<>("Chat message");
    private final ListenerList<ConnectionStatus> connectionListeners = new ListenerList<>("Connection change");

    // Session thread only.
    private SubscriptionHandle userQueue;

    public StompChatClient(SessionExecutor executor,
                           StompConnectionManager manager,
                           ObjectMapper mapper,
                           MessageIdGenerator ids,
                           StompClientConfig config)
    {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.manager = Objects.requireNonNull(manager, "manager");
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(ids, "ids");

        this.publisher = new OutboundPublisher(manager, mapper, ids,
                config.userId(), config.token(), config.chatDestination(), config.broadcastDestination());
        this.dispatcher = new MessageDispatcher(mapper, messageListeners::deliver);

        manager.addStateListener(connectionListeners::deliver);
    }

    @Override
    public void connect()
    {
        executor.call(() -> {
            if (userQueue == null) {
                userQueue = manager.subscriptions().subscribe(config.userQueue(), dispatcher::onMessage);
            }
            manager.connect();
            return null;
        });
    }

    @Override
    public void disconnect()
    {
        executor.call(() -> {
            manager.disconnect();
            userQueue = null;
            return null;
        });
    }

    @Override
    public String sendMessage(String text)
    {
        Objects.requireNonNull(text, "text");
        return executor.call(() -> publisher.sendChatMessage(text));
    }

    @Override
    public void broadcastMessage(String text)
    {
        Objects.requireNonNull(text, "text");
        executor.call(() -> {
            publisher.broadcastMessage(text);
            return null;
        });
    }

    @Override
    public ListenerRegistration onMessage(Consumer<ChatEvent> listener)
    {
        return messageListeners.add(listener);
    }

    @Override
    public ListenerRegistration onConnectionChange(Consumer<ConnectionStatus> listener)
    {
        return connectionListeners.add(listener);
    }

    @Override
    public boolean isConnected()
    {
        return manager.state() == ConnectionStatus.CONNECTED;
    }

    @Override
    public ConnectionStatus status()
    {
        return manager.state();
    }
}
