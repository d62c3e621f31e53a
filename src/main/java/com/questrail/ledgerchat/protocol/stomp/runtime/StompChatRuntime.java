package com.questrail.ledgerchat.protocol.stomp.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.ledgerchat.api.ChatClient;
import com.questrail.ledgerchat.protocol.stomp.StompChatClient;
import com.questrail.ledgerchat.protocol.stomp.codec.impl.DefaultStompFrameDecoder;
import com.questrail.ledgerchat.protocol.stomp.codec.impl.DefaultStompFrameEncoder;
import com.questrail.ledgerchat.protocol.stomp.config.StompClientConfig;
import com.questrail.ledgerchat.protocol.stomp.internal.exec.SingleThreadSessionExecutor;
import com.questrail.ledgerchat.protocol.stomp.internal.publish.MessageIdGenerator;
import com.questrail.ledgerchat.protocol.stomp.internal.session.StompConnectionManager;
import com.questrail.ledgerchat.protocol.stomp.internal.time.MonotonicClock;
import com.questrail.ledgerchat.protocol.stomp.internal.time.MonotonicScheduler;
import com.questrail.ledgerchat.protocol.stomp.internal.time.ScheduledExecutorScheduler;
import com.questrail.ledgerchat.protocol.stomp.internal.time.SystemMonotonicClock;
import com.questrail.ledgerchat.protocol.stomp.internal.time.SystemWallClock;
import com.questrail.ledgerchat.protocol.stomp.observability.Slf4jStompObservabilitySink;
import com.questrail.ledgerchat.protocol.stomp.observability.StompObservabilitySink;
import com.questrail.ledgerchat.protocol.stomp.transport.MessageEndpoint;
import com.questrail.ledgerchat.protocol.stomp.transport.StompTransportAdapter;
import com.questrail.ledgerchat.protocol.stomp.transport.ws.netty.NettyWebSocketEndpoint;

import java.security.SecureRandom;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * StompChatRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one chat client.
 *
 * <pre>
 *   StompChatRuntime runtime = StompChatRuntime.builder()
 *           .withConfig(StompClientConfig.fromProperties(props))
 *           .build();
 *   runtime.client().connect();
 *   ...
 *   runtime.close();
 * </pre>
 *
 * <p>The runtime owns the session thread and the WebSocket endpoint;
 * {@link #close()} disconnects and releases both.</p>
 */
public final class StompChatRuntime implements AutoCloseable {
    private final StompChatClient client;
    private final MessageEndpoint endpoint;
    private final SingleThreadSessionExecutor sessionExecutor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private StompChatRuntime(StompChatClient client,
                             MessageEndpoint endpoint,
                             SingleThreadSessionExecutor sessionExecutor) {
        this.client = client;
        this.endpoint = endpoint;
        this.sessionExecutor = sessionExecutor;
    }

    public ChatClient client() {
        return client;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            client.disconnect();
        } finally {
            endpoint.shutdown();
            sessionExecutor.shutdown();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private StompClientConfig config;
        private StompObservabilitySink observabilitySink = new Slf4jStompObservabilitySink();
        private ObjectMapper objectMapper = new ObjectMapper();
        private Function<StompClientConfig, MessageEndpoint> endpointFactory =
                cfg -> new NettyWebSocketEndpoint(cfg.brokerUrl());
        private String threadName = "ledgerchat-session";

        public Builder withConfig(StompClientConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(StompObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withObjectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Replace the WebSocket client, e.g. with a test double.
         */
        public Builder withEndpointFactory(Function<StompClientConfig, MessageEndpoint> factory) {
            this.endpointFactory = factory;
            return this;
        }

        public Builder withThreadName(String threadName) {
            this.threadName = threadName;
            return this;
        }

        public StompChatRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(objectMapper, "objectMapper");
            Objects.requireNonNull(endpointFactory, "endpointFactory");

            // 1. Session thread, clock and a scheduler whose tasks run on it
            SingleThreadSessionExecutor sessionExecutor = new SingleThreadSessionExecutor(threadName);
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            MonotonicScheduler timers = new ScheduledExecutorScheduler(sessionExecutor.scheduledExecutor(), clock);
            MonotonicScheduler scheduler = (deadline, task) ->
                    timers.scheduleAtNanos(deadline, () -> sessionExecutor.execute(task));

            // 2. Transport: endpoint → adapter, callbacks hop onto the session thread
            MessageEndpoint endpoint = Objects.requireNonNull(endpointFactory.apply(config), "endpoint");
            StompTransportAdapter adapter = new StompTransportAdapter(
                    endpoint, new DefaultStompFrameEncoder(), new DefaultStompFrameDecoder());
            endpoint.setListener(new SessionBoundEndpointListener(sessionExecutor, adapter));

            // 3. Session
            StompConnectionManager manager = new StompConnectionManager(
                    adapter,
                    config.virtualHost(),
                    config.connectHeaders(),
                    config.timingPolicy(),
                    config.reconnectPolicy(),
                    clock,
                    scheduler,
                    SystemWallClock.INSTANCE,
                    observabilitySink);

            // 4. Facade
            StompChatClient client = new StompChatClient(
                    sessionExecutor,
                    manager,
                    objectMapper,
                    new MessageIdGenerator(SystemWallClock.INSTANCE, new SecureRandom()),
                    config);

            return new StompChatRuntime(client, endpoint, sessionExecutor);
        }
    }
}
