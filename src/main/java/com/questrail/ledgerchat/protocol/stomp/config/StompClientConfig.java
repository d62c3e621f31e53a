package com.questrail.ledgerchat.protocol.stomp.config;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Aggregated configuration for one chat client.
 *
 * <p>{@code token} is opaque and may be {@code null}; it travels in the body
 * of each chat request and is never interpreted here.</p>
 */
public record StompClientConfig(
    URI brokerUrl,
    String userId,
    String token,
    Map<String, String> connectHeaders,
    StompTimingPolicy timingPolicy,
    ReconnectPolicy reconnectPolicy,
    String chatDestination,
    String broadcastDestination
) {
    public static final String DEFAULT_CHAT_DESTINATION = "/app/chat/stream";
    public static final String DEFAULT_BROADCAST_DESTINATION = "/app/chat.broadcast";
    public static final String USER_QUEUE_PREFIX = "/queue/messages/";

    static final String PREFIX = "ledgerchat.";
    static final String BROKER_URL = PREFIX + "broker-url";
    static final String USER_ID = PREFIX + "user-id";
    static final String TOKEN = PREFIX + "token";
    static final String CONNECTION_TIMEOUT_MS = PREFIX + "connection-timeout-ms";
    static final String HEARTBEAT_INCOMING_MS = PREFIX + "heartbeat-incoming-ms";
    static final String HEARTBEAT_OUTGOING_MS = PREFIX + "heartbeat-outgoing-ms";
    static final String RECONNECT_DELAY_MS = PREFIX + "reconnect-delay-ms";
    static final String CHAT_DESTINATION = PREFIX + "chat-destination";
    static final String BROADCAST_DESTINATION = PREFIX + "broadcast-destination";

    public StompClientConfig {
        Objects.requireNonNull(brokerUrl, "brokerUrl");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(connectHeaders, "connectHeaders");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
        Objects.requireNonNull(chatDestination, "chatDestination");
        Objects.requireNonNull(broadcastDestination, "broadcastDestination");

        if (userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        if (brokerUrl.getHost() == null) {
            throw new IllegalArgumentException("brokerUrl has no host: " + brokerUrl);
        }
        connectHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(connectHeaders));
    }

    /**
     * Destination the client subscribes to for its own streamed responses.
     */
    public String userQueue() {
        return USER_QUEUE_PREFIX + userId;
    }

    /**
     * Virtual host announced in the CONNECT frame.
     */
    public String virtualHost() {
        return brokerUrl.getHost();
    }

    /**
     * Reads a configuration from {@code ledgerchat.*} properties.
     *
     * <p>{@code broker-url} and {@code user-id} are required; every other key
     * falls back to its default. A {@code reconnect-delay-ms} of {@code 0}
     * disables automatic reconnects.</p>
     *
     * @throws IllegalArgumentException if a required key is missing or a value is malformed
     */
    public static StompClientConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");

        StompTimingPolicy defaults = StompTimingPolicy.defaults();
        StompTimingPolicy timing = new StompTimingPolicy(
                millis(props, CONNECTION_TIMEOUT_MS, defaults.connectionTimeout()),
                millis(props, HEARTBEAT_OUTGOING_MS, defaults.heartbeatOutgoing()),
                millis(props, HEARTBEAT_INCOMING_MS, defaults.heartbeatIncoming()),
                defaults.heartbeatToleranceMultiplier());

        return builder()
                .withBrokerUrl(URI.create(required(props, BROKER_URL)))
                .withUserId(required(props, USER_ID))
                .withToken(props.getProperty(TOKEN))
                .withTimingPolicy(timing)
                .withReconnectPolicy(ReconnectPolicy.fixed(
                        millis(props, RECONNECT_DELAY_MS, ReconnectPolicy.DEFAULT_DELAY)))
                .withChatDestination(props.getProperty(CHAT_DESTINATION, DEFAULT_CHAT_DESTINATION))
                .withBroadcastDestination(props.getProperty(BROADCAST_DESTINATION, DEFAULT_BROADCAST_DESTINATION))
                .build();
    }

    private static String required(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required property " + key);
        }
        return value.trim();
    }

    private static Duration millis(Properties props, String key, Duration fallback) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Duration.ofMillis(Long.parseLong(value.trim()));
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not a number: " + value, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private URI brokerUrl;
        private String userId;
        private String token;
        private final Map<String, String> connectHeaders = new LinkedHashMap<>();
        private StompTimingPolicy timingPolicy = StompTimingPolicy.defaults();
        private ReconnectPolicy reconnectPolicy = ReconnectPolicy.defaults();
        private String chatDestination = DEFAULT_CHAT_DESTINATION;
        private String broadcastDestination = DEFAULT_BROADCAST_DESTINATION;

        public Builder withBrokerUrl(URI brokerUrl) {
            this.brokerUrl = brokerUrl;
            return this;
        }

        public Builder withUserId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder withToken(String token) {
            this.token = token;
            return this;
        }

        public Builder withConnectHeader(String name, String value) {
            connectHeaders.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder withTimingPolicy(StompTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withReconnectPolicy(ReconnectPolicy reconnectPolicy) {
            this.reconnectPolicy = reconnectPolicy;
            return this;
        }

        public Builder withChatDestination(String chatDestination) {
            this.chatDestination = chatDestination;
            return this;
        }

        public Builder withBroadcastDestination(String broadcastDestination) {
            this.broadcastDestination = broadcastDestination;
            return this;
        }

        public StompClientConfig build() {
            return new StompClientConfig(brokerUrl, userId, token, connectHeaders,
                    timingPolicy, reconnectPolicy, chatDestination, broadcastDestination);
        }
    }
}
