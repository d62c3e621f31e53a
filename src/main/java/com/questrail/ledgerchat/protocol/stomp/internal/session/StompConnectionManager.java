package com.questrail.ledgerchat.protocol.stomp.internal.session;

import com.questrail.ledgerchat.api.ConnectionStatus;
import com.questrail.ledgerchat.api.ListenerRegistration;
import com.questrail.ledgerchat.protocol.stomp.StompNotConnectedException;
import com.questrail.ledgerchat.protocol.stomp.codec.StompFramingException;
import com.questrail.ledgerchat.protocol.stomp.config.ReconnectPolicy;
import com.questrail.ledgerchat.protocol.stomp.config.StompTimingPolicy;
import com.questrail.ledgerchat.protocol.stomp.internal.exec.ListenerList;
import com.questrail.ledgerchat.protocol.stomp.internal.time.Cancellable;
import com.questrail.ledgerchat.protocol.stomp.internal.time.MonotonicClock;
import com.questrail.ledgerchat.protocol.stomp.internal.time.MonotonicScheduler;
import com.questrail.ledgerchat.protocol.stomp.internal.time.WallClock;
import com.questrail.ledgerchat.protocol.stomp.model.HeartBeat;
import com.questrail.ledgerchat.protocol.stomp.model.StompFrame;
import com.questrail.ledgerchat.protocol.stomp.model.StompFrames;
import com.questrail.ledgerchat.protocol.stomp.model.StompHeaders;
import com.questrail.ledgerchat.protocol.stomp.observability.NullObservabilitySink;
import com.questrail.ledgerchat.protocol.stomp.observability.StompErrorEvent;
import com.questrail.ledgerchat.protocol.stomp.observability.StompObservabilitySink;
import com.questrail.ledgerchat.protocol.stomp.observability.StompProtocolObservabilityEvent;
import com.questrail.ledgerchat.protocol.stomp.observability.StompStateTransitionEvent;
import com.questrail.ledgerchat.protocol.stomp.observability.StompTransportObservabilityEvent;
import com.questrail.ledgerchat.protocol.stomp.transport.OutboundPayload;
import com.questrail.ledgerchat.protocol.stomp.transport.StompTransportAdapter;
import com.questrail.ledgerchat.protocol.stomp.transport.StompTransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * StompConnectionManager
 * =============================================================================
 * Owns the STOMP session lifecycle over one {@link StompTransportAdapter}:
 * handshake, heart-beats, loss detection and automatic reconnection.
 *
 * <h2>State machine</h2>
 * <pre>
 *   DISCONNECTED --connect()--------------------------------> CONNECTING
 *   CONNECTING   --transport up + CONNECTED frame-----------> CONNECTED
 *   CONNECTING   --transport failure / bad CONNECTED / timeout--> ERROR
 *   CONNECTED    --remote close / heart-beat loss-----------> DISCONNECTED
 *   ERROR, DISCONNECTED --reconnect timer-------------------> CONNECTING
 *   any          --disconnect()-----------------------------> DISCONNECTED
 * </pre>
 *
 * <p>A broker ERROR frame is reported to state listeners as
 * {@link ConnectionStatus#PROTOCOL_ERROR} but changes nothing: the broker
 * normally closes the socket afterwards, and that close drives the
 * transition.</p>
 *
 * <h2>Timers</h2>
 * Every timer captures the connection generation it was armed for; a timer
 * that fires after the generation moved on does nothing.
 * <ul>
 *   <li>handshake timeout, armed by {@code connect()} and each reconnect attempt</li>
 *   <li>outgoing heart-beat, re-armed after each send</li>
 *   <li>inbound supervision, checking {@code incoming * tolerance}</li>
 *   <li>reconnect delay, from {@link ReconnectPolicy}</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Not thread-safe. All calls, transport callbacks and timer callbacks must be
 * made on the session thread. {@link #state()} may be read from any thread.
 */
public final class StompConnectionManager implements StompTransportListener, StompSession
{
    private static final Logger log = LoggerFactory.getLogger(StompConnectionManager.class);

    static final Set<String> SUPPORTED_VERSIONS = Set.of("1.0", "1.1", "1.2");

    static final int CLOSE_NORMAL = 1000;
    static final int CLOSE_HEARTBEAT_TIMEOUT = 4000;
    static final int CLOSE_HANDSHAKE_FAILED = 4001;

    private final StompTransportAdapter transport;
    private final String virtualHost;
    private final Map<String, String> connectHeaders;
    private final StompTimingPolicy timingPolicy;
    private final ReconnectPolicy reconnectPolicy;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final StompObservabilitySink observabilitySink;

    private final SubscriptionRegistry subscriptions;
    private final ListenerList<ConnectionStatus> stateListeners = new ListenerList<>("Connection state");

    private volatile ConnectionStatus state = ConnectionStatus.DISCONNECTED;

    private boolean active;
    private long generation;
    private int reconnectAttempts;
    private long receiptCounter;

    private HeartBeat negotiated = HeartBeat.NONE;
    private long lastInboundNanos;
    private String sessionId;

    private Cancellable handshakeTimer;
    private Cancellable outgoingHeartBeatTimer;
    private Cancellable inboundCheckTimer;
    private Cancellable reconnectTimer;

    public StompConnectionManager(StompTransportAdapter transport,
                                  String virtualHost,
                                  Map<String, String> connectHeaders,
                                  StompTimingPolicy timingPolicy,
                                  ReconnectPolicy reconnectPolicy,
                                  MonotonicClock clock,
                                  MonotonicScheduler scheduler,
                                  WallClock wallClock,
                                  StompObservabilitySink observabilitySink)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.virtualHost = Objects.requireNonNull(virtualHost, "virtualHost");
        this.connectHeaders = Map.copyOf(Objects.requireNonNull(connectHeaders, "connectHeaders"));
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.subscriptions = new SubscriptionRegistry(this);
        transport.setListener(this);
    }

    // -------------------------------------------------------------------------
    // Public surface
    // -------------------------------------------------------------------------

    @Override
    public ConnectionStatus state()
    {
        return state;
    }

    public SubscriptionRegistry subscriptions()
    {
        return subscriptions;
    }

    /**
     * Effective heart-beat intervals of the current session;
     * {@link HeartBeat#NONE} while not connected.
     */
    public HeartBeat negotiatedHeartBeat()
    {
        return negotiated;
    }

    public Optional<String> sessionId()
    {
        return Optional.ofNullable(sessionId);
    }

    /**
     * Listener for every state change. Also receives
     * {@link ConnectionStatus#PROTOCOL_ERROR} notifications.
     */
    public ListenerRegistration addStateListener(Consumer<ConnectionStatus> listener)
    {
        return stateListeners.add(listener);
    }

    /**
     * Start the session and keep it alive until {@link #disconnect()}.
     * No effect while already active.
     */
    public void connect()
    {
        if (active) {
            log.debug("connect() ignored; already {}", state);
            return;
        }
        active = true;
        reconnectAttempts = 0;
        startAttempt("connect()");
    }

    /**
     * Close the session and cancel every timer. Subscriptions are sent
     * UNSUBSCRIBE (if connected) and forgotten.
     */
    public void disconnect()
    {
        active = false;
        generation++;
        cancelAllTimers();

        if (state == ConnectionStatus.CONNECTED && transport.isOpen()) {
            try {
                subscriptions.unsubscribeAll();
                String receipt = "disconnect-" + (++receiptCounter);
                transport.sendFrame(StompFrames.disconnect(receipt));
            }
            catch (StompNotConnectedException e) {
                log.debug("Transport closed while sending DISCONNECT", e);
            }
        }

        transport.close(CLOSE_NORMAL, "client disconnect");
        subscriptions.clear();
        resetSession();
        transition(ConnectionStatus.DISCONNECTED, "disconnect()");
    }

    /**
     * @throws StompNotConnectedException if not {@link ConnectionStatus#CONNECTED}
     */
    @Override
    public void send(StompFrame frame)
    {
        Objects.requireNonNull(frame, "frame");
        if (state != ConnectionStatus.CONNECTED) {
            throw new StompNotConnectedException("STOMP session is not connected (state=" + state + ")");
        }
        transport.sendFrame(frame);
    }

    // -------------------------------------------------------------------------
    // StompTransportListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp()
    {
        if (!active || state != ConnectionStatus.CONNECTING) {
            log.debug("Ignoring transport up in state {}", state);
            return;
        }
        transportEvent(StompTransportObservabilityEvent.Kind.UP, 0, "");
        markInbound();

        HeartBeat offer = clientHeartBeat();
        try {
            transport.sendFrame(StompFrames.connect(virtualHost, offer, connectHeaders));
        }
        catch (StompNotConnectedException e) {
            connectingFailed("transport closed before CONNECT", e);
            return;
        }
        protocolEvent(StompProtocolObservabilityEvent.Kind.CONNECT_SENT,
                "host=" + virtualHost + " heart-beat=" + offer.toHeaderValue());
    }

    @Override
    public void onTransportDown(int code, String reason, Throwable cause)
    {
        transportEvent(StompTransportObservabilityEvent.Kind.DOWN, code, reason);
        if (!active) {
            return;
        }
        String detail = "transport closed (" + code + (reason.isEmpty() ? "" : " " + reason) + ")";
        if (state == ConnectionStatus.CONNECTING) {
            connectingFailed(detail, cause);
        }
        else if (state == ConnectionStatus.CONNECTED) {
            connectionLost(detail);
        }
    }

    @Override
    public void onFrame(StompFrame frame)
    {
        markInbound();
        switch (frame.command()) {
            case CONNECTED -> onConnectedFrame(frame);
            case MESSAGE -> {
                if (state == ConnectionStatus.CONNECTED) {
                    subscriptions.dispatch(frame);
                }
            }
            case RECEIPT -> protocolEvent(StompProtocolObservabilityEvent.Kind.RECEIPT,
                    frame.header(StompHeaders.RECEIPT_ID).orElse(""));
            case ERROR -> onErrorFrame(frame);
            default -> log.debug("Ignoring unexpected {} frame", frame.command());
        }
    }

    @Override
    public void onHeartBeat()
    {
        markInbound();
    }

    @Override
    public void onUndecodable(StompFramingException error)
    {
        markInbound();
        transportEvent(StompTransportObservabilityEvent.Kind.UNDECODABLE_MESSAGE, 0, error.getMessage());
    }

    // -------------------------------------------------------------------------
    // Handshake
    // -------------------------------------------------------------------------

    private void startAttempt(String reason)
    {
        cancelAllTimers();
        resetSession();
        long gen = ++generation;

        transition(ConnectionStatus.CONNECTING, reason);
        transportEvent(StompTransportObservabilityEvent.Kind.OPENING, 0, transport.endpoint().toString());

        Duration timeout = timingPolicy.connectionTimeout();
        if (!timeout.isZero()) {
            handshakeTimer = scheduler.scheduleAfter(timeout, clock, () -> onHandshakeTimeout(gen));
        }

        try {
            transport.open();
        }
        catch (RuntimeException e) {
            connectingFailed("unable to open transport", e);
        }
    }

    private void onConnectedFrame(StompFrame frame)
    {
        if (state != ConnectionStatus.CONNECTING) {
            log.warn("Unexpected CONNECTED frame in state {}", state);
            return;
        }

        String version = frame.header(StompHeaders.VERSION).orElse("1.0");
        if (!SUPPORTED_VERSIONS.contains(version)) {
            handshakeFailed("unsupported STOMP version " + version, null);
            return;
        }

        HeartBeat effective;
        try {
            HeartBeat server = frame.header(StompHeaders.HEART_BEAT).map(HeartBeat::parse).orElse(HeartBeat.NONE);
            effective = clientHeartBeat().negotiate(server);
            // Fails here rather than once the session is up.
            inboundThresholdNanos(effective);
        }
        catch (IllegalArgumentException | ArithmeticException e) {
            handshakeFailed("unusable heart-beat: " + e.getMessage(), e);
            return;
        }

        cancel(handshakeTimer);
        handshakeTimer = null;

        negotiated = effective;
        sessionId = frame.header(StompHeaders.SESSION).orElse(null);
        reconnectAttempts = 0;

        transition(ConnectionStatus.CONNECTED, "CONNECTED frame");
        protocolEvent(StompProtocolObservabilityEvent.Kind.SESSION_ESTABLISHED,
                "version=" + version + " session=" + sessionId + " heart-beat=" + negotiated.toHeaderValue());

        startHeartBeats(generation);
        subscriptions.onConnected();
    }

    private void onErrorFrame(StompFrame frame)
    {
        String message = frame.header(StompHeaders.MESSAGE).orElse("");
        String body = frame.hasBody() ? frame.bodyAsText() : "";
        observabilitySink.onError(new StompErrorEvent(wallClock.now(),
                "Broker ERROR frame: " + message + (body.isEmpty() ? "" : " - " + body), null));
        stateListeners.deliver(ConnectionStatus.PROTOCOL_ERROR);
    }

    private void onHandshakeTimeout(long gen)
    {
        if (gen != generation || state != ConnectionStatus.CONNECTING) {
            return;
        }
        protocolEvent(StompProtocolObservabilityEvent.Kind.HANDSHAKE_TIMEOUT,
                "no CONNECTED frame within " + timingPolicy.connectionTimeout().toMillis() + "ms");
        handshakeFailed("connection timeout", null);
    }

    private void handshakeFailed(String detail, Throwable cause)
    {
        transport.close(CLOSE_HANDSHAKE_FAILED, "handshake failed");
        connectingFailed("handshake failed: " + detail, cause);
    }

    private void connectingFailed(String detail, Throwable cause)
    {
        cancelAllTimers();
        subscriptions.onConnectionLost();
        resetSession();
        generation++;
        observabilitySink.onError(new StompErrorEvent(wallClock.now(), detail, cause));
        transition(ConnectionStatus.ERROR, detail);
        scheduleReconnect();
    }

    private void connectionLost(String detail)
    {
        cancelAllTimers();
        subscriptions.onConnectionLost();
        resetSession();
        generation++;
        transition(ConnectionStatus.DISCONNECTED, detail);
        scheduleReconnect();
    }

    // -------------------------------------------------------------------------
    // Heart-beats
    // -------------------------------------------------------------------------

    private HeartBeat clientHeartBeat()
    {
        return HeartBeat.of(timingPolicy.heartbeatOutgoing(), timingPolicy.heartbeatIncoming());
    }

    private void startHeartBeats(long gen)
    {
        if (negotiated.outgoingMillis() > 0) {
            armOutgoing(gen);
        }
        if (negotiated.incomingMillis() > 0) {
            armInboundCheck(gen, clock.nowNanos() + inboundThresholdNanos(negotiated));
        }
    }

    private void armOutgoing(long gen)
    {
        outgoingHeartBeatTimer = scheduler.scheduleAfter(
                Duration.ofMillis(negotiated.outgoingMillis()), clock, () -> onOutgoingDue(gen));
    }

    private void onOutgoingDue(long gen)
    {
        if (gen != generation || state != ConnectionStatus.CONNECTED) {
            return;
        }
        try {
            transport.send(OutboundPayload.heartBeat());
        }
        catch (StompNotConnectedException e) {
            // The close callback handles the loss.
            log.debug("Heart-beat not sent; transport closed");
            return;
        }
        armOutgoing(gen);
    }

    /**
     * Inbound silence after which the connection counts as lost.
     *
     * @throws ArithmeticException if the interval times the tolerance does not fit in a long
     */
    private long inboundThresholdNanos(HeartBeat heartBeat)
    {
        return Math.multiplyExact(Duration.ofMillis(heartBeat.incomingMillis()).toNanos(),
                (long) timingPolicy.heartbeatToleranceMultiplier());
    }

    private void armInboundCheck(long gen, long deadlineNanos)
    {
        inboundCheckTimer = scheduler.scheduleAtNanos(deadlineNanos, () -> onInboundCheck(gen));
    }

    private void onInboundCheck(long gen)
    {
        if (gen != generation || state != ConnectionStatus.CONNECTED) {
            return;
        }
        long threshold = inboundThresholdNanos(negotiated);
        long silentNanos = clock.nowNanos() - lastInboundNanos;
        if (silentNanos < threshold) {
            armInboundCheck(gen, lastInboundNanos + threshold);
            return;
        }

        protocolEvent(StompProtocolObservabilityEvent.Kind.HEARTBEAT_TIMEOUT,
                "no inbound activity for " + Duration.ofNanos(silentNanos).toMillis() + "ms");
        // A local close produces no close callback; the loss is handled here.
        transport.close(CLOSE_HEARTBEAT_TIMEOUT, "heart-beat timeout");
        connectionLost("heart-beat timeout");
    }

    private void markInbound()
    {
        lastInboundNanos = clock.nowNanos();
    }

    // -------------------------------------------------------------------------
    // Reconnect
    // -------------------------------------------------------------------------

    private void scheduleReconnect()
    {
        if (!active) {
            return;
        }
        reconnectAttempts++;
        Optional<Duration> delay = reconnectPolicy.delayForAttempt(reconnectAttempts);
        if (delay.isEmpty()) {
            log.info("Automatic reconnect disabled; staying {}", state);
            active = false;
            return;
        }
        long gen = generation;
        reconnectTimer = scheduler.scheduleAfter(delay.get(), clock, () -> onReconnectDue(gen));
        protocolEvent(StompProtocolObservabilityEvent.Kind.RECONNECT_SCHEDULED,
                "attempt " + reconnectAttempts + " in " + delay.get().toMillis() + "ms");
    }

    private void onReconnectDue(long gen)
    {
        if (gen != generation || !active) {
            return;
        }
        reconnectTimer = null;
        startAttempt("reconnect attempt " + reconnectAttempts);
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private void transition(ConnectionStatus next, String reason)
    {
        ConnectionStatus previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        observabilitySink.onStateTransition(new StompStateTransitionEvent(wallClock.now(), previous, next, reason));
        stateListeners.deliver(next);
    }

    private void resetSession()
    {
        negotiated = HeartBeat.NONE;
        sessionId = null;
    }

    private void cancelAllTimers()
    {
        cancel(handshakeTimer);
        cancel(outgoingHeartBeatTimer);
        cancel(inboundCheckTimer);
        cancel(reconnectTimer);
        handshakeTimer = null;
        outgoingHeartBeatTimer = null;
        inboundCheckTimer = null;
        reconnectTimer = null;
    }

    private static void cancel(Cancellable timer)
    {
        if (timer != null) {
            timer.cancel();
        }
    }

    private void protocolEvent(StompProtocolObservabilityEvent.Kind kind, String detail)
    {
        observabilitySink.onProtocolEvent(new StompProtocolObservabilityEvent(wallClock.now(), kind, detail));
    }

    private void transportEvent(StompTransportObservabilityEvent.Kind kind, int code, String detail)
    {
        observabilitySink.onTransportEvent(new StompTransportObservabilityEvent(wallClock.now(), kind, code, detail));
    }
}
