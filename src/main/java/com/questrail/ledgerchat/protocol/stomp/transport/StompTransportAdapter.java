package com.questrail.ledgerchat.protocol.stomp.transport;

import com.questrail.ledgerchat.protocol.stomp.StompNotConnectedException;
import com.questrail.ledgerchat.protocol.stomp.codec.StompFrameDecoder;
import com.questrail.ledgerchat.protocol.stomp.codec.StompFrameEncoder;
import com.questrail.ledgerchat.protocol.stomp.codec.StompFramingException;
import com.questrail.ledgerchat.protocol.stomp.codec.impl.StompFraming;
import com.questrail.ledgerchat.protocol.stomp.model.StompCommand;
import com.questrail.ledgerchat.protocol.stomp.model.StompFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * StompTransportAdapter
 * =============================================================================
 * Translation layer between a {@link MessageEndpoint} and the STOMP session.
 *
 * <h2>Inbound path (decode-before-event)</h2>
 * <pre>
 *   MessageEndpoint (text or binary message)
 *        → heart-beat check (EOL only)
 *            → StompFrameDecoder
 *                → StompTransportListener.onFrame
 * </pre>
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   OutboundPayload
 *        → StompFrameEncoder (Frame variant only)
 *            → MessageEndpoint.sendBinary / sendText
 * </pre>
 *
 * <h2>Text-frame truncation workaround</h2>
 * Some WebSocket hosts strip a trailing NUL from text messages, and NUL is the
 * mandatory STOMP frame terminator. Frames are therefore never sent as text:
 * {@link OutboundPayload.Frame} always goes out as binary, and raw
 * {@link OutboundPayload.Text} that begins with a client command token is
 * re-encoded to its exact UTF-8 bytes and sent as binary too. Other text and
 * opaque binary payloads pass through unmodified.
 *
 * <h2>Explicit non-responsibilities</h2>
 * No retries, buffering, timing or reconnection. A send on a closed endpoint
 * fails fast. Undecodable inbound messages are logged and dropped.
 */
public final class StompTransportAdapter implements MessageEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(StompTransportAdapter.class);

    private final MessageEndpoint endpoint;
    private final StompFrameEncoder encoder;
    private final StompFrameDecoder decoder;

    private StompTransportListener listener;

    // Last error reported for the current connection; handed to onTransportDown.
    private Throwable pendingCause;

    public StompTransportAdapter(MessageEndpoint endpoint,
                                 StompFrameEncoder encoder,
                                 StompFrameDecoder decoder)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    public void setListener(StompTransportListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public MessageEndpoint endpoint()
    {
        return endpoint;
    }

    public void open()
    {
        pendingCause = null;
        endpoint.connect();
    }

    public void close(int code, String reason)
    {
        endpoint.close(code, reason);
    }

    public boolean isOpen()
    {
        return endpoint.isOpen();
    }

    /**
     * Encode and send a protocol frame as a binary message.
     */
    public void sendFrame(StompFrame frame)
    {
        send(OutboundPayload.frame(frame));
    }

    /**
     * Send a payload, correcting the text-frame truncation defect.
     *
     * @throws StompNotConnectedException if the endpoint is not open
     */
    public void send(OutboundPayload payload)
    {
        Objects.requireNonNull(payload, "payload");

        if (!endpoint.isOpen()) {
            throw new StompNotConnectedException("Transport is not open");
        }

        if (payload instanceof OutboundPayload.Frame f) {
            endpoint.sendBinary(encoder.encode(f.frame()));
        }
        else if (payload instanceof OutboundPayload.Text t) {
            if (StompCommand.startsWithClientCommand(t.text())) {
                endpoint.sendBinary(t.text().getBytes(StandardCharsets.UTF_8));
            }
            else {
                endpoint.sendText(t.text());
            }
        }
        else if (payload instanceof OutboundPayload.Binary b) {
            endpoint.sendBinary(b.bytes());
        }
    }

    // -------------------------------------------------------------------------
    // MessageEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onOpen()
    {
        pendingCause = null;
        requireListener().onTransportUp();
    }

    @Override
    public void onClose(int code, String reason)
    {
        Throwable cause = pendingCause;
        pendingCause = null;
        requireListener().onTransportDown(code, reason == null ? "" : reason, cause);
    }

    @Override
    public void onError(Throwable cause)
    {
        // Diagnostic only; onClose follows and carries the cause upward.
        log.debug("Transport error", cause);
        pendingCause = cause;
    }

    @Override
    public void onText(String text)
    {
        onInbound(text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public void onBinary(byte[] payload)
    {
        onInbound(payload);
    }

    private void onInbound(byte[] payload)
    {
        StompTransportListener l = requireListener();

        if (StompFraming.isHeartBeat(payload)) {
            l.onHeartBeat();
            return;
        }

        final StompFrame frame;
        try {
            frame = decoder.decode(payload);
        }
        catch (StompFramingException e) {
            log.warn("Dropping undecodable STOMP message ({} bytes): {}", payload.length, e.getMessage());
            l.onUndecodable(e);
            return;
        }

        l.onFrame(frame);
    }

    private StompTransportListener requireListener()
    {
        StompTransportListener l = listener;
        if (l == null) {
            throw new IllegalStateException("StompTransportListener must be set before use");
        }
        return l;
    }
}
