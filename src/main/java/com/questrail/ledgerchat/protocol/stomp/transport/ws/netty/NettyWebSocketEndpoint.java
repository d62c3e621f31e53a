package com.questrail.ledgerchat.protocol.stomp.transport.ws.netty;

import com.questrail.ledgerchat.protocol.stomp.transport.MessageEndpoint;
import com.questrail.ledgerchat.protocol.stomp.transport.MessageEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.*;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * NettyWebSocketEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link MessageEndpoint} port: a
 * WebSocket (RFC 6455) client for {@code ws://} and {@code wss://} URLs.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decode STOMP frames</li>
 *   <li>Interpret protocol semantics</li>
 *   <li>Schedule reconnects, heart-beats, or timeouts</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound payloads are copied into
 * {@code byte[]}; fragmented messages are aggregated before delivery.
 *
 * <h2>Connections</h2>
 * Each {@link #connect()} builds a fresh handshaker and handler; a handler
 * that is no longer current drops its events, so a late close from an old
 * channel can never be mistaken for the loss of the new one.
 *
 * <p>Callbacks are delivered on the Netty event loop thread.</p>
 */
public final class NettyWebSocketEndpoint implements MessageEndpoint
{
    static final int MAX_MESSAGE_BYTES = 1024 * 1024;

    private static final int ABNORMAL_CLOSURE = 1006;

    private final URI uri;
    private final HttpHeaders handshakeHeaders;
    private final SslContext sslContext;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private volatile MessageEndpointListener listener;
    private volatile ConnectionHandler current;

    public NettyWebSocketEndpoint(URI uri)
    {
        this(uri, Map.of());
    }

    /**
     * @param uri              {@code ws://} or {@code wss://} URL of the broker endpoint
     * @param handshakeHeaders extra HTTP headers for the upgrade request
     */
    public NettyWebSocketEndpoint(URI uri, Map<String, String> handshakeHeaders)
    {
        this.uri = Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(handshakeHeaders, "handshakeHeaders");

        String scheme = uri.getScheme();
        if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Unsupported WebSocket scheme: " + uri);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("WebSocket URL has no host: " + uri);
        }

        this.handshakeHeaders = new DefaultHttpHeaders();
        handshakeHeaders.forEach(this.handshakeHeaders::add);

        if ("wss".equalsIgnoreCase(scheme)) {
            try {
                this.sslContext = SslContextBuilder.forClient().build();
            }
            catch (SSLException e) {
                throw new IllegalStateException("Unable to initialise TLS for " + uri, e);
            }
        }
        else {
            this.sslContext = null;
        }

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true);
    }

    @Override
    public void setListener(MessageEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void connect()
    {
        requireListener();

        ConnectionHandler previous = current;
        if (previous != null) {
            previous.detachAndClose(WebSocketCloseStatus.NORMAL_CLOSURE.code(), "reconnect");
        }

        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, false, handshakeHeaders, MAX_MESSAGE_BYTES);
        ConnectionHandler handler = new ConnectionHandler(handshaker);
        current = handler;

        String host = uri.getHost();
        int port = port();

        Bootstrap b = bootstrap.clone().handler(new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch)
            {
                ChannelPipeline p = ch.pipeline();
                if (sslContext != null) {
                    p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                }
                p.addLast(new HttpClientCodec());
                p.addLast(new HttpObjectAggregator(MAX_MESSAGE_BYTES));
                p.addLast(new WebSocketFrameAggregator(MAX_MESSAGE_BYTES));
                p.addLast(handler);
            }
        });

        b.connect(host, port).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                handler.fail(future.cause());
            }
        });
    }

    @Override
    public void close(int code, String reason)
    {
        ConnectionHandler handler = current;
        current = null;
        if (handler != null) {
            handler.detachAndClose(code, reason);
        }
    }

    @Override
    public boolean isOpen()
    {
        ConnectionHandler handler = current;
        return handler != null && handler.isOpen();
    }

    @Override
    public void sendText(String text)
    {
        Objects.requireNonNull(text, "text");
        requireOpenHandler().write(new TextWebSocketFrame(text));
    }

    @Override
    public void sendBinary(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        requireOpenHandler().write(new BinaryWebSocketFrame(Unpooled.wrappedBuffer(payload)));
    }

    @Override
    public void shutdown()
    {
        close(WebSocketCloseStatus.ENDPOINT_UNAVAILABLE.code(), "shutdown");
        group.shutdownGracefully();
    }

    private int port()
    {
        int port = uri.getPort();
        if (port == -1) {
            port = "wss".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
        }
        return port;
    }

    private ConnectionHandler requireOpenHandler()
    {
        ConnectionHandler handler = current;
        if (handler == null || !handler.isOpen()) {
            throw new IllegalStateException("WebSocket is not open");
        }
        return handler;
    }

    // Visible for tests.
    Channel currentChannel()
    {
        ConnectionHandler handler = current;
        return handler == null ? null : handler.channel;
    }

    private MessageEndpointListener requireListener()
    {
        MessageEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("MessageEndpointListener must be set before connect()");
        }
        return l;
    }

    /**
     * ConnectionHandler
     * -------------------------------------------------------------------------
     * Drives one WebSocket connection: finishes the upgrade handshake, then
     * forwards whole messages and the final close to the port listener, as
     * long as it is still the endpoint's current handler.
     */
    private final class ConnectionHandler extends SimpleChannelInboundHandler<Object>
    {
        private final WebSocketClientHandshaker handshaker;

        private volatile Channel channel;
        private volatile boolean open;

        private int closeCode = ABNORMAL_CLOSURE;
        private String closeReason = "";
        private boolean closeReported;

        ConnectionHandler(WebSocketClientHandshaker handshaker)
        {
            this.handshaker = handshaker;
        }

        boolean isOpen()
        {
            Channel ch = channel;
            return open && ch != null && ch.isActive();
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            channel = ctx.channel();
            if (current != this) {
                // Closed locally while the TCP connect was still in flight.
                ctx.close();
                return;
            }
            handshaker.handshake(ctx.channel());
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg)
        {
            Channel ch = ctx.channel();
            if (!handshaker.isHandshakeComplete()) {
                if (msg instanceof FullHttpResponse response) {
                    try {
                        handshaker.finishHandshake(ch, response);
                    }
                    catch (WebSocketHandshakeException e) {
                        fail(e);
                        ch.close();
                        return;
                    }
                    open = true;
                    MessageEndpointListener l = listenerIfCurrent();
                    if (l != null) {
                        l.onOpen();
                    }
                }
                return;
            }

            if (msg instanceof FullHttpResponse response) {
                throw new IllegalStateException(
                        "Unexpected FullHttpResponse (status=" + response.status() + ")");
            }

            MessageEndpointListener l = listenerIfCurrent();

            if (msg instanceof TextWebSocketFrame text) {
                if (l != null) {
                    l.onText(text.text());
                }
            }
            else if (msg instanceof BinaryWebSocketFrame binary) {
                if (l != null) {
                    l.onBinary(copy(binary.content()));
                }
            }
            else if (msg instanceof PingWebSocketFrame ping) {
                ch.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            }
            else if (msg instanceof CloseWebSocketFrame close) {
                closeCode = close.statusCode() == -1 ? WebSocketCloseStatus.NORMAL_CLOSURE.code() : close.statusCode();
                closeReason = close.reasonText() == null ? "" : close.reasonText();
                ch.close();
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            open = false;
            reportClose();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            MessageEndpointListener l = listenerIfCurrent();
            if (l != null) {
                l.onError(cause);
            }
            ctx.close();
        }

        /**
         * Writes one message. A failed write is reported through
         * {@code onError} and closes the channel, which then reports the close.
         */
        void write(WebSocketFrame frame)
        {
            channel.writeAndFlush(frame).addListener((ChannelFutureListener) future -> {
                if (!future.isSuccess()) {
                    writeFailed(future.cause());
                }
            });
        }

        void writeFailed(Throwable cause)
        {
            MessageEndpointListener l = listenerIfCurrent();
            if (l != null) {
                l.onError(cause);
            }
            channel.close();
        }

        /** Connection attempt or handshake failed. */
        void fail(Throwable cause)
        {
            open = false;
            MessageEndpointListener l = listenerIfCurrent();
            if (l != null) {
                l.onError(cause);
            }
            closeReason = cause == null ? "" : String.valueOf(cause.getMessage());
            reportClose();
        }

        void detachAndClose(int code, String reason)
        {
            open = false;
            Channel ch = channel;
            if (ch == null) {
                return;
            }
            if (ch.isActive() && handshaker.isHandshakeComplete()) {
                ch.writeAndFlush(new CloseWebSocketFrame(code, reason))
                        .addListener(ChannelFutureListener.CLOSE);
            }
            else {
                ch.close();
            }
        }

        private synchronized void reportClose()
        {
            if (closeReported) {
                return;
            }
            closeReported = true;
            MessageEndpointListener l = listenerIfCurrent();
            if (l != null) {
                current = null;
                l.onClose(closeCode, closeReason);
            }
        }

        private MessageEndpointListener listenerIfCurrent()
        {
            return current == this ? listener : null;
        }
    }

    private static byte[] copy(ByteBuf content)
    {
        byte[] bytes = new byte[content.readableBytes()];
        content.getBytes(content.readerIndex(), bytes);
        return bytes;
    }

    @Override
    public String toString()
    {
        return "NettyWebSocketEndpoint{" + uri + "}";
    }
}
