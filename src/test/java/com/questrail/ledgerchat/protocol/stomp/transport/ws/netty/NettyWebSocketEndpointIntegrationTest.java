package com.questrail.ledgerchat.protocol.stomp.transport.ws.netty;

import com.questrail.ledgerchat.protocol.stomp.transport.MessageEndpointListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.util.ReferenceCountUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyWebSocketEndpointIntegrationTest
 * -----------------------------------------------------------------------------
 * Runs the endpoint against a loopback Netty WebSocket server that echoes
 * text and binary messages and closes on request.
 */
final class NettyWebSocketEndpointIntegrationTest {

    private static final String CLOSE_ME = "close-me";

    private EventLoopGroup serverGroup;
    private Channel serverChannel;
    private NettyWebSocketEndpoint endpoint;
    private final RecordingListener listener = new RecordingListener();

    /** Flattens every callback into a string so tests can await them in order. */
    private static final class RecordingListener implements MessageEndpointListener {
        final BlockingQueue<String> events = new LinkedBlockingQueue<>();

        @Override public void onOpen() { events.add("open"); }
        @Override public void onClose(int code, String reason) { events.add("close:" + code + ":" + reason); }
        @Override public void onError(Throwable cause) { events.add("error"); }
        @Override public void onText(String text) { events.add("text:" + text); }
        @Override public void onBinary(byte[] payload) {
            events.add("binary:" + new String(payload, StandardCharsets.UTF_8));
        }

        String next() throws InterruptedException {
            String event = events.poll(5, TimeUnit.SECONDS);
            assertNotNull(event, "timed out waiting for endpoint callback");
            return event;
        }
    }

    private static final class EchoHandler extends SimpleChannelInboundHandler<WebSocketFrame> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
            if (frame instanceof TextWebSocketFrame text) {
                if (CLOSE_ME.equals(text.text())) {
                    ctx.writeAndFlush(new CloseWebSocketFrame(4002, "bye"));
                    return;
                }
                ctx.writeAndFlush(new TextWebSocketFrame(text.text()));
            }
            else if (frame instanceof BinaryWebSocketFrame binary) {
                ctx.writeAndFlush(new BinaryWebSocketFrame(binary.content().retain()));
            }
        }
    }

    @BeforeEach
    void startServer() throws InterruptedException {
        serverGroup = new NioEventLoopGroup(1);
        serverChannel = new ServerBootstrap()
                .group(serverGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(
                                new HttpServerCodec(),
                                new HttpObjectAggregator(65536),
                                new WebSocketServerProtocolHandler("/ws"),
                                new EchoHandler());
                    }
                })
                .bind("127.0.0.1", 0)
                .sync()
                .channel();
    }

    @AfterEach
    void stopServer() {
        if (endpoint != null) {
            endpoint.shutdown();
        }
        serverChannel.close();
        serverGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    private URI serverUri() {
        int port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        return URI.create("ws://127.0.0.1:" + port + "/ws");
    }

    private void openEndpoint() throws InterruptedException {
        endpoint = new NettyWebSocketEndpoint(serverUri());
        endpoint.setListener(listener);
        endpoint.connect();
        assertEquals("open", listener.next());
        assertTrue(endpoint.isOpen());
    }

    @Test
    void exchangesTextAndBinaryMessages() throws InterruptedException {
        openEndpoint();

        endpoint.sendBinary("SEND\ndestination:/app/x\n\n\0".getBytes(StandardCharsets.UTF_8));
        assertEquals("binary:SEND\ndestination:/app/x\n\n\0", listener.next());

        endpoint.sendText("\n");
        assertEquals("text:\n", listener.next());
    }

    @Test
    void serverCloseIsReportedWithCodeAndReason() throws InterruptedException {
        openEndpoint();

        endpoint.sendText(CLOSE_ME);

        assertEquals("close:4002:bye", listener.next());
        assertFalse(endpoint.isOpen());
        assertThrows(IllegalStateException.class, () -> endpoint.sendText("late"));
    }

    @Test
    void localCloseProducesNoCallback() throws InterruptedException {
        openEndpoint();

        endpoint.close(1000, "done");

        assertNull(listener.events.poll(300, TimeUnit.MILLISECONDS));
        assertFalse(endpoint.isOpen());
    }

    @Test
    void reconnectAfterServerCloseOpensFreshConnection() throws InterruptedException {
        openEndpoint();
        endpoint.sendText(CLOSE_ME);
        assertEquals("close:4002:bye", listener.next());

        endpoint.connect();

        assertEquals("open", listener.next());
        endpoint.sendText("again");
        assertEquals("text:again", listener.next());
    }

    @Test
    void failedWriteReportsErrorThenAbnormalClose() throws InterruptedException {
        openEndpoint();
        endpoint.currentChannel().pipeline().addLast(new ChannelOutboundHandlerAdapter() {
            @Override
            public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) {
                ReferenceCountUtil.release(msg);
                promise.setFailure(new IOException("write refused"));
            }
        });

        endpoint.sendBinary("SEND\ndestination:/app/x\n\n\0".getBytes(StandardCharsets.UTF_8));

        assertEquals("error", listener.next());
        assertTrue(listener.next().startsWith("close:1006:"));
        assertFalse(endpoint.isOpen());
    }

    @Test
    void refusedConnectionReportsErrorThenAbnormalClose() throws IOException, InterruptedException {
        int unusedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            unusedPort = socket.getLocalPort();
        }
        endpoint = new NettyWebSocketEndpoint(URI.create("ws://127.0.0.1:" + unusedPort + "/ws"));
        endpoint.setListener(listener);

        endpoint.connect();

        assertEquals("error", listener.next());
        assertTrue(listener.next().startsWith("close:1006:"));
    }

    @Test
    void rejectsNonWebSocketUrls() {
        assertThrows(IllegalArgumentException.class,
                () -> new NettyWebSocketEndpoint(URI.create("http://localhost/ws")));
    }

    @Test
    void connectWithoutListenerFails() {
        endpoint = new NettyWebSocketEndpoint(serverUri());

        assertThrows(IllegalStateException.class, endpoint::connect);
    }
}
