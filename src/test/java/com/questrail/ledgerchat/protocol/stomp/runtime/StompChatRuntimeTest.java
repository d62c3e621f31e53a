package com.questrail.ledgerchat.protocol.stomp.runtime;

import com.questrail.ledgerchat.api.ChatClient;
import com.questrail.ledgerchat.api.ChatEvent;
import com.questrail.ledgerchat.protocol.stomp.config.ReconnectPolicy;
import com.questrail.ledgerchat.protocol.stomp.config.StompClientConfig;
import com.questrail.ledgerchat.protocol.stomp.observability.RecordingObservabilitySink;
import com.questrail.ledgerchat.protocol.stomp.transport.FakeMessageEndpoint;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Smoke test: the runtime wires a real session
 * thread around a fake endpoint.
 */
class StompChatRuntimeTest {

    private static final String CONNECTED = "CONNECTED\nversion:1.2\nheart-beat:0,0\n\n\0";

    private static StompClientConfig config() {
        return StompClientConfig.builder()
                .withBrokerUrl(URI.create("ws://localhost:1/ws"))
                .withUserId("42")
                .withReconnectPolicy(ReconnectPolicy.none())
                .build();
    }

    private static void awaitConnected(ChatClient client) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!client.isConnected() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertTrue(client.isConnected(), "client should reach CONNECTED");
    }

    @Test
    void runtimeDrivesHandshakeOnSessionThread() throws InterruptedException {
        FakeMessageEndpoint endpoint = new FakeMessageEndpoint();
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        List<ChatEvent> events = new CopyOnWriteArrayList<>();
        CountDownLatch received = new CountDownLatch(1);

        StompChatRuntime runtime = StompChatRuntime.builder()
                .withConfig(config())
                .withObservabilitySink(sink)
                .withEndpointFactory(cfg -> endpoint)
                .withThreadName("runtime-test")
                .build();
        ChatClient client = runtime.client();
        client.onMessage(e -> {
            events.add(e);
            received.countDown();
        });

        client.connect();
        assertEquals(1, endpoint.connectCalls());

        endpoint.acceptOpen();
        endpoint.injectFrame(CONNECTED);
        awaitConnected(client);

        endpoint.injectFrame("MESSAGE\nsubscription:sub-0\nmessage-id:1\ndestination:/queue/messages/42\n\n"
                + "{\"type\":\"CHUNK\",\"content\":\"hi\",\"timestamp\":\"t\"}\0");
        assertTrue(received.await(2, TimeUnit.SECONDS));
        assertEquals("hi", events.get(0).content());

        String messageId = client.sendMessage("hello");
        assertTrue(messageId.startsWith("msg_"));

        runtime.close();
        runtime.close();

        assertTrue(endpoint.isShutdown());
        assertEquals(1000, endpoint.lastCloseCode());
        assertFalse(client.isConnected());
    }

    @Test
    void buildRequiresConfig() {
        assertThrows(NullPointerException.class, () -> StompChatRuntime.builder().build());
    }
}
