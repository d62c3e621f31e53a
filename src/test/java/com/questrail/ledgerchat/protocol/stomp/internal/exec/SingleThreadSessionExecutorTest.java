package com.questrail.ledgerchat.protocol.stomp.internal.exec;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SingleThreadSessionExecutorTest {

    private final SingleThreadSessionExecutor executor = new SingleThreadSessionExecutor("test-session");

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void callRunsOnSessionThread() {
        String name = executor.call(() -> Thread.currentThread().getName());

        assertEquals("test-session", name);
        assertFalse(executor.inSessionThread());
        assertTrue(executor.call(executor::inSessionThread));
    }

    @Test
    void nestedCallsRunInline() {
        List<String> order = new ArrayList<>();

        executor.call(() -> {
            order.add("outer");
            executor.execute(() -> order.add("nested-execute"));
            return executor.call(() -> order.add("nested-call"));
        });

        assertEquals(List.of("outer", "nested-execute", "nested-call"), order);
    }

    @Test
    void runtimeExceptionsAreRethrownUnchanged() {
        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> executor.call(() -> { throw new IllegalArgumentException("boom"); }));

        assertEquals("boom", thrown.getMessage());
    }

    @Test
    void checkedExceptionsAreWrapped() {
        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> executor.call(() -> { throw new IOException("io"); }));

        assertInstanceOf(IOException.class, thrown.getCause());
    }

    @Test
    void failingTaskDoesNotKillTheThread() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        executor.execute(() -> { throw new IllegalStateException("ignored"); });
        executor.execute(latch::countDown);

        assertTrue(latch.await(1, TimeUnit.SECONDS));
    }

    @Test
    void workAfterShutdown() {
        executor.shutdown();

        assertDoesNotThrow(() -> executor.execute(() -> { }));
        assertThrows(IllegalStateException.class, () -> executor.call(() -> 1));
    }
}
