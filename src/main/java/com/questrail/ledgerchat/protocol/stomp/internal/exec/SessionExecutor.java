package com.questrail.ledgerchat.protocol.stomp.internal.exec;

import java.util.concurrent.Callable;

/**
 * SessionExecutor
 * -----------------------------------------------------------------------------
 * Serializes all protocol work of one client onto a single session thread.
 *
 * <p>The connection manager, subscription registry and publisher are not
 * thread-safe; every call into them goes through a {@code SessionExecutor}.
 * Both methods run the task inline when the caller is already on the session
 * thread, so nested calls (a listener calling back into the client) never
 * deadlock.</p>
 */
public interface SessionExecutor
{
    /**
     * Run {@code task} on the session thread, asynchronously unless already there.
     */
    void execute(Runnable task);

    /**
     * Run {@code task} on the session thread and wait for its result.
     * A {@link RuntimeException} thrown by the task is rethrown unchanged.
     */
    <T> T call(Callable<T> task);

    boolean inSessionThread();
}
