package com.questrail.ledgerchat.protocol.stomp.internal.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * SingleThreadSessionExecutor
 * =============================================================================
 * Production {@link SessionExecutor} backed by one daemon thread.
 *
 * <h2>Threading Model</h2>
 * The same thread also backs the scheduler handed to the connection manager
 * (see {@link #scheduledExecutor()}), so timer callbacks, transport callbacks
 * and facade calls are all processed sequentially. This ensures:
 * <ul>
 *   <li>No concurrent modification of session state</li>
 *   <li>Deterministic ordering between a timer and the event it races</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   new SingleThreadSessionExecutor(name) → thread starts lazily on first task
 *   shutdown()                            → stops accepting work, waits up to 5s
 * </pre>
 */
public final class SingleThreadSessionExecutor implements SessionExecutor
{
    private static final Logger log = LoggerFactory.getLogger(SingleThreadSessionExecutor.class);

    private final ScheduledExecutorService executor;
    private volatile Thread sessionThread;

    public SingleThreadSessionExecutor(String threadName)
    {
        Objects.requireNonNull(threadName, "threadName");
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            sessionThread = t;
            return t;
        });
    }

    /**
     * The underlying executor, for scheduling timers on the session thread.
     */
    public ScheduledExecutorService scheduledExecutor()
    {
        return executor;
    }

    @Override
    public boolean inSessionThread()
    {
        return Thread.currentThread() == sessionThread;
    }

    @Override
    public void execute(Runnable task)
    {
        Objects.requireNonNull(task, "task");
        if (inSessionThread()) {
            runLogged(task);
            return;
        }
        try {
            executor.execute(() -> runLogged(task));
        }
        catch (RejectedExecutionException e) {
            // Late transport callbacks may race shutdown.
            log.debug("Session executor shut down; dropping task");
        }
    }

    @Override
    public <T> T call(Callable<T> task)
    {
        Objects.requireNonNull(task, "task");
        if (inSessionThread()) {
            return invoke(task);
        }

        final Future<T> future;
        try {
            future = executor.submit(task);
        }
        catch (RejectedExecutionException e) {
            throw new IllegalStateException("Session executor is shut down", e);
        }

        try {
            return future.get();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            throw new IllegalStateException("Interrupted while waiting for the session thread", e);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException(cause);
        }
    }

    /**
     * Stop accepting work and wait for queued tasks to finish.
     */
    public void shutdown()
    {
        executor.shutdown();
        if (inSessionThread()) {
            return;
        }
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static <T> T invoke(Callable<T> task)
    {
        try {
            return task.call();
        }
        catch (RuntimeException e) {
            throw e;
        }
        catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static void runLogged(Runnable task)
    {
        try {
            task.run();
        }
        catch (RuntimeException e) {
            log.error("Unhandled exception on session thread", e);
        }
    }
}
