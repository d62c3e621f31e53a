package com.questrail.ledgerchat.protocol.stomp.runtime;

import com.questrail.ledgerchat.protocol.stomp.internal.exec.SessionExecutor;
import com.questrail.ledgerchat.protocol.stomp.transport.MessageEndpointListener;

import java.util.Objects;

/**
 * Re-delivers endpoint callbacks from the I/O thread onto the session thread.
 */
final class SessionBoundEndpointListener implements MessageEndpointListener
{
    private final SessionExecutor executor;
    private final MessageEndpointListener delegate;

    SessionBoundEndpointListener(SessionExecutor executor, MessageEndpointListener delegate)
    {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void onOpen()
    {
        executor.execute(delegate::onOpen);
    }

    @Override
    public void onClose(int code, String reason)
    {
        executor.execute(() -> delegate.onClose(code, reason));
    }

    @Override
    public void onError(Throwable cause)
    {
        executor.execute(() -> delegate.onError(cause));
    }

    @Override
    public void onText(String text)
    {
        executor.execute(() -> delegate.onText(text));
    }

    @Override
    public void onBinary(byte[] payload)
    {
        executor.execute(() -> delegate.onBinary(payload));
    }
}
