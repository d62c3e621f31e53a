package com.questrail.ledgerchat.protocol.stomp.internal.exec;

import com.questrail.ledgerchat.api.ListenerRegistration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Ordered observer list. Registration and removal are safe from any thread;
 * delivery happens on the caller's thread in registration order.
 *
 * <p>A listener that throws is logged and skipped; later listeners still run.</p>
 */
public final class ListenerList<T>
{
    private static final Logger log = LoggerFactory.getLogger(ListenerList.class);

    private final String name;
    private final List<Consumer<T>> listeners = new CopyOnWriteArrayList<>();

    public ListenerList(String name)
    {
        this.name = Objects.requireNonNull(name, "name");
    }

    public ListenerRegistration add(Consumer<T> listener)
    {
        Objects.requireNonNull(listener, "listener");
        // Wrap so the same consumer can be registered twice and removed independently.
        Consumer<T> entry = listener::accept;
        listeners.add(entry);
        return () -> listeners.remove(entry);
    }

    public void deliver(T value)
    {
        for (Consumer<T> listener : listeners) {
            try {
                listener.accept(value);
            }
            catch (RuntimeException e) {
                log.warn("{} listener threw; continuing with the remaining listeners", name, e);
            }
        }
    }

    public int size()
    {
        return listeners.size();
    }
}
