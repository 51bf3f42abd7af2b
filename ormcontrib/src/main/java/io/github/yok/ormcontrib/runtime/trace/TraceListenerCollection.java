package io.github.yok.ormcontrib.runtime.trace;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered, thread-safe set of trace listeners.
 *
 * @author Yasuharu.Okawauchi
 */
public class TraceListenerCollection {

    private final CopyOnWriteArrayList<TraceListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Adds a listener at the end.
     *
     * @param listener listener to add
     * @throws NullPointerException if {@code listener} is {@code null}
     */
    public void add(TraceListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Removes every listener.
     */
    public void clear() {
        listeners.clear();
    }

    /**
     * Returns the listeners in insertion order.
     *
     * @return immutable snapshot
     */
    public List<TraceListener> getListeners() {
        return ImmutableList.copyOf(listeners);
    }

    /**
     * Returns the number of listeners.
     *
     * @return listener count
     */
    public int size() {
        return listeners.size();
    }

    /**
     * Returns whether no listener is registered.
     *
     * @return {@code true} if empty
     */
    public boolean isEmpty() {
        return listeners.isEmpty();
    }

    /**
     * Writes the message to every listener in order.
     *
     * @param message message text
     */
    public void writeLine(String message) {
        for (TraceListener listener : listeners) {
            listener.writeLine(message);
        }
    }
}
