package io.github.yok.ormcontrib.runtime.trace;

/**
 * Destination of trace messages written by the runtime.
 *
 * @author Yasuharu.Okawauchi
 */
public interface TraceListener {

    /**
     * Returns the listener name, unique within a {@link TraceListenerCollection}.
     *
     * @return listener name
     */
    String getName();

    /**
     * Writes one trace message.
     *
     * @param message message text
     */
    void writeLine(String message);
}
