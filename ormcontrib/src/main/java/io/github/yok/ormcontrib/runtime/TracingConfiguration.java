package io.github.yok.ormcontrib.runtime;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import io.github.yok.ormcontrib.runtime.trace.TraceListenerCollection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Getter;
import lombok.Setter;

/**
 * Trace switches, the global trace flag and the listeners trace output goes to.
 *
 * <p>
 * Switch names are matched exactly. A switch that was never set is {@link TraceLevel#OFF}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class TracingConfiguration {

    private final ConcurrentHashMap<String, TraceLevel> switches = new ConcurrentHashMap<>();

    @Getter
    private final TraceListenerCollection listeners = new TraceListenerCollection();

    // Set once any switch is configured above OFF
    @Getter
    @Setter
    private volatile boolean traceEnabled;

    /**
     * Sets the level of a switch, replacing any previous level.
     *
     * @param switchName switch name
     * @param level level
     */
    public void setTraceLevel(String switchName, TraceLevel level) {
        Preconditions.checkNotNull(switchName, "switchName must not be null");
        Preconditions.checkNotNull(level, "level must not be null");
        switches.put(switchName, level);
    }

    /**
     * Returns the level of a switch.
     *
     * @param switchName switch name
     * @return level, {@link TraceLevel#OFF} if never set
     */
    public TraceLevel getTraceLevel(String switchName) {
        if (switchName == null) {
            return TraceLevel.OFF;
        }
        return switches.getOrDefault(switchName, TraceLevel.OFF);
    }

    /**
     * Returns an immutable snapshot of all configured switches.
     *
     * @return switch name to level
     */
    public Map<String, TraceLevel> getTraceLevels() {
        return ImmutableMap.copyOf(switches);
    }

    /**
     * Returns whether a message would be written.
     *
     * @param switchName switch the message belongs to
     * @param level message level
     * @return {@code true} if tracing is enabled and the switch admits the level
     */
    public boolean shouldTrace(String switchName, TraceLevel level) {
        return traceEnabled && getTraceLevel(switchName).admits(level);
    }

    /**
     * Writes a message to all listeners when {@link #shouldTrace(String, TraceLevel)} holds.
     *
     * @param switchName switch the message belongs to
     * @param level message level
     * @param message message text
     */
    public void trace(String switchName, TraceLevel level, String message) {
        if (shouldTrace(switchName, level)) {
            listeners.writeLine(message);
        }
    }
}
