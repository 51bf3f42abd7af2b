package io.github.yok.ormcontrib.runtime.trace;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Writes trace messages to a print stream, standard output by default.
 *
 * @author Yasuharu.Okawauchi
 */
public class ConsoleTraceListener implements TraceListener {

    /** Listener name. */
    public static final String NAME = "Console";

    private final PrintStream out;

    /**
     * Creates a listener writing to {@link System#out}.
     */
    public ConsoleTraceListener() {
        this(System.out);
    }

    /**
     * Creates a listener writing to the given stream.
     *
     * @param out target stream
     */
    public ConsoleTraceListener(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void writeLine(String message) {
        out.println(message);
    }
}
