package io.github.yok.ormcontrib.runtime.trace;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Writes trace messages to the SLF4J logger at debug level.
 *
 * <p>
 * When a log file name is set, each message is also appended to that file.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DebugTraceListener implements TraceListener {

    /** Listener name. */
    public static final String NAME = "Debug";

    private final Path logFile;

    /**
     * Creates a listener without a log file.
     */
    public DebugTraceListener() {
        this(null);
    }

    /**
     * Creates a listener that also appends to {@code logFileName}.
     *
     * @param logFileName file name; {@code null} or blank for none
     */
    public DebugTraceListener(String logFileName) {
        this.logFile = StringUtils.isBlank(logFileName) ? null : Paths.get(logFileName.trim());
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * Returns the file messages are appended to.
     *
     * @return log file, empty when none is set
     */
    public Optional<Path> getLogFile() {
        return Optional.ofNullable(logFile);
    }

    @Override
    public synchronized void writeLine(String message) {
        log.debug("{}", message);
        if (logFile != null) {
            FileTraceListener.appendLine(logFile, message);
        }
    }
}
