package io.github.yok.ormcontrib.runtime.trace;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import lombok.Getter;

/**
 * Appends trace messages to a text file (UTF-8), creating it on the first write.
 *
 * @author Yasuharu.Okawauchi
 */
public class FileTraceListener implements TraceListener {

    /** Listener name. */
    public static final String NAME = "File";

    @Getter
    private final Path file;

    /**
     * Creates a listener appending to {@code file}.
     *
     * @param file log file
     */
    public FileTraceListener(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * {@inheritDoc}
     *
     * @throws UncheckedIOException if the file cannot be written
     */
    @Override
    public synchronized void writeLine(String message) {
        appendLine(file, message);
    }

    static void appendLine(Path file, String message) {
        try {
            Files.writeString(file, message + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write trace file: " + file, e);
        }
    }
}
