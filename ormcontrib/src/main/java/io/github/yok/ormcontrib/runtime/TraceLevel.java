package io.github.yok.ormcontrib.runtime;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Verbosity of a trace switch. Higher values include the lower ones.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public enum TraceLevel {

    OFF(0), ERROR(1), WARNING(2), INFO(3), VERBOSE(4);

    // Numeric value used in configuration files
    private final int value;

    /**
     * Maps a configured number to a level. Values below 0 map to {@link #OFF}, values above 4 to
     * {@link #VERBOSE}.
     *
     * @param value configured number
     * @return trace level
     */
    public static TraceLevel fromValue(int value) {
        if (value <= OFF.value) {
            return OFF;
        }
        if (value >= VERBOSE.value) {
            return VERBOSE;
        }
        return values()[value];
    }

    /**
     * Returns whether a message of {@code messageLevel} passes a switch set to this level.
     *
     * @param messageLevel level of the message
     * @return {@code true} if the message is traced
     */
    public boolean admits(TraceLevel messageLevel) {
        return messageLevel != OFF && messageLevel.value <= value;
    }
}
