package org.konoko.runtime;

import com.typesafe.config.Config;

/**
 * Construction parameters of a {@link VirtualMachine}.
 *
 * @param tapeSize The number of cells on the tape; must be positive.
 * @param symmetricWraparound If {@code true}, moving left from cell 0 wraps to the last cell.
 *                            If {@code false} the pointer goes negative, as the language defines it.
 * @param maxSteps The maximum number of executed steps, or 0 for no limit.
 */
public record MachineOptions(int tapeSize, boolean symmetricWraparound, long maxSteps) {

    /** The tape length used when nothing else is configured. */
    public static final int DEFAULT_TAPE_SIZE = 16;

    /** Configuration path of the machine block. */
    public static final String CONFIG_PATH = "konoko.machine";

    public MachineOptions {
        if (tapeSize <= 0) {
            throw new IllegalArgumentException("Tape size must be positive, was " + tapeSize);
        }
        if (maxSteps < 0) {
            throw new IllegalArgumentException("Step limit must not be negative, was " + maxSteps);
        }
    }

    /**
     * @return The options of the language as defined: 16 cells, no left wraparound, no step limit.
     */
    public static MachineOptions defaults() {
        return new MachineOptions(DEFAULT_TAPE_SIZE, false, 0);
    }

    /**
     * Reads the options from the {@code konoko.machine} block of a configuration.
     * Missing keys fall back to {@link #defaults()}.
     *
     * @param config The application configuration.
     * @return The options.
     */
    public static MachineOptions fromConfig(Config config) {
        MachineOptions defaults = defaults();
        if (!config.hasPath(CONFIG_PATH)) {
            return defaults;
        }
        Config machine = config.getConfig(CONFIG_PATH);
        return new MachineOptions(
                machine.hasPath("tape-size") ? machine.getInt("tape-size") : defaults.tapeSize(),
                machine.hasPath("symmetric-wraparound") ? machine.getBoolean("symmetric-wraparound") : defaults.symmetricWraparound(),
                machine.hasPath("max-steps") ? machine.getLong("max-steps") : defaults.maxSteps());
    }

    /**
     * @param newTapeSize The tape size to use instead.
     * @return A copy of these options with another tape size.
     */
    public MachineOptions withTapeSize(int newTapeSize) {
        return new MachineOptions(newTapeSize, symmetricWraparound, maxSteps);
    }
}
