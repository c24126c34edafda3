package org.konoko.runtime;

/**
 * Thrown when an input instruction runs after the input source has ended.
 */
public class InputExhaustedException extends MachineException {

    public InputExhaustedException() {
        super("Input ended before the program finished reading");
    }
}
