package org.konoko.runtime;

/**
 * Thrown when a program runs longer than the configured step limit.
 */
public class StepLimitExceededException extends MachineException {

    public StepLimitExceededException(long maxSteps) {
        super("Program did not halt within " + maxSteps + " steps");
    }
}
