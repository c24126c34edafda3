package org.konoko.runtime;

/**
 * Base class of the faults that stop a running program.
 */
public class MachineException extends RuntimeException {

    public MachineException(String message) {
        super(message);
    }

    public MachineException(String message, Throwable cause) {
        super(message, cause);
    }
}
