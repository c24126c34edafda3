package org.konoko.runtime;

/**
 * Thrown when a cell value would leave the signed 64-bit range, by arithmetic or by input.
 */
public class CellOverflowException extends MachineException {

    public CellOverflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
