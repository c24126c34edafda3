package org.konoko.runtime;

/**
 * Thrown when a cell is read or written while the data pointer lies outside the tape.
 * <p>
 * Moving left from cell 0 leaves the pointer at -1; the fault surfaces on the next cell access.
 */
public class TapeAccessException extends MachineException {

    private final int dataPointer;

    public TapeAccessException(int dataPointer, int tapeSize) {
        super(String.format("Data pointer %d is outside the tape of size %d", dataPointer, tapeSize));
        this.dataPointer = dataPointer;
    }

    public int getDataPointer() {
        return dataPointer;
    }
}
