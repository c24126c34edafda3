package org.konoko.runtime.io;

import java.io.IOException;

/**
 * The source of values for input instructions.
 */
public interface IInputProvider {

    /**
     * Reads the next integer, blocking until one is available.
     *
     * @return The value.
     * @throws IOException if the underlying source fails.
     * @throws org.konoko.runtime.InputExhaustedException if the source has ended.
     * @throws org.konoko.runtime.CellOverflowException if the value does not fit in a cell.
     */
    long readLong() throws IOException;
}
