package org.konoko.runtime.model;

import org.konoko.compiler.frontend.parser.ast.ProgramNode;
import org.konoko.runtime.TapeAccessException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The complete mutable state of one program run: tape, data pointer, cursor,
 * pending loop break and output log.
 * <p>
 * Cells are signed 64-bit values. The data pointer itself is unconstrained; only cell
 * access checks the tape bounds.
 */
public class MachineState {

    private final long[] tape;
    private final List<Long> outputLog = new ArrayList<>();
    private int dataPointer;
    private ProgramNode cursor;
    private boolean breakLoop;
    private long steps;

    /**
     * Creates a zeroed state.
     * @param tapeSize The number of cells.
     */
    public MachineState(int tapeSize) {
        this.tape = new long[tapeSize];
    }

    public int getTapeSize() {
        return tape.length;
    }

    public int getDataPointer() {
        return dataPointer;
    }

    public void setDataPointer(int dataPointer) {
        this.dataPointer = dataPointer;
    }

    /**
     * @return The value of the cell under the data pointer.
     * @throws TapeAccessException if the pointer is outside the tape.
     */
    public long getCell() {
        checkBounds();
        return tape[dataPointer];
    }

    /**
     * @param value The new value of the cell under the data pointer.
     * @throws TapeAccessException if the pointer is outside the tape.
     */
    public void setCell(long value) {
        checkBounds();
        tape[dataPointer] = value;
    }

    private void checkBounds() {
        if (dataPointer < 0 || dataPointer >= tape.length) {
            throw new TapeAccessException(dataPointer, tape.length);
        }
    }

    /**
     * @return A copy of the tape.
     */
    public long[] getTape() {
        return tape.clone();
    }

    /**
     * @return The current node, or {@code null} before the first step.
     */
    public ProgramNode getCursor() {
        return cursor;
    }

    public void setCursor(ProgramNode cursor) {
        this.cursor = cursor;
    }

    public boolean isBreakLoop() {
        return breakLoop;
    }

    public void setBreakLoop(boolean breakLoop) {
        this.breakLoop = breakLoop;
    }

    /**
     * Records a value written by an output instruction.
     * @param value The written cell value.
     */
    public void appendOutput(long value) {
        outputLog.add(value);
    }

    /**
     * @return An unmodifiable view of every value output so far, in order.
     */
    public List<Long> getOutputLog() {
        return Collections.unmodifiableList(outputLog);
    }

    public long getSteps() {
        return steps;
    }

    public void countStep() {
        steps++;
    }

    @Override
    public String toString() {
        return "MachineState{dp=" + dataPointer + ", tape=" + Arrays.toString(tape) + ", output=" + outputLog + "}";
    }
}
