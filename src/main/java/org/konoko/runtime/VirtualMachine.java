package org.konoko.runtime;

import org.konoko.compiler.frontend.parser.ProgramTree;
import org.konoko.compiler.frontend.parser.ast.ProgramNode;
import org.konoko.runtime.internal.CursorNavigator;
import org.konoko.runtime.io.IInputProvider;
import org.konoko.runtime.io.IOutputSink;
import org.konoko.runtime.model.MachineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * The execution engine. Walks a {@link ProgramTree} with an explicit cursor and
 * applies each node to its {@link MachineState}.
 * <p>
 * Every step first moves the cursor with {@link CursorNavigator#next} using the break
 * signal of the previous step, then executes the node under the cursor, which yields
 * the break signal for the next step. The run is over once the cursor reaches the
 * end node. Not thread-safe; one instance runs one program once.
 */
public class VirtualMachine {

    private static final Logger LOG = LoggerFactory.getLogger(VirtualMachine.class);

    private final ProgramTree program;
    private final MachineOptions options;
    private final IInputProvider input;
    private final IOutputSink output;
    private final MachineState state;

    /**
     * Creates a machine for one run of a program.
     *
     * @param program The program to run.
     * @param options Tape size and behaviour switches.
     * @param input The source of input values.
     * @param output The destination of output characters.
     */
    public VirtualMachine(ProgramTree program, MachineOptions options, IInputProvider input, IOutputSink output) {
        this.program = program;
        this.options = options;
        this.input = input;
        this.output = output;
        this.state = new MachineState(options.tapeSize());
    }

    /**
     * @return {@code false} exactly when the cursor has reached the end node.
     */
    public boolean hasStatements() {
        return state.getCursor() != program.end();
    }

    /**
     * Moves the cursor and executes the node it lands on.
     *
     * @throws IOException if reading input fails.
     * @throws MachineException if the program faults.
     * @throws IllegalStateException if the program has already halted.
     */
    public void step() throws IOException {
        ProgramNode next = CursorNavigator.next(program, state.getCursor(), state.isBreakLoop());
        state.setCursor(next);
        state.countStep();
        if (options.maxSteps() > 0 && state.getSteps() > options.maxSteps()) {
            throw new StepLimitExceededException(options.maxSteps());
        }
        state.setBreakLoop(execute(next));
        if (LOG.isTraceEnabled()) {
            LOG.trace("step {}: {} dp={} break={}", state.getSteps(), next.kind(), state.getDataPointer(), state.isBreakLoop());
        }
    }

    /**
     * Runs the program until it halts.
     *
     * @return The final state.
     * @throws IOException if reading input fails.
     * @throws MachineException if the program faults.
     */
    public MachineState run() throws IOException {
        LOG.debug("Starting run: {} nodes, tape size {}", program.nodeCount(), state.getTapeSize());
        while (hasStatements()) {
            step();
        }
        LOG.debug("Program halted after {} steps, {} values output", state.getSteps(), state.getOutputLog().size());
        return state;
    }

    /**
     * Applies one node to the state.
     *
     * @return The break signal: {@code true} only for a loop whose current cell is zero.
     */
    private boolean execute(ProgramNode node) throws IOException {
        switch (node.kind()) {
            case MOVE_RIGHT -> state.setDataPointer(Math.floorMod(state.getDataPointer() + 1, state.getTapeSize()));
            case MOVE_LEFT -> {
                int moved = state.getDataPointer() - 1;
                state.setDataPointer(options.symmetricWraparound() ? Math.floorMod(moved, state.getTapeSize()) : moved);
            }
            case INCREMENT -> state.setCell(adjustCell(1));
            case DECREMENT -> state.setCell(adjustCell(-1));
            case OUTPUT -> {
                long value = state.getCell();
                state.appendOutput(value);
                output.write(value);
            }
            case INPUT -> state.setCell(input.readLong());
            case LOOP -> {
                return state.getCell() == 0;
            }
            case ROOT, END -> {
                // no effect
            }
        }
        return false;
    }

    private long adjustCell(long delta) {
        try {
            return Math.addExact(state.getCell(), delta);
        } catch (ArithmeticException e) {
            throw new CellOverflowException("Cell " + state.getDataPointer() + " overflowed the 64-bit range", e);
        }
    }

    public MachineState getState() {
        return state;
    }
}
