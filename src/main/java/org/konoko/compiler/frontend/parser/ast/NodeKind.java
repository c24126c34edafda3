package org.konoko.compiler.frontend.parser.ast;

import org.konoko.compiler.isa.Instruction;

/**
 * The closed set of node kinds that can appear in a {@link ProgramNode} tree.
 */
public enum NodeKind {
    /** The single root of every tree. */
    ROOT,
    /** The synthetic last child of the root; reaching it ends the program. */
    END,
    /** A loop; its children are the loop body. */
    LOOP,
    MOVE_RIGHT,
    MOVE_LEFT,
    INCREMENT,
    DECREMENT,
    OUTPUT,
    INPUT;

    /**
     * Returns the leaf kind for a non-loop instruction.
     *
     * @param instruction Any instruction other than a loop marker.
     * @return The matching leaf kind.
     * @throws IllegalArgumentException for {@link Instruction#LOOP_START} and {@link Instruction#LOOP_END},
     *         which become {@link #LOOP} nodes instead of leaves.
     */
    public static NodeKind leafFor(Instruction instruction) {
        return switch (instruction) {
            case MOVE_RIGHT -> MOVE_RIGHT;
            case MOVE_LEFT -> MOVE_LEFT;
            case INCREMENT -> INCREMENT;
            case DECREMENT -> DECREMENT;
            case OUTPUT -> OUTPUT;
            case INPUT -> INPUT;
            case LOOP_START, LOOP_END -> throw new IllegalArgumentException("Loop markers have no leaf kind: " + instruction);
        };
    }

    /**
     * @return {@code true} if nodes of this kind never have children.
     */
    public boolean isLeaf() {
        return this != ROOT && this != LOOP;
    }
}
