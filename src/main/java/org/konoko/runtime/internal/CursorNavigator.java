package org.konoko.runtime.internal;

import org.konoko.compiler.frontend.parser.ProgramTree;
import org.konoko.compiler.frontend.parser.ast.NodeKind;
import org.konoko.compiler.frontend.parser.ast.ProgramNode;

/**
 * The transition function of the execution cursor.
 * <p>
 * Given the current node and the break signal left by the previous step, it returns the
 * node to execute next. Loop re-entry is a plain transition back to the loop node, so
 * no call stack grows with the nesting depth or the number of iterations.
 */
public final class CursorNavigator {

    private CursorNavigator() {}

    /**
     * Computes the next cursor position.
     *
     * @param tree The program being run.
     * @param cursor The current node, or {@code null} if the run has not started.
     * @param breakLoop {@code true} if the previous step was a loop whose condition failed.
     * @return The next node to execute.
     * @throws IllegalStateException if the cursor is already on the end node.
     */
    public static ProgramNode next(ProgramTree tree, ProgramNode cursor, boolean breakLoop) {
        if (cursor == null) {
            return tree.root().children().get(0);
        }
        if (cursor == tree.end()) {
            throw new IllegalStateException("The program has already halted");
        }
        if (cursor.hasChildren() && !breakLoop) {
            return cursor.children().get(0);
        }

        ProgramNode parent = cursor.parent()
                .orElseThrow(() -> new IllegalStateException("The cursor never rests on the root"));
        if (cursor.isLastChild() && parent.kind() == NodeKind.LOOP) {
            return parent;
        }
        // only the end node lacks a next sibling at the top level, and it was handled above
        return cursor.nextSibling()
                .orElseThrow(() -> new IllegalStateException("No node follows " + cursor));
    }
}
