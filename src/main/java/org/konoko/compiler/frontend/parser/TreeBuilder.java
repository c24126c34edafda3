package org.konoko.compiler.frontend.parser;

import org.konoko.compiler.api.StructuralException;
import org.konoko.compiler.frontend.parser.ast.NodeKind;
import org.konoko.compiler.frontend.parser.ast.ProgramNode;
import org.konoko.compiler.isa.Instruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Turns a flat instruction sequence into a {@link ProgramTree} in a single pass.
 * <p>
 * A stack of insertion parents tracks the open loops: {@link Instruction#LOOP_START}
 * pushes a new loop node, {@link Instruction#LOOP_END} pops it, and every other
 * instruction becomes a leaf of the current top.
 */
public final class TreeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(TreeBuilder.class);

    private TreeBuilder() {}

    /**
     * Builds the tree for a program.
     *
     * @param instructions The instruction sequence.
     * @return The frozen program tree.
     * @throws StructuralException if a loop end has no open loop, or a loop is never closed.
     */
    public static ProgramTree build(List<Instruction> instructions) throws StructuralException {
        ProgramNode root = ProgramNode.newRoot();
        Deque<ProgramNode> parents = new ArrayDeque<>();
        Deque<Integer> openedAt = new ArrayDeque<>();
        parents.push(root);

        for (int i = 0; i < instructions.size(); i++) {
            Instruction instruction = instructions.get(i);
            switch (instruction) {
                case LOOP_START -> {
                    parents.push(parents.peek().addChild(NodeKind.LOOP));
                    openedAt.push(i);
                }
                case LOOP_END -> {
                    if (parents.size() == 1) {
                        throw new StructuralException("Unmatched loop end at instruction " + i);
                    }
                    parents.pop();
                    openedAt.pop();
                }
                default -> parents.peek().addChild(NodeKind.leafFor(instruction));
            }
        }

        if (parents.size() > 1) {
            throw new StructuralException(String.format("Unclosed loop: %d loop(s) still open, innermost opened at instruction %d",
                    parents.size() - 1, openedAt.peek()));
        }

        root.addChild(NodeKind.END);
        ProgramTree tree = new ProgramTree(root);
        LOG.debug("Built program tree: {} nodes, {} loops, depth {}", tree.nodeCount(), tree.loopCount(), tree.maxDepth());
        return tree;
    }
}
