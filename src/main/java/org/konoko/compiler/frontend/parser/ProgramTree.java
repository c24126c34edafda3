package org.konoko.compiler.frontend.parser;

import org.konoko.compiler.frontend.parser.ast.NodeKind;
import org.konoko.compiler.frontend.parser.ast.ProgramNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * A frozen program tree produced by the {@link TreeBuilder}.
 * <p>
 * The root owns the top-level statements followed by the single {@link NodeKind#END} node.
 */
public final class ProgramTree {

    private final ProgramNode root;
    private final ProgramNode end;
    private final int nodeCount;
    private final int loopCount;
    private final int maxDepth;

    ProgramTree(ProgramNode root) {
        List<ProgramNode> top = root.children();
        if (top.isEmpty() || top.get(top.size() - 1).kind() != NodeKind.END) {
            throw new IllegalArgumentException("The last child of the root must be the END node");
        }
        root.freeze();
        this.root = root;
        this.end = top.get(top.size() - 1);

        int nodes = 0;
        int loops = 0;
        int depth = 0;
        Deque<ProgramNode> pending = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        pending.push(root);
        depths.push(0);
        while (!pending.isEmpty()) {
            ProgramNode node = pending.pop();
            int nodeDepth = depths.pop();
            nodes++;
            if (node.kind() == NodeKind.LOOP) {
                loops++;
            }
            depth = Math.max(depth, nodeDepth);
            for (ProgramNode child : node.children()) {
                pending.push(child);
                depths.push(nodeDepth + 1);
            }
        }
        this.nodeCount = nodes;
        this.loopCount = loops;
        this.maxDepth = depth;
    }

    public ProgramNode root() {
        return root;
    }

    public ProgramNode end() {
        return end;
    }

    /**
     * @return The number of nodes including root and end.
     */
    public int nodeCount() {
        return nodeCount;
    }

    public int loopCount() {
        return loopCount;
    }

    /**
     * @return The depth of the deepest node; top-level statements have depth 1.
     */
    public int maxDepth() {
        return maxDepth;
    }

    /**
     * Renders the tree as indented text, one node per line.
     * @return The rendering.
     */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        Deque<ProgramNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            ProgramNode node = pending.pop();
            int depth = 0;
            for (ProgramNode p = node.parent().orElse(null); p != null; p = p.parent().orElse(null)) {
                depth++;
            }
            sb.append("  ".repeat(depth)).append(node.kind()).append('\n');
            List<ProgramNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return sb.toString();
    }
}
