package org.konoko.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A node of the program tree.
 * <p>
 * Nodes are created through {@link #newRoot()} and {@link #addChild(NodeKind)} while the
 * tree is built, and become read-only once {@link #freeze()} has been called on the root.
 * Each node remembers its parent and its index among its siblings, so that the tree can
 * be walked in both directions without a call stack.
 */
public final class ProgramNode {

    private final NodeKind kind;
    private final ProgramNode parent;
    private final int index;
    private List<ProgramNode> children;
    private boolean frozen;

    private ProgramNode(NodeKind kind, ProgramNode parent, int index) {
        this.kind = kind;
        this.parent = parent;
        this.index = index;
        this.children = kind.isLeaf() ? Collections.emptyList() : new ArrayList<>();
    }

    /**
     * Creates the root of a new tree.
     * @return A root node without children.
     */
    public static ProgramNode newRoot() {
        return new ProgramNode(NodeKind.ROOT, null, -1);
    }

    /**
     * Appends a new child to this node.
     *
     * @param childKind The kind of the new child; must not be {@link NodeKind#ROOT}.
     * @return The new child.
     * @throws IllegalStateException if the tree is frozen or this node cannot have children.
     */
    public ProgramNode addChild(NodeKind childKind) {
        if (frozen) {
            throw new IllegalStateException("Program tree is frozen");
        }
        if (kind.isLeaf()) {
            throw new IllegalStateException(kind + " nodes cannot have children");
        }
        if (childKind == NodeKind.ROOT) {
            throw new IllegalArgumentException("A tree has exactly one root");
        }
        ProgramNode child = new ProgramNode(childKind, this, children.size());
        children.add(child);
        return child;
    }

    /**
     * Makes this node and its whole subtree read-only.
     */
    public void freeze() {
        if (frozen) {
            return;
        }
        frozen = true;
        if (!kind.isLeaf()) {
            children = Collections.unmodifiableList(children);
        }
        for (ProgramNode child : children) {
            child.freeze();
        }
    }

    public NodeKind kind() {
        return kind;
    }

    /**
     * @return The parent, or empty for the root.
     */
    public Optional<ProgramNode> parent() {
        return Optional.ofNullable(parent);
    }

    /**
     * @return The position of this node among its parent's children, or -1 for the root.
     */
    public int index() {
        return index;
    }

    public List<ProgramNode> children() {
        return children;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * @return {@code true} if this node is the last child of its parent.
     */
    public boolean isLastChild() {
        return parent != null && index == parent.children.size() - 1;
    }

    /**
     * @return The sibling directly after this node, or empty if this is the last child or the root.
     */
    public Optional<ProgramNode> nextSibling() {
        if (parent == null || isLastChild()) {
            return Optional.empty();
        }
        return Optional.of(parent.children.get(index + 1));
    }

    @Override
    public String toString() {
        return kind + (hasChildren() ? "(" + children.size() + ")" : "");
    }
}
