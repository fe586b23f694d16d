package com.thingtalk.ast;

/**
 * Base class for all nodes of the ThingTalk abstract syntax tree.
 *
 * <p>Every node carries an optional source location (null for nodes that
 * were synthesized rather than parsed, and for interned singletons), can be
 * deep-copied with {@link #clone()}, can be printed back to surface syntax
 * with {@link #toSource()}, and supports double-dispatch traversal through
 * {@link #visit(NodeVisitor)}.
 *
 * <p>Traversal protocol: a node calls {@link NodeVisitor#enter(Node)}, then
 * its variant-specific {@code visitXxx} method; if that returns true the node
 * visits its children in order; finally it calls {@link NodeVisitor#exit(Node)}.
 *
 * <p>Structural equality ({@code equals}) ignores source locations.
 */
public abstract class Node {

    /** Source location, or null for synthesized nodes */
    protected final SourceRange location;

    /**
     * Creates a node.
     *
     * @param location the source location, or null
     */
    protected Node(SourceRange location) {
        this.location = location;
    }

    /**
     * Returns the source location of this node.
     *
     * @return the location, or null if the node was synthesized
     */
    public SourceRange location() {
        return location;
    }

    /**
     * Traverses this node and its children with the given visitor.
     *
     * @param visitor the visitor
     */
    public abstract void visit(NodeVisitor visitor);

    /**
     * Returns a deep copy of this node that shares no mutable state with it.
     *
     * <p>Interned singletons return themselves.
     *
     * @return the copy
     */
    @Override
    public abstract Node clone();

    /**
     * Prints this node in ThingTalk surface syntax.
     *
     * @return the source text
     */
    public abstract String toSource();

    /**
     * Returns a debugging representation of this node.
     *
     * @return a string representation
     */
    @Override
    public abstract String toString();
}
