package com.ns.funnel.ast;

/**
 * Root of the typed query tree. Every node is immutable and compares structurally,
 * so two compilations of the same funnel produce equal trees.
 */
public abstract class Node {

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);

    @Override
    public String toString() {
        return QueryPrinter.print(this);
    }
}
