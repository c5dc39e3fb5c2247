package com.ns.funnel.ast;

import java.util.List;

public final class ArrayExpr extends Expr {
    private final List<Expr> elements;

    public ArrayExpr(List<Expr> elements) {
        this.elements = List.copyOf(elements);
    }

    public List<Expr> getElements() { return elements; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArray(this, context);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ArrayExpr && elements.equals(((ArrayExpr) o).elements));
    }

    @Override
    public int hashCode() {
        return 31 * elements.hashCode() + 4;
    }
}
