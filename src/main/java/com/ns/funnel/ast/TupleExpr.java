package com.ns.funnel.ast;

import java.util.List;

public final class TupleExpr extends Expr {
    private final List<Expr> elements;

    public TupleExpr(List<Expr> elements) {
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("Tuple needs at least one element");
        }
        this.elements = List.copyOf(elements);
    }

    public List<Expr> getElements() { return elements; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTuple(this, context);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof TupleExpr && elements.equals(((TupleExpr) o).elements));
    }

    @Override
    public int hashCode() {
        return 31 * elements.hashCode() + 5;
    }
}
