package com.ns.funnel.ast;

import java.util.List;

public final class And extends Expr {
    private final List<Expr> exprs;

    public And(List<Expr> exprs) {
        this.exprs = List.copyOf(exprs);
    }

    public List<Expr> getExprs() { return exprs; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAnd(this, context);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof And && exprs.equals(((And) o).exprs));
    }

    @Override
    public int hashCode() {
        return 31 * exprs.hashCode() + 1;
    }
}
