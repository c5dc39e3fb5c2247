package com.ns.funnel.ast;

import java.util.List;

public final class Or extends Expr {
    private final List<Expr> exprs;

    public Or(List<Expr> exprs) {
        this.exprs = List.copyOf(exprs);
    }

    public List<Expr> getExprs() { return exprs; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitOr(this, context);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Or && exprs.equals(((Or) o).exprs));
    }

    @Override
    public int hashCode() {
        return 31 * exprs.hashCode() + 2;
    }
}
