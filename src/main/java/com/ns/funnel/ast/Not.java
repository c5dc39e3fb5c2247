package com.ns.funnel.ast;

import java.util.Objects;

public final class Not extends Expr {
    private final Expr expr;

    public Not(Expr expr) {
        this.expr = Objects.requireNonNull(expr, "expr is null");
    }

    public Expr getExpr() { return expr; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNot(this, context);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Not && expr.equals(((Not) o).expr));
    }

    @Override
    public int hashCode() {
        return 31 * expr.hashCode() + 3;
    }
}
