package com.ns.funnel.ast;

import java.util.Objects;

public final class Alias extends Expr {
    private final String alias;
    private final Expr expr;

    public Alias(String alias, Expr expr) {
        this.alias = Objects.requireNonNull(alias, "alias is null");
        this.expr = Objects.requireNonNull(expr, "expr is null");
    }

    public String getAlias() { return alias; }
    public Expr getExpr() { return expr; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAlias(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Alias)) return false;
        Alias other = (Alias) o;
        return alias.equals(other.alias) && expr.equals(other.expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alias, expr);
    }
}
