package com.ns.funnel.ast;

import java.util.Objects;

public final class OrderExpr extends Node {
    private final Expr expr;
    private final boolean descending;

    public OrderExpr(Expr expr, boolean descending) {
        this.expr = Objects.requireNonNull(expr, "expr is null");
        this.descending = descending;
    }

    public static OrderExpr asc(Expr expr) {
        return new OrderExpr(expr, false);
    }

    public static OrderExpr desc(Expr expr) {
        return new OrderExpr(expr, true);
    }

    public Expr getExpr() { return expr; }
    public boolean isDescending() { return descending; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitOrderExpr(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderExpr)) return false;
        OrderExpr other = (OrderExpr) o;
        return descending == other.descending && expr.equals(other.expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expr, descending);
    }
}
