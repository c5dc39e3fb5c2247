package com.ns.funnel.ast;

import java.util.Objects;

public final class Exists extends Expr {
    private final QueryExpr subquery;

    public Exists(QueryExpr subquery) {
        this.subquery = Objects.requireNonNull(subquery, "subquery is null");
    }

    public QueryExpr getSubquery() { return subquery; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExists(this, context);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Exists && subquery.equals(((Exists) o).subquery));
    }

    @Override
    public int hashCode() {
        return 31 * subquery.hashCode() + 7;
    }
}
