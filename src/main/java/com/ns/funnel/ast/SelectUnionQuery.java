package com.ns.funnel.ast;

import java.util.List;

/**
 * {@code q1 UNION ALL q2 ...}.
 */
public final class SelectUnionQuery extends QueryExpr {
    private final List<QueryExpr> queries;

    public SelectUnionQuery(List<QueryExpr> queries) {
        if (queries.size() < 2) {
            throw new IllegalArgumentException("A union needs at least two queries, got " + queries.size());
        }
        this.queries = List.copyOf(queries);
    }

    /** Returns the single query unchanged, or a union of all of them. */
    public static QueryExpr of(List<? extends QueryExpr> queries) {
        if (queries.size() == 1) {
            return queries.get(0);
        }
        return new SelectUnionQuery(List.copyOf(queries));
    }

    public List<QueryExpr> getQueries() { return queries; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSelectUnionQuery(this, context);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof SelectUnionQuery && queries.equals(((SelectUnionQuery) o).queries));
    }

    @Override
    public int hashCode() {
        return 31 * queries.hashCode() + 8;
    }
}
