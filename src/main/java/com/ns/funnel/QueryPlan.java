package com.ns.funnel;

import com.ns.funnel.ast.QueryPrinter;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.context.QueryContext;

import java.util.Objects;

/**
 * A compiled funnel: the query tree and the context it was built from. Compiling the same
 * spec again yields an equal plan.
 */
public final class QueryPlan {
    public enum Kind {
        STEPS,
        TRENDS,
        TIME_TO_CONVERT,
        CORRELATION,
        BREAKDOWN_VALUES
    }

    private final Kind kind;
    private final SelectQuery query;
    private final QueryContext context;

    public QueryPlan(Kind kind, SelectQuery query, QueryContext context) {
        this.kind = Objects.requireNonNull(kind, "kind is null");
        this.query = Objects.requireNonNull(query, "query is null");
        this.context = Objects.requireNonNull(context, "context is null");
    }

    public Kind getKind() { return kind; }
    public SelectQuery getQuery() { return query; }
    public QueryContext getContext() { return context; }

    public String toSql() {
        return QueryPrinter.print(query);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryPlan)) return false;
        QueryPlan that = (QueryPlan) o;
        return kind == that.kind && query.equals(that.query) && context.getSpec().equals(that.context.getSpec());
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, query);
    }

    @Override
    public String toString() {
        return "QueryPlan{" + kind + ", " + toSql() + "}";
    }
}
