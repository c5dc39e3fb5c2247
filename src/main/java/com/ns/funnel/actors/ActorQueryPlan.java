package com.ns.funnel.actors;

import com.ns.funnel.ast.QueryPrinter;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.context.QueryContext;

import java.util.Objects;

/**
 * The actors of one funnel step, period or breakdown value: {@code actor_id} and, when
 * recordings were requested, {@code matching_events}.
 */
public final class ActorQueryPlan {
    private final SelectQuery query;
    private final ActorTarget target;
    private final QueryContext context;

    public ActorQueryPlan(SelectQuery query, ActorTarget target, QueryContext context) {
        this.query = Objects.requireNonNull(query, "query is null");
        this.target = Objects.requireNonNull(target, "target is null");
        this.context = Objects.requireNonNull(context, "context is null");
    }

    public SelectQuery getQuery() { return query; }
    public ActorTarget getTarget() { return target; }
    public QueryContext getContext() { return context; }

    public String toSql() {
        return QueryPrinter.print(query);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActorQueryPlan)) return false;
        ActorQueryPlan that = (ActorQueryPlan) o;
        return query.equals(that.query) && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, target);
    }

    @Override
    public String toString() {
        return "ActorQueryPlan{" + target + ", " + toSql() + "}";
    }
}
