package com.ns.funnel.order;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.QueryExpr;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.context.ResolvedExclusion;
import com.ns.funnel.context.ResolvedStep;
import com.ns.funnel.model.OrderType;

import java.util.List;

/**
 * How steps must follow each other. An implementation turns the events row set into
 * rows carrying, for each step-0 candidate, the time every later step was reached.
 */
public interface FunnelOrderStrategy {

    OrderType getOrderType();

    /** The step orders to evaluate. Plans for several orders are combined with UNION ALL. */
    List<List<ResolvedStep>> arrangements(QueryContext context);

    /** Whether events that match no step must still reach the windowing. */
    boolean requiresAllEvents();

    /** Carries {@code latest_i} forward over the actor's later rows. */
    SelectQuery buildWindowedQuery(QueryContext context, QueryExpr eventQuery, boolean withEventFields);

    /** Columns the steps and conversion expressions below refer to. */
    List<Expr> helperColumns(QueryContext context);

    /** Number of steps the row reached, before exclusions. */
    Expr stepsReached(QueryContext context);

    /** Time the exclusion range closes, NULL when its end step was not reached. */
    Expr exclusionRangeEnd(QueryContext context, ResolvedExclusion exclusion);

    /** {@code step_i_conversion_time} for every step after the first. */
    List<Expr> conversionTimes(QueryContext context);
}
