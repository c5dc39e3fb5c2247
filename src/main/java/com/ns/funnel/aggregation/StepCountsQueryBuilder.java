package com.ns.funnel.aggregation;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.OrderExpr;
import com.ns.funnel.ast.QueryExpr;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.ast.WindowFunction;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.query.Columns;
import com.ns.funnel.query.FunnelExprs;
import com.ns.funnel.query.FunnelStepsQueryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Counts actors per number of steps reached. Each actor is counted once, at the furthest
 * step any of its step-0 candidates reached, with its conversion times averaged over the
 * candidates that reached that far.
 */
public class StepCountsQueryBuilder {
    private static final Logger logger = LoggerFactory.getLogger(StepCountsQueryBuilder.class);

    private final QueryContext context;

    public StepCountsQueryBuilder(QueryContext context) {
        this.context = context;
    }

    /** {@code step_i}, {@code step_i_average_conversion_time}, {@code step_i_median_conversion_time} per breakdown value. */
    public SelectQuery build() {
        int maxSteps = context.getMaxSteps();
        List<Expr> select = new ArrayList<>();
        for (int i = 0; i < maxSteps; i++) {
            select.add(Exprs.alias(Columns.step(i + 1),
                Exprs.call("countIf", Exprs.eq(FunnelExprs.col(Columns.STEPS), Exprs.constant(i + 1)))));
        }
        for (int i = 1; i < maxSteps; i++) {
            select.add(Exprs.alias(Columns.averageConversionTime(i),
                Exprs.call("avg", FunnelExprs.col(Columns.inner(Columns.averageConversionTime(i))))));
        }
        for (int i = 1; i < maxSteps; i++) {
            select.add(Exprs.alias(Columns.medianConversionTime(i),
                Exprs.call("median", FunnelExprs.col(Columns.inner(Columns.medianConversionTime(i))))));
        }

        SelectQuery.Builder query = SelectQuery.builder()
            .select(select)
            .from(actorStepsQuery(false, false));
        List<OrderExpr> order = new ArrayList<>();
        order.add(Exprs.desc(FunnelExprs.col(Columns.step(1))));
        if (context.getBreakdown().isPresent()) {
            query.select(FunnelExprs.col(Columns.PROP)).groupBy(FunnelExprs.col(Columns.PROP));
            order.add(Exprs.asc(FunnelExprs.col(Columns.PROP)));
        }
        logger.debug("Step counts over {} steps", maxSteps);
        return query.orderBy(order).build();
    }

    /**
     * One row per actor (and breakdown value) at the furthest step it reached.
     *
     * @param withTimestamps add {@code first_timestamp} and {@code final_timestamp}
     * @param withMatchingEvents add {@code step_i_matching_events} and {@code final_matching_events}
     */
    public SelectQuery actorStepsQuery(boolean withTimestamps, boolean withMatchingEvents) {
        int maxSteps = context.getMaxSteps();
        List<Expr> group = new ArrayList<>();
        group.add(FunnelExprs.col(Columns.AGGREGATION_TARGET));
        group.add(FunnelExprs.col(Columns.STEPS));
        if (context.getBreakdown().isPresent()) {
            group.add(FunnelExprs.col(Columns.PROP));
        }

        List<Expr> select = new ArrayList<>(group);
        for (int i = 1; i < maxSteps; i++) {
            select.add(Exprs.alias(Columns.inner(Columns.averageConversionTime(i)),
                Exprs.call("avg", FunnelExprs.col(Columns.conversionTime(i)))));
        }
        for (int i = 1; i < maxSteps; i++) {
            select.add(Exprs.alias(Columns.inner(Columns.medianConversionTime(i)),
                Exprs.call("median", FunnelExprs.col(Columns.conversionTime(i)))));
        }
        if (withTimestamps) {
            select.add(Exprs.alias(Columns.FIRST_TIMESTAMP,
                Exprs.call("argMax", FunnelExprs.col(Columns.latest(0)), FunnelExprs.col(Columns.STEPS))));
            select.add(Exprs.alias(Columns.FINAL_TIMESTAMP,
                Exprs.call("argMax", FunnelExprs.col(Columns.latest(context.getToStep())), FunnelExprs.col(Columns.STEPS))));
        }
        if (withMatchingEvents) {
            List<Expr> limit = List.of(Exprs.constant(context.getConfig().getMatchingEventsLimit()));
            for (int i = 0; i < maxSteps; i++) {
                select.add(Exprs.alias(Columns.matchingEvents(i),
                    Exprs.parametric("groupArray", limit, List.of(FunnelExprs.col(Columns.matchingEvent(i))))));
            }
            select.add(Exprs.alias(Columns.FINAL_MATCHING_EVENTS,
                Exprs.parametric("groupArray", limit, List.of(FunnelExprs.col(Columns.FINAL_MATCHING_EVENT)))));
        }

        return SelectQuery.builder()
            .select(select)
            .from(candidateRows(withTimestamps, withMatchingEvents))
            .groupBy(group)
            .having(Exprs.eq(FunnelExprs.col(Columns.STEPS), Exprs.call("max", FunnelExprs.col(Columns.MAX_STEPS))))
            .build();
    }

    /** Step-0 candidates with the furthest step of their actor alongside. */
    private SelectQuery candidateRows(boolean withTimestamps, boolean withMatchingEvents) {
        int maxSteps = context.getMaxSteps();
        List<Expr> select = new ArrayList<>();
        select.add(FunnelExprs.col(Columns.AGGREGATION_TARGET));
        select.add(FunnelExprs.col(Columns.STEPS));
        if (context.getBreakdown().isPresent()) {
            select.add(FunnelExprs.col(Columns.PROP));
        }
        select.add(Exprs.alias(Columns.MAX_STEPS, new WindowFunction("max",
            List.of(FunnelExprs.col(Columns.STEPS)), FunnelExprs.actorPartition(context), List.of(), null)));
        for (int i = 1; i < maxSteps; i++) {
            select.add(FunnelExprs.col(Columns.conversionTime(i)));
        }
        if (withTimestamps) {
            select.add(FunnelExprs.col(Columns.latest(0)));
            if (context.getToStep() != 0) {
                select.add(FunnelExprs.col(Columns.latest(context.getToStep())));
            }
        }
        if (withMatchingEvents) {
            for (int i = 0; i < maxSteps; i++) {
                select.add(FunnelExprs.col(Columns.matchingEvent(i)));
            }
            select.add(FunnelExprs.col(Columns.FINAL_MATCHING_EVENT));
        }
        return SelectQuery.builder()
            .select(select)
            .from(stepsSource(withMatchingEvents))
            .build();
    }

    private QueryExpr stepsSource(boolean withMatchingEvents) {
        if (context.isSinglePass()) {
            return new AggregateFunnelQueryBuilder(context).build();
        }
        return new FunnelStepsQueryBuilder(context).build(withMatchingEvents);
    }
}
