package com.ns.funnel.query;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.QueryExpr;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.ast.SelectUnionQuery;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.context.ResolvedStep;
import com.ns.funnel.order.FunnelOrderStrategy;
import com.ns.funnel.order.OrderStrategies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Composes the event query, the order strategy's windowing and the exclusion rules into
 * one row per step-0 candidate with {@code steps}, the {@code latest_i} times and the
 * per-step conversion times. Unordered funnels yield a UNION ALL of their rotations.
 */
public class FunnelStepsQueryBuilder {
    private static final Logger logger = LoggerFactory.getLogger(FunnelStepsQueryBuilder.class);

    private final QueryContext context;
    private final FunnelOrderStrategy strategy;

    public FunnelStepsQueryBuilder(QueryContext context) {
        this(context, OrderStrategies.forOrder(context.getOrderType()));
    }

    public FunnelStepsQueryBuilder(QueryContext context, FunnelOrderStrategy strategy) {
        this.context = context;
        this.strategy = strategy;
    }

    public FunnelOrderStrategy getStrategy() {
        return strategy;
    }

    public QueryExpr build() {
        return build(false);
    }

    /**
     * @param withMatchingEvents carry {@code step_i_matching_event} tuples for the actor drill-down
     */
    public QueryExpr build(boolean withMatchingEvents) {
        List<List<ResolvedStep>> arrangements = strategy.arrangements(context);
        List<QueryExpr> plans = new ArrayList<>(arrangements.size());
        for (List<ResolvedStep> arrangement : arrangements) {
            plans.add(buildArrangement(arrangement, withMatchingEvents));
        }
        logger.debug("Built {} steps plan with {} arrangements", strategy.getOrderType(), plans.size());
        return SelectUnionQuery.of(plans);
    }

    private SelectQuery buildArrangement(List<ResolvedStep> arrangement, boolean withMatchingEvents) {
        QueryExpr events = new FunnelEventQueryBuilder(context)
            .build(arrangement, strategy.requiresAllEvents(), withMatchingEvents);
        SelectQuery windowed = strategy.buildWindowedQuery(context, events, withMatchingEvents);

        ExclusionConditionBuilder exclusions = new ExclusionConditionBuilder(context);
        SelectQuery.Builder query = SelectQuery.builder()
            .select(Exprs.star())
            .select(strategy.helperColumns(context));
        if (exclusions.hasExclusions()) {
            query.select(exclusions.flagColumns(exclusion -> strategy.exclusionRangeEnd(context, exclusion)));
            query.select(exclusions.totalColumn());
        }
        query.select(Exprs.alias(Columns.STEPS, exclusions.capSteps(strategy.stepsReached(context))));
        query.select(strategy.conversionTimes(context));
        if (withMatchingEvents) {
            query.select(matchingEventColumns());
        }
        return query
            .from(windowed)
            .where(FunnelExprs.stepMatched(0))
            .build();
    }

    /**
     * {@code tuple(latest_i, uuid_i, $session_id_i, $window_id_i) AS step_i_matching_event},
     * and the event of the last step reached as {@code final_matching_event}.
     */
    private List<Expr> matchingEventColumns() {
        List<String> fields = new StepColumnBuilder(context).eventFieldNames();
        List<Expr> columns = new ArrayList<>();
        for (int i = 0; i < context.getMaxSteps(); i++) {
            List<Expr> elements = new ArrayList<>();
            elements.add(FunnelExprs.col(Columns.latest(i)));
            for (String field : fields) {
                elements.add(FunnelExprs.col(Columns.stepField(field, i)));
            }
            columns.add(Exprs.alias(Columns.matchingEvent(i), Exprs.tuple(elements.toArray(new Expr[0]))));
        }
        Expr finalEvent = Exprs.NULL;
        for (int i = 0; i < context.getMaxSteps(); i++) {
            Expr reached = Exprs.eq(FunnelExprs.col(Columns.STEPS), Exprs.constant(i + 1));
            finalEvent = Exprs.ifElse(reached, FunnelExprs.col(Columns.matchingEvent(i)), finalEvent);
        }
        columns.add(Exprs.alias(Columns.FINAL_MATCHING_EVENT, finalEvent));
        return columns;
    }
}
