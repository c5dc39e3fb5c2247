package com.ns.funnel.aggregation;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.JoinExpr;
import com.ns.funnel.ast.OrderExpr;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.model.IntervalUnit;
import com.ns.funnel.query.Columns;
import com.ns.funnel.query.FunnelExprs;
import com.ns.funnel.query.FunnelStepsQueryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversion rate per entrance period. An actor enters in the period of its step-0 event;
 * every period of the date range is present, with zero counts where nobody entered.
 */
public class TrendsQueryBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TrendsQueryBuilder.class);

    public static final String ENTRANCE_PERIOD_START = "entrance_period_start";
    public static final String STEPS_COMPLETED = "steps_completed";
    public static final String REACHED_FROM_STEP_COUNT = "reached_from_step_count";
    public static final String REACHED_TO_STEP_COUNT = "reached_to_step_count";
    public static final String CONVERSION_RATE = "conversion_rate";

    static final String PERIOD_DATA = "period_data";
    private static final String DATA = "data";
    private static final String FILL = "fill";
    private static final String BREAKDOWN_VALUES = "breakdown_values";

    private final QueryContext context;

    public TrendsQueryBuilder(QueryContext context) {
        this.context = context;
    }

    public SelectQuery build() {
        boolean hasBreakdown = context.getBreakdown().isPresent();
        Expr periodMatch = Exprs.eq(Exprs.field(DATA, ENTRANCE_PERIOD_START), Exprs.field(FILL, ENTRANCE_PERIOD_START));

        List<Expr> select = new ArrayList<>();
        select.add(Exprs.alias(ENTRANCE_PERIOD_START, Exprs.field(FILL, ENTRANCE_PERIOD_START)));
        for (String count : List.of(REACHED_FROM_STEP_COUNT, REACHED_TO_STEP_COUNT, CONVERSION_RATE)) {
            select.add(Exprs.alias(count, Exprs.call("ifNull", Exprs.field(DATA, count), Exprs.constant(0))));
        }

        JoinExpr from;
        List<OrderExpr> order = new ArrayList<>();
        order.add(Exprs.asc(FunnelExprs.col(ENTRANCE_PERIOD_START)));
        if (hasBreakdown) {
            SelectQuery values = SelectQuery.builder()
                .distinct(true)
                .select(FunnelExprs.col(Columns.PROP))
                .from(Exprs.field(PERIOD_DATA))
                .build();
            Expr valueMatch = Exprs.eq(Exprs.field(DATA, Columns.PROP), Exprs.field(BREAKDOWN_VALUES, Columns.PROP));
            from = JoinExpr.from(fillQuery(), FILL)
                .then(JoinExpr.join("CROSS JOIN", values, BREAKDOWN_VALUES, null))
                .then(JoinExpr.join("LEFT OUTER JOIN", Exprs.field(PERIOD_DATA), DATA, Exprs.and(periodMatch, valueMatch)));
            select.add(Exprs.alias(Columns.PROP, Exprs.field(BREAKDOWN_VALUES, Columns.PROP)));
            order.add(Exprs.asc(FunnelExprs.col(Columns.PROP)));
        } else {
            from = JoinExpr.from(Exprs.field(PERIOD_DATA), DATA)
                .then(JoinExpr.join("RIGHT OUTER JOIN", fillQuery(), FILL, periodMatch));
        }

        logger.debug("Trends by {} from step {} to step {}", context.getInterval(), context.getFromStep(), context.getToStep());
        return SelectQuery.builder()
            .with(PERIOD_DATA, periodQuery())
            .select(select)
            .from(from)
            .orderBy(order)
            .build();
    }

    /** Actors reaching the from-step and the to-step per entrance period. */
    SelectQuery periodQuery() {
        Expr reachedFrom = FunnelExprs.col(REACHED_FROM_STEP_COUNT);
        Expr reachedTo = FunnelExprs.col(REACHED_TO_STEP_COUNT);
        Expr rate = Exprs.ifElse(Exprs.gt(reachedFrom, Exprs.constant(0)),
            Exprs.call("round", Exprs.multiply(Exprs.divide(reachedTo, reachedFrom), Exprs.constant(100)), Exprs.constant(2)),
            Exprs.constant(0));

        List<Expr> group = new ArrayList<>();
        group.add(FunnelExprs.col(ENTRANCE_PERIOD_START));
        context.getBreakdown().ifPresent(breakdown -> group.add(FunnelExprs.col(Columns.PROP)));

        List<Expr> select = new ArrayList<>(group);
        select.add(Exprs.alias(REACHED_FROM_STEP_COUNT, reachedAtLeast(context.getFromStep())));
        select.add(Exprs.alias(REACHED_TO_STEP_COUNT, reachedAtLeast(context.getToStep())));
        select.add(Exprs.alias(CONVERSION_RATE, rate));

        return SelectQuery.builder()
            .select(select)
            .from(actorPeriodsQuery())
            .groupBy(group)
            .build();
    }

    private static Expr reachedAtLeast(int step) {
        return Exprs.call("countIf", Exprs.gtEq(FunnelExprs.col(STEPS_COMPLETED), Exprs.constant(step + 1)));
    }

    /** {@code aggregation_target, entrance_period_start, steps_completed[, prop]} per actor and period. */
    public SelectQuery actorPeriodsQuery() {
        List<Expr> group = new ArrayList<>();
        group.add(FunnelExprs.col(Columns.AGGREGATION_TARGET));
        group.add(FunnelExprs.col(ENTRANCE_PERIOD_START));
        context.getBreakdown().ifPresent(breakdown -> group.add(FunnelExprs.col(Columns.PROP)));

        List<Expr> select = new ArrayList<>();
        select.add(FunnelExprs.col(Columns.AGGREGATION_TARGET));
        select.add(Exprs.alias(ENTRANCE_PERIOD_START, startOfPeriod(FunnelExprs.col(Columns.TIMESTAMP))));
        select.add(Exprs.alias(STEPS_COMPLETED, Exprs.call("max", FunnelExprs.col(Columns.STEPS))));
        context.getBreakdown().ifPresent(breakdown -> select.add(FunnelExprs.col(Columns.PROP)));

        return SelectQuery.builder()
            .select(select)
            .from(new FunnelStepsQueryBuilder(context).build())
            .groupBy(group)
            .build();
    }

    /** Every period start from the start of the date range to its end. */
    SelectQuery fillQuery() {
        IntervalUnit interval = context.getInterval();
        Expr start = startOfPeriod(context.getDateRange().fromExpr());
        Expr end = startOfPeriod(context.getDateRange().toExpr());
        Expr periods = Exprs.plus(Exprs.call("dateDiff", Exprs.constant(interval.getDateDiffUnit()), start, end), Exprs.constant(1));
        return SelectQuery.builder()
            .select(Exprs.alias(ENTRANCE_PERIOD_START,
                Exprs.plus(start, Exprs.call(interval.getIntervalFunction(), FunnelExprs.col("number")))))
            .from(Exprs.call("numbers", periods))
            .build();
    }

    public Expr startOfPeriod(Expr timestamp) {
        IntervalUnit interval = context.getInterval();
        if (interval == IntervalUnit.WEEK) {
            return Exprs.call(interval.getStartOfFunction(), timestamp, Exprs.constant(IntervalUnit.weekMode(context.getWeekStartDay())));
        }
        return Exprs.call(interval.getStartOfFunction(), timestamp);
    }
}
