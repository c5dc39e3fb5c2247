package com.ns.funnel.order;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.QueryExpr;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.ast.WindowFrame;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.context.ResolvedExclusion;
import com.ns.funnel.query.BreakdownAttributionBuilder;
import com.ns.funnel.query.Columns;
import com.ns.funnel.query.FunnelExprs;
import com.ns.funnel.query.StepColumnBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Column builders shared by the order strategies.
 */
abstract class AbstractOrderStrategy implements FunnelOrderStrategy {

    /** {@code min(latest_i) OVER (... frame) AS latest_i}, plus the step's event fields. */
    protected List<Expr> windowedStep(QueryContext context, int index, WindowFrame frame, boolean withEventFields) {
        List<Expr> columns = new ArrayList<>();
        String latest = Columns.latest(index);
        columns.add(Exprs.alias(latest, FunnelExprs.overLaterRows("min", FunnelExprs.col(latest), context, frame)));
        if (withEventFields) {
            for (String field : new StepColumnBuilder(context).eventFieldNames()) {
                String column = Columns.stepField(field, index);
                columns.add(Exprs.alias(column, FunnelExprs.overLaterRows("last_value", FunnelExprs.col(column), context, frame)));
            }
        }
        return columns;
    }

    /** {@code latest_i} and the step's event fields, unchanged. */
    protected List<Expr> passedStep(QueryContext context, int index, boolean withEventFields) {
        List<Expr> columns = new ArrayList<>();
        columns.add(FunnelExprs.col(Columns.latest(index)));
        if (withEventFields) {
            for (String field : new StepColumnBuilder(context).eventFieldNames()) {
                columns.add(FunnelExprs.col(Columns.stepField(field, index)));
            }
        }
        return columns;
    }

    /**
     * Exclusions starting at step {@code index - 1} look for the excluded event among the
     * same rows as step {@code index}.
     */
    protected List<ResolvedExclusion> exclusionsWindowedWith(QueryContext context, int index) {
        List<ResolvedExclusion> matching = new ArrayList<>();
        for (ResolvedExclusion exclusion : context.getExclusions()) {
            if (exclusion.getFromStep() + 1 == index) {
                matching.add(exclusion);
            }
        }
        return matching;
    }

    protected Expr windowedExclusion(QueryContext context, ResolvedExclusion exclusion) {
        String column = Columns.exclusionLatest(exclusion.getIndex(), exclusion.getFromStep());
        return Exprs.alias(column, FunnelExprs.overLaterRows("min", FunnelExprs.col(column), context, WindowFrame.upTo(0)));
    }

    protected Expr passedExclusion(ResolvedExclusion exclusion) {
        return FunnelExprs.col(Columns.exclusionLatest(exclusion.getIndex(), exclusion.getFromStep()));
    }

    /** {@code SELECT aggregation_target, timestamp, <columns>[, prop] FROM (source)}. */
    protected SelectQuery level(QueryContext context, List<Expr> columns, QueryExpr source, boolean innermost) {
        SelectQuery.Builder query = SelectQuery.builder()
            .select(FunnelExprs.col(Columns.AGGREGATION_TARGET), FunnelExprs.col(Columns.TIMESTAMP))
            .select(columns)
            .from(source);
        if (context.getBreakdown().isPresent()) {
            query.select(innermost ? new BreakdownAttributionBuilder(context).groupedProp() : FunnelExprs.col(Columns.PROP));
        }
        return query.build();
    }

    /**
     * Largest {@code curr} such that every step before it was reached in order and
     * within the window of step 0.
     */
    protected Expr sortingCondition(QueryContext context, int current) {
        if (current == 1) {
            return Exprs.constant(1);
        }
        List<Expr> conditions = new ArrayList<>();
        Expr start = FunnelExprs.col(Columns.latest(0));
        for (int i = 1; i < current; i++) {
            Expr previous = FunnelExprs.col(Columns.latest(i - 1));
            Expr latest = FunnelExprs.col(Columns.latest(i));
            conditions.add(context.repeatsPreviousStep(i) ? Exprs.lt(previous, latest) : Exprs.ltEq(previous, latest));
            conditions.add(Exprs.ltEq(latest, FunnelExprs.windowEnd(start, context.getWindow())));
        }
        return Exprs.ifElse(Exprs.and(conditions), Exprs.constant(current), sortingCondition(context, current - 1));
    }

    /** Time between consecutive steps, NULL when the hop left the window. */
    protected List<Expr> perHopConversionTimes(QueryContext context) {
        List<Expr> times = new ArrayList<>();
        for (int i = 1; i < context.getMaxSteps(); i++) {
            Expr previous = FunnelExprs.col(Columns.latest(i - 1));
            Expr latest = FunnelExprs.col(Columns.latest(i));
            Expr withinWindow = Exprs.and(Exprs.isNotNull(latest), Exprs.ltEq(latest, FunnelExprs.windowEnd(previous, context.getWindow())));
            times.add(Exprs.alias(Columns.conversionTime(i),
                Exprs.ifElse(withinWindow, FunnelExprs.dateDiffSeconds(previous, latest), Exprs.NULL)));
        }
        return times;
    }
}
