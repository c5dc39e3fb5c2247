package com.ns.funnel.order;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.QueryExpr;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.ast.WindowFrame;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.context.ResolvedExclusion;
import com.ns.funnel.context.ResolvedStep;
import com.ns.funnel.model.OrderType;
import com.ns.funnel.query.Columns;
import com.ns.funnel.query.FunnelExprs;
import com.ns.funnel.query.StepColumnBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Steps in series order with any events in between. Built as a cascade: the innermost
 * level finds, for every row, the first time each step occurs at or after it; each outer
 * level discards step times that precede the step before them and looks again.
 */
public class SequentialOrderStrategy extends AbstractOrderStrategy {
    private static final Logger logger = LoggerFactory.getLogger(SequentialOrderStrategy.class);

    @Override
    public OrderType getOrderType() {
        return OrderType.SEQUENTIAL;
    }

    @Override
    public List<List<ResolvedStep>> arrangements(QueryContext context) {
        return List.of(context.getSteps());
    }

    @Override
    public boolean requiresAllEvents() {
        return false;
    }

    @Override
    public SelectQuery buildWindowedQuery(QueryContext context, QueryExpr eventQuery, boolean withEventFields) {
        return buildStepSubquery(context, eventQuery, 2, withEventFields);
    }

    private SelectQuery buildStepSubquery(QueryContext context, QueryExpr eventQuery, int levelIndex, boolean withEventFields) {
        int maxSteps = context.getMaxSteps();
        if (levelIndex >= maxSteps) {
            return level(context, partitionColumns(context, 1, withEventFields), eventQuery, true);
        }
        logger.debug("Building comparison level {} of {}", levelIndex, maxSteps - 1);
        SelectQuery inner = buildStepSubquery(context, eventQuery, levelIndex + 1, withEventFields);
        SelectQuery compared = level(context, comparisonColumns(context, levelIndex, withEventFields), inner, false);
        return level(context, partitionColumns(context, levelIndex, withEventFields), compared, false);
    }

    /** Re-windows every step from {@code levelIndex} on; earlier steps are settled. */
    private List<Expr> partitionColumns(QueryContext context, int levelIndex, boolean withEventFields) {
        List<Expr> columns = new ArrayList<>();
        for (int i = 0; i < context.getMaxSteps(); i++) {
            columns.add(FunnelExprs.col(Columns.step(i)));
            if (i < levelIndex) {
                columns.addAll(passedStep(context, i, withEventFields));
                exclusionsWindowedWith(context, i).forEach(exclusion -> columns.add(passedExclusion(exclusion)));
            } else {
                // a step that also matches the previous step's event must come from a later row
                int duplicateEvent = context.repeatsPreviousStep(i) ? 1 : 0;
                columns.addAll(windowedStep(context, i, WindowFrame.upTo(duplicateEvent), withEventFields));
                exclusionsWindowedWith(context, i).forEach(exclusion -> columns.add(windowedExclusion(context, exclusion)));
            }
        }
        return columns;
    }

    /** Nulls step times from {@code levelIndex} on that precede step {@code levelIndex - 1}. */
    private List<Expr> comparisonColumns(QueryContext context, int levelIndex, boolean withEventFields) {
        List<Expr> columns = new ArrayList<>();
        Expr previous = FunnelExprs.col(Columns.latest(levelIndex - 1));
        for (int i = 0; i < context.getMaxSteps(); i++) {
            columns.add(FunnelExprs.col(Columns.step(i)));
            if (i < levelIndex) {
                columns.addAll(passedStep(context, i, withEventFields));
                exclusionsWindowedWith(context, i).forEach(exclusion -> columns.add(passedExclusion(exclusion)));
                continue;
            }
            List<Expr> earlier = new ArrayList<>();
            for (int j = levelIndex; j <= i; j++) {
                earlier.add(Exprs.lt(FunnelExprs.col(Columns.latest(j)), previous));
            }
            Expr outOfOrder = Exprs.or(earlier);
            columns.add(nullIf(outOfOrder, Columns.latest(i)));
            if (withEventFields) {
                for (String field : new StepColumnBuilder(context).eventFieldNames()) {
                    columns.add(nullIf(outOfOrder, Columns.stepField(field, i)));
                }
            }
            for (ResolvedExclusion exclusion : exclusionsWindowedWith(context, i)) {
                String column = Columns.exclusionLatest(exclusion.getIndex(), exclusion.getFromStep());
                Expr beforeFrom = Exprs.lt(FunnelExprs.col(column), FunnelExprs.col(Columns.latest(exclusion.getFromStep())));
                columns.add(nullIf(beforeFrom, column));
            }
        }
        return columns;
    }

    private static Expr nullIf(Expr condition, String column) {
        return Exprs.alias(column, Exprs.ifElse(condition, Exprs.NULL, FunnelExprs.col(column)));
    }

    @Override
    public List<Expr> helperColumns(QueryContext context) {
        return List.of();
    }

    @Override
    public Expr stepsReached(QueryContext context) {
        return sortingCondition(context, context.getMaxSteps());
    }

    @Override
    public Expr exclusionRangeEnd(QueryContext context, ResolvedExclusion exclusion) {
        return FunnelExprs.col(Columns.latest(exclusion.getToStep()));
    }

    @Override
    public List<Expr> conversionTimes(QueryContext context) {
        return perHopConversionTimes(context);
    }
}
