package com.ns.funnel.order;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.QueryExpr;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.ast.WindowFrame;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.context.ResolvedExclusion;
import com.ns.funnel.context.ResolvedStep;
import com.ns.funnel.model.OrderType;
import com.ns.funnel.query.Columns;
import com.ns.funnel.query.FunnelExprs;

import java.util.ArrayList;
import java.util.List;

/**
 * Steps in series order with nothing in between: step {@code i} has to be the actor's
 * i-th event after the step-0 event. Every event of the actor is kept so that an
 * off-path event breaks the chain.
 */
public class StrictOrderStrategy extends AbstractOrderStrategy {

    @Override
    public OrderType getOrderType() {
        return OrderType.STRICT;
    }

    @Override
    public List<List<ResolvedStep>> arrangements(QueryContext context) {
        return List.of(context.getSteps());
    }

    @Override
    public boolean requiresAllEvents() {
        return true;
    }

    @Override
    public SelectQuery buildWindowedQuery(QueryContext context, QueryExpr eventQuery, boolean withEventFields) {
        List<Expr> columns = new ArrayList<>();
        for (int i = 0; i < context.getMaxSteps(); i++) {
            columns.add(FunnelExprs.col(Columns.step(i)));
            if (i == 0) {
                columns.addAll(passedStep(context, i, withEventFields));
            } else {
                columns.addAll(windowedStep(context, i, WindowFrame.exactly(i), withEventFields));
            }
            exclusionsWindowedWith(context, i).forEach(exclusion -> columns.add(windowedExclusion(context, exclusion)));
        }
        return level(context, columns, eventQuery, true);
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
