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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Steps in any order. Every rotation of the series is evaluated with its first step as
 * the entry point; an actor's result is the best rotation.
 */
public class UnorderedOrderStrategy extends AbstractOrderStrategy {
    private static final Logger logger = LoggerFactory.getLogger(UnorderedOrderStrategy.class);

    @Override
    public OrderType getOrderType() {
        return OrderType.UNORDERED;
    }

    @Override
    public List<List<ResolvedStep>> arrangements(QueryContext context) {
        List<ResolvedStep> steps = context.getSteps();
        List<List<ResolvedStep>> rotations = new ArrayList<>();
        for (int rotation = 0; rotation < steps.size(); rotation++) {
            List<ResolvedStep> rotated = new ArrayList<>(steps.size());
            for (int i = 0; i < steps.size(); i++) {
                rotated.add(steps.get((rotation + i) % steps.size()));
            }
            rotations.add(rotated);
        }
        logger.debug("Unordered funnel evaluates {} rotations", rotations.size());
        return rotations;
    }

    @Override
    public boolean requiresAllEvents() {
        return false;
    }

    @Override
    public SelectQuery buildWindowedQuery(QueryContext context, QueryExpr eventQuery, boolean withEventFields) {
        List<Expr> columns = new ArrayList<>();
        for (int i = 0; i < context.getMaxSteps(); i++) {
            columns.add(FunnelExprs.col(Columns.step(i)));
            if (i == 0) {
                columns.addAll(passedStep(context, i, withEventFields));
            } else {
                columns.addAll(windowedStep(context, i, WindowFrame.upTo(0), withEventFields));
            }
            exclusionsWindowedWith(context, i).forEach(exclusion -> columns.add(windowedExclusion(context, exclusion)));
        }
        return level(context, columns, eventQuery, true);
    }

    /** {@code arraySort([latest_0, ...]) AS event_times}; unreached steps sort last. */
    @Override
    public List<Expr> helperColumns(QueryContext context) {
        List<Expr> latest = new ArrayList<>();
        for (int i = 0; i < context.getMaxSteps(); i++) {
            latest.add(FunnelExprs.col(Columns.latest(i)));
        }
        return List.of(Exprs.alias(Columns.EVENT_TIMES, Exprs.call("arraySort", Exprs.array(latest))));
    }

    /** One for the entry step plus one for every other step seen after it within the window. */
    @Override
    public Expr stepsReached(QueryContext context) {
        Expr start = FunnelExprs.col(Columns.latest(0));
        List<Expr> reached = new ArrayList<>();
        for (int i = 1; i < context.getMaxSteps(); i++) {
            Expr latest = FunnelExprs.col(Columns.latest(i));
            Expr within = Exprs.and(Exprs.lt(start, latest), Exprs.ltEq(latest, FunnelExprs.windowEnd(start, context.getWindow())));
            reached.add(Exprs.ifElse(within, Exprs.constant(1), Exprs.constant(0)));
        }
        reached.add(Exprs.constant(1));
        return Exprs.call("arraySum", Exprs.array(reached));
    }

    @Override
    public Expr exclusionRangeEnd(QueryContext context, ResolvedExclusion exclusion) {
        return Exprs.arrayElement(FunnelExprs.col(Columns.EVENT_TIMES), exclusion.getToStep() + 1);
    }

    @Override
    public List<Expr> conversionTimes(QueryContext context) {
        Expr eventTimes = FunnelExprs.col(Columns.EVENT_TIMES);
        Expr first = Exprs.arrayElement(eventTimes, 1);
        List<Expr> times = new ArrayList<>();
        for (int i = 1; i < context.getMaxSteps(); i++) {
            Expr previous = Exprs.arrayElement(eventTimes, i);
            Expr current = Exprs.arrayElement(eventTimes, i + 1);
            Expr within = Exprs.and(Exprs.isNotNull(current), Exprs.ltEq(current, FunnelExprs.windowEnd(first, context.getWindow())));
            times.add(Exprs.alias(Columns.conversionTime(i),
                Exprs.ifElse(within, FunnelExprs.dateDiffSeconds(previous, current), Exprs.NULL)));
        }
        return times;
    }
}
