package com.ns.funnel.aggregation;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.QueryExpr;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.context.ResolvedExclusion;
import com.ns.funnel.model.BreakdownAttribution;
import com.ns.funnel.model.OrderType;
import com.ns.funnel.query.BreakdownAttributionBuilder;
import com.ns.funnel.query.Columns;
import com.ns.funnel.query.FunnelEventQueryBuilder;
import com.ns.funnel.query.FunnelExprs;
import com.ns.funnel.udf.FunnelAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Single-pass execution: every actor's events are collected into one sorted array and
 * classified by the {@code aggregate_funnel} routine in a single aggregation. The output
 * has the columns of the cascading steps query that the step counts read, so both plans
 * are aggregated the same way.
 */
public class AggregateFunnelQueryBuilder {
    private static final Logger logger = LoggerFactory.getLogger(AggregateFunnelQueryBuilder.class);

    static final String RESULT = "af";

    private final QueryContext context;

    public AggregateFunnelQueryBuilder(QueryContext context) {
        this.context = context;
    }

    /** {@code aggregation_target, steps[, prop], step_i_conversion_time} per actor and breakdown value. */
    public SelectQuery build() {
        QueryExpr events = new FunnelEventQueryBuilder(context)
            .buildUnattributed(context.getSteps(), context.getOrderType() == OrderType.STRICT, true);

        SelectQuery perActor = SelectQuery.builder()
            .select(FunnelExprs.col(Columns.AGGREGATION_TARGET),
                Exprs.alias(RESULT, Exprs.call("arrayJoin", aggregateCall())))
            .from(events)
            .groupBy(FunnelExprs.col(Columns.AGGREGATION_TARGET))
            .build();

        Expr result = FunnelExprs.col(RESULT);
        List<Expr> select = new ArrayList<>();
        select.add(FunnelExprs.col(Columns.AGGREGATION_TARGET));
        select.add(Exprs.alias(Columns.STEPS, Exprs.plus(Exprs.tupleElement(result, 1), Exprs.constant(1))));
        context.getBreakdown().ifPresent(breakdown -> select.add(Exprs.alias(Columns.PROP, groupedProp(Exprs.tupleElement(result, 2)))));
        Expr timings = Exprs.tupleElement(result, 3);
        for (int i = 1; i < context.getMaxSteps(); i++) {
            Expr present = Exprs.gtEq(Exprs.call("length", timings), Exprs.constant(i));
            select.add(Exprs.alias(Columns.conversionTime(i),
                Exprs.ifElse(present, Exprs.arrayElement(timings, i), Exprs.NULL)));
        }
        select.add(Exprs.alias(Columns.UUIDS, Exprs.tupleElement(result, 4)));

        logger.debug("Single-pass plan with {} steps, order {}", context.getMaxSteps(), context.getOrderType());
        return SelectQuery.builder()
            .select(select)
            .from(perActor)
            .build();
    }

    /**
     * {@code aggregate_funnel(n, window, attribution, order, [(from, to)], [optional], sorted events)}.
     */
    Expr aggregateCall() {
        List<Expr> args = new ArrayList<>();
        args.add(Exprs.constant(context.getMaxSteps()));
        args.add(Exprs.constant(context.getWindowSeconds()));
        args.add(Exprs.constant(context.getBreakdown()
            .map(breakdown -> FunnelAggregator.attributionArgument(breakdown.getAttribution()))
            .orElse(FunnelAggregator.attributionArgument(BreakdownAttribution.firstTouch()))));
        args.add(Exprs.constant(FunnelAggregator.orderArgument(context.getOrderType())));
        List<Expr> ranges = new ArrayList<>();
        for (ResolvedExclusion exclusion : context.getExclusions()) {
            ranges.add(Exprs.tuple(Exprs.constant(exclusion.getFromStep()), Exprs.constant(exclusion.getToStep())));
        }
        args.add(Exprs.array(ranges));
        if (context.hasOptionalSteps()) {
            List<Expr> flags = new ArrayList<>();
            context.getOptionalFlags().forEach(optional -> flags.add(Exprs.constant(optional ? 1 : 0)));
            args.add(Exprs.array(flags));
        }
        args.add(sortedEvents());
        return Exprs.call(context.getConfig().getAggregateFunnelFunction(), args);
    }

    /** {@code arraySort(t -> t.1, groupArray(tuple(toUnixTimestamp(timestamp), uuid, prop, codes)))}. */
    private Expr sortedEvents() {
        Expr prop = context.getBreakdown().isPresent() ? FunnelExprs.col(Columns.PROP_BASIC) : Exprs.array();
        Expr event = Exprs.tuple(
            Exprs.call("toUnixTimestamp", FunnelExprs.col(Columns.TIMESTAMP)),
            FunnelExprs.col(Columns.UUID),
            prop,
            Exprs.call("arrayFilter", Exprs.lambda("x", Exprs.notEq(Exprs.field("x"), Exprs.constant(0))), Exprs.array(stepCodes())));
        return Exprs.call("arraySort",
            Exprs.lambda("t", Exprs.tupleElement(Exprs.field("t"), 1)),
            Exprs.call("groupArray", event));
    }

    /** Step {@code i} is coded {@code i + 1}; exclusion {@code k} is coded {@code -(k + 1)}. */
    private List<Expr> stepCodes() {
        List<Expr> codes = new ArrayList<>();
        for (int i = 0; i < context.getMaxSteps(); i++) {
            codes.add(Exprs.multiply(FunnelExprs.col(Columns.step(i)), Exprs.constant(i + 1)));
        }
        for (ResolvedExclusion exclusion : context.getExclusions()) {
            codes.add(Exprs.multiply(
                FunnelExprs.col(Columns.exclusionStep(exclusion.getIndex(), exclusion.getFromStep())),
                Exprs.constant(-(exclusion.getIndex() + 1))));
        }
        return codes;
    }

    private Expr groupedProp(Expr prop) {
        BreakdownAttributionBuilder attribution = new BreakdownAttributionBuilder(context);
        Optional<Expr> values = attribution.valuesArray();
        if (values.isEmpty()) {
            return prop;
        }
        Expr other = context.getBreakdown().get().isArrayValued()
            ? Exprs.stringArray(List.of(Columns.OTHER_BREAKDOWN_VALUE))
            : Exprs.constant(Columns.OTHER_BREAKDOWN_VALUE);
        return Exprs.ifElse(Exprs.call("has", values.get(), prop), prop, other);
    }
}
