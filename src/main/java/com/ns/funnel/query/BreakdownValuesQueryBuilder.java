package com.ns.funnel.query;

import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.context.ResolvedBreakdown;
import com.ns.funnel.context.ResolvedStep;
import com.ns.funnel.model.BreakdownAttribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Top breakdown values by number of matching events. The caller runs it first and passes
 * the values back in the breakdown so that the rest is grouped as "Other". Cohort
 * breakdowns have a fixed set of values and need no such query.
 */
public class BreakdownValuesQueryBuilder {
    private static final Logger logger = LoggerFactory.getLogger(BreakdownValuesQueryBuilder.class);

    private static final String VALUE = "value";
    private static final String COUNT = "count";

    private final QueryContext context;

    public BreakdownValuesQueryBuilder(QueryContext context) {
        this.context = context;
    }

    public Optional<SelectQuery> build() {
        Optional<ResolvedBreakdown> breakdown = context.getBreakdown();
        if (breakdown.isEmpty() || breakdown.get().isCohort()) {
            return Optional.empty();
        }
        FunnelEventQueryBuilder events = new FunnelEventQueryBuilder(context);
        BreakdownAttributionBuilder attribution = new BreakdownAttributionBuilder(context);

        SelectQuery.Builder query = events.baseQuery(context.getSteps(), false, false)
            .replaceSelect(List.of(
                Exprs.alias(VALUE, attribution.propBasic()),
                Exprs.alias(COUNT, Exprs.call("count", Exprs.star()))));

        BreakdownAttribution attributionMode = breakdown.get().getAttribution();
        if (attributionMode.isStep()) {
            // only events of the attribution step carry the value an actor is counted under
            ResolvedStep step = context.getSteps().get(attributionMode.getStepIndex());
            query.andWhere(new StepColumnBuilder(context).condition(step));
        }
        int limit = breakdown.get().getLimit();
        logger.debug("Breakdown values query limited to {} values", limit + 1);
        return Optional.of(query
            .groupBy(FunnelExprs.col(VALUE))
            .orderBy(Exprs.desc(FunnelExprs.col(COUNT)), Exprs.desc(FunnelExprs.col(VALUE)))
            .limit(limit + 1)
            .build());
    }
}
