package com.ns.funnel.actors;

import com.ns.funnel.aggregation.StepCountsQueryBuilder;
import com.ns.funnel.aggregation.TrendsQueryBuilder;
import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.context.FunnelValidationException;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.context.ValidationCode;
import com.ns.funnel.model.OrderType;
import com.ns.funnel.model.VizMode;
import com.ns.funnel.query.Columns;
import com.ns.funnel.query.FunnelExprs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Lists the actors behind one number of a funnel result, reading the same per-actor rows
 * the aggregate was computed from.
 */
public class ActorQueryBuilder {
    private static final Logger logger = LoggerFactory.getLogger(ActorQueryBuilder.class);

    public static final String MATCHING_EVENTS = "matching_events";
    private static final DateTimeFormatter PERIOD_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final QueryContext context;

    public ActorQueryBuilder(QueryContext context) {
        this.context = Objects.requireNonNull(context, "context is null");
    }

    public ActorQueryPlan build(ActorTarget target) {
        Objects.requireNonNull(target, "target is null");
        SelectQuery query = context.getVizMode() == VizMode.TRENDS ? trendsActors(target) : stepActors(target);
        logger.info("Built actor query for {}", target);
        return new ActorQueryPlan(query, target, context);
    }

    private SelectQuery stepActors(ActorTarget target) {
        if (target.isTrendsTarget()) {
            throw invalid("An entrance period selects actors of trends funnels only");
        }
        if (target.isIncludeRecordings()) {
            if (context.getOrderType() == OrderType.UNORDERED) {
                throw invalid("Matching events are not available for unordered funnels");
            }
            if (context.isSinglePass()) {
                throw invalid("Matching events are not available for funnels with optional steps");
            }
        }

        Expr stepsFilter;
        String matchingEvents;
        if (!target.getCustomSteps().isEmpty()) {
            List<Expr> steps = new ArrayList<>();
            for (int step : target.getCustomSteps()) {
                checkStepInRange(step);
                steps.add(Exprs.constant(step));
            }
            stepsFilter = Exprs.in(FunnelExprs.col(Columns.STEPS), steps);
            matchingEvents = Columns.FINAL_MATCHING_EVENTS;
        } else {
            int step = target.getStep()
                .orElseThrow(() -> new IllegalStateException("Actor target has neither a step nor custom steps"));
            stepsFilter = stepFilter(step);
            matchingEvents = step > 0 ? Columns.matchingEvents(step - 1) : Columns.FINAL_MATCHING_EVENTS;
        }

        SelectQuery.Builder query = SelectQuery.builder()
            .select(Exprs.alias(Columns.ACTOR_ID, FunnelExprs.col(Columns.AGGREGATION_TARGET)))
            .from(new StepCountsQueryBuilder(context).actorStepsQuery(false, target.isIncludeRecordings()))
            .where(stepsFilter);
        if (target.isIncludeRecordings()) {
            query.select(Exprs.alias(MATCHING_EVENTS, Exprs.call("any", FunnelExprs.col(matchingEvents))));
        }
        breakdownFilter(target).ifPresent(query::andWhere);
        return finish(query, target);
    }

    /** {@code steps IN (n, ..., maxSteps)} for n > 0, {@code steps = |n| - 1} for n < 0. */
    private Expr stepFilter(int step) {
        int maxSteps = context.getMaxSteps();
        if (step == -1) {
            throw invalid("Nobody drops off before the first step; use -2 for actors who dropped off after step 1");
        }
        checkStepInRange(step);
        if (step > 0) {
            List<Expr> reached = new ArrayList<>();
            for (int i = step; i <= maxSteps; i++) {
                reached.add(Exprs.constant(i));
            }
            return Exprs.in(FunnelExprs.col(Columns.STEPS), reached);
        }
        return Exprs.eq(FunnelExprs.col(Columns.STEPS), Exprs.constant(-step - 1));
    }

    private void checkStepInRange(int step) {
        if (step == 0 || Math.abs(step) > context.getMaxSteps()) {
            throw invalid("Step " + step + " is outside a funnel of " + context.getMaxSteps() + " steps");
        }
    }

    private SelectQuery trendsActors(ActorTarget target) {
        if (!target.isTrendsTarget()) {
            throw invalid("Actors of a trends funnel are selected by entrance period");
        }
        if (target.isIncludeRecordings()) {
            throw invalid("Matching events are not available for trends funnels");
        }
        TrendsQueryBuilder trends = new TrendsQueryBuilder(context);
        String period = target.getEntrancePeriodStart().get().format(PERIOD_FORMAT);
        Expr periodStart = Exprs.dateTime(period, context.getDateRange().getZone().getId());
        Expr completed = FunnelExprs.col(TrendsQueryBuilder.STEPS_COMPLETED);
        Expr converted = Exprs.gtEq(completed, Exprs.constant(context.getToStep() + 1));
        Expr outcome = target.isDropOff()
            ? Exprs.and(Exprs.gtEq(completed, Exprs.constant(context.getFromStep() + 1)), Exprs.not(converted))
            : converted;

        SelectQuery.Builder query = SelectQuery.builder()
            .select(Exprs.alias(Columns.ACTOR_ID, FunnelExprs.col(Columns.AGGREGATION_TARGET)))
            .from(trends.actorPeriodsQuery())
            .where(Exprs.and(Exprs.eq(FunnelExprs.col(TrendsQueryBuilder.ENTRANCE_PERIOD_START), periodStart), outcome));
        breakdownFilter(target).ifPresent(query::andWhere);
        return finish(query, target);
    }

    /** {@code arrayFlatten(array(prop)) = arrayFlatten(array(value))} matches plain and array values alike. */
    private Optional<Expr> breakdownFilter(ActorTarget target) {
        if (target.getBreakdownValue().isEmpty()) {
            return Optional.empty();
        }
        if (context.getBreakdown().isEmpty()) {
            throw invalid("A breakdown value was given for a funnel without breakdown");
        }
        List<Object> parts = target.getBreakdownValue().get();
        List<Expr> constants = new ArrayList<>();
        parts.forEach(part -> constants.add(Exprs.constant(part)));
        Expr value = parts.size() == 1 && !context.getBreakdown().get().isArrayValued()
            ? constants.get(0)
            : Exprs.array(constants);
        return Optional.of(Exprs.eq(
            Exprs.call("arrayFlatten", Exprs.call("array", FunnelExprs.col(Columns.PROP))),
            Exprs.call("arrayFlatten", Exprs.call("array", value))));
    }

    private SelectQuery finish(SelectQuery.Builder query, ActorTarget target) {
        return query
            .groupBy(FunnelExprs.col(Columns.ACTOR_ID))
            .orderBy(Exprs.asc(FunnelExprs.col(Columns.ACTOR_ID)))
            .limit(target.getLimit().orElse(null))
            .offset(target.getOffset().orElse(null))
            .build();
    }

    private static FunnelValidationException invalid(String message) {
        return new FunnelValidationException(ValidationCode.ACTOR_TARGET_INVALID, message);
    }
}
