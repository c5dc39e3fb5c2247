package com.ns.funnel.query;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.FieldRequalifier;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.config.EventStoreDefinition;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.context.ResolvedStep;
import com.ns.funnel.model.StepMath;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds the per-row match columns of a step: {@code step_i} and {@code latest_i}, plus
 * the per-step event fields used for matching events.
 */
public class StepColumnBuilder {
    private final QueryContext context;
    private final EventStoreDefinition eventStore;

    public StepColumnBuilder(QueryContext context) {
        this.context = context;
        this.eventStore = context.getEventStore();
    }

    /**
     * Whether an events row matches the step. Fields are left unqualified so the
     * condition reads against the enclosing events row.
     */
    public Expr condition(ResolvedStep step) {
        List<Expr> parts = new ArrayList<>();
        entityCondition(step).ifPresent(parts::add);
        step.getPropertyPredicate().ifPresent(parts::add);
        if (step.getMatcher().getMath() != StepMath.TOTAL && !step.isExternal()) {
            parts.add(Exprs.not(Exprs.exists(firstTimeCheck(step))));
        }
        return parts.isEmpty() ? Exprs.TRUE : Exprs.and(parts);
    }

    private Optional<Expr> entityCondition(ResolvedStep step) {
        if (step.getEventNames().isEmpty()) {
            return Optional.empty();
        }
        List<Expr> names = step.getEventNames().stream().map(Exprs::constant).collect(Collectors.toList());
        return Optional.of(Exprs.in(Exprs.field(eventStore.getEventColumn()), names));
    }

    /**
     * Earlier occurrence of the same step by the same actor within the date range. When
     * it exists the current row is not the actor's first time.
     */
    SelectQuery firstTimeCheck(ResolvedStep step) {
        String prior = Columns.PRIOR_EVENTS_ALIAS;
        String outer = Columns.EVENTS_ALIAS;
        Expr target = context.getAggregationTarget();
        Expr priorTimestamp = Exprs.field(prior, eventStore.getTimestampColumn());

        List<Expr> predicates = new ArrayList<>();
        predicates.add(Exprs.eq(FieldRequalifier.requalify(target, prior), FieldRequalifier.requalify(target, outer)));
        predicates.add(Exprs.gtEq(priorTimestamp, context.getDateRange().fromExpr()));
        predicates.add(Exprs.lt(priorTimestamp, Exprs.field(outer, eventStore.getTimestampColumn())));
        entityCondition(step).ifPresent(condition -> predicates.add(FieldRequalifier.requalify(condition, prior)));
        if (step.getMatcher().getMath() == StepMath.FIRST_TIME_FOR_ACTOR_WITH_FILTERS) {
            step.getPropertyPredicate().ifPresent(predicate -> predicates.add(FieldRequalifier.requalify(predicate, prior)));
        }

        return SelectQuery.builder()
            .select(Exprs.constant(1))
            .from(Exprs.table(eventStore.getEventsTable()), prior)
            .where(Exprs.and(predicates))
            .build();
    }

    /** {@code if(cond, 1, 0) AS step_i, if(step_i = 1, timestamp, NULL) AS latest_i}. */
    public List<Expr> stepColumns(ResolvedStep step, int position) {
        return matchColumns(condition(step), Columns.step(position), Columns.latest(position));
    }

    /** Exclusion columns are numbered by the step the exclusion range starts at. */
    public List<Expr> exclusionColumns(ResolvedStep exclusion, int exclusionIndex, int fromStep) {
        return matchColumns(condition(exclusion),
            Columns.exclusionStep(exclusionIndex, fromStep), Columns.exclusionLatest(exclusionIndex, fromStep));
    }

    /** The columns of a step that can never match in this branch. */
    public List<Expr> unmatchedColumns(int position) {
        return List.of(
            Exprs.alias(Columns.step(position), Exprs.constant(0)),
            Exprs.alias(Columns.latest(position), Exprs.NULL));
    }

    public List<Expr> matchColumns(Expr condition, String stepColumn, String latestColumn) {
        Expr matched = Exprs.eq(Exprs.field(stepColumn), Exprs.constant(1));
        return List.of(
            Exprs.alias(stepColumn, Exprs.ifElse(condition, Exprs.constant(1), Exprs.constant(0))),
            Exprs.alias(latestColumn, Exprs.ifElse(matched, Exprs.field(Columns.TIMESTAMP), Exprs.NULL)));
    }

    /** Names of the event fields carried per step when matching events are requested. */
    public List<String> eventFieldNames() {
        return List.of(Columns.UUID, eventStore.getSessionIdProperty(), eventStore.getWindowIdProperty());
    }

    /** {@code if(step_i = 1, uuid, NULL) AS uuid_i} and the same for the session fields. */
    public List<Expr> eventFieldColumns(int position) {
        List<Expr> columns = new ArrayList<>();
        for (String field : eventFieldNames()) {
            columns.add(Exprs.alias(Columns.stepField(field, position),
                Exprs.ifElse(FunnelExprs.stepMatched(position), Exprs.field(field), Exprs.NULL)));
        }
        return columns;
    }
}
