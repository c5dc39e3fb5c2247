package com.ns.funnel.query;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.JoinExpr;
import com.ns.funnel.ast.QueryExpr;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.ast.SelectUnionQuery;
import com.ns.funnel.config.EventStoreDefinition;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.context.ResolvedExclusion;
import com.ns.funnel.context.ResolvedStep;
import com.ns.funnel.model.ExternalSourceMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Builds the row set every funnel plan starts from: one row per candidate event with
 * {@code timestamp}, {@code aggregation_target}, the step and exclusion match columns and
 * the breakdown value.
 */
public class FunnelEventQueryBuilder {
    private static final Logger logger = LoggerFactory.getLogger(FunnelEventQueryBuilder.class);

    private final QueryContext context;
    private final EventStoreDefinition eventStore;
    private final StepColumnBuilder stepColumns;

    public FunnelEventQueryBuilder(QueryContext context) {
        this.context = context;
        this.eventStore = context.getEventStore();
        this.stepColumns = new StepColumnBuilder(context);
    }

    /**
     * @param arrangement the steps in the order they are numbered in this plan
     * @param allEvents keep events matching no step, as strict ordering needs
     * @param withEventFields carry uuid and session fields per step
     */
    public QueryExpr build(List<ResolvedStep> arrangement, boolean allEvents, boolean withEventFields) {
        QueryExpr events = buildUnattributed(arrangement, allEvents, withEventFields);
        if (context.getBreakdown().isEmpty()) {
            return events;
        }
        return new BreakdownAttributionBuilder(context).attribute(events);
    }

    /**
     * The events rows before breakdown attribution: {@code prop_basic} is the value of the
     * row itself. The single-pass aggregate attributes values on its own.
     */
    public QueryExpr buildUnattributed(List<ResolvedStep> arrangement, boolean allEvents, boolean withEventFields) {
        List<QueryExpr> branches = new ArrayList<>();
        if (arrangement.stream().anyMatch(step -> !step.isExternal())) {
            branches.add(eventsBranch(arrangement, allEvents, withEventFields));
        }
        for (ExternalSourceMatch source : externalSources(arrangement)) {
            branches.add(externalBranch(source, arrangement, withEventFields));
        }
        return SelectUnionQuery.of(branches);
    }

    /** Events within the date range that pass the global filters. */
    public SelectQuery.Builder baseQuery(List<ResolvedStep> arrangement, boolean allEvents, boolean withEventFields) {
        List<Expr> select = new ArrayList<>();
        select.add(Exprs.alias(Columns.TIMESTAMP, Exprs.field(Columns.EVENTS_ALIAS, eventStore.getTimestampColumn())));
        select.add(Exprs.alias(Columns.AGGREGATION_TARGET, context.getAggregationTarget()));
        if (withEventFields) {
            select.add(Exprs.alias(Columns.UUID, Exprs.field(Columns.EVENTS_ALIAS, eventStore.getUuidColumn())));
            select.add(Exprs.alias(eventStore.getSessionIdProperty(),
                Exprs.field(Columns.EVENTS_ALIAS, eventStore.getPropertiesColumn(), eventStore.getSessionIdProperty())));
            select.add(Exprs.alias(eventStore.getWindowIdProperty(),
                Exprs.field(Columns.EVENTS_ALIAS, eventStore.getPropertiesColumn(), eventStore.getWindowIdProperty())));
        }

        JoinExpr from = JoinExpr.from(Exprs.table(eventStore.getEventsTable()), Columns.EVENTS_ALIAS);
        if (context.getSamplingFactor().isPresent()) {
            from = from.withSample(context.getSamplingFactor().get());
        }

        List<Expr> where = new ArrayList<>();
        where.add(dateRangePredicate(Exprs.field(Columns.EVENTS_ALIAS, eventStore.getTimestampColumn())));
        if (!allEvents) {
            entityFilter(arrangement).ifPresent(where::add);
        }
        context.getGlobalFilter().ifPresent(where::add);

        return SelectQuery.builder()
            .select(select)
            .from(from)
            .where(Exprs.and(where));
    }

    private QueryExpr eventsBranch(List<ResolvedStep> arrangement, boolean allEvents, boolean withEventFields) {
        SelectQuery.Builder query = baseQuery(arrangement, allEvents, withEventFields);
        List<Expr> matchers = new ArrayList<>();

        for (int i = 0; i < arrangement.size(); i++) {
            ResolvedStep step = arrangement.get(i);
            query.select(step.isExternal() ? stepColumns.unmatchedColumns(i) : stepColumns.stepColumns(step, i));
            if (withEventFields) {
                query.select(stepColumns.eventFieldColumns(i));
            }
            matchers.add(FunnelExprs.stepMatched(i));
        }
        for (ResolvedExclusion exclusion : context.getExclusions()) {
            query.select(stepColumns.exclusionColumns(exclusion.getStep(), exclusion.getIndex(), exclusion.getFromStep()));
            matchers.add(Exprs.eq(FunnelExprs.col(Columns.exclusionStep(exclusion.getIndex(), exclusion.getFromStep())), Exprs.constant(1)));
        }

        context.getBreakdown().ifPresent(breakdown -> {
            BreakdownAttributionBuilder attribution = new BreakdownAttributionBuilder(context);
            query.select(attribution.selectColumns(arrangement.size()));
            if (breakdown.isCohort()) {
                query.join(attribution.cohortJoin(dateRangePredicate(Exprs.field(Columns.EVENTS_ALIAS, eventStore.getTimestampColumn()))));
            }
        });

        if (!allEvents) {
            query.andWhere(Exprs.or(matchers));
        }
        return query.build();
    }

    private QueryExpr externalBranch(ExternalSourceMatch source, List<ResolvedStep> arrangement, boolean withEventFields) {
        Expr timestamp = Exprs.field(source.getTimestampField());
        SelectQuery.Builder query = SelectQuery.builder()
            .select(Exprs.alias(Columns.TIMESTAMP, timestamp),
                Exprs.alias(Columns.AGGREGATION_TARGET, Exprs.field(source.getActorIdField())));
        if (withEventFields) {
            query.select(Exprs.alias(Columns.UUID, Exprs.NULL),
                Exprs.alias(eventStore.getSessionIdProperty(), Exprs.NULL),
                Exprs.alias(eventStore.getWindowIdProperty(), Exprs.NULL));
        }

        List<Expr> matchers = new ArrayList<>();
        for (int i = 0; i < arrangement.size(); i++) {
            ResolvedStep step = arrangement.get(i);
            if (step.isExternal() && step.getMatcher().sameEntity(source)) {
                query.select(stepColumns.stepColumns(step, i));
                matchers.add(FunnelExprs.stepMatched(i));
            } else {
                query.select(stepColumns.unmatchedColumns(i));
            }
            if (withEventFields) {
                query.select(stepColumns.eventFieldColumns(i));
            }
        }
        logger.debug("External source {} feeds {} steps", source.getTable(), matchers.size());

        return query
            .from(Exprs.table(source.getTable()))
            .where(Exprs.and(dateRangePredicate(timestamp), Exprs.or(matchers)))
            .build();
    }

    /** One entry per distinct external table, in step order. */
    private static List<ExternalSourceMatch> externalSources(List<ResolvedStep> arrangement) {
        List<ExternalSourceMatch> sources = new ArrayList<>();
        for (ResolvedStep step : arrangement) {
            if (!step.isExternal()) {
                continue;
            }
            ExternalSourceMatch match = (ExternalSourceMatch) step.getMatcher();
            if (sources.stream().noneMatch(existing -> existing.sameEntity(match))) {
                sources.add(match);
            }
        }
        return sources;
    }

    public Expr dateRangePredicate(Expr timestamp) {
        return Exprs.and(
            Exprs.gtEq(timestamp, context.getDateRange().fromExpr()),
            Exprs.ltEq(timestamp, context.getDateRange().toExpr()));
    }

    /**
     * {@code event IN (...)} over every step and exclusion, or nothing when some step
     * matches all events.
     */
    private Optional<Expr> entityFilter(List<ResolvedStep> arrangement) {
        List<ResolvedStep> matchers = new ArrayList<>();
        arrangement.stream().filter(step -> !step.isExternal()).forEach(matchers::add);
        context.getExclusions().forEach(exclusion -> matchers.add(exclusion.getStep()));
        if (matchers.stream().anyMatch(ResolvedStep::matchesAllEvents)) {
            return Optional.empty();
        }
        Set<String> names = new TreeSet<>();
        matchers.forEach(step -> names.addAll(step.getEventNames()));
        List<Expr> values = names.stream().map(Exprs::constant).collect(Collectors.toList());
        return Optional.of(Exprs.in(Exprs.field(Columns.EVENTS_ALIAS, eventStore.getEventColumn()), values));
    }
}
