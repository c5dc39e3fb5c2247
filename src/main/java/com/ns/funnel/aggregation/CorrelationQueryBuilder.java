package com.ns.funnel.aggregation;

import com.ns.funnel.ast.CompareOperation;
import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.FieldRequalifier;
import com.ns.funnel.ast.JoinExpr;
import com.ns.funnel.ast.QueryExpr;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.ast.SelectUnionQuery;
import com.ns.funnel.config.EventStoreDefinition;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.context.ResolvedExclusion;
import com.ns.funnel.context.ResolvedStep;
import com.ns.funnel.model.CorrelationSpec;
import com.ns.funnel.query.Columns;
import com.ns.funnel.query.FunnelExprs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Contingency counts for funnel correlation: for every event, person property or event
 * property seen on the way through the funnel, how many converted and how many dropped
 * actors have it. A {@code Total_Values_In_Query} row carries the totals of both groups.
 */
public class CorrelationQueryBuilder {
    private static final Logger logger = LoggerFactory.getLogger(CorrelationQueryBuilder.class);

    public static final String TOTAL_VALUES_ROW = "Total_Values_In_Query";
    public static final String NAME = "name";
    public static final String SUCCESS_COUNT = "success_count";
    public static final String FAILURE_COUNT = "failure_count";
    public static final String ALL_PROPERTIES = "$all";

    static final String FUNNEL_ACTORS = "funnel_actors";
    private static final String ACTORS = "actors";
    private static final String EVENT = "event";
    private static final String PERSONS = "persons";
    private static final String PROP = "prop";
    private static final String EVENT_NAME = "event_name";
    private static final String PROPERTIES = "properties";
    private static final String SEPARATOR = "::";

    private final QueryContext context;
    private final CorrelationSpec correlation;
    private final EventStoreDefinition eventStore;

    public CorrelationQueryBuilder(QueryContext context) {
        this.context = context;
        this.correlation = context.getCorrelation()
            .orElseThrow(() -> new IllegalStateException("Funnel has no correlation analysis"));
        this.eventStore = context.getEventStore();
    }

    /** {@code name, success_count, failure_count}, one row per correlated value plus the totals row. */
    public SelectQuery build() {
        QueryExpr contingency;
        switch (correlation.getType()) {
            case EVENTS:
                contingency = eventsQuery();
                break;
            case PROPERTIES:
                contingency = propertiesQuery();
                break;
            case EVENT_WITH_PROPERTIES:
                contingency = eventPropertiesQuery();
                break;
            default:
                throw new IllegalArgumentException("Unknown correlation type " + correlation.getType());
        }
        logger.debug("Correlation of type {} converting at step {}", correlation.getType(), successSteps());
        return SelectQuery.builder()
            .with(FUNNEL_ACTORS, funnelActorsQuery())
            .select(FunnelExprs.col(NAME), FunnelExprs.col(SUCCESS_COUNT), FunnelExprs.col(FAILURE_COUNT))
            .from(SelectUnionQuery.of(List.of(contingency, totalsQuery())))
            .build();
    }

    /** Every actor that entered the funnel with its furthest step and its time span. */
    SelectQuery funnelActorsQuery() {
        return SelectQuery.builder()
            .select(
                Exprs.alias(Columns.ACTOR_ID, FunnelExprs.col(Columns.AGGREGATION_TARGET)),
                FunnelExprs.col(Columns.STEPS),
                FunnelExprs.col(Columns.FIRST_TIMESTAMP),
                FunnelExprs.col(Columns.FINAL_TIMESTAMP))
            .from(new StepCountsQueryBuilder(context).actorStepsQuery(true, false))
            .build();
    }

    private int successSteps() {
        return context.getToStep() + 1;
    }

    private List<Expr> countColumns(Expr actorId, Expr steps) {
        Expr target = Exprs.constant(successSteps());
        return List.of(
            Exprs.alias(SUCCESS_COUNT, Exprs.call("countDistinctIf", actorId, Exprs.eq(steps, target))),
            Exprs.alias(FAILURE_COUNT, Exprs.call("countDistinctIf", actorId, Exprs.notEq(steps, target))));
    }

    private SelectQuery totalsQuery() {
        return SelectQuery.builder()
            .select(Exprs.alias(NAME, Exprs.constant(TOTAL_VALUES_ROW)))
            .select(countColumns(Exprs.field(ACTORS, Columns.ACTOR_ID), Exprs.field(ACTORS, Columns.STEPS)))
            .from(Exprs.field(FUNNEL_ACTORS), ACTORS)
            .build();
    }

    SelectQuery eventsQuery() {
        List<Expr> excluded = new ArrayList<>();
        funnelEventNames().forEach(name -> excluded.add(Exprs.constant(name)));
        correlation.getExcludeEventNames().forEach(name -> excluded.add(Exprs.constant(name)));

        SelectQuery.Builder query = actorEvents()
            .select(Exprs.alias(NAME, eventName()))
            .select(countColumns(Exprs.field(ACTORS, Columns.ACTOR_ID), Exprs.field(ACTORS, Columns.STEPS)))
            .groupBy(FunnelExprs.col(NAME));
        if (!excluded.isEmpty()) {
            query.andWhere(Exprs.compare(CompareOperation.Operator.NOT_IN, eventName(), Exprs.tuple(excluded.toArray(new Expr[0]))));
        }
        return query.build();
    }

    SelectQuery propertiesQuery() {
        Expr personProperties = Exprs.field(PERSONS, eventStore.getPropertiesColumn());
        Expr pairs;
        if (correlation.getPropertyNames().contains(ALL_PROPERTIES)) {
            pairs = Exprs.call("JSONExtractKeysAndValues", personProperties, Exprs.constant("String"));
        } else {
            List<Expr> values = new ArrayList<>();
            for (String property : correlation.getPropertyNames()) {
                values.add(Exprs.call("toString", Exprs.field(PERSONS, eventStore.getPropertiesColumn(), property)));
            }
            pairs = Exprs.call("arrayZip", Exprs.stringArray(correlation.getPropertyNames()), Exprs.array(values));
        }
        Expr constraint = Exprs.eq(Exprs.field(PERSONS, eventStore.getPersonsIdColumn()), Exprs.field(ACTORS, Columns.ACTOR_ID));
        SelectQuery.Builder actorProperties = SelectQuery.builder()
            .select(
                Exprs.alias(Columns.ACTOR_ID, Exprs.field(ACTORS, Columns.ACTOR_ID)),
                Exprs.alias(Columns.STEPS, Exprs.field(ACTORS, Columns.STEPS)),
                Exprs.alias(PROP, Exprs.call("arrayJoin", pairs)))
            .from(JoinExpr.from(Exprs.field(FUNNEL_ACTORS), ACTORS)
                .then(JoinExpr.join("INNER JOIN", Exprs.table(eventStore.getPersonsTable()), PERSONS, constraint)));
        excludedPropertiesFilter().ifPresent(actorProperties::where);

        Expr name = Exprs.call("concat", propertyKey(), Exprs.constant(SEPARATOR), propertyValue());
        return SelectQuery.builder()
            .select(Exprs.alias(NAME, name))
            .select(countColumns(FunnelExprs.col(Columns.ACTOR_ID), FunnelExprs.col(Columns.STEPS)))
            .from(actorProperties.build())
            .groupBy(FunnelExprs.col(NAME))
            .build();
    }

    SelectQuery eventPropertiesQuery() {
        List<Expr> names = new ArrayList<>();
        correlation.getEventNames().forEach(name -> names.add(Exprs.constant(name)));
        SelectQuery actorEvents = actorEvents()
            .select(
                Exprs.alias(Columns.ACTOR_ID, Exprs.field(ACTORS, Columns.ACTOR_ID)),
                Exprs.alias(Columns.STEPS, Exprs.field(ACTORS, Columns.STEPS)),
                Exprs.alias(EVENT_NAME, eventName()),
                Exprs.alias(PROPERTIES, Exprs.field(EVENT, eventStore.getPropertiesColumn())))
            .andWhere(Exprs.in(eventName(), names))
            .build();

        Expr name = Exprs.call("concat", FunnelExprs.col(EVENT_NAME), Exprs.constant(SEPARATOR),
            propertyKey(), Exprs.constant(SEPARATOR), propertyValue());
        SelectQuery.Builder query = SelectQuery.builder()
            .select(Exprs.alias(NAME, name))
            .select(countColumns(FunnelExprs.col(Columns.ACTOR_ID), FunnelExprs.col(Columns.STEPS)))
            .from(actorEvents)
            .arrayJoin(Exprs.alias(PROP, Exprs.call("JSONExtractKeysAndValues", FunnelExprs.col(PROPERTIES), Exprs.constant("String"))))
            .groupBy(FunnelExprs.col(NAME));
        excludedPropertiesFilter().ifPresent(query::where);
        return query.build();
    }

    /**
     * Events of funnel actors between their first step and their last step, or the end of
     * the conversion window when they dropped off.
     */
    private SelectQuery.Builder actorEvents() {
        Expr timestamp = Exprs.field(EVENT, eventStore.getTimestampColumn());
        Expr actorMatch = Exprs.eq(Exprs.field(ACTORS, Columns.ACTOR_ID), FieldRequalifier.requalify(context.getAggregationTarget(), EVENT));
        Expr firstTimestamp = Exprs.field(ACTORS, Columns.FIRST_TIMESTAMP);
        Expr spanEnd = Exprs.call("COALESCE",
            Exprs.field(ACTORS, Columns.FINAL_TIMESTAMP),
            FunnelExprs.windowEnd(firstTimestamp, context.getWindow()),
            context.getDateRange().toExpr());

        return SelectQuery.builder()
            .from(JoinExpr.from(Exprs.table(eventStore.getEventsTable()), EVENT)
                .then(JoinExpr.join("INNER JOIN", Exprs.field(FUNNEL_ACTORS), ACTORS, actorMatch)))
            .where(Exprs.and(
                Exprs.gtEq(timestamp, context.getDateRange().fromExpr()),
                Exprs.ltEq(timestamp, context.getDateRange().toExpr()),
                Exprs.gtEq(timestamp, firstTimestamp),
                Exprs.lt(timestamp, spanEnd)));
    }

    private Expr eventName() {
        return Exprs.field(EVENT, eventStore.getEventColumn());
    }

    private static Expr propertyKey() {
        return Exprs.tupleElement(FunnelExprs.col(PROP), 1);
    }

    private static Expr propertyValue() {
        return Exprs.tupleElement(FunnelExprs.col(PROP), 2);
    }

    private Optional<Expr> excludedPropertiesFilter() {
        if (correlation.getExcludePropertyNames().isEmpty()) {
            return Optional.empty();
        }
        Expr excluded = Exprs.tuple(correlation.getExcludePropertyNames().stream().map(Exprs::constant).toArray(Expr[]::new));
        return Optional.of(Exprs.compare(CompareOperation.Operator.NOT_IN, propertyKey(), excluded));
    }

    /** Names of the step and exclusion events; they say nothing about conversion. */
    private Set<String> funnelEventNames() {
        Set<String> names = new TreeSet<>();
        for (ResolvedStep step : context.getSteps()) {
            names.addAll(step.getEventNames());
        }
        for (ResolvedExclusion exclusion : context.getExclusions()) {
            names.addAll(exclusion.getStep().getEventNames());
        }
        return names;
    }
}
