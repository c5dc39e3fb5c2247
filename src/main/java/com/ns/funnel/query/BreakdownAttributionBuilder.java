package com.ns.funnel.query;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.JoinExpr;
import com.ns.funnel.ast.QueryExpr;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.ast.SelectUnionQuery;
import com.ns.funnel.ast.WindowFunction;
import com.ns.funnel.config.EventStoreDefinition;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.context.ResolvedBreakdown;
import com.ns.funnel.model.BreakdownAttribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Attaches the breakdown value to every events row and resolves which value an actor is
 * counted under. Produces {@code prop_basic} (the raw value of the row) and {@code prop}
 * (the attributed value).
 */
public class BreakdownAttributionBuilder {
    private static final Logger logger = LoggerFactory.getLogger(BreakdownAttributionBuilder.class);

    private static final String URL_TRAILING_CHARACTERS = "[\\\\/?#]*$";

    private final QueryContext context;
    private final ResolvedBreakdown breakdown;
    private final EventStoreDefinition eventStore;

    public BreakdownAttributionBuilder(QueryContext context) {
        this.context = context;
        this.breakdown = context.getBreakdown()
            .orElseThrow(() -> new IllegalStateException("Funnel has no breakdown"));
        this.eventStore = context.getEventStore();
    }

    /** The breakdown value of a single events row. */
    public Expr propBasic() {
        switch (breakdown.getType()) {
            case COHORT:
                return Exprs.field(Columns.COHORT_JOIN_ALIAS, Columns.COHORT_VALUE);
            case HOGQL:
                return breakdown.getHogqlExpression()
                    .orElseThrow(() -> new IllegalStateException("HogQL breakdown was not parsed"));
            default:
                List<Expr> values = breakdown.getProperties().stream()
                    .map(this::propertyValue)
                    .collect(Collectors.toList());
                return breakdown.isArrayValued() ? Exprs.array(values) : values.get(0);
        }
    }

    private Expr propertyValue(String key) {
        List<String> chain = new ArrayList<>(propertiesChain());
        chain.add(key);
        Expr value = Exprs.call("ifNull", Exprs.field(chain), Exprs.constant(""));
        if (breakdown.isNormalizeUrl()) {
            Expr trimmed = Exprs.call("replaceRegexpOne", value, Exprs.constant(URL_TRAILING_CHARACTERS), Exprs.constant(""));
            value = Exprs.ifElse(Exprs.call("empty", trimmed), Exprs.constant("/"), trimmed);
        }
        return value;
    }

    private List<String> propertiesChain() {
        switch (breakdown.getType()) {
            case PERSON:
            case DATA_WAREHOUSE_PERSON_PROPERTY:
                return eventStore.getPersonPropertiesChain();
            case GROUP:
                return List.of("group_" + breakdown.getGroupTypeIndex().orElse(0), eventStore.getPropertiesColumn());
            default:
                return List.of(eventStore.getPropertiesColumn());
        }
    }

    /** Columns added to the events row, {@code stepCount} being the number of step columns. */
    public List<Expr> selectColumns(int stepCount) {
        List<Expr> columns = new ArrayList<>();
        columns.add(Exprs.alias(Columns.PROP_BASIC, propBasic()));
        BreakdownAttribution attribution = breakdown.getAttribution();
        switch (attribution.getType()) {
            case STEP:
                Expr empty = breakdown.isArrayValued() ? Exprs.array() : Exprs.NULL;
                for (int i = 0; i < stepCount; i++) {
                    columns.add(Exprs.alias(Columns.stepProp(i),
                        Exprs.ifElse(FunnelExprs.stepMatched(i), FunnelExprs.col(Columns.PROP_BASIC), empty)));
                }
                columns.add(Exprs.alias(Columns.PROP, FunnelExprs.col(Columns.stepProp(attribution.getStepIndex()))));
                columns.add(Exprs.alias(Columns.PROP_VALS, new WindowFunction("groupUniqArray",
                    List.of(FunnelExprs.col(Columns.PROP)), List.of(FunnelExprs.col(Columns.AGGREGATION_TARGET)), List.of(), null)));
                break;
            case FIRST_TOUCH:
            case LAST_TOUCH:
                String function = attribution.getType() == BreakdownAttribution.Type.FIRST_TOUCH ? "argMinIf" : "argMaxIf";
                columns.add(Exprs.alias(Columns.PROP, FunnelExprs.col(Columns.PROP_BASIC)));
                Expr hasValue = breakdown.isArrayValued()
                    ? nonEmptyArray(FunnelExprs.col(Columns.PROP))
                    : Exprs.isNotNull(FunnelExprs.col(Columns.PROP));
                columns.add(Exprs.alias(Columns.PROP_VALS, new WindowFunction(function,
                    List.of(FunnelExprs.col(Columns.PROP), FunnelExprs.col(Columns.TIMESTAMP), hasValue),
                    List.of(FunnelExprs.col(Columns.AGGREGATION_TARGET)), List.of(), null)));
                break;
            default:
                columns.add(Exprs.alias(Columns.PROP, FunnelExprs.col(Columns.PROP_BASIC)));
                break;
        }
        return columns;
    }

    private static Expr nonEmptyArray(Expr array) {
        return Exprs.call("notEmpty", Exprs.call("arrayFilter",
            Exprs.lambda("x", Exprs.call("notEmpty", Exprs.field("x"))), array));
    }

    /**
     * Resolves {@code prop} from {@code prop_vals} above the events query. All-events
     * attribution needs no extra level.
     */
    public QueryExpr attribute(QueryExpr eventsWithProp) {
        BreakdownAttribution attribution = breakdown.getAttribution();
        switch (attribution.getType()) {
            case FIRST_TOUCH:
            case LAST_TOUCH: {
                Expr selector = FunnelExprs.col(Columns.PROP_VALS);
                if (breakdown.isArrayValued()) {
                    Expr defaultValue = Exprs.stringArray(Collections.nCopies(breakdown.getProperties().size(), ""));
                    selector = Exprs.ifElse(nonEmptyArray(selector), selector, defaultValue);
                }
                return SelectQuery.builder()
                    .select(Exprs.star(), Exprs.alias(Columns.PROP, selector))
                    .from(eventsWithProp)
                    .build();
            }
            case STEP: {
                // each value the actor reached the attribution step with becomes its own row set
                SelectQuery.Builder query = SelectQuery.builder()
                    .select(Exprs.star(), FunnelExprs.col(Columns.PROP))
                    .from(eventsWithProp)
                    .arrayJoin(Exprs.alias(Columns.PROP, FunnelExprs.col(Columns.PROP_VALS)));
                if (breakdown.isArrayValued()) {
                    query.where(Exprs.notEq(FunnelExprs.col(Columns.PROP), Exprs.array()));
                }
                return query.build();
            }
            default:
                return eventsWithProp;
        }
    }

    /** Pre-computed breakdown values as an array literal, if any were supplied. */
    public Optional<Expr> valuesArray() {
        if (breakdown.isCohort()) {
            return Optional.empty();
        }
        return breakdown.getValues().map(values -> {
            if (breakdown.isArrayValued()) {
                return Exprs.array(values.stream().map(Exprs::stringArray).collect(Collectors.toList()));
            }
            return Exprs.stringArray(values.stream().map(v -> v.get(0)).collect(Collectors.toList()));
        });
    }

    /**
     * {@code prop}, or {@code if(has(values, prop), prop, 'Other') AS prop} when the
     * top values are known, so that the rest is counted under one value.
     */
    public Expr groupedProp() {
        Optional<Expr> values = valuesArray();
        if (values.isEmpty()) {
            return FunnelExprs.col(Columns.PROP);
        }
        Expr other = breakdown.isArrayValued()
            ? Exprs.stringArray(List.of(Columns.OTHER_BREAKDOWN_VALUE))
            : Exprs.constant(Columns.OTHER_BREAKDOWN_VALUE);
        Expr prop = FunnelExprs.col(Columns.PROP);
        return Exprs.alias(Columns.PROP, Exprs.ifElse(Exprs.call("has", values.get(), prop), prop, other));
    }

    /**
     * {@code INNER JOIN (cohort members UNION ALL ...) AS cohort_join ON e.person_id = cohort_join.cohort_person_id}.
     */
    public JoinExpr cohortJoin(Expr allUsersPredicate) {
        List<QueryExpr> branches = new ArrayList<>();
        for (ResolvedBreakdown.CohortBranch branch : breakdown.getCohortBranches()) {
            SelectQuery.Builder members = SelectQuery.builder()
                .select(Exprs.alias(Columns.COHORT_PERSON_ID, Exprs.field(eventStore.getPersonIdColumn())),
                    Exprs.alias(Columns.COHORT_VALUE, Exprs.constant(branch.getCohortId())));
            if (branch.getMembership().isPresent()) {
                members.from(branch.getMembership().get());
            } else {
                members.from(Exprs.table(eventStore.getEventsTable()), Columns.EVENTS_ALIAS).where(allUsersPredicate);
            }
            branches.add(members.build());
        }
        logger.debug("Cohort breakdown joins {} cohorts", branches.size());
        Expr constraint = Exprs.eq(
            Exprs.field(Columns.EVENTS_ALIAS, eventStore.getPersonIdColumn()),
            Exprs.field(Columns.COHORT_JOIN_ALIAS, Columns.COHORT_PERSON_ID));
        return JoinExpr.join("INNER JOIN", SelectUnionQuery.of(branches), Columns.COHORT_JOIN_ALIAS, constraint);
    }
}
