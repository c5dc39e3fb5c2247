package com.ns.funnel.context;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.QueryExpr;
import com.ns.funnel.config.EventStoreDefinition;
import com.ns.funnel.config.FunnelCompilerConfig;
import com.ns.funnel.external.ResolvedDateRange;
import com.ns.funnel.model.ActionMatch;
import com.ns.funnel.model.BreakdownAttribution;
import com.ns.funnel.model.BreakdownSpec;
import com.ns.funnel.model.BreakdownType;
import com.ns.funnel.model.ConversionWindow;
import com.ns.funnel.model.CorrelationSpec;
import com.ns.funnel.model.EventMatch;
import com.ns.funnel.model.Exclusion;
import com.ns.funnel.model.ExecutionStrategy;
import com.ns.funnel.model.FunnelSpec;
import com.ns.funnel.model.IntervalUnit;
import com.ns.funnel.model.OrderType;
import com.ns.funnel.model.PropertyFilter;
import com.ns.funnel.model.StepMatcher;
import com.ns.funnel.model.VizMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * A validated funnel with every external reference resolved and every derived value
 * computed. Builders downstream read from this and never call a collaborator.
 */
public final class QueryContext {
    private static final Logger logger = LoggerFactory.getLogger(QueryContext.class);

    private final FunnelSpec spec;
    private final FunnelCompilerConfig config;
    private final List<ResolvedStep> steps;
    private final List<ResolvedExclusion> exclusions;
    private final ResolvedBreakdown breakdown;
    private final ResolvedDateRange dateRange;
    private final Expr globalFilter;
    private final Expr aggregationTarget;
    private final ExecutionStrategy executionStrategy;

    private QueryContext(FunnelSpec spec, FunnelCompilerConfig config, List<ResolvedStep> steps,
                         List<ResolvedExclusion> exclusions, ResolvedBreakdown breakdown, ResolvedDateRange dateRange,
                         Expr globalFilter, Expr aggregationTarget, ExecutionStrategy executionStrategy) {
        this.spec = spec;
        this.config = config;
        this.steps = Collections.unmodifiableList(steps);
        this.exclusions = Collections.unmodifiableList(exclusions);
        this.breakdown = breakdown;
        this.dateRange = dateRange;
        this.globalFilter = globalFilter;
        this.aggregationTarget = aggregationTarget;
        this.executionStrategy = executionStrategy;
    }

    /**
     * Validates the spec and resolves it against the environment.
     *
     * @throws FunnelValidationException if the spec is inconsistent or unsupported
     * @throws FunnelResolutionException if an action or cohort does not exist
     */
    public static QueryContext build(FunnelSpec spec, FunnelEnvironment env) {
        FunnelCompilerConfig config = env.getConfig();
        FunnelSpecValidator.validate(spec, config).throwIfInvalid();

        List<ResolvedStep> steps = new ArrayList<>();
        for (int i = 0; i < spec.getSeries().size(); i++) {
            steps.add(resolveStep(i, spec.getSeries().get(i), env));
        }

        List<ResolvedExclusion> exclusions = new ArrayList<>();
        for (int k = 0; k < spec.getExclusions().size(); k++) {
            Exclusion exclusion = spec.getExclusions().get(k);
            ResolvedStep step = resolveStep(k, exclusion.getMatcher(), env);
            exclusions.add(new ResolvedExclusion(k, step, exclusion.getFromStep(), exclusion.getToStep()));
        }

        ResolvedBreakdown breakdown = spec.getBreakdown()
            .map(b -> resolveBreakdown(b, spec, env))
            .orElse(null);

        ResolvedDateRange dateRange = env.getDateRangeResolver().resolve(spec.getDateRange(), env.getTimezone());

        List<PropertyFilter> filters = new ArrayList<>(spec.getProperties());
        if (spec.isFilterTestAccounts()) {
            filters.addAll(env.getTestAccountFilters());
        }
        Expr globalFilter = env.getPropertyFilterTranslator().translate(filters).orElse(null);

        Expr aggregationTarget = resolveAggregationTarget(spec, env);

        ExecutionStrategy strategy = spec.getExecutionStrategy();
        if (strategy != ExecutionStrategy.SINGLE_PASS && spec.getSeries().stream().anyMatch(StepMatcher::isOptional)) {
            logger.debug("Funnel has optional steps, switching to single-pass execution");
            strategy = ExecutionStrategy.SINGLE_PASS;
        }

        QueryContext context = new QueryContext(spec, config, steps, exclusions, breakdown, dateRange,
            globalFilter, aggregationTarget, strategy);
        logger.info("Built funnel context: {} steps, order {}, viz {}, strategy {}, breakdown {}",
            steps.size(), spec.getOrderType(), spec.getVizMode(), strategy,
            breakdown == null ? "none" : breakdown.getType());
        return context;
    }

    private static ResolvedStep resolveStep(int index, StepMatcher matcher, FunnelEnvironment env) {
        List<String> eventNames;
        if (matcher instanceof EventMatch) {
            eventNames = ((EventMatch) matcher).getEventName().map(List::of).orElse(List.of());
        } else if (matcher instanceof ActionMatch) {
            long actionId = ((ActionMatch) matcher).getActionId();
            Set<String> resolved = env.getActionRepository().resolveStepEvents(actionId)
                .orElseThrow(() -> new FunnelResolutionException(FunnelResolutionException.ResolutionCode.UNKNOWN_ACTION, actionId));
            eventNames = new ArrayList<>(new TreeSet<>(resolved));
            logger.debug("Action {} resolved to events {}", actionId, eventNames);
        } else {
            eventNames = List.of();
        }
        Expr predicate = env.getPropertyFilterTranslator().translate(matcher.getProperties()).orElse(null);
        return new ResolvedStep(index, matcher, eventNames, predicate);
    }

    private static ResolvedBreakdown resolveBreakdown(BreakdownSpec breakdown, FunnelSpec spec, FunnelEnvironment env) {
        BreakdownAttribution attribution = breakdown.getAttribution();
        if (spec.getOrderType() == OrderType.UNORDERED && attribution.isStep()) {
            logger.warn("Step attribution is not available for unordered funnels, using all events");
            attribution = BreakdownAttribution.allEvents();
        }

        Expr hogql = null;
        if (breakdown.getType() == BreakdownType.HOGQL) {
            hogql = env.getHogqlParser().parse(breakdown.getProperties().get(0));
        }

        List<ResolvedBreakdown.CohortBranch> branches = new ArrayList<>();
        if (breakdown.getType() == BreakdownType.COHORT) {
            for (Long cohortId : breakdown.getCohortIds()) {
                QueryExpr membership = env.getCohortRepository().membershipPlan(cohortId)
                    .orElseThrow(() -> new FunnelResolutionException(FunnelResolutionException.ResolutionCode.UNKNOWN_COHORT, cohortId));
                branches.add(new ResolvedBreakdown.CohortBranch(cohortId, membership));
            }
            if (breakdown.isIncludeAllUsersCohort()) {
                branches.add(new ResolvedBreakdown.CohortBranch(ResolvedBreakdown.ALL_USERS_COHORT_ID, null));
            }
            if (breakdown.getValues().isPresent()) {
                logger.warn("Pre-computed breakdown values are ignored for cohort breakdowns");
            }
        }

        int limit = breakdown.getLimit().orElse(env.getConfig().getDefaultBreakdownLimit());
        List<List<String>> values = breakdown.getType() == BreakdownType.COHORT ? null : breakdown.getValues().orElse(null);
        return new ResolvedBreakdown(breakdown.getType(), attribution, breakdown.getProperties(),
            breakdown.isNormalizeUrl(), breakdown.getGroupTypeIndex().orElse(null), limit, values, hogql, branches);
    }

    private static Expr resolveAggregationTarget(FunnelSpec spec, FunnelEnvironment env) {
        EventStoreDefinition store = env.getConfig().getEventStore();
        if (spec.getAggregateByHogQL().isPresent()) {
            return env.getHogqlParser().parse(spec.getAggregateByHogQL().get());
        }
        if (spec.getAggregationGroupTypeIndex().isPresent()) {
            return Exprs.field(store.getGroupColumnPrefix() + spec.getAggregationGroupTypeIndex().get());
        }
        return Exprs.field(store.getPersonIdColumn());
    }

    public FunnelSpec getSpec() { return spec; }
    public FunnelCompilerConfig getConfig() { return config; }
    public EventStoreDefinition getEventStore() { return config.getEventStore(); }
    public List<ResolvedStep> getSteps() { return steps; }
    public List<ResolvedExclusion> getExclusions() { return exclusions; }
    public Optional<ResolvedBreakdown> getBreakdown() { return Optional.ofNullable(breakdown); }
    public ResolvedDateRange getDateRange() { return dateRange; }
    public Optional<Expr> getGlobalFilter() { return Optional.ofNullable(globalFilter); }
    public Expr getAggregationTarget() { return aggregationTarget; }
    public ExecutionStrategy getExecutionStrategy() { return executionStrategy; }

    public int getMaxSteps() { return steps.size(); }
    public ConversionWindow getWindow() { return spec.getWindow(); }
    public long getWindowSeconds() { return spec.getWindow().getSeconds(); }
    public OrderType getOrderType() { return spec.getOrderType(); }
    public VizMode getVizMode() { return spec.getVizMode(); }
    public int getFromStep() { return spec.getFromStep().orElse(0); }
    public int getToStep() { return spec.getToStep().orElse(steps.size() - 1); }
    public IntervalUnit getInterval() { return spec.getInterval(); }
    public DayOfWeek getWeekStartDay() { return spec.getWeekStartDay(); }
    public Optional<Integer> getBinCount() { return spec.getBinCount(); }
    public Optional<Double> getSamplingFactor() { return spec.getSamplingFactor(); }
    public Optional<CorrelationSpec> getCorrelation() { return spec.getCorrelation(); }

    public boolean hasExternalSteps() {
        return steps.stream().anyMatch(ResolvedStep::isExternal);
    }

    public boolean hasOptionalSteps() {
        return steps.stream().anyMatch(ResolvedStep::isOptional);
    }

    public boolean isSinglePass() {
        return executionStrategy == ExecutionStrategy.SINGLE_PASS;
    }

    /**
     * True when step {@code index} would also match the event that satisfied the step
     * before it, so the two must be satisfied by different rows.
     */
    public boolean repeatsPreviousStep(int index) {
        if (index <= 0) {
            return false;
        }
        StepMatcher current = steps.get(index).getMatcher();
        StepMatcher previous = steps.get(index - 1).getMatcher();
        return current.isEquivalentTo(previous) || current.isSupersetOf(previous);
    }

    /** Optional-step flags in series order, as passed to the single-pass aggregate. */
    public List<Boolean> getOptionalFlags() {
        List<Boolean> flags = new ArrayList<>();
        for (ResolvedStep step : steps) {
            flags.add(step.isOptional());
        }
        return flags;
    }
}
