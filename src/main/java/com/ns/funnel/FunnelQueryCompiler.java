package com.ns.funnel;

import com.ns.funnel.actors.ActorQueryBuilder;
import com.ns.funnel.actors.ActorQueryPlan;
import com.ns.funnel.actors.ActorTarget;
import com.ns.funnel.aggregation.CorrelationQueryBuilder;
import com.ns.funnel.aggregation.StepCountsQueryBuilder;
import com.ns.funnel.aggregation.TimeToConvertQueryBuilder;
import com.ns.funnel.aggregation.TrendsQueryBuilder;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.config.FunnelCompilerConfig;
import com.ns.funnel.context.FunnelEnvironment;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.model.FunnelSpec;
import com.ns.funnel.query.BreakdownValuesQueryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point: compiles a {@link FunnelSpec} into a {@link QueryPlan} and a plan into the
 * query for the actors behind one of its numbers.
 */
public class FunnelQueryCompiler {

    private static final Logger logger = LoggerFactory.getLogger(FunnelQueryCompiler.class);
    public static final String DEFAULT_CONFIG_FILE = "funnel-compiler.yaml";
    private final FunnelEnvironment environment;

    public FunnelQueryCompiler(FunnelEnvironment environment) {
        this.environment = Objects.requireNonNull(environment, "FunnelEnvironment cannot be null");
        logger.info("Initialized funnel compiler: events table '{}', max {} steps",
            environment.getConfig().getEventStore().getEventsTable(), environment.getConfig().getMaxSteps());
    }

    public FunnelEnvironment getEnvironment() {
        return environment;
    }

    /**
     * Validates and resolves the spec, then builds the plan its viz mode asks for; a
     * correlation request takes precedence over the viz mode.
     *
     * @throws com.ns.funnel.context.FunnelValidationException if the spec is invalid
     * @throws com.ns.funnel.context.FunnelResolutionException if an action or cohort is unknown
     */
    public QueryPlan compile(FunnelSpec spec) {
        QueryContext context = QueryContext.build(spec, environment);
        QueryPlan plan = compile(context);
        logger.info("Compiled {} funnel plan with {} steps", plan.getKind(), context.getMaxSteps());
        logger.debug("Plan: {}", plan.toSql());
        return plan;
    }

    QueryPlan compile(QueryContext context) {
        if (context.getCorrelation().isPresent()) {
            return new QueryPlan(QueryPlan.Kind.CORRELATION, new CorrelationQueryBuilder(context).build(), context);
        }
        switch (context.getVizMode()) {
            case TRENDS:
                return new QueryPlan(QueryPlan.Kind.TRENDS, new TrendsQueryBuilder(context).build(), context);
            case TIME_TO_CONVERT:
                return new QueryPlan(QueryPlan.Kind.TIME_TO_CONVERT, new TimeToConvertQueryBuilder(context).build(), context);
            case STEPS:
            default:
                return new QueryPlan(QueryPlan.Kind.STEPS, new StepCountsQueryBuilder(context).build(), context);
        }
    }

    /**
     * The query for the top breakdown values, run before the main plan so that the values
     * can be passed back in the breakdown's {@code values}. Empty when the funnel has no
     * property breakdown.
     */
    public Optional<QueryPlan> compileBreakdownValues(FunnelSpec spec) {
        QueryContext context = QueryContext.build(spec, environment);
        Optional<SelectQuery> query = new BreakdownValuesQueryBuilder(context).build();
        if (query.isEmpty()) {
            logger.debug("No breakdown values query for this funnel");
        }
        return query.map(q -> new QueryPlan(QueryPlan.Kind.BREAKDOWN_VALUES, q, context));
    }

    /**
     * The actors behind one step, period or breakdown value of a compiled plan.
     *
     * @throws NullPointerException if the target is missing
     */
    public ActorQueryPlan actors(QueryPlan plan, ActorTarget target) {
        Objects.requireNonNull(plan, "plan is null");
        Objects.requireNonNull(target, "actor target is required");
        ActorQueryPlan actorPlan = new ActorQueryBuilder(plan.getContext()).build(target);
        logger.info("Compiled actors plan for {}", target);
        return actorPlan;
    }

    /** Loads the configuration bundled with the compiler. */
    public static FunnelCompilerConfig loadDefaultConfig() {
        return loadConfig(DEFAULT_CONFIG_FILE);
    }

    public static FunnelCompilerConfig loadConfig(String filename) {
        LoaderOptions opts = new LoaderOptions();
        opts.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(FunnelCompilerConfig.class, opts));
        try (InputStream in = FunnelQueryCompiler.class.getClassLoader().getResourceAsStream(filename)) {
            if (in == null) {
                logger.error("Config file not found in classpath: {}", filename);
                throw new IllegalStateException("Config file not found in classpath: " + filename);
            }
            FunnelCompilerConfig config = yaml.load(in);
            if (config == null) {
                throw new IllegalStateException("Config file is empty: " + filename);
            }
            logger.info("Loaded compiler config '{}'", filename);
            return config;
        } catch (IOException | YAMLException e) {
            logger.error("Failed to load or parse config '{}': {}", filename, e.getMessage());
            throw new IllegalStateException("Failed to load or parse config: " + filename, e);
        }
    }
}
