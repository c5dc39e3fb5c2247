package com.ns.funnel;

import com.ns.funnel.actors.ActorQueryPlan;
import com.ns.funnel.actors.ActorTarget;
import com.ns.funnel.config.FunnelCompilerConfig;
import com.ns.funnel.context.FunnelResolutionException;
import com.ns.funnel.context.FunnelValidationException;
import com.ns.funnel.context.ValidationCode;
import com.ns.funnel.model.ActionMatch;
import com.ns.funnel.model.BreakdownSpec;
import com.ns.funnel.model.BreakdownType;
import com.ns.funnel.model.CorrelationSpec;
import com.ns.funnel.model.ExecutionStrategy;
import com.ns.funnel.model.FunnelSpec;
import com.ns.funnel.model.VizMode;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.util.Optional;

import static com.ns.funnel.FunnelTestSupport.funnel;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class FunnelQueryCompilerTest {

    private FunnelQueryCompiler compiler;

    @BeforeAll
    void initializeCompiler() {
        FunnelCompilerConfig config = FunnelQueryCompiler.loadConfig("config.yaml");
        assertNotNull(config, "Failed to load compiler config. Ensure config.yaml is in classpath.");
        compiler = new FunnelQueryCompiler(FunnelTestSupport.environmentBuilder().config(config).build());
    }

    @Test
    void loadsConfigFromClasspath() {
        FunnelCompilerConfig config = FunnelQueryCompiler.loadConfig("config.yaml");

        assertEquals("analytics.events", config.getEventStore().getEventsTable());
        assertEquals("analytics.persons", config.getEventStore().getPersonsTable());
        assertEquals("timestamp", config.getEventStore().getTimestampColumn());
        assertEquals(10, config.getMaxSteps());
        assertEquals(5, config.getDefaultBreakdownLimit());
        assertEquals(10, config.getCorrelationMinPersonCount());
        assertEquals(0.02, config.getCorrelationMinPersonPercentage());
        assertEquals("aggregate_funnel_v2", config.getAggregateFunnelFunction());
    }

    @Test
    void missingConfigFails() {
        assertThrows(IllegalStateException.class, () -> FunnelQueryCompiler.loadConfig("no-such-config.yaml"));
    }

    @Test
    void loadsBundledDefaultConfig() {
        FunnelCompilerConfig config = FunnelQueryCompiler.loadDefaultConfig();

        assertEquals(20, config.getMaxSteps());
        assertEquals(25, config.getDefaultBreakdownLimit());
        assertEquals(25, config.getCorrelationMinPersonCount());
        assertEquals("aggregate_funnel", config.getAggregateFunnelFunction());
    }

    @Test
    void vizModeSelectsThePlan() {
        assertEquals(QueryPlan.Kind.STEPS, compiler.compile(funnel("a", "b").build()).getKind());
        assertEquals(QueryPlan.Kind.TRENDS, compiler.compile(funnel("a", "b").vizMode(VizMode.TRENDS).build()).getKind());
        assertEquals(QueryPlan.Kind.TIME_TO_CONVERT,
            compiler.compile(funnel("a", "b").vizMode(VizMode.TIME_TO_CONVERT).build()).getKind());
    }

    @Test
    void correlationTakesPrecedenceOverVizMode() {
        QueryPlan plan = compiler.compile(funnel("a", "b").vizMode(VizMode.TRENDS).correlation(CorrelationSpec.events()).build());

        assertEquals(QueryPlan.Kind.CORRELATION, plan.getKind());
        assertTrue(plan.toSql().contains("FROM analytics.events AS event INNER JOIN funnel_actors AS actors"), plan.toSql());
    }

    @Test
    void compilingTwiceGivesTheSamePlan() {
        FunnelSpec spec = funnel("$pageview", "signup", "purchase")
            .breakdown(BreakdownSpec.builder(BreakdownType.EVENT).properties("$browser").build())
            .build();

        QueryPlan first = compiler.compile(spec);
        QueryPlan second = compiler.compile(spec);

        assertEquals(first, second);
        assertEquals(first.toSql(), second.toSql());
        assertTrue(first.toSql().contains("FROM analytics.events AS e"), first.toSql());
    }

    @Test
    void configuredAggregateFunctionIsUsed() {
        QueryPlan plan = compiler.compile(funnel("a", "b").executionStrategy(ExecutionStrategy.SINGLE_PASS).build());

        assertTrue(plan.toSql().contains("aggregate_funnel_v2(2, 1209600, 'first_touch', 'ordered', []"), plan.toSql());
    }

    @Test
    void breakdownValuesUseTheConfiguredLimit() {
        Optional<QueryPlan> plan = compiler.compileBreakdownValues(funnel("a", "b")
            .breakdown(BreakdownSpec.builder(BreakdownType.EVENT).properties("$browser").build()).build());

        assertTrue(plan.isPresent());
        assertEquals(QueryPlan.Kind.BREAKDOWN_VALUES, plan.get().getKind());
        assertTrue(plan.get().toSql().endsWith("LIMIT 6"), plan.get().toSql());
        assertFalse(compiler.compileBreakdownValues(funnel("a", "b").build()).isPresent());
    }

    @Test
    void actorsReadTheContextOfThePlan() {
        QueryPlan plan = compiler.compile(funnel("a", "b", "c").build());

        ActorQueryPlan actors = compiler.actors(plan, ActorTarget.builder().step(2).build());

        assertTrue(actors.toSql().contains("WHERE steps IN (2, 3)"), actors.toSql());
        assertThrows(NullPointerException.class, () -> compiler.actors(plan, null));
    }

    @Test
    void tooManyStepsForTheConfiguredMaximum() {
        String[] events = new String[11];
        for (int i = 0; i < events.length; i++) {
            events[i] = "event_" + i;
        }

        FunnelValidationException e = assertThrows(FunnelValidationException.class, () -> compiler.compile(funnel(events).build()));
        assertEquals(ValidationCode.TOO_MANY_STEPS, e.getCode());
    }

    @Test
    void unknownActionFailsResolution() {
        FunnelSpec spec = FunnelSpec.builder()
            .steps(ActionMatch.of(99L), ActionMatch.of(FunnelTestSupport.SIGNUP_ACTION_ID))
            .dateRange("2024-01-01", "2024-01-31")
            .build();

        assertThrows(FunnelResolutionException.class, () -> compiler.compile(spec));
    }
}
