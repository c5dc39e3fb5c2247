package com.ns.funnel.context;

import com.ns.funnel.ast.QueryPrinter;
import com.ns.funnel.model.ActionMatch;
import com.ns.funnel.model.BreakdownAttribution;
import com.ns.funnel.model.BreakdownSpec;
import com.ns.funnel.model.BreakdownType;
import com.ns.funnel.model.EventMatch;
import com.ns.funnel.model.ExecutionStrategy;
import com.ns.funnel.model.FunnelSpec;
import com.ns.funnel.model.OrderType;
import com.ns.funnel.model.PropertyFilter;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static com.ns.funnel.FunnelTestSupport.POWER_USERS_COHORT_ID;
import static com.ns.funnel.FunnelTestSupport.SIGNUP_ACTION_ID;
import static com.ns.funnel.FunnelTestSupport.context;
import static com.ns.funnel.FunnelTestSupport.funnel;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class QueryContextTest {

    @Test
    void resolvesActionsToSortedEventNames() {
        QueryContext context = context(FunnelSpec.builder()
            .steps(EventMatch.of("$pageview"), ActionMatch.of(SIGNUP_ACTION_ID))
            .dateRange("2024-01-01", "2024-01-31"));

        assertEquals(List.of("$pageview"), context.getSteps().get(0).getEventNames());
        assertEquals(List.of("$identify", "signed_up"), context.getSteps().get(1).getEventNames());
    }

    @Test
    void unknownActionFailsResolution() {
        FunnelSpec spec = FunnelSpec.builder()
            .steps(EventMatch.of("$pageview"), ActionMatch.of(99))
            .build();

        FunnelResolutionException e = assertThrows(FunnelResolutionException.class, () -> context(spec));
        assertEquals(FunnelResolutionException.ResolutionCode.UNKNOWN_ACTION, e.getCode());
        assertEquals(99L, e.getReferenceId());
    }

    @Test
    void unknownCohortFailsResolution() {
        FunnelSpec.Builder spec = funnel("$pageview", "signup")
            .breakdown(BreakdownSpec.builder(BreakdownType.COHORT).cohorts(POWER_USERS_COHORT_ID, 1234L).build());

        FunnelResolutionException e = assertThrows(FunnelResolutionException.class, () -> context(spec));
        assertEquals(FunnelResolutionException.ResolutionCode.UNKNOWN_COHORT, e.getCode());
        assertEquals(1234L, e.getReferenceId());
    }

    @Test
    void cohortBreakdownWithAllUsers() {
        QueryContext context = context(funnel("$pageview", "signup")
            .breakdown(BreakdownSpec.builder(BreakdownType.COHORT)
                .cohorts(POWER_USERS_COHORT_ID).includeAllUsersCohort(true).build()));

        List<ResolvedBreakdown.CohortBranch> branches = context.getBreakdown().orElseThrow().getCohortBranches();
        assertEquals(2, branches.size());
        assertEquals(POWER_USERS_COHORT_ID, branches.get(0).getCohortId());
        assertTrue(branches.get(0).getMembership().isPresent());
        assertEquals(ResolvedBreakdown.ALL_USERS_COHORT_ID, branches.get(1).getCohortId());
        assertFalse(branches.get(1).getMembership().isPresent());
    }

    @Test
    void breakdownLimitFallsBackToConfig() {
        QueryContext context = context(funnel("$pageview", "signup")
            .breakdown(BreakdownSpec.builder(BreakdownType.EVENT).properties("$browser").build()));

        assertEquals(25, context.getBreakdown().orElseThrow().getLimit());
    }

    @Test
    void unorderedFunnelDropsStepAttribution() {
        QueryContext context = context(funnel("$pageview", "signup")
            .orderType(OrderType.UNORDERED)
            .breakdown(BreakdownSpec.builder(BreakdownType.EVENT)
                .properties("$browser").attribution(BreakdownAttribution.step(1)).build()));

        assertEquals(BreakdownAttribution.allEvents(), context.getBreakdown().orElseThrow().getAttribution());
    }

    @Test
    void optionalStepsForceSinglePass() {
        QueryContext context = context(FunnelSpec.builder()
            .steps(EventMatch.of("a"), EventMatch.of("b").asOptional(), EventMatch.of("c")));

        assertEquals(ExecutionStrategy.SINGLE_PASS, context.getExecutionStrategy());
        assertEquals(List.of(false, true, false), context.getOptionalFlags());
        assertTrue(context.hasOptionalSteps());
    }

    @Test
    void defaultsToCascadingExecution() {
        QueryContext context = context(funnel("a", "b"));

        assertEquals(ExecutionStrategy.CASCADING, context.getExecutionStrategy());
        assertFalse(context.isSinglePass());
        assertEquals(0, context.getFromStep());
        assertEquals(1, context.getToStep());
    }

    @Test
    void aggregationTargets() {
        assertEquals("person_id", QueryPrinter.print(context(funnel("a", "b")).getAggregationTarget()));
        assertEquals("`$group_1`", QueryPrinter.print(context(funnel("a", "b").aggregationGroupTypeIndex(1)).getAggregationTarget()));
        assertEquals("properties.`$session_id`",
            QueryPrinter.print(context(funnel("a", "b").aggregateByHogQL("properties.$session_id")).getAggregationTarget()));
    }

    @Test
    void testAccountFiltersJoinTheGlobalFilter() {
        QueryContext plain = context(funnel("a", "b"));
        QueryContext filtered = context(funnel("a", "b")
            .property(PropertyFilter.event("$browser", "Chrome"))
            .filterTestAccounts(true));

        assertFalse(plain.getGlobalFilter().isPresent());
        assertEquals("(properties.`$browser` = 'Chrome' AND toString(person.properties.email) NOT ILIKE '%@internal.example%')",
            QueryPrinter.print(filtered.getGlobalFilter().orElseThrow()));
    }

    @Test
    void resolvesDateRangeInclusively() {
        QueryContext context = context(funnel("a", "b"));

        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0, 0), context.getDateRange().getFrom());
        assertEquals(LocalDateTime.of(2024, 1, 31, 23, 59, 59), context.getDateRange().getTo());
    }

    @Test
    void detectsStepsThatRepeatThePreviousOne() {
        assertTrue(context(funnel("a", "a")).repeatsPreviousStep(1));
        assertFalse(context(funnel("a", "b")).repeatsPreviousStep(1));
        assertFalse(context(funnel("a", "b")).repeatsPreviousStep(0));

        EventMatch filtered = EventMatch.of("b", PropertyFilter.event("plan", "pro"));
        assertFalse(context(FunnelSpec.builder().steps(EventMatch.of("b"), filtered)).repeatsPreviousStep(1));
        assertTrue(context(FunnelSpec.builder().steps(filtered, EventMatch.of("b"))).repeatsPreviousStep(1));
    }

    @Test
    void invalidSpecFailsBeforeResolution() {
        FunnelSpec spec = FunnelSpec.builder().steps(ActionMatch.of(99)).build();

        FunnelValidationException e = assertThrows(FunnelValidationException.class, () -> context(spec));
        assertEquals(ValidationCode.SERIES_TOO_SHORT, e.getCode());
    }
}
