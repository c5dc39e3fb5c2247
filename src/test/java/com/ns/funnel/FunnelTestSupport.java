package com.ns.funnel;

import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.QueryExpr;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.context.FunnelEnvironment;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.external.DefaultDateRangeResolver;
import com.ns.funnel.model.EventMatch;
import com.ns.funnel.model.FunnelSpec;
import com.ns.funnel.model.PropertyFilter;
import com.ns.funnel.model.PropertyOperator;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Shared fixtures: an environment with one known action and one known cohort, and a
 * fixed clock so that relative dates resolve the same way on every run.
 */
public final class FunnelTestSupport {

    public static final long SIGNUP_ACTION_ID = 7L;
    public static final long POWER_USERS_COHORT_ID = 42L;
    public static final Instant NOW = Instant.parse("2024-02-01T12:00:00Z");

    private static final Map<Long, Set<String>> ACTIONS = Map.of(
        SIGNUP_ACTION_ID, Set.of("signed_up", "$identify"));

    private FunnelTestSupport() {
    }

    public static FunnelEnvironment environment() {
        return environmentBuilder().build();
    }

    public static FunnelEnvironment.Builder environmentBuilder() {
        return FunnelEnvironment.builder()
            .actionRepository(actionId -> Optional.ofNullable(ACTIONS.get(actionId)))
            .cohortRepository(FunnelTestSupport::cohortMembers)
            .dateRangeResolver(new DefaultDateRangeResolver(Clock.fixed(NOW, ZoneId.of("UTC"))))
            .testAccountFilters(List.of(PropertyFilter.person("email", "@internal.example", PropertyOperator.NOT_ICONTAINS)));
    }

    private static Optional<QueryExpr> cohortMembers(long cohortId) {
        if (cohortId != POWER_USERS_COHORT_ID) {
            return Optional.empty();
        }
        return Optional.of(SelectQuery.builder()
            .select(Exprs.field("person_id"))
            .from(Exprs.field("cohortpeople"))
            .where(Exprs.eq(Exprs.field("cohort_id"), Exprs.constant(cohortId)))
            .build());
    }

    /** A sequential funnel over the given events for January 2024. */
    public static FunnelSpec.Builder funnel(String... events) {
        List<EventMatch> steps = Arrays.stream(events).map(EventMatch::of).collect(Collectors.toList());
        return FunnelSpec.builder()
            .steps(steps)
            .dateRange("2024-01-01", "2024-01-31");
    }

    public static QueryContext context(FunnelSpec spec) {
        return QueryContext.build(spec, environment());
    }

    public static QueryContext context(FunnelSpec.Builder spec) {
        return context(spec.build());
    }
}
