package com.ns.funnel.query;

import com.ns.funnel.ast.QueryPrinter;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.model.BreakdownAttribution;
import com.ns.funnel.model.BreakdownSpec;
import com.ns.funnel.model.BreakdownType;
import org.junit.jupiter.api.Test;

import static com.ns.funnel.FunnelTestSupport.POWER_USERS_COHORT_ID;
import static com.ns.funnel.FunnelTestSupport.context;
import static com.ns.funnel.FunnelTestSupport.funnel;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

public class BreakdownValuesQueryBuilderTest {

    private static final String WHERE = "WHERE (e.timestamp >= toDateTime('2024-01-01 00:00:00', 'UTC') "
        + "AND e.timestamp <= toDateTime('2024-01-31 23:59:59', 'UTC') AND e.event IN ('$pageview', 'signup')";

    @Test
    void topValuesPlusOne() {
        QueryContext context = context(funnel("$pageview", "signup")
            .breakdown(BreakdownSpec.builder(BreakdownType.EVENT).properties("$browser").limit(5).build()));

        assertEquals("SELECT ifNull(properties.`$browser`, '') AS value, count(*) AS count FROM events AS e "
                + WHERE + ") GROUP BY value ORDER BY count DESC, value DESC LIMIT 6",
            QueryPrinter.print(new BreakdownValuesQueryBuilder(context).build().orElseThrow()));
    }

    @Test
    void stepAttributionOnlyCountsEventsOfThatStep() {
        QueryContext context = context(funnel("$pageview", "signup")
            .breakdown(BreakdownSpec.builder(BreakdownType.EVENT)
                .properties("$browser").attribution(BreakdownAttribution.step(1)).build()));

        String sql = QueryPrinter.print(new BreakdownValuesQueryBuilder(context).build().orElseThrow());

        assertEquals("SELECT ifNull(properties.`$browser`, '') AS value, count(*) AS count FROM events AS e "
                + WHERE + " AND event = 'signup') GROUP BY value ORDER BY count DESC, value DESC LIMIT 26",
            sql);
    }

    @Test
    void nothingToQueryWithoutBreakdownOrForCohorts() {
        assertFalse(new BreakdownValuesQueryBuilder(context(funnel("a", "b"))).build().isPresent());

        QueryContext cohorts = context(funnel("a", "b")
            .breakdown(BreakdownSpec.builder(BreakdownType.COHORT).cohorts(POWER_USERS_COHORT_ID).build()));
        assertFalse(new BreakdownValuesQueryBuilder(cohorts).build().isPresent());
    }
}
