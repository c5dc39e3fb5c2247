package com.ns.funnel.aggregation;

import com.ns.funnel.ast.QueryPrinter;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.model.BreakdownSpec;
import com.ns.funnel.model.BreakdownType;
import com.ns.funnel.model.EventMatch;
import com.ns.funnel.model.FunnelSpec;
import org.junit.jupiter.api.Test;

import static com.ns.funnel.FunnelTestSupport.context;
import static com.ns.funnel.FunnelTestSupport.funnel;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StepCountsQueryBuilderTest {

    @Test
    void countsEveryStepOnceForEachActor() {
        String sql = QueryPrinter.print(new StepCountsQueryBuilder(context(funnel("a", "b", "c"))).build());

        assertTrue(sql.startsWith("SELECT countIf(steps = 1) AS step_1, countIf(steps = 2) AS step_2, "
            + "countIf(steps = 3) AS step_3, "
            + "avg(step_1_average_conversion_time_inner) AS step_1_average_conversion_time, "
            + "avg(step_2_average_conversion_time_inner) AS step_2_average_conversion_time, "
            + "median(step_1_median_conversion_time_inner) AS step_1_median_conversion_time, "
            + "median(step_2_median_conversion_time_inner) AS step_2_median_conversion_time FROM (SELECT "
            + "aggregation_target, steps, avg(step_1_conversion_time) AS step_1_average_conversion_time_inner"), sql);
        assertTrue(sql.contains("max(steps) OVER (PARTITION BY aggregation_target) AS max_steps"), sql);
        assertTrue(sql.contains("GROUP BY aggregation_target, steps HAVING steps = max(max_steps)"), sql);
        assertTrue(sql.endsWith("ORDER BY step_1 DESC"), sql);
        assertFalse(sql.contains("GROUP BY prop"), sql);
    }

    @Test
    void groupsByBreakdownValue() {
        QueryContext context = context(funnel("a", "b")
            .breakdown(BreakdownSpec.builder(BreakdownType.EVENT).properties("$browser").build()));

        String sql = QueryPrinter.print(new StepCountsQueryBuilder(context).build());

        assertTrue(sql.contains("median(step_1_median_conversion_time_inner) AS step_1_median_conversion_time, prop FROM"), sql);
        assertTrue(sql.contains("max(steps) OVER (PARTITION BY aggregation_target, prop) AS max_steps"), sql);
        assertTrue(sql.contains("GROUP BY aggregation_target, steps, prop HAVING"), sql);
        assertTrue(sql.endsWith("GROUP BY prop ORDER BY step_1 DESC, prop ASC"), sql);
    }

    @Test
    void actorStepsCarryTimestampsAndMatchingEvents() {
        QueryContext context = context(funnel("a", "b", "c"));

        String sql = QueryPrinter.print(new StepCountsQueryBuilder(context).actorStepsQuery(true, true));

        assertTrue(sql.contains("argMax(latest_0, steps) AS first_timestamp, argMax(latest_2, steps) AS final_timestamp"), sql);
        assertTrue(sql.contains("groupArray(10)(step_0_matching_event) AS step_0_matching_events"), sql);
        assertTrue(sql.contains("groupArray(10)(step_2_matching_event) AS step_2_matching_events"), sql);
        assertTrue(sql.contains("groupArray(10)(final_matching_event) AS final_matching_events"), sql);
        assertTrue(sql.contains("latest_0, latest_2, step_0_matching_event"), sql);
    }

    @Test
    void singlePassFunnelsReadTheAggregatedSource() {
        QueryContext context = context(FunnelSpec.builder()
            .steps(EventMatch.of("a"), EventMatch.of("b").asOptional(), EventMatch.of("c"))
            .dateRange("2024-01-01", "2024-01-31"));

        String sql = QueryPrinter.print(new StepCountsQueryBuilder(context).build());

        assertTrue(sql.contains("aggregate_funnel("), sql);
        assertFalse(sql.contains("OVER (PARTITION BY aggregation_target ORDER BY"), sql);
    }
}
