package com.ns.funnel.aggregation;

import com.ns.funnel.ast.QueryPrinter;
import com.ns.funnel.context.QueryContext;
import org.junit.jupiter.api.Test;

import static com.ns.funnel.FunnelTestSupport.context;
import static com.ns.funnel.FunnelTestSupport.funnel;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TimeToConvertQueryBuilderTest {

    @Test
    void sumsHopTimesBetweenFromAndToStep() {
        QueryContext context = context(funnel("a", "b", "c", "d").fromStep(1).toStep(3));

        String sql = QueryPrinter.print(new TimeToConvertQueryBuilder(context).stepRuns());

        assertTrue(sql.startsWith("SELECT aggregation_target, "
            + "(step_2_average_conversion_time_inner + step_3_average_conversion_time_inner) AS timings FROM ("), sql);
        assertTrue(sql.endsWith("WHERE steps >= 4"), sql);
    }

    @Test
    void fillsEveryBinOfTheHistogram() {
        String sql = QueryPrinter.print(new TimeToConvertQueryBuilder(context(funnel("a", "b"))).build());

        assertTrue(sql.startsWith("WITH step_runs AS (SELECT aggregation_target, step_1_average_conversion_time_inner AS timings"), sql);
        assertTrue(sql.contains("), histogram_params AS (SELECT ifNull(floor(min(timings)), 0) AS from_seconds, "
            + "ifNull(ceil(max(timings)), 0) AS to_seconds, round(avg(timings), 2) AS average_conversion_time, "
            + "if(count() >= 2, least(60, ceil(cbrt(count()))), 1) AS bin_count, "
            + "if(ceil(((to_seconds - from_seconds) / bin_count)) > 0, ceil(((to_seconds - from_seconds) / bin_count)), 60) "
            + "AS bin_width_seconds FROM step_runs)"), sql);
        assertTrue(sql.contains("FROM numbers((ifNull((SELECT bin_count FROM histogram_params), 0) + 1))"), sql);
        assertTrue(sql.contains("(SELECT average_conversion_time FROM histogram_params) AS average_conversion_time"), sql);
        assertTrue(sql.contains("AS results RIGHT OUTER JOIN (SELECT "), sql);
        assertTrue(sql.endsWith("AS fill ON results.bin_from_seconds = fill.bin_from_seconds ORDER BY bin_from_seconds ASC"), sql);
    }

    @Test
    void customBinCountIsClamped() {
        QueryContext context = context(funnel("a", "b").binCount(500));

        String sql = QueryPrinter.print(new TimeToConvertQueryBuilder(context).histogramParams());

        assertTrue(sql.contains("90 AS bin_count"), sql);
    }
}
