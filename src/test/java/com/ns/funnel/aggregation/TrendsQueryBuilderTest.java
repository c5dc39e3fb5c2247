package com.ns.funnel.aggregation;

import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.QueryPrinter;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.model.BreakdownSpec;
import com.ns.funnel.model.BreakdownType;
import com.ns.funnel.model.IntervalUnit;
import com.ns.funnel.model.VizMode;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;

import static com.ns.funnel.FunnelTestSupport.context;
import static com.ns.funnel.FunnelTestSupport.funnel;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TrendsQueryBuilderTest {

    private static final String FROM = "toDateTime('2024-01-01 00:00:00', 'UTC')";
    private static final String TO = "toDateTime('2024-01-31 23:59:59', 'UTC')";

    @Test
    void fillsEveryDayOfTheRange() {
        QueryContext context = context(funnel("a", "b").vizMode(VizMode.TRENDS));

        assertEquals("SELECT (toStartOfDay(" + FROM + ") + toIntervalDay(number)) AS entrance_period_start "
                + "FROM numbers((dateDiff('day', toStartOfDay(" + FROM + "), toStartOfDay(" + TO + ")) + 1))",
            QueryPrinter.print(new TrendsQueryBuilder(context).fillQuery()));
    }

    @Test
    void weeksStartOnTheConfiguredDay() {
        QueryContext sunday = context(funnel("a", "b").interval(IntervalUnit.WEEK));
        QueryContext monday = context(funnel("a", "b").interval(IntervalUnit.WEEK).weekStartDay(DayOfWeek.MONDAY));

        assertEquals("toStartOfWeek(timestamp, 0)",
            QueryPrinter.print(new TrendsQueryBuilder(sunday).startOfPeriod(Exprs.field("timestamp"))));
        assertEquals("toStartOfWeek(timestamp, 3)",
            QueryPrinter.print(new TrendsQueryBuilder(monday).startOfPeriod(Exprs.field("timestamp"))));
    }

    @Test
    void countsActorsPerEntrancePeriod() {
        QueryContext context = context(funnel("a", "b", "c").fromStep(0).toStep(2).interval(IntervalUnit.HOUR));

        String sql = QueryPrinter.print(new TrendsQueryBuilder(context).build());

        assertTrue(sql.startsWith("WITH period_data AS (SELECT entrance_period_start, "
            + "countIf(steps_completed >= 1) AS reached_from_step_count, "
            + "countIf(steps_completed >= 3) AS reached_to_step_count, "
            + "if(reached_from_step_count > 0, round(((reached_to_step_count / reached_from_step_count) * 100), 2), 0) "
            + "AS conversion_rate FROM (SELECT aggregation_target, toStartOfHour(timestamp) AS entrance_period_start, "
            + "max(steps) AS steps_completed FROM ("), sql);
        assertTrue(sql.contains("SELECT fill.entrance_period_start AS entrance_period_start, "
            + "ifNull(data.reached_from_step_count, 0) AS reached_from_step_count, "
            + "ifNull(data.reached_to_step_count, 0) AS reached_to_step_count, "
            + "ifNull(data.conversion_rate, 0) AS conversion_rate FROM period_data AS data RIGHT OUTER JOIN (SELECT "), sql);
        assertTrue(sql.endsWith("AS fill ON data.entrance_period_start = fill.entrance_period_start "
            + "ORDER BY entrance_period_start ASC"), sql);
    }

    @Test
    void crossJoinsPeriodsWithBreakdownValues() {
        QueryContext context = context(funnel("a", "b")
            .breakdown(BreakdownSpec.builder(BreakdownType.EVENT).properties("$browser").build()));

        String sql = QueryPrinter.print(new TrendsQueryBuilder(context).build());

        assertTrue(sql.contains("GROUP BY aggregation_target, entrance_period_start, prop) GROUP BY entrance_period_start, prop)"), sql);
        assertTrue(sql.contains("AS fill CROSS JOIN (SELECT DISTINCT prop FROM period_data) AS breakdown_values "
            + "LEFT OUTER JOIN period_data AS data ON (data.entrance_period_start = fill.entrance_period_start "
            + "AND data.prop = breakdown_values.prop)"), sql);
        assertTrue(sql.contains("breakdown_values.prop AS prop FROM"), sql);
        assertTrue(sql.endsWith("ORDER BY entrance_period_start ASC, prop ASC"), sql);
    }
}
