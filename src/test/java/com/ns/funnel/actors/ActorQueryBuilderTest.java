package com.ns.funnel.actors;

import com.ns.funnel.context.FunnelValidationException;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.context.ValidationCode;
import com.ns.funnel.model.BreakdownSpec;
import com.ns.funnel.model.BreakdownType;
import com.ns.funnel.model.EventMatch;
import com.ns.funnel.model.FunnelSpec;
import com.ns.funnel.model.OrderType;
import com.ns.funnel.model.VizMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;
import java.util.List;

import static com.ns.funnel.FunnelTestSupport.context;
import static com.ns.funnel.FunnelTestSupport.funnel;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ActorQueryBuilderTest {

    private final QueryContext steps = context(funnel("a", "b", "c"));

    private String sql(QueryContext context, ActorTarget target) {
        return new ActorQueryBuilder(context).build(target).toSql();
    }

    @Test
    void positiveStepSelectsEveryoneWhoGotThatFar() {
        String sql = sql(steps, ActorTarget.builder().step(2).limit(100).offset(200).build());

        assertTrue(sql.startsWith("SELECT aggregation_target AS actor_id FROM (SELECT aggregation_target, steps"), sql);
        assertTrue(sql.endsWith("WHERE steps IN (2, 3) GROUP BY actor_id ORDER BY actor_id ASC LIMIT 100 OFFSET 200"), sql);
    }

    @Test
    void lastStepIsAnEquality() {
        String sql = sql(steps, ActorTarget.builder().step(3).build());

        assertTrue(sql.endsWith("WHERE steps = 3 GROUP BY actor_id ORDER BY actor_id ASC"), sql);
    }

    @Test
    void negativeStepSelectsDropOffs() {
        String sql = sql(steps, ActorTarget.builder().step(-3).build());

        assertTrue(sql.endsWith("WHERE steps = 2 GROUP BY actor_id ORDER BY actor_id ASC"), sql);
    }

    @Test
    void customStepsAreMatchedExactly() {
        String sql = sql(steps, ActorTarget.builder().customSteps(List.of(1, 3)).build());

        assertTrue(sql.contains("WHERE steps IN (1, 3)"), sql);
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 0, 4, -4})
    void stepsOutsideTheFunnelAreRejected(int step) {
        FunnelValidationException e = assertThrows(FunnelValidationException.class,
            () -> sql(steps, ActorTarget.builder().step(step).build()));
        assertEquals(ValidationCode.ACTOR_TARGET_INVALID, e.getCode());
    }

    @Test
    void recordingsCarryTheMatchingEventsOfTheStep() {
        String sql = sql(steps, ActorTarget.builder().step(2).includeRecordings(true).build());

        assertTrue(sql.startsWith("SELECT aggregation_target AS actor_id, any(step_1_matching_events) AS matching_events FROM"), sql);
        assertTrue(sql.contains("groupArray(10)(step_1_matching_event) AS step_1_matching_events"), sql);

        String dropOffs = sql(steps, ActorTarget.builder().step(-2).includeRecordings(true).build());
        assertTrue(dropOffs.contains("any(final_matching_events) AS matching_events"), dropOffs);
    }

    @Test
    void recordingsAreNotAvailableForUnorderedOrSinglePassFunnels() {
        QueryContext unordered = context(funnel("a", "b").orderType(OrderType.UNORDERED));
        QueryContext optional = context(FunnelSpec.builder()
            .steps(EventMatch.of("a"), EventMatch.of("b").asOptional(), EventMatch.of("c")));
        ActorTarget target = ActorTarget.builder().step(1).includeRecordings(true).build();

        assertThrows(FunnelValidationException.class, () -> sql(unordered, target));
        assertThrows(FunnelValidationException.class, () -> sql(optional, target));
    }

    @Test
    void breakdownValueFiltersTheActors() {
        QueryContext context = context(funnel("a", "b")
            .breakdown(BreakdownSpec.builder(BreakdownType.EVENT).properties("$browser").build()));

        String sql = sql(context, ActorTarget.builder().step(1).breakdownValue(List.of("Chrome")).build());

        assertTrue(sql.contains("WHERE (steps IN (1, 2) AND arrayFlatten(array(prop)) = arrayFlatten(array('Chrome')))"), sql);
    }

    @Test
    void breakdownValueNeedsABreakdown() {
        assertThrows(FunnelValidationException.class,
            () -> sql(steps, ActorTarget.builder().step(1).breakdownValue(List.of("Chrome")).build()));
    }

    @Test
    void trendsActorsAreSelectedByPeriod() {
        QueryContext trends = context(funnel("a", "b").vizMode(VizMode.TRENDS));
        LocalDateTime period = LocalDateTime.of(2024, 1, 15, 0, 0);

        String converted = sql(trends, ActorTarget.builder().entrancePeriod(period, false).build());
        String dropped = sql(trends, ActorTarget.builder().entrancePeriod(period, true).build());

        assertTrue(converted.contains("WHERE (entrance_period_start = toDateTime('2024-01-15 00:00:00', 'UTC') "
            + "AND steps_completed >= 2) GROUP BY actor_id"), converted);
        assertTrue(dropped.contains("WHERE (entrance_period_start = toDateTime('2024-01-15 00:00:00', 'UTC') "
            + "AND steps_completed >= 1 AND NOT (steps_completed >= 2)) GROUP BY actor_id"), dropped);
    }

    @Test
    void targetMustMatchTheVizMode() {
        QueryContext trends = context(funnel("a", "b").vizMode(VizMode.TRENDS));

        assertThrows(FunnelValidationException.class, () -> sql(trends, ActorTarget.builder().step(1).build()));
        assertThrows(FunnelValidationException.class,
            () -> sql(steps, ActorTarget.builder().entrancePeriod(LocalDateTime.of(2024, 1, 15, 0, 0), false).build()));
    }
}
