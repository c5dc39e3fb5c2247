package com.ns.funnel.udf;

import com.ns.funnel.model.BreakdownAttribution;
import com.ns.funnel.model.OrderType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FunnelAggregatorTest {

    private static final long DAY = 86_400L;
    private static final long WEEK = 7 * DAY;

    private static FunnelAggregator aggregator(int steps, long window, OrderType order) {
        return new FunnelAggregator(steps, window, BreakdownAttribution.firstTouch(), order, List.of(), List.of());
    }

    private static AggregatorResult single(List<AggregatorResult> results) {
        assertEquals(1, results.size(), "Expected exactly one result: " + results);
        return results.get(0);
    }

    @Test
    @DisplayName("Third step outside the window stops the actor at step two")
    void windowCutsOffLateStep() {
        List<AggregatorEvent> events = List.of(
            AggregatorEvent.of(0, "a", 1),
            AggregatorEvent.of(DAY, "b", 2),
            AggregatorEvent.of(10 * DAY, "c", 3));

        AggregatorResult result = single(aggregator(3, WEEK, OrderType.SEQUENTIAL).aggregate(events));

        assertEquals(2, result.getSteps());
        assertEquals(List.of(DAY), result.getConversionTimes());
        assertEquals(List.of("a", "b"), result.getUuids());
    }

    @Test
    void exclusionBetweenStepsCapsAtFromStep() {
        FunnelAggregator aggregator = new FunnelAggregator(2, WEEK, BreakdownAttribution.firstTouch(), OrderType.SEQUENTIAL,
            List.of(new FunnelAggregator.ExclusionRange(0, 1)), List.of());
        List<AggregatorEvent> events = List.of(
            AggregatorEvent.of(0, "a", 1),
            AggregatorEvent.of(100, "x", -1),
            AggregatorEvent.of(200, "b", 2));

        assertEquals(1, single(aggregator.aggregate(events)).getSteps());
    }

    @Test
    void exclusionAfterRangeIsIgnored() {
        FunnelAggregator aggregator = new FunnelAggregator(2, WEEK, BreakdownAttribution.firstTouch(), OrderType.SEQUENTIAL,
            List.of(new FunnelAggregator.ExclusionRange(0, 1)), List.of());
        List<AggregatorEvent> events = List.of(
            AggregatorEvent.of(0, "a", 1),
            AggregatorEvent.of(200, "b", 2),
            AggregatorEvent.of(300, "x", -1));

        assertEquals(2, single(aggregator.aggregate(events)).getSteps());
    }

    @Test
    void unrelatedEventBreaksStrictChainOnly() {
        List<AggregatorEvent> events = List.of(
            AggregatorEvent.of(0, "a", 1),
            AggregatorEvent.of(50, "other"),
            AggregatorEvent.of(100, "b", 2));

        assertEquals(1, single(aggregator(2, WEEK, OrderType.STRICT).aggregate(events)).getSteps());
        assertEquals(2, single(aggregator(2, WEEK, OrderType.SEQUENTIAL).aggregate(events)).getSteps());
    }

    @Test
    void unorderedCountsStepsInAnyOrder() {
        List<AggregatorEvent> events = List.of(
            AggregatorEvent.of(0, "b", 2),
            AggregatorEvent.of(10, "c", 3),
            AggregatorEvent.of(20, "a", 1));

        AggregatorResult result = single(aggregator(3, WEEK, OrderType.UNORDERED).aggregate(events));

        assertEquals(3, result.getSteps());
        assertEquals(List.of(10L, 10L), result.getConversionTimes());
        assertEquals(0, single(aggregator(3, WEEK, OrderType.SEQUENTIAL).aggregate(events)).getStepReached());
    }

    @Test
    @DisplayName("Different steps sharing a timestamp are taken in step order")
    void sameTimestampDifferentSteps() {
        List<AggregatorEvent> events = List.of(
            AggregatorEvent.of(0, "b", 2),
            AggregatorEvent.of(0, "a", 1));

        AggregatorResult result = single(aggregator(2, WEEK, OrderType.SEQUENTIAL).aggregate(events));

        assertEquals(2, result.getSteps());
        assertEquals(List.of(0L), result.getConversionTimes());
        assertEquals(List.of("a", "b"), result.getUuids());
    }

    @Test
    @DisplayName("A repeated step needs a strictly later event")
    void repeatedStepAtSameTimestamp() {
        FunnelAggregator aggregator = aggregator(2, WEEK, OrderType.SEQUENTIAL);

        List<AggregatorEvent> sameTime = List.of(
            AggregatorEvent.of(0, "a1", 1, 2),
            AggregatorEvent.of(0, "a2", 1, 2));
        assertEquals(1, single(aggregator.aggregate(sameTime)).getSteps());

        List<AggregatorEvent> later = List.of(
            AggregatorEvent.of(0, "a1", 1, 2),
            AggregatorEvent.of(5, "a2", 1, 2));
        AggregatorResult result = single(aggregator.aggregate(later));
        assertEquals(2, result.getSteps());
        assertEquals(List.of(5L), result.getConversionTimes());
    }

    @Test
    void optionalStepMayBeSkipped() {
        FunnelAggregator aggregator = new FunnelAggregator(3, WEEK, BreakdownAttribution.firstTouch(), OrderType.SEQUENTIAL,
            List.of(), List.of(false, true, false));
        List<AggregatorEvent> events = List.of(
            AggregatorEvent.of(0, "a", 1),
            AggregatorEvent.of(10, "c", 3));

        AggregatorResult result = single(aggregator.aggregate(events));

        assertEquals(3, result.getSteps());
        assertEquals(2, result.getConversionTimes().size());
        assertNull(result.getConversionTimes().get(0));
        assertEquals(10L, result.getConversionTimes().get(1));
    }

    @Test
    void firstStepCannotBeOptional() {
        assertThrows(IllegalArgumentException.class, () -> new FunnelAggregator(2, WEEK, BreakdownAttribution.firstTouch(),
            OrderType.SEQUENTIAL, List.of(), List.of(true, false)));
    }

    @Test
    void actorWithoutFirstStepHasNoResult() {
        List<AggregatorEvent> events = List.of(AggregatorEvent.of(0, "b", 2));
        assertTrue(aggregator(2, WEEK, OrderType.SEQUENTIAL).aggregate(events).isEmpty());
    }

    @Test
    void earliestStartWinsTies() {
        List<AggregatorEvent> events = List.of(
            AggregatorEvent.of(0, "a1", 1),
            AggregatorEvent.of(100, "a2", 1));

        AggregatorResult result = single(aggregator(2, WEEK, OrderType.SEQUENTIAL).aggregate(events));

        assertEquals(List.of(0L), result.getStepTimes());
    }

    @Test
    void breakdownAttributionModes() {
        List<AggregatorEvent> events = List.of(
            AggregatorEvent.of(0, "a", 1).withBreakdown("x"),
            AggregatorEvent.of(10, "b", 2).withBreakdown("y"));

        AggregatorResult first = single(new FunnelAggregator(2, WEEK, BreakdownAttribution.firstTouch(), OrderType.SEQUENTIAL,
            List.of(), List.of()).aggregate(events));
        assertEquals("x", first.getBreakdown());
        assertEquals(2, first.getSteps());

        AggregatorResult last = single(new FunnelAggregator(2, WEEK, BreakdownAttribution.lastTouch(), OrderType.SEQUENTIAL,
            List.of(), List.of()).aggregate(events));
        assertEquals("y", last.getBreakdown());

        AggregatorResult all = single(new FunnelAggregator(2, WEEK, BreakdownAttribution.allEvents(), OrderType.SEQUENTIAL,
            List.of(), List.of()).aggregate(events));
        assertEquals("x", all.getBreakdown());
        assertEquals(1, all.getSteps());

        AggregatorResult step = single(new FunnelAggregator(2, WEEK, BreakdownAttribution.step(1), OrderType.SEQUENTIAL,
            List.of(), List.of()).aggregate(events));
        assertEquals("y", step.getBreakdown());
        assertEquals(2, step.getSteps());
    }

    @ParameterizedTest
    @CsvSource({
        "first_touch, FIRST_TOUCH",
        "last_touch, LAST_TOUCH",
        "all_events, ALL_EVENTS",
        "step_2, STEP"
    })
    void attributionArgumentRoundTrip(String argument, BreakdownAttribution.Type type) {
        BreakdownAttribution parsed = FunnelAggregator.parseAttribution(argument);
        assertEquals(type, parsed.getType());
        assertEquals(argument, FunnelAggregator.attributionArgument(parsed));
    }

    @Test
    void orderArguments() {
        assertEquals("ordered", FunnelAggregator.orderArgument(OrderType.SEQUENTIAL));
        assertEquals("strict", FunnelAggregator.orderArgument(OrderType.STRICT));
        assertEquals(OrderType.UNORDERED, FunnelAggregator.parseOrder("unordered"));
        assertEquals(OrderType.SEQUENTIAL, FunnelAggregator.parseOrder("ordered"));
    }

    @Test
    @DisplayName("Unordered equals the best sequential result over every step permutation")
    void unorderedMatchesBestPermutation() {
        int steps = 3;
        long window = 50;
        Random random = new Random(42);
        FunnelAggregator unordered = aggregator(steps, window, OrderType.UNORDERED);
        FunnelAggregator sequential = aggregator(steps, window, OrderType.SEQUENTIAL);
        List<int[]> permutations = permutations(steps);

        for (int round = 0; round < 300; round++) {
            List<AggregatorEvent> events = new ArrayList<>();
            int count = 1 + random.nextInt(6);
            long ts = 0;
            for (int i = 0; i < count; i++) {
                ts += 1 + random.nextInt(30);
                events.add(AggregatorEvent.of(ts, "e" + i, 1 + random.nextInt(steps)));
            }

            int expected = 0;
            for (int[] permutation : permutations) {
                List<AggregatorEvent> recoded = new ArrayList<>();
                for (AggregatorEvent event : events) {
                    int step = event.getCodes().get(0) - 1;
                    recoded.add(AggregatorEvent.of(event.getTimestamp(), event.getUuid(), permutation[step] + 1));
                }
                for (AggregatorResult result : sequential.aggregate(recoded)) {
                    expected = Math.max(expected, result.getSteps());
                }
            }

            int actual = single(unordered.aggregate(events)).getSteps();
            assertEquals(expected, actual, "Mismatch for " + events);
        }
    }

    /** Every permutation, as position of each step. */
    private static List<int[]> permutations(int n) {
        List<int[]> result = new ArrayList<>();
        permute(new int[n], new boolean[n], 0, result);
        return result;
    }

    private static void permute(int[] current, boolean[] used, int index, List<int[]> result) {
        if (index == current.length) {
            result.add(Arrays.copyOf(current, current.length));
            return;
        }
        for (int position = 0; position < current.length; position++) {
            if (!used[position]) {
                used[position] = true;
                current[index] = position;
                permute(current, used, index + 1, result);
                used[position] = false;
            }
        }
    }
}
