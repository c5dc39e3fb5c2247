package com.ns.funnel.udf;

import com.ns.funnel.model.BreakdownAttribution;
import com.ns.funnel.model.OrderType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * The single-pass routine and the cascading window levels must agree on how far every
 * actor got.
 */
public class CascadeConsistencyTest {

    private static final List<String> NAMES = List.of("A", "B", "C");
    private static final long WINDOW = 60;

    @Test
    @DisplayName("Single-pass and cascade agree on random event streams")
    void singlePassMatchesCascade() {
        Random random = new Random(7);
        for (int round = 0; round < 500; round++) {
            List<String> series = new ArrayList<>();
            int steps = 2 + random.nextInt(3);
            for (int i = 0; i < steps; i++) {
                series.add(NAMES.get(random.nextInt(NAMES.size())));
            }

            List<Long> timestamps = new ArrayList<>();
            List<String> names = new ArrayList<>();
            long ts = 0;
            int count = 1 + random.nextInt(8);
            for (int i = 0; i < count; i++) {
                ts += 1 + random.nextInt(40);
                timestamps.add(ts);
                names.add(NAMES.get(random.nextInt(NAMES.size())));
            }

            CascadeSimulator cascade = new CascadeSimulator(series, WINDOW);
            List<AggregatorEvent> events = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                events.add(new AggregatorEvent(timestamps.get(i), "e" + i, null, cascade.codes(names.get(i))));
            }
            FunnelAggregator aggregator = new FunnelAggregator(steps, WINDOW, BreakdownAttribution.firstTouch(),
                OrderType.SEQUENTIAL, List.of(), List.of());

            int singlePass = aggregator.aggregate(events).stream().mapToInt(AggregatorResult::getSteps).max().orElse(0);
            int expected = cascade.stepsReached(timestamps, names);

            assertEquals(expected, singlePass, "Series " + series + " over " + names + " at " + timestamps);
        }
    }
}
