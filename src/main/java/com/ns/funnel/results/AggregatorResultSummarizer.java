package com.ns.funnel.results;

import com.ns.funnel.udf.AggregatorResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds per-actor aggregator results into step count rows, the same shape the step counts
 * query returns: one row per breakdown value, each actor counted once at its furthest step.
 */
public class AggregatorResultSummarizer {
    private final int numSteps;

    public AggregatorResultSummarizer(int numSteps) {
        this.numSteps = numSteps;
    }

    /** @param resultsByActor aggregator output keyed by actor, in any order */
    public List<StepCountsRow> summarize(Map<?, List<AggregatorResult>> resultsByActor) {
        Map<Object, Bucket> buckets = new LinkedHashMap<>();
        for (List<AggregatorResult> results : resultsByActor.values()) {
            for (AggregatorResult best : furthestPerBreakdown(results).values()) {
                buckets.computeIfAbsent(best.getBreakdown(), value -> new Bucket()).add(best);
            }
        }
        List<StepCountsRow> rows = new ArrayList<>();
        buckets.forEach((value, bucket) -> rows.add(bucket.toRow(value)));
        rows.sort(Comparator.comparingLong((StepCountsRow row) -> row.reachedAtLeast(0)).reversed()
            .thenComparing(row -> String.valueOf(row.getBreakdownValue())));
        return rows;
    }

    private static Map<Object, AggregatorResult> furthestPerBreakdown(List<AggregatorResult> results) {
        Map<Object, AggregatorResult> furthest = new LinkedHashMap<>();
        for (AggregatorResult result : results) {
            AggregatorResult current = furthest.get(result.getBreakdown());
            if (current == null || result.getStepReached() > current.getStepReached()) {
                furthest.put(result.getBreakdown(), result);
            }
        }
        return furthest;
    }

    static Double median(List<Long> values) {
        if (values.isEmpty()) {
            return null;
        }
        List<Long> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int middle = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(middle).doubleValue();
        }
        return (sorted.get(middle - 1) + sorted.get(middle)) / 2.0;
    }

    private final class Bucket {
        private final long[] stoppedAt = new long[numSteps];
        private final List<List<Long>> hopTimes = new ArrayList<>();

        Bucket() {
            for (int i = 0; i < numSteps - 1; i++) {
                hopTimes.add(new ArrayList<>());
            }
        }

        void add(AggregatorResult result) {
            stoppedAt[result.getStepReached()]++;
            List<Long> conversionTimes = result.getConversionTimes();
            for (int hop = 0; hop < conversionTimes.size(); hop++) {
                Long time = conversionTimes.get(hop);
                if (time != null) {
                    hopTimes.get(hop).add(time);
                }
            }
        }

        StepCountsRow toRow(Object value) {
            List<Long> counts = new ArrayList<>();
            for (long count : stoppedAt) {
                counts.add(count);
            }
            List<Double> averages = new ArrayList<>();
            List<Double> medians = new ArrayList<>();
            for (List<Long> times : hopTimes) {
                averages.add(times.isEmpty() ? null : times.stream().mapToLong(Long::longValue).average().getAsDouble());
                medians.add(median(times));
            }
            return new StepCountsRow(counts, averages, medians, value);
        }
    }
}
