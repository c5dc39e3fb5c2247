package com.ns.funnel.results;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Keeps the {@code limit} breakdown rows with the most actors at the from-step and merges
 * the rest into a single "Other" row.
 */
public class BreakdownOtherCollapser {
    private static final Logger logger = LoggerFactory.getLogger(BreakdownOtherCollapser.class);

    public static final String OTHER = "Other";

    private final int limit;
    private final int fromStep;

    public BreakdownOtherCollapser(int limit, int fromStep) {
        if (limit < 1) {
            throw new IllegalArgumentException("Breakdown limit must be positive");
        }
        this.limit = limit;
        this.fromStep = fromStep;
    }

    public List<StepCountsRow> collapse(List<StepCountsRow> rows) {
        List<StepCountsRow> ranked = new ArrayList<>(rows);
        ranked.sort(Comparator.comparingLong((StepCountsRow row) -> row.reachedAtLeast(fromStep)).reversed()
            .thenComparing(row -> String.valueOf(row.getBreakdownValue())));
        if (ranked.size() <= limit) {
            return ranked;
        }
        List<StepCountsRow> kept = new ArrayList<>(ranked.subList(0, limit));
        List<StepCountsRow> rest = ranked.subList(limit, ranked.size());
        logger.debug("Merging {} breakdown rows into {}", rest.size(), OTHER);
        kept.add(merge(rest));
        return kept;
    }

    /** Counts add up, averages are weighted by the actors making each hop, medians are dropped. */
    static StepCountsRow merge(List<StepCountsRow> rows) {
        int steps = rows.get(0).getStepCount();
        List<Long> stoppedAt = new ArrayList<>();
        for (int i = 0; i < steps; i++) {
            long total = 0;
            for (StepCountsRow row : rows) {
                total += row.getStoppedAt().get(i);
            }
            stoppedAt.add(total);
        }
        List<Double> averages = new ArrayList<>();
        List<Double> medians = new ArrayList<>();
        for (int hop = 0; hop < steps - 1; hop++) {
            double weighted = 0;
            long weight = 0;
            for (StepCountsRow row : rows) {
                Double average = row.getAverageConversionTimes().get(hop);
                long converted = row.reachedAtLeast(hop + 1);
                if (average != null && converted > 0) {
                    weighted += average * converted;
                    weight += converted;
                }
            }
            averages.add(weight == 0 ? null : weighted / weight);
            medians.add(null);
        }
        Object value = rows.get(0).getBreakdownValue() instanceof List ? List.of(OTHER) : OTHER;
        return new StepCountsRow(stoppedAt, averages, medians, value);
    }
}
