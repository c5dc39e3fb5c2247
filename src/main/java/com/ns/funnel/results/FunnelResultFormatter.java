package com.ns.funnel.results;

import com.ns.funnel.context.QueryContext;
import com.ns.funnel.context.ResolvedStep;
import com.ns.funnel.model.StepMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns step count rows into per-step results. A step's count is every actor that reached
 * it or went further; counts of a sampled query are scaled back up.
 */
public class FunnelResultFormatter {
    private static final Logger logger = LoggerFactory.getLogger(FunnelResultFormatter.class);

    private final List<StepMatcher> series;
    private final Double samplingFactor;

    public FunnelResultFormatter(List<StepMatcher> series, Optional<Double> samplingFactor) {
        this.series = List.copyOf(series);
        this.samplingFactor = samplingFactor.orElse(null);
        if (this.samplingFactor != null && (this.samplingFactor <= 0 || this.samplingFactor > 1)) {
            throw new IllegalArgumentException("Sampling factor must be in (0, 1], got " + this.samplingFactor);
        }
    }

    public static FunnelResultFormatter forContext(QueryContext context) {
        List<StepMatcher> series = context.getSteps().stream().map(ResolvedStep::getMatcher).collect(Collectors.toList());
        return new FunnelResultFormatter(series, context.getSamplingFactor());
    }

    /** One list of steps per row, in row order. */
    public List<List<FunnelStepResult>> format(List<StepCountsRow> rows) {
        List<List<FunnelStepResult>> formatted = new ArrayList<>();
        for (StepCountsRow row : rows) {
            formatted.add(formatRow(row));
        }
        logger.debug("Formatted {} result rows", formatted.size());
        return formatted;
    }

    public List<FunnelStepResult> formatRow(StepCountsRow row) {
        if (row.getStepCount() != series.size()) {
            throw new IllegalArgumentException("Row has " + row.getStepCount() + " steps, funnel has " + series.size());
        }
        List<FunnelStepResult> steps = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            StepMatcher matcher = series.get(i);
            Double average = i == 0 ? null : row.getAverageConversionTimes().get(i - 1);
            Double median = i == 0 ? null : row.getMedianConversionTimes().get(i - 1);
            steps.add(new FunnelStepResult(i, matcher.describe(), matcher.getCustomName().orElse(null),
                correctForSampling(row.reachedAtLeast(i)), average, median, row.getBreakdownValue()));
        }
        return steps;
    }

    long correctForSampling(long count) {
        if (samplingFactor == null) {
            return count;
        }
        return Math.round(count / samplingFactor);
    }
}
