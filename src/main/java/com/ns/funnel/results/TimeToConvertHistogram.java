package com.ns.funnel.results;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Dense histogram of per-actor conversion times. Every bin from the first to one past the
 * last is present, empty ones with a zero count.
 */
public final class TimeToConvertHistogram {
    private static final Logger logger = LoggerFactory.getLogger(TimeToConvertHistogram.class);

    private final List<HistogramBin> bins;
    private final Double averageConversionTime;
    private final long binWidthSeconds;

    private TimeToConvertHistogram(List<HistogramBin> bins, Double averageConversionTime, long binWidthSeconds) {
        this.bins = Collections.unmodifiableList(bins);
        this.averageConversionTime = averageConversionTime;
        this.binWidthSeconds = binWidthSeconds;
    }

    /**
     * @param timings seconds from the from-step to the to-step, one entry per converted actor
     * @param requestedBinCount custom bin count, clamped; the automatic count when empty
     */
    public static TimeToConvertHistogram build(List<Double> timings, Optional<Integer> requestedBinCount,
                                               TimeToConvertBinning binning) {
        long from = 0;
        long to = 0;
        Double average = null;
        if (!timings.isEmpty()) {
            double min = Double.MAX_VALUE;
            double max = -Double.MAX_VALUE;
            double sum = 0;
            for (double timing : timings) {
                min = Math.min(min, timing);
                max = Math.max(max, timing);
                sum += timing;
            }
            from = (long) Math.floor(min);
            to = (long) Math.ceil(max);
            average = Math.round(sum / timings.size() * 100) / 100.0;
        }
        int binCount = requestedBinCount.map(binning::clampCustom).orElseGet(() -> binning.autoBinCount(timings.size()));
        long width = binning.binWidth(from, to, binCount);
        logger.debug("Histogram of {} timings: from={} to={} bins={} width={}", timings.size(), from, to, binCount, width);

        long[] counts = new long[binCount + 1];
        for (double timing : timings) {
            int bin = (int) Math.floor((timing - from) / width);
            counts[Math.min(bin, binCount)]++;
        }
        List<HistogramBin> bins = new ArrayList<>();
        for (int k = 0; k <= binCount; k++) {
            bins.add(new HistogramBin(from + k * width, counts[k]));
        }
        return new TimeToConvertHistogram(bins, average, width);
    }

    public List<HistogramBin> getBins() { return bins; }
    public Optional<Double> getAverageConversionTime() { return Optional.ofNullable(averageConversionTime); }
    public long getBinWidthSeconds() { return binWidthSeconds; }

    public int getBinCount() {
        return bins.size() - 1;
    }
}
