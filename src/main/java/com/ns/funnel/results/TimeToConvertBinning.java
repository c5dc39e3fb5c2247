package com.ns.funnel.results;

import com.ns.funnel.config.FunnelCompilerConfig;

/**
 * Bin count and width rules of the time-to-convert histogram, shared by the query
 * builder and {@link TimeToConvertHistogram}.
 */
public final class TimeToConvertBinning {
    private final int maxBinCount;
    private final int autoMaxBinCount;
    private final int defaultBinWidthSeconds;

    public TimeToConvertBinning(int maxBinCount, int autoMaxBinCount, int defaultBinWidthSeconds) {
        if (maxBinCount < 1 || autoMaxBinCount < 1 || defaultBinWidthSeconds < 1) {
            throw new IllegalArgumentException("Bin limits must be positive");
        }
        this.maxBinCount = maxBinCount;
        this.autoMaxBinCount = autoMaxBinCount;
        this.defaultBinWidthSeconds = defaultBinWidthSeconds;
    }

    public static TimeToConvertBinning forConfig(FunnelCompilerConfig config) {
        return new TimeToConvertBinning(config.getMaxBinCount(), config.getAutoMaxBinCount(), config.getDefaultBinWidthSeconds());
    }

    public int getMaxBinCount() { return maxBinCount; }
    public int getAutoMaxBinCount() { return autoMaxBinCount; }
    public int getDefaultBinWidthSeconds() { return defaultBinWidthSeconds; }

    public int clampCustom(int requested) {
        return Math.max(1, Math.min(maxBinCount, requested));
    }

    /** Cube root of the sample size, at least one bin and at most the automatic cap. */
    public int autoBinCount(long sampleCount) {
        if (sampleCount < 2) {
            return 1;
        }
        int bins = (int) Math.ceil(Math.cbrt(sampleCount));
        return Math.max(1, Math.min(autoMaxBinCount, bins));
    }

    public long binWidth(long fromSeconds, long toSeconds, int binCount) {
        long width = (long) Math.ceil((double) (toSeconds - fromSeconds) / binCount);
        return width > 0 ? width : defaultBinWidthSeconds;
    }
}
