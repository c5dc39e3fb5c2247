package com.ns.funnel.results;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One row of the step counts query: how many actors stopped at each step, and the
 * average and median time of every hop, for one breakdown value.
 */
public final class StepCountsRow {
    private final List<Long> stoppedAt;
    private final List<Double> averageConversionTimes;
    private final List<Double> medianConversionTimes;
    private final Object breakdownValue;

    /**
     * @param stoppedAt {@code step_1..step_n}: actors whose furthest step is exactly that step
     * @param averageConversionTimes one entry per hop, null when no actor made it
     * @param medianConversionTimes one entry per hop, null when no actor made it
     */
    public StepCountsRow(List<Long> stoppedAt, List<Double> averageConversionTimes, List<Double> medianConversionTimes,
                         Object breakdownValue) {
        this.stoppedAt = List.copyOf(stoppedAt);
        this.averageConversionTimes = Collections.unmodifiableList(new ArrayList<>(averageConversionTimes));
        this.medianConversionTimes = Collections.unmodifiableList(new ArrayList<>(medianConversionTimes));
        this.breakdownValue = breakdownValue;
        if (averageConversionTimes.size() != stoppedAt.size() - 1 || medianConversionTimes.size() != stoppedAt.size() - 1) {
            throw new IllegalArgumentException("Expected " + (stoppedAt.size() - 1) + " conversion times per row");
        }
    }

    public List<Long> getStoppedAt() { return stoppedAt; }
    public List<Double> getAverageConversionTimes() { return averageConversionTimes; }
    public List<Double> getMedianConversionTimes() { return medianConversionTimes; }
    public Object getBreakdownValue() { return breakdownValue; }

    public int getStepCount() {
        return stoppedAt.size();
    }

    /** Actors that reached step {@code index} (0-indexed) or further. */
    public long reachedAtLeast(int index) {
        long total = 0;
        for (int i = index; i < stoppedAt.size(); i++) {
            total += stoppedAt.get(i);
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StepCountsRow)) return false;
        StepCountsRow that = (StepCountsRow) o;
        return stoppedAt.equals(that.stoppedAt)
            && averageConversionTimes.equals(that.averageConversionTimes)
            && medianConversionTimes.equals(that.medianConversionTimes)
            && Objects.equals(breakdownValue, that.breakdownValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stoppedAt, averageConversionTimes, medianConversionTimes, breakdownValue);
    }

    @Override
    public String toString() {
        return "StepCountsRow{" + breakdownValue + ": " + stoppedAt + ", avg=" + averageConversionTimes + "}";
    }
}
