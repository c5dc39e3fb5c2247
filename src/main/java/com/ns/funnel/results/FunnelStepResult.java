package com.ns.funnel.results;

import java.util.Objects;
import java.util.Optional;

/**
 * One step of a formatted funnel: how many actors reached it and how long the hop into it took.
 */
public final class FunnelStepResult {
    private final int order;
    private final String name;
    private final String customName;
    private final long count;
    private final Double averageConversionTime;
    private final Double medianConversionTime;
    private final Object breakdownValue;

    public FunnelStepResult(int order, String name, String customName, long count, Double averageConversionTime,
                            Double medianConversionTime, Object breakdownValue) {
        this.order = order;
        this.name = name;
        this.customName = customName;
        this.count = count;
        this.averageConversionTime = averageConversionTime;
        this.medianConversionTime = medianConversionTime;
        this.breakdownValue = breakdownValue;
    }

    public int getOrder() { return order; }
    public String getName() { return name; }
    public Optional<String> getCustomName() { return Optional.ofNullable(customName); }
    public long getCount() { return count; }
    public Optional<Double> getAverageConversionTime() { return Optional.ofNullable(averageConversionTime); }
    public Optional<Double> getMedianConversionTime() { return Optional.ofNullable(medianConversionTime); }
    public Object getBreakdownValue() { return breakdownValue; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunnelStepResult)) return false;
        FunnelStepResult that = (FunnelStepResult) o;
        return order == that.order
            && count == that.count
            && Objects.equals(name, that.name)
            && Objects.equals(customName, that.customName)
            && Objects.equals(averageConversionTime, that.averageConversionTime)
            && Objects.equals(medianConversionTime, that.medianConversionTime)
            && Objects.equals(breakdownValue, that.breakdownValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(order, name, customName, count, averageConversionTime, medianConversionTime, breakdownValue);
    }

    @Override
    public String toString() {
        return "FunnelStepResult{" + order + " " + name + ": " + count + "}";
    }
}
