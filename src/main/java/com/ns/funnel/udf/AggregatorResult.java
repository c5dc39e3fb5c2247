package com.ns.funnel.udf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * How far one actor got, under one breakdown value. {@code stepReached} is the 0-indexed
 * last step reached; skipped optional steps have no time and no conversion time.
 */
public final class AggregatorResult {
    private final int stepReached;
    private final Object breakdown;
    private final List<Long> stepTimes;
    private final List<Long> conversionTimes;
    private final List<String> uuids;

    public AggregatorResult(int stepReached, Object breakdown, List<Long> stepTimes, List<Long> conversionTimes, List<String> uuids) {
        this.stepReached = stepReached;
        this.breakdown = breakdown;
        this.stepTimes = Collections.unmodifiableList(new ArrayList<>(stepTimes));
        this.conversionTimes = Collections.unmodifiableList(new ArrayList<>(conversionTimes));
        this.uuids = Collections.unmodifiableList(new ArrayList<>(uuids));
    }

    public int getStepReached() { return stepReached; }

    /** Number of steps reached, as the {@code steps} column counts them. */
    public int getSteps() { return stepReached + 1; }

    public Object getBreakdown() { return breakdown; }
    public List<Long> getStepTimes() { return stepTimes; }

    /** One entry per step after the first up to {@code stepReached}, in seconds. */
    public List<Long> getConversionTimes() { return conversionTimes; }

    public List<String> getUuids() { return uuids; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregatorResult)) return false;
        AggregatorResult that = (AggregatorResult) o;
        return stepReached == that.stepReached
            && Objects.equals(breakdown, that.breakdown)
            && stepTimes.equals(that.stepTimes)
            && conversionTimes.equals(that.conversionTimes)
            && uuids.equals(that.uuids);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepReached, breakdown, stepTimes, conversionTimes, uuids);
    }

    @Override
    public String toString() {
        return "AggregatorResult{steps=" + getSteps() + ", breakdown=" + breakdown + ", conversionTimes=" + conversionTimes + "}";
    }
}
