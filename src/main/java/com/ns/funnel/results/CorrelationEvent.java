package com.ns.funnel.results;

import java.util.Objects;

public final class CorrelationEvent {
    public enum Outcome {
        SUCCESS,
        FAILURE
    }

    private final String name;
    private final long successCount;
    private final long failureCount;
    private final double oddsRatio;
    private final Outcome outcome;

    public CorrelationEvent(String name, long successCount, long failureCount, double oddsRatio, Outcome outcome) {
        this.name = name;
        this.successCount = successCount;
        this.failureCount = failureCount;
        this.oddsRatio = oddsRatio;
        this.outcome = outcome;
    }

    public String getName() { return name; }
    public long getSuccessCount() { return successCount; }
    public long getFailureCount() { return failureCount; }
    public double getOddsRatio() { return oddsRatio; }
    public Outcome getOutcome() { return outcome; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CorrelationEvent)) return false;
        CorrelationEvent that = (CorrelationEvent) o;
        return successCount == that.successCount
            && failureCount == that.failureCount
            && Double.compare(oddsRatio, that.oddsRatio) == 0
            && name.equals(that.name)
            && outcome == that.outcome;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, successCount, failureCount, oddsRatio, outcome);
    }

    @Override
    public String toString() {
        return "CorrelationEvent{" + name + ", odds=" + oddsRatio + ", " + outcome + "}";
    }
}
