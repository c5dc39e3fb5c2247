package com.ns.funnel.context;

import java.util.Objects;

public final class ResolvedExclusion {
    private final int index;
    private final ResolvedStep step;
    private final int fromStep;
    private final int toStep;

    public ResolvedExclusion(int index, ResolvedStep step, int fromStep, int toStep) {
        this.index = index;
        this.step = Objects.requireNonNull(step, "step is null");
        this.fromStep = fromStep;
        this.toStep = toStep;
    }

    public int getIndex() { return index; }
    public ResolvedStep getStep() { return step; }
    public int getFromStep() { return fromStep; }
    public int getToStep() { return toStep; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedExclusion)) return false;
        ResolvedExclusion other = (ResolvedExclusion) o;
        return index == other.index && fromStep == other.fromStep && toStep == other.toStep && step.equals(other.step);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, step, fromStep, toStep);
    }
}
