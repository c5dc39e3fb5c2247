package com.ns.funnel.model;

import java.util.Objects;

/**
 * An event that, when it happens between two steps, disqualifies the actor from
 * progressing past {@code fromStep}.
 */
public final class Exclusion {
    private final StepMatcher matcher;
    private final int fromStep;
    private final int toStep;

    public Exclusion(StepMatcher matcher, int fromStep, int toStep) {
        this.matcher = Objects.requireNonNull(matcher, "matcher is null");
        this.fromStep = fromStep;
        this.toStep = toStep;
    }

    public static Exclusion of(StepMatcher matcher, int fromStep, int toStep) {
        return new Exclusion(matcher, fromStep, toStep);
    }

    public StepMatcher getMatcher() { return matcher; }
    public int getFromStep() { return fromStep; }
    public int getToStep() { return toStep; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Exclusion)) return false;
        Exclusion other = (Exclusion) o;
        return fromStep == other.fromStep && toStep == other.toStep && matcher.equals(other.matcher);
    }

    @Override
    public int hashCode() {
        return Objects.hash(matcher, fromStep, toStep);
    }

    @Override
    public String toString() {
        return matcher.describe() + " [" + fromStep + ", " + toStep + "]";
    }
}
