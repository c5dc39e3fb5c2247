package com.ns.funnel.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Which event's breakdown value an actor is attributed to.
 */
public final class BreakdownAttribution {

    public enum Type {
        FIRST_TOUCH,
        LAST_TOUCH,
        STEP,
        ALL_EVENTS
    }

    private static final BreakdownAttribution FIRST = new BreakdownAttribution(Type.FIRST_TOUCH, 0);
    private static final BreakdownAttribution LAST = new BreakdownAttribution(Type.LAST_TOUCH, 0);
    private static final BreakdownAttribution ALL = new BreakdownAttribution(Type.ALL_EVENTS, 0);

    private final Type type;
    private final int stepIndex;

    private BreakdownAttribution(Type type, int stepIndex) {
        this.type = type;
        this.stepIndex = stepIndex;
    }

    public static BreakdownAttribution firstTouch() { return FIRST; }
    public static BreakdownAttribution lastTouch() { return LAST; }
    public static BreakdownAttribution allEvents() { return ALL; }

    /** Attribute to the value seen on the event that matched step {@code stepIndex} (0-indexed). */
    public static BreakdownAttribution step(int stepIndex) {
        return new BreakdownAttribution(Type.STEP, stepIndex);
    }

    public static BreakdownAttribution of(String type, Integer stepIndex) {
        Type parsed = Type.valueOf(type.trim().toUpperCase(Locale.ROOT));
        return parsed == Type.STEP ? step(stepIndex == null ? 0 : stepIndex) : new BreakdownAttribution(parsed, 0);
    }

    public Type getType() { return type; }
    public int getStepIndex() { return stepIndex; }

    public boolean isStep() { return type == Type.STEP; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BreakdownAttribution)) return false;
        BreakdownAttribution other = (BreakdownAttribution) o;
        return type == other.type && stepIndex == other.stepIndex;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, stepIndex);
    }

    @Override
    public String toString() {
        return type == Type.STEP ? "STEP(" + stepIndex + ")" : type.name();
    }
}
