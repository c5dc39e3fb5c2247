package com.ns.funnel.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * What an event must look like to count for a funnel step or an exclusion.
 */
public abstract class StepMatcher {
    private final List<PropertyFilter> properties;
    private final StepMath math;
    private final boolean optional;
    private final String customName;

    protected StepMatcher(List<PropertyFilter> properties, StepMath math, boolean optional, String customName) {
        this.properties = properties == null ? List.of() : List.copyOf(properties);
        this.math = math == null ? StepMath.TOTAL : math;
        this.optional = optional;
        this.customName = customName;
    }

    public List<PropertyFilter> getProperties() { return properties; }
    public StepMath getMath() { return math; }
    public boolean isOptional() { return optional; }
    public Optional<String> getCustomName() { return Optional.ofNullable(customName); }

    /** Display name used in results and error messages. */
    public abstract String describe();

    /** True when both matchers select from the same source on the same event/action. */
    public abstract boolean sameEntity(StepMatcher other);

    protected abstract StepMatcher copy(List<PropertyFilter> properties, StepMath math, boolean optional, String customName);

    public StepMatcher withProperties(List<PropertyFilter> newProperties) {
        return copy(newProperties, math, optional, customName);
    }

    public StepMatcher withMath(StepMath newMath) {
        return copy(properties, newMath, optional, customName);
    }

    public StepMatcher asOptional() {
        return copy(properties, math, true, customName);
    }

    public StepMatcher withCustomName(String name) {
        return copy(properties, math, optional, name);
    }

    /** Same entity and same property filters, so both select exactly the same events. */
    public boolean isEquivalentTo(StepMatcher other) {
        return sameEntity(other) && new HashSet<>(properties).equals(new HashSet<>(other.properties));
    }

    /**
     * Same entity with a subset of the other's property filters: every event the other
     * matcher selects is selected by this one too.
     */
    public boolean isSupersetOf(StepMatcher other) {
        return sameEntity(other) && other.properties.containsAll(properties);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepMatcher other = (StepMatcher) o;
        return optional == other.optional && math == other.math && properties.equals(other.properties)
            && Objects.equals(customName, other.customName) && sameEntity(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), properties, math, optional, customName);
    }

    @Override
    public String toString() {
        return describe() + (properties.isEmpty() ? "" : " " + properties);
    }
}
