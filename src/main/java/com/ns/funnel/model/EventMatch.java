package com.ns.funnel.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Matches events by name. A null name matches every event.
 */
public final class EventMatch extends StepMatcher {
    private final String eventName;

    public EventMatch(String eventName, List<PropertyFilter> properties, StepMath math, boolean optional, String customName) {
        super(properties, math, optional, customName);
        this.eventName = eventName;
    }

    public static EventMatch of(String eventName) {
        return new EventMatch(eventName, List.of(), StepMath.TOTAL, false, null);
    }

    public static EventMatch of(String eventName, PropertyFilter... properties) {
        return new EventMatch(eventName, List.of(properties), StepMath.TOTAL, false, null);
    }

    public static EventMatch allEvents() {
        return new EventMatch(null, List.of(), StepMath.TOTAL, false, null);
    }

    public Optional<String> getEventName() { return Optional.ofNullable(eventName); }

    @Override
    public String describe() {
        return getCustomName().orElse(eventName == null ? "All events" : eventName);
    }

    @Override
    public boolean sameEntity(StepMatcher other) {
        return other instanceof EventMatch && Objects.equals(eventName, ((EventMatch) other).eventName);
    }

    @Override
    protected StepMatcher copy(List<PropertyFilter> properties, StepMath math, boolean optional, String customName) {
        return new EventMatch(eventName, properties, math, optional, customName);
    }
}
