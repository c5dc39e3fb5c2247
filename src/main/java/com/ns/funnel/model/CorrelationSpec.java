package com.ns.funnel.model;

import java.util.List;
import java.util.Objects;

/**
 * Parameters of a correlation analysis run on top of a funnel.
 * {@code propertyNames} are person properties for {@link CorrelationType#PROPERTIES};
 * {@code eventNames} select the events whose properties are analysed for
 * {@link CorrelationType#EVENT_WITH_PROPERTIES}.
 */
public final class CorrelationSpec {
    private final CorrelationType type;
    private final List<String> propertyNames;
    private final List<String> excludePropertyNames;
    private final List<String> eventNames;
    private final List<String> excludeEventNames;

    public CorrelationSpec(CorrelationType type, List<String> propertyNames, List<String> excludePropertyNames,
                           List<String> eventNames, List<String> excludeEventNames) {
        this.type = Objects.requireNonNull(type, "correlation type is null");
        this.propertyNames = propertyNames == null ? List.of() : List.copyOf(propertyNames);
        this.excludePropertyNames = excludePropertyNames == null ? List.of() : List.copyOf(excludePropertyNames);
        this.eventNames = eventNames == null ? List.of() : List.copyOf(eventNames);
        this.excludeEventNames = excludeEventNames == null ? List.of() : List.copyOf(excludeEventNames);
    }

    public static CorrelationSpec events() {
        return new CorrelationSpec(CorrelationType.EVENTS, null, null, null, null);
    }

    public static CorrelationSpec events(List<String> excludeEventNames) {
        return new CorrelationSpec(CorrelationType.EVENTS, null, null, null, excludeEventNames);
    }

    public static CorrelationSpec properties(List<String> propertyNames) {
        return new CorrelationSpec(CorrelationType.PROPERTIES, propertyNames, null, null, null);
    }

    public static CorrelationSpec eventProperties(List<String> eventNames) {
        return new CorrelationSpec(CorrelationType.EVENT_WITH_PROPERTIES, null, null, eventNames, null);
    }

    public CorrelationType getType() { return type; }
    public List<String> getPropertyNames() { return propertyNames; }
    public List<String> getExcludePropertyNames() { return excludePropertyNames; }
    public List<String> getEventNames() { return eventNames; }
    public List<String> getExcludeEventNames() { return excludeEventNames; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CorrelationSpec)) return false;
        CorrelationSpec other = (CorrelationSpec) o;
        return type == other.type && propertyNames.equals(other.propertyNames)
            && excludePropertyNames.equals(other.excludePropertyNames)
            && eventNames.equals(other.eventNames) && excludeEventNames.equals(other.excludeEventNames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, propertyNames, excludePropertyNames, eventNames, excludeEventNames);
    }
}
