package com.ns.funnel.context;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.model.ExternalSourceMatch;
import com.ns.funnel.model.StepMatcher;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A step or exclusion matcher with its action resolved to event names and its property
 * filters translated. An empty event name list means every event matches.
 */
public final class ResolvedStep {
    private final int index;
    private final StepMatcher matcher;
    private final List<String> eventNames;
    private final Expr propertyPredicate;

    public ResolvedStep(int index, StepMatcher matcher, List<String> eventNames, Expr propertyPredicate) {
        this.index = index;
        this.matcher = Objects.requireNonNull(matcher, "matcher is null");
        this.eventNames = List.copyOf(eventNames);
        this.propertyPredicate = propertyPredicate;
    }

    public int getIndex() { return index; }
    public StepMatcher getMatcher() { return matcher; }
    public List<String> getEventNames() { return eventNames; }
    public Optional<Expr> getPropertyPredicate() { return Optional.ofNullable(propertyPredicate); }

    public boolean matchesAllEvents() {
        return eventNames.isEmpty() && !isExternal();
    }

    public boolean isExternal() {
        return matcher instanceof ExternalSourceMatch;
    }

    public boolean isOptional() {
        return matcher.isOptional();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedStep)) return false;
        ResolvedStep other = (ResolvedStep) o;
        return index == other.index && matcher.equals(other.matcher) && eventNames.equals(other.eventNames)
            && Objects.equals(propertyPredicate, other.propertyPredicate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, matcher, eventNames, propertyPredicate);
    }

    @Override
    public String toString() {
        return index + ":" + matcher.describe();
    }
}
