package com.ns.funnel.model;

import java.util.List;

/**
 * Matches the events of a saved action; resolved to event names when the query context is built.
 */
public final class ActionMatch extends StepMatcher {
    private final long actionId;

    public ActionMatch(long actionId, List<PropertyFilter> properties, StepMath math, boolean optional, String customName) {
        super(properties, math, optional, customName);
        this.actionId = actionId;
    }

    public static ActionMatch of(long actionId) {
        return new ActionMatch(actionId, List.of(), StepMath.TOTAL, false, null);
    }

    public long getActionId() { return actionId; }

    @Override
    public String describe() {
        return getCustomName().orElse("action " + actionId);
    }

    @Override
    public boolean sameEntity(StepMatcher other) {
        return other instanceof ActionMatch && actionId == ((ActionMatch) other).actionId;
    }

    @Override
    protected StepMatcher copy(List<PropertyFilter> properties, StepMath math, boolean optional, String customName) {
        return new ActionMatch(actionId, properties, math, optional, customName);
    }
}
