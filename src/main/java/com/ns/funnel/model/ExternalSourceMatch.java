package com.ns.funnel.model;

import java.util.List;
import java.util.Objects;

/**
 * A step whose rows come from an external (warehouse) table instead of the events table.
 * Every row of the table counts as an occurrence of the step.
 */
public final class ExternalSourceMatch extends StepMatcher {
    private final String table;
    private final String timestampField;
    private final String actorIdField;

    public ExternalSourceMatch(String table, String timestampField, String actorIdField,
                               List<PropertyFilter> properties, StepMath math, boolean optional, String customName) {
        super(properties, math, optional, customName);
        this.table = Objects.requireNonNull(table, "table is null");
        this.timestampField = Objects.requireNonNull(timestampField, "timestampField is null");
        this.actorIdField = Objects.requireNonNull(actorIdField, "actorIdField is null");
    }

    public static ExternalSourceMatch of(String table, String timestampField, String actorIdField) {
        return new ExternalSourceMatch(table, timestampField, actorIdField, List.of(), StepMath.TOTAL, false, null);
    }

    public String getTable() { return table; }
    public String getTimestampField() { return timestampField; }
    public String getActorIdField() { return actorIdField; }

    @Override
    public String describe() {
        return getCustomName().orElse(table);
    }

    @Override
    public boolean sameEntity(StepMatcher other) {
        if (!(other instanceof ExternalSourceMatch)) {
            return false;
        }
        ExternalSourceMatch o = (ExternalSourceMatch) other;
        return table.equals(o.table) && timestampField.equals(o.timestampField) && actorIdField.equals(o.actorIdField);
    }

    @Override
    protected StepMatcher copy(List<PropertyFilter> properties, StepMath math, boolean optional, String customName) {
        return new ExternalSourceMatch(table, timestampField, actorIdField, properties, math, optional, customName);
    }
}
