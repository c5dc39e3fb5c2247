package com.ns.funnel.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single property predicate. The value is a string, a number, a boolean, or a list of
 * those for multi-value matches.
 */
public final class PropertyFilter {
    private final String key;
    private final Object value;
    private final PropertyOperator operator;
    private final PropertyType type;
    private final Integer groupTypeIndex;

    public PropertyFilter(String key, Object value, PropertyOperator operator, PropertyType type, Integer groupTypeIndex) {
        this.key = Objects.requireNonNull(key, "key is null");
        this.value = value instanceof List ? List.copyOf((List<?>) value) : value;
        this.operator = operator == null ? PropertyOperator.EXACT : operator;
        this.type = type == null ? PropertyType.EVENT : type;
        this.groupTypeIndex = groupTypeIndex;
    }

    public static PropertyFilter event(String key, Object value) {
        return new PropertyFilter(key, value, PropertyOperator.EXACT, PropertyType.EVENT, null);
    }

    public static PropertyFilter event(String key, Object value, PropertyOperator operator) {
        return new PropertyFilter(key, value, operator, PropertyType.EVENT, null);
    }

    public static PropertyFilter person(String key, Object value, PropertyOperator operator) {
        return new PropertyFilter(key, value, operator, PropertyType.PERSON, null);
    }

    public static PropertyFilter group(int groupTypeIndex, String key, Object value, PropertyOperator operator) {
        return new PropertyFilter(key, value, operator, PropertyType.GROUP, groupTypeIndex);
    }

    public static PropertyFilter cohort(long cohortId) {
        return new PropertyFilter("id", cohortId, PropertyOperator.EXACT, PropertyType.COHORT, null);
    }

    public static PropertyFilter hogql(String expression) {
        return new PropertyFilter(expression, null, null, PropertyType.HOGQL, null);
    }

    public String getKey() { return key; }
    public Object getValue() { return value; }
    public PropertyOperator getOperator() { return operator; }
    public PropertyType getType() { return type; }
    public Optional<Integer> getGroupTypeIndex() { return Optional.ofNullable(groupTypeIndex); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertyFilter)) return false;
        PropertyFilter other = (PropertyFilter) o;
        return key.equals(other.key) && Objects.equals(value, other.value) && operator == other.operator
            && type == other.type && Objects.equals(groupTypeIndex, other.groupTypeIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value, operator, type, groupTypeIndex);
    }

    @Override
    public String toString() {
        return type + ":" + key + " " + operator + " " + value;
    }
}
