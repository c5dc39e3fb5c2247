package com.ns.funnel.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * How results are split. Multi-property breakdowns have several {@code properties} and
 * produce array values; cohort breakdowns use {@code cohortIds} instead of properties.
 * Known {@code values} (one list of per-property strings per value) come from a prior
 * run of the breakdown values query; anything else falls into "Other".
 */
public final class BreakdownSpec {
    private final BreakdownType type;
    private final List<String> properties;
    private final List<Long> cohortIds;
    private final boolean includeAllUsersCohort;
    private final BreakdownAttribution attribution;
    private final boolean normalizeUrl;
    private final Integer groupTypeIndex;
    private final Integer limit;
    private final List<List<String>> values;

    private BreakdownSpec(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "breakdown type is null");
        this.properties = List.copyOf(builder.properties);
        this.cohortIds = List.copyOf(builder.cohortIds);
        this.includeAllUsersCohort = builder.includeAllUsersCohort;
        this.attribution = builder.attribution == null ? BreakdownAttribution.firstTouch() : builder.attribution;
        this.normalizeUrl = builder.normalizeUrl;
        this.groupTypeIndex = builder.groupTypeIndex;
        this.limit = builder.limit;
        this.values = builder.values == null ? null : builder.values.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
    }

    public static Builder builder(BreakdownType type) {
        return new Builder(type);
    }

    public BreakdownType getType() { return type; }
    public List<String> getProperties() { return properties; }
    public List<Long> getCohortIds() { return cohortIds; }
    public boolean isIncludeAllUsersCohort() { return includeAllUsersCohort; }
    public BreakdownAttribution getAttribution() { return attribution; }
    public boolean isNormalizeUrl() { return normalizeUrl; }
    public Optional<Integer> getGroupTypeIndex() { return Optional.ofNullable(groupTypeIndex); }
    public Optional<Integer> getLimit() { return Optional.ofNullable(limit); }
    public Optional<List<List<String>>> getValues() { return Optional.ofNullable(values); }

    public boolean isMultiProperty() {
        return properties.size() > 1;
    }

    public Builder toBuilder() {
        Builder builder = new Builder(type);
        builder.properties.addAll(properties);
        builder.cohortIds.addAll(cohortIds);
        builder.includeAllUsersCohort = includeAllUsersCohort;
        builder.attribution = attribution;
        builder.normalizeUrl = normalizeUrl;
        builder.groupTypeIndex = groupTypeIndex;
        builder.limit = limit;
        builder.values = values;
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BreakdownSpec)) return false;
        BreakdownSpec other = (BreakdownSpec) o;
        return type == other.type && properties.equals(other.properties) && cohortIds.equals(other.cohortIds)
            && includeAllUsersCohort == other.includeAllUsersCohort && attribution.equals(other.attribution)
            && normalizeUrl == other.normalizeUrl && Objects.equals(groupTypeIndex, other.groupTypeIndex)
            && Objects.equals(limit, other.limit) && Objects.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, properties, cohortIds, includeAllUsersCohort, attribution, normalizeUrl, groupTypeIndex, limit, values);
    }

    public static final class Builder {
        private final BreakdownType type;
        private final List<String> properties = new ArrayList<>();
        private final List<Long> cohortIds = new ArrayList<>();
        private boolean includeAllUsersCohort;
        private BreakdownAttribution attribution;
        private boolean normalizeUrl;
        private Integer groupTypeIndex;
        private Integer limit;
        private List<List<String>> values;

        private Builder(BreakdownType type) {
            this.type = type;
        }

        public Builder properties(String... keys) {
            properties.addAll(Arrays.asList(keys));
            return this;
        }

        public Builder properties(List<String> keys) {
            properties.addAll(keys);
            return this;
        }

        public Builder cohorts(Long... ids) {
            cohortIds.addAll(Arrays.asList(ids));
            return this;
        }

        public Builder cohorts(List<Long> ids) {
            cohortIds.addAll(ids);
            return this;
        }

        public Builder includeAllUsersCohort(boolean value) {
            this.includeAllUsersCohort = value;
            return this;
        }

        public Builder attribution(BreakdownAttribution value) {
            this.attribution = value;
            return this;
        }

        public Builder normalizeUrl(boolean value) {
            this.normalizeUrl = value;
            return this;
        }

        public Builder groupTypeIndex(Integer value) {
            this.groupTypeIndex = value;
            return this;
        }

        public Builder limit(Integer value) {
            this.limit = value;
            return this;
        }

        public Builder values(List<List<String>> value) {
            this.values = value;
            return this;
        }

        public BreakdownSpec build() {
            return new BreakdownSpec(this);
        }
    }
}
