package com.ns.funnel.actors;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Which actors of a funnel to list. Steps funnels select by step: {@code n > 0} is everyone
 * who reached step {@code n} (1-indexed) or further, {@code n < 0} everyone who reached
 * step {@code |n| - 1} and dropped off there. Trends funnels select by entrance period and
 * whether the actor converted or dropped off.
 */
public final class ActorTarget {
    private final Integer step;
    private final List<Integer> customSteps;
    private final LocalDateTime entrancePeriodStart;
    private final boolean dropOff;
    private final List<Object> breakdownValue;
    private final boolean includeRecordings;
    private final Integer limit;
    private final Integer offset;

    private ActorTarget(Builder builder) {
        this.step = builder.step;
        this.customSteps = List.copyOf(builder.customSteps);
        this.entrancePeriodStart = builder.entrancePeriodStart;
        this.dropOff = builder.dropOff;
        this.breakdownValue = builder.breakdownValue == null ? null : List.copyOf(builder.breakdownValue);
        this.includeRecordings = builder.includeRecordings;
        this.limit = builder.limit;
        this.offset = builder.offset;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Integer> getStep() { return Optional.ofNullable(step); }
    public List<Integer> getCustomSteps() { return customSteps; }
    public Optional<LocalDateTime> getEntrancePeriodStart() { return Optional.ofNullable(entrancePeriodStart); }
    public boolean isDropOff() { return dropOff; }
    public Optional<List<Object>> getBreakdownValue() { return Optional.ofNullable(breakdownValue); }
    public boolean isIncludeRecordings() { return includeRecordings; }
    public Optional<Integer> getLimit() { return Optional.ofNullable(limit); }
    public Optional<Integer> getOffset() { return Optional.ofNullable(offset); }

    public boolean isTrendsTarget() {
        return entrancePeriodStart != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActorTarget)) return false;
        ActorTarget that = (ActorTarget) o;
        return dropOff == that.dropOff
            && includeRecordings == that.includeRecordings
            && Objects.equals(step, that.step)
            && customSteps.equals(that.customSteps)
            && Objects.equals(entrancePeriodStart, that.entrancePeriodStart)
            && Objects.equals(breakdownValue, that.breakdownValue)
            && Objects.equals(limit, that.limit)
            && Objects.equals(offset, that.offset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(step, customSteps, entrancePeriodStart, dropOff, breakdownValue, includeRecordings, limit, offset);
    }

    @Override
    public String toString() {
        return "ActorTarget{step=" + step + ", customSteps=" + customSteps + ", entrancePeriodStart=" + entrancePeriodStart
            + ", dropOff=" + dropOff + ", breakdownValue=" + breakdownValue + "}";
    }

    public static final class Builder {
        private Integer step;
        private final List<Integer> customSteps = new ArrayList<>();
        private LocalDateTime entrancePeriodStart;
        private boolean dropOff;
        private List<Object> breakdownValue;
        private boolean includeRecordings;
        private Integer limit;
        private Integer offset;

        private Builder() {
        }

        public Builder step(int value) {
            this.step = value;
            return this;
        }

        /** Exact step counts (1-indexed) to select; overrides {@link #step(int)}. */
        public Builder customSteps(List<Integer> values) {
            this.customSteps.clear();
            this.customSteps.addAll(values);
            return this;
        }

        public Builder entrancePeriod(LocalDateTime periodStart, boolean droppedOff) {
            this.entrancePeriodStart = periodStart;
            this.dropOff = droppedOff;
            return this;
        }

        /** One part per breakdown property, or the cohort id for cohort breakdowns. */
        public Builder breakdownValue(List<Object> value) {
            this.breakdownValue = value;
            return this;
        }

        public Builder includeRecordings(boolean value) {
            this.includeRecordings = value;
            return this;
        }

        public Builder limit(Integer value) {
            this.limit = value;
            return this;
        }

        public Builder offset(Integer value) {
            this.offset = value;
            return this;
        }

        public ActorTarget build() {
            return new ActorTarget(this);
        }
    }
}
