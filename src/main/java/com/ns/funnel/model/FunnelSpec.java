package com.ns.funnel.model;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Declarative funnel definition. Immutable; build with {@link #builder()}.
 * Step indices ({@code fromStep}, {@code toStep}, exclusion ranges) are 0-indexed.
 */
public final class FunnelSpec {
    private final List<StepMatcher> series;
    private final OrderType orderType;
    private final ConversionWindow window;
    private final Integer fromStep;
    private final Integer toStep;
    private final List<Exclusion> exclusions;
    private final BreakdownSpec breakdown;
    private final VizMode vizMode;
    private final DateRange dateRange;
    private final IntervalUnit interval;
    private final DayOfWeek weekStartDay;
    private final Integer binCount;
    private final List<PropertyFilter> properties;
    private final boolean filterTestAccounts;
    private final Double samplingFactor;
    private final Integer aggregationGroupTypeIndex;
    private final String aggregateByHogQL;
    private final CorrelationSpec correlation;
    private final ExecutionStrategy executionStrategy;

    private FunnelSpec(Builder builder) {
        this.series = List.copyOf(builder.series);
        this.orderType = builder.orderType;
        this.window = builder.window;
        this.fromStep = builder.fromStep;
        this.toStep = builder.toStep;
        this.exclusions = List.copyOf(builder.exclusions);
        this.breakdown = builder.breakdown;
        this.vizMode = builder.vizMode;
        this.dateRange = builder.dateRange;
        this.interval = builder.interval;
        this.weekStartDay = builder.weekStartDay;
        this.binCount = builder.binCount;
        this.properties = List.copyOf(builder.properties);
        this.filterTestAccounts = builder.filterTestAccounts;
        this.samplingFactor = builder.samplingFactor;
        this.aggregationGroupTypeIndex = builder.aggregationGroupTypeIndex;
        this.aggregateByHogQL = builder.aggregateByHogQL;
        this.correlation = builder.correlation;
        this.executionStrategy = builder.executionStrategy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<StepMatcher> getSeries() { return series; }
    public OrderType getOrderType() { return orderType; }
    public ConversionWindow getWindow() { return window; }
    public Optional<Integer> getFromStep() { return Optional.ofNullable(fromStep); }
    public Optional<Integer> getToStep() { return Optional.ofNullable(toStep); }
    public List<Exclusion> getExclusions() { return exclusions; }
    public Optional<BreakdownSpec> getBreakdown() { return Optional.ofNullable(breakdown); }
    public VizMode getVizMode() { return vizMode; }
    public DateRange getDateRange() { return dateRange; }
    public IntervalUnit getInterval() { return interval; }
    public DayOfWeek getWeekStartDay() { return weekStartDay; }
    public Optional<Integer> getBinCount() { return Optional.ofNullable(binCount); }
    public List<PropertyFilter> getProperties() { return properties; }
    public boolean isFilterTestAccounts() { return filterTestAccounts; }
    public Optional<Double> getSamplingFactor() { return Optional.ofNullable(samplingFactor); }
    public Optional<Integer> getAggregationGroupTypeIndex() { return Optional.ofNullable(aggregationGroupTypeIndex); }
    public Optional<String> getAggregateByHogQL() { return Optional.ofNullable(aggregateByHogQL); }
    public Optional<CorrelationSpec> getCorrelation() { return Optional.ofNullable(correlation); }
    public ExecutionStrategy getExecutionStrategy() { return executionStrategy; }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.series.addAll(series);
        builder.orderType = orderType;
        builder.window = window;
        builder.fromStep = fromStep;
        builder.toStep = toStep;
        builder.exclusions.addAll(exclusions);
        builder.breakdown = breakdown;
        builder.vizMode = vizMode;
        builder.dateRange = dateRange;
        builder.interval = interval;
        builder.weekStartDay = weekStartDay;
        builder.binCount = binCount;
        builder.properties.addAll(properties);
        builder.filterTestAccounts = filterTestAccounts;
        builder.samplingFactor = samplingFactor;
        builder.aggregationGroupTypeIndex = aggregationGroupTypeIndex;
        builder.aggregateByHogQL = aggregateByHogQL;
        builder.correlation = correlation;
        builder.executionStrategy = executionStrategy;
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunnelSpec)) return false;
        FunnelSpec other = (FunnelSpec) o;
        return filterTestAccounts == other.filterTestAccounts && series.equals(other.series)
            && orderType == other.orderType && window.equals(other.window)
            && Objects.equals(fromStep, other.fromStep) && Objects.equals(toStep, other.toStep)
            && exclusions.equals(other.exclusions) && Objects.equals(breakdown, other.breakdown)
            && vizMode == other.vizMode && dateRange.equals(other.dateRange) && interval == other.interval
            && weekStartDay == other.weekStartDay && Objects.equals(binCount, other.binCount)
            && properties.equals(other.properties) && Objects.equals(samplingFactor, other.samplingFactor)
            && Objects.equals(aggregationGroupTypeIndex, other.aggregationGroupTypeIndex)
            && Objects.equals(aggregateByHogQL, other.aggregateByHogQL)
            && Objects.equals(correlation, other.correlation) && executionStrategy == other.executionStrategy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(series, orderType, window, fromStep, toStep, exclusions, breakdown, vizMode, dateRange,
            interval, weekStartDay, binCount, properties, filterTestAccounts, samplingFactor,
            aggregationGroupTypeIndex, aggregateByHogQL, correlation, executionStrategy);
    }

    public static final class Builder {
        private final List<StepMatcher> series = new ArrayList<>();
        private OrderType orderType = OrderType.SEQUENTIAL;
        private ConversionWindow window = ConversionWindow.DEFAULT;
        private Integer fromStep;
        private Integer toStep;
        private final List<Exclusion> exclusions = new ArrayList<>();
        private BreakdownSpec breakdown;
        private VizMode vizMode = VizMode.STEPS;
        private DateRange dateRange = DateRange.of(null, null);
        private IntervalUnit interval = IntervalUnit.DAY;
        private DayOfWeek weekStartDay = DayOfWeek.SUNDAY;
        private Integer binCount;
        private final List<PropertyFilter> properties = new ArrayList<>();
        private boolean filterTestAccounts;
        private Double samplingFactor;
        private Integer aggregationGroupTypeIndex;
        private String aggregateByHogQL;
        private CorrelationSpec correlation;
        private ExecutionStrategy executionStrategy = ExecutionStrategy.CASCADING;

        private Builder() {
        }

        public Builder step(StepMatcher matcher) {
            series.add(Objects.requireNonNull(matcher, "step matcher is null"));
            return this;
        }

        public Builder steps(StepMatcher... matchers) {
            Arrays.stream(matchers).forEach(this::step);
            return this;
        }

        public Builder steps(List<? extends StepMatcher> matchers) {
            matchers.forEach(this::step);
            return this;
        }

        public Builder orderType(OrderType value) {
            this.orderType = Objects.requireNonNull(value, "orderType is null");
            return this;
        }

        public Builder window(ConversionWindow value) {
            this.window = Objects.requireNonNull(value, "window is null");
            return this;
        }

        public Builder window(int amount, WindowUnit unit) {
            return window(ConversionWindow.of(amount, unit));
        }

        public Builder fromStep(Integer value) {
            this.fromStep = value;
            return this;
        }

        public Builder toStep(Integer value) {
            this.toStep = value;
            return this;
        }

        public Builder exclusion(Exclusion value) {
            exclusions.add(Objects.requireNonNull(value, "exclusion is null"));
            return this;
        }

        public Builder exclusions(List<Exclusion> values) {
            values.forEach(this::exclusion);
            return this;
        }

        public Builder breakdown(BreakdownSpec value) {
            this.breakdown = value;
            return this;
        }

        public Builder vizMode(VizMode value) {
            this.vizMode = Objects.requireNonNull(value, "vizMode is null");
            return this;
        }

        public Builder dateRange(DateRange value) {
            this.dateRange = Objects.requireNonNull(value, "dateRange is null");
            return this;
        }

        public Builder dateRange(String dateFrom, String dateTo) {
            return dateRange(DateRange.of(dateFrom, dateTo));
        }

        public Builder interval(IntervalUnit value) {
            this.interval = Objects.requireNonNull(value, "interval is null");
            return this;
        }

        public Builder weekStartDay(DayOfWeek value) {
            this.weekStartDay = Objects.requireNonNull(value, "weekStartDay is null");
            return this;
        }

        public Builder binCount(Integer value) {
            this.binCount = value;
            return this;
        }

        public Builder property(PropertyFilter value) {
            properties.add(Objects.requireNonNull(value, "property filter is null"));
            return this;
        }

        public Builder properties(List<PropertyFilter> values) {
            values.forEach(this::property);
            return this;
        }

        public Builder filterTestAccounts(boolean value) {
            this.filterTestAccounts = value;
            return this;
        }

        public Builder samplingFactor(Double value) {
            this.samplingFactor = value;
            return this;
        }

        public Builder aggregationGroupTypeIndex(Integer value) {
            this.aggregationGroupTypeIndex = value;
            return this;
        }

        public Builder aggregateByHogQL(String value) {
            this.aggregateByHogQL = value;
            return this;
        }

        public Builder correlation(CorrelationSpec value) {
            this.correlation = value;
            return this;
        }

        public Builder executionStrategy(ExecutionStrategy value) {
            this.executionStrategy = Objects.requireNonNull(value, "executionStrategy is null");
            return this;
        }

        public FunnelSpec build() {
            return new FunnelSpec(this);
        }
    }
}
