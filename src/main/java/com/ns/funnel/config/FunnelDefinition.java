package com.ns.funnel.config;

import com.ns.funnel.model.ActionMatch;
import com.ns.funnel.model.BreakdownAttribution;
import com.ns.funnel.model.BreakdownSpec;
import com.ns.funnel.model.BreakdownType;
import com.ns.funnel.model.ConversionWindow;
import com.ns.funnel.model.CorrelationSpec;
import com.ns.funnel.model.CorrelationType;
import com.ns.funnel.model.EventMatch;
import com.ns.funnel.model.Exclusion;
import com.ns.funnel.model.ExecutionStrategy;
import com.ns.funnel.model.ExternalSourceMatch;
import com.ns.funnel.model.FunnelSpec;
import com.ns.funnel.model.IntervalUnit;
import com.ns.funnel.model.OrderType;
import com.ns.funnel.model.PropertyFilter;
import com.ns.funnel.model.PropertyOperator;
import com.ns.funnel.model.PropertyType;
import com.ns.funnel.model.StepMath;
import com.ns.funnel.model.StepMatcher;
import com.ns.funnel.model.VizMode;
import com.ns.funnel.model.WindowUnit;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * YAML form of a funnel. Mutable bean for SnakeYAML; {@link #toSpec} turns it into the
 * immutable {@link FunnelSpec}. Unset fields fall back to the compiler configuration.
 */
public class FunnelDefinition {
    private List<StepDefinition> steps = new ArrayList<>();
    private String order;
    private Integer windowAmount;
    private String windowUnit;
    private Integer fromStep;
    private Integer toStep;
    private List<ExclusionDefinition> exclusions = new ArrayList<>();
    private BreakdownDefinition breakdown;
    private String viz;
    private String dateFrom;
    private String dateTo;
    private String interval;
    private String weekStartDay;
    private Integer binCount;
    private List<PropertyDefinition> properties = new ArrayList<>();
    private boolean filterTestAccounts;
    private Double samplingFactor;
    private Integer aggregationGroupTypeIndex;
    private String aggregateByHogQL;
    private CorrelationDefinition correlation;
    private String strategy;

    public FunnelSpec toSpec(FunnelCompilerConfig config) {
        FunnelSpec.Builder builder = FunnelSpec.builder();
        steps.forEach(step -> builder.step(step.toMatcher()));
        if (order != null) {
            builder.orderType(OrderType.valueOf(order.trim().toUpperCase(Locale.ROOT)));
        }
        int amount = windowAmount != null ? windowAmount : config.getDefaultWindowAmount();
        String unit = windowUnit != null ? windowUnit : config.getDefaultWindowUnit();
        builder.window(ConversionWindow.of(amount, WindowUnit.fromString(unit)));
        builder.fromStep(fromStep).toStep(toStep);
        exclusions.forEach(exclusion -> builder.exclusion(exclusion.toExclusion()));
        if (breakdown != null) {
            builder.breakdown(breakdown.toSpec());
        }
        if (viz != null) {
            builder.vizMode(VizMode.valueOf(viz.trim().toUpperCase(Locale.ROOT)));
        }
        builder.dateRange(dateFrom, dateTo);
        if (interval != null) {
            builder.interval(IntervalUnit.fromString(interval));
        }
        if (weekStartDay != null) {
            builder.weekStartDay(DayOfWeek.valueOf(weekStartDay.trim().toUpperCase(Locale.ROOT)));
        }
        builder.binCount(binCount)
            .properties(toFilters(properties))
            .filterTestAccounts(filterTestAccounts)
            .samplingFactor(samplingFactor)
            .aggregationGroupTypeIndex(aggregationGroupTypeIndex)
            .aggregateByHogQL(aggregateByHogQL);
        if (correlation != null) {
            builder.correlation(correlation.toSpec());
        }
        if (strategy != null) {
            builder.executionStrategy(ExecutionStrategy.valueOf(strategy.trim().toUpperCase(Locale.ROOT)));
        }
        return builder.build();
    }

    static List<PropertyFilter> toFilters(List<PropertyDefinition> definitions) {
        if (definitions == null) {
            return List.of();
        }
        return definitions.stream().map(PropertyDefinition::toFilter).collect(Collectors.toList());
    }

    // Getters and Setters
    public List<StepDefinition> getSteps() { return steps; }
    public void setSteps(List<StepDefinition> steps) { this.steps = steps; }
    public String getOrder() { return order; }
    public void setOrder(String order) { this.order = order; }
    public Integer getWindowAmount() { return windowAmount; }
    public void setWindowAmount(Integer windowAmount) { this.windowAmount = windowAmount; }
    public String getWindowUnit() { return windowUnit; }
    public void setWindowUnit(String windowUnit) { this.windowUnit = windowUnit; }
    public Integer getFromStep() { return fromStep; }
    public void setFromStep(Integer fromStep) { this.fromStep = fromStep; }
    public Integer getToStep() { return toStep; }
    public void setToStep(Integer toStep) { this.toStep = toStep; }
    public List<ExclusionDefinition> getExclusions() { return exclusions; }
    public void setExclusions(List<ExclusionDefinition> exclusions) { this.exclusions = exclusions; }
    public BreakdownDefinition getBreakdown() { return breakdown; }
    public void setBreakdown(BreakdownDefinition breakdown) { this.breakdown = breakdown; }
    public String getViz() { return viz; }
    public void setViz(String viz) { this.viz = viz; }
    public String getDateFrom() { return dateFrom; }
    public void setDateFrom(String dateFrom) { this.dateFrom = dateFrom; }
    public String getDateTo() { return dateTo; }
    public void setDateTo(String dateTo) { this.dateTo = dateTo; }
    public String getInterval() { return interval; }
    public void setInterval(String interval) { this.interval = interval; }
    public String getWeekStartDay() { return weekStartDay; }
    public void setWeekStartDay(String weekStartDay) { this.weekStartDay = weekStartDay; }
    public Integer getBinCount() { return binCount; }
    public void setBinCount(Integer binCount) { this.binCount = binCount; }
    public List<PropertyDefinition> getProperties() { return properties; }
    public void setProperties(List<PropertyDefinition> properties) { this.properties = properties; }
    public boolean isFilterTestAccounts() { return filterTestAccounts; }
    public void setFilterTestAccounts(boolean filterTestAccounts) { this.filterTestAccounts = filterTestAccounts; }
    public Double getSamplingFactor() { return samplingFactor; }
    public void setSamplingFactor(Double samplingFactor) { this.samplingFactor = samplingFactor; }
    public Integer getAggregationGroupTypeIndex() { return aggregationGroupTypeIndex; }
    public void setAggregationGroupTypeIndex(Integer aggregationGroupTypeIndex) { this.aggregationGroupTypeIndex = aggregationGroupTypeIndex; }
    public String getAggregateByHogQL() { return aggregateByHogQL; }
    public void setAggregateByHogQL(String aggregateByHogQL) { this.aggregateByHogQL = aggregateByHogQL; }
    public CorrelationDefinition getCorrelation() { return correlation; }
    public void setCorrelation(CorrelationDefinition correlation) { this.correlation = correlation; }
    public String getStrategy() { return strategy; }
    public void setStrategy(String strategy) { this.strategy = strategy; }

    public static class StepDefinition {
        private String event;
        private Long action;
        private String externalTable;
        private String timestampField;
        private String actorIdField;
        private List<PropertyDefinition> properties = new ArrayList<>();
        private String math;
        private boolean optional;
        private String name;

        StepMatcher toMatcher() {
            StepMath stepMath = math == null ? StepMath.TOTAL : StepMath.valueOf(math.trim().toUpperCase(Locale.ROOT));
            List<PropertyFilter> filters = toFilters(properties);
            if (action != null) {
                return new ActionMatch(action, filters, stepMath, optional, name);
            }
            if (externalTable != null) {
                return new ExternalSourceMatch(externalTable, timestampField, actorIdField, filters, stepMath, optional, name);
            }
            return new EventMatch(event, filters, stepMath, optional, name);
        }

        public String getEvent() { return event; }
        public void setEvent(String event) { this.event = event; }
        public Long getAction() { return action; }
        public void setAction(Long action) { this.action = action; }
        public String getExternalTable() { return externalTable; }
        public void setExternalTable(String externalTable) { this.externalTable = externalTable; }
        public String getTimestampField() { return timestampField; }
        public void setTimestampField(String timestampField) { this.timestampField = timestampField; }
        public String getActorIdField() { return actorIdField; }
        public void setActorIdField(String actorIdField) { this.actorIdField = actorIdField; }
        public List<PropertyDefinition> getProperties() { return properties; }
        public void setProperties(List<PropertyDefinition> properties) { this.properties = properties; }
        public String getMath() { return math; }
        public void setMath(String math) { this.math = math; }
        public boolean isOptional() { return optional; }
        public void setOptional(boolean optional) { this.optional = optional; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
    }

    public static class ExclusionDefinition extends StepDefinition {
        private int from;
        private int to;

        Exclusion toExclusion() {
            return Exclusion.of(toMatcher(), from, to);
        }

        public int getFrom() { return from; }
        public void setFrom(int from) { this.from = from; }
        public int getTo() { return to; }
        public void setTo(int to) { this.to = to; }
    }

    public static class PropertyDefinition {
        private String key;
        private Object value;
        private String operator;
        private String type;
        private Integer groupTypeIndex;

        PropertyFilter toFilter() {
            return new PropertyFilter(
                key,
                value,
                operator == null ? PropertyOperator.EXACT : PropertyOperator.fromString(operator),
                type == null ? PropertyType.EVENT : PropertyType.fromString(type),
                groupTypeIndex);
        }

        public String getKey() { return key; }
        public void setKey(String key) { this.key = key; }
        public Object getValue() { return value; }
        public void setValue(Object value) { this.value = value; }
        public String getOperator() { return operator; }
        public void setOperator(String operator) { this.operator = operator; }
        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public Integer getGroupTypeIndex() { return groupTypeIndex; }
        public void setGroupTypeIndex(Integer groupTypeIndex) { this.groupTypeIndex = groupTypeIndex; }
    }

    public static class BreakdownDefinition {
        private String type;
        private List<String> properties = new ArrayList<>();
        private List<String> cohorts = new ArrayList<>();
        private String attribution;
        private Integer attributionStep;
        private boolean normalizeUrl;
        private Integer groupTypeIndex;
        private Integer limit;
        private List<List<String>> values;

        BreakdownSpec toSpec() {
            BreakdownSpec.Builder builder = BreakdownSpec.builder(BreakdownType.fromString(type))
                .properties(properties)
                .normalizeUrl(normalizeUrl)
                .groupTypeIndex(groupTypeIndex)
                .limit(limit)
                .values(values);
            for (String cohort : cohorts) {
                if ("all".equalsIgnoreCase(cohort.trim())) {
                    builder.includeAllUsersCohort(true);
                } else {
                    builder.cohorts(Long.parseLong(cohort.trim()));
                }
            }
            if (attribution != null) {
                builder.attribution(BreakdownAttribution.of(attribution, attributionStep));
            }
            return builder.build();
        }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public List<String> getProperties() { return properties; }
        public void setProperties(List<String> properties) { this.properties = properties; }
        public List<String> getCohorts() { return cohorts; }
        public void setCohorts(List<String> cohorts) { this.cohorts = cohorts; }
        public String getAttribution() { return attribution; }
        public void setAttribution(String attribution) { this.attribution = attribution; }
        public Integer getAttributionStep() { return attributionStep; }
        public void setAttributionStep(Integer attributionStep) { this.attributionStep = attributionStep; }
        public boolean isNormalizeUrl() { return normalizeUrl; }
        public void setNormalizeUrl(boolean normalizeUrl) { this.normalizeUrl = normalizeUrl; }
        public Integer getGroupTypeIndex() { return groupTypeIndex; }
        public void setGroupTypeIndex(Integer groupTypeIndex) { this.groupTypeIndex = groupTypeIndex; }
        public Integer getLimit() { return limit; }
        public void setLimit(Integer limit) { this.limit = limit; }
        public List<List<String>> getValues() { return values; }
        public void setValues(List<List<String>> values) { this.values = values; }
    }

    public static class CorrelationDefinition {
        private String type;
        private List<String> propertyNames = new ArrayList<>();
        private List<String> excludePropertyNames = new ArrayList<>();
        private List<String> eventNames = new ArrayList<>();
        private List<String> excludeEventNames = new ArrayList<>();

        CorrelationSpec toSpec() {
            return new CorrelationSpec(CorrelationType.fromString(type), propertyNames, excludePropertyNames, eventNames, excludeEventNames);
        }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public List<String> getPropertyNames() { return propertyNames; }
        public void setPropertyNames(List<String> propertyNames) { this.propertyNames = propertyNames; }
        public List<String> getExcludePropertyNames() { return excludePropertyNames; }
        public void setExcludePropertyNames(List<String> excludePropertyNames) { this.excludePropertyNames = excludePropertyNames; }
        public List<String> getEventNames() { return eventNames; }
        public void setEventNames(List<String> eventNames) { this.eventNames = eventNames; }
        public List<String> getExcludeEventNames() { return excludeEventNames; }
        public void setExcludeEventNames(List<String> excludeEventNames) { this.excludeEventNames = excludeEventNames; }
    }
}
