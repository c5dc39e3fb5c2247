package com.ns.funnel.config;

public class FunnelCompilerConfig {
    private EventStoreDefinition eventStore = new EventStoreDefinition();
    private int maxSteps = 20;
    private int defaultBreakdownLimit = 25;
    private int defaultWindowAmount = 14;
    private String defaultWindowUnit = "day";
    private int maxBinCount = 90;
    private int autoMaxBinCount = 60;
    private int defaultBinWidthSeconds = 60;
    private int correlationMinPersonCount = 25;
    private double correlationMinPersonPercentage = 0.02;
    private int correlationResultLimit = 10;
    private int correlationPriorCount = 1;
    private int matchingEventsLimit = 10;
    private String aggregateFunnelFunction = "aggregate_funnel";

    public static FunnelCompilerConfig defaults() {
        return new FunnelCompilerConfig();
    }

    // Getters and Setters
    public EventStoreDefinition getEventStore() { return eventStore; }
    public void setEventStore(EventStoreDefinition eventStore) { this.eventStore = eventStore; }
    public int getMaxSteps() { return maxSteps; }
    public void setMaxSteps(int maxSteps) { this.maxSteps = maxSteps; }
    public int getDefaultBreakdownLimit() { return defaultBreakdownLimit; }
    public void setDefaultBreakdownLimit(int defaultBreakdownLimit) { this.defaultBreakdownLimit = defaultBreakdownLimit; }
    public int getDefaultWindowAmount() { return defaultWindowAmount; }
    public void setDefaultWindowAmount(int defaultWindowAmount) { this.defaultWindowAmount = defaultWindowAmount; }
    public String getDefaultWindowUnit() { return defaultWindowUnit; }
    public void setDefaultWindowUnit(String defaultWindowUnit) { this.defaultWindowUnit = defaultWindowUnit; }
    public int getMaxBinCount() { return maxBinCount; }
    public void setMaxBinCount(int maxBinCount) { this.maxBinCount = maxBinCount; }
    public int getAutoMaxBinCount() { return autoMaxBinCount; }
    public void setAutoMaxBinCount(int autoMaxBinCount) { this.autoMaxBinCount = autoMaxBinCount; }
    public int getDefaultBinWidthSeconds() { return defaultBinWidthSeconds; }
    public void setDefaultBinWidthSeconds(int defaultBinWidthSeconds) { this.defaultBinWidthSeconds = defaultBinWidthSeconds; }
    public int getCorrelationMinPersonCount() { return correlationMinPersonCount; }
    public void setCorrelationMinPersonCount(int correlationMinPersonCount) { this.correlationMinPersonCount = correlationMinPersonCount; }
    public double getCorrelationMinPersonPercentage() { return correlationMinPersonPercentage; }
    public void setCorrelationMinPersonPercentage(double correlationMinPersonPercentage) { this.correlationMinPersonPercentage = correlationMinPersonPercentage; }
    public int getCorrelationResultLimit() { return correlationResultLimit; }
    public void setCorrelationResultLimit(int correlationResultLimit) { this.correlationResultLimit = correlationResultLimit; }
    public int getCorrelationPriorCount() { return correlationPriorCount; }
    public void setCorrelationPriorCount(int correlationPriorCount) { this.correlationPriorCount = correlationPriorCount; }
    public int getMatchingEventsLimit() { return matchingEventsLimit; }
    public void setMatchingEventsLimit(int matchingEventsLimit) { this.matchingEventsLimit = matchingEventsLimit; }
    public String getAggregateFunnelFunction() { return aggregateFunnelFunction; }
    public void setAggregateFunnelFunction(String aggregateFunnelFunction) { this.aggregateFunnelFunction = aggregateFunnelFunction; }
}
