package com.ns.funnel.results;

import java.util.List;

public final class CorrelationResult {
    private final List<CorrelationEvent> events;
    private final boolean skewed;

    public CorrelationResult(List<CorrelationEvent> events, boolean skewed) {
        this.events = List.copyOf(events);
        this.skewed = skewed;
    }

    /** Success correlations by descending odds ratio, then failure correlations by ascending odds ratio. */
    public List<CorrelationEvent> getEvents() { return events; }

    /** True when converted and dropped actors are so unbalanced that the odds ratios are unreliable. */
    public boolean isSkewed() { return skewed; }
}
