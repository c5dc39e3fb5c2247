package com.ns.funnel.udf;

import java.util.List;
import java.util.Objects;

/**
 * One event of an actor as the single-pass routine sees it. Step {@code i} is coded
 * {@code i + 1} and exclusion {@code k} is coded {@code -(k + 1)}; an event can carry
 * several codes.
 */
public final class AggregatorEvent {
    private final long timestamp;
    private final String uuid;
    private final Object breakdown;
    private final List<Integer> codes;

    public AggregatorEvent(long timestamp, String uuid, Object breakdown, List<Integer> codes) {
        this.timestamp = timestamp;
        this.uuid = uuid;
        this.breakdown = breakdown;
        this.codes = List.copyOf(Objects.requireNonNull(codes, "codes is null"));
    }

    public static AggregatorEvent of(long timestamp, String uuid, Integer... codes) {
        return new AggregatorEvent(timestamp, uuid, null, List.of(codes));
    }

    public long getTimestamp() { return timestamp; }
    public String getUuid() { return uuid; }
    public Object getBreakdown() { return breakdown; }
    public List<Integer> getCodes() { return codes; }

    public AggregatorEvent withBreakdown(Object value) {
        return new AggregatorEvent(timestamp, uuid, value, codes);
    }

    public boolean matchesStep(int step) {
        return codes.contains(step + 1);
    }

    public boolean matchesExclusion(int exclusion) {
        return codes.contains(-(exclusion + 1));
    }

    /** Lowest step matched, used to order events sharing a timestamp. */
    int firstStep() {
        int first = Integer.MAX_VALUE;
        for (int code : codes) {
            if (code > 0) {
                first = Math.min(first, code - 1);
            }
        }
        return first;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregatorEvent)) return false;
        AggregatorEvent that = (AggregatorEvent) o;
        return timestamp == that.timestamp
            && Objects.equals(uuid, that.uuid)
            && Objects.equals(breakdown, that.breakdown)
            && codes.equals(that.codes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, uuid, breakdown, codes);
    }

    @Override
    public String toString() {
        return "AggregatorEvent{" + timestamp + ", " + uuid + ", " + breakdown + ", " + codes + "}";
    }
}
