package com.ns.funnel.results;

import java.util.Objects;

/** One row of the correlation query: a name and how many converted and dropped actors it touched. */
public final class CorrelationRow {
    private final String name;
    private final long successCount;
    private final long failureCount;

    public CorrelationRow(String name, long successCount, long failureCount) {
        this.name = Objects.requireNonNull(name, "name");
        this.successCount = successCount;
        this.failureCount = failureCount;
    }

    public String getName() { return name; }
    public long getSuccessCount() { return successCount; }
    public long getFailureCount() { return failureCount; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CorrelationRow)) return false;
        CorrelationRow that = (CorrelationRow) o;
        return successCount == that.successCount && failureCount == that.failureCount && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, successCount, failureCount);
    }

    @Override
    public String toString() {
        return name + " (" + successCount + "/" + failureCount + ")";
    }
}
