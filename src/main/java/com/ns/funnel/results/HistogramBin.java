package com.ns.funnel.results;

import java.util.Objects;

public final class HistogramBin {
    private final long binFromSeconds;
    private final long personCount;

    public HistogramBin(long binFromSeconds, long personCount) {
        this.binFromSeconds = binFromSeconds;
        this.personCount = personCount;
    }

    public long getBinFromSeconds() { return binFromSeconds; }
    public long getPersonCount() { return personCount; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HistogramBin)) return false;
        HistogramBin that = (HistogramBin) o;
        return binFromSeconds == that.binFromSeconds && personCount == that.personCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(binFromSeconds, personCount);
    }

    @Override
    public String toString() {
        return binFromSeconds + "s: " + personCount;
    }
}
