package com.ns.funnel.model;

import java.util.Objects;
import java.util.Optional;

/**
 * The requested date range, unresolved. Values are whatever the date range resolver
 * understands, e.g. {@code 2021-05-01}, {@code -7d} or {@code all}.
 */
public final class DateRange {
    private final String dateFrom;
    private final String dateTo;

    public DateRange(String dateFrom, String dateTo) {
        this.dateFrom = dateFrom;
        this.dateTo = dateTo;
    }

    public static DateRange of(String dateFrom, String dateTo) {
        return new DateRange(dateFrom, dateTo);
    }

    public Optional<String> getDateFrom() { return Optional.ofNullable(dateFrom); }
    public Optional<String> getDateTo() { return Optional.ofNullable(dateTo); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DateRange)) return false;
        DateRange other = (DateRange) o;
        return Objects.equals(dateFrom, other.dateFrom) && Objects.equals(dateTo, other.dateTo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dateFrom, dateTo);
    }
}
