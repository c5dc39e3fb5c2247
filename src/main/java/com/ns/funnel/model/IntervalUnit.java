package com.ns.funnel.model;

import java.time.DayOfWeek;
import java.util.Locale;

/**
 * Bucketing granularity of funnel trends. Each unit knows the start-of-interval
 * function and the interval constructor that the trends plan uses.
 */
public enum IntervalUnit {
    HOUR("toStartOfHour", "hour", "toIntervalHour"),
    DAY("toStartOfDay", "day", "toIntervalDay"),
    WEEK("toStartOfWeek", "week", "toIntervalWeek"),
    MONTH("toStartOfMonth", "month", "toIntervalMonth");

    private final String startOfFunction;
    private final String dateDiffUnit;
    private final String intervalFunction;

    IntervalUnit(String startOfFunction, String dateDiffUnit, String intervalFunction) {
        this.startOfFunction = startOfFunction;
        this.dateDiffUnit = dateDiffUnit;
        this.intervalFunction = intervalFunction;
    }

    public String getStartOfFunction() { return startOfFunction; }
    public String getDateDiffUnit() { return dateDiffUnit; }
    public String getIntervalFunction() { return intervalFunction; }

    /**
     * Week mode argument of {@code toStartOfWeek}: 0 starts weeks on Sunday, 3 on Monday.
     */
    public static int weekMode(DayOfWeek weekStartDay) {
        return weekStartDay == DayOfWeek.MONDAY ? 3 : 0;
    }

    public static IntervalUnit fromString(String value) {
        return IntervalUnit.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
