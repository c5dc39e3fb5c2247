package com.ns.funnel.model;

import java.util.Locale;

public enum WindowUnit {
    SECOND(1L),
    MINUTE(60L),
    HOUR(3_600L),
    DAY(86_400L),
    WEEK(7 * 86_400L),
    MONTH(30 * 86_400L);

    private final long seconds;

    WindowUnit(long seconds) {
        this.seconds = seconds;
    }

    public long getSeconds() {
        return seconds;
    }

    /** Name of the interval constructor, e.g. {@code toIntervalDay}. */
    public String getIntervalFunction() {
        String name = name().toLowerCase(Locale.ROOT);
        return "toInterval" + Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    public static WindowUnit fromString(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.endsWith("S")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return WindowUnit.valueOf(normalized);
    }
}
