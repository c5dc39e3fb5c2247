package com.ns.funnel.external;

import com.ns.funnel.model.DateRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves absolute dates ({@code 2021-05-01}, {@code 2021-05-01 12:00:00}) and relative
 * offsets from now ({@code -7d}, {@code -24h}, {@code -2w}, {@code -3m}, {@code -1y}).
 * A missing start means seven days ago; a missing end means now. Date-only ends are
 * inclusive of the whole day.
 */
public class DefaultDateRangeResolver implements DateRangeResolver {
    private static final Logger logger = LoggerFactory.getLogger(DefaultDateRangeResolver.class);
    private static final Pattern RELATIVE = Pattern.compile("-(\\d+)([hdwmy])");
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public DefaultDateRangeResolver() {
        this(Clock.systemUTC());
    }

    public DefaultDateRangeResolver(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is null");
    }

    @Override
    public ResolvedDateRange resolve(DateRange range, ZoneId zone) {
        LocalDateTime now = LocalDateTime.now(clock.withZone(zone));
        LocalDateTime from = range.getDateFrom()
            .map(value -> parse(value, now, false))
            .orElse(now.toLocalDate().minusDays(7).atStartOfDay());
        LocalDateTime to = range.getDateTo()
            .map(value -> parse(value, now, true))
            .orElse(now);
        ResolvedDateRange resolved = new ResolvedDateRange(from, to, zone);
        logger.debug("Resolved date range {} .. {} to {}", range.getDateFrom().orElse("-"), range.getDateTo().orElse("-"), resolved);
        return resolved;
    }

    private static LocalDateTime parse(String value, LocalDateTime now, boolean endOfRange) {
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        Matcher relative = RELATIVE.matcher(trimmed);
        if (relative.matches()) {
            int amount = Integer.parseInt(relative.group(1));
            switch (relative.group(2)) {
                case "h":
                    return now.minusHours(amount).withMinute(0).withSecond(0).withNano(0);
                case "d":
                    return startOrEnd(now.toLocalDate().minusDays(amount), endOfRange);
                case "w":
                    return startOrEnd(now.toLocalDate().minusWeeks(amount), endOfRange);
                case "m":
                    return startOrEnd(now.toLocalDate().minusMonths(amount), endOfRange);
                case "y":
                    return startOrEnd(now.toLocalDate().minusYears(amount), endOfRange);
                default:
                    throw new IllegalArgumentException("Unknown relative date unit in '" + value + "'");
            }
        }
        try {
            if (trimmed.length() == 10) {
                return startOrEnd(LocalDate.parse(trimmed), endOfRange);
            }
            return LocalDateTime.parse(trimmed.replace('t', ' '), DATE_TIME);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Cannot parse date '" + value + "'", e);
        }
    }

    private static LocalDateTime startOrEnd(LocalDate date, boolean endOfRange) {
        return endOfRange ? date.atTime(LocalTime.of(23, 59, 59)) : date.atStartOfDay();
    }
}
