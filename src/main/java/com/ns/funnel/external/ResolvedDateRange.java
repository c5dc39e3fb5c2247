package com.ns.funnel.external;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.Exprs;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Concrete, inclusive bounds of a date range in a time zone.
 */
public final class ResolvedDateRange {
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final LocalDateTime from;
    private final LocalDateTime to;
    private final ZoneId zone;

    public ResolvedDateRange(LocalDateTime from, LocalDateTime to, ZoneId zone) {
        this.from = Objects.requireNonNull(from, "from is null");
        this.to = Objects.requireNonNull(to, "to is null");
        this.zone = Objects.requireNonNull(zone, "zone is null");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Date range ends before it starts: " + from + " > " + to);
        }
    }

    public LocalDateTime getFrom() { return from; }
    public LocalDateTime getTo() { return to; }
    public ZoneId getZone() { return zone; }

    public Expr fromExpr() {
        return Exprs.dateTime(FORMAT.format(from), zone.getId());
    }

    public Expr toExpr() {
        return Exprs.dateTime(FORMAT.format(to), zone.getId());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedDateRange)) return false;
        ResolvedDateRange other = (ResolvedDateRange) o;
        return from.equals(other.from) && to.equals(other.to) && zone.equals(other.zone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, zone);
    }

    @Override
    public String toString() {
        return FORMAT.format(from) + " .. " + FORMAT.format(to) + " " + zone;
    }
}
