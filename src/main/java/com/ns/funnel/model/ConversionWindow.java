package com.ns.funnel.model;

import java.util.Objects;

public final class ConversionWindow {
    public static final ConversionWindow DEFAULT = new ConversionWindow(14, WindowUnit.DAY);

    private final int amount;
    private final WindowUnit unit;

    public ConversionWindow(int amount, WindowUnit unit) {
        this.amount = amount;
        this.unit = Objects.requireNonNull(unit, "unit is null");
    }

    public static ConversionWindow of(int amount, WindowUnit unit) {
        return new ConversionWindow(amount, unit);
    }

    public int getAmount() { return amount; }
    public WindowUnit getUnit() { return unit; }

    public long getSeconds() {
        return amount * unit.getSeconds();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConversionWindow)) return false;
        ConversionWindow other = (ConversionWindow) o;
        return amount == other.amount && unit == other.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount, unit);
    }

    @Override
    public String toString() {
        return amount + " " + unit;
    }
}
