package com.ns.funnel.ast;

import java.util.Objects;

/**
 * A {@code ROWS BETWEEN start AND end} frame. Offsets are row counts; a null offset on a
 * preceding or following bound means unbounded.
 */
public final class WindowFrame {

    public enum BoundType {
        PRECEDING,
        CURRENT_ROW,
        FOLLOWING
    }

    public static final class Bound {
        private final BoundType type;
        private final Integer offset;

        private Bound(BoundType type, Integer offset) {
            this.type = type;
            this.offset = offset;
        }

        public static Bound unboundedPreceding() { return new Bound(BoundType.PRECEDING, null); }
        public static Bound preceding(int rows) { return new Bound(BoundType.PRECEDING, rows); }
        public static Bound currentRow() { return new Bound(BoundType.CURRENT_ROW, null); }
        public static Bound following(int rows) { return new Bound(BoundType.FOLLOWING, rows); }
        public static Bound unboundedFollowing() { return new Bound(BoundType.FOLLOWING, null); }

        public BoundType getType() { return type; }
        public Integer getOffset() { return offset; }
        public boolean isUnbounded() { return type != BoundType.CURRENT_ROW && offset == null; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Bound)) return false;
            Bound other = (Bound) o;
            return type == other.type && Objects.equals(offset, other.offset);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, offset);
        }
    }

    private final Bound start;
    private final Bound end;

    public WindowFrame(Bound start, Bound end) {
        this.start = Objects.requireNonNull(start, "start is null");
        this.end = Objects.requireNonNull(end, "end is null");
    }

    /** Every row from the partition start down to {@code rows} before the current one. */
    public static WindowFrame upTo(int rows) {
        return new WindowFrame(Bound.unboundedPreceding(), Bound.preceding(rows));
    }

    /** Exactly the row {@code rows} before the current one. */
    public static WindowFrame exactly(int rows) {
        return new WindowFrame(Bound.preceding(rows), Bound.preceding(rows));
    }

    public Bound getStart() { return start; }
    public Bound getEnd() { return end; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WindowFrame)) return false;
        WindowFrame other = (WindowFrame) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }
}
