package com.ns.funnel.ast;

import java.util.Objects;

/**
 * One-based tuple element access, {@code tuple.1}.
 */
public final class TupleAccess extends Expr {
    private final Expr tuple;
    private final int index;

    public TupleAccess(Expr tuple, int index) {
        if (index < 1) {
            throw new IllegalArgumentException("Tuple index is one-based, got " + index);
        }
        this.tuple = Objects.requireNonNull(tuple, "tuple is null");
        this.index = index;
    }

    public Expr getTuple() { return tuple; }
    public int getIndex() { return index; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTupleAccess(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TupleAccess)) return false;
        TupleAccess other = (TupleAccess) o;
        return index == other.index && tuple.equals(other.tuple);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tuple, index);
    }
}
