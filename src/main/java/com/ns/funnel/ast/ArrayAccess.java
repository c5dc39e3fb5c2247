package com.ns.funnel.ast;

import java.util.Objects;

/**
 * One-based element access, {@code array[index]}.
 */
public final class ArrayAccess extends Expr {
    private final Expr array;
    private final Expr index;

    public ArrayAccess(Expr array, Expr index) {
        this.array = Objects.requireNonNull(array, "array is null");
        this.index = Objects.requireNonNull(index, "index is null");
    }

    public Expr getArray() { return array; }
    public Expr getIndex() { return index; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayAccess(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayAccess)) return false;
        ArrayAccess other = (ArrayAccess) o;
        return array.equals(other.array) && index.equals(other.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(array, index, 6);
    }
}
