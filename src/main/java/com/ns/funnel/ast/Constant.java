package com.ns.funnel.ast;

import java.util.Objects;

public final class Constant extends Expr {
    private final Object value;

    public Constant(Object value) {
        if (value != null && !(value instanceof String) && !(value instanceof Number) && !(value instanceof Boolean)) {
            throw new IllegalArgumentException("Unsupported constant type: " + value.getClass().getName());
        }
        this.value = value;
    }

    public Object getValue() { return value; }

    public boolean isNull() { return value == null; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConstant(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Constant)) return false;
        return Objects.equals(value, ((Constant) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }
}
