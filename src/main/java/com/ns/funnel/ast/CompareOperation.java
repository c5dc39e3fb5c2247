package com.ns.funnel.ast;

import java.util.Objects;

public final class CompareOperation extends Expr {

    public enum Operator {
        EQ("="),
        NOT_EQ("!="),
        LT("<"),
        LT_EQ("<="),
        GT(">"),
        GT_EQ(">="),
        IN("IN"),
        NOT_IN("NOT IN"),
        LIKE("LIKE"),
        NOT_LIKE("NOT LIKE"),
        ILIKE("ILIKE"),
        NOT_ILIKE("NOT ILIKE");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() { return symbol; }
    }

    private final Operator operator;
    private final Expr left;
    private final Expr right;

    public CompareOperation(Operator operator, Expr left, Expr right) {
        this.operator = Objects.requireNonNull(operator, "operator is null");
        this.left = Objects.requireNonNull(left, "left is null");
        this.right = Objects.requireNonNull(right, "right is null");
    }

    public Operator getOperator() { return operator; }
    public Expr getLeft() { return left; }
    public Expr getRight() { return right; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCompareOperation(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompareOperation)) return false;
        CompareOperation other = (CompareOperation) o;
        return operator == other.operator && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }
}
