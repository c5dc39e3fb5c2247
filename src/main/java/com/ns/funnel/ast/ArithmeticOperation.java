package com.ns.funnel.ast;

import java.util.Objects;

public final class ArithmeticOperation extends Expr {

    public enum Operator {
        ADD("+"),
        SUB("-"),
        MULT("*"),
        DIV("/"),
        MOD("%");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() { return symbol; }
    }

    private final Operator operator;
    private final Expr left;
    private final Expr right;

    public ArithmeticOperation(Operator operator, Expr left, Expr right) {
        this.operator = Objects.requireNonNull(operator, "operator is null");
        this.left = Objects.requireNonNull(left, "left is null");
        this.right = Objects.requireNonNull(right, "right is null");
    }

    public Operator getOperator() { return operator; }
    public Expr getLeft() { return left; }
    public Expr getRight() { return right; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArithmeticOperation(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArithmeticOperation)) return false;
        ArithmeticOperation other = (ArithmeticOperation) o;
        return operator == other.operator && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }
}
