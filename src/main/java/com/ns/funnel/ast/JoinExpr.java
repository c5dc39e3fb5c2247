package com.ns.funnel.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * One link of a FROM clause. The first link has no join type; each following link
 * carries its join type and, except for cross joins, an ON constraint.
 */
public final class JoinExpr extends Node {
    private final String joinType;
    private final Expr table;
    private final String alias;
    private final Expr constraint;
    private final Double sample;
    private final JoinExpr next;

    private JoinExpr(String joinType, Expr table, String alias, Expr constraint, Double sample, JoinExpr next) {
        if (!(table instanceof Field) && !(table instanceof QueryExpr) && !(table instanceof Call)) {
            throw new IllegalArgumentException("Join table must be a table name, a subquery or a table function");
        }
        this.joinType = joinType;
        this.table = table;
        this.alias = alias;
        this.constraint = constraint;
        this.sample = sample;
        this.next = next;
    }

    public static JoinExpr from(Expr table) {
        return new JoinExpr(null, table, null, null, null, null);
    }

    public static JoinExpr from(Expr table, String alias) {
        return new JoinExpr(null, table, alias, null, null, null);
    }

    public static JoinExpr join(String joinType, Expr table, String alias, Expr constraint) {
        return new JoinExpr(Objects.requireNonNull(joinType, "joinType is null"), table, alias, constraint, null, null);
    }

    public JoinExpr withSample(Double sampleFactor) {
        return new JoinExpr(joinType, table, alias, constraint, sampleFactor, next);
    }

    public JoinExpr withTable(Expr newTable) {
        return new JoinExpr(joinType, newTable, alias, constraint, sample, next);
    }

    public JoinExpr withConstraint(Expr newConstraint) {
        return new JoinExpr(joinType, table, alias, newConstraint, sample, next);
    }

    public JoinExpr withNext(JoinExpr newNext) {
        return new JoinExpr(joinType, table, alias, constraint, sample, newNext);
    }

    /** Appends a join at the end of this chain. */
    public JoinExpr then(JoinExpr link) {
        if (next == null) {
            return withNext(link);
        }
        return withNext(next.then(link));
    }

    public Optional<String> getJoinType() { return Optional.ofNullable(joinType); }
    public Expr getTable() { return table; }
    public Optional<String> getAlias() { return Optional.ofNullable(alias); }
    public Optional<Expr> getConstraint() { return Optional.ofNullable(constraint); }
    public Optional<Double> getSample() { return Optional.ofNullable(sample); }
    public Optional<JoinExpr> getNext() { return Optional.ofNullable(next); }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitJoinExpr(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JoinExpr)) return false;
        JoinExpr other = (JoinExpr) o;
        return Objects.equals(joinType, other.joinType) && table.equals(other.table)
            && Objects.equals(alias, other.alias) && Objects.equals(constraint, other.constraint)
            && Objects.equals(sample, other.sample) && Objects.equals(next, other.next);
    }

    @Override
    public int hashCode() {
        return Objects.hash(joinType, table, alias, constraint, sample, next);
    }
}
