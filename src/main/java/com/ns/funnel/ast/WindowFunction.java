package com.ns.funnel.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code name(args) OVER (PARTITION BY ... ORDER BY ... ROWS BETWEEN ...)}.
 */
public final class WindowFunction extends Expr {
    private final String name;
    private final List<Expr> args;
    private final List<Expr> partitionBy;
    private final List<OrderExpr> orderBy;
    private final WindowFrame frame;

    public WindowFunction(String name, List<Expr> args, List<Expr> partitionBy, List<OrderExpr> orderBy, WindowFrame frame) {
        this.name = Objects.requireNonNull(name, "name is null");
        this.args = List.copyOf(args);
        this.partitionBy = List.copyOf(partitionBy);
        this.orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
        this.frame = frame;
    }

    public String getName() { return name; }
    public List<Expr> getArgs() { return args; }
    public List<Expr> getPartitionBy() { return partitionBy; }
    public List<OrderExpr> getOrderBy() { return orderBy; }
    public Optional<WindowFrame> getFrame() { return Optional.ofNullable(frame); }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWindowFunction(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WindowFunction)) return false;
        WindowFunction other = (WindowFunction) o;
        return name.equals(other.name) && args.equals(other.args) && partitionBy.equals(other.partitionBy)
            && orderBy.equals(other.orderBy) && Objects.equals(frame, other.frame);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args, partitionBy, orderBy, frame);
    }
}
