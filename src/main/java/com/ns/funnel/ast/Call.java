package com.ns.funnel.ast;

import java.util.List;
import java.util.Objects;

/**
 * A function call. Parametric aggregates such as {@code groupArray(10)(x)} carry their
 * parameters separately from the arguments.
 */
public final class Call extends Expr {
    private final String name;
    private final List<Expr> args;
    private final List<Expr> params;
    private final boolean distinct;

    public Call(String name, List<Expr> args) {
        this(name, args, List.of(), false);
    }

    public Call(String name, List<Expr> args, List<Expr> params, boolean distinct) {
        this.name = Objects.requireNonNull(name, "name is null");
        this.args = List.copyOf(args);
        this.params = params == null ? List.of() : List.copyOf(params);
        this.distinct = distinct;
    }

    public String getName() { return name; }
    public List<Expr> getArgs() { return args; }
    public List<Expr> getParams() { return params; }
    public boolean isDistinct() { return distinct; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCall(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Call)) return false;
        Call other = (Call) o;
        return distinct == other.distinct && name.equals(other.name)
            && args.equals(other.args) && params.equals(other.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args, params, distinct);
    }
}
