package com.ns.funnel.ast;

import java.util.List;
import java.util.Objects;

public final class Lambda extends Expr {
    private final List<String> args;
    private final Expr body;

    public Lambda(List<String> args, Expr body) {
        if (args.isEmpty()) {
            throw new IllegalArgumentException("Lambda needs at least one argument");
        }
        this.args = List.copyOf(args);
        this.body = Objects.requireNonNull(body, "body is null");
    }

    public List<String> getArgs() { return args; }
    public Expr getBody() { return body; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLambda(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Lambda)) return false;
        Lambda other = (Lambda) o;
        return args.equals(other.args) && body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(args, body);
    }
}
