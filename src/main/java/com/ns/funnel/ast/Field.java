package com.ns.funnel.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A column reference, possibly a chain such as {@code e.properties.$browser}.
 */
public final class Field extends Expr {
    private final List<String> chain;

    public Field(List<String> chain) {
        if (chain == null || chain.isEmpty()) {
            throw new IllegalArgumentException("Field chain cannot be empty");
        }
        this.chain = List.copyOf(chain);
    }

    public List<String> getChain() { return chain; }

    public String getFirst() { return chain.get(0); }

    public Field prefixed(String qualifier) {
        List<String> qualified = new ArrayList<>(chain.size() + 1);
        qualified.add(qualifier);
        qualified.addAll(chain);
        return new Field(qualified);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitField(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Field)) return false;
        return chain.equals(((Field) o).chain);
    }

    @Override
    public int hashCode() {
        return chain.hashCode();
    }
}
