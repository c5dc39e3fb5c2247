package com.ns.funnel.ast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Prefixes every column reference of an expression with a table alias, so a predicate
 * written against the events table can be evaluated against another alias of it
 * (for example {@code prior} inside a correlated existence check).
 * Lambda arguments are left alone and subqueries are not entered.
 */
public class FieldRequalifier extends AstRewriter<Set<String>> {
    private static final Logger logger = LoggerFactory.getLogger(FieldRequalifier.class);

    private final String qualifier;
    private int replacementCount = 0;

    public FieldRequalifier(String qualifier) {
        this.qualifier = Objects.requireNonNull(qualifier, "qualifier is null");
    }

    public static Expr requalify(Expr expr, String qualifier) {
        FieldRequalifier requalifier = new FieldRequalifier(qualifier);
        Expr result = requalifier.rewrite(expr, new HashSet<>());
        logger.debug("Qualified {} field references with '{}'", requalifier.getReplacementCount(), qualifier);
        return result;
    }

    public int getReplacementCount() {
        return replacementCount;
    }

    @Override
    protected Node visitField(Field node, Set<String> boundNames) {
        if (boundNames.contains(node.getFirst()) || qualifier.equals(node.getFirst())) {
            return node;
        }
        replacementCount++;
        return node.prefixed(qualifier);
    }

    @Override
    protected Node visitLambda(Lambda node, Set<String> boundNames) {
        Set<String> inner = new HashSet<>(boundNames);
        inner.addAll(node.getArgs());
        Expr body = rewrite(node.getBody(), inner);
        return body == node.getBody() ? node : new Lambda(node.getArgs(), body);
    }

    @Override
    protected Node visitExists(Exists node, Set<String> boundNames) {
        return node;
    }

    @Override
    protected Node visitSelectQuery(SelectQuery node, Set<String> boundNames) {
        return node;
    }

    @Override
    protected Node visitSelectUnionQuery(SelectUnionQuery node, Set<String> boundNames) {
        return node;
    }
}
