package com.ns.funnel.ast;

/**
 * An expression that yields a row set: a single select or a union of selects.
 */
public abstract class QueryExpr extends Expr {
}
