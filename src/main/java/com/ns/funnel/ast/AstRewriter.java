package com.ns.funnel.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds a tree bottom-up. A node whose children come back unchanged is returned as the
 * same instance, so callers can detect whether anything was rewritten with {@code !=}.
 */
public abstract class AstRewriter<C> extends AstVisitor<Node, C> {

    @SuppressWarnings("unchecked")
    public <T extends Node> T rewrite(T node, C context) {
        return (T) process(node, context);
    }

    protected List<Expr> rewriteAll(List<Expr> exprs, C context) {
        List<Expr> result = new ArrayList<>(exprs.size());
        boolean changed = false;
        for (Expr expr : exprs) {
            Expr rewritten = rewrite(expr, context);
            changed |= rewritten != expr;
            result.add(rewritten);
        }
        return changed ? result : exprs;
    }

    @Override
    protected Node visitNode(Node node, C context) {
        return node;
    }

    @Override
    protected Node visitAlias(Alias node, C context) {
        Expr expr = rewrite(node.getExpr(), context);
        return expr == node.getExpr() ? node : new Alias(node.getAlias(), expr);
    }

    @Override
    protected Node visitCall(Call node, C context) {
        List<Expr> args = rewriteAll(node.getArgs(), context);
        List<Expr> params = rewriteAll(node.getParams(), context);
        if (args == node.getArgs() && params == node.getParams()) {
            return node;
        }
        return new Call(node.getName(), args, params, node.isDistinct());
    }

    @Override
    protected Node visitAnd(And node, C context) {
        List<Expr> exprs = rewriteAll(node.getExprs(), context);
        return exprs == node.getExprs() ? node : new And(exprs);
    }

    @Override
    protected Node visitOr(Or node, C context) {
        List<Expr> exprs = rewriteAll(node.getExprs(), context);
        return exprs == node.getExprs() ? node : new Or(exprs);
    }

    @Override
    protected Node visitNot(Not node, C context) {
        Expr expr = rewrite(node.getExpr(), context);
        return expr == node.getExpr() ? node : new Not(expr);
    }

    @Override
    protected Node visitCompareOperation(CompareOperation node, C context) {
        Expr left = rewrite(node.getLeft(), context);
        Expr right = rewrite(node.getRight(), context);
        if (left == node.getLeft() && right == node.getRight()) {
            return node;
        }
        return new CompareOperation(node.getOperator(), left, right);
    }

    @Override
    protected Node visitArithmeticOperation(ArithmeticOperation node, C context) {
        Expr left = rewrite(node.getLeft(), context);
        Expr right = rewrite(node.getRight(), context);
        if (left == node.getLeft() && right == node.getRight()) {
            return node;
        }
        return new ArithmeticOperation(node.getOperator(), left, right);
    }

    @Override
    protected Node visitArray(ArrayExpr node, C context) {
        List<Expr> elements = rewriteAll(node.getElements(), context);
        return elements == node.getElements() ? node : new ArrayExpr(elements);
    }

    @Override
    protected Node visitTuple(TupleExpr node, C context) {
        List<Expr> elements = rewriteAll(node.getElements(), context);
        return elements == node.getElements() ? node : new TupleExpr(elements);
    }

    @Override
    protected Node visitArrayAccess(ArrayAccess node, C context) {
        Expr array = rewrite(node.getArray(), context);
        Expr index = rewrite(node.getIndex(), context);
        if (array == node.getArray() && index == node.getIndex()) {
            return node;
        }
        return new ArrayAccess(array, index);
    }

    @Override
    protected Node visitTupleAccess(TupleAccess node, C context) {
        Expr tuple = rewrite(node.getTuple(), context);
        return tuple == node.getTuple() ? node : new TupleAccess(tuple, node.getIndex());
    }

    @Override
    protected Node visitLambda(Lambda node, C context) {
        Expr body = rewrite(node.getBody(), context);
        return body == node.getBody() ? node : new Lambda(node.getArgs(), body);
    }

    @Override
    protected Node visitWindowFunction(WindowFunction node, C context) {
        List<Expr> args = rewriteAll(node.getArgs(), context);
        List<Expr> partitionBy = rewriteAll(node.getPartitionBy(), context);
        List<OrderExpr> orderBy = new ArrayList<>(node.getOrderBy().size());
        boolean orderChanged = false;
        for (OrderExpr order : node.getOrderBy()) {
            OrderExpr rewritten = rewrite(order, context);
            orderChanged |= rewritten != order;
            orderBy.add(rewritten);
        }
        if (args == node.getArgs() && partitionBy == node.getPartitionBy() && !orderChanged) {
            return node;
        }
        return new WindowFunction(node.getName(), args, partitionBy, orderBy, node.getFrame().orElse(null));
    }

    @Override
    protected Node visitOrderExpr(OrderExpr node, C context) {
        Expr expr = rewrite(node.getExpr(), context);
        return expr == node.getExpr() ? node : new OrderExpr(expr, node.isDescending());
    }
}
