package com.ns.funnel.ast;

/**
 * Visits every child of every node. Subclasses override the node types they care about
 * and call {@code super} to keep descending.
 */
public abstract class DefaultTraversalVisitor<C> extends AstVisitor<Void, C> {

    @Override
    protected Void visitAlias(Alias node, C context) {
        process(node.getExpr(), context);
        return null;
    }

    @Override
    protected Void visitCall(Call node, C context) {
        node.getParams().forEach(param -> process(param, context));
        node.getArgs().forEach(arg -> process(arg, context));
        return null;
    }

    @Override
    protected Void visitAnd(And node, C context) {
        node.getExprs().forEach(expr -> process(expr, context));
        return null;
    }

    @Override
    protected Void visitOr(Or node, C context) {
        node.getExprs().forEach(expr -> process(expr, context));
        return null;
    }

    @Override
    protected Void visitNot(Not node, C context) {
        process(node.getExpr(), context);
        return null;
    }

    @Override
    protected Void visitCompareOperation(CompareOperation node, C context) {
        process(node.getLeft(), context);
        process(node.getRight(), context);
        return null;
    }

    @Override
    protected Void visitArithmeticOperation(ArithmeticOperation node, C context) {
        process(node.getLeft(), context);
        process(node.getRight(), context);
        return null;
    }

    @Override
    protected Void visitArray(ArrayExpr node, C context) {
        node.getElements().forEach(element -> process(element, context));
        return null;
    }

    @Override
    protected Void visitTuple(TupleExpr node, C context) {
        node.getElements().forEach(element -> process(element, context));
        return null;
    }

    @Override
    protected Void visitArrayAccess(ArrayAccess node, C context) {
        process(node.getArray(), context);
        process(node.getIndex(), context);
        return null;
    }

    @Override
    protected Void visitTupleAccess(TupleAccess node, C context) {
        process(node.getTuple(), context);
        return null;
    }

    @Override
    protected Void visitLambda(Lambda node, C context) {
        process(node.getBody(), context);
        return null;
    }

    @Override
    protected Void visitWindowFunction(WindowFunction node, C context) {
        node.getArgs().forEach(arg -> process(arg, context));
        node.getPartitionBy().forEach(expr -> process(expr, context));
        node.getOrderBy().forEach(order -> process(order, context));
        return null;
    }

    @Override
    protected Void visitExists(Exists node, C context) {
        process(node.getSubquery(), context);
        return null;
    }

    @Override
    protected Void visitSelectQuery(SelectQuery node, C context) {
        node.getCtes().values().forEach(cte -> process(cte, context));
        node.getSelect().forEach(expr -> process(expr, context));
        node.getFrom().ifPresent(from -> process(from, context));
        node.getArrayJoin().forEach(expr -> process(expr, context));
        node.getWhere().ifPresent(where -> process(where, context));
        node.getGroupBy().forEach(expr -> process(expr, context));
        node.getHaving().ifPresent(having -> process(having, context));
        node.getOrderBy().forEach(order -> process(order, context));
        return null;
    }

    @Override
    protected Void visitSelectUnionQuery(SelectUnionQuery node, C context) {
        node.getQueries().forEach(query -> process(query, context));
        return null;
    }

    @Override
    protected Void visitJoinExpr(JoinExpr node, C context) {
        process(node.getTable(), context);
        node.getConstraint().ifPresent(constraint -> process(constraint, context));
        node.getNext().ifPresent(next -> process(next, context));
        return null;
    }

    @Override
    protected Void visitOrderExpr(OrderExpr node, C context) {
        process(node.getExpr(), context);
        return null;
    }
}
