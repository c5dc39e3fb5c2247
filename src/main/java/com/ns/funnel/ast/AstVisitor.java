package com.ns.funnel.ast;

public abstract class AstVisitor<R, C> {

    public R process(Node node, C context) {
        return node.accept(this, context);
    }

    protected R visitNode(Node node, C context) {
        return null;
    }

    protected R visitExpr(Expr node, C context) {
        return visitNode(node, context);
    }

    protected R visitConstant(Constant node, C context) {
        return visitExpr(node, context);
    }

    protected R visitField(Field node, C context) {
        return visitExpr(node, context);
    }

    protected R visitAlias(Alias node, C context) {
        return visitExpr(node, context);
    }

    protected R visitCall(Call node, C context) {
        return visitExpr(node, context);
    }

    protected R visitAnd(And node, C context) {
        return visitExpr(node, context);
    }

    protected R visitOr(Or node, C context) {
        return visitExpr(node, context);
    }

    protected R visitNot(Not node, C context) {
        return visitExpr(node, context);
    }

    protected R visitCompareOperation(CompareOperation node, C context) {
        return visitExpr(node, context);
    }

    protected R visitArithmeticOperation(ArithmeticOperation node, C context) {
        return visitExpr(node, context);
    }

    protected R visitArray(ArrayExpr node, C context) {
        return visitExpr(node, context);
    }

    protected R visitTuple(TupleExpr node, C context) {
        return visitExpr(node, context);
    }

    protected R visitArrayAccess(ArrayAccess node, C context) {
        return visitExpr(node, context);
    }

    protected R visitTupleAccess(TupleAccess node, C context) {
        return visitExpr(node, context);
    }

    protected R visitLambda(Lambda node, C context) {
        return visitExpr(node, context);
    }

    protected R visitWindowFunction(WindowFunction node, C context) {
        return visitExpr(node, context);
    }

    protected R visitExists(Exists node, C context) {
        return visitExpr(node, context);
    }

    protected R visitSelectQuery(SelectQuery node, C context) {
        return visitExpr(node, context);
    }

    protected R visitSelectUnionQuery(SelectUnionQuery node, C context) {
        return visitExpr(node, context);
    }

    protected R visitJoinExpr(JoinExpr node, C context) {
        return visitNode(node, context);
    }

    protected R visitOrderExpr(OrderExpr node, C context) {
        return visitNode(node, context);
    }
}
