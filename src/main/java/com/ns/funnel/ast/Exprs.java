package com.ns.funnel.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Static factories for building trees without string formatting.
 */
public final class Exprs {

    public static final Constant NULL = new Constant(null);
    public static final Constant TRUE = new Constant(true);

    private Exprs() {
    }

    public static Field field(String... chain) {
        return new Field(Arrays.asList(chain));
    }

    public static Field field(List<String> chain) {
        return new Field(chain);
    }

    /** A table name, optionally qualified with its database as {@code db.table}. */
    public static Field table(String name) {
        return new Field(Arrays.asList(name.split("\\.")));
    }

    public static Constant constant(Object value) {
        return new Constant(value);
    }

    public static Alias alias(String alias, Expr expr) {
        return new Alias(alias, expr);
    }

    public static Call call(String name, Expr... args) {
        return new Call(name, Arrays.asList(args));
    }

    public static Call call(String name, List<? extends Expr> args) {
        return new Call(name, List.copyOf(args));
    }

    /** A parametric aggregate, {@code name(params)(args)}. */
    public static Call parametric(String name, List<? extends Expr> params, List<? extends Expr> args) {
        return new Call(name, List.copyOf(args), List.copyOf(params), false);
    }

    public static Call distinctCall(String name, Expr... args) {
        return new Call(name, Arrays.asList(args), List.of(), true);
    }

    public static Expr and(Expr... exprs) {
        return and(Arrays.asList(exprs));
    }

    /** ANDs the non-null expressions, flattening nested ANDs; a single operand is returned as is. */
    public static Expr and(List<? extends Expr> exprs) {
        List<Expr> operands = new ArrayList<>();
        for (Expr expr : exprs) {
            if (expr == null) continue;
            if (expr instanceof And) {
                operands.addAll(((And) expr).getExprs());
            } else {
                operands.add(expr);
            }
        }
        if (operands.isEmpty()) {
            return TRUE;
        }
        return operands.size() == 1 ? operands.get(0) : new And(operands);
    }

    public static Expr or(Expr... exprs) {
        return or(Arrays.asList(exprs));
    }

    public static Expr or(List<? extends Expr> exprs) {
        List<Expr> operands = new ArrayList<>();
        for (Expr expr : exprs) {
            if (expr == null) continue;
            if (expr instanceof Or) {
                operands.addAll(((Or) expr).getExprs());
            } else {
                operands.add(expr);
            }
        }
        if (operands.isEmpty()) {
            return TRUE;
        }
        return operands.size() == 1 ? operands.get(0) : new Or(operands);
    }

    public static Not not(Expr expr) {
        return new Not(expr);
    }

    public static CompareOperation compare(CompareOperation.Operator op, Expr left, Expr right) {
        return new CompareOperation(op, left, right);
    }

    public static CompareOperation eq(Expr left, Expr right) {
        return compare(CompareOperation.Operator.EQ, left, right);
    }

    public static CompareOperation notEq(Expr left, Expr right) {
        return compare(CompareOperation.Operator.NOT_EQ, left, right);
    }

    public static CompareOperation lt(Expr left, Expr right) {
        return compare(CompareOperation.Operator.LT, left, right);
    }

    public static CompareOperation ltEq(Expr left, Expr right) {
        return compare(CompareOperation.Operator.LT_EQ, left, right);
    }

    public static CompareOperation gt(Expr left, Expr right) {
        return compare(CompareOperation.Operator.GT, left, right);
    }

    public static CompareOperation gtEq(Expr left, Expr right) {
        return compare(CompareOperation.Operator.GT_EQ, left, right);
    }

    /** {@code left = value} for one value, {@code left IN (...)} for several. */
    public static Expr in(Expr left, List<? extends Expr> values) {
        if (values.size() == 1) {
            return eq(left, values.get(0));
        }
        return compare(CompareOperation.Operator.IN, left, new TupleExpr(List.copyOf(values)));
    }

    public static ArithmeticOperation plus(Expr left, Expr right) {
        return new ArithmeticOperation(ArithmeticOperation.Operator.ADD, left, right);
    }

    public static ArithmeticOperation minus(Expr left, Expr right) {
        return new ArithmeticOperation(ArithmeticOperation.Operator.SUB, left, right);
    }

    public static ArithmeticOperation multiply(Expr left, Expr right) {
        return new ArithmeticOperation(ArithmeticOperation.Operator.MULT, left, right);
    }

    public static ArithmeticOperation divide(Expr left, Expr right) {
        return new ArithmeticOperation(ArithmeticOperation.Operator.DIV, left, right);
    }

    public static ArrayExpr array(Expr... elements) {
        return new ArrayExpr(Arrays.asList(elements));
    }

    public static ArrayExpr array(List<? extends Expr> elements) {
        return new ArrayExpr(List.copyOf(elements));
    }

    public static ArrayExpr stringArray(List<String> values) {
        return new ArrayExpr(values.stream().map(Exprs::constant).collect(Collectors.toList()));
    }

    public static TupleExpr tuple(Expr... elements) {
        return new TupleExpr(Arrays.asList(elements));
    }

    public static ArrayAccess arrayElement(Expr array, int index) {
        return new ArrayAccess(array, constant(index));
    }

    public static TupleAccess tupleElement(Expr tuple, int index) {
        return new TupleAccess(tuple, index);
    }

    public static Lambda lambda(String arg, Expr body) {
        return new Lambda(List.of(arg), body);
    }

    public static Call ifElse(Expr condition, Expr then, Expr otherwise) {
        return call("if", condition, then, otherwise);
    }

    public static Call isNull(Expr expr) {
        return call("isNull", expr);
    }

    public static Call isNotNull(Expr expr) {
        return call("isNotNull", expr);
    }

    public static Exists exists(QueryExpr subquery) {
        return new Exists(subquery);
    }

    public static OrderExpr asc(Expr expr) {
        return OrderExpr.asc(expr);
    }

    public static OrderExpr desc(Expr expr) {
        return OrderExpr.desc(expr);
    }

    public static Field star() {
        return field("*");
    }

    /** {@code toDateTime('yyyy-MM-dd HH:mm:ss', 'zone')}. */
    public static Call dateTime(String value, String zone) {
        return call("toDateTime", constant(value), constant(zone));
    }
}
