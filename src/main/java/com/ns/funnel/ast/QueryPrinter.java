package com.ns.funnel.ast;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders a tree as ClickHouse-flavoured query text on a single line.
 */
public class QueryPrinter extends AstVisitor<String, Void> {
    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final QueryPrinter INSTANCE = new QueryPrinter();

    public static String print(Node node) {
        return INSTANCE.process(node, null);
    }

    public static String quoteIdentifier(String identifier) {
        if ("*".equals(identifier) || PLAIN_IDENTIFIER.matcher(identifier).matches()) {
            return identifier;
        }
        return "`" + identifier.replace("\\", "\\\\").replace("`", "\\`") + "`";
    }

    public static String quoteString(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private String join(List<? extends Node> nodes) {
        return nodes.stream().map(this::operand).collect(Collectors.joining(", "));
    }

    /** Scalar subqueries in expression position need their own parentheses. */
    private String operand(Node node) {
        return node instanceof QueryExpr ? subquery((Expr) node) : process(node, null);
    }

    private String subquery(Expr expr) {
        return "(" + process(expr, null) + ")";
    }

    @Override
    protected String visitNode(Node node, Void context) {
        throw new IllegalArgumentException("Cannot print node of type " + node.getClass().getSimpleName());
    }

    @Override
    protected String visitConstant(Constant node, Void context) {
        Object value = node.getValue();
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String) {
            return quoteString((String) value);
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(((Number) value).doubleValue()).stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    @Override
    protected String visitField(Field node, Void context) {
        return node.getChain().stream().map(QueryPrinter::quoteIdentifier).collect(Collectors.joining("."));
    }

    @Override
    protected String visitAlias(Alias node, Void context) {
        return operand(node.getExpr()) + " AS " + quoteIdentifier(node.getAlias());
    }

    @Override
    protected String visitCall(Call node, Void context) {
        StringBuilder sb = new StringBuilder(node.getName());
        if (!node.getParams().isEmpty()) {
            sb.append('(').append(join(node.getParams())).append(')');
        }
        sb.append('(');
        if (node.isDistinct()) {
            sb.append("DISTINCT ");
        }
        return sb.append(join(node.getArgs())).append(')').toString();
    }

    @Override
    protected String visitAnd(And node, Void context) {
        return "(" + node.getExprs().stream().map(e -> process(e, null)).collect(Collectors.joining(" AND ")) + ")";
    }

    @Override
    protected String visitOr(Or node, Void context) {
        return "(" + node.getExprs().stream().map(e -> process(e, null)).collect(Collectors.joining(" OR ")) + ")";
    }

    @Override
    protected String visitNot(Not node, Void context) {
        return "NOT (" + process(node.getExpr(), null) + ")";
    }

    @Override
    protected String visitCompareOperation(CompareOperation node, Void context) {
        return operand(node.getLeft()) + " " + node.getOperator().getSymbol() + " " + operand(node.getRight());
    }

    @Override
    protected String visitArithmeticOperation(ArithmeticOperation node, Void context) {
        return "(" + operand(node.getLeft()) + " " + node.getOperator().getSymbol() + " " + operand(node.getRight()) + ")";
    }

    @Override
    protected String visitArray(ArrayExpr node, Void context) {
        return "[" + join(node.getElements()) + "]";
    }

    @Override
    protected String visitTuple(TupleExpr node, Void context) {
        if (node.getElements().size() == 1) {
            return "tuple(" + join(node.getElements()) + ")";
        }
        return "(" + join(node.getElements()) + ")";
    }

    @Override
    protected String visitArrayAccess(ArrayAccess node, Void context) {
        return process(node.getArray(), null) + "[" + process(node.getIndex(), null) + "]";
    }

    @Override
    protected String visitTupleAccess(TupleAccess node, Void context) {
        return process(node.getTuple(), null) + "." + node.getIndex();
    }

    @Override
    protected String visitLambda(Lambda node, Void context) {
        String args = node.getArgs().size() == 1
            ? quoteIdentifier(node.getArgs().get(0))
            : "(" + node.getArgs().stream().map(QueryPrinter::quoteIdentifier).collect(Collectors.joining(", ")) + ")";
        return args + " -> " + process(node.getBody(), null);
    }

    @Override
    protected String visitWindowFunction(WindowFunction node, Void context) {
        StringBuilder over = new StringBuilder();
        if (!node.getPartitionBy().isEmpty()) {
            over.append("PARTITION BY ").append(join(node.getPartitionBy()));
        }
        if (!node.getOrderBy().isEmpty()) {
            if (over.length() > 0) over.append(' ');
            over.append("ORDER BY ").append(join(node.getOrderBy()));
        }
        node.getFrame().ifPresent(frame -> {
            if (over.length() > 0) over.append(' ');
            over.append("ROWS BETWEEN ").append(bound(frame.getStart())).append(" AND ").append(bound(frame.getEnd()));
        });
        return node.getName() + "(" + join(node.getArgs()) + ") OVER (" + over + ")";
    }

    private static String bound(WindowFrame.Bound bound) {
        switch (bound.getType()) {
            case CURRENT_ROW:
                return "CURRENT ROW";
            case PRECEDING:
                return bound.isUnbounded() ? "UNBOUNDED PRECEDING" : bound.getOffset() + " PRECEDING";
            case FOLLOWING:
                return bound.isUnbounded() ? "UNBOUNDED FOLLOWING" : bound.getOffset() + " FOLLOWING";
            default:
                throw new IllegalArgumentException("Unknown frame bound: " + bound.getType());
        }
    }

    @Override
    protected String visitExists(Exists node, Void context) {
        return "exists(" + process(node.getSubquery(), null) + ")";
    }

    @Override
    protected String visitSelectQuery(SelectQuery node, Void context) {
        StringBuilder sb = new StringBuilder();
        if (!node.getCtes().isEmpty()) {
            sb.append("WITH ");
            boolean first = true;
            for (Map.Entry<String, QueryExpr> cte : node.getCtes().entrySet()) {
                if (!first) sb.append(", ");
                sb.append(quoteIdentifier(cte.getKey())).append(" AS ").append(subquery(cte.getValue()));
                first = false;
            }
            sb.append(' ');
        }
        sb.append("SELECT ");
        if (node.isDistinct()) {
            sb.append("DISTINCT ");
        }
        sb.append(node.getSelect().stream().map(this::selectItem).collect(Collectors.joining(", ")));
        node.getFrom().ifPresent(from -> sb.append(" FROM ").append(process(from, null)));
        if (!node.getArrayJoin().isEmpty()) {
            sb.append(" ARRAY JOIN ").append(join(node.getArrayJoin()));
        }
        node.getWhere().ifPresent(where -> sb.append(" WHERE ").append(process(where, null)));
        if (!node.getGroupBy().isEmpty()) {
            sb.append(" GROUP BY ").append(join(node.getGroupBy()));
        }
        node.getHaving().ifPresent(having -> sb.append(" HAVING ").append(process(having, null)));
        if (!node.getOrderBy().isEmpty()) {
            sb.append(" ORDER BY ").append(join(node.getOrderBy()));
        }
        node.getLimit().ifPresent(limit -> sb.append(" LIMIT ").append(limit));
        node.getOffset().ifPresent(offset -> sb.append(" OFFSET ").append(offset));
        return sb.toString();
    }

    private String selectItem(Expr expr) {
        if (expr instanceof QueryExpr) {
            return subquery(expr);
        }
        if (expr instanceof Alias && ((Alias) expr).getExpr() instanceof QueryExpr) {
            Alias alias = (Alias) expr;
            return subquery(alias.getExpr()) + " AS " + quoteIdentifier(alias.getAlias());
        }
        return process(expr, null);
    }

    @Override
    protected String visitSelectUnionQuery(SelectUnionQuery node, Void context) {
        return node.getQueries().stream().map(q -> process(q, null)).collect(Collectors.joining(" UNION ALL "));
    }

    @Override
    protected String visitJoinExpr(JoinExpr node, Void context) {
        StringBuilder sb = new StringBuilder();
        node.getJoinType().ifPresent(type -> sb.append(type).append(' '));
        Expr table = node.getTable();
        sb.append(table instanceof QueryExpr ? subquery(table) : process(table, null));
        node.getAlias().ifPresent(alias -> sb.append(" AS ").append(quoteIdentifier(alias)));
        node.getSample().ifPresent(sample -> sb.append(" SAMPLE ").append(process(new Constant(sample), null)));
        node.getConstraint().ifPresent(constraint -> sb.append(" ON ").append(process(constraint, null)));
        node.getNext().ifPresent(next -> sb.append(' ').append(process(next, null)));
        return sb.toString();
    }

    @Override
    protected String visitOrderExpr(OrderExpr node, Void context) {
        return process(node.getExpr(), null) + (node.isDescending() ? " DESC" : " ASC");
    }
}
