package com.ns.funnel.hogql;

import com.ns.funnel.ast.ArithmeticOperation;
import com.ns.funnel.ast.ArrayAccess;
import com.ns.funnel.ast.CompareOperation;
import com.ns.funnel.ast.Constant;
import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.TupleExpr;
import com.ns.funnel.context.FunnelValidationException;
import com.ns.funnel.context.ValidationCode;
import io.trino.sql.parser.ParsingException;
import io.trino.sql.parser.SqlParser;
import io.trino.sql.tree.ArithmeticBinaryExpression;
import io.trino.sql.tree.ArithmeticUnaryExpression;
import io.trino.sql.tree.AstVisitor;
import io.trino.sql.tree.BooleanLiteral;
import io.trino.sql.tree.ComparisonExpression;
import io.trino.sql.tree.DecimalLiteral;
import io.trino.sql.tree.DereferenceExpression;
import io.trino.sql.tree.DoubleLiteral;
import io.trino.sql.tree.Expression;
import io.trino.sql.tree.FunctionCall;
import io.trino.sql.tree.Identifier;
import io.trino.sql.tree.IfExpression;
import io.trino.sql.tree.InListExpression;
import io.trino.sql.tree.InPredicate;
import io.trino.sql.tree.IsNotNullPredicate;
import io.trino.sql.tree.IsNullPredicate;
import io.trino.sql.tree.LambdaArgumentDeclaration;
import io.trino.sql.tree.LambdaExpression;
import io.trino.sql.tree.LikePredicate;
import io.trino.sql.tree.LogicalExpression;
import io.trino.sql.tree.LongLiteral;
import io.trino.sql.tree.Node;
import io.trino.sql.tree.NotExpression;
import io.trino.sql.tree.NullLiteral;
import io.trino.sql.tree.SearchedCaseExpression;
import io.trino.sql.tree.StringLiteral;
import io.trino.sql.tree.SubscriptExpression;
import io.trino.sql.tree.WhenClause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Parses user-supplied HogQL expressions (breakdowns, aggregation targets, property
 * filters) into the typed AST. The text goes through the Trino expression parser, after
 * backtick identifiers and bare {@code $}-prefixed identifiers have been turned into
 * double-quoted identifiers, which Trino accepts.
 */
public class HogQLExpressionParser {
    private static final Logger logger = LoggerFactory.getLogger(HogQLExpressionParser.class);

    private final SqlParser sqlParser = new SqlParser();

    public Expr parse(String hogql) {
        if (hogql == null || hogql.isBlank()) {
            throw new FunnelValidationException(ValidationCode.INVALID_HOGQL_EXPRESSION, "HogQL expression is empty");
        }
        String normalized = normalizeIdentifiers(hogql);
        logger.debug("Parsing HogQL expression: {}", normalized);
        try {
            Expression expression = sqlParser.createExpression(normalized);
            return new ExpressionConverter().process(expression, null);
        } catch (ParsingException e) {
            throw new FunnelValidationException(ValidationCode.INVALID_HOGQL_EXPRESSION,
                "Cannot parse HogQL expression '" + hogql + "': " + e.getErrorMessage());
        } catch (UnsupportedOperationException e) {
            throw new FunnelValidationException(ValidationCode.INVALID_HOGQL_EXPRESSION,
                "Unsupported construct in HogQL expression '" + hogql + "': " + e.getMessage());
        }
    }

    /**
     * Rewrites {@code `x`} and bare {@code $x} identifiers to {@code "x"} / {@code "$x"},
     * leaving string literals untouched.
     */
    static String normalizeIdentifiers(String text) {
        StringBuilder out = new StringBuilder(text.length() + 8);
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\'') {
                int end = i + 1;
                while (end < text.length()) {
                    char e = text.charAt(end);
                    if (e == '\\') {
                        end += 2;
                        continue;
                    }
                    if (e == '\'') {
                        if (end + 1 < text.length() && text.charAt(end + 1) == '\'') {
                            end += 2;
                            continue;
                        }
                        break;
                    }
                    end++;
                }
                int stop = Math.min(end + 1, text.length());
                out.append(text, i, stop);
                i = stop;
            } else if (c == '`') {
                int end = text.indexOf('`', i + 1);
                if (end < 0) {
                    throw new FunnelValidationException(ValidationCode.INVALID_HOGQL_EXPRESSION, "Unterminated identifier in '" + text + "'");
                }
                out.append('"').append(text, i + 1, end).append('"');
                i = end + 1;
            } else if (c == '"') {
                int end = text.indexOf('"', i + 1);
                int stop = end < 0 ? text.length() : end + 1;
                out.append(text, i, stop);
                i = stop;
            } else if (c == '$' && (i == 0 || !Character.isLetterOrDigit(text.charAt(i - 1)))) {
                int end = i + 1;
                while (end < text.length() && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '_')) {
                    end++;
                }
                out.append('"').append(text, i, end).append('"');
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static class ExpressionConverter extends AstVisitor<Expr, Void> {

        private List<Expr> convertAll(List<Expression> expressions) {
            return expressions.stream().map(e -> process(e, null)).collect(Collectors.toList());
        }

        @Override
        protected Expr visitNode(Node node, Void context) {
            throw new UnsupportedOperationException(node.getClass().getSimpleName());
        }

        @Override
        protected Expr visitIdentifier(Identifier node, Void context) {
            return Exprs.field(node.getValue());
        }

        @Override
        protected Expr visitDereferenceExpression(DereferenceExpression node, Void context) {
            LinkedList<String> chain = new LinkedList<>();
            Expression current = node;
            while (current instanceof DereferenceExpression) {
                DereferenceExpression deref = (DereferenceExpression) current;
                Optional<Identifier> field = deref.getField();
                if (field.isEmpty()) {
                    throw new UnsupportedOperationException("wildcard dereference");
                }
                chain.addFirst(field.get().getValue());
                current = deref.getBase();
            }
            if (!(current instanceof Identifier)) {
                throw new UnsupportedOperationException("dereference of " + current.getClass().getSimpleName());
            }
            chain.addFirst(((Identifier) current).getValue());
            return Exprs.field(chain);
        }

        @Override
        protected Expr visitStringLiteral(StringLiteral node, Void context) {
            return Exprs.constant(node.getValue());
        }

        @Override
        protected Expr visitLongLiteral(LongLiteral node, Void context) {
            return Exprs.constant(Long.parseLong(node.getValue()));
        }

        @Override
        protected Expr visitDoubleLiteral(DoubleLiteral node, Void context) {
            return Exprs.constant(node.getValue());
        }

        @Override
        protected Expr visitDecimalLiteral(DecimalLiteral node, Void context) {
            return Exprs.constant(new BigDecimal(node.getValue()).doubleValue());
        }

        @Override
        protected Expr visitBooleanLiteral(BooleanLiteral node, Void context) {
            return Exprs.constant(node.getValue());
        }

        @Override
        protected Expr visitNullLiteral(NullLiteral node, Void context) {
            return Exprs.NULL;
        }

        @Override
        protected Expr visitFunctionCall(FunctionCall node, Void context) {
            List<Identifier> parts = node.getName().getOriginalParts();
            String name = parts.get(parts.size() - 1).getValue();
            List<Expr> args = convertAll(node.getArguments());
            if (node.isDistinct()) {
                return new com.ns.funnel.ast.Call(name, args, List.of(), true);
            }
            return Exprs.call(name, args);
        }

        @Override
        protected Expr visitComparisonExpression(ComparisonExpression node, Void context) {
            Expr left = process(node.getLeft(), null);
            Expr right = process(node.getRight(), null);
            switch (node.getOperator()) {
                case EQUAL:
                    return Exprs.eq(left, right);
                case NOT_EQUAL:
                    return Exprs.notEq(left, right);
                case LESS_THAN:
                    return Exprs.lt(left, right);
                case LESS_THAN_OR_EQUAL:
                    return Exprs.ltEq(left, right);
                case GREATER_THAN:
                    return Exprs.gt(left, right);
                case GREATER_THAN_OR_EQUAL:
                    return Exprs.gtEq(left, right);
                default:
                    throw new UnsupportedOperationException("comparison " + node.getOperator());
            }
        }

        @Override
        protected Expr visitLogicalExpression(LogicalExpression node, Void context) {
            List<Expr> terms = convertAll(node.getTerms());
            return node.getOperator() == LogicalExpression.Operator.AND ? Exprs.and(terms) : Exprs.or(terms);
        }

        @Override
        protected Expr visitNotExpression(NotExpression node, Void context) {
            return Exprs.not(process(node.getValue(), null));
        }

        @Override
        protected Expr visitArithmeticBinary(ArithmeticBinaryExpression node, Void context) {
            Expr left = process(node.getLeft(), null);
            Expr right = process(node.getRight(), null);
            switch (node.getOperator()) {
                case ADD:
                    return new ArithmeticOperation(ArithmeticOperation.Operator.ADD, left, right);
                case SUBTRACT:
                    return new ArithmeticOperation(ArithmeticOperation.Operator.SUB, left, right);
                case MULTIPLY:
                    return new ArithmeticOperation(ArithmeticOperation.Operator.MULT, left, right);
                case DIVIDE:
                    return new ArithmeticOperation(ArithmeticOperation.Operator.DIV, left, right);
                case MODULUS:
                    return new ArithmeticOperation(ArithmeticOperation.Operator.MOD, left, right);
                default:
                    throw new UnsupportedOperationException("arithmetic " + node.getOperator());
            }
        }

        @Override
        protected Expr visitArithmeticUnary(ArithmeticUnaryExpression node, Void context) {
            Expr value = process(node.getValue(), null);
            if (node.getSign() == ArithmeticUnaryExpression.Sign.PLUS) {
                return value;
            }
            if (value instanceof Constant && ((Constant) value).getValue() instanceof Long) {
                return Exprs.constant(-((Long) ((Constant) value).getValue()));
            }
            if (value instanceof Constant && ((Constant) value).getValue() instanceof Double) {
                return Exprs.constant(-((Double) ((Constant) value).getValue()));
            }
            return Exprs.call("negate", value);
        }

        @Override
        protected Expr visitIsNullPredicate(IsNullPredicate node, Void context) {
            return Exprs.isNull(process(node.getValue(), null));
        }

        @Override
        protected Expr visitIsNotNullPredicate(IsNotNullPredicate node, Void context) {
            return Exprs.isNotNull(process(node.getValue(), null));
        }

        @Override
        protected Expr visitInPredicate(InPredicate node, Void context) {
            if (!(node.getValueList() instanceof InListExpression)) {
                throw new UnsupportedOperationException("IN with a subquery");
            }
            List<Expr> values = convertAll(((InListExpression) node.getValueList()).getValues());
            return new CompareOperation(CompareOperation.Operator.IN, process(node.getValue(), null), new TupleExpr(values));
        }

        @Override
        protected Expr visitLikePredicate(LikePredicate node, Void context) {
            if (node.getEscape().isPresent()) {
                throw new UnsupportedOperationException("LIKE with ESCAPE");
            }
            return new CompareOperation(CompareOperation.Operator.LIKE, process(node.getValue(), null), process(node.getPattern(), null));
        }

        @Override
        protected Expr visitIfExpression(IfExpression node, Void context) {
            Expr otherwise = node.getFalseValue().map(e -> process(e, null)).orElse(Exprs.NULL);
            return Exprs.ifElse(process(node.getCondition(), null), process(node.getTrueValue(), null), otherwise);
        }

        @Override
        protected Expr visitSearchedCaseExpression(SearchedCaseExpression node, Void context) {
            List<Expr> args = new ArrayList<>();
            for (WhenClause when : node.getWhenClauses()) {
                args.add(process(when.getOperand(), null));
                args.add(process(when.getResult(), null));
            }
            args.add(node.getDefaultValue().map(e -> process(e, null)).orElse(Exprs.NULL));
            return Exprs.call("multiIf", args);
        }

        @Override
        protected Expr visitSubscriptExpression(SubscriptExpression node, Void context) {
            return new ArrayAccess(process(node.getBase(), null), process(node.getIndex(), null));
        }

        @Override
        protected Expr visitLambdaExpression(LambdaExpression node, Void context) {
            List<String> args = node.getArguments().stream()
                .map(LambdaArgumentDeclaration::getName)
                .map(Identifier::getValue)
                .collect(Collectors.toList());
            return new com.ns.funnel.ast.Lambda(args, process(node.getBody(), null));
        }
    }
}
