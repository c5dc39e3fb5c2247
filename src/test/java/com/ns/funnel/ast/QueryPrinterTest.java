package com.ns.funnel.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;

public class QueryPrinterTest {

    @Test
    void printsConstantsAndIdentifiers() {
        assertEquals("'it\\'s'", QueryPrinter.print(Exprs.constant("it's")));
        assertEquals("NULL", QueryPrinter.print(Exprs.NULL));
        assertEquals("true", QueryPrinter.print(Exprs.TRUE));
        assertEquals("2.5", QueryPrinter.print(Exprs.constant(2.50)));
        assertEquals("properties.`$browser`", QueryPrinter.print(Exprs.field("properties", "$browser")));
        assertEquals("count() AS `total count`", QueryPrinter.print(Exprs.alias("total count", Exprs.call("count"))));
    }

    @Test
    void printsCallsAndConditionals() {
        Expr step = Exprs.ifElse(Exprs.eq(Exprs.field("event"), Exprs.constant("signup")), Exprs.constant(1), Exprs.constant(0));
        assertEquals("if(event = 'signup', 1, 0)", QueryPrinter.print(step));

        Call parametric = Exprs.parametric("quantiles", List.of(Exprs.constant(0.5)), List.of(Exprs.field("t")));
        assertEquals("quantiles(0.5)(t)", QueryPrinter.print(parametric));
        assertEquals("count(DISTINCT person_id)", QueryPrinter.print(Exprs.distinctCall("count", Exprs.field("person_id"))));
    }

    @Test
    void inCollapsesToEqualityForOneValue() {
        Expr single = Exprs.in(Exprs.field("event"), List.of(Exprs.constant("a")));
        Expr many = Exprs.in(Exprs.field("event"), List.of(Exprs.constant("a"), Exprs.constant("b")));

        assertEquals("event = 'a'", QueryPrinter.print(single));
        assertEquals("event IN ('a', 'b')", QueryPrinter.print(many));
    }

    @Test
    void booleanOperatorsFlattenAndParenthesize() {
        Expr a = Exprs.eq(Exprs.field("a"), Exprs.constant(1));
        Expr b = Exprs.eq(Exprs.field("b"), Exprs.constant(2));
        Expr c = Exprs.eq(Exprs.field("c"), Exprs.constant(3));

        assertEquals("(a = 1 AND b = 2 AND c = 3)", QueryPrinter.print(Exprs.and(Exprs.and(a, b), c)));
        assertEquals("(a = 1 OR (b = 2 AND c = 3))", QueryPrinter.print(Exprs.or(a, Exprs.and(b, null, c))));
        assertSame(a, Exprs.and(a));
        assertSame(Exprs.TRUE, Exprs.and(List.of()));
        assertEquals("((a + 1) * 2)", QueryPrinter.print(
            Exprs.multiply(Exprs.plus(Exprs.field("a"), Exprs.constant(1)), Exprs.constant(2))));
    }

    @Test
    void printsWindowFunctions() {
        WindowFunction fn = new WindowFunction("min", List.of(Exprs.field("latest_1")),
            List.of(Exprs.field("aggregation_target")), List.of(Exprs.desc(Exprs.field("timestamp"))), WindowFrame.upTo(0));

        assertEquals("min(latest_1) OVER (PARTITION BY aggregation_target ORDER BY timestamp DESC "
            + "ROWS BETWEEN UNBOUNDED PRECEDING AND 0 PRECEDING)", QueryPrinter.print(fn));
    }

    @Test
    void printsSelectWithSubqueryAndJoin() {
        SelectQuery inner = SelectQuery.builder()
            .select(Exprs.field("person_id"))
            .from(Exprs.field("cohortpeople"))
            .where(Exprs.eq(Exprs.field("cohort_id"), Exprs.constant(42)))
            .build();
        SelectQuery outer = SelectQuery.builder()
            .select(Exprs.alias("total", Exprs.call("count")))
            .from(JoinExpr.from(Exprs.field("events"), "e")
                .then(JoinExpr.join("INNER JOIN", Exprs.field("persons"), "p",
                    Exprs.eq(Exprs.field("p", "id"), Exprs.field("e", "person_id")))))
            .where(Exprs.compare(CompareOperation.Operator.IN, Exprs.field("e", "person_id"), inner))
            .groupBy(Exprs.field("e", "event"))
            .orderBy(Exprs.desc(Exprs.field("total")))
            .limit(10)
            .build();

        assertEquals("SELECT count() AS total FROM events AS e INNER JOIN persons AS p ON p.id = e.person_id "
                + "WHERE e.person_id IN (SELECT person_id FROM cohortpeople WHERE cohort_id = 42) "
                + "GROUP BY e.event ORDER BY total DESC LIMIT 10",
            QueryPrinter.print(outer));
    }

    @Test
    void dateTimeLiteral() {
        assertEquals("toDateTime('2024-01-01 00:00:00', 'UTC')",
            QueryPrinter.print(Exprs.dateTime("2024-01-01 00:00:00", "UTC")));
    }

    @Test
    void requalifierPrefixesFieldsOutsideLambdas() {
        Expr predicate = Exprs.and(
            Exprs.eq(Exprs.field("event"), Exprs.constant("signup")),
            Exprs.call("arrayExists", Exprs.lambda("x", Exprs.eq(Exprs.field("x"), Exprs.field("uuid"))), Exprs.field("uuids")));

        Expr qualified = FieldRequalifier.requalify(predicate, "prior");

        assertEquals("(prior.event = 'signup' AND arrayExists(x -> x = prior.uuid, prior.uuids))", QueryPrinter.print(qualified));
    }

    @Test
    void rewriterKeepsUnchangedNodes() {
        Expr expr = Exprs.call("toString", Exprs.field("prior", "event"));
        assertSame(expr, FieldRequalifier.requalify(expr, "prior"));
        assertNotSame(expr, FieldRequalifier.requalify(expr, "e"));
    }
}
