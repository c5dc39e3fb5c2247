package com.ns.funnel.query;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.QueryExpr;
import com.ns.funnel.ast.QueryPrinter;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.model.BreakdownAttribution;
import com.ns.funnel.model.BreakdownSpec;
import com.ns.funnel.model.BreakdownType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.ns.funnel.FunnelTestSupport.POWER_USERS_COHORT_ID;
import static com.ns.funnel.FunnelTestSupport.context;
import static com.ns.funnel.FunnelTestSupport.funnel;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BreakdownAttributionBuilderTest {

    private static QueryContext breakdown(BreakdownSpec.Builder breakdown) {
        return context(funnel("a", "b").breakdown(breakdown.build()));
    }

    private static String columns(QueryContext context) {
        return new BreakdownAttributionBuilder(context).selectColumns(2).stream()
            .map(QueryPrinter::print)
            .collect(Collectors.joining(", "));
    }

    @Test
    void needsABreakdown() {
        assertThrows(IllegalStateException.class, () -> new BreakdownAttributionBuilder(context(funnel("a", "b"))));
    }

    @Test
    void propertyValuesDefaultToEmptyString() {
        QueryContext single = breakdown(BreakdownSpec.builder(BreakdownType.EVENT).properties("$browser"));
        QueryContext multi = breakdown(BreakdownSpec.builder(BreakdownType.PERSON).properties("plan", "country"));

        assertEquals("ifNull(properties.`$browser`, '')", QueryPrinter.print(new BreakdownAttributionBuilder(single).propBasic()));
        assertEquals("[ifNull(person.properties.plan, ''), ifNull(person.properties.country, '')]",
            QueryPrinter.print(new BreakdownAttributionBuilder(multi).propBasic()));
    }

    @Test
    void groupAndHogqlBreakdowns() {
        QueryContext group = breakdown(BreakdownSpec.builder(BreakdownType.GROUP).groupTypeIndex(1).properties("industry"));
        QueryContext hogql = breakdown(BreakdownSpec.builder(BreakdownType.HOGQL).properties("properties.$os"));

        assertEquals("ifNull(group_1.properties.industry, '')", QueryPrinter.print(new BreakdownAttributionBuilder(group).propBasic()));
        assertEquals("properties.`$os`", QueryPrinter.print(new BreakdownAttributionBuilder(hogql).propBasic()));
    }

    @Test
    void normalizedUrlsFallBackToSlash() {
        QueryContext context = breakdown(BreakdownSpec.builder(BreakdownType.EVENT).properties("$current_url").normalizeUrl(true));
        String value = QueryPrinter.print(new BreakdownAttributionBuilder(context).propBasic());

        assertTrue(value.startsWith("if(empty(replaceRegexpOne(ifNull(properties.`$current_url`, ''), "));
        assertTrue(value.contains(", '/', replaceRegexpOne("));
    }

    @Test
    void lastTouchPicksTheLatestNonNullValue() {
        QueryContext context = breakdown(BreakdownSpec.builder(BreakdownType.EVENT)
            .properties("$browser").attribution(BreakdownAttribution.lastTouch()));

        assertEquals("ifNull(properties.`$browser`, '') AS prop_basic, prop_basic AS prop, "
                + "argMaxIf(prop, timestamp, isNotNull(prop)) OVER (PARTITION BY aggregation_target) AS prop_vals",
            columns(context));
    }

    @Test
    void arrayValuedFirstTouchSkipsEmptyArrays() {
        QueryContext context = breakdown(BreakdownSpec.builder(BreakdownType.EVENT).properties("$browser", "$os"));
        String columns = columns(context);
        String attributed = QueryPrinter.print(new BreakdownAttributionBuilder(context).attribute(events()));

        assertTrue(columns.contains("argMinIf(prop, timestamp, notEmpty(arrayFilter(x -> notEmpty(x), prop))) OVER"));
        assertEquals("SELECT *, if(notEmpty(arrayFilter(x -> notEmpty(x), prop_vals)), prop_vals, ['', '']) AS prop FROM (SELECT * FROM events)",
            attributed);
    }

    @Test
    void stepAttributionExplodesEveryValueSeenAtTheStep() {
        QueryContext context = breakdown(BreakdownSpec.builder(BreakdownType.EVENT)
            .properties("$browser").attribution(BreakdownAttribution.step(1)));

        assertEquals("ifNull(properties.`$browser`, '') AS prop_basic, "
                + "if(step_0 = 1, prop_basic, NULL) AS prop_0, if(step_1 = 1, prop_basic, NULL) AS prop_1, prop_1 AS prop, "
                + "groupUniqArray(prop) OVER (PARTITION BY aggregation_target) AS prop_vals",
            columns(context));
        assertEquals("SELECT *, prop FROM (SELECT * FROM events) ARRAY JOIN prop_vals AS prop",
            QueryPrinter.print(new BreakdownAttributionBuilder(context).attribute(events())));
    }

    @Test
    void allEventsAttributionUsesTheRowValue() {
        QueryContext context = breakdown(BreakdownSpec.builder(BreakdownType.EVENT)
            .properties("$browser").attribution(BreakdownAttribution.allEvents()));
        QueryExpr events = events();

        assertEquals("ifNull(properties.`$browser`, '') AS prop_basic, prop_basic AS prop", columns(context));
        assertSame(events, new BreakdownAttributionBuilder(context).attribute(events));
    }

    @Test
    void knownValuesGroupTheRestAsOther() {
        QueryContext single = breakdown(BreakdownSpec.builder(BreakdownType.EVENT)
            .properties("$browser").values(List.of(List.of("Chrome"), List.of("Safari"))));
        QueryContext multi = breakdown(BreakdownSpec.builder(BreakdownType.EVENT)
            .properties("$browser", "$os").values(List.of(List.of("Chrome", "Mac"))));
        QueryContext open = breakdown(BreakdownSpec.builder(BreakdownType.EVENT).properties("$browser"));

        assertEquals("if(has(['Chrome', 'Safari'], prop), prop, 'Other') AS prop",
            QueryPrinter.print(new BreakdownAttributionBuilder(single).groupedProp()));
        assertEquals("if(has([['Chrome', 'Mac']], prop), prop, ['Other']) AS prop",
            QueryPrinter.print(new BreakdownAttributionBuilder(multi).groupedProp()));
        assertEquals("prop", QueryPrinter.print(new BreakdownAttributionBuilder(open).groupedProp()));
    }

    @Test
    void cohortBreakdownJoinsMembership() {
        QueryContext context = breakdown(BreakdownSpec.builder(BreakdownType.COHORT)
            .cohorts(POWER_USERS_COHORT_ID).includeAllUsersCohort(true));
        Expr everyone = Exprs.TRUE;

        assertEquals("cohort_join.value", QueryPrinter.print(new BreakdownAttributionBuilder(context).propBasic()));
        assertEquals("INNER JOIN (SELECT person_id AS cohort_person_id, 42 AS value "
                + "FROM (SELECT person_id FROM cohortpeople WHERE cohort_id = 42) "
                + "UNION ALL SELECT person_id AS cohort_person_id, 0 AS value FROM events AS e WHERE true) "
                + "AS cohort_join ON e.person_id = cohort_join.cohort_person_id",
            QueryPrinter.print(new BreakdownAttributionBuilder(context).cohortJoin(everyone)));
    }

    private static QueryExpr events() {
        return SelectQuery.builder()
            .select(Exprs.star())
            .from(Exprs.field("events"))
            .build();
    }
}
