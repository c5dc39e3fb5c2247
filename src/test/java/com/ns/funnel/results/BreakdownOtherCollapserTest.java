package com.ns.funnel.results;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class BreakdownOtherCollapserTest {

    private static StepCountsRow row(Object value, long stoppedAtFirst, long converted, Double average) {
        return new StepCountsRow(List.of(stoppedAtFirst, converted), Arrays.asList(average), Arrays.asList(average), value);
    }

    @Test
    void rowsBeyondLimitMergeIntoOther() {
        List<StepCountsRow> rows = List.of(
            row("e", 10, 0, null),
            row("c", 30, 0, null),
            row("a", 50, 0, null),
            row("d", 20, 0, null),
            row("b", 40, 0, null));

        List<StepCountsRow> collapsed = new BreakdownOtherCollapser(2, 0).collapse(rows);

        assertEquals(3, collapsed.size());
        assertEquals("a", collapsed.get(0).getBreakdownValue());
        assertEquals("b", collapsed.get(1).getBreakdownValue());
        assertEquals(BreakdownOtherCollapser.OTHER, collapsed.get(2).getBreakdownValue());
        assertEquals(60, collapsed.get(2).reachedAtLeast(0));
    }

    @Test
    void tiesAreBrokenByValue() {
        List<StepCountsRow> rows = List.of(row("b", 5, 0, null), row("a", 5, 0, null), row("c", 1, 0, null));

        List<StepCountsRow> collapsed = new BreakdownOtherCollapser(1, 0).collapse(rows);

        assertEquals("a", collapsed.get(0).getBreakdownValue());
        assertEquals(6, collapsed.get(1).reachedAtLeast(0));
    }

    @Test
    void mergedAverageIsWeightedAndMedianDropped() {
        List<StepCountsRow> rows = List.of(
            row("top", 100, 100, 1.0),
            row("x", 0, 1, 10.0),
            row("y", 0, 3, 30.0));

        StepCountsRow other = new BreakdownOtherCollapser(1, 0).collapse(rows).get(1);

        assertEquals(List.of(0L, 4L), other.getStoppedAt());
        assertEquals(25.0, other.getAverageConversionTimes().get(0), 1e-9);
        assertNull(other.getMedianConversionTimes().get(0));
    }

    @Test
    void arrayValuesGetArrayOther() {
        List<StepCountsRow> rows = List.of(row(List.of("a"), 2, 0, null), row(List.of("b"), 1, 0, null));

        List<StepCountsRow> collapsed = new BreakdownOtherCollapser(1, 0).collapse(rows);

        assertEquals(List.of("Other"), collapsed.get(1).getBreakdownValue());
    }

    @Test
    void rankingUsesFromStep() {
        List<StepCountsRow> rows = List.of(row("many-starts", 50, 1, null), row("many-conversions", 0, 10, null));

        List<StepCountsRow> collapsed = new BreakdownOtherCollapser(1, 1).collapse(rows);

        assertEquals("many-conversions", collapsed.get(0).getBreakdownValue());
    }

    @Test
    void rowsWithinLimitAreOnlySorted() {
        List<StepCountsRow> rows = List.of(row("b", 1, 0, null), row("a", 2, 0, null));
        List<StepCountsRow> collapsed = new BreakdownOtherCollapser(5, 0).collapse(rows);
        assertEquals(2, collapsed.size());
        assertEquals("a", collapsed.get(0).getBreakdownValue());
    }

    @Test
    void limitMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new BreakdownOtherCollapser(0, 0));
    }
}
